package com.example.pms.router.model;

public enum ActionVariant {
    READ,
    MUTATE,
    /** Mutation that needs a signature from an authorized role. */
    SIGNED
}
