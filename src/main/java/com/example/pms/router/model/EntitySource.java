package com.example.pms.router.model;

public enum EntitySource {
    PATTERN,
    MODEL
}
