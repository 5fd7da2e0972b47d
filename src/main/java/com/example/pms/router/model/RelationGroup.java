package com.example.pms.router.model;

import java.util.List;

public record RelationGroup(RelationDomain domain, List<RelationItem> items) {

    public RelationGroup {
        items = items == null ? List.of() : List.copyOf(items);
    }

    public static RelationGroup empty(RelationDomain domain) {
        return new RelationGroup(domain, List.of());
    }
}
