package com.example.pms.router.model;

import java.util.List;

public record RelationResponse(RecordType focusType,
                               String focusId,
                               double alpha,
                               List<RelationGroup> groups) {

    public RelationResponse {
        groups = groups == null ? List.of() : List.copyOf(groups);
    }

    public int totalItems() {
        return groups.stream().mapToInt(g -> g.items().size()).sum();
    }
}
