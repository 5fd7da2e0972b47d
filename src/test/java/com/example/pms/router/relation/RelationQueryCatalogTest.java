package com.example.pms.router.relation;

import com.example.pms.router.model.FkTier;
import com.example.pms.router.model.RecordType;
import com.example.pms.router.model.RelationDomain;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class RelationQueryCatalogTest {

  private final RelationQueryCatalog catalog = RelationQueryCatalog.defaults();

  @Test
  void defaultQueriesAreGroupedByFocus() {
    assertThat(catalog.forFocus(RecordType.EQUIPMENT)).hasSize(11);
    assertThat(catalog.forFocus(RecordType.FAULT)).hasSize(6);
    assertThat(catalog.forFocus(RecordType.WORK_ORDER)).hasSize(6);
    assertThat(catalog.forFocus(RecordType.PART)).hasSize(4);
    assertThat(catalog.forFocus(RecordType.PART)).allSatisfy(q -> assertThat(q.focusType()).isEqualTo(RecordType.PART));
  }

  @Test
  void everyDefaultQueryIsTenantScopedAndLimited() {
    for (RecordType type : RecordType.values()) {
      for (RelationQuery q : catalog.forFocus(type)) {
        assertThat(q.sql()).as(q.name()).contains("yacht_id = :tenantId", ":focusId", ":limit");
      }
    }
  }

  @Test
  void unsupportedFocusHasNoQueries() {
    assertThat(catalog.supports(RecordType.NOTE)).isFalse();
    assertThat(catalog.forFocus(RecordType.NOTE)).isEmpty();
    assertThat(catalog.supports(RecordType.EQUIPMENT)).isTrue();
  }

  @Test
  void unscopedQueryIsRejected() {
    RelationQuery leaky = new RelationQuery("leaky", RecordType.PART, RelationDomain.INVENTORY, FkTier.DIRECT,
        RecordType.PART, "select id as entity_id from parts where id = :focusId");

    assertThatThrownBy(() -> RelationQueryCatalog.of(List.of(leaky)))
        .isInstanceOf(IllegalStateException.class)
        .hasMessageContaining("leaky");
  }
}
