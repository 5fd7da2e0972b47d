package com.example.pms.router.extraction;

import com.example.pms.router.model.EntitySource;
import com.example.pms.router.model.EntityType;
import com.example.pms.router.model.ExtractedEntity;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class EntityMergerTest {

  @Test
  void patternEntityWinsOnCollision_andOrderFollowsQuery() {
    String query = "bow thruster tripped after E101";
    ExtractedEntity fault = new ExtractedEntity(EntityType.FAULT_CODE, "E101", "E101", 0.95, EntitySource.PATTERN, 27);
    ExtractedEntity modelFault = new ExtractedEntity(EntityType.FAULT_CODE, "e101", "E101", 0.6, EntitySource.MODEL, -1);
    ExtractedEntity modelEquipment = new ExtractedEntity(EntityType.EQUIPMENT, "bow thruster", "bow thruster", 0.7, EntitySource.MODEL, -1);

    List<ExtractedEntity> merged = EntityMerger.merge(query, List.of(fault), List.of(modelFault, modelEquipment));

    assertThat(merged).hasSize(2);
    assertThat(merged.get(0).text()).isEqualTo("bow thruster");
    assertThat(merged.get(0).start()).isZero();
    assertThat(merged.get(1)).isSameAs(fault);
  }

  @Test
  void unlocatedModelEntities_goLast() {
    ExtractedEntity located = new ExtractedEntity(EntityType.PART, "impeller", "impeller", 0.8, EntitySource.PATTERN, 4);
    ExtractedEntity unlocated = new ExtractedEntity(EntityType.EQUIPMENT, "sea water pump", "raw pump", 0.6, EntitySource.MODEL, -1);

    List<ExtractedEntity> merged = EntityMerger.merge("the impeller", List.of(located), List.of(unlocated));

    assertThat(merged).containsExactly(located, unlocated);
  }
}
