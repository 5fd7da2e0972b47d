package com.example.pms.router.extraction;

import com.example.pms.router.model.EntitySource;
import com.example.pms.router.model.EntityType;
import com.example.pms.router.model.ExtractedEntity;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.ClassPathResource;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.tuple;

class PatternEntityExtractorTest {

  private static PatternEntityExtractor extractor;

  @BeforeAll
  static void loadGazetteer() {
    Gazetteer gazetteer = Gazetteer.load(new ClassPathResource("router/gazetteer.json"), new ObjectMapper());
    extractor = new PatternEntityExtractor(gazetteer);
  }

  @Test
  void equipmentCodeAndFaultCode_areNormalized() {
    List<ExtractedEntity> entities = extractor.extract("ME1 fault E047");

    assertThat(entities)
        .extracting(ExtractedEntity::type, ExtractedEntity::text, ExtractedEntity::surface)
        .containsExactly(
            tuple(EntityType.EQUIPMENT, "main engine 1", "ME1"),
            tuple(EntityType.FAULT_CODE, "E047", "E047"));
    assertThat(entities).allSatisfy(e -> {
      assertThat(e.source()).isEqualTo(EntitySource.PATTERN);
      assertThat(e.confidence()).isBetween(0.0, 1.0);
    });
  }

  @Test
  void spnFmiCode_andSpacedAbbreviation() {
    List<ExtractedEntity> entities = extractor.extract("SPN 110 FMI 3 on AE2");

    assertThat(entities)
        .extracting(ExtractedEntity::type, ExtractedEntity::text)
        .containsExactly(
            tuple(EntityType.FAULT_CODE, "SPN 110 FMI 3"),
            tuple(EntityType.EQUIPMENT, "auxiliary engine 2"));
  }

  @Test
  void workOrderNumber_winsOverPartNumberOnSameSpan() {
    List<ExtractedEntity> entities = extractor.extract("WO-1234 oil filter replacement");

    assertThat(entities)
        .extracting(ExtractedEntity::type, ExtractedEntity::text)
        .containsExactly(
            tuple(EntityType.WORK_ORDER_NUMBER, "WO-1234"),
            tuple(EntityType.PART, "oil filter"));
  }

  @Test
  void measurementsCarryCanonicalUnits() {
    List<ExtractedEntity> entities = extractor.extract("main engine running at 95 °C and 3.5 bar");

    assertThat(entities)
        .extracting(ExtractedEntity::type, ExtractedEntity::text)
        .contains(
            tuple(EntityType.EQUIPMENT, "main engine"),
            tuple(EntityType.MEASUREMENT, "95 °C"),
            tuple(EntityType.MEASUREMENT, "3.5 bar"));
  }

  @Test
  void aliasesResolveToCanonicalNames() {
    List<ExtractedEntity> entities = extractor.extract("genset 2 running hot, check the racor filter");

    assertThat(entities)
        .extracting(ExtractedEntity::type, ExtractedEntity::text)
        .containsExactly(
            tuple(EntityType.EQUIPMENT, "generator 2"),
            tuple(EntityType.SYMPTOM, "overheating"),
            tuple(EntityType.PART, "fuel filter"));
  }

  @Test
  void lowercaseBareAbbreviation_isNotTreatedAsEquipment() {
    assertThat(extractor.extract("show me the fuel filter"))
        .extracting(ExtractedEntity::type)
        .containsExactly(EntityType.PART);
  }

  @Test
  void entitiesAreOrderedByOffsetAndDeduplicated() {
    List<ExtractedEntity> entities = extractor.extract("E047 again on E047");

    assertThat(entities).hasSize(1);
    assertThat(entities.get(0).start()).isZero();
  }

  @Test
  void blankInput_yieldsNothing() {
    assertThat(extractor.extract("  ")).isEmpty();
    assertThat(extractor.extract(null)).isEmpty();
  }
}
