package com.example.pms.router.capability;

import com.example.pms.router.config.RouterProperties;
import com.example.pms.router.model.ActionVariant;
import com.example.pms.router.model.AuthContext;
import com.example.pms.router.model.CandidateAction;
import com.example.pms.router.model.EntitySource;
import com.example.pms.router.model.EntityType;
import com.example.pms.router.model.ExtractedEntity;
import com.example.pms.router.model.Lane;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeAll;
import org.junit.jupiter.api.Test;
import org.springframework.core.io.DefaultResourceLoader;

import java.util.List;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;

class CapabilityMapperTest {

  private static CapabilityRegistry registry;
  private static CapabilityMapper mapper;

  private static final List<ExtractedEntity> ENTITIES = List.of(
      new ExtractedEntity(EntityType.EQUIPMENT, "main engine 1", "ME1", 0.9, EntitySource.PATTERN, 0),
      new ExtractedEntity(EntityType.FAULT_CODE, "E047", "E047", 0.95, EntitySource.PATTERN, 10));

  @BeforeAll
  static void loadRegistry() {
    ClasspathCapabilityDao dao = new ClasspathCapabilityDao(new DefaultResourceLoader(), new ObjectMapper(), new RouterProperties());
    registry = CapabilityRegistry.from(dao.loadCatalog());
    mapper = new CapabilityMapper(registry);
  }

  @Test
  void crewNeverSeesSignedActions() {
    List<CandidateAction> actions = mapper.map(ENTITIES, Lane.NO_LLM, new AuthContext("u1", "yacht-1", "crew"));

    assertThat(actions).isNotEmpty();
    assertThat(actions).extracting(CandidateAction::variant).doesNotContain(ActionVariant.SIGNED);
    assertThat(actions).allSatisfy(a -> assertThat(a.allowedRoles()).contains("crew"));
  }

  @Test
  void signedActionsNeverReachRolesOutsideTheirAllowedRoles() {
    Set<String> roles = new TreeSet<>();
    registry.all().forEach(c -> roles.addAll(c.allowedRoles()));
    roles.add("guest");
    List<Capability> signed = registry.all().stream().filter(c -> c.variant() == ActionVariant.SIGNED).toList();
    assertThat(signed).isNotEmpty();

    for (String role : roles) {
      AuthContext auth = new AuthContext("u1", "yacht-1", role);
      for (EntityType type : EntityType.values()) {
        List<ExtractedEntity> entity = List.of(new ExtractedEntity(type, "x", "x", 0.9, EntitySource.PATTERN, 0));
        for (Lane lane : List.of(Lane.NO_LLM, Lane.RULES_ONLY, Lane.GPT)) {
          Set<String> mapped = mapper.map(entity, lane, auth).stream()
              .map(CandidateAction::actionId)
              .collect(Collectors.toSet());
          for (Capability capability : signed) {
            if (!capability.allowsRole(role)) {
              assertThat(mapped).as("%s / %s / %s", role, type, lane).doesNotContain(capability.actionId());
            }
          }
        }
      }
    }
  }

  @Test
  void captainSeesSignedActionsFlaggedForSignature() {
    List<CandidateAction> actions = mapper.map(ENTITIES, Lane.NO_LLM, new AuthContext("u2", "yacht-1", "Captain"));

    assertThat(actions).extracting(CandidateAction::actionId).contains("decommission_equipment", "close_fault");
    assertThat(actions).filteredOn(a -> a.variant() == ActionVariant.SIGNED)
        .allSatisfy(a -> assertThat(a.requiresSignature()).isTrue());
  }

  @Test
  void actionsFollowEntityOrderAndAreNotRepeated() {
    List<CandidateAction> actions = mapper.map(ENTITIES, Lane.NO_LLM, new AuthContext("u3", "yacht-1", "engineer"));

    assertThat(actions.get(0).actionId()).isEqualTo("view_equipment");
    assertThat(actions.get(0).entityText()).isEqualTo("main engine 1");
    assertThat(actions).extracting(CandidateAction::actionId).doesNotHaveDuplicates();
  }

  @Test
  void blockedLaneOrUnknownRole_mapsNothing() {
    assertThat(mapper.map(ENTITIES, Lane.BLOCKED, new AuthContext("u1", "yacht-1", "captain"))).isEmpty();
    assertThat(mapper.map(ENTITIES, Lane.NO_LLM, new AuthContext("u1", "yacht-1", "guest"))).isEmpty();
    assertThat(mapper.map(List.of(), Lane.NO_LLM, new AuthContext("u1", "yacht-1", "captain"))).isEmpty();
  }

  @Test
  void registryResolvesEveryMappedType() {
    assertThat(registry.version()).isEqualTo("2025.03.1");
    for (EntityType type : EntityType.values()) {
      assertThat(registry.forEntityType(type)).as(type.name()).isNotEmpty();
    }
    assertThat(registry.find("sign_off_work_order")).get()
        .extracting(Capability::requiresSignature).isEqualTo(true);
  }
}
