package io.intellixity.tally.examples.config;

import io.intellixity.tally.model.ConnectionType;
import io.intellixity.tally.model.EventDataSource;
import io.intellixity.tally.model.EventDataTable;
import io.intellixity.tally.model.SecretResolver;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

final class TallyPropertiesTest {
  private static TallyProperties.Table table(String name) {
    TallyProperties.Table t = new TallyProperties.Table();
    t.setName(name);
    t.setUserIdField("user_id");
    t.setEventTimeField("event_time");
    t.setEventNameField("event_name");
    return t;
  }

  @Test
  void buildsSourceFromProperties() {
    TallyProperties.Source s = new TallyProperties.Source();
    s.setType("postgresql");
    s.setHost("db");
    s.setCatalog("analytics");
    s.setUsername("tally");
    s.setPassword("secret");
    s.setExtraConfigs(Map.of("pool_size", "8"));
    s.setMaxEnumCardinality(50);
    TallyProperties.Table t = table("events");
    t.setSchema("public");
    t.setEventSpecificPrefixes(List.of("ev_"));
    t.setMaxMapKeyCardinality(20);
    s.setTables(List.of(t));

    EventDataSource src = s.toEventDataSource("warehouse");

    assertEquals("warehouse", src.id());
    assertEquals(ConnectionType.POSTGRESQL, src.connection().type());
    assertEquals("secret", src.connection().password());
    assertEquals("8", src.connection().extraConfig("pool_size"));
    assertEquals(50, src.maxEnumCardinality());
    assertNull(src.defaultDiscoveryRange());
    EventDataTable et = src.tables().get(0);
    assertEquals("public.events", et.id());
    assertTrue(et.isEventSpecific("ev_amount"));
    assertEquals(20, src.mapKeyLimitFor(et));
  }

  @Test
  void passwordEnvWinsAndLookbackSetsADiscoveryRange() {
    TallyProperties.Source s = new TallyProperties.Source();
    s.setType("sqlite");
    s.setUrl("events.db");
    s.setPassword("ignored");
    s.setPasswordEnv("TALLY_TEST_PASSWORD");
    s.setDiscoveryLookback("7 days");
    s.setTables(List.of(table("events")));

    EventDataSource src = s.toEventDataSource("local");

    assertEquals(SecretResolver.env("TALLY_TEST_PASSWORD"), src.connection().secretResolver());
    assertEquals(src.defaultDiscoveryRange().end().minusDays(7), src.defaultDiscoveryRange().start());
  }

  @Test
  void missingTypeOrTablesAreRejected() {
    TallyProperties.Source s = new TallyProperties.Source();
    s.setTables(List.of(table("events")));
    assertThrows(IllegalArgumentException.class, () -> s.toEventDataSource("x"));

    s.setType("oracle");
    assertThrows(IllegalArgumentException.class, () -> s.toEventDataSource("x"));
  }
}
