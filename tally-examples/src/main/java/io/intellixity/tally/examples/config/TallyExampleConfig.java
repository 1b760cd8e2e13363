package io.intellixity.tally.examples.config;

import io.intellixity.tally.examples.engine.Sources;
import io.intellixity.tally.jdbc.ConnectionCache;
import io.intellixity.tally.jdbc.JdbcEventAdapter;
import io.intellixity.tally.model.EventDataSource;
import io.intellixity.tally.schema.SchemaRegistry;
import io.intellixity.tally.serde.MetricCodec;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import java.util.LinkedHashMap;
import java.util.Map;

@Configuration
@EnableConfigurationProperties(TallyProperties.class)
public class TallyExampleConfig {

  @Bean(destroyMethod = "close")
  public ConnectionCache connectionCache() {
    return new ConnectionCache();
  }

  @Bean
  public SchemaRegistry schemaRegistry() {
    return new SchemaRegistry();
  }

  @Bean
  public MetricCodec metricCodec() {
    return new MetricCodec();
  }

  @Bean
  public Sources sources(TallyProperties props, ConnectionCache connections) {
    Map<String, JdbcEventAdapter> adapters = new LinkedHashMap<>();
    for (Map.Entry<String, TallyProperties.Source> e : props.getSources().entrySet()) {
      EventDataSource source = e.getValue().toEventDataSource(e.getKey());
      // Dialect is picked from the connection type; an unknown type fails startup.
      adapters.put(e.getKey(), new JdbcEventAdapter(source, connections));
    }
    return new Sources(adapters);
  }
}
