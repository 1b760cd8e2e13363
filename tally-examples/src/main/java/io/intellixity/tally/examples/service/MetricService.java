package io.intellixity.tally.examples.service;

import io.intellixity.tally.examples.engine.Sources;
import io.intellixity.tally.jdbc.CompiledMetricQuery;
import io.intellixity.tally.jdbc.JdbcEventAdapter;
import io.intellixity.tally.jdbc.ResultTable;
import io.intellixity.tally.metric.Metric;
import io.intellixity.tally.model.DiscoveredEventDataSource;
import io.intellixity.tally.serde.MetricCodec;
import org.springframework.stereotype.Service;

@Service
public class MetricService {
  private final Sources sources;
  private final DiscoveryService discovery;
  private final MetricCodec codec;

  public MetricService(Sources sources, DiscoveryService discovery, MetricCodec codec) {
    this.sources = sources;
    this.discovery = discovery;
    this.codec = codec;
  }

  public String render(String sourceId, String metricJson) {
    return compile(sourceId, metricJson).render();
  }

  public ResultTable run(String sourceId, String metricJson) {
    return compile(sourceId, metricJson).execute();
  }

  public String compress(String sourceId, String metricJson) {
    DiscoveredEventDataSource schema = discovery.schema(sourceId);
    // Decode first so only metrics valid for this source get a shareable form.
    return codec.toCompressedString(codec.fromJson(metricJson, schema));
  }

  public ResultTable runCompressed(String sourceId, String compressed) {
    return run(sourceId, MetricCodec.decompress(compressed));
  }

  private CompiledMetricQuery compile(String sourceId, String metricJson) {
    JdbcEventAdapter adapter = sources.adapter(sourceId);
    DiscoveredEventDataSource schema = discovery.schema(sourceId);
    Metric metric = codec.fromJson(metricJson, schema);
    return adapter.compile(metric, schema);
  }
}
