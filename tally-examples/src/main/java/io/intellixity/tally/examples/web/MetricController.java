package io.intellixity.tally.examples.web;

import io.intellixity.tally.examples.service.MetricService;
import io.intellixity.tally.jdbc.ResultTable;
import org.springframework.http.MediaType;
import org.springframework.web.bind.annotation.*;

import java.util.List;
import java.util.Map;

@RestController
@RequestMapping("/api/sources/{sourceId}/metrics")
public final class MetricController {
  private final MetricService metrics;

  public MetricController(MetricService metrics) {
    this.metrics = metrics;
  }

  public record SqlResponse(String sql) {}

  public record CompressedResponse(String metric) {}

  public record RowsResponse(List<String> columns, List<Map<String, Object>> rows) {
    static RowsResponse of(ResultTable t) { return new RowsResponse(t.columns(), t.asMaps()); }
  }

  @PostMapping(path = "/sql", consumes = MediaType.APPLICATION_JSON_VALUE)
  public SqlResponse sql(@PathVariable("sourceId") String sourceId, @RequestBody String metricJson) {
    return new SqlResponse(metrics.render(sourceId, metricJson));
  }

  @PostMapping(path = "/run", consumes = MediaType.APPLICATION_JSON_VALUE)
  public RowsResponse run(@PathVariable("sourceId") String sourceId, @RequestBody String metricJson) {
    return RowsResponse.of(metrics.run(sourceId, metricJson));
  }

  @PostMapping(path = "/compress", consumes = MediaType.APPLICATION_JSON_VALUE)
  public CompressedResponse compress(@PathVariable("sourceId") String sourceId, @RequestBody String metricJson) {
    return new CompressedResponse(metrics.compress(sourceId, metricJson));
  }

  @GetMapping("/{metric}")
  public RowsResponse runShared(@PathVariable("sourceId") String sourceId, @PathVariable("metric") String metric) {
    return RowsResponse.of(metrics.runCompressed(sourceId, metric));
  }
}
