package io.intellixity.tally.serde;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import io.intellixity.tally.error.SerializationException;
import io.intellixity.tally.metric.Metric;
import io.intellixity.tally.model.DiscoveredEventDataSource;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.Base64;
import java.util.Objects;
import java.util.zip.DataFormatException;
import java.util.zip.Deflater;
import java.util.zip.Inflater;

/**
 * JSON and compressed-string transport of {@link Metric} trees.\n
 *
 * The compressed form is URL-safe base64 (no padding) of the deflated UTF-8 JSON and
 * restores the exact JSON text.\n
 */
public final class MetricCodec {
  public static final String SCHEMA_ATTRIBUTE = "tally.schema";

  private final ObjectMapper mapper;

  public MetricCodec() { this(new ObjectMapper()); }

  public MetricCodec(ObjectMapper mapper) { this.mapper = Objects.requireNonNull(mapper, "mapper"); }

  public String toJson(Metric metric) {
    Objects.requireNonNull(metric, "metric");
    try {
      return mapper.writerFor(Metric.class).writeValueAsString(metric);
    } catch (JsonProcessingException e) {
      throw new SerializationException("Failed to encode metric", e);
    }
  }

  public Metric fromJson(String json, DiscoveredEventDataSource schema) {
    Objects.requireNonNull(json, "json");
    Objects.requireNonNull(schema, "schema");
    try {
      return mapper.readerFor(Metric.class).withAttribute(SCHEMA_ATTRIBUTE, schema).readValue(json);
    } catch (JsonProcessingException e) {
      if (e.getCause() instanceof SerializationException se) throw se;
      throw new SerializationException("Malformed metric payload: " + e.getOriginalMessage(), e);
    }
  }

  public String toCompressedString(Metric metric) { return compress(toJson(metric)); }

  public Metric fromCompressedString(String compressed, DiscoveredEventDataSource schema) {
    return fromJson(decompress(compressed), schema);
  }

  public static String compress(String text) {
    byte[] input = text.getBytes(StandardCharsets.UTF_8);
    Deflater deflater = new Deflater(Deflater.BEST_COMPRESSION);
    try {
      deflater.setInput(input);
      deflater.finish();
      ByteArrayOutputStream out = new ByteArrayOutputStream(Math.max(64, input.length / 2));
      byte[] buf = new byte[1024];
      while (!deflater.finished()) {
        int n = deflater.deflate(buf);
        out.write(buf, 0, n);
      }
      return Base64.getUrlEncoder().withoutPadding().encodeToString(out.toByteArray());
    } finally {
      deflater.end();
    }
  }

  public static String decompress(String compressed) {
    Objects.requireNonNull(compressed, "compressed");
    byte[] input;
    try {
      input = Base64.getUrlDecoder().decode(compressed);
    } catch (IllegalArgumentException e) {
      throw new SerializationException("Compressed metric is not valid base64url", e);
    }
    Inflater inflater = new Inflater();
    try {
      inflater.setInput(input);
      ByteArrayOutputStream out = new ByteArrayOutputStream(input.length * 4);
      byte[] buf = new byte[1024];
      while (!inflater.finished()) {
        int n = inflater.inflate(buf);
        if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
          throw new SerializationException("Compressed metric is truncated");
        }
        out.write(buf, 0, n);
      }
      return out.toString(StandardCharsets.UTF_8);
    } catch (DataFormatException e) {
      throw new SerializationException("Compressed metric is corrupt", e);
    } finally {
      inflater.end();
    }
  }
}
