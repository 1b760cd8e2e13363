package io.intellixity.tally.jdbc.trino;

import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;

import java.util.ArrayList;
import java.util.List;

/**
 * Amazon Athena: Trino SQL behind the Athena JDBC driver.\n
 *
 * The URL is assembled from {@code extra_configs}: {@code region} (required),
 * {@code s3_staging_dir} and {@code work_group}. {@code catalog}/{@code schema} map to the
 * driver's Catalog and Schema properties.\n
 */
public final class AthenaDialect extends TrinoDialect {
  public static final String REGION = "region";
  public static final String S3_STAGING_DIR = "s3_staging_dir";
  public static final String WORK_GROUP = "work_group";

  @Override public ConnectionType connectionType() { return ConnectionType.ATHENA; }
  @Override public String id() { return "athena"; }

  @Override
  public String jdbcUrl(Connection c) {
    String explicit = explicitUrl(c, "awsathena");
    if (explicit != null) return explicit;
    String region = c.extraConfig(REGION);
    if (region == null || region.isBlank()) {
      throw new IllegalArgumentException("Athena connections require extra_configs." + REGION);
    }
    List<String> props = new ArrayList<>();
    props.add("AwsRegion=" + region);
    if (c.extraConfig(S3_STAGING_DIR) != null) props.add("S3OutputLocation=" + c.extraConfig(S3_STAGING_DIR));
    if (c.extraConfig(WORK_GROUP) != null) props.add("Workgroup=" + c.extraConfig(WORK_GROUP));
    if (c.catalog() != null) props.add("Catalog=" + c.catalog());
    if (c.schema() != null) props.add("Schema=" + c.schema());
    c.urlParams().forEach((k, v) -> props.add(k + "=" + v));
    return "jdbc:awsathena://" + String.join(";", props);
  }
}
