package io.intellixity.tally.examples.config;

import io.intellixity.tally.model.Connection;
import io.intellixity.tally.model.ConnectionType;
import io.intellixity.tally.model.DateRange;
import io.intellixity.tally.model.EventDataSource;
import io.intellixity.tally.model.EventDataTable;
import io.intellixity.tally.model.SecretResolver;
import io.intellixity.tally.model.TimeWindow;
import org.springframework.boot.context.properties.ConfigurationProperties;

import java.time.LocalDateTime;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@ConfigurationProperties(prefix = "tally")
public class TallyProperties {
  private final Map<String, Source> sources = new LinkedHashMap<>();

  public Map<String, Source> getSources() { return sources; }

  public static class Source {
    private String type;
    private String url;
    private String host;
    private Integer port;
    private String catalog;
    private String schema;
    private String username;
    private String password;
    /** Environment variable holding the password; wins over {@code password}. */
    private String passwordEnv;
    private Map<String, String> urlParams = new HashMap<>();
    private Map<String, String> extraConfigs = new HashMap<>();
    private List<Table> tables = new ArrayList<>();
    private int maxEnumCardinality = EventDataSource.DEFAULT_MAX_ENUM_CARDINALITY;
    private int maxMapKeyCardinality = EventDataSource.DEFAULT_MAX_MAP_KEY_CARDINALITY;
    private int propertySampleSize = EventDataSource.DEFAULT_PROPERTY_SAMPLE_SIZE;

    /** Optional discovery lookback like {@code "30 days"}, ending now. */
    private String discoveryLookback;

    public String getType() { return type; }
    public void setType(String type) { this.type = type; }
    public String getUrl() { return url; }
    public void setUrl(String url) { this.url = url; }
    public String getHost() { return host; }
    public void setHost(String host) { this.host = host; }
    public Integer getPort() { return port; }
    public void setPort(Integer port) { this.port = port; }
    public String getCatalog() { return catalog; }
    public void setCatalog(String catalog) { this.catalog = catalog; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getPasswordEnv() { return passwordEnv; }
    public void setPasswordEnv(String passwordEnv) { this.passwordEnv = passwordEnv; }
    public Map<String, String> getUrlParams() { return urlParams; }
    public void setUrlParams(Map<String, String> urlParams) { this.urlParams = urlParams; }
    public Map<String, String> getExtraConfigs() { return extraConfigs; }
    public void setExtraConfigs(Map<String, String> extraConfigs) { this.extraConfigs = extraConfigs; }
    public List<Table> getTables() { return tables; }
    public void setTables(List<Table> tables) { this.tables = tables; }
    public int getMaxEnumCardinality() { return maxEnumCardinality; }
    public void setMaxEnumCardinality(int maxEnumCardinality) { this.maxEnumCardinality = maxEnumCardinality; }
    public int getMaxMapKeyCardinality() { return maxMapKeyCardinality; }
    public void setMaxMapKeyCardinality(int maxMapKeyCardinality) { this.maxMapKeyCardinality = maxMapKeyCardinality; }
    public int getPropertySampleSize() { return propertySampleSize; }
    public void setPropertySampleSize(int propertySampleSize) { this.propertySampleSize = propertySampleSize; }
    public String getDiscoveryLookback() { return discoveryLookback; }
    public void setDiscoveryLookback(String discoveryLookback) { this.discoveryLookback = discoveryLookback; }

    public EventDataSource toEventDataSource(String id) {
      if (type == null) throw new IllegalArgumentException("Missing type for source " + id);
      SecretResolver secret = null;
      if (passwordEnv != null && !passwordEnv.isBlank()) secret = SecretResolver.env(passwordEnv);
      else if (password != null) secret = SecretResolver.constant(password);
      Connection c = new Connection(ConnectionType.parse(type), url, host, port, catalog, schema, username,
          secret, urlParams, extraConfigs);
      List<EventDataTable> ts = new ArrayList<>();
      for (Table t : tables) ts.add(t.toEventDataTable());
      DateRange range = null;
      if (discoveryLookback != null && !discoveryLookback.isBlank()) {
        range = DateRange.lookback(LocalDateTime.now().truncatedTo(ChronoUnit.SECONDS), TimeWindow.parse(discoveryLookback));
      }
      return new EventDataSource(id, c, ts, range, maxEnumCardinality, maxMapKeyCardinality, propertySampleSize);
    }
  }

  public static class Table {
    private String name;
    private String schema;
    private String catalog;
    private String userIdField;
    private String eventTimeField;
    private String eventNameField;
    private String eventNameAlias;
    private List<String> ignoredFields = new ArrayList<>();
    private List<String> eventSpecificPrefixes = new ArrayList<>();
    private Integer maxEnumCardinality;
    private Integer maxMapKeyCardinality;

    public String getName() { return name; }
    public void setName(String name) { this.name = name; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public String getCatalog() { return catalog; }
    public void setCatalog(String catalog) { this.catalog = catalog; }
    public String getUserIdField() { return userIdField; }
    public void setUserIdField(String userIdField) { this.userIdField = userIdField; }
    public String getEventTimeField() { return eventTimeField; }
    public void setEventTimeField(String eventTimeField) { this.eventTimeField = eventTimeField; }
    public String getEventNameField() { return eventNameField; }
    public void setEventNameField(String eventNameField) { this.eventNameField = eventNameField; }
    public String getEventNameAlias() { return eventNameAlias; }
    public void setEventNameAlias(String eventNameAlias) { this.eventNameAlias = eventNameAlias; }
    public List<String> getIgnoredFields() { return ignoredFields; }
    public void setIgnoredFields(List<String> ignoredFields) { this.ignoredFields = ignoredFields; }
    public List<String> getEventSpecificPrefixes() { return eventSpecificPrefixes; }
    public void setEventSpecificPrefixes(List<String> eventSpecificPrefixes) { this.eventSpecificPrefixes = eventSpecificPrefixes; }
    public Integer getMaxEnumCardinality() { return maxEnumCardinality; }
    public void setMaxEnumCardinality(Integer maxEnumCardinality) { this.maxEnumCardinality = maxEnumCardinality; }
    public Integer getMaxMapKeyCardinality() { return maxMapKeyCardinality; }
    public void setMaxMapKeyCardinality(Integer maxMapKeyCardinality) { this.maxMapKeyCardinality = maxMapKeyCardinality; }

    EventDataTable toEventDataTable() {
      return new EventDataTable(name, schema, catalog, userIdField, eventTimeField, eventNameField, eventNameAlias,
          ignoredFields, eventSpecificPrefixes, maxEnumCardinality, maxMapKeyCardinality);
    }
  }
}
