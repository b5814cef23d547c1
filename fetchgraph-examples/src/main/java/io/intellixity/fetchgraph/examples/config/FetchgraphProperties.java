package io.intellixity.fetchgraph.examples.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "fetchgraph")
public class FetchgraphProperties {
  /** {@code tabular} or {@code jdbc}. */
  private String engine = "tabular";
  private String providerName = "retail";
  /** Classpath directory holding {@code schema.json} and {@code data.json}. */
  private String dataLocation = "retail";
  private final Jdbc jdbc = new Jdbc();

  public String getEngine() { return engine; }
  public void setEngine(String engine) { this.engine = engine; }
  public String getProviderName() { return providerName; }
  public void setProviderName(String providerName) { this.providerName = providerName; }
  public String getDataLocation() { return dataLocation; }
  public void setDataLocation(String dataLocation) { this.dataLocation = dataLocation; }
  public Jdbc getJdbc() { return jdbc; }

  public static class Jdbc {
    private String jdbcUrl = "jdbc:h2:mem:retail;DB_CLOSE_DELAY=-1";
    private String username = "sa";
    private String password = "";
    /** Table qualifier; null for the connection's default schema. */
    private String schema;
    private String dialect = "ansi";
    private int maximumPoolSize = 5;

    /** Whether to create and fill the tables from the classpath data on startup. */
    private boolean loadData = true;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public String getDialect() { return dialect; }
    public void setDialect(String dialect) { this.dialect = dialect; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public boolean isLoadData() { return loadData; }
    public void setLoadData(boolean loadData) { this.loadData = loadData; }
  }
}
