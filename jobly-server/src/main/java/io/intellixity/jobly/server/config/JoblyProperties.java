package io.intellixity.jobly.server.config;

import org.springframework.boot.context.properties.ConfigurationProperties;

@ConfigurationProperties(prefix = "jobly")
public class JoblyProperties {
  private final Datasource datasource = new Datasource();
  private final Security security = new Security();

  public Datasource getDatasource() { return datasource; }
  public Security getSecurity() { return security; }

  public static class Datasource {
    private String jdbcUrl;
    private String username;
    private String password;
    private String schema = "public";
    private int maximumPoolSize = 10;

    /** Run {@code db/jobly-schema.sql} at startup. */
    private boolean initSchema;

    public String getJdbcUrl() { return jdbcUrl; }
    public void setJdbcUrl(String jdbcUrl) { this.jdbcUrl = jdbcUrl; }
    public String getUsername() { return username; }
    public void setUsername(String username) { this.username = username; }
    public String getPassword() { return password; }
    public void setPassword(String password) { this.password = password; }
    public String getSchema() { return schema; }
    public void setSchema(String schema) { this.schema = schema; }
    public int getMaximumPoolSize() { return maximumPoolSize; }
    public void setMaximumPoolSize(int maximumPoolSize) { this.maximumPoolSize = maximumPoolSize; }
    public boolean isInitSchema() { return initSchema; }
    public void setInitSchema(boolean initSchema) { this.initSchema = initSchema; }
  }

  public static class Security {
    /** BCrypt log rounds; the encoder accepts 4..31. */
    private int bcryptStrength = 12;

    public int getBcryptStrength() { return bcryptStrength; }
    public void setBcryptStrength(int bcryptStrength) { this.bcryptStrength = bcryptStrength; }
  }
}
