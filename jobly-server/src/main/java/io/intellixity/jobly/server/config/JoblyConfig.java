package io.intellixity.jobly.server.config;

import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.jobly.domain.PasswordHasher;
import io.intellixity.jobly.jdbc.JdbcStore;
import io.intellixity.jobly.repository.ApplicationRepository;
import io.intellixity.jobly.repository.CompanyRepository;
import io.intellixity.jobly.repository.JobRepository;
import io.intellixity.jobly.repository.UserRepository;
import io.intellixity.jobly.server.security.BcryptPasswordHasher;
import io.intellixity.jobly.store.Store;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.core.io.ClassPathResource;
import org.springframework.jdbc.datasource.init.DatabasePopulatorUtils;
import org.springframework.jdbc.datasource.init.ResourceDatabasePopulator;

import javax.sql.DataSource;

@Configuration
@EnableConfigurationProperties(JoblyProperties.class)
public class JoblyConfig {
  private static final Logger log = LoggerFactory.getLogger(JoblyConfig.class);

  static final String SCHEMA_SCRIPT = "db/jobly-schema.sql";

  @Bean(destroyMethod = "close")
  public HikariDataSource dataSource(JoblyProperties props) {
    JoblyProperties.Datasource db = props.getDatasource();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalStateException("Missing jobly.datasource.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setPoolName("jobly");
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setSchema(db.getSchema());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    HikariDataSource ds = new HikariDataSource(hc);
    log.info("jobly.datasource pool={} schema={} maxPoolSize={}", hc.getPoolName(), db.getSchema(), db.getMaximumPoolSize());

    if (db.isInitSchema()) initSchema(ds);
    return ds;
  }

  private static void initSchema(DataSource ds) {
    ResourceDatabasePopulator populator = new ResourceDatabasePopulator(new ClassPathResource(SCHEMA_SCRIPT));
    DatabasePopulatorUtils.execute(populator, ds);
    log.info("jobly.datasource schema script={} applied", SCHEMA_SCRIPT);
  }

  @Bean
  public Store store(DataSource dataSource) {
    return new JdbcStore(dataSource);
  }

  @Bean
  public PasswordHasher passwordHasher(JoblyProperties props) {
    return new BcryptPasswordHasher(props.getSecurity().getBcryptStrength());
  }

  @Bean
  public CompanyRepository companyRepository(Store store) {
    return new CompanyRepository(store);
  }

  @Bean
  public JobRepository jobRepository(Store store) {
    return new JobRepository(store);
  }

  @Bean
  public UserRepository userRepository(Store store, PasswordHasher passwordHasher) {
    return new UserRepository(store, passwordHasher);
  }

  @Bean
  public ApplicationRepository applicationRepository(Store store) {
    return new ApplicationRepository(store);
  }
}
