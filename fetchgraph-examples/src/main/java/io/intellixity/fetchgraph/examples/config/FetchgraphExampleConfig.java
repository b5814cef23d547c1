package io.intellixity.fetchgraph.examples.config;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.zaxxer.hikari.HikariConfig;
import com.zaxxer.hikari.HikariDataSource;
import io.intellixity.fetchgraph.examples.data.RetailDatabase;
import io.intellixity.fetchgraph.examples.data.RetailDataset;
import io.intellixity.fetchgraph.examples.semantic.KeywordSemanticBackend;
import io.intellixity.fetchgraph.jdbc.JdbcHandle;
import io.intellixity.fetchgraph.jdbc.JdbcRelationalProvider;
import io.intellixity.fetchgraph.jdbc.dialect.SqlDialects;
import io.intellixity.fetchgraph.spi.provider.RelationalProvider;
import io.intellixity.fetchgraph.spi.semantic.SemanticBackend;
import io.intellixity.fetchgraph.tabular.TabularRelationalProvider;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.properties.EnableConfigurationProperties;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.context.annotation.Lazy;

import java.util.Locale;

@Configuration
@EnableConfigurationProperties(FetchgraphProperties.class)
public class FetchgraphExampleConfig {
  private static final Logger log = LoggerFactory.getLogger(FetchgraphExampleConfig.class);

  @Bean
  public RetailDataset retailDataset(FetchgraphProperties props, ObjectMapper mapper) {
    return RetailDataset.load(mapper, props.getDataLocation());
  }

  @Bean
  public SemanticBackend semanticBackend(RetailDataset dataset) {
    return new KeywordSemanticBackend(dataset.schema(), dataset.tables());
  }

  @Bean
  public RelationalProvider relationalProvider(FetchgraphProperties props,
                                               RetailDataset dataset,
                                               SemanticBackend semanticBackend,
                                               ObjectProvider<HikariDataSource> dataSource) {
    String engine = props.getEngine() == null ? "" : props.getEngine().trim().toLowerCase(Locale.ROOT);
    log.info("fetchgraph.examples op=provider name={} engine={}", props.getProviderName(), engine);
    return switch (engine) {
      case "tabular" -> new TabularRelationalProvider(props.getProviderName(), dataset.schema(), dataset.tables(),
          semanticBackend);
      case "jdbc" -> {
        HikariDataSource ds = dataSource.getObject();
        if (props.getJdbc().isLoadData()) RetailDatabase.load(ds, props.getJdbc().getSchema(), dataset);
        JdbcHandle handle = new JdbcHandle("jdbc:" + props.getProviderName(), ds, props.getJdbc().getSchema());
        yield new JdbcRelationalProvider(props.getProviderName(), dataset.schema(), handle,
            SqlDialects.byId(props.getJdbc().getDialect()), semanticBackend);
      }
      default -> throw new IllegalArgumentException("Unsupported fetchgraph.engine: " + props.getEngine());
    };
  }

  /** Created lazily, only when the jdbc engine asks for it. */
  @Bean(destroyMethod = "close")
  @Lazy
  public HikariDataSource fetchgraphDataSource(FetchgraphProperties props) {
    FetchgraphProperties.Jdbc db = props.getJdbc();
    if (db.getJdbcUrl() == null || db.getJdbcUrl().isBlank()) {
      throw new IllegalArgumentException("Missing fetchgraph.jdbc.jdbc-url");
    }
    HikariConfig hc = new HikariConfig();
    hc.setJdbcUrl(db.getJdbcUrl());
    hc.setUsername(db.getUsername());
    hc.setPassword(db.getPassword());
    hc.setMaximumPoolSize(db.getMaximumPoolSize());
    hc.setPoolName("fetchgraph-" + props.getProviderName());
    return new HikariDataSource(hc);
  }
}
