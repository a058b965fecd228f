package dev.sqljudge.execution;

import javax.sql.DataSource;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.transaction.PlatformTransactionManager;
import org.springframework.transaction.support.TransactionTemplate;

/**
 * Configures the JDBC plumbing used by {@link JdbcQueryExecutor}.
 *
 * <p>Both beans share the Boot-managed HikariCP {@link DataSource}. Limits come from {@link
 * ExecutorProperties}; the transaction template is read-only so the database itself refuses writes.
 */
@Configuration
public class ExecutorConfig {

  /**
   * Creates the {@link JdbcTemplate} that runs evaluated statements.
   *
   * @param dataSource the shared data source
   * @param properties timeout and row limits
   * @return a template qualified as {@code "evaluationJdbcTemplate"}
   */
  @Bean
  public JdbcTemplate evaluationJdbcTemplate(DataSource dataSource, ExecutorProperties properties) {
    JdbcTemplate template = new JdbcTemplate(dataSource);
    template.setQueryTimeout(properties.getQueryTimeoutSeconds());
    template.setMaxRows(properties.getMaxRows());
    return template;
  }

  @Bean
  public TransactionTemplate readOnlyTransactionTemplate(
      PlatformTransactionManager transactionManager, ExecutorProperties properties) {
    TransactionTemplate template = new TransactionTemplate(transactionManager);
    template.setReadOnly(true);
    template.setTimeout(properties.getQueryTimeoutSeconds());
    return template;
  }
}
