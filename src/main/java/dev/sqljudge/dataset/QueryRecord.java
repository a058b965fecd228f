package dev.sqljudge.dataset;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import org.jspecify.annotations.Nullable;

/**
 * One query descriptor of a benchmark dataset (reference or predicted side).
 *
 * <p>Only {@code SQL} is required. The optional fields follow the BIRD mini-dev layout and are
 * used for reporting; unknown fields are ignored.
 *
 * @param sql the SQL text to execute
 * @param questionId dataset-wide question identifier
 * @param dbId name of the database the question targets
 * @param question natural-language question the SQL answers
 * @param difficulty difficulty label (e.g. simple, moderate, challenging)
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public record QueryRecord(
    @JsonProperty("SQL") String sql,
    @JsonProperty("question_id") @Nullable Integer questionId,
    @JsonProperty("db_id") @Nullable String dbId,
    @JsonProperty("question") @Nullable String question,
    @JsonProperty("difficulty") @Nullable String difficulty) {

  public QueryRecord {
    if (sql == null) {
      throw new IllegalArgumentException("SQL must not be null");
    }
  }

  /** Record carrying only SQL text. */
  public static QueryRecord ofSql(String sql) {
    return new QueryRecord(sql, null, null, null, null);
  }
}
