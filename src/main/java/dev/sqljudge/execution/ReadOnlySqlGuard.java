package dev.sqljudge.execution;

import java.util.List;
import java.util.regex.Pattern;
import net.sf.jsqlparser.JSQLParserException;
import net.sf.jsqlparser.parser.CCJSqlParserUtil;
import net.sf.jsqlparser.statement.Statement;
import net.sf.jsqlparser.statement.select.Select;
import net.sf.jsqlparser.statement.select.TableStatement;
import net.sf.jsqlparser.statement.select.Values;
import org.jspecify.annotations.Nullable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Gate that lets only a single {@code SELECT} statement through to the database.
 *
 * <p>The text is parsed with JSqlParser. It passes when it holds exactly one statement and that
 * statement is a query: a plain select, a set operation or a {@code WITH ... SELECT}. Bare {@code
 * VALUES} lists and {@code TABLE} shorthands are not queries here. Text JSqlParser cannot parse is
 * rejected. The executor also runs statements in a read-only transaction, so a data-modifying CTE
 * that parses as a select still fails at the database.
 */
public final class ReadOnlySqlGuard {

  private static final Logger log = LoggerFactory.getLogger(ReadOnlySqlGuard.class);

  // PostgreSQL honours backslash escapes only inside E'...' strings.
  private static final Pattern ESCAPE_STRING = Pattern.compile("(?i)(?<![\\w$])E'");

  private ReadOnlySqlGuard() {
    // utility class
  }

  /**
   * Checks whether the SQL text is a single read-only query.
   *
   * @param sql the SQL text, possibly null
   * @return true if the statement may be executed
   */
  public static boolean isReadOnly(@Nullable String sql) {
    if (sql == null || sql.isBlank()) {
      return false;
    }
    boolean backslashEscapes = ESCAPE_STRING.matcher(sql).find();
    List<Statement> statements;
    try {
      statements =
          CCJSqlParserUtil.parseStatements(
                  sql, parser -> parser.withBackslashEscapeCharacter(backslashEscapes))
              .getStatements();
    } catch (JSQLParserException e) {
      log.debug("Unparseable statement: {}", e.getMessage());
      return false;
    }
    if (statements.size() != 1) {
      return false;
    }
    return isQuery(statements.get(0));
  }

  private static boolean isQuery(Statement statement) {
    return statement instanceof Select
        && !(statement instanceof Values)
        && !(statement instanceof TableStatement);
  }
}
