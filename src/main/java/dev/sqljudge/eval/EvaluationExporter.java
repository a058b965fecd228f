package dev.sqljudge.eval;

import dev.sqljudge.dataset.QueryRecord;
import java.io.BufferedWriter;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.LocalDateTime;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;
import org.jspecify.annotations.Nullable;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;

/**
 * Exports evaluation runs to CSV files for tracking accuracy across model or prompt changes.
 *
 * <p>Produces two CSV files per export: a summary CSV with per-difficulty and global accuracy, and
 * a detailed CSV with one line per evaluated pair.
 */
@Service
public class EvaluationExporter {

  private static final DateTimeFormatter TIMESTAMP_FORMAT =
      DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH-mm-ss");

  private static final String SUMMARY_HEADER = "scope,count,correct,accuracy";

  private static final String DETAILED_HEADER =
      "index,question_id,db_id,difficulty,correct,reference_error,predicted_error";

  static final String UNKNOWN_DIFFICULTY = "unknown";

  private final Path outputDir;
  private final Clock clock;

  public EvaluationExporter(
      @Value("${sqljudge.eval.output-dir:${user.home}/.sqljudge/eval}") String outputDir,
      Clock clock) {
    this.outputDir = Path.of(outputDir);
    this.clock = clock;
  }

  /**
   * Exports an evaluation run to summary and detailed CSV files.
   *
   * @param run the finished evaluation run
   * @return the paths to the two generated CSV files (summary first, detailed second)
   * @throws IOException if file writing fails
   */
  public List<Path> export(EvaluationRun run) throws IOException {
    Files.createDirectories(outputDir);

    String timestamp = LocalDateTime.now(clock).format(TIMESTAMP_FORMAT);
    Path summaryPath =
        outputDir.resolve("eval-summary-%s-%s.csv".formatted(timestamp, run.label()));
    Path detailedPath =
        outputDir.resolve("eval-detailed-%s-%s.csv".formatted(timestamp, run.label()));

    writeSummaryCsv(run, summaryPath);
    writeDetailedCsv(run, detailedPath);

    return List.of(summaryPath, detailedPath);
  }

  private void writeSummaryCsv(EvaluationRun run, Path path) throws IOException {
    Map<String, List<PairOutcome>> byDifficulty = groupByDifficulty(run.outcomes());

    try (BufferedWriter writer = Files.newBufferedWriter(path)) {
      writer.write(SUMMARY_HEADER);
      writer.newLine();

      for (Map.Entry<String, List<PairOutcome>> entry : byDifficulty.entrySet()) {
        writeSummaryRow(writer, entry.getKey(), toReport(entry.getValue()));
      }

      writeSummaryRow(writer, "GLOBAL", run.report());
    }
  }

  private void writeSummaryRow(BufferedWriter writer, String scope, AccuracyReport report)
      throws IOException {
    writer.write(
        String.format(
            Locale.US,
            "%s,%d,%d,%.4f",
            escapeCsv(scope),
            report.total(),
            report.correct(),
            report.accuracy()));
    writer.newLine();
  }

  private void writeDetailedCsv(EvaluationRun run, Path path) throws IOException {
    try (BufferedWriter writer = Files.newBufferedWriter(path)) {
      writer.write(DETAILED_HEADER);
      writer.newLine();

      for (PairOutcome outcome : run.outcomes()) {
        QueryRecord reference = outcome.reference();
        writer.write(
            String.join(
                ",",
                String.valueOf(outcome.index()),
                reference.questionId() == null ? "" : String.valueOf(reference.questionId()),
                escapeCsv(nullToEmpty(reference.dbId())),
                escapeCsv(nullToEmpty(reference.difficulty())),
                String.valueOf(outcome.correct()),
                escapeCsv(nullToEmpty(outcome.referenceError())),
                escapeCsv(nullToEmpty(outcome.predictedError()))));
        writer.newLine();
      }
    }
  }

  private static Map<String, List<PairOutcome>> groupByDifficulty(List<PairOutcome> outcomes) {
    Map<String, List<PairOutcome>> map = new TreeMap<>();
    for (PairOutcome outcome : outcomes) {
      String difficulty = outcome.reference().difficulty();
      String key = difficulty == null || difficulty.isBlank() ? UNKNOWN_DIFFICULTY : difficulty;
      map.computeIfAbsent(key, k -> new ArrayList<>()).add(outcome);
    }
    return map;
  }

  private static AccuracyReport toReport(List<PairOutcome> outcomes) {
    int correct = (int) outcomes.stream().filter(PairOutcome::correct).count();
    return new AccuracyReport(correct, outcomes.size());
  }

  private static String nullToEmpty(@Nullable String value) {
    return value == null ? "" : value;
  }

  private static String escapeCsv(String value) {
    if (value.contains(",")
        || value.contains("\"")
        || value.contains("\n")
        || value.contains("\r")) {
      return "\"" + value.replace("\"", "\"\"") + "\"";
    }
    return value;
  }
}
