package dev.sqljudge.eval;

import dev.sqljudge.dataset.DatasetLoader;
import dev.sqljudge.dataset.QueryRecord;
import java.nio.file.Path;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.autoconfigure.condition.ConditionalOnProperty;
import org.springframework.stereotype.Component;

/**
 * Runs one benchmark evaluation on startup when {@code sqljudge.eval.enabled=true}: loads both
 * datasets, evaluates every pair and exports the results. A run cancelled by {@link
 * EvaluationShutdownListener} still exports the pairs it completed.
 */
@Component
@ConditionalOnProperty(prefix = "sqljudge.eval", name = "enabled", havingValue = "true")
public class EvaluationRunner implements ApplicationRunner {

  private static final Logger log = LoggerFactory.getLogger(EvaluationRunner.class);

  private final DatasetLoader datasetLoader;
  private final AccuracyHarness harness;
  private final EvaluationExporter exporter;
  private final EvaluationProgressTracker progressTracker;
  private final EvaluationProperties properties;

  public EvaluationRunner(
      DatasetLoader datasetLoader,
      AccuracyHarness harness,
      EvaluationExporter exporter,
      EvaluationProgressTracker progressTracker,
      EvaluationProperties properties) {
    this.datasetLoader = datasetLoader;
    this.harness = harness;
    this.exporter = exporter;
    this.progressTracker = progressTracker;
    this.properties = properties;
  }

  @Override
  public void run(ApplicationArguments args) throws Exception {
    List<QueryRecord> predictions = datasetLoader.load(properties.getPredictions());
    List<QueryRecord> references = datasetLoader.load(properties.getReferences());

    String label = properties.getLabel();
    try {
      EvaluationRun run = harness.evaluate(label, references, predictions);
      if (run.cancelled()) {
        log.info(
            "Evaluation '{}' was cancelled; exporting the {} evaluated pairs",
            label,
            run.outcomes().size());
      }
      if (properties.isExport()) {
        List<Path> paths = exporter.export(run);
        log.info("Exported evaluation '{}' to {}", run.label(), paths);
      }
    } finally {
      progressTracker.removeRun(label);
    }
  }
}
