package dev.sqljudge.eval;

import jakarta.annotation.PostConstruct;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.context.annotation.Configuration;

/**
 * Externalised configuration for benchmark runs, bound from {@code sqljudge.eval.*}.
 *
 * <ul>
 *   <li>{@code enabled} - run the evaluation on startup (default false)
 *   <li>{@code predictions} - dataset with predicted SQL (default {@code output.json})
 *   <li>{@code references} - dataset with reference SQL (default {@code
 *       mini_dev_postgresql.json})
 *   <li>{@code label} - run label used in logs and export file names (default {@code run})
 *   <li>{@code export} - write CSV results after the run (default true)
 * </ul>
 *
 * <p>The export directory is read by {@link EvaluationExporter} from {@code
 * sqljudge.eval.output-dir}.
 */
@Configuration
@ConfigurationProperties(prefix = "sqljudge.eval")
public class EvaluationProperties {

  private boolean enabled = false;
  private String predictions = "output.json";
  private String references = "mini_dev_postgresql.json";
  private String label = AccuracyHarness.DEFAULT_LABEL;
  private boolean export = true;

  /** Validates configuration at startup. */
  @PostConstruct
  void validate() {
    if (label == null || label.isBlank()) {
      throw new IllegalStateException("sqljudge.eval.label must not be blank");
    }
    if (!label.matches("[A-Za-z0-9._-]+")) {
      throw new IllegalStateException(
          "sqljudge.eval.label may only contain letters, digits, '.', '_' and '-', got: " + label);
    }
    if (predictions == null || predictions.isBlank()) {
      throw new IllegalStateException("sqljudge.eval.predictions must not be blank");
    }
    if (references == null || references.isBlank()) {
      throw new IllegalStateException("sqljudge.eval.references must not be blank");
    }
  }

  public boolean isEnabled() {
    return enabled;
  }

  public void setEnabled(boolean enabled) {
    this.enabled = enabled;
  }

  public String getPredictions() {
    return predictions;
  }

  public void setPredictions(String predictions) {
    this.predictions = predictions;
  }

  public String getReferences() {
    return references;
  }

  public void setReferences(String references) {
    this.references = references;
  }

  public String getLabel() {
    return label;
  }

  public void setLabel(String label) {
    this.label = label;
  }

  public boolean isExport() {
    return export;
  }

  public void setExport(boolean export) {
    this.export = export;
  }
}
