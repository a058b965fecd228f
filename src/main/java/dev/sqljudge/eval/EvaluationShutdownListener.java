package dev.sqljudge.eval;

import dev.sqljudge.execution.ExecutorProperties;
import java.time.Duration;
import java.util.List;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.event.ContextClosedEvent;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Component;

/**
 * Stops running evaluations when the application context closes, e.g. on SIGTERM or Ctrl-C.
 *
 * <p>Each running evaluation is asked to cancel and the context close is held back until the pair
 * in flight has finished, so the harness still reports the accuracy of the pairs evaluated so far
 * before the data source shuts down. The wait is bounded by the time two queries may take.
 */
@Component
public class EvaluationShutdownListener {

  private static final Logger log = LoggerFactory.getLogger(EvaluationShutdownListener.class);

  private final EvaluationProgressTracker progressTracker;
  private final Duration drainTimeout;

  public EvaluationShutdownListener(
      EvaluationProgressTracker progressTracker, ExecutorProperties executorProperties) {
    this.progressTracker = progressTracker;
    // reference and predicted query of the pair in flight, plus slack
    this.drainTimeout = Duration.ofSeconds(2L * executorProperties.getQueryTimeoutSeconds() + 1);
  }

  @EventListener(ContextClosedEvent.class)
  public void onContextClosed() {
    List<String> running = progressTracker.runningLabels();
    if (running.isEmpty()) {
      return;
    }
    for (String label : running) {
      if (progressTracker.requestCancellation(label)) {
        progressTracker
            .getProgress(label)
            .ifPresent(
                progress ->
                    log.info(
                        "Shutting down: cancelling evaluation '{}' after {} of {} pairs",
                        label,
                        progress.report().total(),
                        progress.expectedPairs()));
      }
    }
    try {
      if (!progressTracker.awaitNoRunningRuns(drainTimeout)) {
        log.warn(
            "Evaluations {} still running after {}s; closing anyway",
            progressTracker.runningLabels(),
            drainTimeout.toSeconds());
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      log.warn("Interrupted while waiting for evaluations {} to stop", running);
    }
  }
}
