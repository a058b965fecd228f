package dev.sqljudge.eval;

import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.TimeUnit;
import org.springframework.stereotype.Component;

/**
 * Thread-safe in-memory tracker for running evaluations, keyed by run label.
 *
 * <p>Snapshots are replaced atomically with {@code compute()}. Cancellation is cooperative: the
 * harness polls {@link #isCancelled(String)} between pairs, never inside one. Callers that must
 * wait for runs to stop use {@link #awaitNoRunningRuns(Duration)}.
 */
@Component
public class EvaluationProgressTracker {

  private final ConcurrentHashMap<String, EvaluationProgress> activeRuns =
      new ConcurrentHashMap<>();
  private final Set<String> cancellationRequests = ConcurrentHashMap.newKeySet();
  private final Object statusMonitor = new Object();
  private final Clock clock;

  public EvaluationProgressTracker(Clock clock) {
    this.clock = clock;
  }

  /**
   * Start tracking a run. Clears any stale cancellation request for the same label.
   *
   * @param label the run label
   * @param expectedPairs number of pairs the run will evaluate
   */
  public void startRun(String label, int expectedPairs) {
    cancellationRequests.remove(label);
    activeRuns.put(
        label,
        new EvaluationProgress(
            label,
            EvaluationProgress.Status.RUNNING,
            new AccuracyReport(0, 0),
            expectedPairs,
            clock.instant()));
  }

  /**
   * Record the running counters after a pair was evaluated.
   *
   * @param label the run label
   * @param report the counters including the latest pair
   */
  public void recordPair(String label, AccuracyReport report) {
    activeRuns.computeIfPresent(
        label,
        (key, progress) ->
            new EvaluationProgress(
                key, progress.status(), report, progress.expectedPairs(), progress.startedAt()));
  }

  public void completeRun(String label) {
    updateStatus(label, EvaluationProgress.Status.COMPLETED);
  }

  public void markCancelled(String label) {
    updateStatus(label, EvaluationProgress.Status.CANCELLED);
  }

  /**
   * Request cancellation of a running evaluation. The pair in flight finishes first.
   *
   * @param label the run label
   * @return true if a running evaluation with this label exists
   */
  public boolean requestCancellation(String label) {
    EvaluationProgress progress = activeRuns.get(label);
    if (progress == null || progress.status() != EvaluationProgress.Status.RUNNING) {
      return false;
    }
    cancellationRequests.add(label);
    return true;
  }

  public boolean isCancelled(String label) {
    return cancellationRequests.contains(label);
  }

  public Optional<EvaluationProgress> getProgress(String label) {
    return Optional.ofNullable(activeRuns.get(label));
  }

  /** Labels of the runs currently in {@link EvaluationProgress.Status#RUNNING}. */
  public List<String> runningLabels() {
    return activeRuns.values().stream()
        .filter(progress -> progress.status() == EvaluationProgress.Status.RUNNING)
        .map(EvaluationProgress::label)
        .sorted()
        .toList();
  }

  /**
   * Block until no tracked run is running any more.
   *
   * @param timeout maximum time to wait
   * @return true if no run is running, false if the timeout elapsed first
   * @throws InterruptedException if the waiting thread is interrupted
   */
  public boolean awaitNoRunningRuns(Duration timeout) throws InterruptedException {
    long deadline = System.nanoTime() + timeout.toNanos();
    synchronized (statusMonitor) {
      while (!runningLabels().isEmpty()) {
        long remaining = deadline - System.nanoTime();
        if (remaining <= 0) {
          return false;
        }
        TimeUnit.NANOSECONDS.timedWait(statusMonitor, remaining);
      }
      return true;
    }
  }

  /**
   * Stop tracking a run and forget its cancellation request.
   *
   * @param label the run label
   */
  public void removeRun(String label) {
    activeRuns.remove(label);
    cancellationRequests.remove(label);
    signalStatusChange();
  }

  private void updateStatus(String label, EvaluationProgress.Status status) {
    activeRuns.computeIfPresent(
        label,
        (key, progress) ->
            new EvaluationProgress(
                key, status, progress.report(), progress.expectedPairs(), progress.startedAt()));
    signalStatusChange();
  }

  private void signalStatusChange() {
    synchronized (statusMonitor) {
      statusMonitor.notifyAll();
    }
  }
}
