package nl.adgroot.pdfocr.batch;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;

public class ProgressTracker {
  private final int totalTasks;
  private final Clock clock;
  private final Instant startAll;

  private int accepted;
  private int dropped;
  private int attempts;

  public ProgressTracker(int totalTasks) {
    this(totalTasks, Clock.systemUTC());
  }

  public ProgressTracker(int totalTasks, Clock clock) {
    this.totalTasks = totalTasks;
    this.clock = clock;
    this.startAll = clock.instant();
  }

  public void attempted(int requests) {
    attempts += requests;
  }

  public void accepted() {
    accepted++;
  }

  public void droppedSoFar(int total) {
    dropped = total;
  }

  public int finished() {
    return accepted + dropped;
  }

  public String formatStatus() {
    int done = finished();
    int remaining = Math.max(0, totalTasks - done);

    Duration elapsed = Duration.between(startAll, clock.instant());
    double elapsedSec = Math.max(0.001, elapsed.toMillis() / 1000.0);

    double throughput = done / elapsedSec; // tasks/sec
    long etaSec = (throughput <= 0) ? 0 : (long) Math.ceil(remaining / throughput);

    double pct = totalTasks == 0 ? 100.0 : (done * 100.0) / totalTasks;

    return String.format(
        "Tasks %d/%d (%.2f%%) | accepted=%d dropped=%d requests=%d | elapsed=%s | ETA=%s",
        done, totalTasks, pct,
        accepted, dropped, attempts,
        fmtDuration(elapsed),
        done == 0 ? "?" : fmtDuration(Duration.ofSeconds(etaSec))
    );
  }

  static String fmtDuration(Duration d) {
    long s = d.getSeconds();
    long h = s / 3600;
    long m = (s % 3600) / 60;
    long sec = s % 60;
    if (h > 0) return String.format("%dh %02dm %02ds", h, m, sec);
    if (m > 0) return String.format("%dm %02ds", m, sec);
    return String.format("%ds", sec);
  }
}
