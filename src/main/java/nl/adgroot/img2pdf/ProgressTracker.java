package nl.adgroot.img2pdf;

import java.time.Duration;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.LongAdder;

public class ProgressTracker {
  private final int totalInputs;
  private final AtomicInteger doneInputs = new AtomicInteger();
  private final Instant startAll = Instant.now();

  private final LongAdder pdfs = new LongAdder();
  private final LongAdder pages = new LongAdder();

  public ProgressTracker(int totalInputs) {
    this.totalInputs = Math.max(1, totalInputs);
  }

  public void pdfWritten(int pageCount) {
    pdfs.increment();
    pages.add(pageCount);
  }

  public void finishInput() {
    doneInputs.incrementAndGet();
  }

  public long pdfCount() {
    return pdfs.sum();
  }

  public long pageCount() {
    return pages.sum();
  }

  public String formatStatus() {
    int done = doneInputs.get();
    int remaining = Math.max(0, totalInputs - done);

    Duration elapsed = Duration.between(startAll, Instant.now());
    double elapsedSec = Math.max(0.001, elapsed.toMillis() / 1000.0);

    double inputsPerSec = done / elapsedSec;
    long etaSec = (inputsPerSec <= 0) ? 0 : (long) Math.ceil(remaining / inputsPerSec);

    double pct = (done * 100.0) / totalInputs;

    return String.format(
        "Input %d/%d (%.2f%%) | pdfs=%d | pages=%d | elapsed=%s | throughput=%.2f pages/s | ETA=%s",
        done, totalInputs, pct,
        pdfs.sum(),
        pages.sum(),
        fmtDuration(elapsed),
        pages.sum() / elapsedSec,
        fmtDuration(Duration.ofSeconds(etaSec))
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
