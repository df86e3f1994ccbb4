package nl.adgroot.img2pdf;

import static org.junit.jupiter.api.Assertions.*;

import java.time.Duration;
import org.junit.jupiter.api.Test;

class ProgressTrackerTest {

  @Test
  void formatStatus_reportsInputsPdfsAndPages() {
    ProgressTracker tracker = new ProgressTracker(2);
    tracker.pdfWritten(3);
    tracker.pdfWritten(1);
    tracker.finishInput();

    String status = tracker.formatStatus();

    assertTrue(status.startsWith("Input 1/2"), status);
    assertTrue(status.contains("pdfs=2"), status);
    assertTrue(status.contains("pages=4"), status);
    assertEquals(2, tracker.pdfCount());
    assertEquals(4, tracker.pageCount());
  }

  @Test
  void fmtDuration() {
    assertEquals("5s", ProgressTracker.fmtDuration(Duration.ofSeconds(5)));
    assertEquals("2m 05s", ProgressTracker.fmtDuration(Duration.ofSeconds(125)));
    assertEquals("1h 00m 01s", ProgressTracker.fmtDuration(Duration.ofSeconds(3601)));
  }
}
