package ca.gc.dfo.tides.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.io.Writer;
import java.nio.charset.StandardCharsets;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Standard-output channel of the {@code tides} commands.
 *
 * <p>Help, usage and dry-run plans are printed here, and so are reports when no {@code out=} file is given.
 * Logging goes to standard error through Logback, so a report can be piped while diagnostics stay on the
 * terminal.</p>
 */
public final class CliPrinter {
  private static final PrintWriter CONSOLE = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> CAPTURE = new AtomicReference<>();

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints one line.
   *
   * @param message text to print
   */
  public static void println(String message) {
    active().println(message);
  }

  /**
   * Prints a block such as a dry-run plan; a {@code null} block prints nothing.
   *
   * @param lines lines in display order
   */
  public static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = active();
    for (String line : lines) {
      out.println(line);
    }
    out.flush();
  }

  /**
   * Console writer handed to report writers targeting standard output. Flush it, never close it.
   *
   * @return current console writer
   */
  static Writer reportWriter() {
    return active();
  }

  static void setWriterForTesting(PrintWriter writer) {
    CAPTURE.set(writer);
  }

  static void clearTestWriter() {
    CAPTURE.set(null);
  }

  private static PrintWriter active() {
    PrintWriter captured = CAPTURE.get();
    return captured == null ? CONSOLE : captured;
  }
}
