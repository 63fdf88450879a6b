package ca.gc.cra.haplotree.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Command output on stdout. Logging goes to stderr, so results printed here can be piped.
 * Numbers are formatted with {@link Locale#ROOT}.
 */
final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static final AtomicReference<PrintWriter> TEST_WRITER = new AtomicReference<>();

  private CliPrinter() {}

  static void println(String line) {
    PrintWriter out = target();
    out.println(line);
    out.flush();
  }

  static void printf(String format, Object... args) {
    println(String.format(Locale.ROOT, format, args));
  }

  static void printLines(String... lines) {
    if (lines == null) {
      return;
    }
    PrintWriter out = target();
    for (String line : lines) {
      out.println(line);
    }
    out.flush();
  }

  static void setWriterForTesting(PrintWriter writer) {
    TEST_WRITER.set(writer);
  }

  static void clearTestWriter() {
    TEST_WRITER.set(null);
  }

  private static PrintWriter target() {
    PrintWriter writer = TEST_WRITER.get();
    return writer == null ? STDOUT : writer;
  }
}
