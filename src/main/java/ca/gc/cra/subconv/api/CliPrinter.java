package ca.gc.cra.subconv.api;

import java.io.FileDescriptor;
import java.io.FileOutputStream;
import java.io.OutputStreamWriter;
import java.io.PrintWriter;
import java.nio.charset.StandardCharsets;

/**
 * Console output for command results and usage text.
 *
 * <p>Writes through the native stdout descriptor in UTF-8 so emoji node names survive regardless of the platform
 * default charset, and so results never mix with log output on stderr.</p>
 */
public final class CliPrinter {
  private static final PrintWriter STDOUT = new PrintWriter(
      new OutputStreamWriter(new FileOutputStream(FileDescriptor.out), StandardCharsets.UTF_8), true);
  private static volatile PrintWriter override;

  private CliPrinter() {
    // Utility
  }

  /**
   * Prints a single line.
   *
   * @param message line to emit
   */
  public static void println(String message) {
    writer().println(message);
  }

  /**
   * Prints a block of text, adding a final newline only when it lacks one.
   *
   * @param text text to emit
   */
  public static void printBlock(String text) {
    PrintWriter writer = writer();
    if (text.endsWith("\n")) {
      writer.print(text);
      writer.flush();
    } else {
      writer.println(text);
    }
  }

  static void setWriterForTesting(PrintWriter writer) {
    override = writer;
  }

  static void clearTestWriter() {
    override = null;
  }

  private static PrintWriter writer() {
    return override != null ? override : STDOUT;
  }
}
