package io.boxofports.table;

import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.io.Writer;

/**
 * Destination for rendered output. Renderers write lines without knowing whether they end up on a
 * terminal, in a pipe or in a file.
 */
public interface OutputWriter {

  /** Prints a line to standard output. */
  void println(String s);

  /** Prints formatted output to standard output. */
  void printf(String fmt, Object... args);

  /** Prints an error or diagnostic message, typically to stderr. */
  void error(String s);

  /** Creates an OutputWriter that writes to the given PrintStream. */
  static OutputWriter forPrintStream(PrintStream out) {
    return forPrintStream(out, out);
  }

  /** Creates an OutputWriter that writes to separate stdout and stderr streams. */
  static OutputWriter forPrintStream(PrintStream out, PrintStream err) {
    return new OutputWriter() {
      @Override
      public void println(String s) {
        out.println(s);
      }

      @Override
      public void printf(String fmt, Object... args) {
        out.printf(fmt, args);
      }

      @Override
      public void error(String s) {
        err.println(s);
      }
    };
  }

  /**
   * Creates an OutputWriter over a character stream, used for export files. Lines end with
   * {@code \n}; write failures surface as {@link UncheckedIOException}. Errors go to {@code err}.
   */
  static OutputWriter forWriter(Writer w, OutputWriter err) {
    return new OutputWriter() {
      @Override
      public void println(String s) {
        try {
          w.write(s);
          w.write('\n');
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }

      @Override
      public void printf(String fmt, Object... args) {
        try {
          w.write(String.format(fmt, args));
        } catch (IOException e) {
          throw new UncheckedIOException(e);
        }
      }

      @Override
      public void error(String s) {
        err.error(s);
      }
    };
  }

  /** Discards standard output, keeps errors. */
  static OutputWriter quiet(OutputWriter delegate) {
    return new OutputWriter() {
      @Override
      public void println(String s) {}

      @Override
      public void printf(String fmt, Object... args) {}

      @Override
      public void error(String s) {
        delegate.error(s);
      }
    };
  }

  /** Creates an OutputWriter that writes to System.out and System.err. */
  static OutputWriter system() {
    return forPrintStream(System.out, System.err);
  }
}
