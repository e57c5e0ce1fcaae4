package io.boxofports.table.render;

import io.boxofports.table.OutputWriter;
import java.io.IOException;
import java.io.InputStream;

/** Simple, self-contained pager for the interactive table. */
public final class PagedPrinter {
  private final OutputWriter out;
  private final boolean enabled;
  private final int pageSize;
  private final InputStream keys;
  private int lineCount = 0;
  private boolean aborted = false;

  private PagedPrinter(OutputWriter out, boolean enabled, int pageSize, InputStream keys) {
    this.out = out;
    this.enabled = enabled;
    this.pageSize = Math.max(5, pageSize);
    this.keys = keys;
  }

  /** A printer that never pauses. */
  public static PagedPrinter plain(OutputWriter out) {
    return new PagedPrinter(out, false, Integer.MAX_VALUE, null);
  }

  /**
   * A printer that pauses every {@code pageSize} lines when enabled and attached to a console.
   * Page size comes from {@code BOP_PAGE_SIZE} when not given (0).
   */
  public static PagedPrinter create(OutputWriter out, boolean enabled, int pageSize) {
    boolean enable = enabled && System.console() != null;
    int size = pageSize > 0 ? pageSize : decidePageSize();
    return new PagedPrinter(out, enable, size, System.in);
  }

  /** Explicit settings and key source, for tests. */
  static PagedPrinter create(OutputWriter out, int pageSize, InputStream keys) {
    return new PagedPrinter(out, true, pageSize, keys);
  }

  /** Prints a line, pausing for pager if needed. */
  public void println(String s) {
    if (aborted) return;
    out.println(s);
    if (!enabled) return;
    lineCount++;
    if (lineCount >= pageSize) {
      if (!promptMore()) {
        aborted = true;
        return;
      }
      lineCount = 0;
    }
  }

  /** Returns whether output has been aborted by user. */
  public boolean isAborted() {
    return aborted;
  }

  private boolean promptMore() {
    out.printf("-- more -- (Enter: next, q: quit) ");
    try {
      int ch = keys.read();
      // Drain until newline
      while (ch != -1 && ch != '\n') {
        if (ch == 'q' || ch == 'Q') {
          out.println("");
          return false;
        }
        ch = keys.read();
      }
      out.println("");
      return ch != -1;
    } catch (IOException e) {
      // input gone; print the rest without paging
      out.println("");
      return true;
    }
  }

  private static int decidePageSize() {
    String env = System.getenv("BOP_PAGE_SIZE");
    if (env != null && env.trim().matches("\\d{1,6}")) {
      return Math.max(5, Integer.parseInt(env.trim()));
    }
    return 24; // conservative default
  }
}
