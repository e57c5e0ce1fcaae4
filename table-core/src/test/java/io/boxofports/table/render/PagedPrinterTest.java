package io.boxofports.table.render;

import static org.junit.jupiter.api.Assertions.*;

import io.boxofports.table.OutputWriter;
import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.jupiter.api.Test;

class PagedPrinterTest {

  static class BufferIO implements OutputWriter {
    final StringBuilder out = new StringBuilder();

    @Override
    public void println(String s) {
      out.append(s).append('\n');
    }

    @Override
    public void printf(String fmt, Object... args) {
      out.append(String.format(fmt, args));
    }

    @Override
    public void error(String s) {
      out.append(s).append('\n');
    }
  }

  private static ByteArrayInputStream keys(String s) {
    return new ByteArrayInputStream(s.getBytes(StandardCharsets.UTF_8));
  }

  @Test
  void pausesEveryPage() {
    BufferIO io = new BufferIO();
    PagedPrinter pager = PagedPrinter.create(io, 5, keys("\n\n"));
    for (int i = 0; i < 12; i++) {
      pager.println("line " + i);
    }
    assertFalse(pager.isAborted());
    assertTrue(io.out.toString().contains("line 11"));
    assertEquals(2, io.out.toString().split("-- more --", -1).length - 1);
  }

  @Test
  void quitStopsOutput() {
    BufferIO io = new BufferIO();
    PagedPrinter pager = PagedPrinter.create(io, 5, keys("q\n"));
    for (int i = 0; i < 12; i++) {
      pager.println("line " + i);
    }
    assertTrue(pager.isAborted());
    assertTrue(io.out.toString().contains("line 4"));
    assertFalse(io.out.toString().contains("line 5"));
  }

  @Test
  void plainNeverPauses() {
    BufferIO io = new BufferIO();
    PagedPrinter pager = PagedPrinter.plain(io);
    for (int i = 0; i < 100; i++) {
      pager.println("x");
    }
    assertFalse(io.out.toString().contains("more"));
    assertEquals(100, io.out.toString().lines().count());
  }
}
