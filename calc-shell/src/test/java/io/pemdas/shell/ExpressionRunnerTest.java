package io.pemdas.shell;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import io.pemdas.calc.ErrorKind;
import io.pemdas.calc.Evaluation;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

class ExpressionRunnerTest {

  static class BufferIO implements ExpressionRunner.IO {
    final StringBuilder out = new StringBuilder();
    final StringBuilder err = new StringBuilder();

    @Override
    public void println(String s) {
      out.append(s).append('\n');
    }

    @Override
    public void error(String s) {
      err.append(s).append('\n');
    }
  }

  private BufferIO io;
  private ExpressionRunner runner;

  @BeforeEach
  void setUp() {
    io = new BufferIO();
    runner = new ExpressionRunner(io, 0);
  }

  @Test
  void printsResult() {
    Evaluation result = runner.run("2+3*4");
    assertTrue(result.isSuccess());
    assertEquals("Result: 14\n", io.out.toString());
    assertEquals("", io.err.toString());
  }

  @Test
  void printsFractionalResult() {
    runner.run("5/2");
    assertEquals("Result: 2.5\n", io.out.toString());
  }

  @Test
  void printsErrorWithPosition() {
    Evaluation result = runner.run("3 q");
    assertFalse(result.isSuccess());
    assertEquals(ErrorKind.TRAILING_INPUT, ((Evaluation.Failure) result).kind());
    assertEquals("Error: Unexpected trailing input at pos 2: q\n", io.err.toString());
    assertEquals("", io.out.toString());
  }

  @Test
  void appliesPrecision() {
    ExpressionRunner sixDigits = new ExpressionRunner(io, 6);
    sixDigits.run("1/3");
    assertEquals("Result: 0.333333\n", io.out.toString());
  }

  @Test
  void errorGoesOnlyToErrorChannel() {
    ExpressionRunner.IO mockIo = mock(ExpressionRunner.IO.class);
    new ExpressionRunner(mockIo, 0).run("5/0");
    verify(mockIo).error("Error: Division by zero at pos 1");
    verify(mockIo, never()).println(anyString());
  }

  @Test
  void resultGoesOnlyToOutputChannel() {
    ExpressionRunner.IO mockIo = mock(ExpressionRunner.IO.class);
    new ExpressionRunner(mockIo, 0).run("(1+2)(3+4)");
    verify(mockIo).println("Result: 21");
    verify(mockIo, never()).error(anyString());
  }
}
