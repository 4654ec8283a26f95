package asmsynth.util;

public class Log2 {
  public static int log2(int n) {
    if (n < 0)
      throw new IllegalArgumentException();
    return 31 - Integer.numberOfLeadingZeros(n);
  }

  public static int clog2(int n) {
    if (n <= 0)
      throw new IllegalArgumentException();
    return log2(n - 1) + 1;
  }

  /** Bits needed to give {@code count} items distinct codes; at least one, so that a register always exists. */
  public static int codeWidth(int count) { return Math.max(1, clog2(count)); }
}
