package asmsynth.minimize;

import java.util.Arrays;

/**
 * Product term over {@code numVars} ordered variables. Variable {@code k} is held in bit {@code numVars-1-k} of
 * {@link #value} and {@link #mask}, so that minterm numbers read MSB first in variable order. A cleared mask bit means the
 * variable does not appear in the term.
 */
final class Implicant {
  /** Polarity of a variable in {@link #key()} */
  static final int negative = 0, positive = 1, absent = 2;

  final long value;
  final long mask;
  final int numVars;

  Implicant(long value, long mask, int numVars) {
    this.value = value & mask;
    this.mask = mask;
    this.numVars = numVars;
  }

  /** The term matching exactly one minterm */
  static Implicant minterm(long minterm, int numVars) {
    long full = numVars == 64 ? -1L : (1L << numVars) - 1;
    return new Implicant(minterm, full, numVars);
  }

  boolean covers(long minterm) { return (minterm & mask) == value; }

  int literalCount() { return Long.bitCount(mask); }

  /**
   * The term covering both this and {@code other}, if the two differ in exactly one present variable; null otherwise.
   */
  Implicant combine(Implicant other) {
    if (other.mask != mask)
      return null;
    long diff = value ^ other.value;
    if (Long.bitCount(diff) != 1)
      return null;
    return new Implicant(value & ~diff, mask & ~diff, numVars);
  }

  /** Per variable, in variable order: {@link #negative}, {@link #positive} or {@link #absent} */
  int[] key() {
    int[] ret = new int[numVars];
    for (int k = 0; k < numVars; ++k) {
      long bit = 1L << (numVars - 1 - k);
      ret[k] = (mask & bit) == 0 ? absent : ((value & bit) != 0 ? positive : negative);
    }
    return ret;
  }

  static int compareKeys(int[] a, int[] b) { return Arrays.compare(a, b); }

  @Override
  public boolean equals(Object obj) {
    if (!(obj instanceof Implicant))
      return false;
    Implicant other = (Implicant)obj;
    return value == other.value && mask == other.mask && numVars == other.numVars;
  }

  @Override
  public int hashCode() {
    return Long.hashCode(value * 31 + mask) ^ numVars;
  }

  @Override
  public String toString() {
    StringBuilder ret = new StringBuilder();
    for (int polarity : key())
      ret.append(polarity == absent ? '-' : (char)('0' + polarity));
    return ret.toString();
  }
}
