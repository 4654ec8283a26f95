package asmsynth.encode;

import java.util.Collections;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Set;

/**
 * Fixed-width code per state, produced once per compilation.
 */
public final class StateEncoding {
  /** Widest state register a code can describe */
  public static final int maxWidth = 62;

  private final EncodingPolicy policy;
  private final int width;
  private final Map<String, Long> codes;
  private final Set<Long> used;

  /**
   * @param codes state id to code, in encoding order (initial state first)
   */
  public StateEncoding(EncodingPolicy policy, int width, LinkedHashMap<String, Long> codes) {
    if (width < 1 || width > maxWidth)
      throw new IllegalArgumentException("Unsupported encoding width " + width);
    this.policy = policy;
    this.width = width;
    this.codes = Collections.unmodifiableMap(new LinkedHashMap<>(codes));
    this.used = new HashSet<>(codes.values());
    if (used.size() != codes.size())
      throw new IllegalArgumentException("State codes are not distinct: " + codes);
    for (long code : used)
      if ((code >> width) != 0)
        throw new IllegalArgumentException("Code " + code + " does not fit in " + width + " bits");
  }

  public EncodingPolicy getPolicy() { return policy; }

  public int getWidth() { return width; }

  /** State id to code, initial state first */
  public Map<String, Long> getCodes() { return codes; }

  public long codeOf(String state) {
    Long code = codes.get(state);
    if (code == null)
      throw new IllegalArgumentException("State " + state + " has no code");
    return code;
  }

  /** Code as a bit string, MSB first */
  public String bitsOf(String state) { return toBits(codeOf(state), width); }

  public boolean isUsed(long code) { return used.contains(code); }

  public static String toBits(long code, int width) {
    StringBuilder ret = new StringBuilder(width);
    for (int i = width - 1; i >= 0; --i)
      ret.append(((code >> i) & 1) != 0 ? '1' : '0');
    return ret.toString();
  }

  @Override
  public String toString() {
    StringBuilder ret = new StringBuilder(policy.serialName).append('{');
    codes.forEach((state, code) -> ret.append(ret.charAt(ret.length() - 1) == '{' ? "" : ", ").append(state).append('=').append(toBits(code, width)));
    return ret.append('}').toString();
  }
}
