package asmsynth.encode;

public enum EncodingPolicy {
  binary("binary"),
  gray("gray"),
  onehot("onehot");

  /** Name used on the command line and in configuration */
  public final String serialName;

  private EncodingPolicy(String serialName) { this.serialName = serialName; }

  public StateEncoder createEncoder() {
    switch (this) {
    case gray:
      return new GrayEncoder();
    case onehot:
      return new OneHotEncoder();
    default:
      return new BinaryEncoder();
    }
  }

  public static EncodingPolicy parse(String text) {
    String lower = text.trim().toLowerCase().replace("-", "").replace("_", "");
    for (EncodingPolicy policy : values())
      if (policy.serialName.equals(lower))
        return policy;
    throw new IllegalArgumentException("Unknown encoding '" + text + "', expected one of binary, gray, onehot");
  }
}
