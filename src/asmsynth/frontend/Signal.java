package asmsynth.frontend;

import java.util.Objects;

/**
 * Declared port of the generated machine. Immutable.
 */
public final class Signal {
  public enum Direction {
    input("in"),
    output("out");

    /** Name used in chart descriptions */
    public final String serialName;
    private Direction(String serialName) { this.serialName = serialName; }

    public static Direction parse(String text) {
      if (text == null)
        return null;
      String lower = text.trim().toLowerCase();
      for (Direction dir : values()) {
        if (dir.name().equals(lower) || dir.serialName.equals(lower))
          return dir;
      }
      return null;
    }
  }

  public final String name;
  public final Direction direction;
  public final int width;
  /** Value of an output in states that do not bind it. Unused for inputs. */
  public final long defaultValue;

  public Signal(String name, Direction direction, int width, long defaultValue) {
    this.name = Objects.requireNonNull(name);
    this.direction = Objects.requireNonNull(direction);
    this.width = width;
    this.defaultValue = defaultValue;
  }

  public Signal(String name, Direction direction, int width) { this(name, direction, width, 0); }

  public boolean isInput() { return direction == Direction.input; }
  public boolean isOutput() { return direction == Direction.output; }

  /** Literal for bit {@code bit} of this signal. */
  public BoolExpr bit(int bit) {
    if (bit < 0 || bit >= width)
      throw new IndexOutOfBoundsException("Bit " + bit + " of signal " + name + " (width " + width + ")");
    return new BoolExpr.Literal(name, bit);
  }

  @Override
  public boolean equals(Object obj) {
    if (this == obj)
      return true;
    if (obj == null || getClass() != obj.getClass())
      return false;
    Signal other = (Signal)obj;
    return name.equals(other.name) && direction == other.direction && width == other.width && defaultValue == other.defaultValue;
  }

  @Override
  public int hashCode() {
    return Objects.hash(name, direction, width, defaultValue);
  }

  @Override
  public String toString() {
    return name + ":" + direction.serialName + (width > 1 ? "[" + width + "]" : "");
  }
}
