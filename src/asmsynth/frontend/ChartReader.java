package asmsynth.frontend;

import java.io.File;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.math.BigInteger;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.error.YAMLException;

/**
 * Reads a {@link ChartDescription} from YAML. JSON exports are accepted as well, being valid YAML.
 * <pre>
 * name: traffic
 * signals:
 *   - {name: car, direction: input, width: 1}
 * states:
 *   - {id: MG, initial: true, outputs: {main_green: 1}}
 * transitions:
 *   - {id: t0, from: MG, to: MY, guard: "T1 and car", priority: 0}
 * initial_state: MG
 * </pre>
 */
public class ChartReader {
  // logging
  protected static final Logger logger = LogManager.getLogger();

  public static ChartDescription read(File file) throws IOException, ChartFormatException {
    try (InputStream in = new FileInputStream(file)) {
      return read(in);
    }
  }

  public static ChartDescription read(InputStream in) throws ChartFormatException {
    Object data;
    try {
      data = new Yaml().load(in);
    } catch (YAMLException e) {
      throw new ChartFormatException("Chart is not valid YAML: " + e.getMessage(), e);
    }
    return fromObject(data);
  }

  public static ChartDescription read(String text) throws ChartFormatException {
    Object data;
    try {
      data = new Yaml().load(text);
    } catch (YAMLException e) {
      throw new ChartFormatException("Chart is not valid YAML: " + e.getMessage(), e);
    }
    return fromObject(data);
  }

  private static ChartDescription fromObject(Object data) throws ChartFormatException {
    Map<?, ?> root = asMap(data, "chart");
    ChartDescription ret = new ChartDescription();
    for (Map.Entry<?, ?> setting : root.entrySet()) {
      String key = String.valueOf(setting.getKey());
      Object value = setting.getValue();
      switch (key) {
      case "name":
        ret.name = asString(value);
        break;
      case "signals":
        for (Object entry : asList(value, key))
          ret.signals.add(readSignal(asMap(entry, "signal")));
        break;
      case "states":
        for (Object entry : asList(value, key))
          ret.states.add(readState(asMap(entry, "state")));
        break;
      case "transitions":
        for (Object entry : asList(value, key))
          ret.transitions.add(readTransition(asMap(entry, "transition")));
        break;
      case "initial_state":
      case "initialState":
        ret.initialState = asString(value);
        break;
      default:
        logger.warn("ChartReader. Ignoring unknown chart key '{}'", key);
      }
    }
    logger.debug("ChartReader. Read chart '{}' with {} signals, {} states, {} transitions", ret.name, ret.signals.size(),
                 ret.states.size(), ret.transitions.size());
    return ret;
  }

  private static ChartDescription.SignalDesc readSignal(Map<?, ?> map) throws ChartFormatException {
    ChartDescription.SignalDesc sig = new ChartDescription.SignalDesc();
    sig.name = asString(map.get("name"));
    sig.direction = asString(map.get("direction"));
    if (map.containsKey("width"))
      sig.width = asInt(map.get("width"), "width of signal " + sig.name);
    if (map.containsKey("default"))
      sig.defaultValue = asLong(map.get("default"), "default of signal " + sig.name);
    return sig;
  }

  private static ChartDescription.StateDesc readState(Map<?, ?> map) throws ChartFormatException {
    ChartDescription.StateDesc state = new ChartDescription.StateDesc();
    state.id = asString(map.get("id"));
    Object initial = map.get("initial");
    if (initial != null)
      state.initial = Boolean.parseBoolean(String.valueOf(initial));
    Object outputs = map.get("outputs");
    if (outputs != null) {
      for (Map.Entry<?, ?> binding : asMap(outputs, "outputs of state " + state.id).entrySet())
        state.outputs.put(String.valueOf(binding.getKey()), asConstantOrExpression(binding.getValue()));
    }
    return state;
  }

  private static ChartDescription.TransitionDesc readTransition(Map<?, ?> map) throws ChartFormatException {
    ChartDescription.TransitionDesc transition = new ChartDescription.TransitionDesc();
    transition.id = asString(map.get("id"));
    transition.from = asString(map.get("from"));
    transition.to = asString(map.get("to"));
    transition.guard = asConstantOrExpression(map.get("guard"));
    if (map.containsKey("priority"))
      transition.priority = asInt(map.get("priority"), "priority of transition " + transition.id);
    Object outputs = map.get("outputs");
    if (outputs instanceof String)
      transition.outputs = new ArrayList<>(List.of((String)outputs));
    else if (outputs != null)
      for (Object out : asList(outputs, "outputs of transition " + transition.id))
        transition.outputs.add(String.valueOf(out));
    return transition;
  }

  private static Map<?, ?> asMap(Object value, String what) throws ChartFormatException {
    if (!(value instanceof Map))
      throw new ChartFormatException("Expected a mapping for " + what + ", found: " + value);
    return (Map<?, ?>)value;
  }

  private static List<?> asList(Object value, String what) throws ChartFormatException {
    if (value == null)
      return List.of();
    if (!(value instanceof List))
      throw new ChartFormatException("Expected a list for " + what + ", found: " + value);
    return (List<?>)value;
  }

  private static String asString(Object value) { return value == null ? null : String.valueOf(value); }

  /** YAML turns {@code 1} into an Integer and {@code true} into a Boolean; expressions expect text. */
  private static String asConstantOrExpression(Object value) {
    if (value == null)
      return null;
    if (value instanceof Boolean)
      return ((Boolean)value) ? "1" : "0";
    return String.valueOf(value);
  }

  private static long asLong(Object value, String what) throws ChartFormatException {
    if (value instanceof Integer || value instanceof Long)
      return ((Number)value).longValue();
    if (value instanceof BigInteger) {
      if (((BigInteger)value).bitLength() > 63)
        throw new ChartFormatException("Value of " + what + " is out of range: " + value);
      return ((BigInteger)value).longValue();
    }
    try {
      return Long.parseLong(String.valueOf(value).trim());
    } catch (NumberFormatException e) {
      throw new ChartFormatException("Expected an integer for " + what + ", found: " + value, e);
    }
  }

  private static int asInt(Object value, String what) throws ChartFormatException {
    long ret = asLong(value, what);
    if (ret < Integer.MIN_VALUE || ret > Integer.MAX_VALUE)
      throw new ChartFormatException("Value of " + what + " is out of range: " + value);
    return (int)ret;
  }
}
