package quantmark.grammar;

import java.util.Arrays;
import java.util.EnumSet;
import java.util.Set;
import java.util.regex.Pattern;
import java.util.stream.Collectors;
import quantmark.circuit.GateKind;
import quantmark.circuit.GateParameter;

/**
 * Textual shape of each family of printed gates.
 *
 * <p>Every family matches one gate exactly as the circuit printer renders it, e.g. {@code
 * Rx(target=(0,), control=(1, 2), parameter=theta)}. Fields appear in the order target, control,
 * parameter; the control field is optional everywhere.
 */
public enum GateGrammar {
  NON_PARAMETRIZED_ONE_QUBIT(
      EnumSet.of(GateKind.X, GateKind.Y, GateKind.Z, GateKind.H),
      Fragments.SINGLE_TUPLE,
      false),
  PARAMETRIZED_ONE_QUBIT(
      EnumSet.of(GateKind.PHASE, GateKind.RX, GateKind.RY, GateKind.RZ),
      Fragments.SINGLE_TUPLE,
      true),
  SWAP(EnumSet.of(GateKind.SWAP), Fragments.PAIR_TUPLE, false);

  private final Set<GateKind> kinds;
  private final String regex;
  private final Pattern pattern;

  GateGrammar(Set<GateKind> kinds, String targetTuple, boolean parametrized) {
    this.kinds = Set.copyOf(kinds);
    this.regex =
        nameAlternatives(kinds)
            + "\\(target="
            + targetTuple
            + Fragments.OPTIONAL_CONTROL
            + (parametrized ? Fragments.PARAMETER : "")
            + "\\)";
    this.pattern = Pattern.compile(regex);
  }

  /** Gate kinds whose printed form this family describes. */
  public Set<GateKind> kinds() {
    return kinds;
  }

  /** Regex source for one gate of this family, without anchors or capturing groups. */
  public String regex() {
    return regex;
  }

  /** Compiled form of {@link #regex()}. */
  public Pattern pattern() {
    return pattern;
  }

  /** True when the whole of {@code gateText} is one gate of this family. */
  public boolean matches(String gateText) {
    return gateText != null && pattern.matcher(gateText).matches();
  }

  /** Union of all families as a single non-capturing regex. */
  public static String anyGateRegex() {
    return Arrays.stream(values())
        .map(GateGrammar::regex)
        .collect(Collectors.joining("|", "(?:", ")"));
  }

  private static String nameAlternatives(Set<GateKind> kinds) {
    return kinds.stream()
        .map(GateKind::printedName)
        .sorted()
        .collect(Collectors.joining("|", "(?:", ")"));
  }

  /** Shared pieces of the gate patterns. */
  static final class Fragments {
    // at most nine digits, so any accepted index fits an int
    static final String INDEX = "\\d{1,9}";
    static final String SINGLE_TUPLE = "\\(" + INDEX + ",\\)";
    static final String PAIR_TUPLE = "\\(" + INDEX + ", " + INDEX + "\\)";
    static final String CONTROL_TUPLE =
        "\\((?:" + INDEX + ",|" + INDEX + "(?:, " + INDEX + ")+)\\)";
    static final String OPTIONAL_CONTROL = "(?:, control=" + CONTROL_TUPLE + ")?";
    static final String NUMBER = GateParameter.NUMBER_REGEX;
    static final String SYMBOL = GateParameter.SYMBOL_REGEX;
    static final String PARAMETER = ", parameter=(?:" + NUMBER + "|" + SYMBOL + ")";

    private Fragments() {}
  }
}
