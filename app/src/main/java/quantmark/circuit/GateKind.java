package quantmark.circuit;

import java.util.Optional;

/** Closed set of gate kinds the circuit model can construct and print. */
public enum GateKind {
  X("X", 1, false),
  Y("Y", 1, false),
  Z("Z", 1, false),
  H("H", 1, false),
  PHASE("Phase", 1, true),
  RX("Rx", 1, true),
  RY("Ry", 1, true),
  RZ("Rz", 1, true),
  SWAP("SWAP", 2, false);

  private final String printedName;
  private final int targetCount;
  private final boolean parametrized;

  GateKind(String printedName, int targetCount, boolean parametrized) {
    this.printedName = printedName;
    this.targetCount = targetCount;
    this.parametrized = parametrized;
  }

  /** Name as it appears in the textual circuit format, e.g. {@code Rx}. */
  public String printedName() {
    return printedName;
  }

  public int targetCount() {
    return targetCount;
  }

  public boolean parametrized() {
    return parametrized;
  }

  public static Optional<GateKind> fromPrintedName(String name) {
    for (GateKind kind : values()) {
      if (kind.printedName.equals(name)) {
        return Optional.of(kind);
      }
    }
    return Optional.empty();
  }
}
