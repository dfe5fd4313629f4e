package quantmark.core;

import java.util.Objects;
import java.util.Set;
import quantmark.circuit.Circuit;

/**
 * Read-only summary of a finished circuit.
 *
 * <p>All values are taken from the circuit once, at construction.
 */
public final class CircuitInfo {
  private final int qubitCount;
  private final int gateDepth;
  private final int gateCount;
  private final Set<String> parameters;

  public CircuitInfo(Circuit circuit) {
    Objects.requireNonNull(circuit, "circuit");
    this.qubitCount = circuit.qubitCount();
    this.gateDepth = circuit.depth();
    this.gateCount = circuit.gateCount();
    this.parameters = Set.copyOf(circuit.parameters());
  }

  /** The amount of qubits the circuit needs. */
  public int qubitCount() {
    return qubitCount;
  }

  /** The gate depth of the circuit. */
  public int gateDepth() {
    return gateDepth;
  }

  /** The amount of gates the circuit uses. */
  public int gateCount() {
    return gateCount;
  }

  /** The amount of distinct unbound parameters that still have to be optimized. */
  public int parameterCount() {
    return parameters.size();
  }

  @Override
  public String toString() {
    return String.format(
        "QUBIT COUNT:        %d\n"
            + "GATE DEPTH:         %d\n"
            + "GATE COUNT:         %d\n"
            + "PARAMETER COUNT:    %d\n",
        qubitCount, gateDepth, gateCount, parameterCount());
  }
}
