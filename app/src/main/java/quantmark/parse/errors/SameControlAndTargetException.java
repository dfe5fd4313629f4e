package quantmark.parse.errors;

import java.util.Set;

/** A gate names the same qubit both as a control and as a target. */
public final class SameControlAndTargetException extends CircuitFormatException {
  private static final long serialVersionUID = 1L;

  private final Set<Integer> qubits;

  public SameControlAndTargetException(String gateName, Set<Integer> qubits) {
    super("Gate " + gateName + " uses qubit(s) " + qubits + " as both control and target");
    this.qubits = Set.copyOf(qubits);
  }

  public Set<Integer> qubits() {
    return qubits;
  }
}
