package quantmark.circuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;

/**
 * Immutable ordered sequence of gates.
 *
 * <p>Composition is sequential: {@link #append(Gate)} places the gate after every gate already in
 * the circuit and returns a new circuit. {@link #toString()} is the canonical textual form accepted
 * by {@code quantmark.grammar.CircuitGrammar}.
 */
public final class Circuit {
  public static final String HEADER = "circuit:";

  private static final Circuit EMPTY = new Circuit(List.of());

  private final List<Gate> gates;

  private Circuit(List<Gate> gates) {
    this.gates = List.copyOf(gates);
  }

  public static Circuit empty() {
    return EMPTY;
  }

  public static Circuit of(Gate gate) {
    return new Circuit(List.of(Objects.requireNonNull(gate, "gate")));
  }

  public static Circuit of(List<Gate> gates) {
    return new Circuit(Objects.requireNonNull(gates, "gates"));
  }

  public Circuit append(Gate gate) {
    Objects.requireNonNull(gate, "gate");
    List<Gate> next = new ArrayList<>(gates.size() + 1);
    next.addAll(gates);
    next.add(gate);
    return new Circuit(next);
  }

  public Circuit append(Circuit other) {
    Objects.requireNonNull(other, "other");
    List<Gate> next = new ArrayList<>(gates.size() + other.gates.size());
    next.addAll(gates);
    next.addAll(other.gates);
    return new Circuit(next);
  }

  public List<Gate> gates() {
    return gates;
  }

  public int gateCount() {
    return gates.size();
  }

  /** Highest qubit index used plus one; zero for a circuit without gates. */
  public int qubitCount() {
    int max = -1;
    for (Gate gate : gates) {
      for (int qubit : gate.qubits()) {
        max = Math.max(max, qubit);
      }
    }
    return max + 1;
  }

  /**
   * Length of the longest chain of gates that share qubits. Each gate is scheduled one layer after
   * the latest layer occupied by any of its qubits.
   */
  public int depth() {
    Map<Integer, Integer> layerByQubit = new HashMap<>();
    int depth = 0;
    for (Gate gate : gates) {
      List<Integer> qubits = gate.qubits();
      int layer = 0;
      for (int qubit : qubits) {
        layer = Math.max(layer, layerByQubit.getOrDefault(qubit, 0));
      }
      layer++;
      for (int qubit : qubits) {
        layerByQubit.put(qubit, layer);
      }
      depth = Math.max(depth, layer);
    }
    return depth;
  }

  /** Distinct symbolic parameter names in order of first appearance. */
  public Set<String> parameters() {
    Set<String> names = new LinkedHashSet<>();
    for (Gate gate : gates) {
      GateParameter parameter = gate.parameter();
      if (parameter != null && parameter.isSymbolic()) {
        names.add(parameter.symbol());
      }
    }
    return Collections.unmodifiableSet(names);
  }

  @Override
  public boolean equals(Object o) {
    if (this == o) {
      return true;
    }
    if (!(o instanceof Circuit other)) {
      return false;
    }
    return gates.equals(other.gates);
  }

  @Override
  public int hashCode() {
    return gates.hashCode();
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(HEADER).append(" \n");
    for (Gate gate : gates) {
      sb.append(gate).append('\n');
    }
    return sb.toString();
  }
}
