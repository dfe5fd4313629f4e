package quantmark.circuit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/** A single gate occurrence: kind, target qubits, control qubits and an optional angle. */
public record Gate(GateKind kind, List<Integer> targets, Set<Integer> controls, GateParameter parameter) {

  public Gate {
    Objects.requireNonNull(kind, "kind");
    Objects.requireNonNull(targets, "targets");
    targets = List.copyOf(targets);
    // controls keep their printed order
    controls =
        controls == null || controls.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(controls));
    if (targets.size() != kind.targetCount()) {
      throw new IllegalArgumentException(
          kind.printedName() + " expects " + kind.targetCount() + " target(s), got " + targets);
    }
    if (kind.parametrized() && parameter == null) {
      throw new IllegalArgumentException(kind.printedName() + " requires a parameter");
    }
    if (!kind.parametrized() && parameter != null) {
      throw new IllegalArgumentException(kind.printedName() + " does not take a parameter");
    }
    for (Integer qubit : targets) {
      requireQubit(qubit);
    }
    for (Integer qubit : controls) {
      requireQubit(qubit);
    }
  }

  public boolean isControlled() {
    return !controls.isEmpty();
  }

  /** Targets followed by controls. */
  public List<Integer> qubits() {
    List<Integer> qubits = new ArrayList<>(targets);
    qubits.addAll(controls);
    return qubits;
  }

  @Override
  public String toString() {
    StringBuilder sb = new StringBuilder(kind.printedName());
    sb.append("(target=").append(tuple(targets));
    if (isControlled()) {
      sb.append(", control=").append(tuple(controls));
    }
    if (parameter != null) {
      sb.append(", parameter=").append(parameter);
    }
    return sb.append(')').toString();
  }

  private static String tuple(Iterable<Integer> qubits) {
    List<String> parts = new ArrayList<>();
    qubits.forEach(q -> parts.add(String.valueOf(q)));
    if (parts.size() == 1) {
      return "(" + parts.get(0) + ",)";
    }
    return parts.stream().collect(Collectors.joining(", ", "(", ")"));
  }

  private static void requireQubit(Integer qubit) {
    if (qubit == null || qubit < 0) {
      throw new IllegalArgumentException("Qubit indices must be non-negative: " + qubit);
    }
  }
}
