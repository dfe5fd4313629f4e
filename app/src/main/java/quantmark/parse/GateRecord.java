package quantmark.parse;

import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;
import quantmark.circuit.GateKind;
import quantmark.circuit.GateParameter;

/**
 * One gate occurrence as read from circuit text, before it is turned into a {@link
 * quantmark.circuit.Gate}.
 *
 * <p>Arity and parameter presence are not checked here; records may be built by hand and are
 * validated when materialized.
 */
public record GateRecord(
    GateKind name, List<Integer> targets, Set<Integer> controls, GateParameter parameter) {

  public GateRecord {
    Objects.requireNonNull(name, "name");
    Objects.requireNonNull(targets, "targets");
    targets = List.copyOf(targets);
    controls =
        controls == null || controls.isEmpty()
            ? Set.of()
            : Collections.unmodifiableSet(new LinkedHashSet<>(controls));
  }

  public static GateRecord of(GateKind name, List<Integer> targets) {
    return new GateRecord(name, targets, Set.of(), null);
  }

  public boolean hasControls() {
    return !controls.isEmpty();
  }

  public boolean hasParameter() {
    return parameter != null;
  }
}
