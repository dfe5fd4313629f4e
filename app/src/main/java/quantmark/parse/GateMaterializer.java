package quantmark.parse;

import java.util.Collections;
import java.util.EnumMap;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.function.Function;
import quantmark.circuit.Gate;
import quantmark.circuit.GateKind;
import quantmark.circuit.GateParameter;
import quantmark.circuit.Gates;
import quantmark.parse.errors.SameControlAndTargetException;
import quantmark.parse.errors.UnsupportedGateKindException;

/** Builds circuit gates from {@link GateRecord}s through a fixed table of constructors. */
public final class GateMaterializer {
  private static final Map<GateKind, Function<GateRecord, Gate>> CONSTRUCTORS = constructors();

  /**
   * Materializes one record. Overlapping control and target qubits are rejected before anything
   * else is looked at.
   *
   * @throws SameControlAndTargetException if a qubit is both control and target
   * @throws UnsupportedGateKindException if no constructor is registered for the record's kind
   * @throws IllegalArgumentException if the record has the wrong number of targets or a missing
   *     parameter
   */
  public Gate materialize(GateRecord record) {
    Set<Integer> overlap = new HashSet<>(record.controls());
    overlap.retainAll(record.targets());
    if (!overlap.isEmpty()) {
      throw new SameControlAndTargetException(record.name().printedName(), overlap);
    }
    Function<GateRecord, Gate> constructor = CONSTRUCTORS.get(record.name());
    if (constructor == null) {
      throw new UnsupportedGateKindException(record.name().printedName());
    }
    return constructor.apply(record);
  }

  /** Gate kinds this materializer can build. */
  public static Set<GateKind> supportedKinds() {
    return Collections.unmodifiableSet(CONSTRUCTORS.keySet());
  }

  private static Map<GateKind, Function<GateRecord, Gate>> constructors() {
    Map<GateKind, Function<GateRecord, Gate>> table = new EnumMap<>(GateKind.class);
    table.put(GateKind.X, r -> Gates.x(onlyTarget(r), r.controls()));
    table.put(GateKind.Y, r -> Gates.y(onlyTarget(r), r.controls()));
    table.put(GateKind.Z, r -> Gates.z(onlyTarget(r), r.controls()));
    table.put(GateKind.H, r -> Gates.h(onlyTarget(r), r.controls()));
    table.put(GateKind.RX, r -> Gates.rx(angle(r), onlyTarget(r), r.controls()));
    table.put(GateKind.RY, r -> Gates.ry(angle(r), onlyTarget(r), r.controls()));
    table.put(GateKind.RZ, r -> Gates.rz(angle(r), onlyTarget(r), r.controls()));
    table.put(GateKind.PHASE, r -> Gates.phase(angle(r), onlyTarget(r), r.controls()));
    table.put(
        GateKind.SWAP,
        r -> {
          List<Integer> targets = r.targets();
          if (targets.size() != 2) {
            throw new IllegalArgumentException("SWAP expects two targets, got " + targets);
          }
          return Gates.swap(targets.get(0), targets.get(1), r.controls());
        });
    return table;
  }

  private static int onlyTarget(GateRecord record) {
    List<Integer> targets = record.targets();
    if (targets.size() != 1) {
      throw new IllegalArgumentException(
          record.name().printedName() + " expects one target, got " + targets);
    }
    return targets.get(0);
  }

  private static GateParameter angle(GateRecord record) {
    if (!record.hasParameter()) {
      throw new IllegalArgumentException(record.name().printedName() + " requires a parameter");
    }
    return record.parameter();
  }
}
