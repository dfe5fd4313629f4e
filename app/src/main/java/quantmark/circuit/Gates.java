package quantmark.circuit;

import java.util.List;
import java.util.Set;

/** Constructors for the supported gate kinds. */
public final class Gates {
  private Gates() {}

  public static Gate x(int target, Set<Integer> controls) {
    return fixed(GateKind.X, target, controls);
  }

  public static Gate y(int target, Set<Integer> controls) {
    return fixed(GateKind.Y, target, controls);
  }

  public static Gate z(int target, Set<Integer> controls) {
    return fixed(GateKind.Z, target, controls);
  }

  public static Gate h(int target, Set<Integer> controls) {
    return fixed(GateKind.H, target, controls);
  }

  public static Gate rx(GateParameter angle, int target, Set<Integer> controls) {
    return rotation(GateKind.RX, angle, target, controls);
  }

  public static Gate ry(GateParameter angle, int target, Set<Integer> controls) {
    return rotation(GateKind.RY, angle, target, controls);
  }

  public static Gate rz(GateParameter angle, int target, Set<Integer> controls) {
    return rotation(GateKind.RZ, angle, target, controls);
  }

  public static Gate phase(GateParameter phi, int target, Set<Integer> controls) {
    return rotation(GateKind.PHASE, phi, target, controls);
  }

  public static Gate swap(int first, int second, Set<Integer> controls) {
    return new Gate(GateKind.SWAP, List.of(first, second), controls, null);
  }

  private static Gate fixed(GateKind kind, int target, Set<Integer> controls) {
    return new Gate(kind, List.of(target), controls, null);
  }

  private static Gate rotation(
      GateKind kind, GateParameter angle, int target, Set<Integer> controls) {
    return new Gate(kind, List.of(target), controls, angle);
  }
}
