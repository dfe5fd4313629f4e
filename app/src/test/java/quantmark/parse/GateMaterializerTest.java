package quantmark.parse;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;
import quantmark.circuit.Gate;
import quantmark.circuit.GateKind;
import quantmark.circuit.GateParameter;
import quantmark.parse.errors.SameControlAndTargetException;

final class GateMaterializerTest {
  private final GateMaterializer materializer = new GateMaterializer();

  @Test
  void everyGateKindHasAConstructor() {
    assertEquals(EnumSet.allOf(GateKind.class), GateMaterializer.supportedKinds());
  }

  @Test
  void sharedControlAndTargetIsRejectedForEveryKind() {
    for (GateKind kind : GateKind.values()) {
      GateRecord record =
          new GateRecord(
              kind,
              List.of(0),
              Set.of(0),
              kind.parametrized() ? GateParameter.numeric(0.1) : null);

      SameControlAndTargetException ex =
          assertThrows(
              SameControlAndTargetException.class, () -> materializer.materialize(record), kind.name());
      assertEquals(Set.of(0), ex.qubits());
    }
  }

  @Test
  void swapOverlapIsCheckedOnEitherTarget() {
    GateRecord record = new GateRecord(GateKind.SWAP, List.of(0, 1), Set.of(1, 2), null);

    assertThrows(SameControlAndTargetException.class, () -> materializer.materialize(record));
  }

  @Test
  void buildsRotationWithSymbolicAngle() {
    GateRecord record =
        new GateRecord(GateKind.RX, List.of(1), Set.of(0), GateParameter.symbolic("theta"));

    Gate gate = materializer.materialize(record);

    assertEquals(GateKind.RX, gate.kind());
    assertEquals(List.of(1), gate.targets());
    assertEquals(Set.of(0), gate.controls());
    assertEquals(GateParameter.symbolic("theta"), gate.parameter());
  }

  @Test
  void buildsSwapFromBothTargets() {
    Gate gate = materializer.materialize(GateRecord.of(GateKind.SWAP, List.of(3, 1)));

    assertEquals(List.of(3, 1), gate.targets());
  }

  @Test
  void wrongArityIsRejected() {
    assertThrows(
        IllegalArgumentException.class,
        () -> materializer.materialize(GateRecord.of(GateKind.SWAP, List.of(0))));
    assertThrows(
        IllegalArgumentException.class,
        () -> materializer.materialize(GateRecord.of(GateKind.H, List.of(0, 1))));
    assertThrows(
        IllegalArgumentException.class,
        () -> materializer.materialize(GateRecord.of(GateKind.PHASE, List.of(0))));
  }
}
