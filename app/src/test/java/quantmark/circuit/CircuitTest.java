package quantmark.circuit;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import org.junit.jupiter.api.Test;

final class CircuitTest {

  private static Circuit sample() {
    return Circuit.of(Gates.h(0, Set.of()))
        .append(Gates.x(1, Set.of(0)))
        .append(Gates.rz(GateParameter.symbolic("theta"), 1, Set.of()))
        .append(Gates.swap(0, 2, Set.of()));
  }

  @Test
  void accountsForQubitsGatesAndDepth() {
    Circuit circuit = sample();

    assertEquals(3, circuit.qubitCount());
    assertEquals(4, circuit.gateCount());
    assertEquals(3, circuit.depth(), "H, CX and Rz chain on qubit 1; SWAP sits after CX");
  }

  @Test
  void independentGatesShareOneLayer() {
    Circuit circuit =
        Circuit.of(Gates.h(0, Set.of())).append(Gates.h(1, Set.of())).append(Gates.h(2, Set.of()));

    assertEquals(1, circuit.depth());
  }

  @Test
  void countsDistinctSymbolicParametersOnly() {
    Circuit circuit =
        Circuit.of(Gates.rx(GateParameter.symbolic("a"), 0, Set.of()))
            .append(Gates.ry(GateParameter.numeric(0.5), 0, Set.of()))
            .append(Gates.rz(GateParameter.symbolic("b"), 1, Set.of()))
            .append(Gates.phase(GateParameter.symbolic("a"), 1, Set.of()));

    assertEquals(List.of("a", "b"), List.copyOf(circuit.parameters()));
  }

  @Test
  void appendReturnsNewCircuit() {
    Circuit first = Circuit.of(Gates.z(0, Set.of()));
    Circuit second = first.append(Gates.y(0, Set.of()));

    assertNotSame(first, second);
    assertEquals(1, first.gateCount());
    assertEquals(2, second.gateCount());
    assertEquals(3, second.append(first).gateCount());
  }

  @Test
  void emptyCircuitHasNoQubits() {
    assertEquals(0, Circuit.empty().qubitCount());
    assertEquals(0, Circuit.empty().depth());
  }

  @Test
  void printsCanonicalForm() {
    String expected =
        "circuit: \n"
            + "H(target=(0,))\n"
            + "X(target=(1,), control=(0,))\n"
            + "Rz(target=(1,), parameter=theta)\n"
            + "SWAP(target=(0, 2))\n";

    assertEquals(expected, sample().toString());
  }

  @Test
  void gateRejectsWrongArity() {
    assertThrows(
        IllegalArgumentException.class,
        () -> new Gate(GateKind.SWAP, List.of(0), Set.of(), null));
    assertThrows(
        IllegalArgumentException.class, () -> new Gate(GateKind.RX, List.of(0), Set.of(), null));
    assertThrows(
        IllegalArgumentException.class,
        () -> new Gate(GateKind.X, List.of(0), Set.of(), GateParameter.numeric(1.0)));
  }

  @Test
  void multiControlGatePrintsControlTuple() {
    Gate gate = Gates.phase(GateParameter.numeric(-0.25), 3, new LinkedHashSet<>(List.of(1, 2)));

    assertEquals("Phase(target=(3,), control=(1, 2), parameter=-0.25)", gate.toString());
  }
}
