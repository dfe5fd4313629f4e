package quantmark.core;

import static org.junit.jupiter.api.Assertions.assertEquals;

import java.util.Set;
import org.junit.jupiter.api.Test;
import quantmark.circuit.Circuit;
import quantmark.circuit.GateParameter;
import quantmark.circuit.Gates;

final class CircuitInfoTest {

  @Test
  void reportsCircuitAccounting() {
    Circuit circuit =
        Circuit.of(Gates.rx(GateParameter.symbolic("a"), 0, Set.of()))
            .append(Gates.rz(GateParameter.symbolic("b"), 0, Set.of(1)))
            .append(Gates.h(4, Set.of()));

    CircuitInfo info = new CircuitInfo(circuit);

    assertEquals(5, info.qubitCount());
    assertEquals(2, info.gateDepth());
    assertEquals(3, info.gateCount());
    assertEquals(2, info.parameterCount());
  }

  @Test
  void printsOneValuePerLine() {
    Circuit circuit = Circuit.of(Gates.h(0, Set.of())).append(Gates.x(1, Set.of()));

    assertEquals(
        "QUBIT COUNT:        2\n"
            + "GATE DEPTH:         1\n"
            + "GATE COUNT:         2\n"
            + "PARAMETER COUNT:    0\n",
        new CircuitInfo(circuit).toString());
  }
}
