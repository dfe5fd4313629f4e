package quantmark.grammar;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.List;
import org.junit.jupiter.api.Test;

final class CircuitGrammarTest {

  @Test
  void acceptsPrintedCircuit() {
    assertTrue(
        CircuitGrammar.validate(
            "circuit: \nH(target=(0,))\nRx(target=(1,), control=(0,), parameter=0.5)\n"
                + "SWAP(target=(0, 1))\n"));
  }

  @Test
  void acceptsHeaderWithoutGates() {
    assertTrue(CircuitGrammar.validate("circuit:\n"));
    assertTrue(CircuitGrammar.validate("circuit:"));
  }

  @Test
  void rejectsMalformedText() {
    assertFalse(CircuitGrammar.validate(null));
    assertFalse(CircuitGrammar.validate(""));
    assertFalse(CircuitGrammar.validate("H(target=(0,))\n"), "header missing");
    assertFalse(CircuitGrammar.validate("circuit:H(target=(0,))"), "gate glued to header");
    assertFalse(CircuitGrammar.validate("circuit:\nH(target=(0,))X(target=(1,))\n"));
    assertFalse(CircuitGrammar.validate("circuit:\nH(target=(0,)) junk\n"));
    assertFalse(CircuitGrammar.validate("circuit:\nCNOT(target=(0,), control=(1,))\n"));
    assertFalse(CircuitGrammar.validate("circuit:\nMeasure(target=(0,))\n"));
  }

  @Test
  void splitsGatesInPrintedOrder() {
    String text =
        "circuit: \nZ(target=(2,))\nRy(target=(0,), parameter=a)\n\nSWAP(target=(1, 2))\n";

    assertEquals(
        List.of("Z(target=(2,))", "Ry(target=(0,), parameter=a)", "SWAP(target=(1, 2))"),
        CircuitGrammar.gateOccurrences(text));
  }

  @Test
  void headerOnlyHasNoOccurrences() {
    assertTrue(CircuitGrammar.gateOccurrences("circuit:\n").isEmpty());
  }

  @Test
  void exposesRegexSource() {
    assertTrue(CircuitGrammar.circuitRegex().contains("SWAP"));
    assertEquals(CircuitGrammar.circuitRegex(), CircuitGrammar.pattern().pattern());
  }
}
