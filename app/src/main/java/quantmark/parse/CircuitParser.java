package quantmark.parse;

import java.util.Optional;
import quantmark.circuit.Circuit;
import quantmark.grammar.CircuitGrammar;

/**
 * Entry points for reading circuits printed by {@link Circuit#toString()}.
 *
 * <p>Supported gates are X, Y, Z, H, Phase, Rx, Ry, Rz and SWAP, each optionally controlled.
 */
public final class CircuitParser {
  private static final CircuitReconstructor RECONSTRUCTOR = new CircuitReconstructor();

  private CircuitParser() {}

  /** Returns whether {@code text} can be turned into a circuit without a syntax error. */
  public static boolean validateCircuitSyntax(String text) {
    return CircuitGrammar.validate(text);
  }

  /**
   * Transforms printed circuit text back into a circuit.
   *
   * @return the circuit, or empty when the text holds a header and no gates
   * @throws quantmark.parse.errors.InvalidSyntaxException if the text is not a valid circuit
   * @throws quantmark.parse.errors.MalformedFieldException if a gate field cannot be read
   * @throws quantmark.parse.errors.SameControlAndTargetException if a gate controls its own target
   */
  public static Optional<Circuit> parseCircuit(String text) {
    return RECONSTRUCTOR.parse(text);
  }
}
