package quantmark.parse;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import quantmark.circuit.Circuit;
import quantmark.grammar.CircuitGrammar;
import quantmark.parse.errors.InvalidSyntaxException;

/**
 * Rebuilds a {@link Circuit} from its printed form: validate, split into gates, build a record per
 * gate, materialize, then compose in printed order.
 *
 * <p>Either the whole circuit is produced or an exception is thrown; partial circuits never
 * escape. Instances hold no mutable state and may be shared between threads.
 */
public final class CircuitReconstructor {
  private final GateRecordBuilder recordBuilder;
  private final GateMaterializer materializer;

  public CircuitReconstructor() {
    this(new GateRecordBuilder(), new GateMaterializer());
  }

  CircuitReconstructor(GateRecordBuilder recordBuilder, GateMaterializer materializer) {
    this.recordBuilder = recordBuilder;
    this.materializer = materializer;
  }

  /**
   * Parses {@code text} into a circuit.
   *
   * @return the circuit, or empty if the text is a valid header with no gates
   * @throws InvalidSyntaxException if the text does not match the circuit grammar
   */
  public Optional<Circuit> parse(String text) {
    if (!CircuitGrammar.validate(text)) {
      throw new InvalidSyntaxException("Text is not a valid circuit: " + abbreviate(text));
    }
    List<GateRecord> records = new ArrayList<>();
    for (String gateText : CircuitGrammar.gateOccurrences(text)) {
      records.add(recordBuilder.build(gateText));
    }
    if (records.isEmpty()) {
      return Optional.empty();
    }

    Circuit circuit = Circuit.of(materializer.materialize(records.get(0)));
    for (GateRecord record : records.subList(1, records.size())) {
      circuit = circuit.append(materializer.materialize(record));
    }
    return Optional.of(circuit);
  }

  private static String abbreviate(String text) {
    if (text == null) {
      return "null";
    }
    String singleLine = text.replace("\n", "\\n");
    return singleLine.length() <= 80 ? singleLine : singleLine.substring(0, 77) + "...";
  }
}
