package quantmark.parse;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import quantmark.circuit.GateKind;
import quantmark.circuit.GateParameter;
import quantmark.parse.errors.MalformedFieldException;
import quantmark.parse.errors.UnsupportedGateKindException;

/** Turns the text of one printed gate into a {@link GateRecord}. */
public final class GateRecordBuilder {

  /**
   * Builds the record for {@code gateText}. Controls are read only when a control field is present;
   * the parameter is read only for kinds that take one.
   *
   * @throws UnsupportedGateKindException if the leading name is unknown
   * @throws MalformedFieldException if a required field is missing or unreadable
   */
  public GateRecord build(String gateText) {
    int open = gateText.indexOf('(');
    if (open <= 0) {
      throw new MalformedFieldException("name", gateText, gateText);
    }
    String name = gateText.substring(0, open);
    GateKind kind =
        GateKind.fromPrintedName(name).orElseThrow(() -> new UnsupportedGateKindException(name));

    List<Integer> targets = GateFields.qubitList(gateText, GateFields.TARGET);
    Set<Integer> controls = Set.of();
    if (GateFields.hasField(gateText, GateFields.CONTROL)) {
      controls = new LinkedHashSet<>(GateFields.qubitList(gateText, GateFields.CONTROL));
    }
    GateParameter parameter = null;
    if (kind.parametrized()) {
      parameter = GateFields.parameter(gateText);
    }
    return new GateRecord(kind, targets, controls, parameter);
  }
}
