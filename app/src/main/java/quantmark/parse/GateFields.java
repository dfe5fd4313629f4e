package quantmark.parse;

import com.google.common.base.Splitter;
import com.google.common.primitives.Doubles;
import com.google.common.primitives.Ints;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Pattern;
import quantmark.circuit.GateParameter;
import quantmark.parse.errors.MalformedFieldException;

/** Pulls individual fields out of the text of a single printed gate. */
public final class GateFields {
  public static final String TARGET = "target";
  public static final String CONTROL = "control";
  public static final String PARAMETER = "parameter";

  private static final Pattern NUMBER = Pattern.compile(GateParameter.NUMBER_REGEX);
  private static final Pattern SYMBOL = Pattern.compile(GateParameter.SYMBOL_REGEX);
  private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults();

  private GateFields() {}

  /** Returns whether the gate text carries a {@code field=} entry. */
  public static boolean hasField(String gateText, String field) {
    return gateText.contains(field + "=");
  }

  /**
   * Reads the bracketed qubit list of {@code field}, e.g. {@code control=(3,)} gives {@code [3]}. A
   * single trailing separator is allowed.
   */
  public static List<Integer> qubitList(String gateText, String field) {
    String content = fieldContent(gateText, field + "=(", field);
    List<String> parts = new ArrayList<>(LIST_SPLITTER.splitToList(content));
    if (!parts.isEmpty() && parts.get(parts.size() - 1).isEmpty()) {
      parts.remove(parts.size() - 1);
    }
    if (parts.isEmpty()) {
      throw new MalformedFieldException(field, content, gateText);
    }
    List<Integer> qubits = new ArrayList<>(parts.size());
    for (String part : parts) {
      Integer qubit = Ints.tryParse(part);
      if (qubit == null || qubit < 0) {
        throw new MalformedFieldException(field, part, gateText);
      }
      qubits.add(qubit);
    }
    return qubits;
  }

  /**
   * Reads the {@code parameter=} entry. Numeric text becomes a fixed angle and must fit a finite
   * double; a bare name such as {@code theta} is kept as a symbolic parameter.
   */
  public static GateParameter parameter(String gateText) {
    String token = fieldContent(gateText, PARAMETER + "=", PARAMETER).trim();
    if (NUMBER.matcher(token).matches()) {
      Double value = Doubles.tryParse(token);
      if (value == null || !Double.isFinite(value)) {
        throw new MalformedFieldException(PARAMETER, token, gateText);
      }
      return GateParameter.numeric(value);
    }
    if (SYMBOL.matcher(token).matches()) {
      return GateParameter.symbolic(token);
    }
    throw new MalformedFieldException(PARAMETER, token, gateText);
  }

  private static String fieldContent(String gateText, String opener, String field) {
    int start = gateText.indexOf(opener);
    if (start < 0) {
      throw new MalformedFieldException(field, "", gateText);
    }
    start += opener.length();
    int end = gateText.indexOf(')', start);
    if (end < 0) {
      throw new MalformedFieldException(field, gateText.substring(start), gateText);
    }
    return gateText.substring(start, end);
  }
}
