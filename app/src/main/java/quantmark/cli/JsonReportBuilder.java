package quantmark.cli;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import quantmark.circuit.Circuit;
import quantmark.circuit.Gate;
import quantmark.core.CircuitInfo;

final class JsonReportBuilder {
  private static final String VERSION = "1.0.0";
  private final Gson gson = new GsonBuilder().setPrettyPrinting().create();

  String build(Circuit circuit, long elapsedMs) {
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("meta", meta(elapsedMs));
    root.putAll(summary(new CircuitInfo(circuit)));
    root.put("parameters", new ArrayList<>(circuit.parameters()));
    List<String> gates = new ArrayList<>(circuit.gateCount());
    for (Gate gate : circuit.gates()) {
      gates.add(gate.toString());
    }
    root.put("gates", gates);
    return gson.toJson(root);
  }

  String buildBatch(List<BatchResult> results) {
    List<Map<String, Object>> entries = new ArrayList<>(results.size());
    for (BatchResult result : results) {
      Map<String, Object> entry = new LinkedHashMap<>();
      entry.put("file", result.file());
      if (result.isFailed()) {
        entry.put("status", "failed");
        entry.put("error", result.error());
      } else if (result.info() == null) {
        entry.put("status", "no_gates");
      } else {
        entry.put("status", "parsed");
        entry.putAll(summary(result.info()));
      }
      entries.add(entry);
    }
    Map<String, Object> root = new LinkedHashMap<>();
    root.put("version", VERSION);
    root.put("circuits", entries);
    return gson.toJson(root);
  }

  private Map<String, Object> meta(long elapsedMs) {
    Map<String, Object> meta = new LinkedHashMap<>();
    meta.put("version", VERSION);
    meta.put("time_ms", elapsedMs);
    return meta;
  }

  private Map<String, Object> summary(CircuitInfo info) {
    Map<String, Object> summary = new LinkedHashMap<>();
    summary.put("qubit_count", info.qubitCount());
    summary.put("gate_depth", info.gateDepth());
    summary.put("gate_count", info.gateCount());
    summary.put("parameter_count", info.parameterCount());
    return summary;
  }
}
