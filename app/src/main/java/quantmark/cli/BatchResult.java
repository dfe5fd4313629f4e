package quantmark.cli;

import quantmark.core.CircuitInfo;

/** Outcome of parsing one file in a batch: an info summary, no gates, or an error message. */
record BatchResult(String file, CircuitInfo info, String error) {

  static BatchResult parsed(String file, CircuitInfo info) {
    return new BatchResult(file, info, null);
  }

  static BatchResult noGates(String file) {
    return new BatchResult(file, null, null);
  }

  static BatchResult failed(String file, String error) {
    return new BatchResult(file, null, error);
  }

  boolean isFailed() {
    return error != null;
  }

  String summaryLine() {
    if (isFailed()) {
      return file + ": FAILED (" + error + ")";
    }
    if (info == null) {
      return file + ": no gates";
    }
    return String.format(
        "%s: qubits=%d depth=%d gates=%d parameters=%d",
        file, info.qubitCount(), info.gateDepth(), info.gateCount(), info.parameterCount());
  }
}
