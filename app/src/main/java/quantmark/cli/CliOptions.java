package quantmark.cli;

import java.util.List;

record CliOptions(String circuitFile, List<String> batchFiles, boolean json) {

  CliOptions {
    batchFiles = batchFiles == null ? List.of() : List.copyOf(batchFiles);
  }

  boolean hasCircuitFile() {
    return circuitFile != null && !circuitFile.isBlank();
  }

  static Builder builder() {
    return new Builder();
  }

  static final class Builder {
    private String circuitFile;
    private List<String> batchFiles = List.of();
    private boolean json;

    Builder circuitFile(String circuitFile) {
      this.circuitFile = circuitFile;
      return this;
    }

    Builder batchFiles(List<String> batchFiles) {
      if (batchFiles != null) {
        this.batchFiles = List.copyOf(batchFiles);
      }
      return this;
    }

    Builder json(boolean json) {
      this.json = json;
      return this;
    }

    CliOptions build() {
      if (circuitFile != null && !circuitFile.isBlank() && !batchFiles.isEmpty()) {
        throw new IllegalArgumentException("Provide at most one of --file or --files");
      }
      return new CliOptions(circuitFile, batchFiles, json);
    }
  }
}
