package quantmark.cli;

import java.io.IOException;
import java.io.PrintStream;
import java.util.List;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import quantmark.circuit.Circuit;
import quantmark.core.CircuitInfo;
import quantmark.parse.CircuitParser;
import quantmark.parse.errors.CircuitFormatException;

/**
 * Handles the `batch` command.
 *
 * <p>Each file is parsed independently on the common pool; a file that fails is reported and the
 * rest of the batch continues.
 */
final class BatchCommand {
  private static final Logger LOG = LoggerFactory.getLogger(BatchCommand.class);

  private final PrintStream out;
  private final JsonReportBuilder reportBuilder = new JsonReportBuilder();

  BatchCommand(PrintStream out) {
    this.out = out;
  }

  int execute(String[] args) {
    CliOptions options = CliParsers.parseOptions(args);
    List<String> files = options.batchFiles();
    if (files.isEmpty()) {
      throw new IllegalArgumentException("batch requires --files a,b,c");
    }

    long startedAt = System.nanoTime();
    List<BatchResult> results = files.parallelStream().map(this::parseFile).toList();
    long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000L;

    long failures = results.stream().filter(BatchResult::isFailed).count();
    LOG.info("Parsed {} file(s) in {} ms, {} failed", results.size(), elapsedMs, failures);

    if (options.json()) {
      out.println(reportBuilder.buildBatch(results));
    } else {
      results.forEach(result -> out.println(result.summaryLine()));
    }
    return failures == 0 ? ExitCodes.OK : ExitCodes.INVALID_INPUT;
  }

  private BatchResult parseFile(String file) {
    try {
      String text = CliParsers.readCircuitFile(file);
      Optional<Circuit> circuit = CircuitParser.parseCircuit(text);
      return circuit
          .map(c -> BatchResult.parsed(file, new CircuitInfo(c)))
          .orElseGet(() -> BatchResult.noGates(file));
    } catch (IOException | IllegalArgumentException | CircuitFormatException ex) {
      LOG.warn("Skipping {}: {}", file, ex.getMessage());
      return BatchResult.failed(file, ex.getMessage());
    }
  }
}
