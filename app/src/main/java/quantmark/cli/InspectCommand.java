package quantmark.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Optional;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import quantmark.circuit.Circuit;
import quantmark.core.CircuitInfo;
import quantmark.parse.CircuitParser;
import quantmark.parse.errors.CircuitFormatException;

/** Handles the `inspect` command: parse one circuit and report its size. */
final class InspectCommand {
  private static final Logger LOG = LoggerFactory.getLogger(InspectCommand.class);

  private final InputStream in;
  private final PrintStream out;
  private final JsonReportBuilder reportBuilder = new JsonReportBuilder();

  InspectCommand(InputStream in, PrintStream out) {
    this.in = in;
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parseOptions(args);
    String text = CliParsers.readCircuitText(options, in);

    long startedAt = System.nanoTime();
    Optional<Circuit> parsed;
    try {
      parsed = CircuitParser.parseCircuit(text);
    } catch (CircuitFormatException ex) {
      LOG.error("Failed to parse circuit: {}", ex.getMessage());
      return ExitCodes.INVALID_INPUT;
    }
    long elapsedMs = (System.nanoTime() - startedAt) / 1_000_000L;

    if (parsed.isEmpty()) {
      LOG.warn("Circuit has no gates; nothing to inspect.");
      return ExitCodes.NO_GATES;
    }
    Circuit circuit = parsed.get();
    LOG.info("Parsed {} gate(s) in {} ms", circuit.gateCount(), elapsedMs);

    if (options.json()) {
      out.println(reportBuilder.build(circuit, elapsedMs));
    } else {
      out.print(new CircuitInfo(circuit));
    }
    return ExitCodes.OK;
  }
}
