package quantmark.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import quantmark.parse.CircuitParser;

/** Handles the `validate` command. */
final class ValidateCommand {
  private static final Logger LOG = LoggerFactory.getLogger(ValidateCommand.class);

  private final InputStream in;
  private final PrintStream out;

  ValidateCommand(InputStream in, PrintStream out) {
    this.in = in;
    this.out = out;
  }

  int execute(String[] args) throws IOException {
    CliOptions options = CliParsers.parseOptions(args);
    String text = CliParsers.readCircuitText(options, in);
    boolean valid = CircuitParser.validateCircuitSyntax(text);
    LOG.debug("Validated {} character(s): {}", text.length(), valid);
    out.println(valid ? "valid" : "invalid");
    return valid ? ExitCodes.OK : ExitCodes.INVALID_INPUT;
  }
}
