package quantmark.cli;

import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.Arrays;
import java.util.Locale;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Command line entry point.
 *
 * <p>Usage:
 *
 * <ul>
 *   <li>{@code validate [--file F]} — check circuit text from a file or stdin
 *   <li>{@code inspect [--file F] [--json]} — parse a circuit and print its size
 *   <li>{@code batch --files a,b,c [--json]} — inspect several circuit files
 * </ul>
 */
public final class Main {
  private static final Logger LOG = LoggerFactory.getLogger(Main.class);

  private Main() {}

  public static void main(String[] args) {
    System.exit(run(args, System.in, System.out));
  }

  static int run(String[] args, InputStream in, PrintStream out) {
    if (args == null || args.length == 0) {
      printUsage(out);
      return ExitCodes.INVALID_INPUT;
    }
    String command = args[0].toLowerCase(Locale.ROOT);
    String[] rest = Arrays.copyOfRange(args, 1, args.length);
    try {
      return switch (command) {
        case "validate" -> new ValidateCommand(in, out).execute(rest);
        case "inspect" -> new InspectCommand(in, out).execute(rest);
        case "batch" -> new BatchCommand(out).execute(rest);
        case "help", "--help", "-h" -> {
          printUsage(out);
          yield ExitCodes.OK;
        }
        default -> throw new IllegalArgumentException("Unknown command: " + args[0]);
      };
    } catch (IllegalArgumentException ex) {
      LOG.error(ex.getMessage());
      printUsage(out);
      return ExitCodes.INVALID_INPUT;
    } catch (IOException ex) {
      LOG.error("Failed to read circuit: {}", ex.getMessage());
      return ExitCodes.IO_FAILURE;
    }
  }

  private static void printUsage(PrintStream out) {
    out.println("Usage:");
    out.println("  validate [--file F]             check circuit syntax (stdin if no file)");
    out.println("  inspect [--file F] [--json]     print qubit count, depth, gates, parameters");
    out.println("  batch --files a,b,c [--json]    inspect several circuit files");
  }
}
