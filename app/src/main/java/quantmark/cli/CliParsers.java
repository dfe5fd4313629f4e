package quantmark.cli;

import com.google.common.base.Splitter;
import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.BiConsumer;
import java.util.function.Consumer;

/** Shared helpers for CLI argument parsing and circuit loading. */
final class CliParsers {
  private static final Map<String, OptionSpec> OPTION_SPECS = optionSpecs();

  private CliParsers() {}

  static CliOptions parseOptions(String[] args) {
    CliOptions.Builder builder = CliOptions.builder();
    for (int i = 0; i < args.length; i++) {
      ParsedArg parsed = ParsedArg.parse(args[i]);
      OptionSpec spec = OPTION_SPECS.get(parsed.option());
      if (spec == null) {
        throw new IllegalArgumentException("Unknown option: " + args[i]);
      }

      String value = parsed.value();
      if (spec.requiresValue() && (value == null || value.isBlank())) {
        if (i + 1 >= args.length) {
          throw new IllegalArgumentException("Missing value for " + parsed.option());
        }
        value = args[++i];
      }
      spec.apply(builder, value);
    }
    return builder.build();
  }

  static List<String> parseFileList(String raw) {
    if (raw == null || raw.isBlank()) {
      throw new IllegalArgumentException("No files provided.");
    }
    List<String> files = Splitter.on(',').trimResults().omitEmptyStrings().splitToList(raw);
    if (files.isEmpty()) {
      throw new IllegalArgumentException("No files provided.");
    }
    return files;
  }

  /** Reads circuit text from {@code --file} when given, otherwise from {@code stdin}. */
  static String readCircuitText(CliOptions options, InputStream stdin) throws IOException {
    if (options.hasCircuitFile()) {
      return readCircuitFile(options.circuitFile());
    }
    return new String(stdin.readAllBytes(), StandardCharsets.UTF_8);
  }

  static String readCircuitFile(String circuitFile) throws IOException {
    Path path = Path.of(circuitFile);
    if (!Files.exists(path)) {
      throw new IllegalArgumentException("Circuit file not found: " + path);
    }
    return Files.readString(path);
  }

  private static Map<String, OptionSpec> optionSpecs() {
    Map<String, OptionSpec> specs = new LinkedHashMap<>();
    specs.put("--file", OptionSpec.withValue((b, raw) -> b.circuitFile(raw)));
    specs.put("--files", OptionSpec.withValue((b, raw) -> b.batchFiles(parseFileList(raw))));
    specs.put("--json", OptionSpec.flag(b -> b.json(true)));
    return Map.copyOf(specs);
  }

  private record ParsedArg(String option, String value) {
    static ParsedArg parse(String raw) {
      if (raw == null || raw.isBlank()) {
        throw new IllegalArgumentException("Unknown option: " + raw);
      }
      if (raw.startsWith("--")) {
        int equalsIndex = raw.indexOf('=');
        if (equalsIndex > 0) {
          String option = raw.substring(0, equalsIndex);
          String value = raw.substring(equalsIndex + 1);
          return new ParsedArg(option, value.isEmpty() ? null : value);
        }
      }
      return new ParsedArg(raw, null);
    }
  }

  private record OptionSpec(boolean requiresValue, BiConsumer<CliOptions.Builder, String> apply) {
    static OptionSpec withValue(BiConsumer<CliOptions.Builder, String> consumer) {
      return new OptionSpec(true, consumer);
    }

    static OptionSpec flag(Consumer<CliOptions.Builder> consumer) {
      return new OptionSpec(false, (builder, ignored) -> consumer.accept(builder));
    }

    void apply(CliOptions.Builder builder, String value) {
      apply.accept(builder, value);
    }
  }
}
