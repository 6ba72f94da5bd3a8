package br.rio.confere.api;

import br.rio.confere.application.error.PersistenceException;
import br.rio.confere.application.pipeline.CancellationToken;
import br.rio.confere.application.pipeline.RunSummary;
import br.rio.confere.config.CompositionRoot;
import br.rio.confere.config.PipelineConfig;
import br.rio.confere.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import br.rio.confere.logging.LoggingConfigurator;
import br.rio.confere.validation.Paths;
import java.nio.file.Path;
import java.util.LinkedHashMap;
import java.util.Map;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for evaluating stored contract/publication pairs without browsing.
 */
public final class ConformityCli {
  private static final Logger log = LoggerFactory.getLogger(ConformityCli.class);
  private static final String SUMMARY_USAGE =
      "usage: conformity pairs=DIR out=DIR [runId=ID] [config=PATH] [metricsExporter=otlp|none]";
  private static final String HELP_TEXT = """
      CONFERE offline conformity evaluation

      Usage:
        conformity pairs=./pairs out=./out [options]

      Required:
        pairs=DIR                  Directory of <name>.pair.json documents {contract:{...}, publication:{...}}
        out=DIR                    Artifacts root; results go to DIR/<runId>

      Optional:
        runId=ID                   Run identifier (default run-<timestamp>)
        config=PATH                YAML file with 'common' and 'conformity' sections
        metricsExporter=otlp|none  Metrics exporter (default otlp)
        --verbose                  Enable DEBUG logging
        --help                     Show this message
      """;

  /** Evaluates the pairs of a directory; replaced in tests. */
  @FunctionalInterface
  interface ConformityLauncher {
    RunSummary launch(PipelineConfig config, Path pairs, CancellationToken cancellation);
  }

  private ConformityCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args);
    System.exit(exit.code());
  }

  static ExitCode run(String[] args) {
    return run(args, ConformityCli::launch);
  }

  static ExitCode run(String[] args, ConformityLauncher launcher) {
    CliInput input;
    try {
      input = CliInput.parse(args);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid argument: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_CONFIG;
    }
    if (input.help()) {
      CliPrinter.println(HELP_TEXT.stripTrailing());
      return ExitCode.SUCCESS;
    }
    if (input.verbose()) {
      LoggingConfigurator.enableVerboseLogging();
    }

    PipelineConfig config;
    Path pairs;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      Map<String, String> effective = ConfigCliUtils.effectiveConfig("conformity", kv, log);
      pairs = Paths.requireReadableDir("pairs", Path.of(effective.get("pairs").trim()));
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      config = PipelineConfig.fromMap(configInputs);
      Paths.validateWritableDir("out", config.outputDirectory(), true);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid conformity configuration: {}", ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_CONFIG;
    }

    try {
      log.info("Evaluating pairs from {} into {}", pairs, config.runDirectory());
      RunSummary summary = launcher.launch(config, pairs, new CancellationToken());
      RunCli.printSummary(summary, config);
      return ExitCode.SUCCESS;
    } catch (PersistenceException ex) {
      log.error("Persistence failure while writing {}", config.runDirectory(), ex);
      return ExitCode.SETUP_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in conformity evaluation", ex);
      return ExitCode.SETUP_FAILURE;
    }
  }

  private static RunSummary launch(PipelineConfig config, Path pairs, CancellationToken cancellation) {
    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.forRun(config.runId());
        CompositionRoot root = new CompositionRoot(config, metrics)) {
      return root.conformityOnlyUseCase(pairs).run(cancellation);
    }
  }
}
