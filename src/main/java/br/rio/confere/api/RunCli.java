package br.rio.confere.api;

import br.rio.confere.application.error.ConfereException;
import br.rio.confere.application.error.PersistenceException;
import br.rio.confere.application.error.PortalUnavailableException;
import br.rio.confere.application.pipeline.CancellationToken;
import br.rio.confere.application.pipeline.RunSummary;
import br.rio.confere.config.CompositionRoot;
import br.rio.confere.config.PipelineConfig;
import br.rio.confere.infrastructure.metrics.OpenTelemetryMetricsAdapter;
import br.rio.confere.logging.LoggingConfigurator;
import br.rio.confere.validation.Paths;
import java.time.Duration;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the full conformity pipeline ({@code run}) and for continuing an interrupted run
 * ({@code resume}).
 *
 * <p>A JVM shutdown hook requests cooperative cancellation; the pipeline finishes its current unit, flushes
 * the checkpoint, and the process exits with {@link ExitCode#INTERRUPTED}.</p>
 */
public final class RunCli {
  private static final Logger log = LoggerFactory.getLogger(RunCli.class);
  private static final Duration SHUTDOWN_GRACE = Duration.ofSeconds(60);
  private static final String SUMMARY_USAGE =
      "usage: run [--max N] [--csv PATH] [--headless] [--resume runId=ID] [--dry-run] [config=PATH] [key=value ...]";
  private static final String HELP_TEXT = """
      CONFERE conformity pipeline

      Usage:
        run [options]
        resume runId=ID [options]

      Options:
        --max N | max=N              Process at most N companies (0 = all)
        --csv PATH | csv=PATH        Read the company listing from a CSV seed instead of the portal
        --headless                   Run browsers headless (manual CAPTCHA resolution unavailable)
        --resume                     Continue the run named by runId=ID from its checkpoint
        --dry-run                    Validate configuration and print the plan without browsing
        config=PATH                  YAML file with 'common' and 'run' sections
        filterYear=YYYY              Contract year listed by the portal (default current year)
        runId=ID                     Run identifier [A-Za-z0-9._-] (default run-<timestamp>)
        out=DIR                      Artifacts root; results go to DIR/<runId>
        checkpointDir=DIR            Checkpoint directory
        tempDir=DIR                  Scratch directory for downloaded documents
        timeoutSeconds=N             Page and HTTP timeout (default 10)
        captchaManualTimeoutSeconds=N  Wait for a person to solve a CAPTCHA (default 300)
        extractionEndpoint=URL       OpenAI-compatible chat-completions endpoint
        extractionModel=NAME         Extraction model
        extractionApiKeyEnv=VAR      Environment variable holding the API key (default GROQ_API_KEY)
        metricsExporter=otlp|none    Metrics exporter (default otlp)
        otelEndpoint=URL             OTLP metrics endpoint
        --verbose                    Enable DEBUG logging
        --help                       Show this message

      Exit codes: 0 completed (skips included), 1 setup failure, 2 invalid configuration, 130 interrupted.
      """;

  /** Runs the pipeline for an effective configuration; replaced in tests. */
  @FunctionalInterface
  interface PipelineLauncher {
    RunSummary launch(PipelineConfig config, boolean resume, CancellationToken cancellation)
        throws InterruptedException;
  }

  private RunCli() {}

  public static void main(String[] args) {
    ExitCode exit = run(args, false);
    System.exit(exit.code());
  }

  /**
   * Executes the run or resume command.
   *
   * @param args raw CLI arguments
   * @param resumeMode whether the command was invoked as {@code resume}
   * @return exit code capturing the outcome
   */
  static ExitCode run(String[] args, boolean resumeMode) {
    return run(args, resumeMode, RunCli::launchPipeline);
  }

  static ExitCode run(String[] args, boolean resumeMode, PipelineLauncher launcher) {
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
      log.debug("Verbose logging enabled for run CLI");
    }

    boolean resume = resumeMode || input.hasFlag("--resume");
    String mode = resume ? "resume" : "run";

    PipelineConfig config;
    boolean dryRun;
    try {
      Map<String, String> kv = new LinkedHashMap<>(CliArgsParser.toMap(input.keyValueArgs()));
      if (input.hasFlag("--headless")) {
        kv.put("headless", "true");
      }
      Map<String, String> effective = ConfigCliUtils.effectiveConfig(mode, kv, log);
      dryRun = input.hasFlag("--dry-run") || ConfigCliUtils.parseBoolean(effective, "dryRun");
      Map<String, String> configInputs = new LinkedHashMap<>(effective);
      TelemetryConfigurator.configureMetrics(configInputs);
      config = validate(PipelineConfig.fromMap(configInputs), !dryRun);
    } catch (IllegalArgumentException ex) {
      log.error("Invalid {} configuration: {}", mode, ex.getMessage());
      CliPrinter.println(SUMMARY_USAGE);
      return ExitCode.INVALID_CONFIG;
    }

    if (dryRun) {
      printDryRunPlan(config, resume);
      return ExitCode.SUCCESS;
    }

    CancellationToken cancellation = new CancellationToken();
    CountDownLatch finished = new CountDownLatch(1);
    Thread hook = new Thread(() -> {
      log.warn("Shutdown requested; finishing the current unit and flushing the checkpoint");
      cancellation.cancel();
      try {
        if (!finished.await(SHUTDOWN_GRACE.toMillis(), TimeUnit.MILLISECONDS)) {
          log.warn("Pipeline did not stop within {}s", SHUTDOWN_GRACE.toSeconds());
        }
      } catch (InterruptedException ex) {
        Thread.currentThread().interrupt();
      }
    }, "confere-shutdown");
    Runtime.getRuntime().addShutdownHook(hook);

    try {
      log.info("Starting {} {} (filterYear={}, max={}, out={})",
          mode, config.runId(), config.filterYear(), config.maxCompanies(), config.runDirectory());
      RunSummary summary = launcher.launch(config, resume, cancellation);
      printSummary(summary, config);
      if (summary.cancelled()) {
        log.warn("Run {} cancelled; resume with: resume runId={}", config.runId(), config.runId());
        return ExitCode.INTERRUPTED;
      }
      return ExitCode.SUCCESS;
    } catch (InterruptedException ex) {
      Thread.currentThread().interrupt();
      log.error("Run {} interrupted; shutting down", config.runId(), ex);
      return ExitCode.INTERRUPTED;
    } catch (PortalUnavailableException ex) {
      log.error("Portal unavailable: {}", ex.getMessage(), ex);
      return ExitCode.SETUP_FAILURE;
    } catch (PersistenceException ex) {
      log.error("Persistence failure; run {} stopped", config.runId(), ex);
      return ExitCode.SETUP_FAILURE;
    } catch (ConfereException ex) {
      log.error("Run {} could not start: {}", config.runId(), ex.getMessage(), ex);
      return ExitCode.SETUP_FAILURE;
    } catch (RuntimeException ex) {
      log.error("Unexpected runtime failure in run {}", config.runId(), ex);
      return ExitCode.SETUP_FAILURE;
    } finally {
      finished.countDown();
      removeHook(hook);
    }
  }

  private static RunSummary launchPipeline(
      PipelineConfig config, boolean resume, CancellationToken cancellation) throws InterruptedException {
    try (OpenTelemetryMetricsAdapter metrics = OpenTelemetryMetricsAdapter.forRun(config.runId());
        CompositionRoot root = new CompositionRoot(config, metrics)) {
      return root.pipelineUseCase().run(resume, cancellation);
    }
  }

  static PipelineConfig validate(PipelineConfig config, boolean createDirectories) {
    Paths.validateWritableDir("out", config.outputDirectory(), createDirectories);
    Paths.validateWritableDir("checkpointDir", config.checkpointDirectory(), createDirectories);
    Paths.validateWritableDir("tempDir", config.tempDirectory(), createDirectories);
    config.csvSeed().ifPresent(csv -> Paths.requireReadableFile("csv", csv));
    return config;
  }

  private static void removeHook(Thread hook) {
    try {
      Runtime.getRuntime().removeShutdownHook(hook);
    } catch (IllegalStateException ex) {
      log.debug("JVM shutdown in progress; hook stays registered");
    }
  }

  private static void printDryRunPlan(PipelineConfig config, boolean resume) {
    CliPrinter.printLines(
        "CONFERE dry-run: no browser is started and no file is written.",
        " Mode              : " + (resume ? "resume" : "run"),
        " Run id            : " + config.runId(),
        " Filter year       : " + config.filterYear(),
        " Max companies     : " + (config.maxCompanies() == 0 ? "all" : config.maxCompanies()),
        " Company source    : " + config.csvSeed().map(Object::toString).orElse(config.portalUrl()),
        " Gazette search    : " + config.gazetteUrl(),
        " Headless          : " + config.headless(),
        " Timeout           : " + config.timeout().toSeconds() + "s",
        " Extraction        : " + config.extractionModel() + " @ " + config.extractionEndpoint(),
        " API key variable  : " + config.extractionApiKeyEnv(),
        " Run directory     : " + config.runDirectory(),
        " Checkpoint dir    : " + config.checkpointDirectory(),
        " Re-run without --dry-run to start the pipeline.");
  }

  static void printSummary(RunSummary summary, PipelineConfig config) {
    RunSummary.Processed processed = summary.processed();
    RunSummary.Skipped skipped = summary.skipped();
    CliPrinter.printLines(
        "Run " + summary.runId() + (summary.cancelled() ? " (cancelled)" : ""),
        " Companies         : " + summary.companiesCompleted() + " completed, "
            + summary.companiesResumed() + " resumed, " + summary.companiesListed() + " listed",
        " Processos         : " + summary.processosDiscovered() + " discovered",
        " Processed         : " + processed.total() + " (conforme " + processed.conforme()
            + ", parcial " + processed.parcial() + ", nao conforme " + processed.naoConforme()
            + ", publication not located " + processed.notLocated() + ")",
        " Skipped           : " + skipped.total() + " (captcha " + skipped.captcha()
            + ", timeout " + skipped.timeout() + ", parse error " + skipped.parseError()
            + ", extraction " + skipped.extraction() + ")",
        " Results           : " + config.runDirectory());
  }
}
