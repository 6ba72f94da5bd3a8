package br.rio.confere.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

import br.rio.confere.application.error.PersistenceException;
import br.rio.confere.application.error.PortalUnavailableException;
import br.rio.confere.application.pipeline.RunSummary;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class RunCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private Level originalLevel;
  private boolean originalAdditive;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(RunCli.class);
    originalLevel = logger.getLevel();
    originalAdditive = logger.isAdditive();
    logger.setAdditive(false);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    logger.detachAppender(appender);
    appender.stop();
    logger.setAdditive(originalAdditive);
    logger.setLevel(originalLevel);
    CliPrinter.clearTestWriter();
    System.clearProperty("otel.metrics.exporter");
  }

  @Test
  void helpPrintsUsageAndSucceeds() {
    ExitCode code = RunCli.run(new String[] {"--help"}, false, failingLauncher());

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().startsWith("CONFERE conformity pipeline"));
  }

  @Test
  void malformedArgumentReturnsInvalidConfig() {
    ExitCode code = RunCli.run(new String[] {"runId"}, false, failingLauncher());

    assertEquals(ExitCode.INVALID_CONFIG, code);
    assertTrue(buffer.toString().contains("usage: run"));
    assertTrue(appender.list.stream().anyMatch(event -> event.getLevel() == Level.ERROR));
  }

  @Test
  void invalidValueReturnsInvalidConfig() {
    ExitCode code = RunCli.run(args("filterYear=1999"), false, failingLauncher());

    assertEquals(ExitCode.INVALID_CONFIG, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("filterYear"));
    assertTrue(logged);
  }

  @Test
  void resumeWithoutRunIdIsRejected() {
    ExitCode code = RunCli.run(
        new String[] {"out=" + tempDir.resolve("out"), "metricsExporter=none"}, true, failingLauncher());

    assertEquals(ExitCode.INVALID_CONFIG, code);
    boolean logged = appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("resume requires runId=ID"));
    assertTrue(logged);
  }

  @Test
  void dryRunPrintsPlanWithoutCreatingDirectories() {
    AtomicBoolean launched = new AtomicBoolean();
    ExitCode code = RunCli.run(append(args("max=4"), "--dry-run"), false, (config, resume, cancellation) -> {
      launched.set(true);
      return summary(false);
    });

    assertEquals(ExitCode.SUCCESS, code);
    assertFalse(launched.get());
    String output = buffer.toString();
    assertTrue(output.startsWith("CONFERE dry-run: no browser is started and no file is written."));
    assertTrue(output.contains(" Max companies     : 4"));
    assertFalse(Files.exists(tempDir.resolve("out")));
    assertFalse(Files.exists(tempDir.resolve("checkpoints")));
  }

  @Test
  void completedRunPrintsSummaryAndCreatesDirectories() {
    List<Boolean> resumeFlags = new ArrayList<>();
    ExitCode code = RunCli.run(append(args(), "--resume", "--headless"), false, (config, resume, cancellation) -> {
      resumeFlags.add(resume);
      assertTrue(config.headless());
      assertEquals("audit-1", config.runId());
      return summary(false);
    });

    assertEquals(ExitCode.SUCCESS, code);
    assertEquals(List.of(true), resumeFlags);
    assertTrue(Files.isDirectory(tempDir.resolve("out")));
    assertTrue(Files.isDirectory(tempDir.resolve("checkpoints")));
    assertTrue(Files.isDirectory(tempDir.resolve("tmp")));
    String output = buffer.toString();
    assertTrue(output.startsWith("Run audit-1"));
    assertTrue(output.contains("2 (conforme 1, parcial 0, nao conforme 1, publication not located 1)"));
  }

  @Test
  void cancelledRunExitsWithInterrupted() {
    ExitCode code = RunCli.run(args(), false, (config, resume, cancellation) -> summary(true));

    assertEquals(ExitCode.INTERRUPTED, code);
    assertTrue(buffer.toString().startsWith("Run audit-1 (cancelled)"));
    boolean hinted = appender.list.stream()
        .anyMatch(event -> event.getFormattedMessage().contains("resume runId=audit-1"));
    assertTrue(hinted);
  }

  @Test
  void unreachablePortalIsASetupFailure() {
    ExitCode code = RunCli.run(args(), false, (config, resume, cancellation) -> {
      throw new PortalUnavailableException("listing never loaded");
    });

    assertEquals(ExitCode.SETUP_FAILURE, code);
  }

  @Test
  void persistenceFailureIsASetupFailure() {
    ExitCode code = RunCli.run(args(), false, (config, resume, cancellation) -> {
      throw new PersistenceException("disk full", null);
    });

    assertEquals(ExitCode.SETUP_FAILURE, code);
  }

  @Test
  void argumentErrorDuringTheRunIsNotReportedAsInvalidConfig() {
    ExitCode code = RunCli.run(args(), false, (config, resume, cancellation) -> {
      throw new IllegalArgumentException("unexpected value from the portal");
    });

    assertEquals(ExitCode.SETUP_FAILURE, code);
  }

  @Test
  void missingCsvSeedIsInvalidConfig() {
    ExitCode code = RunCli.run(
        append(args(), "--csv", tempDir.resolve("absent.csv").toString()), false, failingLauncher());

    assertEquals(ExitCode.INVALID_CONFIG, code);
  }

  private String[] args(String... extra) {
    String[] base = {
        "runId=audit-1",
        "out=" + tempDir.resolve("out"),
        "checkpointDir=" + tempDir.resolve("checkpoints"),
        "tempDir=" + tempDir.resolve("tmp"),
        "metricsExporter=none"};
    return append(base, extra);
  }

  private static String[] append(String[] base, String... extra) {
    String[] all = new String[base.length + extra.length];
    System.arraycopy(base, 0, all, 0, base.length);
    System.arraycopy(extra, 0, all, base.length, extra.length);
    return all;
  }

  private static RunCli.PipelineLauncher failingLauncher() {
    return (config, resume, cancellation) -> {
      throw new AssertionError("pipeline must not start");
    };
  }

  private static RunSummary summary(boolean cancelled) {
    Instant now = Instant.parse("2025-03-01T12:00:00Z");
    return new RunSummary("audit-1", now, now.plusSeconds(60), cancelled, 2, 2, 0, 3, 0,
        new RunSummary.Processed(1, 0, 1, 1), new RunSummary.Skipped(0, 1, 0, 0), List.of());
  }
}
