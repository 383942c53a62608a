package ca.gc.cra.sentinel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import ca.gc.cra.sentinel.testing.MutableClock;
import ca.gc.cra.sentinel.testing.RecordingMetricsPort;
import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;
import ch.qos.logback.classic.spi.ILoggingEvent;
import ch.qos.logback.core.read.ListAppender;
import java.io.InputStream;
import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.slf4j.LoggerFactory;

class ReplayCliTest {
  @TempDir Path tempDir;

  private ListAppender<ILoggingEvent> appender;
  private Logger logger;
  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    logger = (Logger) LoggerFactory.getLogger(ReplayCli.class);
    appender = new ListAppender<>();
    appender.start();
    logger.addAppender(appender);
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    if (logger != null && appender != null) {
      logger.detachAppender(appender);
    }
    CliPrinter.clearTestWriter();
  }

  @Test
  void replayPrintsSummaryAndStatistics() throws Exception {
    Path log = copyFixture();
    RecordingMetricsPort metrics = new RecordingMetricsPort();

    ExitCode code = ReplayCli.run(new String[] {"log=" + log, "eventSink=NONE"}, new MutableClock(), metrics);

    assertEquals(ExitCode.SUCCESS, code);
    String out = buffer.toString();
    assertTrue(out.contains("Replay complete: applied=9 rejected=2"), out);
    assertTrue(out.contains(" line 11 verifyThreat: ALREADY_VERIFIED"), out);
    assertTrue(out.contains(" line 13 registerThreat: UNAUTHORIZED"), out);
    assertTrue(out.contains("Threats: total=2 active=0 resolved=0 verified=1 critical=1"), out);
    assertTrue(out.contains("Alerts: total=1 delivered=1 failed=0 pending=0 emergency=1 avgDeliveryMillis=0 "
        + "successRate=100.0%"), out);
    assertEquals(2L, metrics.count("threat.registered"));
  }

  @Test
  void strictReplayHaltsWithRuntimeFailure() throws Exception {
    Path log = copyFixture();

    ExitCode code = ReplayCli.run(new String[] {"log=" + log, "eventSink=NONE", "--strict"},
        new MutableClock(), null);

    assertEquals(ExitCode.RUNTIME_FAILURE, code);
    assertTrue(buffer.toString().contains("Replay halted: applied=8 rejected=1"), buffer::toString);
  }

  @Test
  void yamlConfigFeedsEngineAndCliOverrides() throws Exception {
    Path log = tempDir.resolve("threshold.ndjson");
    Files.writeString(log, """
        {"op":"createAlert","caller":"coast-guard","threatId":1,"message":"m","severity":2,"channels":["WEB"],"recipients":["r"]}
        """);
    Path config = tempDir.resolve("sentinel.yaml");
    Files.writeString(config, """
        common:
          owner: coast-guard
        replay:
          emergencyThreshold: 2
          eventSink: LOG
        """);

    ExitCode code = ReplayCli.run(new String[] {"log=" + log, "config=" + config, "eventSink=NONE"},
        new MutableClock(), null);

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("emergency=1"), buffer::toString);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.WARN
            && event.getFormattedMessage().contains("CLI overrides YAML for key: eventSink")));
  }

  @Test
  void missingLogIsInvalidArgs() {
    ExitCode code = ReplayCli.run(new String[] {"eventSink=NONE"}, new MutableClock(), null);

    assertEquals(ExitCode.INVALID_ARGS, code);
    assertTrue(buffer.toString().contains("usage: replay"));
  }

  @Test
  void malformedArgumentIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, ReplayCli.run(new String[] {"log"}, new MutableClock(), null));
  }

  @Test
  void unreadableLogIsIoError() {
    ExitCode code = ReplayCli.run(new String[] {"log=" + tempDir.resolve("absent.ndjson"), "eventSink=NONE"},
        new MutableClock(), null);
    assertEquals(ExitCode.IO_ERROR, code);
  }

  @Test
  void missingConfigFileIsConfigError() throws Exception {
    Path log = copyFixture();
    ExitCode code = ReplayCli.run(new String[] {"log=" + log, "config=" + tempDir.resolve("none.yaml")},
        new MutableClock(), null);
    assertEquals(ExitCode.CONFIG_ERROR, code);
  }

  @Test
  void invalidConfigValueIsConfigError() throws Exception {
    Path log = copyFixture();

    ExitCode code = ReplayCli.run(new String[] {"log=" + log, "emergencyThreshold=9"}, new MutableClock(), null);

    assertEquals(ExitCode.CONFIG_ERROR, code);
    assertTrue(appender.list.stream()
        .anyMatch(event -> event.getLevel() == Level.ERROR
            && event.getFormattedMessage().contains("Invalid replay configuration")));
  }

  @Test
  void kafkaSinkWithoutBootstrapIsConfigError() throws Exception {
    Path log = copyFixture();
    assertEquals(ExitCode.CONFIG_ERROR,
        ReplayCli.run(new String[] {"log=" + log, "eventSink=KAFKA"}, new MutableClock(), null));
  }

  @Test
  void helpPrintsUsage() {
    assertEquals(ExitCode.SUCCESS, ReplayCli.run(new String[] {"--help"}, new MutableClock(), null));
    assertTrue(buffer.toString().contains("SENTINEL mutation-log replay"));
  }

  private Path copyFixture() throws Exception {
    Path target = tempDir.resolve("hurricane.ndjson");
    try (InputStream in = ReplayCliTest.class.getResourceAsStream("/replay/hurricane.ndjson")) {
      Files.copy(in, target);
    }
    return target;
  }
}
