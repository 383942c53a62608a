package ca.gc.cra.sentinel.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.PrintWriter;
import java.io.StringWriter;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class MainTest {
  @TempDir Path tempDir;

  private StringWriter buffer;

  @BeforeEach
  void setUp() {
    buffer = new StringWriter();
    CliPrinter.setWriterForTesting(new PrintWriter(buffer));
  }

  @AfterEach
  void tearDown() {
    CliPrinter.clearTestWriter();
  }

  @Test
  void helpWithoutCommandPrintsDispatcherHelp() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"--help"}));
    assertTrue(buffer.toString().contains("SENTINEL threat and alert registry"));
  }

  @Test
  void missingCommandIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[0]));
    assertTrue(buffer.toString().contains("usage: sentinel"));
  }

  @Test
  void unknownCommandIsInvalidArgs() {
    assertEquals(ExitCode.INVALID_ARGS, Main.run(new String[] {"capture"}));
  }

  @Test
  void replayCommandReceivesItsOwnFlags() {
    assertEquals(ExitCode.SUCCESS, Main.run(new String[] {"replay", "--help"}));
    assertTrue(buffer.toString().contains("SENTINEL mutation-log replay"));
  }

  @Test
  void replayCommandRunsLog() throws Exception {
    Path log = tempDir.resolve("one.ndjson");
    Files.writeString(log, "{\"op\":\"setEmergencyThreshold\",\"caller\":\"owner\",\"threshold\":5}\n");

    ExitCode code = Main.run(new String[] {"Replay", "log=" + log, "eventSink=NONE"});

    assertEquals(ExitCode.SUCCESS, code);
    assertTrue(buffer.toString().contains("Replay complete: applied=1 rejected=0"), buffer::toString);
  }
}
