package ca.gc.cra.sentinel.application.replay;

import ca.gc.cra.sentinel.application.access.AccessControl;
import ca.gc.cra.sentinel.application.registry.AlertDraft;
import ca.gc.cra.sentinel.application.registry.AlertRegistry;
import ca.gc.cra.sentinel.application.registry.RegistryError;
import ca.gc.cra.sentinel.application.registry.RegistryException;
import ca.gc.cra.sentinel.application.registry.ThreatRegistry;
import ca.gc.cra.sentinel.application.registry.ThreatSubmission;
import ca.gc.cra.sentinel.domain.access.Principal;
import ca.gc.cra.sentinel.domain.access.Role;
import ca.gc.cra.sentinel.domain.alert.AlertChannel;
import ca.gc.cra.sentinel.domain.alert.AlertStatus;
import ca.gc.cra.sentinel.domain.threat.ContentHash;
import ca.gc.cra.sentinel.domain.threat.GeoPoint;
import ca.gc.cra.sentinel.domain.threat.ThreatStatus;
import ca.gc.cra.sentinel.domain.threat.ThreatType;
import ca.gc.cra.sentinel.logging.Logs;
import java.io.BufferedReader;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Set;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * <strong>What:</strong> Applies a newline-delimited JSON mutation log to a registry engine, one command per line.
 * <p><strong>Why:</strong> The registries are defined as a state machine over a serialized mutation log; replaying
 * a log rebuilds the exact state, counters, and event stream the original sequence produced.</p>
 * <p><strong>Format:</strong> Each non-blank line not starting with {@code #} is an object with {@code op},
 * {@code caller}, and the operation's arguments, for example
 * {@code {"op":"verifyThreat","caller":"verifier-1","threatId":3,"legitimate":false}}.</p>
 * <p><strong>Errors:</strong> Unreadable lines, unknown operations, and engine rejections are recorded in the
 * {@link ReplayReport}; only I/O failures propagate.</p>
 * <p><strong>Thread-safety:</strong> Not thread-safe; replay one log at a time.</p>
 *
 * @since 0.1.0
 */
public final class MutationLogReplayer {
  private static final Logger log = LoggerFactory.getLogger(MutationLogReplayer.class);

  private final AccessControl access;
  private final ThreatRegistry threats;
  private final AlertRegistry alerts;
  private final ReplayJson json = new ReplayJson();

  /**
   * @param access access control shared by both registries
   * @param threats threat registry
   * @param alerts alert registry
   */
  public MutationLogReplayer(AccessControl access, ThreatRegistry threats, AlertRegistry alerts) {
    this.access = Objects.requireNonNull(access, "access");
    this.threats = Objects.requireNonNull(threats, "threats");
    this.alerts = Objects.requireNonNull(alerts, "alerts");
  }

  /**
   * Replays every command from {@code reader}.
   *
   * @param reader mutation log
   * @param strict stop at the first rejected command
   * @return replay outcome
   * @throws IOException when reading fails
   */
  public ReplayReport replay(BufferedReader reader, boolean strict) throws IOException {
    Objects.requireNonNull(reader, "reader");
    long applied = 0;
    List<ReplayReport.Rejection> rejections = new ArrayList<>();
    int lineNumber = 0;
    String line;
    while ((line = reader.readLine()) != null) {
      lineNumber++;
      String trimmed = line.trim();
      if (trimmed.isEmpty() || trimmed.startsWith("#")) {
        continue;
      }
      String op = "?";
      try {
        ReplayCommand command = ReplayCommand.from(lineNumber, json.parseObject(trimmed));
        op = command.op();
        apply(command);
        applied++;
      } catch (RegistryException ex) {
        rejections.add(new ReplayReport.Rejection(lineNumber, op, ex.kind(), ex.getMessage()));
      } catch (IllegalArgumentException ex) {
        rejections.add(new ReplayReport.Rejection(lineNumber, op, RegistryError.INVALID_INPUT, ex.getMessage()));
        log.debug("Line {} rejected as invalid input", lineNumber, ex);
      }
      if (strict && !rejections.isEmpty()) {
        ReplayReport.Rejection first = rejections.get(0);
        log.warn("Strict replay halted at line {} ({} {})", first.lineNumber(), first.op(), first.kind());
        return new ReplayReport(applied, rejections.size(), rejections, true);
      }
    }
    log.info("Replayed {} commands ({} rejected)", applied + rejections.size(), rejections.size());
    return new ReplayReport(applied, rejections.size(), rejections, false);
  }

  void apply(ReplayCommand command) {
    Principal caller = command.caller();
    switch (command.op()) {
      case "registerThreat" -> threats.registerThreat(caller, submission(command));
      case "updateThreatStatus" -> threats.updateStatus(caller, command.longValue("threatId"),
          command.enumValue("status", ThreatStatus.class));
      case "verifyThreat" -> threats.verifyThreat(caller, command.longValue("threatId"),
          command.booleanValue("legitimate"));
      case "createAlert" -> alerts.createAlert(caller, draft(command));
      case "updateAlertStatus" -> alerts.updateStatus(caller, command.longValue("alertId"),
          command.enumValue("status", AlertStatus.class), command.optionalText("reason"));
      case "setEmergencyThreshold" -> alerts.setEmergencyThreshold(caller, command.intValue("threshold"));
      case "grantRole" -> access.grant(caller, command.enumValue("role", Role.class),
          command.principal("principal"));
      case "revokeRole" -> access.revoke(caller, command.enumValue("role", Role.class),
          command.principal("principal"));
      case "transferOwnership" -> access.transferOwnership(caller, command.principal("newOwner"));
      default -> throw ReplayCommand.invalid("unknown op " + Logs.truncate(command.op(), 64));
    }
  }

  private static ThreatSubmission submission(ReplayCommand command) {
    return new ThreatSubmission(
        command.enumValue("type", ThreatType.class),
        command.intValue("severity"),
        command.intValue("confidence"),
        GeoPoint.ofDegrees(command.doubleValue("latitude"), command.doubleValue("longitude")),
        command.text("description"),
        dataHash(command),
        command.longValue("affectedPopulation"));
  }

  // Either an explicit 32-byte hex digest or evidence text fingerprinted with SHA-256.
  private static ContentHash dataHash(ReplayCommand command) {
    String hex = command.optionalText("dataHash");
    if (hex != null) {
      return ContentHash.fromHex(hex);
    }
    return ContentHash.sha256(command.text("evidence").getBytes(StandardCharsets.UTF_8));
  }

  private static AlertDraft draft(ReplayCommand command) {
    Set<AlertChannel> channels = EnumSet.noneOf(AlertChannel.class);
    for (String channel : command.textList("channels")) {
      try {
        channels.add(AlertChannel.valueOf(channel.trim().toUpperCase(Locale.ROOT)));
      } catch (IllegalArgumentException ex) {
        throw ReplayCommand.invalid("unknown channel " + channel);
      }
    }
    return new AlertDraft(
        command.longValue("threatId"),
        command.text("message"),
        command.intValue("severity"),
        channels,
        command.textList("recipients"));
  }
}
