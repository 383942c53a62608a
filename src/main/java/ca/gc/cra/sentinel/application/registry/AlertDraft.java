package ca.gc.cra.sentinel.application.registry;

import ca.gc.cra.sentinel.domain.alert.AlertChannel;
import java.util.List;
import java.util.Set;

/**
 * Caller-supplied alert awaiting creation. Validated by {@link AlertRegistry#createAlert}.
 *
 * @param threatId threat the alert concerns; existence is not checked by the alert registry
 * @param message expected 1-1000 characters
 * @param severity expected 1-5
 * @param channels expected non-empty
 * @param recipients expected 1-1000 non-blank entries
 * @since 0.1.0
 */
public record AlertDraft(
    long threatId,
    String message,
    int severity,
    Set<AlertChannel> channels,
    List<String> recipients) {}
