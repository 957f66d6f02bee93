package com.lsemantica.core.trace;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.format.DateTimeFormatter;
import java.util.UUID;
import java.util.function.Supplier;

/**
 * Fault-tolerant evaluation of {@link GovernanceHooks}. A hook that throws or yields an
 * unusable value falls back to real time or a generated id; hook failures never reach the
 * governed operation.
 */
public final class HookResolver {

    private static final Logger log = LoggerFactory.getLogger(HookResolver.class);

    private static final DateTimeFormatter ISO_MILLIS =
            DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss.SSS'Z'").withZone(ZoneOffset.UTC);

    private HookResolver() {}

    public static String formatInstant(Instant instant) {
        return ISO_MILLIS.format(instant);
    }

    public static String resolveTimestamp(Supplier<Instant> clock) {
        if (clock != null) {
            try {
                Instant candidate = clock.get();
                if (candidate != null) {
                    return formatInstant(candidate);
                }
            } catch (RuntimeException e) {
                log.debug("Clock hook failed, falling back to system time: {}", e.getMessage());
            }
        }
        return formatInstant(Instant.now());
    }

    /**
     * Resolves a run id: an explicit non-blank id wins, then the factory, then {@code fallback},
     * then a random UUID.
     */
    public static String resolveRunId(String explicitRunId, Supplier<String> factory, String fallback) {
        String explicit = trimToNull(explicitRunId);
        if (explicit != null) {
            return explicit;
        }
        String generated = invoke(factory, "runId");
        if (generated != null) {
            return generated;
        }
        String preferred = trimToNull(fallback);
        return preferred != null ? preferred : UUID.randomUUID().toString();
    }

    public static String resolveFeedbackId(Supplier<String> factory, String runId) {
        String generated = invoke(factory, "feedbackId");
        return generated != null ? generated : "ft-" + runId + "-" + UUID.randomUUID();
    }

    public static String trimToNull(String value) {
        if (value == null) {
            return null;
        }
        String trimmed = value.trim();
        return trimmed.isEmpty() ? null : trimmed;
    }

    private static String invoke(Supplier<String> factory, String hookName) {
        if (factory == null) {
            return null;
        }
        try {
            return trimToNull(factory.get());
        } catch (RuntimeException e) {
            log.debug("{} factory hook failed, using fallback id: {}", hookName, e.getMessage());
            return null;
        }
    }
}
