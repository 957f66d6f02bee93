package com.lsemantica.core.pipeline;

import com.lsemantica.core.json.CanonicalJson;
import com.lsemantica.core.trace.GovernanceHooks;
import com.lsemantica.core.trace.HookResolver;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Envelope helpers shared by the stage services: content-derived ids, hook resolution and
 * upstream envelope checks.
 */
public final class Envelopes {

    public static final String DEFAULT_TOOL_VERSION = "lsemantica-governance@0.1.0";
    private static final int ID_DIGEST_LENGTH = 12;

    private Envelopes() {}

    /**
     * Derives the artifact id from the canonical JSON of its inputs, trace and payload, so
     * identical content always yields the identical id.
     */
    public static String artifactId(ArtifactType type, List<ArtifactRef> inputs, Object trace, Object payload) {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("inputs", inputs);
        body.put("trace", trace);
        body.put("payload", payload);
        return type.idPrefix() + CanonicalJson.sha256OfJson(body).substring(0, ID_DIGEST_LENGTH);
    }

    public static String digest(String content) {
        return "sha256:" + CanonicalJson.sha256Hex(content);
    }

    public static String shortDigest(String digest) {
        String hex = digest.startsWith("sha256:") ? digest.substring("sha256:".length()) : digest;
        return hex.substring(0, Math.min(ID_DIGEST_LENGTH, hex.length()));
    }

    /** Run id from the hook factory, else the upstream run id, else a random UUID. */
    public static String runId(GovernanceHooks hooks, String upstreamRunId) {
        GovernanceHooks effective = hooks != null ? hooks : GovernanceHooks.systemClock();
        return HookResolver.resolveRunId(null, effective.runIdFactory(), upstreamRunId);
    }

    public static String producedAt(GovernanceHooks hooks) {
        GovernanceHooks effective = hooks != null ? hooks : GovernanceHooks.systemClock();
        return HookResolver.resolveTimestamp(effective.clock());
    }

    public static String toolVersion(String toolVersion) {
        String normalized = HookResolver.trimToNull(toolVersion);
        return normalized != null ? normalized : DEFAULT_TOOL_VERSION;
    }

    /**
     * Checks that {@code upstream} is a well-formed envelope of the expected family and pinned
     * version before a stage consumes it.
     */
    public static <E extends RuntimeException> void requireEnvelope(Artifact upstream, ArtifactType expected,
                                                                    ArtifactType consumer,
                                                                    Function<String, E> error) {
        if (upstream == null) {
            throw error.apply(consumer.label() + " requires a " + expected.label().toLowerCase()
                    + " artifact object");
        }
        if (!expected.typeId().equals(upstream.artifactType())) {
            throw error.apply(consumer.label() + " requires " + expected.typeId() + " input");
        }
        if (!expected.schemaVersion().equals(upstream.schemaVersion())) {
            throw error.apply(consumer.label() + " requires " + expected.pinned());
        }
        if (HookResolver.trimToNull(upstream.artifactId()) == null || HookResolver.trimToNull(upstream.runId()) == null) {
            throw error.apply(consumer.label() + " " + expected.label().toLowerCase()
                    + " is missing required envelope fields");
        }
    }

    /** Collapses whitespace to single spaces and truncates with {@code ...}. */
    public static String singleLine(String value, int maxLength) {
        String collapsed = value.replaceAll("\\s+", " ").trim();
        if (collapsed.length() <= maxLength) {
            return collapsed;
        }
        return collapsed.substring(0, maxLength - 3) + "...";
    }
}
