package com.lsemantica.core.pipeline.diffplan;

import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.ArtifactRef;
import com.lsemantica.core.pipeline.ArtifactType;
import com.lsemantica.core.pipeline.Envelopes;
import com.lsemantica.core.pipeline.PathGlobs;
import com.lsemantica.core.pipeline.ReasonCode;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import com.lsemantica.core.pipeline.intent.SearchText;
import com.lsemantica.core.trace.HookResolver;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.regex.Pattern;

/**
 * Turns a continued intent mapping into a conservative edit plan. Blocked mappings propagate;
 * otherwise the plan is checked, in order, for conflicting edits, forbidden paths, change
 * bounds and escalation-class paths.
 */
@Service
public class SafeDiffPlanService {

    private static final Logger log = LoggerFactory.getLogger(SafeDiffPlanService.class);

    public static final String DEFAULT_PLANNER_PROFILE = "default-conservative";
    public static final int DEFAULT_MAX_FILE_CHANGES = 5;
    public static final int DEFAULT_MAX_HUNKS = 20;
    static final int MAX_BOUND = 10_000;

    public static final List<String> DEFAULT_FORBIDDEN_PATH_PATTERNS = List.of(
            ".git/**", "node_modules/**", ".env*", "**/.env*", "*.pem", "**/*.pem", "*.key", "**/*.key");

    /** CI, policy and contract-schema paths. Also the patch run's policy-sensitive defaults. */
    public static final List<String> DEFAULT_ESCALATION_PATH_PATTERNS = List.of(
            ".github/workflows/**",
            ".github/actions/**",
            "docs/spec/schemas/**",
            "docs/spec/policyprofile-*.md",
            "docs/spec/verificationcontract-*.md");

    private static final Pattern DELETE_VERB = Pattern.compile("\\b(delete|remove)\\b");
    private static final Pattern CREATE_VERB = Pattern.compile("\\b(create|new)\\b");
    private static final Pattern ADD_VERB = Pattern.compile("\\badd\\b");
    private static final Pattern ADDABLE_NOUN =
            Pattern.compile("\\b(?:file|section|entry|field|rule|check|capability|goal)\\b");

    public SafeDiffPlan plan(IntentMapping mapping, SafeDiffPlanOptions options) {
        SafeDiffPlanOptions effective = options != null ? options : SafeDiffPlanOptions.defaults();
        validateMapping(mapping);
        String plannerProfile = HookResolver.trimToNull(effective.plannerProfile());
        if (plannerProfile == null) {
            plannerProfile = DEFAULT_PLANNER_PROFILE;
        }
        List<String> forbiddenPatterns = forbiddenPatterns(effective.forbiddenPathPatterns());
        List<String> escalationPatterns = patterns(effective.escalationPathPatterns(),
                DEFAULT_ESCALATION_PATH_PATTERNS, "escalationPathPatterns");
        int maxFileChanges = bound(effective.maxFileChanges(), DEFAULT_MAX_FILE_CHANGES, "maxFileChanges");
        int maxHunks = bound(effective.maxHunks(), DEFAULT_MAX_HUNKS, "maxHunks");

        IntentMapping.Payload upstream = mapping.payload();
        List<PlanEdit> edits = List.of();
        Decision decision = Decision.STOP;
        ReasonCode reasonCode = ReasonCode.UNSUPPORTED_INPUT;
        String reasonDetail = "No safe diff edits were generated.";

        if (upstream.decision() != Decision.CONTINUE) {
            decision = upstream.decision();
            reasonCode = propagatedReason(upstream.decision(), upstream.reasonCode());
            reasonDetail = "Intent mapping blocked diff planning: " + upstream.reasonDetail();
        } else if (upstream.candidates().size() > 1) {
            decision = Decision.ESCALATE;
            reasonCode = ReasonCode.MAPPING_AMBIGUOUS;
            reasonDetail = "Intent mapping provided multiple selected candidates for a continue decision.";
        } else {
            edits = effective.plannedEdits() != null
                    ? normalizeEdits(effective.plannedEdits())
                    : defaultEdits(upstream);
            if (edits.isEmpty()) {
                reasonDetail = "Planner produced no safe edits from the selected intent mapping target.";
            }
        }

        Set<String> uniquePaths = new TreeSet<>();
        edits.forEach(edit -> uniquePaths.add(edit.path()));
        SafeDiffPlan.SafetyChecks safetyChecks = new SafeDiffPlan.SafetyChecks(forbiddenPatterns, escalationPatterns,
                new SafeDiffPlan.Bound(maxFileChanges, uniquePaths.size()),
                new SafeDiffPlan.Bound(maxHunks, edits.size()));

        if (!edits.isEmpty()) {
            List<String> conflicts = conflictPaths(edits);
            List<String> forbidden = forbiddenPaths(uniquePaths, forbiddenPatterns);
            List<String> escalation = PathGlobs.matching(uniquePaths, escalationPatterns);
            if (!conflicts.isEmpty()) {
                decision = Decision.ESCALATE;
                reasonCode = ReasonCode.CONFLICT_DETECTED;
                reasonDetail = "Planner produced conflicting edits for the same path(s): "
                        + String.join(", ", conflicts) + ".";
            } else if (!forbidden.isEmpty()) {
                decision = Decision.STOP;
                reasonCode = ReasonCode.FORBIDDEN_PATH;
                reasonDetail = "Plan targets forbidden path(s): " + String.join(", ", forbidden) + ".";
            } else if (safetyChecks.maxFileChanges().exceeded() || safetyChecks.maxHunks().exceeded()) {
                List<String> exceeded = new ArrayList<>();
                if (safetyChecks.maxFileChanges().exceeded()) {
                    exceeded.add("max_file_changes " + uniquePaths.size() + "/" + maxFileChanges);
                }
                if (safetyChecks.maxHunks().exceeded()) {
                    exceeded.add("max_hunks " + edits.size() + "/" + maxHunks);
                }
                decision = Decision.ESCALATE;
                reasonCode = ReasonCode.CHANGE_BOUND_EXCEEDED;
                reasonDetail = "Plan exceeds conservative safety bounds: " + String.join("; ", exceeded) + ".";
            } else if (!escalation.isEmpty()) {
                decision = Decision.ESCALATE;
                reasonCode = ReasonCode.POLICY_BLOCKED;
                reasonDetail = "Plan touches escalation-class path(s) requiring human review: "
                        + String.join(", ", escalation) + ".";
            } else {
                decision = Decision.CONTINUE;
                reasonCode = ReasonCode.OK;
                reasonDetail = "Plan is within conservative safety bounds";
            }
        }

        SafeDiffPlan.Trace trace = new SafeDiffPlan.Trace(plannerProfile);
        SafeDiffPlan.Payload payload = new SafeDiffPlan.Payload(edits, safetyChecks, decision, reasonCode,
                reasonDetail);
        List<ArtifactRef> inputs = List.of(mapping.ref());
        SafeDiffPlan plan = new SafeDiffPlan(
                ArtifactType.SAFE_DIFF_PLAN.typeId(),
                ArtifactType.SAFE_DIFF_PLAN.schemaVersion(),
                Envelopes.artifactId(ArtifactType.SAFE_DIFF_PLAN, inputs, trace, payload),
                Envelopes.runId(effective.hooks(), mapping.runId()),
                Envelopes.producedAt(effective.hooks()),
                Envelopes.toolVersion(effective.toolVersion()),
                inputs,
                trace,
                payload);
        log.info("Safe diff plan {} -> {}/{} ({} edit(s))", plan.artifactId(), decision.wireValue(),
                reasonCode.wireValue(), edits.size());
        return plan;
    }

    static EditOperation inferOperation(String intentSummary) {
        String normalized = SearchText.normalize(intentSummary);
        if (DELETE_VERB.matcher(normalized).find()) {
            return EditOperation.DELETE;
        }
        if (CREATE_VERB.matcher(normalized).find()) {
            return EditOperation.CREATE;
        }
        if (ADD_VERB.matcher(normalized).find() && ADDABLE_NOUN.matcher(normalized).find()) {
            return EditOperation.CREATE;
        }
        return EditOperation.MODIFY;
    }

    private static List<PlanEdit> defaultEdits(IntentMapping.Payload mapping) {
        if (mapping.candidates().size() != 1) {
            return List.of();
        }
        IntentMapping.Candidate candidate = mapping.candidates().get(0);
        EditOperation operation = inferOperation(mapping.intent().summary());
        String label = candidate.symbolPath() != null ? candidate.path() + "#" + candidate.symbolPath()
                : candidate.path();
        return List.of(new PlanEdit(editPath(candidate.path()), operation,
                "Mapped intent to " + label + " for conservative " + operation.wireValue() + " planning.",
                candidate.targetId(), candidate.symbolPath()));
    }

    private static List<PlanEdit> normalizeEdits(List<PlanEdit> planned) {
        List<PlanEdit> edits = new ArrayList<>(planned.size());
        for (int i = 0; i < planned.size(); i++) {
            PlanEdit edit = planned.get(i);
            if (edit == null) {
                throw invalidOptions("Safe diff plan plannedEdits[" + i + "] must be an object");
            }
            String path = editPath(edit.path());
            EditOperation operation = edit.operation() != null ? edit.operation() : EditOperation.MODIFY;
            String justification = HookResolver.trimToNull(edit.justification());
            if (justification == null) {
                justification = "Planner override requested " + operation.wireValue() + " on " + path + ".";
            }
            String symbolPath = edit.symbolPath();
            if (symbolPath != null && HookResolver.trimToNull(symbolPath) == null) {
                throw invalidOptions("Safe diff plan edit symbol_path must be null or a non-empty string");
            }
            edits.add(new PlanEdit(path, operation, justification, HookResolver.trimToNull(edit.targetId()),
                    HookResolver.trimToNull(symbolPath)));
        }
        return List.copyOf(edits);
    }

    private static String editPath(String raw) {
        String trimmed = HookResolver.trimToNull(raw);
        if (trimmed == null) {
            throw invalidOptions("Safe diff plan edits must include a non-empty path");
        }
        String normalized = PathGlobs.normalize(trimmed);
        if (normalized.equals(".")) {
            throw invalidOptions("Safe diff plan edits must include a file path, not '.'");
        }
        return normalized;
    }

    private static List<String> conflictPaths(List<PlanEdit> edits) {
        Map<String, Integer> counts = new TreeMap<>();
        edits.forEach(edit -> counts.merge(edit.path(), 1, Integer::sum));
        List<String> conflicts = new ArrayList<>();
        counts.forEach((path, count) -> {
            if (count > 1) {
                conflicts.add(path);
            }
        });
        return conflicts;
    }

    private static List<String> forbiddenPaths(Set<String> paths, List<String> patterns) {
        Set<String> blocked = new TreeSet<>();
        for (String path : paths) {
            if (PathGlobs.isOutsideWorkspace(path)) {
                blocked.add(path);
            }
        }
        blocked.addAll(PathGlobs.matching(paths, patterns));
        return List.copyOf(blocked);
    }

    private static ReasonCode propagatedReason(Decision decision, ReasonCode upstream) {
        if (upstream == ReasonCode.MAPPING_AMBIGUOUS || upstream == ReasonCode.MAPPING_LOW_CONFIDENCE) {
            return upstream;
        }
        return decision == Decision.STOP ? ReasonCode.UNSUPPORTED_INPUT : ReasonCode.CONFLICT_DETECTED;
    }

    private static void validateMapping(IntentMapping mapping) {
        Envelopes.requireEnvelope(mapping, ArtifactType.INTENT_MAPPING, ArtifactType.SAFE_DIFF_PLAN,
                SafeDiffPlanService::invalidMapping);
        IntentMapping.Payload payload = mapping.payload();
        if (payload == null || payload.intent() == null || HookResolver.trimToNull(payload.intent().summary()) == null) {
            throw invalidMapping("Safe diff plan intent mapping payload.intent.summary is required");
        }
        if (payload.decision() == null) {
            throw invalidMapping("Safe diff plan intent mapping payload.decision must be continue, escalate, or stop");
        }
        if (payload.reasonCode() == null || HookResolver.trimToNull(payload.reasonDetail()) == null) {
            throw invalidMapping(
                    "Safe diff plan intent mapping payload.reason_code and payload.reason_detail are required");
        }
        if (!payload.reasonCode().allowedIn(ArtifactType.INTENT_MAPPING)) {
            throw invalidMapping(
                    "Safe diff plan intent mapping payload.reason_code is unsupported for the pinned schema version");
        }
        if (payload.candidates() == null) {
            throw invalidMapping("Safe diff plan intent mapping payload.candidates must be an array");
        }
        for (int i = 0; i < payload.candidates().size(); i++) {
            IntentMapping.Candidate candidate = payload.candidates().get(i);
            if (candidate == null || HookResolver.trimToNull(candidate.targetId()) == null
                    || HookResolver.trimToNull(candidate.path()) == null) {
                throw invalidMapping("Safe diff plan payload.candidates[" + i
                        + "] candidate is missing target_id or path");
            }
        }
    }

    /** Configured patterns extend the secret and VCS defaults; they never replace them. */
    private static List<String> forbiddenPatterns(List<String> configured) {
        if (configured == null) {
            return List.copyOf(new TreeSet<>(DEFAULT_FORBIDDEN_PATH_PATTERNS));
        }
        Set<String> merged = new LinkedHashSet<>(DEFAULT_FORBIDDEN_PATH_PATTERNS);
        merged.addAll(configured);
        return PathGlobs.normalizePatterns(merged, SafeDiffPlanService::invalidOptions,
                "Safe diff plan forbiddenPathPatterns must contain non-empty strings");
    }

    private static List<String> patterns(List<String> configured, List<String> defaults, String name) {
        if (configured == null) {
            return List.copyOf(new TreeSet<>(defaults));
        }
        return PathGlobs.normalizePatterns(new LinkedHashSet<>(configured), SafeDiffPlanService::invalidOptions,
                "Safe diff plan " + name + " must contain non-empty strings");
    }

    private static int bound(Integer value, int fallback, String name) {
        if (value == null) {
            return fallback;
        }
        if (value < 1 || value > MAX_BOUND) {
            throw invalidOptions("Safe diff plan " + name + " must be an integer between 1 and " + MAX_BOUND);
        }
        return value;
    }

    private static SafeDiffPlanException invalidMapping(String message) {
        return new SafeDiffPlanException(SafeDiffPlanException.Code.INVALID_INTENT_MAPPING, message);
    }

    private static SafeDiffPlanException invalidOptions(String message) {
        return new SafeDiffPlanException(SafeDiffPlanException.Code.INVALID_OPTIONS, message);
    }
}
