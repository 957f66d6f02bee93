package com.lsemantica.core.feedback;

import com.lsemantica.core.trace.HookResolver;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Normalizes draft FeedbackTensor values: blank strings fall back to fixed defaults, scores
 * are clamped to [0, 1] and an empty alternative list becomes a single manual-review entry.
 */
public final class FeedbackTensorFactory {

    static final String DEFAULT_HYPOTHESIS = "Escalate to human review for deterministic adjudication.";
    static final String DEFAULT_EXPECTED_OUTCOME = "Task remains blocked pending review.";

    private FeedbackTensorFactory() {}

    public static FeedbackTensor create(FeedbackTensor draft) {
        FeedbackTensor.FailureSignal signal = draft.failureSignal();
        FeedbackTensor.Confidence confidence = draft.confidence();
        FeedbackTensor.ProposedRepairAction action = draft.proposedRepairAction();
        FeedbackTensor.Provenance provenance = draft.provenance();
        FeedbackTensor.ContractVersions versions = provenance.contractVersions();

        return new FeedbackTensor(
                FeedbackTensor.SCHEMA_VERSION,
                orDefault(draft.feedbackId(), "ft-fallback-" + Long.toString(System.currentTimeMillis(), 36)),
                orDefault(draft.generatedAt(), HookResolver.formatInstant(Instant.now())),
                new FeedbackTensor.FailureSignal(
                        signal.failureClass(),
                        signal.stage(),
                        orDefault(signal.summary(), "Feedback summary unavailable."),
                        signal.continuationAllowed(),
                        HookResolver.trimToNull(signal.errorCode())),
                new FeedbackTensor.Confidence(
                        clampOrZero(confidence.score()),
                        orDefault(confidence.rationale(), "Confidence rationale unavailable."),
                        confidence.calibrationBand()),
                normalizeAlternatives(draft.alternatives()),
                new FeedbackTensor.ProposedRepairAction(
                        action.action(),
                        orDefault(action.rationale(), "Repair action rationale unavailable."),
                        action.requiresHumanApproval(),
                        HookResolver.trimToNull(action.target()),
                        HookResolver.trimToNull(action.patchExcerpt())),
                new FeedbackTensor.Provenance(
                        orDefault(provenance.runId(), "run-unavailable"),
                        provenance.sourceStage(),
                        HookResolver.trimToNull(provenance.traceEntryId()),
                        new FeedbackTensor.ContractVersions(
                                orDefault(versions == null ? null : versions.semanticIr(), "unknown"),
                                orDefault(versions == null ? null : versions.policyProfile(), "unknown"),
                                orDefault(versions == null ? null : versions.feedbackTensor(),
                                        FeedbackTensor.SCHEMA_VERSION))));
    }

    static double clampOrZero(double score) {
        if (!Double.isFinite(score)) {
            return 0;
        }
        return Math.max(0, Math.min(1, score));
    }

    private static List<FeedbackTensor.Alternative> normalizeAlternatives(List<FeedbackTensor.Alternative> drafts) {
        List<FeedbackTensor.Alternative> normalized = new ArrayList<>();
        if (drafts != null) {
            for (int i = 0; i < drafts.size(); i++) {
                FeedbackTensor.Alternative alternative = drafts.get(i);
                Double probability = alternative.estimatedSuccessProbability();
                if (probability != null && !Double.isFinite(probability)) {
                    probability = null;
                }
                normalized.add(new FeedbackTensor.Alternative(
                        orDefault(alternative.id(), "alt-" + (i + 1)),
                        orDefault(alternative.hypothesis(), DEFAULT_HYPOTHESIS),
                        orDefault(alternative.expectedOutcome(), DEFAULT_EXPECTED_OUTCOME),
                        probability == null ? null : Math.max(0, Math.min(1, probability))));
            }
        }
        if (normalized.isEmpty()) {
            normalized.add(new FeedbackTensor.Alternative(
                    "alt-manual-review", DEFAULT_HYPOTHESIS, DEFAULT_EXPECTED_OUTCOME, 0.95));
        }
        return List.copyOf(normalized);
    }

    private static String orDefault(String value, String fallback) {
        String trimmed = HookResolver.trimToNull(value);
        return trimmed != null ? trimmed : fallback;
    }
}
