package com.lsemantica.core.pipeline.intent;

import com.lsemantica.core.trace.GovernanceHooks;

/**
 * Per-call intent mapping options. {@code null} numeric options select the defaults in
 * {@link IntentMappingService}.
 */
public record IntentMappingOptions(
        String intent,
        String intentSource,
        Double minConfidence,
        Double ambiguityGap,
        Integer maxAlternatives,
        GovernanceHooks hooks,
        String toolVersion
) {

    public static IntentMappingOptions of(String intent) {
        return new IntentMappingOptions(intent, null, null, null, null, null, null);
    }

    public IntentMappingOptions withIntentSource(String intentSource) {
        return new IntentMappingOptions(intent, intentSource, minConfidence, ambiguityGap, maxAlternatives, hooks,
                toolVersion);
    }

    public IntentMappingOptions withThresholds(Double minConfidence, Double ambiguityGap) {
        return new IntentMappingOptions(intent, intentSource, minConfidence, ambiguityGap, maxAlternatives, hooks,
                toolVersion);
    }

    public IntentMappingOptions withMaxAlternatives(Integer maxAlternatives) {
        return new IntentMappingOptions(intent, intentSource, minConfidence, ambiguityGap, maxAlternatives, hooks,
                toolVersion);
    }

    public IntentMappingOptions withHooks(GovernanceHooks hooks) {
        return new IntentMappingOptions(intent, intentSource, minConfidence, ambiguityGap, maxAlternatives, hooks,
                toolVersion);
    }

    public IntentMappingOptions withToolVersion(String toolVersion) {
        return new IntentMappingOptions(intent, intentSource, minConfidence, ambiguityGap, maxAlternatives, hooks,
                toolVersion);
    }
}
