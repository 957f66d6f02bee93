package com.lsemantica.core.pipeline.patch;

import com.lsemantica.core.trace.GovernanceHooks;

import java.util.List;

public record PatchRunOptions(
        String patchMaterialization,
        List<String> requiredChecks,
        List<VerificationResult> verificationResults,
        List<String> policySensitivePathPatterns,
        GovernanceHooks hooks,
        String toolVersion
) {

    public static PatchRunOptions of(List<VerificationResult> verificationResults) {
        return new PatchRunOptions(null, null, verificationResults, null, null, null);
    }

    public PatchRunOptions withRequiredChecks(List<String> requiredChecks) {
        return new PatchRunOptions(patchMaterialization, requiredChecks, verificationResults,
                policySensitivePathPatterns, hooks, toolVersion);
    }

    public PatchRunOptions withPolicySensitivePathPatterns(List<String> policySensitivePathPatterns) {
        return new PatchRunOptions(patchMaterialization, requiredChecks, verificationResults,
                policySensitivePathPatterns, hooks, toolVersion);
    }

    public PatchRunOptions withHooks(GovernanceHooks hooks) {
        return new PatchRunOptions(patchMaterialization, requiredChecks, verificationResults,
                policySensitivePathPatterns, hooks, toolVersion);
    }

    public PatchRunOptions withToolVersion(String toolVersion) {
        return new PatchRunOptions(patchMaterialization, requiredChecks, verificationResults,
                policySensitivePathPatterns, hooks, toolVersion);
    }
}
