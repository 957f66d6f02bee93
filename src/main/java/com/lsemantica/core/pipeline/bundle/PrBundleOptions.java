package com.lsemantica.core.pipeline.bundle;

import com.lsemantica.core.pipeline.diffplan.SafeDiffPlan;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import com.lsemantica.core.pipeline.snapshot.WorkspaceSnapshot;
import com.lsemantica.core.trace.GovernanceHooks;

import java.util.List;

/**
 * Bundle options. Text fields left {@code null} are derived from the patch run and lineage.
 * {@code omitVerificationEvidenceRef} suppresses the default link to the patch run.
 */
public record PrBundleOptions(
        Lineage lineage,
        String summary,
        String rationale,
        List<String> riskTradeoffs,
        String verificationEvidenceRef,
        boolean omitVerificationEvidenceRef,
        RollbackOverrides rollback,
        GovernanceHooks hooks,
        String toolVersion
) {

    /** Upstream artifacts of the patch run; any of them may be {@code null}. */
    public record Lineage(WorkspaceSnapshot workspaceSnapshot, IntentMapping intentMapping,
                          SafeDiffPlan safeDiffPlan) {

        public static Lineage none() {
            return new Lineage(null, null, null);
        }
    }

    public record RollbackOverrides(String strategy, Boolean supported, String packageRef,
                                    List<String> instructions) {}

    public static PrBundleOptions of(Lineage lineage) {
        return new PrBundleOptions(lineage, null, null, null, null, false, null, null, null);
    }

    public PrBundleOptions withSummary(String summary, String rationale) {
        return new PrBundleOptions(lineage, summary, rationale, riskTradeoffs, verificationEvidenceRef,
                omitVerificationEvidenceRef, rollback, hooks, toolVersion);
    }

    public PrBundleOptions withRiskTradeoffs(List<String> riskTradeoffs) {
        return new PrBundleOptions(lineage, summary, rationale, riskTradeoffs, verificationEvidenceRef,
                omitVerificationEvidenceRef, rollback, hooks, toolVersion);
    }

    public PrBundleOptions withVerificationEvidenceRef(String verificationEvidenceRef) {
        return new PrBundleOptions(lineage, summary, rationale, riskTradeoffs, verificationEvidenceRef,
                false, rollback, hooks, toolVersion);
    }

    public PrBundleOptions withoutVerificationEvidenceRef() {
        return new PrBundleOptions(lineage, summary, rationale, riskTradeoffs, null, true, rollback, hooks,
                toolVersion);
    }

    public PrBundleOptions withRollback(RollbackOverrides rollback) {
        return new PrBundleOptions(lineage, summary, rationale, riskTradeoffs, verificationEvidenceRef,
                omitVerificationEvidenceRef, rollback, hooks, toolVersion);
    }

    public PrBundleOptions withHooks(GovernanceHooks hooks) {
        return new PrBundleOptions(lineage, summary, rationale, riskTradeoffs, verificationEvidenceRef,
                omitVerificationEvidenceRef, rollback, hooks, toolVersion);
    }

    public PrBundleOptions withToolVersion(String toolVersion) {
        return new PrBundleOptions(lineage, summary, rationale, riskTradeoffs, verificationEvidenceRef,
                omitVerificationEvidenceRef, rollback, hooks, toolVersion);
    }
}
