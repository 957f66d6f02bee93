package com.lsemantica.core.config;

import com.lsemantica.core.pipeline.Envelopes;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanOptions;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanService;
import com.lsemantica.core.pipeline.intent.IntentMappingOptions;
import com.lsemantica.core.pipeline.intent.IntentMappingService;
import com.lsemantica.core.pipeline.patch.PatchRunOptions;
import com.lsemantica.core.pipeline.patch.PatchRunService;
import com.lsemantica.core.pipeline.patch.VerificationResult;
import com.lsemantica.core.repair.RepairLoop;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;

/**
 * Defaults for CLI runs, bound from {@code lsemantica.*}. Services never read this class;
 * the CLI folds it into the per-call option records.
 */
@Component
@ConfigurationProperties(prefix = "lsemantica")
public class GovernanceProperties {

    private String toolVersion = Envelopes.DEFAULT_TOOL_VERSION;
    private final Repair repair = new Repair();
    private final IntentMapping intentMapping = new IntentMapping();
    private final SafeDiff safeDiff = new SafeDiff();
    private final PatchRun patchRun = new PatchRun();
    private final Trace trace = new Trace();

    public String getToolVersion() {
        return toolVersion;
    }

    public void setToolVersion(String toolVersion) {
        this.toolVersion = toolVersion;
    }

    public Repair getRepair() {
        return repair;
    }

    public IntentMapping getIntentMapping() {
        return intentMapping;
    }

    public SafeDiff getSafeDiff() {
        return safeDiff;
    }

    public PatchRun getPatchRun() {
        return patchRun;
    }

    public Trace getTrace() {
        return trace;
    }

    public IntentMappingOptions intentMappingOptions(String intent) {
        return IntentMappingOptions.of(intent)
                .withThresholds(intentMapping.getMinConfidence(), intentMapping.getAmbiguityGap())
                .withMaxAlternatives(intentMapping.getMaxAlternatives())
                .withToolVersion(toolVersion);
    }

    public SafeDiffPlanOptions safeDiffPlanOptions() {
        return SafeDiffPlanOptions.defaults()
                .withPlannerProfile(safeDiff.getPlannerProfile())
                .withForbiddenPathPatterns(safeDiff.getForbiddenPatterns())
                .withBounds(safeDiff.getMaxFileChanges(), safeDiff.getMaxHunks())
                .withToolVersion(toolVersion);
    }

    public PatchRunOptions patchRunOptions(List<VerificationResult> results) {
        return PatchRunOptions.of(results)
                .withRequiredChecks(patchRun.getRequiredChecks())
                .withPolicySensitivePathPatterns(patchRun.getPolicySensitivePatterns())
                .withToolVersion(toolVersion);
    }

    public static class Repair {

        private int maxAttempts = RepairLoop.DEFAULT_MAX_ATTEMPTS;

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }
    }

    public static class IntentMapping {

        private double minConfidence = IntentMappingService.DEFAULT_MIN_CONFIDENCE;
        private double ambiguityGap = IntentMappingService.DEFAULT_AMBIGUITY_GAP;
        private int maxAlternatives = IntentMappingService.DEFAULT_MAX_ALTERNATIVES;

        public double getMinConfidence() {
            return minConfidence;
        }

        public void setMinConfidence(double minConfidence) {
            this.minConfidence = minConfidence;
        }

        public double getAmbiguityGap() {
            return ambiguityGap;
        }

        public void setAmbiguityGap(double ambiguityGap) {
            this.ambiguityGap = ambiguityGap;
        }

        public int getMaxAlternatives() {
            return maxAlternatives;
        }

        public void setMaxAlternatives(int maxAlternatives) {
            this.maxAlternatives = maxAlternatives;
        }
    }

    public static class SafeDiff {

        private String plannerProfile = SafeDiffPlanService.DEFAULT_PLANNER_PROFILE;
        private List<String> forbiddenPatterns = new ArrayList<>(SafeDiffPlanService.DEFAULT_FORBIDDEN_PATH_PATTERNS);
        private int maxFileChanges = SafeDiffPlanService.DEFAULT_MAX_FILE_CHANGES;
        private int maxHunks = SafeDiffPlanService.DEFAULT_MAX_HUNKS;

        public String getPlannerProfile() {
            return plannerProfile;
        }

        public void setPlannerProfile(String plannerProfile) {
            this.plannerProfile = plannerProfile;
        }

        public List<String> getForbiddenPatterns() {
            return forbiddenPatterns;
        }

        public void setForbiddenPatterns(List<String> forbiddenPatterns) {
            this.forbiddenPatterns = forbiddenPatterns;
        }

        public int getMaxFileChanges() {
            return maxFileChanges;
        }

        public void setMaxFileChanges(int maxFileChanges) {
            this.maxFileChanges = maxFileChanges;
        }

        public int getMaxHunks() {
            return maxHunks;
        }

        public void setMaxHunks(int maxHunks) {
            this.maxHunks = maxHunks;
        }
    }

    public static class PatchRun {

        private List<String> requiredChecks = new ArrayList<>(PatchRunService.DEFAULT_REQUIRED_CHECKS);
        private List<String> policySensitivePatterns =
                new ArrayList<>(SafeDiffPlanService.DEFAULT_ESCALATION_PATH_PATTERNS);

        public List<String> getRequiredChecks() {
            return requiredChecks;
        }

        public void setRequiredChecks(List<String> requiredChecks) {
            this.requiredChecks = requiredChecks;
        }

        public List<String> getPolicySensitivePatterns() {
            return policySensitivePatterns;
        }

        public void setPolicySensitivePatterns(List<String> policySensitivePatterns) {
            this.policySensitivePatterns = policySensitivePatterns;
        }
    }

    /** Default sink paths; unset means the sink is off unless a CLI flag enables it. */
    public static class Trace {

        private Path ledgerPath;
        private Path feedbackTensorPath;
        private Path inspectionPath;
        private Path inspectionReportPath;

        public Path getLedgerPath() {
            return ledgerPath;
        }

        public void setLedgerPath(Path ledgerPath) {
            this.ledgerPath = ledgerPath;
        }

        public Path getFeedbackTensorPath() {
            return feedbackTensorPath;
        }

        public void setFeedbackTensorPath(Path feedbackTensorPath) {
            this.feedbackTensorPath = feedbackTensorPath;
        }

        public Path getInspectionPath() {
            return inspectionPath;
        }

        public void setInspectionPath(Path inspectionPath) {
            this.inspectionPath = inspectionPath;
        }

        public Path getInspectionReportPath() {
            return inspectionReportPath;
        }

        public void setInspectionReportPath(Path inspectionReportPath) {
            this.inspectionReportPath = inspectionReportPath;
        }
    }
}
