package com.lsemantica.core.pipeline.diffplan;

import com.lsemantica.core.trace.GovernanceHooks;

import java.util.List;

/**
 * Planner options. {@code null} selects the default for each field; {@code plannedEdits}
 * overrides the edit derived from the selected mapping candidate.
 */
public record SafeDiffPlanOptions(
        String plannerProfile,
        List<String> forbiddenPathPatterns,
        List<String> escalationPathPatterns,
        Integer maxFileChanges,
        Integer maxHunks,
        List<PlanEdit> plannedEdits,
        GovernanceHooks hooks,
        String toolVersion
) {

    public static SafeDiffPlanOptions defaults() {
        return new SafeDiffPlanOptions(null, null, null, null, null, null, null, null);
    }

    public SafeDiffPlanOptions withPlannedEdits(List<PlanEdit> plannedEdits) {
        return new SafeDiffPlanOptions(plannerProfile, forbiddenPathPatterns, escalationPathPatterns, maxFileChanges,
                maxHunks, plannedEdits, hooks, toolVersion);
    }

    public SafeDiffPlanOptions withBounds(Integer maxFileChanges, Integer maxHunks) {
        return new SafeDiffPlanOptions(plannerProfile, forbiddenPathPatterns, escalationPathPatterns, maxFileChanges,
                maxHunks, plannedEdits, hooks, toolVersion);
    }

    public SafeDiffPlanOptions withForbiddenPathPatterns(List<String> forbiddenPathPatterns) {
        return new SafeDiffPlanOptions(plannerProfile, forbiddenPathPatterns, escalationPathPatterns, maxFileChanges,
                maxHunks, plannedEdits, hooks, toolVersion);
    }

    public SafeDiffPlanOptions withEscalationPathPatterns(List<String> escalationPathPatterns) {
        return new SafeDiffPlanOptions(plannerProfile, forbiddenPathPatterns, escalationPathPatterns, maxFileChanges,
                maxHunks, plannedEdits, hooks, toolVersion);
    }

    public SafeDiffPlanOptions withPlannerProfile(String plannerProfile) {
        return new SafeDiffPlanOptions(plannerProfile, forbiddenPathPatterns, escalationPathPatterns, maxFileChanges,
                maxHunks, plannedEdits, hooks, toolVersion);
    }

    public SafeDiffPlanOptions withHooks(GovernanceHooks hooks) {
        return new SafeDiffPlanOptions(plannerProfile, forbiddenPathPatterns, escalationPathPatterns, maxFileChanges,
                maxHunks, plannedEdits, hooks, toolVersion);
    }

    public SafeDiffPlanOptions withToolVersion(String toolVersion) {
        return new SafeDiffPlanOptions(plannerProfile, forbiddenPathPatterns, escalationPathPatterns, maxFileChanges,
                maxHunks, plannedEdits, hooks, toolVersion);
    }
}
