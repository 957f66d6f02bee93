package com.lsemantica.core.pipeline.diffplan;

/**
 * One planned file edit. As planner input only {@code path} is required; the planner fills in
 * {@code modify} and a default justification.
 */
public record PlanEdit(
        String path,
        EditOperation operation,
        String justification,
        String targetId,
        String symbolPath
) {

    public static PlanEdit of(String path, EditOperation operation) {
        return new PlanEdit(path, operation, null, null, null);
    }
}
