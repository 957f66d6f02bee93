package com.lsemantica.core.pipeline.patch;

import com.lsemantica.core.pipeline.Envelopes;
import com.lsemantica.core.pipeline.diffplan.EditOperation;
import com.lsemantica.core.pipeline.diffplan.PlanEdit;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.stream.Collectors;

/**
 * Renders deterministic placeholder unified-diff chunks, one per edit. The content carries
 * marker lines plus symbol, target and justification metadata rather than real file text.
 */
public final class PatchChunks {

    static final String PATCH_MARKER = "ls_m2_patch_run";
    static final String ROLLBACK_MARKER = "ls_m2_pr_bundle_rollback";

    private PatchChunks() {}

    /** Chunks joined by a blank line with a trailing newline; empty for no edits. */
    public static String render(List<PlanEdit> edits) {
        if (edits.isEmpty()) {
            return "";
        }
        return edits.stream().map(edit -> chunk(edit, edit.operation(), PATCH_MARKER))
                .collect(Collectors.joining("\n\n")) + "\n";
    }

    /** Reverse patch: edits in reverse order with create and delete swapped. */
    public static String renderRollback(List<PlanEdit> edits) {
        if (edits.isEmpty()) {
            return "";
        }
        List<PlanEdit> reversed = new ArrayList<>(edits);
        Collections.reverse(reversed);
        return reversed.stream().map(edit -> chunk(edit, edit.operation().inverse(), ROLLBACK_MARKER))
                .collect(Collectors.joining("\n\n")) + "\n";
    }

    static String chunk(PlanEdit edit, EditOperation operation, String marker) {
        String path = edit.path();
        String metadata = metadata(edit);
        String header = "diff --git a/" + path + " b/" + path;
        return switch (operation) {
            case CREATE -> String.join("\n",
                    header,
                    "new file mode 100644",
                    "--- /dev/null",
                    "+++ b/" + path,
                    "@@ -0,0 +1 @@",
                    "+__" + marker + "_create__ " + metadata);
            case DELETE -> String.join("\n",
                    header,
                    "deleted file mode 100644",
                    "--- a/" + path,
                    "+++ /dev/null",
                    "@@ -1 +0,0 @@",
                    "-__" + marker + "_delete__ " + metadata);
            case MODIFY -> String.join("\n",
                    header,
                    "--- a/" + path,
                    "+++ b/" + path,
                    "@@ -1 +1 @@",
                    "-__" + marker + "_before__",
                    "+__" + marker + "_after__ " + metadata);
        };
    }

    /**
     * {@code symbol:file} marks a whole-file edit that came from a mapped target;
     * {@code symbol:unspecified} marks a planner override without target information.
     */
    static String metadata(PlanEdit edit) {
        String symbol;
        if (edit.symbolPath() != null) {
            symbol = "symbol:" + Envelopes.singleLine(edit.symbolPath(), 96);
        } else {
            symbol = edit.targetId() != null ? "symbol:file" : "symbol:unspecified";
        }
        String target = edit.targetId() != null ? "target:" + Envelopes.singleLine(edit.targetId(), 96)
                : "target:none";
        String why = "why:" + Envelopes.singleLine(edit.justification(), 120);
        return symbol + " | " + target + " | " + why;
    }
}
