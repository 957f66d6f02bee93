package com.lsemantica.core.pipeline.patch;

import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.Envelopes;
import com.lsemantica.core.pipeline.PipelineFixtures;
import com.lsemantica.core.pipeline.ReasonCode;
import com.lsemantica.core.pipeline.diffplan.EditOperation;
import com.lsemantica.core.pipeline.diffplan.PlanEdit;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlan;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanOptions;
import com.lsemantica.core.pipeline.diffplan.SafeDiffPlanService;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class PatchRunServiceTest {

    @TempDir
    Path workspace;

    private final PatchRunService service = new PatchRunService();
    private SafeDiffPlan plan;

    @BeforeEach
    void setUp() {
        PipelineFixtures.workspace(workspace);
        plan = PipelineFixtures.plan(workspace);
    }

    @Nested
    @DisplayName("Verification gating")
    class GatingTests {

        @Test
        @DisplayName("all checks passing with evidence continues")
        void passing() {
            PatchRun run = service.run(plan, PatchRunOptions.of(PipelineFixtures.passingResults()));

            assertEquals(Decision.CONTINUE, run.payload().decision());
            assertEquals(ReasonCode.OK, run.payload().reasonCode());
            PatchRun.Verification verification = run.payload().verification();
            assertTrue(verification.checksComplete());
            assertTrue(verification.evidenceComplete());
            assertTrue(verification.allRequiredPassed());
            assertEquals(List.of("lint", "test", "typecheck"), verification.requiredChecks());
            assertEquals(List.of("lint", "test", "typecheck"),
                    verification.results().stream().map(VerificationResult::check).toList());
        }

        @Test
        @DisplayName("a missing required check is incomplete")
        void missingCheck() {
            PatchRun run = service.run(plan, PatchRunOptions.of(List.of(
                    VerificationResult.passed("lint", "ci://lint/1"),
                    VerificationResult.passed("typecheck", "ci://typecheck/1"))));

            assertEquals(Decision.STOP, run.payload().decision());
            assertEquals(ReasonCode.VERIFICATION_INCOMPLETE, run.payload().reasonCode());
            assertEquals("Required verification evidence is incomplete: missing required checks: test.",
                    run.payload().reasonDetail());
            assertEquals(List.of("test"), run.payload().verification().missingRequiredChecks());
        }

        @Test
        @DisplayName("not-run checks and missing evidence are both reported")
        void notRunAndEvidence() {
            PatchRun run = service.run(plan, PatchRunOptions.of(List.of(
                    VerificationResult.passed("lint", null),
                    new VerificationResult("typecheck", CheckStatus.NOT_RUN, "ci://typecheck/1", null),
                    VerificationResult.passed("test", "ci://test/1"))));

            assertEquals(ReasonCode.VERIFICATION_INCOMPLETE, run.payload().reasonCode());
            assertEquals("Required verification evidence is incomplete: not-run required checks: typecheck; "
                    + "missing evidence links for: lint.", run.payload().reasonDetail());
            assertEquals(List.of("lint", "typecheck"), run.payload().verification().incompleteChecks());
        }

        @Test
        @DisplayName("a failing check with evidence is a verification failure")
        void failing() {
            PatchRun run = service.run(plan, PatchRunOptions.of(List.of(
                    VerificationResult.failed("lint", "ci://lint/1", "2 errors"),
                    VerificationResult.passed("typecheck", "ci://typecheck/1"),
                    VerificationResult.passed("test", "ci://test/1"))));

            assertEquals(Decision.STOP, run.payload().decision());
            assertEquals(ReasonCode.VERIFICATION_FAILED, run.payload().reasonCode());
            assertEquals("Required verification checks failed: lint.", run.payload().reasonDetail());
            assertEquals(List.of("lint"), run.payload().verification().failingChecks());
        }

        @Test
        @DisplayName("custom required checks replace the defaults")
        void customChecks() {
            PatchRun run = service.run(plan, PatchRunOptions.of(List.of(VerificationResult.passed("test", "ci://t")))
                    .withRequiredChecks(List.of(" test ")));

            assertEquals(Decision.CONTINUE, run.payload().decision());
            assertEquals(List.of("test"), run.payload().verification().requiredChecks());
        }

        @Test
        @DisplayName("policy-sensitive paths escalate even when checks pass")
        void policySensitive() {
            IntentMapping mapping = PipelineFixtures.mapping(workspace, PipelineFixtures.CAPABILITY_INTENT);
            SafeDiffPlan workflowPlan = new SafeDiffPlanService().plan(mapping, SafeDiffPlanOptions.defaults()
                    .withEscalationPathPatterns(List.of())
                    .withPlannedEdits(List.of(PlanEdit.of(".github/workflows/ci.yml", EditOperation.MODIFY))));
            assertEquals(Decision.CONTINUE, workflowPlan.payload().decision());

            PatchRun run = service.run(workflowPlan, PatchRunOptions.of(PipelineFixtures.passingResults()));

            assertEquals(Decision.ESCALATE, run.payload().decision());
            assertEquals(ReasonCode.POLICY_BLOCKED, run.payload().reasonCode());
            assertEquals("Patch targets policy-sensitive paths requiring human review: .github/workflows/ci.yml.",
                    run.payload().reasonDetail());
        }
    }

    @Nested
    @DisplayName("Patch materialization")
    class MaterializationTests {

        @Test
        @DisplayName("the patch is a digest-bound placeholder diff")
        void patchContent() {
            PatchRun run = service.run(plan, PatchRunOptions.of(PipelineFixtures.passingResults()));

            PatchRun.Patch patch = run.payload().patch();
            assertEquals(PatchRun.FORMAT_UNIFIED_DIFF, patch.format());
            assertEquals(1, patch.fileCount());
            assertEquals(1, patch.hunkCount());
            assertTrue(patch.content().startsWith("diff --git a/specs/release.ls b/specs/release.ls\n"));
            assertTrue(patch.content().contains("+__ls_m2_patch_run_after__ symbol:capability:write_notes | target:"));
            assertTrue(patch.content().endsWith("\n"));
            assertEquals(Envelopes.digest(patch.content()), run.payload().patchDigest());
            assertEquals(PatchRunService.DEFAULT_MATERIALIZATION, run.trace().patchMaterialization());
            assertEquals(List.of(plan.ref()), run.inputs());
            assertEquals(PipelineFixtures.RUN_ID, run.runId());
        }

        @Test
        @DisplayName("rollback chunks reverse order and invert create/delete")
        void rollbackChunks() {
            List<PlanEdit> edits = List.of(
                    new PlanEdit("a.txt", EditOperation.CREATE, "new file", null, null),
                    new PlanEdit("b.txt", EditOperation.DELETE, "old file", "t-b", null));

            String rollback = PatchChunks.renderRollback(edits);

            assertTrue(rollback.indexOf("b/b.txt") < rollback.indexOf("b/a.txt"));
            assertTrue(rollback.contains("-__ls_m2_pr_bundle_rollback_delete__ symbol:unspecified | target:none"));
            assertTrue(rollback.contains("+__ls_m2_pr_bundle_rollback_create__ symbol:file | target:t-b"));
            assertEquals("", PatchChunks.render(List.of()));
        }

        @Test
        @DisplayName("a blocked plan propagates with an empty patch")
        void blockedPlan() {
            SafeDiffPlan forbidden = new SafeDiffPlanService().plan(
                    PipelineFixtures.mapping(workspace, PipelineFixtures.CAPABILITY_INTENT),
                    SafeDiffPlanOptions.defaults().withPlannedEdits(List.of(PlanEdit.of(".env", EditOperation.MODIFY))));

            PatchRun run = service.run(forbidden, PatchRunOptions.of(PipelineFixtures.passingResults()));

            assertEquals(Decision.STOP, run.payload().decision());
            assertEquals(ReasonCode.FORBIDDEN_PATH, run.payload().reasonCode());
            assertTrue(run.payload().reasonDetail().startsWith("Safe diff plan blocked patch generation: "));
            assertEquals("", run.payload().patch().content());
            assertEquals(0, run.payload().patch().hunkCount());
        }
    }

    @Nested
    @DisplayName("Input validation")
    class ValidationTests {

        @Test
        @DisplayName("duplicate verification checks are rejected")
        void duplicateChecks() {
            var ex = assertThrows(PatchRunException.class, () -> service.run(plan, PatchRunOptions.of(List.of(
                    VerificationResult.passed("lint", "a"), VerificationResult.passed("lint", "b")))));
            assertEquals(PatchRunException.Code.INVALID_OPTIONS, ex.code());
        }

        @Test
        @DisplayName("an empty required check list is rejected")
        void emptyRequired() {
            var ex = assertThrows(PatchRunException.class,
                    () -> service.run(plan, PatchRunOptions.of(List.of()).withRequiredChecks(List.of())));
            assertEquals(PatchRunException.Code.INVALID_OPTIONS, ex.code());
        }

        @Test
        @DisplayName("a missing plan is rejected")
        void missingPlan() {
            var ex = assertThrows(PatchRunException.class, () -> service.run(null, PatchRunOptions.of(List.of())));
            assertEquals(PatchRunException.Code.INVALID_SAFE_DIFF_PLAN, ex.code());
        }
    }
}
