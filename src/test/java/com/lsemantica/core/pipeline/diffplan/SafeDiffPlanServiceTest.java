package com.lsemantica.core.pipeline.diffplan;

import com.lsemantica.core.model.Decision;
import com.lsemantica.core.pipeline.PipelineFixtures;
import com.lsemantica.core.pipeline.ReasonCode;
import com.lsemantica.core.pipeline.intent.IntentMapping;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SafeDiffPlanServiceTest {

    @TempDir
    Path workspace;

    private final SafeDiffPlanService service = new SafeDiffPlanService();
    private IntentMapping mapping;

    @BeforeEach
    void setUp() {
        PipelineFixtures.workspace(workspace);
        mapping = PipelineFixtures.mapping(workspace, PipelineFixtures.CAPABILITY_INTENT);
    }

    private SafeDiffPlan planWith(PlanEdit... edits) {
        return service.plan(mapping, SafeDiffPlanOptions.defaults().withPlannedEdits(List.of(edits)));
    }

    @Nested
    @DisplayName("Default planning")
    class DefaultPlanningTests {

        @Test
        @DisplayName("the selected candidate becomes a single modify edit")
        void singleEdit() {
            SafeDiffPlan plan = service.plan(mapping, SafeDiffPlanOptions.defaults());

            assertEquals(Decision.CONTINUE, plan.payload().decision());
            assertEquals(ReasonCode.OK, plan.payload().reasonCode());
            assertEquals(1, plan.payload().edits().size());
            PlanEdit edit = plan.payload().edits().get(0);
            assertEquals("specs/release.ls", edit.path());
            assertEquals(EditOperation.MODIFY, edit.operation());
            assertEquals("capability:write_notes", edit.symbolPath());
            assertEquals(mapping.payload().candidates().get(0).targetId(), edit.targetId());
            assertTrue(edit.justification().startsWith("Mapped intent to specs/release.ls#capability:write_notes"));

            assertEquals(SafeDiffPlanService.DEFAULT_PLANNER_PROFILE, plan.trace().plannerProfile());
            assertEquals(1, plan.payload().safetyChecks().maxFileChanges().observed());
            assertEquals(5, plan.payload().safetyChecks().maxFileChanges().limit());
            assertEquals(List.of(mapping.ref()), plan.inputs());
            assertEquals(PipelineFixtures.RUN_ID, plan.runId());
            assertTrue(plan.artifactId().startsWith("dplan_"));
        }

        @Test
        @DisplayName("operation is inferred from intent verbs")
        void inferOperation() {
            assertEquals(EditOperation.DELETE, SafeDiffPlanService.inferOperation("Remove the stale notes"));
            assertEquals(EditOperation.CREATE, SafeDiffPlanService.inferOperation("create a changelog"));
            assertEquals(EditOperation.CREATE, SafeDiffPlanService.inferOperation("add a check for notes"));
            assertEquals(EditOperation.MODIFY, SafeDiffPlanService.inferOperation("add more detail"));
            assertEquals(EditOperation.MODIFY, SafeDiffPlanService.inferOperation("tweak wording"));
        }
    }

    @Nested
    @DisplayName("Upstream propagation")
    class PropagationTests {

        @Test
        @DisplayName("a stopped mapping stops the plan with no edits")
        void stopPropagates() {
            IntentMapping stopped = PipelineFixtures.mapping(workspace, "zebra quantum");

            SafeDiffPlan plan = service.plan(stopped, SafeDiffPlanOptions.defaults());

            assertEquals(Decision.STOP, plan.payload().decision());
            assertEquals(ReasonCode.UNSUPPORTED_INPUT, plan.payload().reasonCode());
            assertTrue(plan.payload().edits().isEmpty());
            assertTrue(plan.payload().reasonDetail().startsWith("Intent mapping blocked diff planning: "));
        }

        @Test
        @DisplayName("an ambiguous mapping keeps its reason code")
        void ambiguousPropagates() {
            IntentMapping ambiguous = PipelineFixtures.mapping(workspace, "release");

            SafeDiffPlan plan = service.plan(ambiguous, SafeDiffPlanOptions.defaults());

            assertEquals(Decision.ESCALATE, plan.payload().decision());
            assertEquals(ReasonCode.MAPPING_AMBIGUOUS, plan.payload().reasonCode());
        }

        @Test
        @DisplayName("planned edits are ignored when the mapping is blocked")
        void overridesIgnoredWhenBlocked() {
            IntentMapping stopped = PipelineFixtures.mapping(workspace, "zebra quantum");

            SafeDiffPlan plan = service.plan(stopped, SafeDiffPlanOptions.defaults()
                    .withPlannedEdits(List.of(PlanEdit.of("src/app.ts", EditOperation.MODIFY))));

            assertTrue(plan.payload().edits().isEmpty());
        }
    }

    @Nested
    @DisplayName("Safety checks")
    class SafetyTests {

        @Test
        @DisplayName("two edits to one path are a conflict")
        void conflict() {
            SafeDiffPlan plan = planWith(PlanEdit.of("src/app.ts", EditOperation.MODIFY),
                    PlanEdit.of("./src/app.ts", EditOperation.DELETE));

            assertEquals(Decision.ESCALATE, plan.payload().decision());
            assertEquals(ReasonCode.CONFLICT_DETECTED, plan.payload().reasonCode());
            assertEquals("Planner produced conflicting edits for the same path(s): src/app.ts.",
                    plan.payload().reasonDetail());
        }

        @Test
        @DisplayName("secrets and paths outside the workspace are forbidden")
        void forbidden() {
            SafeDiffPlan plan = planWith(PlanEdit.of("config/.env.local", EditOperation.MODIFY),
                    PlanEdit.of("../outside.txt", EditOperation.CREATE));

            assertEquals(Decision.STOP, plan.payload().decision());
            assertEquals(ReasonCode.FORBIDDEN_PATH, plan.payload().reasonCode());
            assertEquals("Plan targets forbidden path(s): ../outside.txt, config/.env.local.",
                    plan.payload().reasonDetail());
        }

        @Test
        @DisplayName("configured forbidden patterns extend the secret and VCS defaults")
        void configuredForbiddenPatternsExtendDefaults() {
            SafeDiffPlanOptions options = SafeDiffPlanOptions.defaults()
                    .withForbiddenPathPatterns(List.of("build/**", ".git/**"));

            SafeDiffPlan secret = service.plan(mapping, options
                    .withPlannedEdits(List.of(PlanEdit.of(".env", EditOperation.MODIFY))));
            assertEquals(Decision.STOP, secret.payload().decision());
            assertEquals(ReasonCode.FORBIDDEN_PATH, secret.payload().reasonCode());

            SafeDiffPlan configured = service.plan(mapping, options
                    .withPlannedEdits(List.of(PlanEdit.of("build/out.js", EditOperation.MODIFY))));
            assertEquals(ReasonCode.FORBIDDEN_PATH, configured.payload().reasonCode());

            List<String> patterns = secret.payload().safetyChecks().forbiddenPathPatterns();
            assertTrue(patterns.containsAll(SafeDiffPlanService.DEFAULT_FORBIDDEN_PATH_PATTERNS));
            assertTrue(patterns.contains("build/**"));
            assertEquals(SafeDiffPlanService.DEFAULT_FORBIDDEN_PATH_PATTERNS.size() + 1, patterns.size());
        }

        @Test
        @DisplayName("exceeding the file bound escalates")
        void bounds() {
            SafeDiffPlan plan = service.plan(mapping, SafeDiffPlanOptions.defaults()
                    .withBounds(1, null)
                    .withPlannedEdits(List.of(PlanEdit.of("a.txt", EditOperation.MODIFY),
                            PlanEdit.of("b.txt", EditOperation.MODIFY))));

            assertEquals(Decision.ESCALATE, plan.payload().decision());
            assertEquals(ReasonCode.CHANGE_BOUND_EXCEEDED, plan.payload().reasonCode());
            assertEquals("Plan exceeds conservative safety bounds: max_file_changes 2/1.",
                    plan.payload().reasonDetail());
        }

        @Test
        @DisplayName("CI workflow paths need human review")
        void escalationPath() {
            SafeDiffPlan plan = planWith(PlanEdit.of(".github/workflows/ci.yml", EditOperation.MODIFY));

            assertEquals(Decision.ESCALATE, plan.payload().decision());
            assertEquals(ReasonCode.POLICY_BLOCKED, plan.payload().reasonCode());
        }

        @Test
        @DisplayName("conflicts take precedence over forbidden paths")
        void precedence() {
            SafeDiffPlan plan = planWith(PlanEdit.of(".env", EditOperation.MODIFY),
                    PlanEdit.of(".env", EditOperation.DELETE));

            assertEquals(ReasonCode.CONFLICT_DETECTED, plan.payload().reasonCode());
        }

        @Test
        @DisplayName("planner overrides get a default justification")
        void overrideJustification() {
            SafeDiffPlan plan = planWith(new PlanEdit("src/app.ts", null, null, null, null));

            PlanEdit edit = plan.payload().edits().get(0);
            assertEquals(EditOperation.MODIFY, edit.operation());
            assertEquals("Planner override requested modify on src/app.ts.", edit.justification());
            assertEquals(Decision.CONTINUE, plan.payload().decision());
        }
    }

    @Nested
    @DisplayName("Input validation")
    class ValidationTests {

        @Test
        @DisplayName("bounds outside [1, 10000] are rejected")
        void invalidBounds() {
            var ex = assertThrows(SafeDiffPlanException.class,
                    () -> service.plan(mapping, SafeDiffPlanOptions.defaults().withBounds(0, null)));
            assertEquals(SafeDiffPlanException.Code.INVALID_OPTIONS, ex.code());
        }

        @Test
        @DisplayName("an edit of '.' is rejected")
        void dotPath() {
            var ex = assertThrows(SafeDiffPlanException.class,
                    () -> planWith(PlanEdit.of("./", EditOperation.MODIFY)));
            assertEquals(SafeDiffPlanException.Code.INVALID_OPTIONS, ex.code());
        }

        @Test
        @DisplayName("a missing mapping is rejected")
        void missingMapping() {
            var ex = assertThrows(SafeDiffPlanException.class,
                    () -> service.plan(null, SafeDiffPlanOptions.defaults()));
            assertEquals(SafeDiffPlanException.Code.INVALID_INTENT_MAPPING, ex.code());
        }
    }
}
