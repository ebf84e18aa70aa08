package org.calista.specopt.ai.env;

import org.calista.specopt.ai.TestFixtures;
import org.calista.specopt.ai.action.Action;
import org.calista.specopt.ai.action.ActionDecoder;
import org.calista.specopt.ai.action.ActionSpace;
import org.calista.specopt.ai.encode.impl.HashingSpecEncoder;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.InvalidSpecException;
import org.calista.specopt.ai.spec.SceneMetadata;
import org.calista.specopt.ai.spec.SpecObject;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.*;

class SpecEditEnvironmentTest {

    private HashingSpecEncoder encoder;
    private ActionSpace space;
    private SpecEditEnvironment env;

    @BeforeEach
    void setUp() {
        encoder = TestFixtures.encoder();
        space = TestFixtures.actionSpace();
        env = new SpecEditEnvironment(encoder, new ActionDecoder(space), TestFixtures.constantReward(encoder, 0.5),
                SpecEditEnvironment.Config.builder()
                        .horizon(3)
                        .violationPenalty(1.0)
                        .constraints(new HardConstraints(0.05, 2.5, 4))
                        .build());
    }

    // --- state machine ---

    @Test
    void stepBeforeResetIsInvalidState() {
        assertEquals(EnvironmentState.UNINITIALIZED, env.state());
        assertThrows(InvalidStateException.class, () -> env.step(0));
    }

    @Test
    void resetReturnsObservationOfEncoderDim() {
        var obs = env.reset(TestFixtures.livingRoom(), "modern");

        assertEquals(encoder.dim(), obs.dim());
        assertEquals(EnvironmentState.READY, env.state());
        assertEquals(0, env.stepCount());
        assertEquals(space.size(), env.actionCount());
    }

    @Test
    void resetRejectsInvalidSpec() {
        assertThrows(InvalidSpecException.class, () -> env.reset(TestFixtures.duplicateIds(), ""));
    }

    @Test
    @DisplayName("explicit NO_OP terminates; further steps are rejected until reset")
    void noOpTerminates() {
        env.reset(TestFixtures.livingRoom(), "");
        StepResult r = env.step(space.noOpIndex());

        assertTrue(r.terminated());
        assertFalse(r.truncated());
        assertEquals(0.5, r.reward(), 0.0);
        assertEquals(EnvironmentState.TERMINAL, env.state());
        assertThrows(InvalidStateException.class, () -> env.step(0));

        env.reset(TestFixtures.livingRoom(), "");
        assertEquals(EnvironmentState.READY, env.state());
        assertEquals(0, env.stepCount());
    }

    @Test
    void truncatesAtHorizon() {
        env.reset(TestFixtures.livingRoom(), "");
        int oak = space.indexOf(Action.setMaterial(0, "wood_oak"));
        int marble = space.indexOf(Action.setMaterial(0, "marble_white"));

        assertFalse(env.step(oak).done());
        assertFalse(env.step(marble).done());
        StepResult last = env.step(oak);

        assertTrue(last.truncated());
        assertFalse(last.terminated());
        assertEquals(3, last.info().get(StepResult.INFO_STEP));
        assertEquals(EnvironmentState.TERMINAL, env.state());
    }

    @Test
    @DisplayName("a degraded action is a no-op edit but does not end the episode")
    void degradedActionDoesNotTerminate() {
        env.reset(DesignSpecification.of(List.of()), "");
        StepResult r = env.step(space.indexOf(Action.remove(1)));

        assertFalse(r.done());
        assertEquals(Boolean.TRUE, r.info().get(StepResult.INFO_DEGRADED));
        assertEquals(0, env.currentSpec().objectCount());
    }

    // --- constraints ---

    @Nested
    class Violations {

        @Test
        void newViolationTerminatesWithPenalty() {
            env.reset(TestFixtures.livingRoom(), "");
            StepResult r = env.step(space.indexOf(Action.resize(0, 2.0)));

            assertTrue(r.terminated());
            assertTrue(r.violated());
            assertEquals(-0.5, r.reward(), 1e-12);
            assertTrue(String.valueOf(r.info().get(StepResult.INFO_VIOLATION)).contains("sofa_1.width"));
        }

        @Test
        @DisplayName("a spec that already broke a limit is not penalised for unrelated edits")
        void preExistingViolationIsNotBlamed() {
            SpecObject big = new SpecObject("rug_1", "rug", "wool", null, Map.of("width", 3.0), null);
            env.reset(DesignSpecification.of(List.of(big)), "");

            StepResult r = env.step(space.indexOf(Action.setMaterial(0, "marble_white")));

            assertFalse(r.violated());
            assertFalse(r.terminated());
            assertEquals(0.5, r.reward(), 0.0);
        }

        @Test
        void worseningAnAlreadyBrokenLimitIsNotBlamed() {
            SpecObject big = new SpecObject("rug_1", "rug", "wool", null, Map.of("width", 3.0), null);
            env.reset(DesignSpecification.of(List.of(big)), "");

            StepResult r = env.step(space.indexOf(Action.resize(0, 2.0)));

            assertFalse(r.violated());
            assertEquals(6.0, env.currentSpec().object(0).dimension("width", 0), 1e-12);
        }

        @Test
        @DisplayName("an over-budget spec is still penalised for breaking a dimension limit")
        void overBudgetSpecStillChecksOtherLimits() {
            var base = TestFixtures.livingRoom();
            var overBudget = new DesignSpecification(base.specId(), base.designType(), base.objects(),
                    new SceneMetadata("modern", "Oslo", 500.0), 1000.0);
            env.reset(overBudget, "");

            StepResult r = env.step(space.indexOf(Action.resize(0, 2.0)));

            assertTrue(r.violated());
            assertTrue(r.terminated());
            assertEquals(-0.5, r.reward(), 1e-12);
            assertTrue(String.valueOf(r.info().get(StepResult.INFO_VIOLATION)).contains("sofa_1.width=4.0 exceeds"));
        }
    }

    @Test
    void rewardModelMustMatchEncoderDim() {
        var other = new HashingSpecEncoder(HashingSpecEncoder.Config.builder().dim(64).build());
        var cfg = SpecEditEnvironment.Config.builder().build();
        var decoder = new ActionDecoder(space);
        var rm = TestFixtures.constantReward(other, 0.0);

        assertThrows(IllegalArgumentException.class, () -> new SpecEditEnvironment(encoder, decoder, rm, cfg));
    }
}
