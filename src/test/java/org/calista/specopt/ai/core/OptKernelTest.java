package org.calista.specopt.ai.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.specopt.ai.TestFixtures;
import org.calista.specopt.ai.policy.PolicyCheckpoint;
import org.calista.specopt.ai.reward.ModelUnavailableException;
import org.calista.specopt.ai.reward.feedback.FeedbackRecord;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.InvalidSpecException;
import org.calista.specopt.ai.spec.SpecObject;
import org.calista.specopt.ai.suggest.Strategy;
import org.calista.specopt.ai.suggest.Suggestion;
import org.calista.specopt.ai.train.TrainingOutcome;
import org.calista.specopt.ai.train.remote.JobHandle;
import org.calista.specopt.ai.train.remote.RemoteJobClient;
import org.calista.specopt.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import java.util.function.Consumer;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class OptKernelTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = TestFixtures.mapper();

    @BeforeEach
    void setUp() throws Exception {
        writeConfig(cfg -> { });
    }

    /** Small, fast settings; {@code tweak} adjusts them per test. */
    private void writeConfig(Consumer<OptConfig> tweak) throws Exception {
        OptConfig cfg = new OptConfig();
        cfg.baseDir = tmp.resolve("data").toString();
        cfg.encoder.dim = 32;
        cfg.actions.maxSlots = 3;
        cfg.actions.materials = List.of("wood_oak", "marble_white");
        cfg.actions.scaleFactors = List.of(0.5, 2.0);
        cfg.actions.addableTypes = List.of("plant", "lamp");
        cfg.environment.horizon = 4;
        cfg.rewardModel.hidden = 8;
        cfg.rewardModel.epochs = 50;
        cfg.training.envCount = 2;
        cfg.training.rolloutLength = 4;
        cfg.training.epochs = 1;
        cfg.training.minibatchSize = 8;
        cfg.training.hidden = 4;
        cfg.training.checkpointEvery = 1;
        cfg.training.workerThreads = 1;
        tweak.accept(cfg);
        OptConfig.save(new FileIO(tmp), tmp.resolve("specopt.json"), mapper, cfg);
    }

    private OptKernel kernel() throws Exception {
        return OptKernel.builder().configRoot(tmp).mapper(mapper).build(Path.of("specopt.json"));
    }

    private void recordPreferences(OptKernel k) throws Exception {
        DesignSpecification plain = TestFixtures.livingRoom();
        DesignSpecification fancy = plain.withObject(0, plain.object(0).withMaterial("marble_white"));
        for (int i = 0; i < 3; i++) {
            k.feedbackLog().append(FeedbackRecord.preferring("luxury", k.codec().toJson(plain), k.codec().toJson(fancy), "B"));
        }
    }

    // --- wiring ---

    @Test
    void buildsFromConfigFile() throws Exception {
        OptKernel k = kernel();

        assertEquals(32, k.encoder().dim());
        assertEquals(18, k.actionSpace().size());
        assertEquals(tmp.resolve("data").toAbsolutePath().normalize(), k.io().baseDir());
        assertTrue(k.router().remote().isEmpty());
    }

    @Test
    @DisplayName("with no trained models suggestions fall back to the heuristic")
    void noModelsMeansHeuristic() throws Exception {
        OptKernel k = kernel();

        assertFalse(k.probeRewardModel().isAvailable());
        assertEquals(ErrorKind.MODEL_UNAVAILABLE, k.probePolicy().kind());

        Suggestion s = k.suggestionService().suggest(TestFixtures.floorOnly(), "", Strategy.POLICY_ROLLOUT);
        assertTrue(s.fellBack());
        assertEquals("wood_oak", s.improvedSpec().object(0).material());
    }

    @Test
    @DisplayName("a corrupt policy checkpoint falls back to the heuristic instead of failing")
    void corruptPolicyCheckpointFallsBack() throws Exception {
        OptKernel k = kernel();
        PolicyCheckpoint cp = new PolicyCheckpoint();
        cp.observationDim = k.encoder().dim();
        cp.hidden = 0;
        cp.actionCount = k.actionSpace().size();
        cp.params = new double[cp.actionCount + 1];
        k.policyStore().save(cp);

        assertEquals(ErrorKind.MODEL_UNAVAILABLE, k.probePolicy().kind());
        Suggestion s = k.suggestionService().suggest(TestFixtures.floorOnly(), "", Strategy.POLICY_ROLLOUT);
        assertTrue(s.fellBack());
        assertEquals(Strategy.HEURISTIC_FALLBACK, s.strategyUsed());
    }

    // --- reward model ---

    @Test
    void emptyFeedbackLogCannotTrainRewardModel() throws Exception {
        OptKernel k = kernel();
        assertThrows(IllegalStateException.class, k::trainRewardModel);
    }

    @Test
    void feedbackTrainsAnAvailableRewardModel() throws Exception {
        OptKernel k = kernel();
        recordPreferences(k);

        var res = k.trainRewardModel();

        assertEquals(3, res.pairs());
        assertTrue(Files.exists(k.rewardModelStore().file()));
        assertTrue(k.probeRewardModel().isAvailable());
    }

    // --- policy ---

    @Test
    void trainingNeedsARewardModel() throws Exception {
        OptKernel k = kernel();
        assertThrows(ModelUnavailableException.class, () -> k.train(List.of(TestFixtures.livingRoom()), 8));
    }

    @Test
    @DisplayName("a small local run makes the policy rollout path available")
    void localTrainingEnablesPolicyRollout() throws Exception {
        OptKernel k = kernel();
        recordPreferences(k);
        k.trainRewardModel();

        TrainingOutcome out = k.train(List.of(TestFixtures.livingRoom(), TestFixtures.floorOnly()), 16);

        assertFalse(out.isRemote());
        assertEquals(2, out.updates());
        assertTrue(k.probePolicy().isAvailable());

        var svc = k.suggestionService();
        assertTrue(svc.policyRolloutAvailable());
        Suggestion s = svc.suggest(TestFixtures.livingRoom(), "luxury", Strategy.POLICY_ROLLOUT);
        assertEquals(Strategy.POLICY_ROLLOUT, s.strategyUsed());
        assertTrue(s.steps() <= 4);

        List<String> types = k.eventStore().readAll().stream().map(e -> e.type).toList();
        assertEquals("TRAIN_START", types.get(0));
        assertEquals("TRAIN_END", types.get(types.size() - 1));
    }

    @Test
    void remotePreferenceSubmitsToInjectedClient() throws Exception {
        writeConfig(cfg -> cfg.remote.preference = "cloud");
        RemoteJobClient remote = mock(RemoteJobClient.class);
        when(remote.submit(eq("opt_ppo_train"), any())).thenReturn(new JobHandle("r-1", "opt_ppo_train", "mock", 0L));

        OptKernel k = OptKernel.builder().configRoot(tmp).mapper(mapper).remoteClient(remote).build(Path.of("specopt.json"));
        recordPreferences(k);
        k.trainRewardModel();

        TrainingOutcome out = k.train(List.of(TestFixtures.livingRoom()), 8);

        assertTrue(out.isRemote());
        assertEquals("r-1", out.jobHandle().id());
        assertTrue(k.policyStore().latest().isEmpty());
    }

    @Test
    void invalidSpecsAreRejectedBySuggest() throws Exception {
        OptKernel k = kernel();
        var bad = DesignSpecification.of(List.of(SpecObject.of("a", "", "oak")));
        assertThrows(InvalidSpecException.class,
                () -> k.suggestionService().suggest(bad, "", Strategy.HEURISTIC_FALLBACK));
    }
}
