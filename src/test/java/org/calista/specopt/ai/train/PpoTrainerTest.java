package org.calista.specopt.ai.train;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.specopt.ai.TestFixtures;
import org.calista.specopt.ai.action.ActionDecoder;
import org.calista.specopt.ai.encode.impl.HashingSpecEncoder;
import org.calista.specopt.ai.env.SpecEditEnvironment;
import org.calista.specopt.ai.events.EventStore;
import org.calista.specopt.ai.events.OptEvent;
import org.calista.specopt.ai.policy.PolicyCheckpoint;
import org.calista.specopt.ai.policy.PolicyCheckpointStore;
import org.calista.specopt.ai.reward.ModelUnavailableException;
import org.calista.specopt.ai.reward.RewardModel;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.InvalidSpecException;
import org.calista.specopt.ai.train.remote.ComputePreference;
import org.calista.specopt.ai.train.remote.ComputeRouter;
import org.calista.specopt.ai.train.remote.JobHandle;
import org.calista.specopt.ai.train.remote.RemoteJobClient;
import org.calista.specopt.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.mockito.ArgumentCaptor;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.function.Supplier;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class PpoTrainerTest {

    /** 2 envs x 8 steps = 16 env steps per update; 64 steps = 4 updates. */
    private static final int ENVS = 2;
    private static final long STEPS = 64;

    @TempDir
    Path tmp;

    private ObjectMapper mapper;
    private HashingSpecEncoder encoder;
    private ActionDecoder decoder;
    private RewardModel rewardModel;
    private Hyperparameters hp;

    @BeforeEach
    void setUp() {
        mapper = TestFixtures.mapper();
        encoder = TestFixtures.encoder();
        decoder = TestFixtures.decoder();
        rewardModel = TestFixtures.mlpReward(encoder, 11L);
        hp = Hyperparameters.builder()
                .rolloutLength(8)
                .epochs(2)
                .minibatchSize(8)
                .learningRate(1e-2)
                .hidden(8)
                .checkpointEvery(1)
                .seed(7L)
                .build();
    }

    private PpoTrainer trainer(String dir, Supplier<RewardModel> rm, ComputeRouter router, EventStore events) {
        FileIO io = new FileIO(tmp.resolve(dir));
        return PpoTrainer.builder()
                .encoder(encoder)
                .decoder(decoder)
                .environment(SpecEditEnvironment.Config.builder().horizon(4).build())
                .rewardModels(rm)
                .checkpoints(new PolicyCheckpointStore(io, mapper, io.resolve("policy")))
                .router(router)
                .events(events)
                .mapper(mapper)
                .config(PpoTrainer.Config.builder().workerThreads(2).threadNamePrefix("test-rollout-").build())
                .build();
    }

    private PpoTrainer localTrainer(String dir) {
        return trainer(dir, () -> rewardModel, ComputeRouter.defaults(), null);
    }

    private static List<DesignSpecification> specs() {
        return List.of(TestFixtures.livingRoom(), TestFixtures.floorOnly());
    }

    private PolicyCheckpoint read(Path file) throws Exception {
        return mapper.readValue(Files.readString(file), PolicyCheckpoint.class);
    }

    // --- local runs ---

    @Test
    void plannedUpdatesRoundsUp() {
        assertEquals(4, PpoTrainer.plannedUpdates(64, ENVS, hp));
        assertEquals(5, PpoTrainer.plannedUpdates(65, ENVS, hp));
        assertEquals(1, PpoTrainer.plannedUpdates(1, ENVS, hp));
    }

    @Test
    @DisplayName("a local run writes one checkpoint per update and points LATEST at the last")
    void localRunWritesCheckpoints() throws Exception {
        ArrayList<UpdateStats> seen = new ArrayList<>();
        TrainingOutcome out = localTrainer("run").train(specs(), STEPS, ENVS, hp, CancellationToken.none(), seen::add);

        assertFalse(out.isRemote());
        assertEquals(4, out.updates());
        assertEquals(64L, out.envSteps());
        assertEquals("policy-u000004.json", out.checkpointPath().getFileName().toString());
        assertEquals("policy-u000004.json",
                Files.readString(out.checkpointPath().resolveSibling(PolicyCheckpointStore.LATEST)).trim());

        assertEquals(4, seen.size());
        for (int i = 0; i < seen.size(); i++) {
            UpdateStats s = seen.get(i);
            assertEquals(i + 1, s.update());
            assertEquals(16L * (i + 1), s.envSteps());
            assertNotNull(s.checkpoint());
            assertTrue(Double.isFinite(s.policyLoss()));
            assertTrue(s.entropy() > 0.0);
        }

        PolicyCheckpoint cp = read(out.checkpointPath());
        assertEquals(4, cp.update);
        assertEquals(encoder.dim(), cp.observationDim);
        assertEquals(decoder.space().size(), cp.actionCount);
    }

    @Test
    void sameSeedGivesSameWeights() throws Exception {
        Path a = localTrainer("a").train(specs(), STEPS, ENVS, hp).checkpointPath();
        Path b = localTrainer("b").train(specs(), STEPS, ENVS, hp).checkpointPath();

        assertArrayEquals(read(a).params, read(b).params, 0.0);
    }

    @Test
    void eventsAreLogged() throws Exception {
        FileIO io = new FileIO(tmp);
        EventStore events = new EventStore(io, mapper, io.resolve("events.jsonl"));
        trainer("ev", () -> rewardModel, ComputeRouter.defaults(), events).train(specs(), 32, ENVS, hp);

        List<String> types = events.readAll().stream().map(e -> e.type).toList();
        assertEquals(List.of("TRAIN_START", "TRAIN_UPDATE", "TRAIN_UPDATE", "TRAIN_END"), types);
        OptEvent update = events.readAll().get(1);
        assertEquals(1, update.update);
        assertNotNull(update.runId);
    }

    // --- cancellation / resume ---

    @Nested
    class CancelAndResume {

        @Test
        @DisplayName("cancelling after update 2 keeps the update-2 checkpoint")
        void cancellationStopsBetweenUpdates() {
            CancellationToken token = new CancellationToken();
            TrainingListener cancelAtTwo = s -> {
                if (s.update() == 2) token.cancel();
            };

            TrainingInterruptedException e = assertThrows(TrainingInterruptedException.class,
                    () -> localTrainer("cancel").train(specs(), STEPS, ENVS, hp, token, cancelAtTwo));

            assertEquals(2, e.completedUpdates());
            assertEquals("policy-u000002.json", e.lastCheckpoint().getFileName().toString());
            assertFalse(Files.exists(e.lastCheckpoint().resolveSibling("policy-u000003.json")));
        }

        @Test
        @DisplayName("resuming an interrupted run reproduces the uninterrupted weights")
        void resumeMatchesUninterruptedRun() throws Exception {
            Path full = localTrainer("full").train(specs(), STEPS, ENVS, hp).checkpointPath();

            CancellationToken token = new CancellationToken();
            PpoTrainer interrupted = localTrainer("split");
            TrainingInterruptedException e = assertThrows(TrainingInterruptedException.class,
                    () -> interrupted.train(specs(), STEPS, ENVS, hp, token, s -> {
                        if (s.update() == 2) token.cancel();
                    }));

            TrainingOutcome resumed = interrupted.resume(e.lastCheckpoint(), specs(), STEPS, ENVS, hp,
                    CancellationToken.none(), TrainingListener.NONE);

            assertEquals(4, resumed.updates());
            assertEquals(64L, resumed.envSteps());
            PolicyCheckpoint a = read(full);
            PolicyCheckpoint b = read(resumed.checkpointPath());
            assertArrayEquals(a.params, b.params, 0.0);
            assertArrayEquals(a.adamM, b.adamM, 0.0);
        }

        @Test
        void resumeFromFinalCheckpointIsANoOp() throws Exception {
            PpoTrainer t = localTrainer("done");
            Path last = t.train(specs(), STEPS, ENVS, hp).checkpointPath();

            TrainingOutcome again = t.resume(last, specs(), STEPS, ENVS, hp, CancellationToken.none(), TrainingListener.NONE);
            assertEquals(4, again.updates());
            assertEquals(last, again.checkpointPath());
        }
    }

    // --- failures ---

    @Test
    @DisplayName("an invalid base spec is skipped and reported, the run still completes")
    void invalidBaseSpecIsIsolated() throws Exception {
        ArrayList<UpdateStats> seen = new ArrayList<>();
        TrainingOutcome out = localTrainer("mixed").train(
                List.of(TestFixtures.livingRoom(), TestFixtures.duplicateIds()), 32, ENVS, hp,
                CancellationToken.none(), seen::add);

        assertEquals(2, out.updates());
        assertTrue(seen.stream().allMatch(s -> s.invalidResets() >= 1));
    }

    @Test
    void allBaseSpecsInvalidFails() {
        PpoTrainer t = localTrainer("bad");
        assertThrows(InvalidSpecException.class, () -> t.train(List.of(TestFixtures.duplicateIds()), 32, ENVS, hp));
    }

    @Test
    void missingRewardModelFailsBeforeAnyWork() {
        RemoteJobClient remote = mock(RemoteJobClient.class);
        PpoTrainer t = trainer("norm", () -> {
            throw new ModelUnavailableException("reward model checkpoint not found", "models/reward-model.json");
        }, new ComputeRouter(ComputePreference.AUTO, 100, remote), null);

        assertThrows(ModelUnavailableException.class, () -> t.train(specs(), 1_000, ENVS, hp));
        assertFalse(Files.exists(tmp.resolve("norm/policy")));
        verifyNoInteractions(remote);
    }

    @Test
    void rejectsBadArguments() {
        PpoTrainer t = localTrainer("args");
        assertThrows(IllegalArgumentException.class, () -> t.train(List.of(), 32, ENVS, hp));
        assertThrows(IllegalArgumentException.class, () -> t.train(specs(), 0, ENVS, hp));
        assertThrows(IllegalArgumentException.class, () -> t.train(specs(), 32, 0, hp));
    }

    // --- routing ---

    @Nested
    class Remote {

        @Test
        @DisplayName("a job above the local threshold is submitted remotely")
        void largeJobIsSubmitted() throws Exception {
            RemoteJobClient remote = mock(RemoteJobClient.class);
            when(remote.submit(anyString(), any())).thenReturn(
                    new JobHandle("job-7", PpoTrainer.REMOTE_JOB_KIND, "http://compute", 1L));

            TrainingOutcome out = trainer("remote", () -> rewardModel,
                    new ComputeRouter(ComputePreference.AUTO, 100, remote), null)
                    .train(specs(), 100_000, 8, hp);

            assertTrue(out.isRemote());
            assertEquals("job-7", out.jobHandle().id());
            assertNull(out.checkpointPath());

            ArgumentCaptor<JsonNode> payload = ArgumentCaptor.forClass(JsonNode.class);
            verify(remote).submit(eq(PpoTrainer.REMOTE_JOB_KIND), payload.capture());
            assertEquals(100_000L, payload.getValue().get("steps").asLong());
            assertEquals(8, payload.getValue().get("envCount").asInt());
            assertEquals(2, payload.getValue().get("baseSpecs").size());
            assertEquals(rewardModel.version(), payload.getValue().get("rewardModelVersion").asText());
            assertEquals(7L, payload.getValue().get("hyperparameters").get("seed").asLong());
            assertFalse(Files.exists(tmp.resolve("remote/policy")));
        }

        @Test
        void smallJobStaysLocal() throws Exception {
            RemoteJobClient remote = mock(RemoteJobClient.class);
            TrainingOutcome out = trainer("small", () -> rewardModel,
                    new ComputeRouter(ComputePreference.AUTO, 100, remote), null)
                    .train(specs(), 32, ENVS, hp);

            assertFalse(out.isRemote());
            verifyNoInteractions(remote);
        }

        @Test
        void largeJobWithoutRemoteEndpointFails() {
            PpoTrainer t = trainer("noremote", () -> rewardModel,
                    new ComputeRouter(ComputePreference.AUTO, 100, null), null);

            assertThrows(IllegalStateException.class, () -> t.train(specs(), 100_000, ENVS, hp));
        }

        @Test
        @DisplayName("a LOCAL preference does not keep a large job in-process")
        void localPreferenceCannotRunLargeJob() throws Exception {
            RemoteJobClient remote = mock(RemoteJobClient.class);
            when(remote.submit(anyString(), any())).thenReturn(
                    new JobHandle("job-8", PpoTrainer.REMOTE_JOB_KIND, "http://compute", 1L));

            TrainingOutcome out = trainer("forced", () -> rewardModel,
                    new ComputeRouter(ComputePreference.LOCAL, 100, remote), null)
                    .train(specs(), 100, ENVS, hp);

            assertTrue(out.isRemote());
            assertFalse(Files.exists(tmp.resolve("forced/policy")));
        }

        @Test
        void defaultRouterRefusesLargeJob() {
            PpoTrainer t = localTrainer("default");
            assertThrows(IllegalStateException.class,
                    () -> t.train(specs(), ComputeRouter.DEFAULT_LOCAL_STEP_THRESHOLD, ENVS, hp));
        }

        @Test
        void resumeRefusesBudgetAtThreshold() throws Exception {
            PpoTrainer small = trainer("resume-cap", () -> rewardModel,
                    new ComputeRouter(ComputePreference.AUTO, 100, null), null);
            Path cp = small.train(specs(), 32, ENVS, hp).checkpointPath();

            assertThrows(IllegalStateException.class, () -> small.resume(cp, specs(), 100, ENVS, hp,
                    CancellationToken.none(), TrainingListener.NONE));
        }
    }
}
