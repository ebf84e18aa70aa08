package org.calista.specopt.ai.policy;

import org.calista.specopt.ai.TestFixtures;
import org.calista.specopt.ai.encode.Observation;
import org.calista.specopt.ai.policy.impl.ActorCriticPolicy;
import org.calista.specopt.ai.policy.impl.AdamOptimizer;
import org.calista.specopt.ai.reward.ModelUnavailableException;
import org.calista.specopt.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class PolicyCheckpointStoreTest {

    @TempDir
    Path tmp;

    private PolicyCheckpointStore store;

    @BeforeEach
    void setUp() {
        FileIO io = new FileIO(tmp);
        store = new PolicyCheckpointStore(io, TestFixtures.mapper(), io.resolve("models/policy"));
    }

    @Test
    void fileNameIsZeroPadded() {
        assertEquals("policy-u000042.json", PolicyCheckpointStore.fileName(42));
    }

    @Test
    void saveWritesCheckpointAndLatestPointer() throws Exception {
        Path file = store.save(capture(3));

        assertEquals("policy-u000003.json", file.getFileName().toString());
        assertTrue(Files.exists(file));
        assertEquals("policy-u000003.json", Files.readString(store.dir().resolve(PolicyCheckpointStore.LATEST)).trim());
        assertEquals(file, store.latest().orElseThrow());
    }

    @Test
    void latestFollowsNewestSave() throws Exception {
        store.save(capture(1));
        Path second = store.save(capture(2));
        assertEquals(second, store.latest().orElseThrow());
    }

    @Test
    void restoredPolicyBehavesLikeTheSavedOne() throws Exception {
        ActorCriticPolicy policy = ActorCriticPolicy.initialize(TestFixtures.DIM, 4, 18, 9L);
        AdamOptimizer adam = new AdamOptimizer(policy.parameterCount(), 1e-3);
        adam.step(policy.parameters(), new double[policy.parameterCount()]);
        store.save(PolicyCheckpoint.capture(policy, adam, 5, 80L, 9L, 0.25));

        PolicyCheckpoint cp = store.loadLatest(TestFixtures.DIM, 18);
        Observation obs = TestFixtures.encoder().encode("x", TestFixtures.livingRoom());

        assertArrayEquals(policy.probabilities(obs), cp.toPolicy().probabilities(obs), 0.0);
        assertEquals(1, cp.toOptimizer(1e-3).stepCount());
        assertEquals(5, cp.update);
        assertEquals(80L, cp.envSteps);
        assertEquals(9L, cp.seed);
    }

    @Test
    void noCheckpointIsModelUnavailable() {
        assertThrows(ModelUnavailableException.class, () -> store.loadLatest(TestFixtures.DIM, 18));
    }

    @Test
    void shapeMismatchIsModelUnavailable() throws Exception {
        store.save(capture(1));
        assertThrows(ModelUnavailableException.class, () -> store.loadLatest(TestFixtures.DIM, 19));
        assertThrows(ModelUnavailableException.class, () -> store.loadLatest(64, 18));
    }

    @Test
    void corruptFileIsModelUnavailable() throws Exception {
        Path file = store.save(capture(1));
        Files.writeString(file, "{\"schema\":\"ppo-policy-v1\",\"params\":[1,2,3]}");
        assertThrows(ModelUnavailableException.class, () -> store.load(file));
    }

    @Test
    @DisplayName("a checkpoint with a zero hidden width is unavailable, not a crash")
    void zeroHiddenWidthIsModelUnavailable() throws Exception {
        PolicyCheckpoint cp = capture(1);
        cp.hidden = 0;
        cp.params = new double[cp.actionCount + 1];
        cp.adamM = null;
        cp.adamV = null;
        store.save(cp);

        assertThrows(ModelUnavailableException.class, () -> store.loadLatest(TestFixtures.DIM, 18));
        assertThrows(ModelUnavailableException.class, () -> store.loadLatestPolicy(TestFixtures.DIM, 18));
    }

    @Test
    void mismatchedOptimizerMomentsAreModelUnavailable() throws Exception {
        PolicyCheckpoint cp = capture(1);
        cp.adamM = new double[3];
        Path file = store.save(cp);
        assertThrows(ModelUnavailableException.class, () -> store.load(file));
    }

    @Test
    void garbageLatestPointerIsModelUnavailable() throws Exception {
        store.save(capture(1));
        Files.writeString(store.dir().resolve(PolicyCheckpointStore.LATEST), "bad\u0000name");

        assertThrows(ModelUnavailableException.class, () -> store.latest());
        assertThrows(ModelUnavailableException.class, () -> store.loadLatestPolicy(TestFixtures.DIM, 18));
    }

    @Test
    void loadLatestPolicyBuildsThePolicy() throws Exception {
        store.save(capture(2));
        ActorCriticPolicy policy = store.loadLatestPolicy(TestFixtures.DIM, 18);
        assertEquals(18, policy.actionCount());
        assertEquals(TestFixtures.DIM, policy.observationDim());
    }

    private static PolicyCheckpoint capture(int update) {
        ActorCriticPolicy policy = ActorCriticPolicy.initialize(TestFixtures.DIM, 4, 18, update);
        return PolicyCheckpoint.capture(policy, new AdamOptimizer(policy.parameterCount(), 1e-3),
                update, update * 16L, 1L, 0.0);
    }
}
