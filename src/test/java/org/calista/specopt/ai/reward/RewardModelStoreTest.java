package org.calista.specopt.ai.reward;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.specopt.ai.TestFixtures;
import org.calista.specopt.ai.core.ErrorKind;
import org.calista.specopt.ai.encode.impl.HashingSpecEncoder;
import org.calista.specopt.ai.reward.impl.MlpRewardModel;
import org.calista.specopt.ai.reward.impl.RewardMlpParameters;
import org.calista.specopt.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class RewardModelStoreTest {

    @TempDir
    Path tmp;

    private ObjectMapper mapper;
    private HashingSpecEncoder encoder;
    private RewardModelStore store;

    @BeforeEach
    void setUp() {
        mapper = TestFixtures.mapper();
        encoder = TestFixtures.encoder();
        FileIO io = new FileIO(tmp);
        store = new RewardModelStore(io, mapper, io.resolve("models/reward-model.json"));
    }

    @Test
    void missingCheckpointIsModelUnavailable() {
        assertFalse(store.exists());
        ModelUnavailableException e = assertThrows(ModelUnavailableException.class, () -> store.load(encoder));
        assertEquals(ErrorKind.MODEL_UNAVAILABLE, e.kind());
        assertTrue(e.getMessage().contains("reward-model.json"));
    }

    @Test
    void savedModelScoresLikeTheOriginal() throws Exception {
        RewardMlpParameters params = RewardMlpParameters.initial(encoder.dim(), 6, 99L);
        MlpRewardModel original = new MlpRewardModel(params, encoder, "v1");

        store.save(params, "v1", 12);
        MlpRewardModel loaded = store.load(encoder);

        assertEquals("v1", loaded.version());
        assertEquals(6, loaded.hidden());
        var spec = TestFixtures.livingRoom();
        assertEquals(original.score("cozy", spec), loaded.score("cozy", spec), 0.0);
    }

    @Test
    void encoderDimensionMismatchIsModelUnavailable() throws Exception {
        store.save(RewardMlpParameters.initial(encoder.dim(), 4, 1L), "v1", 1);
        var wider = new HashingSpecEncoder(HashingSpecEncoder.Config.builder().dim(64).build());

        assertThrows(ModelUnavailableException.class, () -> store.load(wider));
    }

    @Test
    void foreignSchemaIsModelUnavailable() throws Exception {
        Files.createDirectories(store.file().getParent());
        Files.writeString(store.file(), "{\"schema\":\"something-else\",\"inputDim\":32}");

        assertThrows(ModelUnavailableException.class, () -> store.load(encoder));
    }

    @Test
    void truncatedFileIsModelUnavailable() throws Exception {
        Files.createDirectories(store.file().getParent());
        Files.writeString(store.file(), "{\"schema\":\"reward-mlp-v1\",\"w1\":[0.1,");

        assertThrows(ModelUnavailableException.class, () -> store.load(encoder));
    }

    @Test
    void wrongWeightShapeIsModelUnavailable() throws Exception {
        Files.createDirectories(store.file().getParent());
        Files.writeString(store.file(), "{\"schema\":\"reward-mlp-v1\",\"inputDim\":32,\"hidden\":2,"
                + "\"w1\":[0.1,0.2,0.3],\"b1\":[0,0],\"w2\":[1,1],\"b2\":0}");

        assertThrows(ModelUnavailableException.class, () -> store.load(encoder));
    }
}
