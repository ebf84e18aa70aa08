package org.calista.specopt.ai.core;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.specopt.io.FileIO;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Nested;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class OptConfigTest {

    @TempDir
    Path tmp;

    private final ObjectMapper mapper = new ObjectMapper();
    private FileIO io;

    @BeforeEach
    void setUp() {
        io = new FileIO(tmp);
    }

    // --- load / create ---

    @Test
    @DisplayName("missing config file is created with defaults")
    void missingFileCreatesDefaults() throws Exception {
        Path file = tmp.resolve("specopt.json");

        OptConfig cfg = OptConfig.loadOrCreate(io, file, mapper);

        assertTrue(Files.exists(file));
        assertEquals(512, cfg.encoder.dim);
        assertEquals("auto", cfg.remote.preference);
        assertEquals(512, mapper.readTree(Files.readString(file)).get("encoder").get("dim").asInt());
    }

    @Test
    void blankFileIsRecreated() throws Exception {
        Path file = tmp.resolve("specopt.json");
        Files.writeString(file, "   ");

        OptConfig cfg = OptConfig.loadOrCreate(io, file, mapper);

        assertEquals("data", cfg.baseDir);
        assertFalse(Files.readString(file).isBlank());
    }

    @Test
    void unknownKeysAreIgnored() throws Exception {
        Path file = tmp.resolve("specopt.json");
        Files.writeString(file, "{\"encoder\":{\"dim\":64,\"legacy\":true},\"gpu\":\"a100\"}");

        OptConfig cfg = OptConfig.loadOrCreate(io, file, mapper);

        assertEquals(64, cfg.encoder.dim);
        assertEquals(16, cfg.environment.horizon);
    }

    @Test
    void saveThenLoadKeepsValues() throws Exception {
        Path file = tmp.resolve("specopt.json");
        OptConfig cfg = new OptConfig();
        cfg.training.envCount = 3;
        cfg.remote.url = "http://compute.local";

        OptConfig.save(io, file, mapper, cfg);
        OptConfig back = OptConfig.loadOrCreate(io, file, mapper);

        assertEquals(3, back.training.envCount);
        assertEquals("http://compute.local", back.remote.url);
    }

    // --- validation ---

    @Nested
    class Validate {

        @Test
        void encoderDimIsRoundedUpToPowerOfTwo() {
            OptConfig cfg = new OptConfig();
            cfg.encoder.dim = 100;
            cfg.validate();
            assertEquals(128, cfg.encoder.dim);

            cfg.encoder.dim = 4;
            cfg.validate();
            assertEquals(16, cfg.encoder.dim);
        }

        @Test
        void countsAreClamped() {
            OptConfig cfg = new OptConfig();
            cfg.training.envCount = 0;
            cfg.training.checkpointEvery = -5;
            cfg.encoder.maxPromptTokens = 0;
            cfg.validate();

            assertEquals(1, cfg.training.envCount);
            assertEquals(1, cfg.training.checkpointEvery);
            assertEquals(1, cfg.encoder.maxPromptTokens);
        }

        @Test
        void zeroPromptWeightIsKept() {
            OptConfig cfg = new OptConfig();
            cfg.encoder.promptWeight = 0.0;
            cfg.validate();
            assertEquals(0.0, cfg.encoder.promptWeight);

            cfg.encoder.promptWeight = -2.0;
            cfg.validate();
            assertEquals(1.0, cfg.encoder.promptWeight);
        }

        @Test
        void maxObjectsCoversEverySlot() {
            OptConfig cfg = new OptConfig();
            cfg.actions.maxSlots = 8;
            cfg.environment.maxObjects = 2;
            cfg.validate();
            assertEquals(8, cfg.environment.maxObjects);
        }

        @Test
        void paletteAndScalesAreCleaned() {
            OptConfig cfg = new OptConfig();
            cfg.actions.materials = Arrays.asList(" oak ", "oak", "", null, "marble");
            cfg.actions.scaleFactors = Arrays.asList(0.8, 1.0, -2.0, null, 1.25);
            cfg.validate();

            assertEquals(List.of("oak", "marble"), cfg.actions.materials);
            assertEquals(List.of(0.8, 1.25), cfg.actions.scaleFactors);
        }

        @Test
        void nullSectionsAreRestored() {
            OptConfig cfg = new OptConfig();
            cfg.training = null;
            cfg.remote = null;
            cfg.validate();

            assertNotNull(cfg.training);
            assertEquals("auto", cfg.remote.preference);
        }
    }
}
