package org.calista.specopt.ai;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.ai.core.OptKernel;
import org.calista.specopt.ai.core.SpecOptException;
import org.calista.specopt.ai.reward.feedback.FeedbackRecord;
import org.calista.specopt.ai.reward.train.RewardModelTrainer;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.suggest.Strategy;
import org.calista.specopt.ai.suggest.Suggestion;
import org.calista.specopt.ai.train.CancellationToken;
import org.calista.specopt.ai.train.TrainingInterruptedException;
import org.calista.specopt.ai.train.TrainingListener;
import org.calista.specopt.ai.train.TrainingOutcome;

import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

/**
 * SpecOptApp — command-line runner.
 *
 * <pre>
 * specopt [--config FILE] train-reward
 * specopt [--config FILE] train STEPS SPEC.json [SPEC.json ...]
 * specopt [--config FILE] suggest SPEC.json [STRATEGY] [PROMPT ...]
 * specopt [--config FILE] feedback SPEC_A.json SPEC_B.json A|B [PROMPT ...]
 * </pre>
 * Results go to stdout as JSON, logs to stderr. Ctrl-C during training stops after the current update.
 */
public final class SpecOptApp {

    private static final Logger log = LogManager.getLogger(SpecOptApp.class);

    private static final long SHUTDOWN_GRACE_SECONDS = 120;

    private final PrintStream out;
    private Path cfgPath = Path.of("config/specopt.json");
    private OptKernel kernel;

    public SpecOptApp(PrintStream out) {
        this.out = out;
    }

    public static void main(String[] args) {
        int code = new SpecOptApp(System.out).run(args);
        if (code != 0) System.exit(code);
    }

    public int run(String[] argv) {
        List<String> args = new ArrayList<>(Arrays.asList(argv));
        if (args.size() >= 2 && args.get(0).equals("--config")) {
            cfgPath = Path.of(args.get(1));
            args = args.subList(2, args.size());
        }
        if (args.isEmpty()) {
            usage();
            return 2;
        }

        String cmd = args.get(0);
        List<String> rest = args.subList(1, args.size());
        try {
            kernel = OptKernel.builder().configRoot(Path.of(".")).build(cfgPath);
            return switch (cmd) {
                case "train-reward" -> trainReward();
                case "train" -> train(rest);
                case "suggest" -> suggest(rest);
                case "feedback" -> feedback(rest);
                default -> {
                    usage();
                    yield 2;
                }
            };
        } catch (TrainingInterruptedException e) {
            log.warn("Training interrupted after {} updates; resume from {}", e.completedUpdates(), e.lastCheckpoint());
            return 3;
        } catch (SpecOptException e) {
            log.error("{} failed ({}): {}", cmd, e.kind(), e.getMessage());
            return 1;
        } catch (IOException | IllegalArgumentException | IllegalStateException e) {
            log.error("{} failed: {}", cmd, e.getMessage(), e);
            return 1;
        }
    }

    // ---------------------------------------------------------------------

    private int trainReward() throws IOException {
        RewardModelTrainer.Result res = kernel.trainRewardModel();
        ObjectNode n = kernel.mapper().createObjectNode();
        n.put("checkpoint", kernel.rewardModelStore().file().toString());
        n.put("pairs", res.pairs());
        n.put("loss", res.finalLoss());
        n.put("accuracy", res.accuracy());
        print(n);
        return 0;
    }

    private int train(List<String> rest) throws IOException {
        if (rest.size() < 2) {
            usage();
            return 2;
        }
        long steps = Long.parseLong(rest.get(0));
        ArrayList<DesignSpecification> specs = new ArrayList<>();
        for (String f : rest.subList(1, rest.size())) specs.add(readSpec(Path.of(f)));

        // on Ctrl-C: cancel, then hold the JVM until the current update and its checkpoint are done
        CancellationToken cancel = new CancellationToken();
        CountDownLatch finished = new CountDownLatch(1);
        Thread hook = new Thread(() -> {
            cancel.cancel();
            try {
                if (!finished.await(SHUTDOWN_GRACE_SECONDS, TimeUnit.SECONDS)) {
                    log.warn("Training did not stop within {}s", SHUTDOWN_GRACE_SECONDS);
                }
            } catch (InterruptedException ie) {
                Thread.currentThread().interrupt();
            }
        }, "specopt-cancel");
        Runtime.getRuntime().addShutdownHook(hook);
        TrainingOutcome outcome;
        try {
            outcome = kernel.train(specs, steps, kernel.config().training.envCount, kernel.hyperparameters(),
                    cancel, TrainingListener.NONE);
        } finally {
            finished.countDown();
            removeHook(hook);
        }

        ObjectNode n = kernel.mapper().createObjectNode();
        if (outcome.isRemote()) {
            n.put("jobId", outcome.jobHandle().id());
            n.put("endpoint", outcome.jobHandle().endpoint());
        } else {
            n.put("checkpoint", String.valueOf(outcome.checkpointPath()));
            n.put("updates", outcome.updates());
            n.put("envSteps", outcome.envSteps());
            n.put("meanReward", outcome.lastMeanReward());
        }
        print(n);
        return 0;
    }

    private int suggest(List<String> rest) throws IOException {
        if (rest.isEmpty()) {
            usage();
            return 2;
        }
        DesignSpecification spec = readSpec(Path.of(rest.get(0)));
        Strategy strategy = rest.size() > 1 ? Strategy.parse(rest.get(1)) : Strategy.POLICY_ROLLOUT;
        String prompt = rest.size() > 2 ? String.join(" ", rest.subList(2, rest.size())) : "";

        Suggestion s = kernel.suggestionService().suggest(spec, prompt, strategy);

        ObjectNode n = kernel.mapper().createObjectNode();
        n.put("strategyUsed", s.strategyUsed().name());
        n.put("requestedStrategy", s.requestedStrategy().name());
        n.put("predictedScore", s.predictedScore());
        n.put("steps", s.steps());
        n.set("notes", kernel.mapper().valueToTree(s.notes()));
        n.set("spec", kernel.codec().toJson(s.improvedSpec()));
        print(n);
        return 0;
    }

    private int feedback(List<String> rest) throws IOException {
        if (rest.size() < 3) {
            usage();
            return 2;
        }
        JsonNode a = kernel.mapper().readTree(Files.readString(Path.of(rest.get(0))));
        JsonNode b = kernel.mapper().readTree(Files.readString(Path.of(rest.get(1))));
        String pref = rest.get(2).trim().toUpperCase(Locale.ROOT);
        String prompt = rest.size() > 3 ? String.join(" ", rest.subList(3, rest.size())) : "";

        FeedbackRecord r = kernel.feedbackLog().append(FeedbackRecord.preferring(prompt, a, b, pref));
        ObjectNode n = kernel.mapper().createObjectNode();
        n.put("id", r.id);
        n.put("log", kernel.feedbackLog().file().toString());
        print(n);
        return 0;
    }

    // ---------------------------------------------------------------------

    private DesignSpecification readSpec(Path file) throws IOException {
        String name = file.getFileName().toString();
        String id = name.endsWith(".json") ? name.substring(0, name.length() - 5) : name;
        return kernel.codec().parse(Files.readString(file), id);
    }

    private void print(JsonNode n) throws IOException {
        out.println(kernel.mapper().writerWithDefaultPrettyPrinter().writeValueAsString(n));
    }

    private static void removeHook(Thread hook) {
        try {
            Runtime.getRuntime().removeShutdownHook(hook);
        } catch (IllegalStateException shuttingDown) {
            log.debug("JVM shutting down; cancel hook stays registered");
        }
    }

    private void usage() {
        out.println("usage: specopt [--config FILE] <command>");
        out.println("  train-reward                              train the reward model on the feedback log");
        out.println("  train STEPS SPEC.json [SPEC.json ...]     train the edit policy (large runs go remote)");
        out.println("  suggest SPEC.json [STRATEGY] [PROMPT...]  policy | reward | heuristic");
        out.println("  feedback A.json B.json A|B [PROMPT...]    record a preference");
    }

    public Path cfgPath() { return cfgPath; }

    public OptKernel kernel() { return kernel; }
}
