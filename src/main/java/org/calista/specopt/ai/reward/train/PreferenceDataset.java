package org.calista.specopt.ai.reward.train;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.specopt.ai.reward.feedback.FeedbackRecord;
import org.calista.specopt.ai.spec.DesignSpecification;
import org.calista.specopt.ai.spec.InvalidSpecException;
import org.calista.specopt.ai.spec.SpecCodec;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Preference pairs derived from logged feedback.
 *
 * <p>An explicit preference wins. Without one, the ratings decide when both are present and
 * differ by at least {@code minRatingDelta}. Ties, small deltas and records with an unparsable
 * spec are dropped.</p>
 */
public final class PreferenceDataset {
    private static final Logger log = LogManager.getLogger(PreferenceDataset.class);

    private final List<PreferencePair> pairs;
    private final int skipped;

    private PreferenceDataset(List<PreferencePair> pairs, int skipped) {
        this.pairs = Collections.unmodifiableList(pairs);
        this.skipped = skipped;
    }

    public static PreferenceDataset fromFeedback(List<FeedbackRecord> records, SpecCodec codec, double minRatingDelta) {
        Objects.requireNonNull(records, "records");
        Objects.requireNonNull(codec, "codec");
        if (!(minRatingDelta >= 0.0)) throw new IllegalArgumentException("minRatingDelta must be >= 0");

        ArrayList<PreferencePair> out = new ArrayList<>(records.size());
        int skipped = 0;
        for (FeedbackRecord r : records) {
            if (r == null || r.specA == null || r.specB == null) {
                skipped++;
                continue;
            }
            String winner = winner(r, minRatingDelta);
            if (winner == null) {
                skipped++;
                continue;
            }
            DesignSpecification a;
            DesignSpecification b;
            try {
                a = codec.parse(r.specA, r.id == null ? "feedback.A" : r.id + ".A");
                b = codec.parse(r.specB, r.id == null ? "feedback.B" : r.id + ".B");
            } catch (InvalidSpecException e) {
                log.warn("Skipping feedback {}: {}", r.id, e.getMessage());
                skipped++;
                continue;
            }
            out.add(winner.equals("A") ? new PreferencePair(r.prompt, a, b) : new PreferencePair(r.prompt, b, a));
        }
        log.debug("PreferenceDataset: {} pairs from {} records ({} skipped)", out.size(), records.size(), skipped);
        return new PreferenceDataset(out, skipped);
    }

    public static PreferenceDataset of(List<PreferencePair> pairs) {
        return new PreferenceDataset(new ArrayList<>(Objects.requireNonNull(pairs, "pairs")), 0);
    }

    public List<PreferencePair> pairs() {
        return pairs;
    }

    public int size() {
        return pairs.size();
    }

    public int skipped() {
        return skipped;
    }

    private static String winner(FeedbackRecord r, double minDelta) {
        if ("A".equals(r.preference) || "B".equals(r.preference)) return r.preference;
        if (r.ratingA == null || r.ratingB == null) return null;
        double d = r.ratingB - r.ratingA;
        if (Math.abs(d) < minDelta || d == 0.0) return null;
        return d > 0 ? "B" : "A";
    }
}
