package org.calista.specopt.ai.reward.feedback;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.JsonNode;

/**
 * One human judgement over two variants of a design. Stored as a JSONL row.
 *
 * <p>{@code preference} is "A", "B" or null; when null the ratings (if both present) decide.</p>
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class FeedbackRecord {

    public String id;
    public long recordedAtEpochMs;
    public String prompt;
    public JsonNode specA;
    public JsonNode specB;
    public String preference;
    public Double ratingA;
    public Double ratingB;
    public String note;

    public FeedbackRecord() {
    }

    public static FeedbackRecord preferring(String prompt, JsonNode specA, JsonNode specB, String preference) {
        FeedbackRecord r = new FeedbackRecord();
        r.prompt = prompt;
        r.specA = specA;
        r.specB = specB;
        r.preference = preference;
        return r;
    }

    public static FeedbackRecord rated(String prompt, JsonNode specA, double ratingA, JsonNode specB, double ratingB) {
        FeedbackRecord r = new FeedbackRecord();
        r.prompt = prompt;
        r.specA = specA;
        r.specB = specB;
        r.ratingA = ratingA;
        r.ratingB = ratingB;
        return r;
    }
}
