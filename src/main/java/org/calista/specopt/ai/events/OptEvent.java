package org.calista.specopt.ai.events;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;

import java.util.LinkedHashMap;
import java.util.Map;

@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public final class OptEvent {
    public String type;        // "TRAIN_START", "TRAIN_UPDATE", "TRAIN_END", "TRAIN_INTERRUPTED", "REMOTE_SUBMIT"
    public long tsEpochMs;
    public String runId;
    public Integer update;
    public Map<String, Object> data;

    public static OptEvent of(String type, String runId, Integer update, Map<String, Object> data) {
        OptEvent e = new OptEvent();
        e.type = type;
        e.runId = runId;
        e.update = update;
        e.data = data == null ? null : new LinkedHashMap<>(data);
        e.tsEpochMs = System.currentTimeMillis();
        return e;
    }
}
