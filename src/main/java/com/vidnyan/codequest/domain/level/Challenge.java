package com.vidnyan.codequest.domain.level;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A single question within a level.
 * The answer payload is for grading only and never shown to the learner.
 */
public record Challenge(
    String id,
    ChallengeType type,
    Map<String, Object> question,
    Map<String, Object> answer,
    List<String> hints,
    int points
) {

    public Challenge {
        question = frozen(question);
        answer = frozen(answer);
        hints = hints != null ? List.copyOf(hints) : List.of();
    }

    /**
     * Copy without the answer payload.
     */
    public Challenge redacted() {
        return new Challenge(id, type, question, Map.of(), hints, points);
    }

    /**
     * Unmodifiable copy of a payload; nested lists and maps are copied too and key order is kept.
     */
    private static Map<String, Object> frozen(Map<String, Object> payload) {
        if (payload == null) {
            return Map.of();
        }
        Map<String, Object> copy = new LinkedHashMap<>();
        payload.forEach((key, value) -> copy.put(key, frozenValue(value)));
        return Collections.unmodifiableMap(copy);
    }

    private static Object frozenValue(Object value) {
        if (value instanceof List<?> list) {
            List<Object> copy = new ArrayList<>(list.size());
            list.forEach(element -> copy.add(frozenValue(element)));
            return Collections.unmodifiableList(copy);
        }
        if (value instanceof Map<?, ?> map) {
            Map<Object, Object> copy = new LinkedHashMap<>();
            map.forEach((key, nested) -> copy.put(key, frozenValue(nested)));
            return Collections.unmodifiableMap(copy);
        }
        return value;
    }
}
