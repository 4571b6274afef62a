package com.caret.analyze.exception;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.stream.Collectors;

/**
 * Thrown by fuzzy lookups when no item matches exactly but one is close
 * enough to be offered back to the caller as a hint.
 *
 * <p>Callers that want to print a "did you mean" message should catch this
 * before {@link ItemNotFoundException}:</p>
 * <pre>
 * try {
 *     node = lookup.findSimilarOne(name, nodes, Node::getName);
 * } catch (SuggestionException e) {
 *     System.err.println(e.getMessage());
 * }
 * </pre>
 */
public class SuggestionException extends ItemNotFoundException {

    private final String suggestion;
    private final Map<String, String> suggestedFields;

    private SuggestionException(String message, String suggestion, Map<String, String> suggestedFields) {
        super(message);
        this.suggestion = suggestion;
        this.suggestedFields = suggestedFields;
    }

    /**
     * Creates an exception suggesting a single candidate name.
     */
    public static SuggestionException forName(String candidate) {
        Objects.requireNonNull(candidate, "candidate must not be null");
        String message = "Arguments may be wrong. Isn't it '" + candidate + "'?";
        return new SuggestionException(message, candidate, Map.of());
    }

    /**
     * Creates an exception suggesting a candidate described by several fields.
     * Field order is preserved in both the message and {@link #getSuggestedFields()}.
     */
    public static SuggestionException forFields(Map<String, String> candidateFields) {
        Objects.requireNonNull(candidateFields, "candidateFields must not be null");
        Map<String, String> fields = Collections.unmodifiableMap(new LinkedHashMap<>(candidateFields));

        StringBuilder message = new StringBuilder("Arguments may be wrong. Aren't they below?\n");
        fields.forEach((field, value) -> message.append(field).append("='").append(value).append("'\n"));

        String suggestion = fields.entrySet().stream()
                .map(e -> e.getKey() + "='" + e.getValue() + "'")
                .collect(Collectors.joining(", "));
        return new SuggestionException(message.toString(), suggestion, fields);
    }

    /**
     * The suggested candidate: its key for single-key lookups, or a
     * comma-separated {@code field='value'} rendering for multi-key lookups.
     */
    public String getSuggestion() {
        return suggestion;
    }

    /**
     * Requested field names mapped to the candidate's values, in request order.
     * Empty for single-key lookups.
     */
    public Map<String, String> getSuggestedFields() {
        return suggestedFields;
    }
}
