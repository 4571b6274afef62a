package com.caret.analyze.lookup;

import com.caret.analyze.common.Items;
import com.caret.analyze.exception.ItemNotFoundException;
import com.caret.analyze.exception.MultipleItemFoundException;
import com.caret.analyze.exception.SuggestionException;
import com.caret.analyze.logging.LogContext;
import com.caret.analyze.similarity.SequenceMatcherSimilarity;
import com.caret.analyze.similarity.SimilarityAlgorithm;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.math.BigDecimal;
import java.math.MathContext;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * Finds a single item in a caller-supplied collection.
 *
 * <p>{@link #findOne} matches with a predicate and requires exactly one hit.
 * {@link #findSimilarOne} and {@link #findSimilarOneMultiKeys} match by name and, when the
 * name is not exact, tell the caller which item was most likely intended:</p>
 * <ul>
 *   <li>best similarity {@code == 1.0}: the item is returned</li>
 *   <li>{@code threshold < similarity < 1.0}: {@link SuggestionException} naming the best candidate</li>
 *   <li>{@code similarity <= threshold}: {@link ItemNotFoundException}</li>
 * </ul>
 *
 * <p>Instances hold no mutable state and may be shared.</p>
 */
public class Lookup {
    private static final Logger log = LoggerFactory.getLogger(Lookup.class);

    static final String NOT_FOUND_MESSAGE = "Failed find item.";
    static final String MULTIPLE_FOUND_MESSAGE = "Failed to identify item.";

    private final SimilarityAlgorithm similarity;
    private final LookupConfig config;

    public Lookup() {
        this(new SequenceMatcherSimilarity(), LookupConfig.defaults());
    }

    public Lookup(LookupConfig config) {
        this(new SequenceMatcherSimilarity(), config);
    }

    public Lookup(SimilarityAlgorithm similarity, LookupConfig config) {
        this.similarity = Objects.requireNonNull(similarity, "similarity must not be null");
        this.config = Objects.requireNonNull(config, "config must not be null");
    }

    /**
     * Gets the single item that matches the condition.
     *
     * @param condition predicate the item must satisfy
     * @param items     items to search; {@code null} is treated as empty
     * @return the only matching item
     * @throws ItemNotFoundException       if no item matches
     * @throws MultipleItemFoundException  if two or more items match
     */
    public <T> T findOne(Predicate<? super T> condition, Iterable<? extends T> items) {
        List<T> filtered = Items.filterItems(condition, items);
        if (filtered.isEmpty()) {
            throw new ItemNotFoundException(NOT_FOUND_MESSAGE);
        }
        if (filtered.size() >= 2) {
            log.debug("lookup.ambiguous matches={}", filtered.size());
            throw new MultipleItemFoundException(MULTIPLE_FOUND_MESSAGE);
        }
        return filtered.get(0);
    }

    /**
     * Finds the string equal to {@code targetName}, using the configured threshold for suggestions.
     */
    public String findSimilarOne(String targetName, Collection<String> items) {
        return findSimilarOne(targetName, items, Function.<String>identity(), config.threshold());
    }

    /**
     * Finds the string equal to {@code targetName}, using {@code th} as threshold for suggestions.
     */
    public String findSimilarOne(String targetName, Collection<String> items, double th) {
        return findSimilarOne(targetName, items, Function.<String>identity(), th);
    }

    /**
     * Finds the item whose key equals {@code targetName}, using the configured threshold for suggestions.
     */
    public <T> T findSimilarOne(String targetName, Collection<? extends T> items, Function<? super T, String> key) {
        return findSimilarOne(targetName, items, key, config.threshold());
    }

    /**
     * Finds the item whose key equals {@code targetName}.
     *
     * <p>Every item is scored against the target; the first item reaching the highest score
     * is the candidate. Items scoring the same as an earlier one never replace it.</p>
     *
     * @param targetName name the caller is looking for
     * @param items      items to search
     * @param key        extracts the name of an item
     * @param th         similarity at or below which no suggestion is made
     * @return the item whose key is identical to {@code targetName}
     * @throws SuggestionException   if the best candidate scores above {@code th} but below 1.0
     * @throws ItemNotFoundException if the collection is empty or no candidate scores above {@code th}
     */
    public <T> T findSimilarOne(String targetName, Collection<? extends T> items,
                                Function<? super T, String> key, double th) {
        Objects.requireNonNull(targetName, "targetName must not be null");
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(key, "key must not be null");
        LookupConfig.validateThreshold(th);

        try (LogContext ctx = LogContext.forLookup("findSimilarOne", targetName)
                .with("threshold", String.valueOf(th))) {
            if (items.isEmpty()) {
                log.debug("lookup.notFound reason=empty");
                throw new ItemNotFoundException(NOT_FOUND_MESSAGE);
            }

            double maxSimilarity = 0.0;
            T mostSimilar = null;
            for (T item : items) {
                String name = key.apply(item);
                double score = checkScore(similarity.compute(name, targetName));
                log.debug("lookup.score candidate='{}' score={}", name, score);
                if (score > maxSimilarity) {
                    maxSimilarity = score;
                    mostSimilar = item;
                }
            }

            if (maxSimilarity == 1.0) {
                return mostSimilar;
            }
            if (maxSimilarity > th) {
                String candidate = key.apply(mostSimilar);
                log.debug("lookup.suggest candidate='{}' score={} threshold={}", candidate, maxSimilarity, th);
                throw SuggestionException.forName(candidate);
            }
            log.debug("lookup.notFound score={} threshold={}", maxSimilarity, th);
            throw new ItemNotFoundException(NOT_FOUND_MESSAGE);
        }
    }

    /**
     * Finds the map whose fields equal {@code targetNames}, using the configured threshold for suggestions.
     */
    public <M extends Map<String, String>> M findSimilarOneMultiKeys(Map<String, String> targetNames,
                                                                    Collection<? extends M> items) {
        return findSimilarOneMultiKeys(targetNames, items, Function.<M>identity(), config.threshold());
    }

    /**
     * Finds the map whose fields equal {@code targetNames}, using {@code th} as threshold for suggestions.
     */
    public <M extends Map<String, String>> M findSimilarOneMultiKeys(Map<String, String> targetNames,
                                                                    Collection<? extends M> items,
                                                                    double th) {
        return findSimilarOneMultiKeys(targetNames, items, Function.<M>identity(), th);
    }

    /**
     * Finds the item whose fields equal {@code targetNames}, using the configured threshold for suggestions.
     */
    public <T> T findSimilarOneMultiKeys(Map<String, String> targetNames, Collection<? extends T> items,
                                         Function<? super T, ? extends Map<String, String>> keys) {
        return findSimilarOneMultiKeys(targetNames, items, keys, config.threshold());
    }

    /**
     * Finds the item whose fields equal {@code targetNames}.
     *
     * <p>Only the fields named in {@code targetNames} are compared. An item's score is the mean
     * of its per-field scores; a field the item has no value for scores 0.0.</p>
     *
     * @param targetNames field name to the value the caller is looking for; iteration order is
     *                    the order fields are listed in a suggestion
     * @param items       items to search
     * @param keys        extracts an item's field values
     * @param th          similarity at or below which no suggestion is made
     * @return the item whose requested fields are all identical to the target
     * @throws SuggestionException      if the best candidate scores above {@code th} but below 1.0
     * @throws ItemNotFoundException    if the collection is empty or no candidate scores above {@code th}
     * @throws IllegalArgumentException if {@code targetNames} is empty
     */
    public <T> T findSimilarOneMultiKeys(Map<String, String> targetNames, Collection<? extends T> items,
                                         Function<? super T, ? extends Map<String, String>> keys, double th) {
        Objects.requireNonNull(targetNames, "targetNames must not be null");
        Objects.requireNonNull(items, "items must not be null");
        Objects.requireNonNull(keys, "keys must not be null");
        if (targetNames.isEmpty()) {
            throw new IllegalArgumentException("targetNames must not be empty");
        }
        LookupConfig.validateThreshold(th);

        try (LogContext ctx = LogContext.forLookup("findSimilarOneMultiKeys", targetNames.toString())
                .with("threshold", String.valueOf(th))) {
            if (items.isEmpty()) {
                log.debug("lookup.notFound reason=empty");
                throw new ItemNotFoundException(NOT_FOUND_MESSAGE);
            }

            double maxSimilarity = 0.0;
            T mostSimilar = null;
            for (T item : items) {
                Map<String, String> fields = keys.apply(item);
                double score = checkScore(meanSimilarity(fields, targetNames));
                log.debug("lookup.score candidate={} score={}", fields, score);
                if (score > maxSimilarity) {
                    maxSimilarity = score;
                    mostSimilar = item;
                }
            }

            if (maxSimilarity == 1.0) {
                return mostSimilar;
            }
            if (maxSimilarity > th) {
                Map<String, String> fields = keys.apply(mostSimilar);
                Map<String, String> suggested = new LinkedHashMap<>();
                for (String field : targetNames.keySet()) {
                    suggested.put(field, fields == null ? null : fields.get(field));
                }
                log.debug("lookup.suggest candidate={} score={} threshold={}", suggested, maxSimilarity, th);
                throw SuggestionException.forFields(suggested);
            }
            log.debug("lookup.notFound score={} threshold={}", maxSimilarity, th);
            throw new ItemNotFoundException(NOT_FOUND_MESSAGE);
        }
    }

    /**
     * Mean of the per-field scores over the requested fields, in request order.
     * The sum is exact and rounded to a double once, so a mean equal to the threshold
     * never lands just above it.
     */
    private double meanSimilarity(Map<String, String> fields, Map<String, String> targetNames) {
        BigDecimal sum = BigDecimal.ZERO;
        for (Map.Entry<String, String> target : targetNames.entrySet()) {
            String value = fields == null ? null : fields.get(target.getKey());
            if (value == null) {
                continue;
            }
            sum = sum.add(new BigDecimal(checkScore(similarity.compute(value, target.getValue()))));
        }
        return sum.divide(BigDecimal.valueOf(targetNames.size()), MathContext.DECIMAL128).doubleValue();
    }

    /**
     * Fails hard when the similarity algorithm returns a score outside [0, 1].
     */
    private double checkScore(double score) {
        if (!(score >= 0.0 && score <= 1.0)) {
            throw new AssertionError(similarity.getName() + " similarity out of range: " + score);
        }
        return score;
    }

    public SimilarityAlgorithm getSimilarity() {
        return similarity;
    }

    public LookupConfig getConfig() {
        return config;
    }
}
