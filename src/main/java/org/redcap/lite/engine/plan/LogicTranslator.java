package org.redcap.lite.engine.plan;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;
import org.redcap.lite.column.RowMask;
import org.redcap.lite.engine.execution.Dataset;
import org.redcap.lite.logic.LogicExpression;
import org.redcap.lite.logic.LogicParseException;
import org.redcap.lite.logic.LogicParser;
import org.redcap.lite.logic.antlr.LogicAstBuilder;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

/**
 * Translates branching-logic strings into {@link CompiledPredicate}s.
 *
 * Translation is pure, so results are cached by logic string. The cache is
 * bounded and safe for concurrent use; a failed translation is not cached.
 */
public final class LogicTranslator {

    private static final Logger LOG = LoggerFactory.getLogger(LogicTranslator.class);

    public static final long DEFAULT_CACHE_SIZE = 10_000;

    private final Cache<String, CompiledPredicate> cache;

    public LogicTranslator() {
        this(DEFAULT_CACHE_SIZE);
    }

    public LogicTranslator(long maximumCacheSize) {
        this.cache = Caffeine.newBuilder()
                .maximumSize(maximumCacheSize)
                .build();
    }

    /**
     * Translates a logic string.
     *
     * @param logic The branching-logic string
     * @return the compiled predicate with its referenced fields
     * @throws LogicParseException if the string is blank or malformed
     */
    public CompiledPredicate translate(String logic) {
        Objects.requireNonNull(logic, "Logic cannot be null");
        return cache.get(logic, LogicTranslator::compile);
    }

    /**
     * Translates the branching logic of many fields, as found in a data
     * dictionary. Blank logic is skipped; logic that fails to parse is logged
     * and skipped.
     *
     * @param logicByField branching logic keyed by field name
     * @return the predicates that translated, keyed by field, in input order
     */
    public Map<String, CompiledPredicate> translateAll(Map<String, String> logicByField) {
        Map<String, CompiledPredicate> predicates = new LinkedHashMap<>();
        for (Map.Entry<String, String> entry : logicByField.entrySet()) {
            String logic = entry.getValue();
            if (logic == null || logic.isBlank()) {
                continue;
            }
            try {
                predicates.put(entry.getKey(), translate(logic));
            } catch (LogicParseException e) {
                LOG.warn("Skipping branching logic of field '{}': {}", entry.getKey(), e.getMessage());
            }
        }
        return Collections.unmodifiableMap(predicates);
    }

    /**
     * Evaluates a compiled predicate against a dataset.
     */
    public RowMask evaluate(CompiledPredicate predicate, Dataset dataset) {
        return predicate.evaluate(dataset);
    }

    /**
     * Translates and evaluates in one step.
     */
    public RowMask evaluate(String logic, Dataset dataset) {
        return translate(logic).evaluate(dataset);
    }

    public long cachedCount() {
        return cache.estimatedSize();
    }

    private static CompiledPredicate compile(String logic) {
        LOG.debug("Translating branching logic: {}", logic);
        LogicAstBuilder builder = new LogicAstBuilder();
        LogicExpression expression = builder.visit(LogicParser.parseTree(logic));
        return new CompiledPredicate(logic, expression, builder.referencedFields());
    }
}
