package org.redcap.lite.types;

import com.github.benmanes.caffeine.cache.Cache;
import com.github.benmanes.caffeine.cache.Caffeine;

import java.util.Objects;

/**
 * Creates {@link RedcapValue}s for one {@link ValueConfig}.
 *
 * Response columns repeat the same few strings many times, so values are
 * interned in a cache with weak values: an entry lives as long as some
 * column still holds the value. Interning only saves memory; values built
 * with and without it compare equal.
 */
public final class RedcapValues {

    private static final RedcapValues DEFAULTS = new RedcapValues(ValueConfig.defaults());

    private final ValueConfig config;
    private final ValueClassifier classifier;
    private final Cache<String, RedcapValue> interned;

    public RedcapValues(ValueConfig config) {
        this(config, true);
    }

    /**
     * @param config    the classifier configuration
     * @param interning whether to reuse instances for equal raw strings
     */
    public RedcapValues(ValueConfig config, boolean interning) {
        this.config = Objects.requireNonNull(config, "Config cannot be null");
        this.classifier = new ValueClassifier(config);
        this.interned = interning ? Caffeine.newBuilder().weakValues().build() : null;
    }

    /**
     * @return the shared factory for {@link ValueConfig#defaults()}
     */
    public static RedcapValues defaults() {
        return DEFAULTS;
    }

    public ValueConfig config() {
        return config;
    }

    public ValueClassifier classifier() {
        return classifier;
    }

    /**
     * Returns the value for a raw response string.
     *
     * @throws InputTypeException if raw is null
     */
    public RedcapValue value(String raw) {
        if (raw == null) {
            throw new InputTypeException("Response values must be strings, got null");
        }
        if (interned == null) {
            return create(raw);
        }
        return interned.get(raw, this::create);
    }

    /**
     * Accepts an existing value as-is, or classifies a string.
     *
     * @throws InputTypeException for any other type
     */
    public RedcapValue coerce(Object raw) {
        if (raw instanceof RedcapValue value) {
            return value;
        }
        if (raw instanceof String text) {
            return value(text);
        }
        String typeName = raw == null ? "null" : raw.getClass().getName();
        throw new InputTypeException("Response values must be strings, got " + typeName);
    }

    private RedcapValue create(String raw) {
        return new RedcapValue(raw, classifier.classify(raw));
    }
}
