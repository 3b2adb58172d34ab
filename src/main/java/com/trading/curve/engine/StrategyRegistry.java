package com.trading.curve.engine;

import com.trading.curve.exception.UnknownStrategyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Case-insensitive name to factory mapping for one strategy family.
 *
 * <p>
 * Instances are immutable. New names are added on a {@link Builder}, which is
 * the only place registration can happen.
 *
 * @param <F> Factory type, e.g. {@code Supplier<Interpolator>}.
 */
public final class StrategyRegistry<F> {
    private final String family;
    private final Map<String, F> factories;
    private final List<String> names;

    private StrategyRegistry(String family, Map<String, F> factories, List<String> names) {
        this.family = family;
        this.factories = Collections.unmodifiableMap(new LinkedHashMap<>(factories));
        this.names = List.copyOf(names);
    }

    /**
     * Looks up a factory by name, ignoring case.
     *
     * @throws UnknownStrategyException listing every registered name.
     */
    public F get(String name) {
        F factory = name == null ? null : factories.get(normalize(name));
        if (factory == null)
            throw new UnknownStrategyException(family, name, names);
        return factory;
    }

    public boolean contains(String name) {
        return name != null && factories.containsKey(normalize(name));
    }

    /** Registered names as first spelled, in registration order. */
    public List<String> names() {
        return names;
    }

    public String family() {
        return family;
    }

    public int size() {
        return names.size();
    }

    public Builder<F> toBuilder() {
        Builder<F> b = new Builder<>(family);
        for (String name : names)
            b.register(name, factories.get(normalize(name)));
        return b;
    }

    public static <F> Builder<F> builder(String family) {
        return new Builder<>(family);
    }

    static String normalize(String name) {
        return name.trim().toLowerCase(Locale.ROOT);
    }

    @Override
    public String toString() {
        return family + names;
    }

    public static final class Builder<F> {
        private final String family;
        private final Map<String, F> factories = new LinkedHashMap<>();
        private final List<String> names = new ArrayList<>();

        private Builder(String family) {
            this.family = family;
        }

        /** Registers or replaces the factory for {@code name}. */
        public Builder<F> register(String name, F factory) {
            if (name == null || name.isBlank())
                throw new IllegalArgumentException(family + " name must not be blank");
            if (factory == null)
                throw new IllegalArgumentException(family + " factory for '" + name + "' must not be null");
            String key = normalize(name);
            if (factories.put(key, factory) == null)
                names.add(name.trim());
            return this;
        }

        public StrategyRegistry<F> build() {
            return new StrategyRegistry<>(family, factories, names);
        }
    }
}
