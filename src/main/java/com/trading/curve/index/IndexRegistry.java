package com.trading.curve.index;

import com.trading.curve.exception.UnknownStrategyException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

import lombok.extern.log4j.Log4j2;

/**
 * Catalog of interest-rate benchmarks, keyed by upper-cased code.
 *
 * <p>
 * Built once at start-up through {@link #builder()} or {@link #defaults()} and
 * read-only afterwards, so a single instance can be shared by every factory
 * and thread.
 */
@Log4j2
public final class IndexRegistry {
    private final Map<String, InterestRateIndex> indexes;

    private IndexRegistry(Map<String, InterestRateIndex> indexes) {
        this.indexes = Collections.unmodifiableMap(new LinkedHashMap<>(indexes));
    }

    /** Returns the index registered under {@code code}, or null. */
    public InterestRateIndex get(String code) {
        if (code == null)
            return null;
        return indexes.get(normalize(code));
    }

    /**
     * Returns the index registered under {@code code}.
     *
     * @throws UnknownStrategyException listing the registered codes.
     */
    public InterestRateIndex require(String code) {
        InterestRateIndex index = get(code);
        if (index == null)
            throw new UnknownStrategyException("index", code, codes());
        return index;
    }

    public boolean contains(String code) {
        return get(code) != null;
    }

    /** All registered indexes in registration order. */
    public Map<String, InterestRateIndex> listAll() {
        return indexes;
    }

    public List<String> codes() {
        return new ArrayList<>(indexes.keySet());
    }

    /** Code to full name, restricted to {@code currency} unless it is null. */
    public Map<String, String> listAvailable(String currency) {
        Map<String, String> out = new LinkedHashMap<>();
        for (InterestRateIndex index : indexes.values()) {
            if (currency == null || index.currency().equalsIgnoreCase(currency))
                out.put(index.code(), index.name());
        }
        return out;
    }

    public int size() {
        return indexes.size();
    }

    static String normalize(String code) {
        return code.trim().toUpperCase(Locale.ROOT);
    }

    public static Builder builder() {
        return new Builder();
    }

    /** Registry pre-populated with the standard USD, EUR and GBP benchmarks. */
    public static IndexRegistry defaults() {
        return builder().registerDefaults().build();
    }

    public static final class Builder {
        private final Map<String, InterestRateIndex> indexes = new LinkedHashMap<>();

        private Builder() {
        }

        public Builder register(InterestRateIndex index) {
            indexes.put(normalize(index.code()), index);
            return this;
        }

        public Builder registerDefaults() {
            // US Dollar
            register(new InterestRateIndex("SOFR", "Secured Overnight Financing Rate", "USD", IndexType.OIS,
                    "ACT/360", "simple", FixingFrequency.DAILY, "US Dollar overnight rate, replacement for LIBOR"));
            register(new InterestRateIndex("USD-LIBOR-1M", "US Dollar LIBOR 1 Month", "USD", IndexType.IBOR,
                    "ACT/360", "simple", FixingFrequency.MONTHLY, "US Dollar 1-month interbank offered rate (legacy)"));
            register(new InterestRateIndex("USD-LIBOR-3M", "US Dollar LIBOR 3 Month", "USD", IndexType.IBOR,
                    "ACT/360", "simple", FixingFrequency.QUARTERLY,
                    "US Dollar 3-month interbank offered rate (legacy)"));
            register(new InterestRateIndex("USD-LIBOR-6M", "US Dollar LIBOR 6 Month", "USD", IndexType.IBOR,
                    "ACT/360", "simple", FixingFrequency.SEMI_ANNUAL,
                    "US Dollar 6-month interbank offered rate (legacy)"));

            // Euro
            register(new InterestRateIndex("EURIBOR-1M", "Euro Interbank Offered Rate 1 Month", "EUR",
                    IndexType.IBOR, "ACT/360", "simple", FixingFrequency.MONTHLY,
                    "Euro 1-month interbank offered rate"));
            register(new InterestRateIndex("EURIBOR-3M", "Euro Interbank Offered Rate 3 Month", "EUR",
                    IndexType.IBOR, "ACT/360", "simple", FixingFrequency.QUARTERLY,
                    "Euro 3-month interbank offered rate"));
            register(new InterestRateIndex("EURIBOR-6M", "Euro Interbank Offered Rate 6 Month", "EUR",
                    IndexType.IBOR, "ACT/360", "simple", FixingFrequency.SEMI_ANNUAL,
                    "Euro 6-month interbank offered rate"));
            register(new InterestRateIndex("EONIA", "Euro Overnight Index Average", "EUR", IndexType.OIS,
                    "ACT/360", "simple", FixingFrequency.DAILY, "Euro overnight rate (replaced by ESTR)"));
            register(new InterestRateIndex("ESTR", "Euro Short-Term Rate", "EUR", IndexType.OIS,
                    "ACT/360", "simple", FixingFrequency.DAILY, "Euro overnight rate, replacement for EONIA"));

            // British Pound
            register(new InterestRateIndex("GBP-LIBOR-3M", "British Pound LIBOR 3 Month", "GBP", IndexType.IBOR,
                    "ACT/365", "simple", FixingFrequency.QUARTERLY, "British Pound 3-month interbank offered rate"));
            register(new InterestRateIndex("SONIA", "Sterling Overnight Index Average", "GBP", IndexType.OIS,
                    "ACT/365", "simple", FixingFrequency.DAILY, "British Pound overnight rate"));

            // Treasury
            register(new InterestRateIndex("USD-TREASURY", "US Treasury Constant Maturity", "USD",
                    IndexType.TREASURY, "ACT/365", "simple", FixingFrequency.DAILY,
                    "US Treasury constant maturity rates"));
            return this;
        }

        public IndexRegistry build() {
            log.debug("Index registry built with {} indexes", indexes.size());
            return new IndexRegistry(indexes);
        }
    }
}
