package com.trading.curve.engine;

import com.trading.curve.api.Bootstrapper;
import com.trading.curve.api.Compounding;
import com.trading.curve.api.DayCount;
import com.trading.curve.api.Interpolator;
import com.trading.curve.bootstrap.BootstrapContext;
import com.trading.curve.bootstrap.BootstrapMethod;
import com.trading.curve.bootstrap.BootstrapperFactory;
import com.trading.curve.compounding.CompoundingMethod;
import com.trading.curve.daycount.DayCountConvention;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.interp.InterpolationMethod;

import java.util.function.Supplier;

import lombok.extern.log4j.Log4j2;

/**
 * The set of strategies available to curve factories, one
 * {@link StrategyRegistry} per family.
 *
 * <p>
 * A catalog is built once at start-up and passed explicitly to the factories.
 * Built-in strategies come from the {@link InterpolationMethod},
 * {@link DayCountConvention}, {@link CompoundingMethod} and
 * {@link BootstrapMethod} enums; extensions are registered on the
 * {@link Builder} before {@link Builder#build()}. Once built the catalog is
 * immutable and safe to share between threads.
 */
@Log4j2
public final class StrategyCatalog {
    private final StrategyRegistry<Supplier<Interpolator>> interpolators;
    private final StrategyRegistry<Supplier<DayCount>> dayCounts;
    private final StrategyRegistry<Supplier<Compounding>> compoundings;
    private final StrategyRegistry<BootstrapperFactory> bootstrappers;

    private StrategyCatalog(Builder b) {
        this.interpolators = b.interpolators.build();
        this.dayCounts = b.dayCounts.build();
        this.compoundings = b.compoundings.build();
        this.bootstrappers = b.bootstrappers.build();
    }

    /** Catalog holding the built-in strategies only. */
    public static StrategyCatalog defaults() {
        return DefaultsHolder.INSTANCE;
    }

    private static final class DefaultsHolder {
        static final StrategyCatalog INSTANCE = builder().build();
    }

    public Interpolator interpolator(String name) {
        return interpolators.get(name).get();
    }

    public DayCount dayCount(String name) {
        return dayCounts.get(name).get();
    }

    public Compounding compounding(String name) {
        return compoundings.get(name).get();
    }

    /**
     * Creates the named bootstrapper and checks it consumes
     * {@code instrumentType}.
     *
     * @throws com.trading.curve.exception.UnknownStrategyException if the name
     *                                                              is not
     *                                                              registered.
     * @throws CurveValidationException                             if the
     *                                                              bootstrapper
     *                                                              expects a
     *                                                              different
     *                                                              instrument.
     */
    public <T> Bootstrapper<T> bootstrapper(String name, Class<T> instrumentType, BootstrapContext context) {
        Bootstrapper<?> bootstrapper = bootstrappers.get(name).create(context);
        if (!instrumentType.equals(bootstrapper.instrumentType()))
            throw new CurveValidationException("Bootstrapper '" + name + "' consumes "
                    + bootstrapper.instrumentType().getSimpleName() + " instruments, not "
                    + instrumentType.getSimpleName());
        @SuppressWarnings("unchecked")
        Bootstrapper<T> typed = (Bootstrapper<T>) bootstrapper;
        return typed;
    }

    public StrategyRegistry<Supplier<Interpolator>> interpolators() {
        return interpolators;
    }

    public StrategyRegistry<Supplier<DayCount>> dayCounts() {
        return dayCounts;
    }

    public StrategyRegistry<Supplier<Compounding>> compoundings() {
        return compoundings;
    }

    public StrategyRegistry<BootstrapperFactory> bootstrappers() {
        return bootstrappers;
    }

    /** Builder seeded with the current registrations of this catalog. */
    public Builder toBuilder() {
        return new Builder(interpolators.toBuilder(), dayCounts.toBuilder(), compoundings.toBuilder(),
                bootstrappers.toBuilder());
    }

    /** Builder seeded with the built-in strategies. */
    public static Builder builder() {
        StrategyRegistry.Builder<Supplier<Interpolator>> interp = StrategyRegistry.builder("interpolator");
        for (InterpolationMethod m : InterpolationMethod.values())
            interp.register(m.code(), m.factory());

        StrategyRegistry.Builder<Supplier<DayCount>> dc = StrategyRegistry.builder("day count convention");
        for (DayCountConvention c : DayCountConvention.values())
            dc.register(c.code(), c.factory());

        StrategyRegistry.Builder<Supplier<Compounding>> comp = StrategyRegistry.builder("compounding method");
        for (CompoundingMethod m : CompoundingMethod.values())
            comp.register(m.code(), m.factory());

        StrategyRegistry.Builder<BootstrapperFactory> boot = StrategyRegistry.builder("bootstrapper");
        for (BootstrapMethod m : BootstrapMethod.values())
            boot.register(m.code(), m.factory());

        return new Builder(interp, dc, comp, boot);
    }

    public static final class Builder {
        private final StrategyRegistry.Builder<Supplier<Interpolator>> interpolators;
        private final StrategyRegistry.Builder<Supplier<DayCount>> dayCounts;
        private final StrategyRegistry.Builder<Supplier<Compounding>> compoundings;
        private final StrategyRegistry.Builder<BootstrapperFactory> bootstrappers;

        private Builder(StrategyRegistry.Builder<Supplier<Interpolator>> interpolators,
                StrategyRegistry.Builder<Supplier<DayCount>> dayCounts,
                StrategyRegistry.Builder<Supplier<Compounding>> compoundings,
                StrategyRegistry.Builder<BootstrapperFactory> bootstrappers) {
            this.interpolators = interpolators;
            this.dayCounts = dayCounts;
            this.compoundings = compoundings;
            this.bootstrappers = bootstrappers;
        }

        public Builder registerInterpolator(String name, Supplier<Interpolator> factory) {
            interpolators.register(name, factory);
            return this;
        }

        public Builder registerDayCount(String name, Supplier<DayCount> factory) {
            dayCounts.register(name, factory);
            return this;
        }

        public Builder registerCompounding(String name, Supplier<Compounding> factory) {
            compoundings.register(name, factory);
            return this;
        }

        public Builder registerBootstrapper(String name, BootstrapperFactory factory) {
            bootstrappers.register(name, factory);
            return this;
        }

        public StrategyCatalog build() {
            StrategyCatalog catalog = new StrategyCatalog(this);
            log.info("Strategy catalog built: {}, {}, {}, {}", catalog.interpolators, catalog.dayCounts,
                    catalog.compoundings, catalog.bootstrappers);
            return catalog;
        }
    }
}
