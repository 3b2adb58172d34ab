package com.trading.curve.bootstrap;

import com.trading.curve.api.Bootstrapper;
import com.trading.curve.api.CurvePoints;
import com.trading.curve.exception.CurveValidationException;
import com.trading.curve.instrument.Deposit;

import java.util.Comparator;
import java.util.List;

/**
 * Money-market deposits are already spot rates: sort by maturity and pass the
 * quotes through.
 */
public final class DepositBootstrapper implements Bootstrapper<Deposit> {

    @Override
    public Class<Deposit> instrumentType() {
        return Deposit.class;
    }

    @Override
    public CurvePoints bootstrap(List<? extends Deposit> deposits) {
        if (deposits == null || deposits.isEmpty())
            throw new CurveValidationException("No deposit data provided for bootstrapping");

        List<? extends Deposit> sorted = deposits.stream()
                .sorted(Comparator.comparingDouble(Deposit::maturity))
                .toList();

        double[] tenors = new double[sorted.size()];
        double[] rates = new double[sorted.size()];
        for (int i = 0; i < sorted.size(); i++) {
            Deposit d = sorted.get(i);
            if (!(d.maturity() > 0))
                throw new CurveValidationException("Deposit maturities must be positive, got " + d.maturity());
            tenors[i] = d.maturity();
            rates[i] = d.rate();
        }
        return new CurvePoints(tenors, rates);
    }
}
