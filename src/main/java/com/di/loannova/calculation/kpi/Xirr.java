package com.di.loannova.calculation.kpi;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;
import java.util.Comparator;
import java.util.List;

/**
 * Internal rate of return over irregularly dated cash flows, solved with Newton's method.
 */
final class Xirr {

    record CashFlow(LocalDate date, double amount) {
    }

    static final double GUESS = 0.1;
    static final int MAX_ITERATIONS = 100;
    static final double TOLERANCE = 1e-9;

    private Xirr() {
    }

    /**
     * Annual rate as a fraction. Returns 0 when the flows do not change sign or when Newton's
     * method fails to converge to a finite root.
     */
    static double solve(List<CashFlow> flows) {
        if (flows.isEmpty() || signDegenerate(flows)) {
            return 0.0;
        }
        List<CashFlow> sorted = flows.stream().sorted(Comparator.comparing(CashFlow::date)).toList();
        LocalDate d0 = sorted.get(0).date();
        double rate = GUESS;
        for (int i = 0; i < MAX_ITERATIONS; i++) {
            double npv = 0.0;
            double derivative = 0.0;
            for (CashFlow cf : sorted) {
                double t = ChronoUnit.DAYS.between(d0, cf.date()) / 365.0;
                double discount = Math.pow(1.0 + rate, t);
                npv += cf.amount() / discount;
                derivative -= t * cf.amount() / (discount * (1.0 + rate));
            }
            if (!Double.isFinite(npv) || !Double.isFinite(derivative) || derivative == 0.0) {
                return 0.0;
            }
            double next = rate - npv / derivative;
            if (!Double.isFinite(next) || next <= -1.0) {
                return 0.0;
            }
            if (Math.abs(next - rate) < TOLERANCE) {
                return next;
            }
            rate = next;
        }
        return 0.0;
    }

    static boolean signDegenerate(List<CashFlow> flows) {
        boolean allNonNegative = flows.stream().allMatch(f -> f.amount() >= 0);
        boolean allNonPositive = flows.stream().allMatch(f -> f.amount() <= 0);
        return allNonNegative || allNonPositive;
    }
}
