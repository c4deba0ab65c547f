package com.barthel.proforma.domain.finance;

import com.barthel.proforma.domain.exception.InvalidAssumptionException;
import com.barthel.proforma.domain.model.AmortizationEntry;

import java.util.ArrayList;
import java.util.List;

/**
 * Level-payment (annuity) repayment of a term loan drawn at year 0.
 */
public final class DebtAmortizer {

    public static final String TENOR_FIELD = "debt_tenor_years";
    public static final String RATE_FIELD = "debt_interest_rate";

    private DebtAmortizer() {
    }

    /**
     * Annual payment that retires {@code principal} over {@code tenorYears}.
     *
     * @param principal  amount borrowed
     * @param rate       annual interest rate, greater than -1
     * @param tenorYears repayment period, positive when principal is positive
     * @return the level payment, zero without principal
     */
    public static double levelPayment(double principal, double rate, int tenorYears) {
        if (principal <= 0.0) {
            return 0.0;
        }
        requireUsable(rate, tenorYears);
        // (1 + rate)^n - 1 without losing rates too small to survive 1 + rate
        double growthLessOne = Math.expm1(tenorYears * Math.log1p(rate));
        if (growthLessOne == 0.0) {
            return principal / tenorYears;
        }
        if (Double.isInfinite(growthLessOne)) {
            return principal * rate;
        }
        return principal * rate * (1.0 + growthLessOne) / growthLessOne;
    }

    /**
     * Builds the repayment entries for years 1..tenor. The last entry repays
     * whatever balance is left so the loan is fully retired.
     *
     * @param principal    amount borrowed
     * @param rate         annual interest rate
     * @param tenorYears   repayment period
     * @param horizonYears projection horizon the loan has to fit in
     * @return one entry per repayment year, empty without principal
     */
    public static List<AmortizationEntry> amortize(double principal, double rate, int tenorYears, int horizonYears) {
        if (principal <= 0.0) {
            return List.of();
        }
        if (tenorYears > horizonYears) {
            throw new InvalidAssumptionException(TENOR_FIELD,
                    "tenor of " + tenorYears + " years exceeds the " + horizonYears + "-year horizon");
        }
        double payment = levelPayment(principal, rate, tenorYears);

        List<AmortizationEntry> entries = new ArrayList<>(tenorYears);
        double balance = principal;
        for (int year = 1; year <= tenorYears; year++) {
            double interest = balance * rate;
            double repaid = year == tenorYears ? balance : payment - interest;
            entries.add(new AmortizationEntry(year, balance, interest, repaid, balance - repaid));
            balance -= repaid;
        }
        return entries;
    }

    private static void requireUsable(double rate, int tenorYears) {
        if (tenorYears <= 0) {
            throw new InvalidAssumptionException(TENOR_FIELD,
                    "must be positive when debt is drawn, was " + tenorYears);
        }
        if (!Double.isFinite(rate) || rate <= -1.0) {
            throw new InvalidAssumptionException(RATE_FIELD, "must be greater than -100%, was " + rate);
        }
    }
}
