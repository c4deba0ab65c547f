package com.barthel.proforma.domain.model.inputs;

/**
 * MACRS general depreciation system recovery classes with the published
 * half-year convention percentages (IRS Publication 946, table A-1).
 */
public enum MacrsClass {
    MACRS_3(33.33, 44.45, 14.81, 7.41),
    MACRS_5(20.00, 32.00, 19.20, 11.52, 11.52, 5.76),
    MACRS_7(14.29, 24.49, 17.49, 12.49, 8.93, 8.92, 8.93, 4.46),
    MACRS_10(10.00, 18.00, 14.40, 11.52, 9.22, 7.37, 6.55, 6.55, 6.56, 6.55, 3.28),
    MACRS_15(5.00, 9.50, 8.55, 7.70, 6.93, 6.23, 5.90, 5.90, 5.91, 5.90, 5.91, 5.90, 5.91, 5.90,
            5.91, 2.95),
    MACRS_20(3.750, 7.219, 6.677, 6.177, 5.713, 5.285, 4.888, 4.522, 4.462, 4.461, 4.462, 4.461,
            4.462, 4.461, 4.462, 4.461, 4.462, 4.461, 4.462, 4.461, 2.231);

    private final double[] percentages;

    MacrsClass(double... percentages) {
        this.percentages = percentages;
    }

    /**
     * Depreciation rate for the given recovery year.
     *
     * @param year 1-based year since the asset was placed in service
     * @return the fraction of basis to expense, zero outside the table
     */
    public double rate(int year) {
        if (year < 1 || year > percentages.length) {
            return 0.0;
        }
        return percentages[year - 1] / 100.0;
    }

    /**
     * @return number of years with a non-zero rate
     */
    public int scheduleYears() {
        return percentages.length;
    }
}
