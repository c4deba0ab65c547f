package com.barthel.proforma.domain.model;

import java.util.List;
import java.util.Objects;

/**
 * Ordered operating years 1..N of a projection. Year 0 has no row; the equity
 * contribution of the matching {@link FinancingStructure} stands for it.
 *
 * @param sector the sector the schedule was built for
 * @param rows   one row per operating year, in year order
 */
public record ProjectionSchedule(Sector sector, List<ForecastRow> rows) {
    public ProjectionSchedule {
        Objects.requireNonNull(sector, "Sector is required");
        rows = List.copyOf(rows);
        for (int i = 0; i < rows.size(); i++) {
            if (rows.get(i).year() != i + 1) {
                throw new IllegalArgumentException("Rows must cover consecutive years from 1, found year "
                        + rows.get(i).year() + " at position " + (i + 1));
            }
        }
    }

    public int horizon() {
        return rows.size();
    }

    /**
     * @param year 1-based operating year
     * @return the row for that year
     */
    public ForecastRow row(int year) {
        return rows.get(year - 1);
    }
}
