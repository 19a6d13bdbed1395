package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.ProgressListener;
import com.ashscreener.model.Stock;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Drops companies that placed additional shares or issued convertible bonds within the lookback.
 * Either dataset may be missing; a missing dataset removes nobody.
 */
public final class NoFinancingFilter implements BatchFilter {
    private static final Logger LOG = LogManager.getLogger(NoFinancingFilter.class);
    static final String LABEL = "No additional issuance or convertible bonds";

    private final MarketDataService data;
    private final Clock clock;
    private final int lookbackYears;

    public NoFinancingFilter(MarketDataService data, Clock clock, int lookbackYears) {
        this.data = data;
        this.clock = clock;
        this.lookbackYears = Math.max(1, lookbackYears);
    }

    @Override
    public Criterion criterion() {
        return Criterion.DIVIDENDS_NO_FINANCING;
    }

    @Override
    public String label() {
        return LABEL;
    }

    @Override
    public List<String> apply(List<String> codes, ProgressListener listener) {
        LocalDate cutoff = LocalDate.now(clock).minusYears(lookbackYears);
        Set<String> financed = new HashSet<>();

        Table issuances = data.additionalIssuances();
        if (issuances.isEmpty()) {
            LOG.warn("additional issuance dataset unavailable");
        }
        collectRecent(issuances, cutoff, financed);

        Table bonds = data.convertibleBonds();
        if (bonds.isEmpty()) {
            LOG.warn("convertible bond dataset unavailable");
        }
        collectRecent(bonds, cutoff, financed);

        return codes.stream().filter(code -> !financed.contains(code)).toList();
    }

    private static void collectRecent(Table table, LocalDate cutoff, Set<String> out) {
        for (TableRow row : table.rows()) {
            LocalDate issued = row.getDate(Fields.ISSUE_DATE);
            String code = Stock.normalizeCode(row.getString(Fields.CODE));
            if (issued != null && !code.isEmpty() && !issued.isBefore(cutoff)) {
                out.add(code);
            }
        }
    }
}
