package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.FilterOutcome;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;

import java.time.Clock;
import java.time.LocalDate;

/**
 * Trailing-twelve-month cash dividend per share over the latest price, in percent.
 */
public final class DividendYieldCheck implements EntityCheck {
    private final MarketDataService data;
    private final Clock clock;
    private final double minYieldPct;

    public DividendYieldCheck(MarketDataService data, Clock clock, double minYieldPct) {
        this.data = data;
        this.clock = clock;
        this.minYieldPct = minYieldPct;
    }

    @Override
    public Criterion criterion() {
        return Criterion.DIVIDEND_YIELD;
    }

    @Override
    public String label() {
        return Criterion.DIVIDEND_YIELD.label;
    }

    @Override
    public FilterOutcome evaluate(String code) {
        Table quote = data.quote(code);
        Double price = quote.isEmpty() ? null : quote.row(0).getDouble(Fields.LATEST_PRICE);
        if (price == null || price <= 0.0) {
            return FilterOutcome.INDETERMINATE;
        }
        return judge(price, data.dividendHistory(code), LocalDate.now(clock), minYieldPct);
    }

    static FilterOutcome judge(Double price, Table dividends, LocalDate today, double minYieldPct) {
        if (price == null || price <= 0.0) {
            return FilterOutcome.INDETERMINATE;
        }
        if (dividends.isEmpty()) {
            return FilterOutcome.FAIL;
        }
        LocalDate cutoff = today.minusMonths(12);
        double total = 0.0;
        for (TableRow row : dividends.rows()) {
            LocalDate period = row.getDate(Fields.REPORT_DATE);
            if (period == null || period.isBefore(cutoff) || period.isAfter(today)) {
                continue;
            }
            double perShare = row.doubleOr(Fields.CASH_DIVIDEND_PER_SHARE, 0.0);
            if (perShare > 0.0) {
                total += perShare;
            }
        }
        if (total <= 0.0) {
            return FilterOutcome.FAIL;
        }
        double yieldPct = total / price * 100.0;
        return FilterOutcome.of(yieldPct >= minYieldPct);
    }
}
