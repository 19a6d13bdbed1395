package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.FilterOutcome;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;

import java.time.LocalDate;
import java.util.List;

/**
 * Latest reported period beats both the previous period and the same period a year earlier,
 * in revenue and in net profit.
 */
public final class QuarterlyGrowthCheck implements EntityCheck {
    private static final int MIN_PERIODS = 6;

    private final MarketDataService data;

    public QuarterlyGrowthCheck(MarketDataService data) {
        this.data = data;
    }

    @Override
    public Criterion criterion() {
        return Criterion.QUARTERLY_GROWTH;
    }

    @Override
    public String label() {
        return Criterion.QUARTERLY_GROWTH.label;
    }

    @Override
    public FilterOutcome evaluate(String code) {
        return judge(data.profitStatement(code));
    }

    static FilterOutcome judge(Table statements) {
        List<TableRow> rows = StatementRows.newestFirst(statements);
        if (rows.size() < MIN_PERIODS) {
            return FilterOutcome.INDETERMINATE;
        }
        TableRow latest = rows.get(0);
        TableRow previous = rows.get(1);
        LocalDate latestDate = latest.getDate(Fields.REPORT_DATE);

        TableRow yearAgo = null;
        for (int i = 1; i < rows.size(); i++) {
            LocalDate d = rows.get(i).getDate(Fields.REPORT_DATE);
            if (d.getMonthValue() == latestDate.getMonthValue()
                    && d.getDayOfMonth() == latestDate.getDayOfMonth()
                    && d.getYear() != latestDate.getYear()) {
                yearAgo = rows.get(i);
                break;
            }
        }
        if (yearAgo == null) {
            return FilterOutcome.FAIL;
        }
        return FilterOutcome.of(grew(latest, yearAgo) && grew(latest, previous));
    }

    private static boolean grew(TableRow current, TableRow base) {
        double baseRevenue = base.doubleOr(Fields.TOTAL_REVENUE, 0.0);
        double baseProfit = base.doubleOr(Fields.NET_PROFIT, 0.0);
        if (baseRevenue <= 0.0 || baseProfit <= 0.0) {
            return false;
        }
        return current.doubleOr(Fields.TOTAL_REVENUE, 0.0) > baseRevenue
                && current.doubleOr(Fields.NET_PROFIT, 0.0) > baseProfit;
    }
}
