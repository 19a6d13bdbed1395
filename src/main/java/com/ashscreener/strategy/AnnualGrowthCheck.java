package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.FilterOutcome;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;

import java.util.ArrayList;
import java.util.List;

/**
 * Revenue and net profit strictly increasing across the last three fiscal-year pairs, each earlier
 * year positive.
 */
public final class AnnualGrowthCheck implements EntityCheck {
    private static final int YEARS_NEEDED = 4;

    private final MarketDataService data;

    public AnnualGrowthCheck(MarketDataService data) {
        this.data = data;
    }

    @Override
    public Criterion criterion() {
        return Criterion.ANNUAL_GROWTH;
    }

    @Override
    public String label() {
        return Criterion.ANNUAL_GROWTH.label;
    }

    @Override
    public FilterOutcome evaluate(String code) {
        return judge(data.profitStatement(code));
    }

    static FilterOutcome judge(Table statements) {
        if (statements.isEmpty()) {
            return FilterOutcome.INDETERMINATE;
        }
        List<TableRow> annual = new ArrayList<>();
        for (TableRow row : StatementRows.newestFirst(statements)) {
            if (StatementRows.isFiscalYearEnd(row)) {
                annual.add(row);
            }
            if (annual.size() == YEARS_NEEDED) {
                break;
            }
        }
        // a short history disqualifies
        if (annual.size() < YEARS_NEEDED) {
            return FilterOutcome.FAIL;
        }
        for (int i = 0; i < YEARS_NEEDED - 1; i++) {
            TableRow curr = annual.get(i);
            TableRow prev = annual.get(i + 1);
            double currRevenue = curr.doubleOr(Fields.TOTAL_REVENUE, 0.0);
            double prevRevenue = prev.doubleOr(Fields.TOTAL_REVENUE, 0.0);
            double currProfit = curr.doubleOr(Fields.NET_PROFIT, 0.0);
            double prevProfit = prev.doubleOr(Fields.NET_PROFIT, 0.0);
            if (prevRevenue <= 0.0 || prevProfit <= 0.0) {
                return FilterOutcome.FAIL;
            }
            if (currRevenue <= prevRevenue || currProfit <= prevProfit) {
                return FilterOutcome.FAIL;
            }
        }
        return FilterOutcome.PASS;
    }
}
