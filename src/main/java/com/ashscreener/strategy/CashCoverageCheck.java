package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.FilterOutcome;
import com.ashscreener.model.Stock;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Cash on the latest balance sheet exceeds short-term borrowings, long-term borrowings and bonds
 * payable combined, and the controlling holder has not pledged more than the allowed ratio.
 */
public final class CashCoverageCheck implements EntityCheck {
    private final MarketDataService data;
    private final double maxPledgePct;
    private final LazyIndex<Map<String, Double>> pledgeByCode;

    public CashCoverageCheck(MarketDataService data, double maxPledgePct) {
        this.data = data;
        this.maxPledgePct = maxPledgePct;
        this.pledgeByCode = new LazyIndex<>(() -> index(data.pledgeRatios()));
    }

    @Override
    public Criterion criterion() {
        return Criterion.CASH_EXCEEDS_DEBT;
    }

    @Override
    public String label() {
        return Criterion.CASH_EXCEEDS_DEBT.label;
    }

    @Override
    public FilterOutcome evaluate(String code) {
        Table balance = data.balanceSheet(code);
        Double pledge = pledgeByCode.get().map(m -> m.get(code)).orElse(null);
        return judge(balance, pledge, maxPledgePct);
    }

    static FilterOutcome judge(Table balance, Double pledgeRatio, double maxPledgePct) {
        List<TableRow> rows = StatementRows.newestFirst(balance);
        if (rows.isEmpty()) {
            return FilterOutcome.INDETERMINATE;
        }
        if (pledgeRatio != null && pledgeRatio > maxPledgePct) {
            return FilterOutcome.FAIL;
        }
        TableRow latest = rows.get(0);
        double cash = latest.doubleOr(Fields.CASH_EQUIVALENTS, 0.0);
        double debt = latest.doubleOr(Fields.SHORT_TERM_BORROWINGS, 0.0)
                + latest.doubleOr(Fields.LONG_TERM_BORROWINGS, 0.0)
                + latest.doubleOr(Fields.BONDS_PAYABLE, 0.0);
        return FilterOutcome.of(cash > debt);
    }

    static Optional<Map<String, Double>> index(Table pledges) {
        if (pledges.isEmpty()) {
            return Optional.empty();
        }
        Map<String, Double> out = new HashMap<>();
        for (TableRow row : pledges.rows()) {
            String code = Stock.normalizeCode(row.getString(Fields.CODE));
            Double ratio = row.getDouble(Fields.PLEDGE_RATIO);
            if (!code.isEmpty() && ratio != null) {
                out.putIfAbsent(code, ratio);
            }
        }
        return Optional.of(out);
    }
}
