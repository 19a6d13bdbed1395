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

import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps companies with a buyback plan that is proposed, approved, in progress or completed.
 */
public final class BuybackFilter implements BatchFilter {
    private static final Logger LOG = LogManager.getLogger(BuybackFilter.class);
    static final List<String> VALID_PROGRESS = List.of("完成", "实施中", "实施", "董事会预案", "股东大会通过");

    private final MarketDataService data;

    public BuybackFilter(MarketDataService data) {
        this.data = data;
    }

    @Override
    public Criterion criterion() {
        return Criterion.BUYBACK;
    }

    @Override
    public String label() {
        return Criterion.BUYBACK.label;
    }

    @Override
    public List<String> apply(List<String> codes, ProgressListener listener) {
        Table buybacks = data.buybacks();
        if (buybacks.isEmpty()) {
            LOG.warn("buyback dataset unavailable, skipping buyback filter");
            return codes;
        }
        Set<String> active = new HashSet<>();
        for (TableRow row : buybacks.rows()) {
            String code = Stock.normalizeCode(row.getString(Fields.CODE));
            String progress = row.getString(Fields.BUYBACK_PROGRESS);
            if (!code.isEmpty() && VALID_PROGRESS.stream().anyMatch(progress::contains)) {
                active.add(code);
            }
        }
        return codes.stream().filter(active::contains).toList();
    }
}
