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
 * Keeps companies whose actual controller is a state body (SASAC, finance bureaus, local governments).
 */
public final class StateOwnershipFilter implements BatchFilter {
    private static final Logger LOG = LogManager.getLogger(StateOwnershipFilter.class);

    static final List<String> STATE_KEYWORDS = List.of(
            "国有", "国资", "财政局", "财政厅", "国投", "中央", "省人民政府",
            "市人民政府", "国家", "央企", "国企", "人民政府", "管理委员会",
            "国有资产", "SASAC", "财政部", "国务院", "中国人民", "省国资",
            "市国资", "区国资", "县国资", "经济开发区", "高新区管委会"
    );

    private final MarketDataService data;

    public StateOwnershipFilter(MarketDataService data) {
        this.data = data;
    }

    @Override
    public Criterion criterion() {
        return Criterion.STATE_OWNED;
    }

    @Override
    public String label() {
        return Criterion.STATE_OWNED.label;
    }

    @Override
    public List<String> apply(List<String> codes, ProgressListener listener) {
        Table controllers = data.controllerInfo();
        if (controllers.isEmpty()) {
            LOG.warn("controller dataset unavailable, skipping state ownership filter");
            return codes;
        }
        Set<String> stateOwned = new HashSet<>();
        for (TableRow row : controllers.rows()) {
            String code = Stock.normalizeCode(row.getString(Fields.CODE));
            if (code.isEmpty()) {
                continue;
            }
            if (isStateOwned(row.getString(Fields.CONTROLLER_NAME))
                    || row.getString(Fields.CONTROL_TYPE).contains("国有")) {
                stateOwned.add(code);
            }
        }
        return codes.stream().filter(stateOwned::contains).toList();
    }

    static boolean isStateOwned(String controllerName) {
        if (controllerName == null || controllerName.isBlank()) {
            return false;
        }
        for (String keyword : STATE_KEYWORDS) {
            if (controllerName.contains(keyword)) {
                return true;
            }
        }
        return false;
    }
}
