package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.ProgressEvent;
import com.ashscreener.model.ProgressListener;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Keeps companies that paid a cash dividend in each of the last N completed calendar years.
 * Dividend records are per company, so this step walks the survivors; if no record at all comes
 * back the dataset is treated as unavailable and every code passes.
 */
public final class DividendHistoryFilter implements BatchFilter {
    private static final Logger LOG = LogManager.getLogger(DividendHistoryFilter.class);
    static final String LABEL = "5 consecutive years of cash dividends";

    private final MarketDataService data;
    private final Clock clock;
    private final int requiredYears;
    private final int progressEvery;

    public DividendHistoryFilter(MarketDataService data, Clock clock, int requiredYears, int progressEvery) {
        this.data = data;
        this.clock = clock;
        this.requiredYears = Math.max(1, requiredYears);
        this.progressEvery = Math.max(1, progressEvery);
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
        int currentYear = LocalDate.now(clock).getYear();
        Set<Integer> required = new HashSet<>();
        for (int y = currentYear - requiredYears; y < currentYear; y++) {
            required.add(y);
        }

        List<String> passed = new ArrayList<>();
        int withRecords = 0;
        for (int i = 0; i < codes.size(); i++) {
            String code = codes.get(i);
            if (i % progressEvery == 0) {
                listener.onProgress(new ProgressEvent(
                        "Checking dividends: " + i + "/" + codes.size(), LABEL, codes.size() - i));
            }
            Table dividends = data.dividendHistory(code);
            if (dividends.isEmpty()) {
                continue;
            }
            withRecords++;
            if (cashDividendYears(dividends).containsAll(required)) {
                passed.add(code);
            }
        }
        if (withRecords == 0 && !codes.isEmpty()) {
            LOG.warn("no dividend records for any of {} codes, treating dataset as unavailable", codes.size());
            return codes;
        }
        return passed;
    }

    static Set<Integer> cashDividendYears(Table dividends) {
        Set<Integer> years = new HashSet<>();
        for (TableRow row : dividends.rows()) {
            LocalDate reportDate = row.getDate(Fields.REPORT_DATE);
            if (reportDate == null) {
                continue;
            }
            if (row.doubleOr(Fields.CASH_DIVIDEND_PER_SHARE, 0.0) > 0.0) {
                years.add(reportDate.getYear());
            }
        }
        return years;
    }
}
