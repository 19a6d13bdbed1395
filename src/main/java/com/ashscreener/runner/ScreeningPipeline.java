package com.ashscreener.runner;

import com.ashscreener.config.Config;
import com.ashscreener.data.Dataset;
import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataService;
import com.ashscreener.model.Criterion;
import com.ashscreener.model.ProgressEvent;
import com.ashscreener.model.ProgressListener;
import com.ashscreener.model.ScreeningReport;
import com.ashscreener.model.StageResult;
import com.ashscreener.model.Stock;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;
import com.ashscreener.strategy.AnnualGrowthCheck;
import com.ashscreener.strategy.BatchFilter;
import com.ashscreener.strategy.BuybackFilter;
import com.ashscreener.strategy.CashCoverageCheck;
import com.ashscreener.strategy.ControllerStabilityCheck;
import com.ashscreener.strategy.DividendHistoryFilter;
import com.ashscreener.strategy.DividendYieldCheck;
import com.ashscreener.strategy.EntityCheck;
import com.ashscreener.strategy.NoFinancingFilter;
import com.ashscreener.strategy.QuarterlyGrowthCheck;
import com.ashscreener.strategy.StateOwnershipFilter;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.time.Clock;
import java.time.Instant;
import java.time.LocalDate;
import java.time.ZoneId;
import java.time.format.DateTimeFormatter;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * 模块说明：ScreeningPipeline（class）。
 * 主要职责：构建股票池，先执行批量过滤（阶段一），再对剩余股票并发执行单项检查（阶段二），输出漏斗报告。
 * 使用建议：每次 run 重新创建检查实例，控制人、质押等批量数据只在本次运行内复用。
 */
public final class ScreeningPipeline {
    private static final Logger LOG = LogManager.getLogger(ScreeningPipeline.class);
    private static final DateTimeFormatter TIME_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss");

    private final Config config;
    private final MarketDataService data;
    private final Clock clock;
    private final ZoneId zone;

    public ScreeningPipeline(Config config, MarketDataService data) {
        this(config, data, Clock.systemDefaultZone());
    }

    public ScreeningPipeline(Config config, MarketDataService data, Clock clock) {
        this.config = config;
        this.data = data;
        this.zone = resolveZone(config.getString("app.zone", "Asia/Shanghai"));
        this.clock = clock.withZone(zone);
    }

    public ScreeningReport run(Set<Criterion> selected, ProgressListener listener) throws InterruptedException {
        Set<Criterion> criteria = selected == null || selected.isEmpty()
                ? Criterion.all()
                : EnumSet.copyOf(selected);
        ProgressListener progress = listener == null ? ProgressListener.NONE : listener;
        progress.onProgress(new ProgressEvent("Loading stock universe", ProgressEvent.STAGE_INIT, 0));

        Map<String, String> names = new LinkedHashMap<>();
        List<String> universe = buildUniverse(data.stockList(), names);
        int totalInitial = universe.size();
        LOG.info("universe: {} stocks, criteria={}", totalInitial, ids(criteria));
        progress.onProgress(new ProgressEvent(
                "Universe ready: " + totalInitial + " stocks", ProgressEvent.STAGE_INIT, totalInitial));

        Set<Criterion> batch = EnumSet.noneOf(Criterion.class);
        Set<Criterion> individual = EnumSet.noneOf(Criterion.class);
        for (Criterion c : criteria) {
            if (c.phase == Criterion.Phase.BATCH) {
                batch.add(c);
            } else {
                individual.add(c);
            }
        }

        List<StageResult> stages = new ArrayList<>();
        List<String> current = universe;

        for (BatchFilter filter : batchFilters(batch)) {
            if (current.isEmpty()) {
                break;
            }
            progress.onProgress(new ProgressEvent(filter.label(), filter.label(), current.size()));
            int before = current.size();
            List<String> next;
            try {
                next = filter.apply(current, progress);
            } catch (RuntimeException e) {
                LOG.error("batch filter [{}] failed, passing all {} codes through", filter.label(), before, e);
                next = current;
            }
            current = intersectInOrder(current, next);
            stages.add(StageResult.of(filter.criterion(), filter.label(), before, current.size()));
            LOG.info("[{}] {} -> {}", filter.label(), before, current.size());
        }

        IndividualCheckRunner runner = new IndividualCheckRunner(
                config.getInt("screen.pool.max_threads", 16),
                config.getInt("screen.progress.every", 20));
        for (EntityCheck check : entityChecks(individual)) {
            if (current.isEmpty()) {
                break;
            }
            progress.onProgress(new ProgressEvent(check.label(), check.label(), current.size()));
            int before = current.size();
            current = runner.run(current, check, progress);
            stages.add(StageResult.of(check.criterion(), check.label(), before, current.size()));
            LOG.info("[{}] {} -> {}", check.label(), before, current.size());
        }

        Map<String, String> dates = dataDates(current.isEmpty() ? universe : current);
        progress.onProgress(new ProgressEvent(
                "Screening finished: " + current.size() + " passed", ProgressEvent.STAGE_DONE, 0));

        return ScreeningReport.builder()
                .totalInitial(totalInitial)
                .stages(List.copyOf(stages))
                .passed(List.copyOf(current))
                .stockNames(names)
                .finalCount(current.size())
                .selectedCriteria(ids(criteria))
                .dataDates(dates)
                .build();
    }

    List<BatchFilter> batchFilters(Set<Criterion> criteria) {
        List<BatchFilter> out = new ArrayList<>();
        if (criteria.contains(Criterion.STATE_OWNED)) {
            out.add(new StateOwnershipFilter(data));
        }
        if (criteria.contains(Criterion.DIVIDENDS_NO_FINANCING)) {
            out.add(new DividendHistoryFilter(data, clock,
                    config.getInt("screen.dividend.required_years", 5),
                    config.getInt("screen.progress.every", 20)));
            out.add(new NoFinancingFilter(data, clock, config.getInt("screen.financing.lookback_years", 5)));
        }
        if (criteria.contains(Criterion.BUYBACK)) {
            out.add(new BuybackFilter(data));
        }
        return out;
    }

    List<EntityCheck> entityChecks(Set<Criterion> criteria) {
        List<EntityCheck> out = new ArrayList<>();
        if (criteria.contains(Criterion.DIVIDEND_YIELD)) {
            out.add(new DividendYieldCheck(data, clock, config.getDouble("screen.dividend_yield.min_pct", 4.0)));
        }
        if (criteria.contains(Criterion.ANNUAL_GROWTH)) {
            out.add(new AnnualGrowthCheck(data));
        }
        if (criteria.contains(Criterion.QUARTERLY_GROWTH)) {
            out.add(new QuarterlyGrowthCheck(data));
        }
        if (criteria.contains(Criterion.CONTROLLER_STABLE)) {
            out.add(new ControllerStabilityCheck(data));
        }
        if (criteria.contains(Criterion.CASH_EXCEEDS_DEBT)) {
            out.add(new CashCoverageCheck(data, config.getDouble("screen.pledge_ratio.max_pct", 30.0)));
        }
        return out;
    }

    static List<String> buildUniverse(Table stockList, Map<String, String> names) {
        Set<String> codes = new LinkedHashSet<>();
        for (TableRow row : stockList.rows()) {
            Stock stock = new Stock(row.getString(Fields.CODE), row.getString(Fields.NAME));
            if (stock.code.isEmpty()) {
                continue;
            }
            names.putIfAbsent(stock.code, stock.name);
            if (stock.excludedByName() || !stock.board.screenable()) {
                continue;
            }
            codes.add(stock.code);
        }
        return new ArrayList<>(codes);
    }

    // survivors never grow and keep the previous order
    private static List<String> intersectInOrder(List<String> current, List<String> next) {
        Set<String> keep = new LinkedHashSet<>(next == null ? List.of() : next);
        List<String> out = new ArrayList<>(Math.min(current.size(), keep.size()));
        for (String code : current) {
            if (keep.contains(code)) {
                out.add(code);
            }
        }
        return out;
    }

    private Map<String, String> dataDates(List<String> sampleFrom) {
        Map<String, String> dates = new LinkedHashMap<>();
        dates.put("screening_time", TIME_FMT.format(clock.instant().atZone(zone)));
        data.lastUpdated(Dataset.STOCK_LIST).ifPresent(t -> dates.put("stock_list_update", format(t)));
        if (sampleFrom.isEmpty()) {
            return dates;
        }
        String sample = sampleFrom.get(0);
        latestReportDate(data.profitStatement(sample))
                .ifPresent(d -> dates.put("latest_financial_report", d.toString()));
        data.lastUpdated(Dataset.QUOTE, sample).ifPresent(t -> dates.put("price_data_update", format(t)));
        return dates;
    }

    private static Optional<LocalDate> latestReportDate(Table statements) {
        LocalDate latest = null;
        for (TableRow row : statements.rows()) {
            LocalDate d = row.getDate(Fields.REPORT_DATE);
            if (d != null && (latest == null || d.isAfter(latest))) {
                latest = d;
            }
        }
        return Optional.ofNullable(latest);
    }

    private String format(Instant instant) {
        return TIME_FMT.format(instant.atZone(zone));
    }

    private static List<Integer> ids(Set<Criterion> criteria) {
        List<Integer> out = new ArrayList<>();
        for (Criterion c : criteria) {
            out.add(c.id);
        }
        out.sort(Integer::compareTo);
        return out;
    }

    private static ZoneId resolveZone(String raw) {
        try {
            return ZoneId.of(raw);
        } catch (Exception e) {
            LOG.warn("invalid app.zone '{}', using Asia/Shanghai", raw);
            return ZoneId.of("Asia/Shanghai");
        }
    }
}
