package com.ashscreener.strategy;

import com.ashscreener.data.FakeMarketDataProvider;
import com.ashscreener.data.Fields;
import com.ashscreener.model.ProgressEvent;
import com.ashscreener.model.ProgressListener;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Instant;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

import static com.ashscreener.data.FakeMarketDataProvider.row;
import static com.ashscreener.data.FakeMarketDataProvider.table;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class BatchFiltersTest {
    private static final Clock CLOCK = Clock.fixed(Instant.parse("2026-03-02T02:00:00Z"), ZoneId.of("Asia/Shanghai"));
    private static final List<String> CODES = List.of("600000", "000001", "300750", "688981");

    @Test
    void stateOwnershipShouldMatchKeywordsOrControlType() {
        FakeMarketDataProvider provider = new FakeMarketDataProvider();
        provider.controllers = table(
                row(Fields.CODE, "600000", Fields.CONTROLLER_NAME, "上海市国有资产监督管理委员会"),
                row(Fields.CODE, "000001", Fields.CONTROLLER_NAME, "某某集团", Fields.CONTROL_TYPE, "地方国有企业"),
                row(Fields.CODE, "300750", Fields.CONTROLLER_NAME, "曾毓群", Fields.CONTROL_TYPE, "自然人")
        );

        List<String> kept = new StateOwnershipFilter(provider.service()).apply(CODES, ProgressListener.NONE);

        assertEquals(List.of("600000", "000001"), kept);
        assertTrue(StateOwnershipFilter.isStateOwned("国务院国有资产监督管理委员会"));
        assertFalse(StateOwnershipFilter.isStateOwned("曾毓群"));
    }

    @Test
    void unavailableDatasetsShouldPassEverythingThrough() {
        FakeMarketDataProvider provider = new FakeMarketDataProvider();
        provider.bulkError = new RuntimeException("HTTP 500");

        assertEquals(CODES, new StateOwnershipFilter(provider.service()).apply(CODES, ProgressListener.NONE));
        assertEquals(CODES, new BuybackFilter(provider.service()).apply(CODES, ProgressListener.NONE));
        assertEquals(CODES, new NoFinancingFilter(provider.service(), CLOCK, 5).apply(CODES, ProgressListener.NONE));
        assertEquals(CODES, new DividendHistoryFilter(provider.service(), CLOCK, 5, 20).apply(CODES, ProgressListener.NONE));
    }

    @Test
    void buybackShouldKeepValidProgressOnly() {
        FakeMarketDataProvider provider = new FakeMarketDataProvider();
        provider.buybacks = table(
                row(Fields.CODE, "600000", Fields.BUYBACK_PROGRESS, "实施中"),
                row(Fields.CODE, "000001", Fields.BUYBACK_PROGRESS, "股东大会否决"),
                row(Fields.CODE, "688981", Fields.BUYBACK_PROGRESS, "完成实施")
        );

        List<String> kept = new BuybackFilter(provider.service()).apply(CODES, ProgressListener.NONE);

        assertEquals(List.of("600000", "688981"), kept);
    }

    @Test
    void dividendHistoryShouldRequireEachOfTheLastFiveYears() {
        FakeMarketDataProvider provider = new FakeMarketDataProvider();
        provider.dividends.put("600000", table(
                dividend("2021-12-31"), dividend("2022-12-31"), dividend("2023-06-30"),
                dividend("2024-12-31"), dividend("2025-12-31")));
        provider.dividends.put("000001", table(
                dividend("2021-12-31"), dividend("2022-12-31"), dividend("2024-12-31"), dividend("2025-12-31")));
        List<ProgressEvent> events = new ArrayList<>();

        List<String> kept = new DividendHistoryFilter(provider.service(), CLOCK, 5, 2).apply(CODES, events::add);

        assertEquals(List.of("600000"), kept);
        assertEquals(2, events.size());
    }

    @Test
    void recentFinancingShouldBeRemoved() {
        FakeMarketDataProvider provider = new FakeMarketDataProvider();
        provider.issuances = table(
                row(Fields.CODE, "600000", Fields.ISSUE_DATE, "2023-05-10"),
                row(Fields.CODE, "000001", Fields.ISSUE_DATE, "2019-05-10")
        );
        provider.bonds = table(row(Fields.CODE, "300750", Fields.ISSUE_DATE, "2025-01-15"));

        List<String> kept = new NoFinancingFilter(provider.service(), CLOCK, 5).apply(CODES, ProgressListener.NONE);

        assertEquals(List.of("000001", "688981"), kept);
    }

    private static Map<String, Object> dividend(String date) {
        return row(Fields.REPORT_DATE, date, Fields.CASH_DIVIDEND_PER_SHARE, 0.3);
    }
}
