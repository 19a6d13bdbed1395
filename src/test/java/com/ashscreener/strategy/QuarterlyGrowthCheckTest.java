package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.model.FilterOutcome;
import com.ashscreener.model.Table;
import org.junit.jupiter.api.Test;

import java.util.Map;

import static com.ashscreener.data.FakeMarketDataProvider.row;
import static com.ashscreener.data.FakeMarketDataProvider.table;
import static org.junit.jupiter.api.Assertions.assertEquals;

class QuarterlyGrowthCheckTest {

    @Test
    void growthOverPriorQuarterAndYearShouldPass() {
        Table statements = table(
                quarter("2025-09-30", 130, 13),
                quarter("2025-06-30", 120, 12),
                quarter("2025-03-31", 110, 11),
                quarter("2024-12-31", 105, 10.5),
                quarter("2024-09-30", 100, 10),
                quarter("2024-06-30", 95, 9.5)
        );

        assertEquals(FilterOutcome.PASS, QuarterlyGrowthCheck.judge(statements));
    }

    @Test
    void declineAgainstPriorQuarterShouldFail() {
        Table statements = table(
                quarter("2025-09-30", 115, 13),
                quarter("2025-06-30", 120, 12),
                quarter("2025-03-31", 110, 11),
                quarter("2024-12-31", 105, 10.5),
                quarter("2024-09-30", 100, 10),
                quarter("2024-06-30", 95, 9.5)
        );

        assertEquals(FilterOutcome.FAIL, QuarterlyGrowthCheck.judge(statements));
    }

    @Test
    void missingSameQuarterLastYearShouldFail() {
        Table statements = table(
                quarter("2025-09-30", 130, 13),
                quarter("2025-06-30", 120, 12),
                quarter("2025-03-31", 110, 11),
                quarter("2024-12-31", 105, 10.5),
                quarter("2024-06-30", 95, 9.5),
                quarter("2024-03-31", 90, 9)
        );

        assertEquals(FilterOutcome.FAIL, QuarterlyGrowthCheck.judge(statements));
    }

    @Test
    void fewerThanSixPeriodsShouldBeIndeterminate() {
        Table statements = table(
                quarter("2025-09-30", 130, 13),
                quarter("2025-06-30", 120, 12),
                quarter("2024-09-30", 100, 10)
        );

        assertEquals(FilterOutcome.INDETERMINATE, QuarterlyGrowthCheck.judge(statements));
        assertEquals(FilterOutcome.INDETERMINATE, QuarterlyGrowthCheck.judge(Table.empty()));
    }

    private static Map<String, Object> quarter(String date, double revenue, double profit) {
        return row(Fields.REPORT_DATE, date, Fields.TOTAL_REVENUE, revenue, Fields.NET_PROFIT, profit);
    }
}
