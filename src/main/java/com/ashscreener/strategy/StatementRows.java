package com.ashscreener.strategy;

import com.ashscreener.data.Fields;
import com.ashscreener.model.Table;
import com.ashscreener.model.TableRow;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;

final class StatementRows {
    private StatementRows() {
    }

    /**
     * Rows with a parseable report date, newest first.
     */
    static List<TableRow> newestFirst(Table statements) {
        List<TableRow> out = new ArrayList<>();
        for (TableRow row : statements.rows()) {
            if (row.getDate(Fields.REPORT_DATE) != null) {
                out.add(row);
            }
        }
        out.sort(Comparator.comparing((TableRow r) -> r.getDate(Fields.REPORT_DATE)).reversed());
        return out;
    }

    static boolean isFiscalYearEnd(TableRow row) {
        LocalDate date = row.getDate(Fields.REPORT_DATE);
        return date != null && date.getMonthValue() == 12 && date.getDayOfMonth() == 31;
    }
}
