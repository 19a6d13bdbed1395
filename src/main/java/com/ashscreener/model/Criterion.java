package com.ashscreener.model;

import java.util.EnumSet;
import java.util.Set;

/**
 * 模块说明：Criterion（enum）。
 * 主要职责：八项筛选条件的编号、名称与执行阶段。
 * 使用建议：编号对外暴露给调用方选择条件，调整时不可重排。
 */
public enum Criterion {
    ANNUAL_GROWTH(1, "3-year annual revenue and net profit growth", Phase.INDIVIDUAL),
    QUARTERLY_GROWTH(2, "Latest quarter revenue and profit up YoY and QoQ", Phase.INDIVIDUAL),
    DIVIDENDS_NO_FINANCING(3, "5 years of cash dividends, no issuance or bond financing", Phase.BATCH),
    DIVIDEND_YIELD(4, "Dividend yield >= 4%", Phase.INDIVIDUAL),
    STATE_OWNED(5, "State-owned controlling shareholder", Phase.BATCH),
    BUYBACK(6, "Share buyback", Phase.BATCH),
    CONTROLLER_STABLE(7, "Actual controller unchanged", Phase.INDIVIDUAL),
    CASH_EXCEEDS_DEBT(8, "Cash exceeds interest-bearing debt", Phase.INDIVIDUAL);

    public enum Phase {
        BATCH,
        INDIVIDUAL
    }

    public final int id;
    public final String label;
    public final Phase phase;

    Criterion(int id, String label, Phase phase) {
        this.id = id;
        this.label = label;
        this.phase = phase;
    }

    public static Criterion fromId(int id) {
        for (Criterion c : values()) {
            if (c.id == id) {
                return c;
            }
        }
        throw new IllegalArgumentException("unknown criterion id: " + id);
    }

    public static Set<Criterion> all() {
        return EnumSet.allOf(Criterion.class);
    }

    /**
     * Parses {@code "1,5,6"}. A blank selection means all criteria.
     */
    public static Set<Criterion> parseSelection(String raw) {
        String text = raw == null ? "" : raw.trim();
        if (text.isEmpty()) {
            return all();
        }
        Set<Criterion> out = EnumSet.noneOf(Criterion.class);
        for (String token : text.split("[,;\\s]+")) {
            if (token.isEmpty()) {
                continue;
            }
            try {
                out.add(fromId(Integer.parseInt(token)));
            } catch (NumberFormatException e) {
                throw new IllegalArgumentException("invalid criterion id: " + token, e);
            }
        }
        return out.isEmpty() ? all() : out;
    }
}
