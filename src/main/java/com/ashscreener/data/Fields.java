package com.ashscreener.data;

/**
 * Canonical field names. Provider adapters translate their raw schema to these before any
 * check reads the data.
 */
public final class Fields {
    public static final String CODE = "code";
    public static final String NAME = "name";

    public static final String REPORT_DATE = "report_date";
    public static final String TOTAL_REVENUE = "total_revenue";
    public static final String NET_PROFIT = "net_profit";

    public static final String CASH_EQUIVALENTS = "cash_equivalents";
    public static final String SHORT_TERM_BORROWINGS = "short_term_borrowings";
    public static final String LONG_TERM_BORROWINGS = "long_term_borrowings";
    public static final String BONDS_PAYABLE = "bonds_payable";

    public static final String CASH_DIVIDEND_PER_SHARE = "cash_dividend_per_share";

    public static final String CONTROLLER_NAME = "controller_name";
    public static final String CONTROL_TYPE = "control_type";

    public static final String PLEDGE_RATIO = "pledge_ratio";
    public static final String BUYBACK_PROGRESS = "buyback_progress";
    public static final String ISSUE_DATE = "issue_date";

    public static final String LATEST_PRICE = "latest_price";

    private Fields() {
    }
}
