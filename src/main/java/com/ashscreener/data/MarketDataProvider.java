package com.ashscreener.data;

import com.ashscreener.model.Table;

/**
 * Upstream data source. Every method returns rows already mapped to {@link Fields} names and
 * throws on transport or payload errors; retrying and caching happen above this seam.
 */
public interface MarketDataProvider {

    /** All listed A-shares: {@code code}, {@code name}. */
    Table stockList() throws Exception;

    /** Income statements, newest first: {@code report_date}, {@code total_revenue}, {@code net_profit}. */
    Table profitStatement(String code) throws Exception;

    /** Balance sheets, newest first: {@code report_date}, cash and borrowing fields. */
    Table balanceSheet(String code) throws Exception;

    /** Dividend plans: {@code report_date}, {@code cash_dividend_per_share}. */
    Table dividendHistory(String code) throws Exception;

    /** Latest quote: a single row with {@code latest_price}. */
    Table quote(String code) throws Exception;

    /** Actual controllers of all listed companies: {@code code}, {@code controller_name}, {@code control_type}. */
    Table controllerInfo() throws Exception;

    /** Pledge ratios of all listed companies: {@code code}, {@code pledge_ratio}. */
    Table pledgeRatios() throws Exception;

    /** Share buyback plans: {@code code}, {@code buyback_progress}. */
    Table buybacks() throws Exception;

    /** Additional share issuances: {@code code}, {@code issue_date}. */
    Table additionalIssuances() throws Exception;

    /** Convertible bond issues: {@code code} (underlying stock), {@code issue_date}. */
    Table convertibleBonds() throws Exception;
}
