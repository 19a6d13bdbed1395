package com.ashscreener.data;

/**
 * Logical upstream datasets with their cache time-to-live.
 */
public enum Dataset {
    STOCK_LIST("stock_list", 24),
    PROFIT_STATEMENT("profit", 48),
    BALANCE_SHEET("balance", 48),
    DIVIDEND_HISTORY("dividend", 24),
    CONTROLLER("controller_info", 24),
    PLEDGE("pledge_data", 24),
    BUYBACK("buyback_data", 12),
    ADDITIONAL_ISSUANCE("additional_issuance", 24),
    CONVERTIBLE_BOND("conv_bonds", 24),
    QUOTE("price", 4);

    public final String logicalName;
    public final double ttlHours;

    Dataset(String logicalName, double ttlHours) {
        this.logicalName = logicalName;
        this.ttlHours = ttlHours;
    }

    public String cacheKey(String... args) {
        if (args == null || args.length == 0) {
            return logicalName;
        }
        StringBuilder sb = new StringBuilder(logicalName);
        for (String arg : args) {
            sb.append('_').append(arg == null ? "" : arg.trim());
        }
        return sb.toString();
    }
}
