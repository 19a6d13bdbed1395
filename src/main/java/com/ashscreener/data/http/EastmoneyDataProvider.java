package com.ashscreener.data.http;

import com.ashscreener.config.Config;
import com.ashscreener.data.Fields;
import com.ashscreener.data.MarketDataProvider;
import com.ashscreener.data.RateLimiter;
import com.ashscreener.model.Stock;
import com.ashscreener.model.Table;
import org.json.JSONArray;
import org.json.JSONObject;

import java.net.URLEncoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.function.Function;

/**
 * Eastmoney public endpoints (quote list, quote, data-center reports). Raw report columns are
 * pinned per dataset and renamed to {@link Fields}. The caller's limiter covers the first request
 * of each call; later report pages acquire the same limiter themselves.
 */
public final class EastmoneyDataProvider implements MarketDataProvider {
    static final String CLIST_URL = "https://82.push2.eastmoney.com/api/qt/clist/get";
    static final String QUOTE_URL = "https://push2.eastmoney.com/api/qt/stock/get";
    static final String DATACENTER_URL = "https://datacenter-web.eastmoney.com/api/data/v1/get";
    static final String F10_URL = "https://datacenter.eastmoney.com/securities/api/data/v1/get";
    private static final String A_SHARE_FILTER = "m:0+t:6,m:0+t:80,m:1+t:2,m:1+t:23,m:0+t:81+s:2048";
    private static final int NO_DATA_CODE = 9201;

    private static final Map<String, String> BUYBACK_PROGRESS = Map.of(
            "001", "董事会预案",
            "002", "股东大会通过",
            "003", "股东大会否决",
            "004", "实施中",
            "005", "停止实施",
            "006", "完成实施"
    );

    private static final List<Column> PROFIT_COLUMNS = List.of(
            new Column("REPORT_DATE", Fields.REPORT_DATE, EastmoneyDataProvider::isoDate),
            new Column("TOTAL_OPERATE_INCOME", Fields.TOTAL_REVENUE, Function.identity()),
            new Column("PARENT_NETPROFIT", Fields.NET_PROFIT, Function.identity())
    );
    private static final List<Column> BALANCE_COLUMNS = List.of(
            new Column("REPORT_DATE", Fields.REPORT_DATE, EastmoneyDataProvider::isoDate),
            new Column("MONETARYFUNDS", Fields.CASH_EQUIVALENTS, Function.identity()),
            new Column("SHORT_LOAN", Fields.SHORT_TERM_BORROWINGS, Function.identity()),
            new Column("LONG_LOAN", Fields.LONG_TERM_BORROWINGS, Function.identity()),
            new Column("BOND_PAYABLE", Fields.BONDS_PAYABLE, Function.identity())
    );
    private static final List<Column> DIVIDEND_COLUMNS = List.of(
            new Column("REPORT_DATE", Fields.REPORT_DATE, EastmoneyDataProvider::isoDate),
            // quoted per 10 shares upstream
            new Column("PRETAX_BONUS_RMB", Fields.CASH_DIVIDEND_PER_SHARE, EastmoneyDataProvider::perTenToPerShare)
    );
    private static final List<Column> CONTROLLER_COLUMNS = List.of(
            new Column("SECURITY_CODE", Fields.CODE, EastmoneyDataProvider::code),
            new Column("HOLDER_NAME", Fields.CONTROLLER_NAME, Function.identity()),
            new Column("HOLDER_TYPE", Fields.CONTROL_TYPE, Function.identity())
    );
    private static final List<Column> PLEDGE_COLUMNS = List.of(
            new Column("SECURITY_CODE", Fields.CODE, EastmoneyDataProvider::code),
            new Column("PLEDGE_RATIO", Fields.PLEDGE_RATIO, Function.identity())
    );
    private static final List<Column> BUYBACK_COLUMNS = List.of(
            new Column("DIM_SCODE", Fields.CODE, EastmoneyDataProvider::code),
            new Column("REPURPROGRESS", Fields.BUYBACK_PROGRESS,
                    v -> BUYBACK_PROGRESS.getOrDefault(String.valueOf(v).trim(), String.valueOf(v)))
    );
    private static final List<Column> ISSUANCE_COLUMNS = List.of(
            new Column("SECURITY_CODE", Fields.CODE, EastmoneyDataProvider::code),
            new Column("ISSUE_DATE", Fields.ISSUE_DATE, EastmoneyDataProvider::isoDate)
    );
    private static final List<Column> CONVERTIBLE_COLUMNS = List.of(
            new Column("CONVERT_STOCK_CODE", Fields.CODE, EastmoneyDataProvider::code),
            new Column("PUBLIC_START_DATE", Fields.ISSUE_DATE, EastmoneyDataProvider::isoDate)
    );

    private final HttpClientEx http;
    private final RateLimiter pageLimiter;
    private final Config config;
    private final int timeoutSec;
    private final int pageSize;

    public EastmoneyDataProvider(Config config, RateLimiter pageLimiter) {
        this(config, new HttpClientEx("https://data.eastmoney.com/"), pageLimiter);
    }

    public EastmoneyDataProvider(Config config, HttpClientEx http, RateLimiter pageLimiter) {
        this.config = config;
        this.http = http;
        this.pageLimiter = pageLimiter;
        this.timeoutSec = Math.max(3, config.getInt("eastmoney.request_timeout_sec", 30));
        this.pageSize = Math.max(50, config.getInt("eastmoney.page_size", 500));
    }

    @Override
    public Table stockList() throws Exception {
        String url = CLIST_URL + "?pn=1&pz=6000&po=1&np=1&fltt=2&invt=2&fid=f12&fs=" + A_SHARE_FILTER
                + "&fields=f12,f14";
        JSONObject root = new JSONObject(http.getText(url, timeoutSec));
        JSONObject data = root.optJSONObject("data");
        JSONArray diff = data == null ? null : data.optJSONArray("diff");
        if (diff == null) {
            throw new IllegalStateException("unexpected stock list payload");
        }
        return Table.of(mapItems(diff, List.of(
                new Column("f12", Fields.CODE, EastmoneyDataProvider::code),
                new Column("f14", Fields.NAME, Function.identity())
        )));
    }

    @Override
    public Table profitStatement(String code) throws Exception {
        return report(DATACENTER_URL, reportName("profit", "RPT_DMSK_FN_INCOME"),
                "(SECURITY_CODE=\"" + code + "\")", "REPORT_DATE", PROFIT_COLUMNS);
    }

    @Override
    public Table balanceSheet(String code) throws Exception {
        return report(F10_URL, reportName("balance", "RPT_F10_FINANCE_GBALANCE"),
                "(SECUCODE=\"" + secucode(code) + "\")", "REPORT_DATE", BALANCE_COLUMNS);
    }

    @Override
    public Table dividendHistory(String code) throws Exception {
        return report(DATACENTER_URL, reportName("dividend", "RPT_SHAREBONUS_DET"),
                "(SECURITY_CODE=\"" + code + "\")", "REPORT_DATE", DIVIDEND_COLUMNS);
    }

    @Override
    public Table quote(String code) throws Exception {
        String url = QUOTE_URL + "?secid=" + secid(code) + "&fltt=2&invt=2&fields=f43,f57,f58";
        JSONObject root = new JSONObject(http.getText(url, timeoutSec));
        JSONObject data = root.optJSONObject("data");
        if (data == null) {
            return Table.empty();
        }
        Map<String, Object> row = new LinkedHashMap<>();
        row.put(Fields.CODE, code);
        Object price = data.opt("f43");
        if (price instanceof Number) {
            row.put(Fields.LATEST_PRICE, price);
        }
        return Table.of(List.of(row));
    }

    @Override
    public Table controllerInfo() throws Exception {
        return report(DATACENTER_URL, reportName("controller", "RPT_F10_CONTROLLER_HOLDER"),
                "", "SECURITY_CODE", CONTROLLER_COLUMNS);
    }

    @Override
    public Table pledgeRatios() throws Exception {
        return report(DATACENTER_URL, reportName("pledge", "RPT_CSDC_LIST"),
                "", "PLEDGE_RATIO", PLEDGE_COLUMNS);
    }

    @Override
    public Table buybacks() throws Exception {
        return report(DATACENTER_URL, reportName("buyback", "RPTA_WEB_GETHGLIST"),
                "", "UPD", BUYBACK_COLUMNS);
    }

    @Override
    public Table additionalIssuances() throws Exception {
        return report(DATACENTER_URL, reportName("issuance", "RPT_SEO_DETAIL"),
                "", "ISSUE_DATE", ISSUANCE_COLUMNS);
    }

    @Override
    public Table convertibleBonds() throws Exception {
        return report(DATACENTER_URL, reportName("convertible_bond", "RPT_BOND_CB_LIST"),
                "", "PUBLIC_START_DATE", CONVERTIBLE_COLUMNS);
    }

    private String reportName(String dataset, String fallback) {
        return config.getString("eastmoney.report." + dataset, fallback);
    }

    private Table report(String baseUrl, String reportName, String filter, String sortColumn, List<Column> columns)
            throws Exception {
        List<Map<String, Object>> rows = new ArrayList<>();
        int maxPages = Math.max(1, config.getInt("eastmoney.max_pages", 200));
        int page = 1;
        int pages = 1;
        while (page <= pages && page <= maxPages) {
            if (page > 1) {
                pageLimiter.acquire();
            }
            StringBuilder url = new StringBuilder(baseUrl)
                    .append("?reportName=").append(reportName)
                    .append("&columns=ALL")
                    .append("&pageNumber=").append(page)
                    .append("&pageSize=").append(pageSize)
                    .append("&sortColumns=").append(sortColumn)
                    .append("&sortTypes=-1&source=WEB&client=WEB");
            if (!filter.isEmpty()) {
                url.append("&filter=").append(URLEncoder.encode(filter, StandardCharsets.UTF_8));
            }
            JSONObject root = new JSONObject(http.getText(url.toString(), timeoutSec));
            JSONObject result = root.optJSONObject("result");
            if (result == null) {
                if (root.optInt("code", 0) == NO_DATA_CODE) {
                    break;
                }
                throw new IllegalStateException(reportName + ": " + root.optString("message", "no result"));
            }
            pages = Math.max(1, result.optInt("pages", 1));
            JSONArray data = result.optJSONArray("data");
            if (data == null) {
                break;
            }
            rows.addAll(mapItems(data, columns));
            page++;
        }
        return Table.of(rows);
    }

    static List<Map<String, Object>> mapItems(JSONArray data, List<Column> columns) {
        List<Map<String, Object>> out = new ArrayList<>(data.length());
        for (int i = 0; i < data.length(); i++) {
            JSONObject item = data.optJSONObject(i);
            if (item == null) {
                continue;
            }
            Map<String, Object> row = new LinkedHashMap<>();
            for (Column column : columns) {
                Object raw = item.opt(column.raw);
                if (raw == null || raw == JSONObject.NULL) {
                    continue;
                }
                Object value = column.transform.apply(raw);
                if (value != null) {
                    row.put(column.canonical, value);
                }
            }
            if (!row.isEmpty()) {
                out.add(row);
            }
        }
        return out;
    }

    static String secid(String code) {
        return (code.startsWith("6") ? "1." : "0.") + code;
    }

    static String secucode(String code) {
        String suffix = code.startsWith("6") ? ".SH" : (code.startsWith("8") || code.startsWith("4") ? ".BJ" : ".SZ");
        return code + suffix;
    }

    private static Object code(Object raw) {
        String normalized = Stock.normalizeCode(String.valueOf(raw));
        return normalized.isEmpty() ? null : normalized;
    }

    private static Object isoDate(Object raw) {
        String text = String.valueOf(raw).trim();
        return text.length() >= 10 ? text.substring(0, 10) : text;
    }

    private static Object perTenToPerShare(Object raw) {
        if (raw instanceof Number number) {
            return number.doubleValue() / 10.0;
        }
        try {
            return Double.parseDouble(String.valueOf(raw).trim()) / 10.0;
        } catch (NumberFormatException e) {
            return null;
        }
    }

    static final class Column {
        final String raw;
        final String canonical;
        final Function<Object, Object> transform;

        Column(String raw, String canonical, Function<Object, Object> transform) {
            this.raw = raw;
            this.canonical = canonical;
            this.transform = transform;
        }
    }
}
