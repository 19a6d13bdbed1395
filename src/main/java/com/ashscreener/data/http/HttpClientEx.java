package com.ashscreener.data.http;

import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 模块说明：HttpClientEx（class）。
 * 主要职责：封装 JDK HttpClient 的 GET 调用，非 2xx 状态码统一转为异常，交由上层重试。
 */
public class HttpClientEx {
    private final HttpClient client;
    private final String referer;

    public HttpClientEx(String referer) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.referer = referer == null ? "" : referer;
    }

    public String getText(String url, int timeoutSeconds) throws Exception {
        HttpRequest.Builder builder = HttpRequest.newBuilder()
                .uri(URI.create(url))
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .GET()
                .header("User-Agent", "Mozilla/5.0 (ashscreener/1.0)");
        if (!referer.isEmpty()) {
            builder.header("Referer", referer);
        }
        HttpResponse<String> resp = client.send(builder.build(), HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) return resp.body();
        throw new RuntimeException("HTTP " + resp.statusCode() + " for " + url);
    }
}
