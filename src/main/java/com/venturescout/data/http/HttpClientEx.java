package com.venturescout.data.http;

import com.venturescout.ratelimit.SlidingWindowRateLimiter;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;

/**
 * 模块说明：HttpClientEx（class）。
 * 主要职责：封装对外 HTTP 调用；每次请求前按目标主机向限流器申请配额。
 * 使用建议：所有外部服务调用都应经过此类，保证同一来源的请求速率受控。
 */
public class HttpClientEx {
    private static final String USER_AGENT = "VentureScout/1.0";

    private final HttpClient client;
    private final SlidingWindowRateLimiter rateLimiter;

    public HttpClientEx(SlidingWindowRateLimiter rateLimiter) {
        this.client = HttpClient.newBuilder()
                .connectTimeout(Duration.ofSeconds(20))
                .followRedirects(HttpClient.Redirect.NORMAL)
                .build();
        this.rateLimiter = rateLimiter;
    }

    public String postJson(String url, String json, int timeoutSeconds) throws IOException, InterruptedException {
        URI uri = URI.create(url);
        HttpRequest req = HttpRequest.newBuilder()
                .uri(uri)
                .timeout(Duration.ofSeconds(timeoutSeconds))
                .POST(HttpRequest.BodyPublishers.ofString(json == null ? "" : json))
                .header("Content-Type", "application/json")
                .header("User-Agent", USER_AGENT)
                .build();
        return send(uri, req, url);
    }

    /**
     * Rate-limit bucket for a URL: its host, or "default" when the URL has none.
     */
    public static String sourceOf(URI uri) {
        String host = uri == null ? null : uri.getHost();
        return host == null || host.isBlank() ? "default" : host;
    }

    private String send(URI uri, HttpRequest req, String url) throws IOException, InterruptedException {
        if (rateLimiter != null) {
            rateLimiter.acquire(sourceOf(uri));
        }
        HttpResponse<String> resp = client.send(req, HttpResponse.BodyHandlers.ofString());
        if (resp.statusCode() >= 200 && resp.statusCode() < 300) {
            return resp.body();
        }
        throw new IOException("HTTP " + resp.statusCode() + " for " + url);
    }
}
