package com.pagelens.core.http;

import com.pagelens.core.api.IPageFetcher;
import com.pagelens.core.model.CrawlConfig;
import com.pagelens.core.model.CrawlContext;
import com.pagelens.core.util.StructuredLog;

import java.io.IOException;
import java.net.URI;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.time.Duration;
import java.util.Locale;
import java.util.Objects;
import java.util.Optional;

/**
 * 단일 시도 GET + Content-Type 게이트.
 * 재시도/백오프 없음: 호출 1회 = 요청 1회.
 */
public class HttpPageFetcher implements IPageFetcher {

    private static final StructuredLog SLOG = StructuredLog.get(HttpPageFetcher.class);

    /** 테스트/모킹용 송신 훅 */
    @FunctionalInterface
    public interface HttpSender {
        HttpResponse<String> send(HttpRequest req) throws IOException, InterruptedException;
    }

    private final CrawlConfig config;
    private final HttpSender sender;

    public HttpPageFetcher(CrawlConfig config) {
        this(config, defaultSender(config));
    }

    /** 테스트용 생성자(송신 훅 주입) */
    public HttpPageFetcher(CrawlConfig config, HttpSender sender) {
        this.config = Objects.requireNonNull(config, "config");
        this.sender = Objects.requireNonNull(sender, "sender");
    }

    private static HttpSender defaultSender(CrawlConfig config) {
        HttpClient client = HttpClient.newBuilder()
                .followRedirects(config.isFollowRedirects() ? HttpClient.Redirect.NORMAL : HttpClient.Redirect.NEVER)
                .connectTimeout(config.getTimeout())
                .build();
        return req -> client.send(req, HttpResponse.BodyHandlers.ofString());
    }

    /** 실패 사유는 로그로 남기고 empty 반환 */
    @Override
    public Optional<String> fetch(String url, Duration timeout, CrawlContext ctx) {
        StructuredLog log = (ctx != null) ? ctx.log() : SLOG;
        try {
            log.info("fetch", "url", url);
            return Optional.of(fetchOrThrow(url, timeout));
        } catch (FetchException e) {
            switch (e.getReason()) {
                case HTTP_STATUS:
                    log.warn("fetch-non-200", "url", url, "status", e.getStatusCode());
                    break;
                case CONTENT_TYPE:
                    log.info("fetch-non-html", "url", url, "detail", e.getMessage());
                    break;
                default:
                    log.error("fetch-failed", e, "url", url);
            }
            return Optional.empty();
        }
    }

    /** 타입이 붙은 실패를 그대로 던지는 버전 */
    public String fetchOrThrow(String url, Duration timeout) throws FetchException {
        HttpRequest req = buildRequest(url, timeout);

        HttpResponse<String> resp;
        try {
            resp = sender.send(req);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new FetchException(FetchException.Reason.NETWORK, "interrupted: " + url, e);
        } catch (IOException | RuntimeException e) {
            throw new FetchException(FetchException.Reason.NETWORK, "transport error for " + url + ": " + e, e);
        }

        int status = resp.statusCode();
        if (status != 200) {
            throw new FetchException(FetchException.Reason.HTTP_STATUS, status, "status " + status + " for " + url);
        }

        String contentType = resp.headers().firstValue("Content-Type").orElse("").toLowerCase(Locale.ROOT);
        if (!isHtml(contentType) && !url.endsWith(".html")) {
            throw new FetchException(FetchException.Reason.CONTENT_TYPE, status,
                    "content-type '" + contentType + "' for " + url);
        }
        return resp.body() == null ? "" : resp.body();
    }

    static boolean isHtml(String contentTypeLower) {
        return contentTypeLower.contains("text/html") || contentTypeLower.contains("application/xhtml");
    }

    private HttpRequest buildRequest(String url, Duration timeout) throws FetchException {
        Duration t = (timeout == null || timeout.isZero() || timeout.isNegative()) ? config.getTimeout() : timeout;
        try {
            // 공백만 인코딩: 그 외는 링크 그대로 요청
            URI uri = URI.create(url.trim().replace(" ", "%20"));
            return HttpRequest.newBuilder(uri)
                    .timeout(t)
                    .header("User-Agent", config.getUserAgent())
                    .header("Accept", config.getAccept())
                    .GET()
                    .build();
        } catch (IllegalArgumentException e) {
            throw new FetchException(FetchException.Reason.NETWORK, "malformed url: " + url, e);
        }
    }
}
