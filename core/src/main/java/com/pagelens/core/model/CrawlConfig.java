package com.pagelens.core.model;

import com.pagelens.core.api.ValidationException;

import java.time.Duration;

/**
 * 크롤/질의 설정 (pagelens.yml 매핑 대상). 순수 설정 보관용.
 * 페이지 상한은 항상 [MIN_PAGES, MAX_PAGES] 범위.
 */
public final class CrawlConfig {

    public static final int MIN_PAGES = 1;
    public static final int MAX_PAGES = 50;

    public static final String DEFAULT_BASE_URL = "https://ctseng777.github.io/";
    public static final String DEFAULT_USER_AGENT = "PageLens/1.0 (+https://github.com/pagelens)";
    public static final String DEFAULT_ACCEPT =
            "text/html,application/xhtml+xml,application/xml;q=0.9,*/*;q=0.8";

    // ---------- 기본 필드 ----------
    private String baseUrl = DEFAULT_BASE_URL;   // 사이트맵/질의 대상 시드
    private int siteMapMaxPages = 10;
    private int queryMaxPages = 12;
    private Duration delay = Duration.ofMillis(250);   // 성공 fetch 후 대기
    private Duration timeout = Duration.ofSeconds(15); // 요청당 타임아웃
    private boolean followRedirects = true;

    // ---------- HTTP 헤더 ----------
    private String userAgent = DEFAULT_USER_AGENT;
    private String accept = DEFAULT_ACCEPT;

    // ---------- getters ----------
    public String getBaseUrl() { return baseUrl; }
    public int getSiteMapMaxPages() { return siteMapMaxPages; }
    public int getQueryMaxPages() { return queryMaxPages; }
    public Duration getDelay() { return delay; }
    public Duration getTimeout() { return timeout; }
    public boolean isFollowRedirects() { return followRedirects; }
    public String getUserAgent() { return userAgent; }
    public String getAccept() { return accept; }

    // ---------- fluent setters ----------
    public CrawlConfig setBaseUrl(String baseUrl) { this.baseUrl = baseUrl; return this; }
    public CrawlConfig setSiteMapMaxPages(int v) { this.siteMapMaxPages = v; return this; }
    public CrawlConfig setQueryMaxPages(int v) { this.queryMaxPages = v; return this; }
    public CrawlConfig setDelay(Duration delay) { this.delay = delay; return this; }
    public CrawlConfig setTimeout(Duration timeout) { this.timeout = timeout; return this; }
    public CrawlConfig setFollowRedirects(boolean v) { this.followRedirects = v; return this; }
    public CrawlConfig setUserAgent(String userAgent) { this.userAgent = userAgent; return this; }
    public CrawlConfig setAccept(String accept) { this.accept = accept; return this; }

    /** 밀리초 단위 세터(YAML 호환). 음수는 0으로 */
    public CrawlConfig setDelayMs(long ms) {
        this.delay = Duration.ofMillis(Math.max(0, ms));
        return this;
    }

    /** 밀리초 단위 세터(YAML 호환). 최소 1ms */
    public CrawlConfig setTimeoutMs(long ms) {
        this.timeout = Duration.ofMillis(Math.max(1, ms));
        return this;
    }

    // ---------- validate ----------
    public void validate() {
        if (baseUrl == null || baseUrl.isBlank()) throw new ValidationException("baseUrl must not be blank");
        requirePageRange("siteMapMaxPages", siteMapMaxPages);
        requirePageRange("queryMaxPages", queryMaxPages);
        if (delay == null || delay.isNegative())
            throw new ValidationException("delay must be >= 0");
        if (timeout == null || timeout.isNegative() || timeout.isZero())
            throw new ValidationException("timeout must be > 0");
        if (userAgent == null || userAgent.isBlank()) throw new ValidationException("userAgent must not be blank");
        if (accept == null || accept.isBlank()) throw new ValidationException("accept must not be blank");
    }

    // ---------- helpers ----------
    public static CrawlConfig defaults() { return new CrawlConfig(); }

    /** 호출자 측 검증: 범위 밖이면 ValidationException */
    public static void requirePageRange(String name, int pages) {
        if (pages < MIN_PAGES || pages > MAX_PAGES) {
            throw new ValidationException(name + " must be between " + MIN_PAGES + " and " + MAX_PAGES + " (was " + pages + ")");
        }
    }

    /** 코어 측 방어: 범위 밖 값을 조용히 보정 */
    public static int clampPages(int pages) {
        return Math.max(MIN_PAGES, Math.min(pages, MAX_PAGES));
    }
}
