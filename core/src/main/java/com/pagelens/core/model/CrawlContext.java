package com.pagelens.core.model;

import com.pagelens.core.util.StructuredLog;
import com.pagelens.core.util.UrlUtils;

import java.util.Objects;
import java.util.UUID;

/**
 * 크롤 1회 범위의 컨텍스트: crawlId가 바인딩된 로거 + 카운터.
 * 크롤마다 새로 만들고 반환 시 버린다. 단일 스레드 전용.
 */
public final class CrawlContext {

    private final String crawlId;
    private final String seedUrl;
    private final String seedLocation;
    private final int maxPages;
    private final StructuredLog log;

    private int fetched;
    private int failed;
    private int duplicates;
    private int offHost;

    private CrawlContext(String crawlId, String seedUrl, int maxPages, StructuredLog base) {
        this.crawlId = crawlId;
        this.seedUrl = seedUrl;
        this.seedLocation = UrlUtils.networkLocation(seedUrl);
        this.maxPages = maxPages;
        this.log = base.bind("crawlId", crawlId);
    }

    public static CrawlContext start(String seedUrl, int maxPages, StructuredLog base) {
        Objects.requireNonNull(seedUrl, "seedUrl");
        Objects.requireNonNull(base, "base");
        String id = UUID.randomUUID().toString().substring(0, 8);
        return new CrawlContext(id, seedUrl, maxPages, base);
    }

    public String crawlId() { return crawlId; }
    public String seedUrl() { return seedUrl; }
    /** 시드의 authority(host[:port]). 트래버설 필터 기준 */
    public String seedLocation() { return seedLocation; }
    public int maxPages() { return maxPages; }
    public StructuredLog log() { return log; }

    // ---------- counters ----------
    public void recordFetched()   { fetched++; }
    public void recordFailed()    { failed++; }
    public void recordDuplicate() { duplicates++; }
    public void recordOffHost()   { offHost++; }

    public Stats stats() { return new Stats(fetched, failed, duplicates, offHost); }

    /** 불변 스냅샷 */
    public record Stats(int fetched, int failed, int duplicates, int offHostLinks) {}
}
