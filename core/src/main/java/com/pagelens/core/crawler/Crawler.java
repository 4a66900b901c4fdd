package com.pagelens.core.crawler;

import com.pagelens.core.api.ICrawler;
import com.pagelens.core.api.IPageFetcher;
import com.pagelens.core.api.ValidationException;
import com.pagelens.core.http.HttpPageFetcher;
import com.pagelens.core.model.CrawlConfig;
import com.pagelens.core.model.CrawlContext;
import com.pagelens.core.model.Page;
import com.pagelens.core.model.PageLink;
import com.pagelens.core.util.DefaultSleeper;
import com.pagelens.core.util.Sleeper;
import com.pagelens.core.util.StructuredLog;
import com.pagelens.core.util.UrlUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.Duration;
import java.util.*;

/**
 * BFS 기반 Crawler
 * - 시드와 같은 네트워크 위치(authority)의 링크만 큐에 넣는다. 외부 링크는 Page.links에만 남는다
 * - 방문 판정은 URL 문자열 완전 일치(정규화 없음)
 * - fetch 실패 URL은 페이지도 하위 링크도 만들지 않는다
 * - 순차 실행: 성공한 fetch 뒤마다 delay 만큼 쉰다
 */
public class Crawler implements ICrawler {

    private static final Logger LOG = LoggerFactory.getLogger(Crawler.class);
    private static final StructuredLog SLOG = StructuredLog.get(Crawler.class);

    private final CrawlConfig config;
    private final IPageFetcher fetcher;
    private final PageParser parser;
    private final Sleeper sleeper;

    public Crawler(CrawlConfig config) {
        this(config, new HttpPageFetcher(config), new JsoupPageParser(), new DefaultSleeper());
    }

    public Crawler(CrawlConfig config, IPageFetcher fetcher, PageParser parser, Sleeper sleeper) {
        this.config = Objects.requireNonNull(config, "config");
        this.fetcher = Objects.requireNonNull(fetcher, "fetcher");
        this.parser = Objects.requireNonNull(parser, "parser");
        this.sleeper = Objects.requireNonNull(sleeper, "sleeper");
    }

    @Override
    public List<Page> crawl(String startUrl, int maxPages, Duration delay) {
        if (startUrl == null || startUrl.isBlank()) {
            throw new ValidationException("startUrl must not be blank");
        }
        final int cap = CrawlConfig.clampPages(maxPages);
        final Duration pause = (delay == null || delay.isNegative()) ? Duration.ZERO : delay;

        CrawlContext ctx = CrawlContext.start(startUrl, cap, SLOG);
        LOG.info("Crawl start: seed={}, maxPages={}, delayMs={}, crawlId={}",
                startUrl, cap, pause.toMillis(), ctx.crawlId());
        ctx.log().info("crawl-start", "seed", startUrl, "maxPages", cap, "host", ctx.seedLocation());

        Set<String> visited = new HashSet<>();
        Deque<String> frontier = new ArrayDeque<>();
        List<Page> pages = new ArrayList<>();
        frontier.addLast(startUrl);

        while (!frontier.isEmpty() && pages.size() < cap) {
            if (Thread.currentThread().isInterrupted()) {
                ctx.log().warn("crawl-interrupted", "pages", pages.size());
                break;
            }
            String url = frontier.pollFirst();
            if (!visited.add(url)) {
                ctx.recordDuplicate();
                continue;
            }

            Optional<Page> page = visit(url, ctx);
            if (page.isEmpty()) continue;

            Page p = page.get();
            pages.add(p);
            enqueueSameHost(p, ctx, visited, frontier);

            try {
                sleeper.sleep(pause);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
                ctx.log().warn("crawl-interrupted", "pages", pages.size());
                break;
            }
        }

        CrawlContext.Stats s = ctx.stats();
        ctx.log().info("crawl-complete", "pages", pages.size(), "fetched", s.fetched(),
                "failed", s.failed(), "duplicates", s.duplicates(), "offHostLinks", s.offHostLinks());
        LOG.info("Crawl complete: {} pages from {} (failed={}, crawlId={})",
                pages.size(), startUrl, s.failed(), ctx.crawlId());
        return List.copyOf(pages);
    }

    /** fetch + parse. 실패/예외는 여기서 흡수해 empty로 바꾼다 */
    private Optional<Page> visit(String url, CrawlContext ctx) {
        try {
            Optional<String> markup = fetcher.fetch(url, config.getTimeout(), ctx);
            if (markup.isEmpty() || markup.get().isEmpty()) {
                ctx.recordFailed();
                return Optional.empty();
            }
            ctx.recordFetched();
            PageParser.ParsedPage parsed = parser.parse(url, markup.get(), ctx);
            return Optional.of(new Page(url, parsed.text(), parsed.links()));
        } catch (RuntimeException e) {
            ctx.recordFailed();
            ctx.log().error("visit-failed", e, "url", url);
            return Optional.empty();
        }
    }

    private static void enqueueSameHost(Page page, CrawlContext ctx, Set<String> visited, Deque<String> frontier) {
        for (PageLink link : page.links()) {
            String href = link.href();
            if (!UrlUtils.sameNetworkLocation(ctx.seedLocation(), href)) {
                ctx.recordOffHost();
                continue;
            }
            // 큐 중복은 허용: 꺼낼 때 visited로 걸러진다
            if (!visited.contains(href)) {
                frontier.addLast(href);
            }
        }
    }
}
