package com.pagelens.core.crawler;

import com.pagelens.core.api.IPageFetcher;
import com.pagelens.core.model.CrawlConfig;
import com.pagelens.core.model.Page;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import java.time.Duration;
import java.util.List;
import java.util.Optional;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

/** 개별 URL 실패는 그 URL(과 하위 링크)만 건너뛰고 크롤은 계속된다 */
class CrawlerResilienceTest {

    static final String SEED = "https://site.test/";

    @AfterEach
    void clearInterrupt() {
        Thread.interrupted();
    }

    @Test
    void failed_fetch_hides_children() {
        // /broken 은 404 → 그 아래 /hidden 은 발견되지 않는다
        FakeSite site = new FakeSite()
                .linking(SEED, "/broken", "/ok")
                .linking("https://site.test/ok")
                .linking("https://site.test/hidden");

        List<Page> pages = new Crawler(CrawlConfig.defaults(), site, new JsoupPageParser(), new RecordingSleeper())
                .crawl(SEED, 10, Duration.ZERO);

        assertThat(pages).extracting(Page::url).containsExactly(SEED, "https://site.test/ok");
        assertThat(site.requested).doesNotContain("https://site.test/hidden");
    }

    @Test
    void empty_body_counts_as_failure() {
        FakeSite site = new FakeSite().page(SEED, "");
        List<Page> pages = new Crawler(CrawlConfig.defaults(), site, new JsoupPageParser(), new RecordingSleeper())
                .crawl(SEED, 5, Duration.ZERO);
        assertTrue(pages.isEmpty());
    }

    @Test
    void fetcher_runtime_exception_is_skipped() {
        FakeSite site = new FakeSite()
                .linking(SEED, "/boom", "/ok")
                .linking("https://site.test/ok");
        IPageFetcher flaky = (url, timeout, ctx) -> {
            if (url.endsWith("/boom")) throw new IllegalStateException("fetcher bug");
            return site.fetch(url, timeout, ctx);
        };

        List<Page> pages = new Crawler(CrawlConfig.defaults(), flaky, new JsoupPageParser(), new RecordingSleeper())
                .crawl(SEED, 10, Duration.ZERO);

        assertThat(pages).extracting(Page::url).containsExactly(SEED, "https://site.test/ok");
    }

    @Test
    void parser_runtime_exception_is_skipped() {
        FakeSite site = new FakeSite()
                .linking(SEED, "/bad", "/ok")
                .page("https://site.test/bad", "<p>bad</p>")
                .linking("https://site.test/ok");
        JsoupPageParser real = new JsoupPageParser();
        PageParser picky = (base, markup, ctx) -> {
            if (base.endsWith("/bad")) throw new IllegalStateException("parser bug");
            return real.parse(base, markup, ctx);
        };

        List<Page> pages = new Crawler(CrawlConfig.defaults(), site, picky, new RecordingSleeper())
                .crawl(SEED, 10, Duration.ZERO);

        assertThat(pages).extracting(Page::url).containsExactly(SEED, "https://site.test/ok");
    }

    @Test
    void interrupt_during_sleep_returns_partial_result() {
        FakeSite site = new FakeSite()
                .linking(SEED, "/a", "/b", "/c")
                .linking("https://site.test/a")
                .linking("https://site.test/b")
                .linking("https://site.test/c");
        RecordingSleeper sleeper = new RecordingSleeper(2);

        List<Page> pages = new Crawler(CrawlConfig.defaults(), site, new JsoupPageParser(), sleeper)
                .crawl(SEED, 10, Duration.ofMillis(100));

        assertThat(pages).extracting(Page::url).containsExactly(SEED, "https://site.test/a");
        assertTrue(Thread.currentThread().isInterrupted(), "interrupt flag must be restored");
    }

    @Test
    void already_interrupted_thread_crawls_nothing() {
        Thread.currentThread().interrupt();
        FakeSite site = new FakeSite().linking(SEED);

        List<Page> pages = new Crawler(CrawlConfig.defaults(), site, new JsoupPageParser(), new RecordingSleeper())
                .crawl(SEED, 10, Duration.ZERO);

        assertTrue(pages.isEmpty());
        assertTrue(site.requested.isEmpty());
    }
}
