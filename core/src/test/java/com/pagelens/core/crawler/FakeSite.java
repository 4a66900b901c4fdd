package com.pagelens.core.crawler;

import com.pagelens.core.api.IPageFetcher;
import com.pagelens.core.model.CrawlContext;

import java.time.Duration;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/** URL → HTML 맵 기반 가짜 사이트. 없는 URL은 실패(404 취급), 요청 순서를 기록한다. */
final class FakeSite implements IPageFetcher {
    private final Map<String, String> pages = new HashMap<>();
    final List<String> requested = new ArrayList<>();

    FakeSite page(String url, String html) {
        pages.put(url, html);
        return this;
    }

    /** href 목록으로 간단한 페이지 생성 */
    FakeSite linking(String url, String... hrefs) {
        StringBuilder sb = new StringBuilder("<html><body><h1>").append(url).append("</h1>");
        for (String h : hrefs) sb.append("<a href=\"").append(h).append("\">go</a>");
        return page(url, sb.append("</body></html>").toString());
    }

    @Override
    public Optional<String> fetch(String url, Duration timeout, CrawlContext ctx) {
        requested.add(url);
        return Optional.ofNullable(pages.get(url));
    }
}
