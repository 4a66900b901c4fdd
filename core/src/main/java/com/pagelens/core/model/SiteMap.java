package com.pagelens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 외부 노출용 사이트맵 뷰: {base, pages:[{url, links:[{href, text}]}]}.
 * 본문 텍스트는 포함하지 않는다.
 */
public record SiteMap(String base, List<PageEntry> pages) {

    public record PageEntry(String url, List<PageLink> links) {
        public PageEntry {
            Objects.requireNonNull(url, "url");
            links = (links == null) ? List.of() : List.copyOf(links);
        }
    }

    public SiteMap {
        Objects.requireNonNull(base, "base");
        pages = (pages == null) ? List.of() : List.copyOf(pages);
    }

    public static SiteMap of(String base, List<Page> crawled) {
        List<PageEntry> entries = crawled.stream()
                .map(p -> new PageEntry(p.url(), p.links()))
                .toList();
        return new SiteMap(base, entries);
    }
}
