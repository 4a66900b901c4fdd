package com.pagelens.core.answer.routes;

import com.pagelens.core.model.Page;
import com.pagelens.core.model.PageLink;

import java.util.List;
import java.util.Locale;
import java.util.Optional;

/**
 * Google Scholar 링크 찾기.
 * 1차: href에 "scholar.google" 또는 앵커 텍스트에 "google scholar"
 * 2차: 앵커 텍스트에 "scholar"
 * 페이지는 크롤 순서, 링크는 문서 순서로 본다.
 */
public final class ScholarLinkRoute {
    private ScholarLinkRoute() {}

    public static final String NOT_FOUND = "No Google Scholar link found within crawled pages.";

    /** 찾은 링크와 그 링크가 나온 페이지 */
    public record Match(String sourceUrl, String href, String text) {}

    public static String answer(List<Page> pages) {
        return find(pages)
                .map(m -> "Google Scholar link found:\n"
                        + "- Link: " + m.href() + "\n"
                        + "- Anchor Text: " + m.text() + "\n"
                        + "- Found on: " + m.sourceUrl())
                .orElse(NOT_FOUND);
    }

    public static Optional<Match> find(List<Page> pages) {
        for (Page page : pages) {
            for (PageLink link : page.links()) {
                String href = link.href().toLowerCase(Locale.ROOT);
                String text = link.text().toLowerCase(Locale.ROOT);
                if (href.contains("scholar.google") || text.contains("google scholar")) {
                    String shown = link.text().isEmpty() ? "Google Scholar" : link.text();
                    return Optional.of(new Match(page.url(), link.href(), shown));
                }
            }
        }
        // 느슨한 2차 탐색
        for (Page page : pages) {
            for (PageLink link : page.links()) {
                if (link.text().toLowerCase(Locale.ROOT).contains("scholar")) {
                    return Optional.of(new Match(page.url(), link.href(), link.text()));
                }
            }
        }
        return Optional.empty();
    }
}
