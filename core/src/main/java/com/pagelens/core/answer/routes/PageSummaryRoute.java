package com.pagelens.core.answer.routes;

import com.pagelens.core.model.Page;
import com.pagelens.core.util.TextUtil;

import java.util.List;

/** 인식하지 못한 질의: 앞쪽 페이지들의 URL + 본문 앞부분 */
public final class PageSummaryRoute {
    private PageSummaryRoute() {}

    public static final String HEADER = "Query not recognized; returning crawled page summaries:";
    public static final int MAX_PAGES = 8;
    public static final int SNIPPET_CHARS = 200;

    public static String summarize(List<Page> pages) {
        StringBuilder sb = new StringBuilder(HEADER);
        for (Page page : pages.subList(0, Math.min(MAX_PAGES, pages.size()))) {
            sb.append("\n- ").append(page.url()).append(": ").append(snippet(page)).append("...");
        }
        return sb.toString();
    }

    static String snippet(Page page) {
        String collapsed = TextUtil.collapseWhitespace(page.joinedText());
        if (collapsed.codePointCount(0, collapsed.length()) <= SNIPPET_CHARS) return collapsed;
        return collapsed.substring(0, collapsed.offsetByCodePoints(0, SNIPPET_CHARS));
    }
}
