package com.pagelens.core.answer.routes;

import com.pagelens.core.model.Page;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.*;

class PageSummaryRouteTest {

    @Test
    void header_only_for_empty_corpus() {
        assertEquals(PageSummaryRoute.HEADER, PageSummaryRoute.summarize(List.of()));
    }

    @Test
    void collapses_whitespace_and_appends_ellipsis() {
        Page p = new Page("https://h/", List.of("Hello   there", "second\tline"), List.of());

        assertEquals("Query not recognized; returning crawled page summaries:\n"
                + "- https://h/: Hello there second line...", PageSummaryRoute.summarize(List.of(p)));
    }

    @Test
    void snippet_is_cut_at_200_characters() {
        Page p = new Page("https://h/", List.of("x".repeat(500)), List.of());
        assertEquals(200, PageSummaryRoute.snippet(p).length());
    }

    @Test
    void only_first_eight_pages() {
        List<Page> pages = new ArrayList<>();
        for (int i = 0; i < 10; i++) pages.add(new Page("https://h/" + i, List.of("p" + i), List.of()));

        String out = PageSummaryRoute.summarize(pages);

        assertThat(out.split("\n")).hasSize(1 + 8);
        assertThat(out).contains("- https://h/7: p7...").doesNotContain("https://h/8");
    }
}
