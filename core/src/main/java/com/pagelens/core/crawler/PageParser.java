package com.pagelens.core.crawler;

import com.pagelens.core.model.CrawlContext;
import com.pagelens.core.model.PageLink;

import java.util.List;

/** 마크업에서 가시 텍스트 줄과 절대 URL 링크를 뽑는 전략 인터페이스. 예외를 던지지 않는다. */
public interface PageParser {

    /** 파싱 결과: 텍스트 줄 + 링크, 둘 다 문서 순서 */
    record ParsedPage(List<String> text, List<PageLink> links) {
        public ParsedPage {
            text = (text == null) ? List.of() : List.copyOf(text);
            links = (links == null) ? List.of() : List.copyOf(links);
        }
        public static ParsedPage empty() { return new ParsedPage(List.of(), List.of()); }
    }

    ParsedPage parse(String baseUrl, String markup, CrawlContext ctx);
}
