package com.pagelens.core.model;

import java.util.List;
import java.util.Objects;

/**
 * 크롤 결과 한 페이지. 생성 후 변경되지 않는다.
 *
 * @param url   요청한 URL 문자열 그대로(정규화 없음)
 * @param text  공백을 걷어낸 비어 있지 않은 텍스트 줄, 문서 순서
 * @param links 절대 URL로 해석된 앵커, 문서 순서
 */
public record Page(String url, List<String> text, List<PageLink> links) {
    public Page {
        Objects.requireNonNull(url, "url");
        text = (text == null) ? List.of() : List.copyOf(text);
        links = (links == null) ? List.of() : List.copyOf(links);
    }

    /** 줄 단위 텍스트를 개행으로 이어 붙인 본문 */
    public String joinedText() {
        return String.join("\n", text);
    }
}
