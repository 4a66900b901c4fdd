// ICrawler.java
package com.pagelens.core.api;

import com.pagelens.core.model.Page;

import java.time.Duration;
import java.util.List;

/** 크롤러 최소 계약: 시드 URL에서 BFS로 수집한 페이지를 발견 순서대로 돌려준다. */
public interface ICrawler extends AutoCloseable {
    /**
     * @param startUrl 시드 URL (공백 불가)
     * @param maxPages 페이지 상한. [1, 50]으로 보정된다
     * @param delay    성공한 fetch 뒤마다 쉬는 시간
     * @throws ValidationException startUrl이 비어 있을 때
     */
    List<Page> crawl(String startUrl, int maxPages, Duration delay);
    @Override default void close() throws Exception {}
}
