// IPageFetcher.java
package com.pagelens.core.api;

import com.pagelens.core.model.CrawlContext;

import java.time.Duration;
import java.util.Optional;

/** 페처 최소 계약: URL 하나를 한 번만 요청해 HTML 본문을 돌려준다. 실패 사유는 로그로만 남긴다. */
@FunctionalInterface
public interface IPageFetcher {
    Optional<String> fetch(String url, Duration timeout, CrawlContext ctx);
}
