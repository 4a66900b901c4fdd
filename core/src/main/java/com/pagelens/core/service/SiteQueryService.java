package com.pagelens.core.service;

import com.pagelens.core.answer.HeuristicAnswerEngine;
import com.pagelens.core.api.IAnswerEngine;
import com.pagelens.core.api.ICrawler;
import com.pagelens.core.api.ValidationException;
import com.pagelens.core.crawler.Crawler;
import com.pagelens.core.model.CrawlConfig;
import com.pagelens.core.model.Page;
import com.pagelens.core.model.SiteMap;
import com.pagelens.core.util.TextUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.List;
import java.util.Objects;

/**
 * 질의 오케스트레이터:
 *  - 입력 검증 → crawl → answer / 사이트맵 변환
 *  - 전송 어댑터(HTTP/툴 호출)가 호출하는 진입점. 검증 실패는 네트워크 I/O 전에 던진다
 *  - 상태 없음: 호출마다 새 크롤
 */
public final class SiteQueryService {

    private static final Logger LOG = LoggerFactory.getLogger(SiteQueryService.class);

    private final CrawlConfig config;
    private final ICrawler crawler;
    private final IAnswerEngine engine;

    /** 기본 구현 */
    public SiteQueryService(CrawlConfig config) {
        this(config, new Crawler(config), new HeuristicAnswerEngine());
    }

    /** DI/테스트용 */
    public SiteQueryService(CrawlConfig config, ICrawler crawler, IAnswerEngine engine) {
        this.config = Objects.requireNonNull(config, "config");
        this.config.validate();
        this.crawler = Objects.requireNonNull(crawler, "crawler");
        this.engine = Objects.requireNonNull(engine, "engine");
    }

    public SiteMap siteMap() {
        return siteMap(config.getSiteMapMaxPages());
    }

    /** 설정된 baseUrl을 크롤해 페이지별 링크 목록을 만든다 */
    public SiteMap siteMap(int maxPages) {
        CrawlConfig.requirePageRange("maxPages", maxPages);
        List<Page> pages = crawler.crawl(config.getBaseUrl(), maxPages, config.getDelay());
        LOG.info("Site map built: base={}, pages={}", config.getBaseUrl(), pages.size());
        return SiteMap.of(config.getBaseUrl(), pages);
    }

    public String query(String prompt) {
        return query(prompt, config.getQueryMaxPages());
    }

    /** 크롤 후 프롬프트에 답한다 */
    public String query(String prompt, int maxPages) {
        String p = TextUtil.trim(prompt);
        if (p.isEmpty()) throw new ValidationException("prompt must not be empty");
        CrawlConfig.requirePageRange("maxPages", maxPages);

        List<Page> pages = crawler.crawl(config.getBaseUrl(), maxPages, config.getDelay());
        LOG.info("Answering prompt over {} pages from {}", pages.size(), config.getBaseUrl());
        return engine.answer(pages, p);
    }

    public CrawlConfig config() { return config; }
}
