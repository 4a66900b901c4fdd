package com.pagelens.core.answer;

import com.pagelens.core.answer.routes.PageSummaryRoute;
import com.pagelens.core.answer.routes.PublicationRoute;
import com.pagelens.core.answer.routes.ScholarLinkRoute;
import com.pagelens.core.api.IAnswerEngine;
import com.pagelens.core.model.Page;
import com.pagelens.core.util.TextUtil;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;

/**
 * 규칙 기반 응답 엔진: 라우트를 순서대로 평가해 처음 매치된 핸들러의 결과를 돌려준다.
 * 아무 것도 매치되지 않으면 페이지 요약(fallback).
 * 순수 함수: I/O 없음, 예외 없음.
 */
public final class HeuristicAnswerEngine implements IAnswerEngine {

    private final List<PromptRoute> routes;
    private final Function<List<Page>, String> fallback;

    public HeuristicAnswerEngine() {
        this(defaultRoutes(), PageSummaryRoute::summarize);
    }

    public HeuristicAnswerEngine(List<PromptRoute> routes, Function<List<Page>, String> fallback) {
        this.routes = List.copyOf(Objects.requireNonNull(routes, "routes"));
        this.fallback = Objects.requireNonNull(fallback, "fallback");
    }

    /** scholar → publication/paper/article 순 */
    public static List<PromptRoute> defaultRoutes() {
        return List.of(
                PromptRoute.onKeywords("scholar", ScholarLinkRoute::answer, "scholar"),
                PromptRoute.onKeywords("publications", PublicationRoute::answer, "publication", "paper", "article")
        );
    }

    @Override
    public String answer(List<Page> pages, String prompt) {
        List<Page> corpus = (pages == null) ? List.of() : pages;
        String p = TextUtil.trim(prompt).toLowerCase(Locale.ROOT);
        for (PromptRoute r : routes) {
            if (r.matches(p)) return r.handle(corpus);
        }
        return fallback.apply(corpus);
    }

    public List<PromptRoute> routes() { return routes; }
}
