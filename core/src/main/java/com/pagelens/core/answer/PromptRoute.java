package com.pagelens.core.answer;

import com.pagelens.core.model.Page;

import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * (predicate, handler) 한 쌍. predicate는 소문자+trim된 프롬프트를 받는다.
 * 새 휴리스틱은 새 라우트로 추가한다.
 */
public record PromptRoute(String name, Predicate<String> predicate, Function<List<Page>, String> handler) {

    public PromptRoute {
        Objects.requireNonNull(name, "name");
        Objects.requireNonNull(predicate, "predicate");
        Objects.requireNonNull(handler, "handler");
    }

    /** 키워드 중 하나라도 부분 문자열로 포함하면 매치 */
    public static PromptRoute onKeywords(String name, Function<List<Page>, String> handler, String... keywords) {
        List<String> kws = List.of(keywords).stream().map(k -> k.toLowerCase(Locale.ROOT)).toList();
        return new PromptRoute(name, p -> kws.stream().anyMatch(p::contains), handler);
    }

    public boolean matches(String normalizedPrompt) {
        return predicate.test(normalizedPrompt);
    }

    public String handle(List<Page> pages) {
        return handler.apply(pages);
    }
}
