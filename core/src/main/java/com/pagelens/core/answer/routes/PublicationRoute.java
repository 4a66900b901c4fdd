package com.pagelens.core.answer.routes;

import com.pagelens.core.model.Page;
import com.pagelens.core.util.TextUtil;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * 인용문처럼 보이는 줄 추출. 페이지 본문을 줄바꿈 단위로 나눠 trim한 비어 있지 않은 줄을 본다.
 * 후보: 연도 토큰(19xx/20xx) + ",.;:" 중 2자 이상.
 * 페이지에 "publication"이 들어간 줄이 있으면 그 페이지의 연도 포함 줄은 모두 후보.
 */
public final class PublicationRoute {
    private PublicationRoute() {}

    public static final String NONE_FOUND = "No publications detected via heuristics.";
    public static final int DEFAULT_LIMIT = 20;

    private static final Pattern YEAR = Pattern.compile("\\b(19|20)\\d{2}\\b");
    private static final Pattern LINE_BREAK = Pattern.compile("\\R");
    private static final String CITATION_PUNCT = ",.;:";

    /** 후보 줄과 출처 페이지 */
    public record Publication(String sourceUrl, String line) {}

    public static String answer(List<Page> pages) {
        return format(extract(pages), DEFAULT_LIMIT);
    }

    public static List<Publication> extract(List<Page> pages) {
        List<Publication> raw = new ArrayList<>();
        for (Page page : pages) {
            List<String> lines = lines(page);
            for (String ln : lines) {
                if (isCandidate(ln)) raw.add(new Publication(page.url(), ln));
            }
            if (lines.stream().anyMatch(ln -> ln.toLowerCase(Locale.ROOT).contains("publication"))) {
                for (String ln : lines) {
                    if (hasYear(ln)) raw.add(new Publication(page.url(), ln));
                }
            }
        }
        // 줄 텍스트 기준 중복 제거(첫 출현 유지)
        Map<String, Publication> dedup = new LinkedHashMap<>();
        for (Publication p : raw) dedup.putIfAbsent(p.line(), p);
        return List.copyOf(dedup.values());
    }

    /** 본문을 줄바꿈 기준으로 다시 나눈다. 텍스트 청크 하나가 여러 줄일 수 있다 */
    static List<String> lines(Page page) {
        List<String> out = new ArrayList<>();
        for (String ln : LINE_BREAK.split(page.joinedText())) {
            String t = TextUtil.trim(ln);
            if (!t.isEmpty()) out.add(t);
        }
        return out;
    }

    public static boolean isCandidate(String line) {
        return hasYear(line) && punctuationCount(line) >= 2;
    }

    static boolean hasYear(String line) {
        return YEAR.matcher(line).find();
    }

    static int punctuationCount(String line) {
        int n = 0;
        for (int i = 0; i < line.length(); i++) {
            if (CITATION_PUNCT.indexOf(line.charAt(i)) >= 0) n++;
        }
        return n;
    }

    public static String format(List<Publication> items, int limit) {
        if (items.isEmpty()) return NONE_FOUND;
        StringBuilder sb = new StringBuilder("Publications (heuristic extraction):");
        int shown = Math.min(limit, items.size());
        for (int i = 0; i < shown; i++) {
            Publication p = items.get(i);
            sb.append('\n').append(i + 1).append(". ").append(p.line())
              .append("\n   Source: ").append(p.sourceUrl());
        }
        if (items.size() > limit) {
            sb.append("\n(+").append(items.size() - limit).append(" more omitted)");
        }
        return sb.toString();
    }
}
