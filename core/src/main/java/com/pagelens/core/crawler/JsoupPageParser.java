package com.pagelens.core.crawler;

import com.pagelens.core.model.CrawlContext;
import com.pagelens.core.model.PageLink;
import com.pagelens.core.util.StructuredLog;
import com.pagelens.core.util.TextUtil;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.nodes.Node;
import org.jsoup.nodes.TextNode;
import org.jsoup.select.NodeTraversor;
import org.jsoup.select.NodeVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * JSoup 기반 파서: 노드 방문(head=시작 태그, tail=종료 태그) 순서로 한 번 훑는다.
 * - script/style 안의 문자 데이터는 버린다
 * - 앵커 안의 텍스트는 따로 모아 종료 시점에 (abs:href, 텍스트) 방출
 * - 공백이 아닌 텍스트 청크는 앵커 안팎 모두 한 줄씩 기록
 */
public class JsoupPageParser implements PageParser {

    private static final StructuredLog SLOG = StructuredLog.get(JsoupPageParser.class);

    @Override
    public ParsedPage parse(String baseUrl, String markup, CrawlContext ctx) {
        if (markup == null || markup.isEmpty()) return ParsedPage.empty();
        try {
            Document doc = Jsoup.parse(markup, baseUrl == null ? "" : baseUrl);
            Collector c = new Collector();
            NodeTraversor.traverse(c, doc);
            return new ParsedPage(c.lines, c.links);
        } catch (RuntimeException e) {
            // 깨진 마크업은 빈 결과로 강등
            StructuredLog log = (ctx != null) ? ctx.log() : SLOG;
            log.warn("parse-degraded", "url", baseUrl, "error", e.toString());
            return ParsedPage.empty();
        }
    }

    private static final class Collector implements NodeVisitor {
        final List<String> lines = new ArrayList<>();
        final List<PageLink> links = new ArrayList<>();

        private int rawTextDepth;                 // script/style 중첩 깊이
        private Element anchor;                   // 현재 열린 앵커(href 있을 때만)
        private final List<String> anchorChunks = new ArrayList<>();

        @Override
        public void head(Node node, int depth) {
            if (node instanceof Element el) {
                String tag = el.normalName();
                if (isRawText(tag)) {
                    rawTextDepth++;
                } else if ("a".equals(tag)) {
                    // 새 앵커가 열리면 이전 앵커 텍스트는 버린다
                    anchor = el.attr("href").isEmpty() ? null : el;
                    anchorChunks.clear();
                }
            } else if (node instanceof TextNode tn) {
                if (rawTextDepth > 0) return;
                String data = tn.getWholeText();
                if (anchor != null) anchorChunks.add(data);
                String line = TextUtil.trim(data);
                if (!line.isEmpty()) lines.add(line);
            }
        }

        @Override
        public void tail(Node node, int depth) {
            if (!(node instanceof Element el)) return;
            String tag = el.normalName();
            if (isRawText(tag)) {
                rawTextDepth = Math.max(0, rawTextDepth - 1);
            } else if ("a".equals(tag) && el == anchor) {
                String abs = el.absUrl("href");
                if (!abs.isEmpty()) links.add(new PageLink(abs, joinChunks(anchorChunks)));
                anchor = null;
                anchorChunks.clear();
            }
        }

        private static boolean isRawText(String tag) {
            return "script".equals(tag) || "style".equals(tag);
        }

        private static String joinChunks(List<String> chunks) {
            StringBuilder sb = new StringBuilder();
            for (String chunk : chunks) {
                String t = TextUtil.trim(chunk);
                if (t.isEmpty()) continue;
                if (sb.length() > 0) sb.append(' ');
                sb.append(t);
            }
            return sb.toString();
        }
    }
}
