package com.pagelens.core.util;

import com.pagelens.core.api.ValidationException;
import com.pagelens.core.model.CrawlConfig;
import org.yaml.snakeyaml.LoaderOptions;
import org.yaml.snakeyaml.Yaml;
import org.yaml.snakeyaml.constructor.SafeConstructor;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;
import java.util.Objects;
import java.util.function.Consumer;
import java.util.function.IntConsumer;
import java.util.function.LongConsumer;

/**
 * pagelens.yml을 읽어 CrawlConfig로 변환.
 *
 * 예상 YAML 키:
 * baseUrl: "https://ctseng777.github.io/"
 * timeoutMs: 15000
 * delayMs: 250
 * followRedirects: true
 * siteMap:
 *   maxPages: 10
 * query:
 *   maxPages: 12
 * http:
 *   userAgent: "PageLens/1.0 (+https://github.com/pagelens)"
 *   accept: "text/html,application/xhtml+xml,application/xml;q=0.9,*&#47;*;q=0.8"
 */
public final class YamlConfigLoader {

    private YamlConfigLoader() {}

    public static CrawlConfig loadDefault() throws IOException {
        return load(Path.of("pagelens.yml"));
    }

    public static CrawlConfig load(Path yamlPath) throws IOException {
        Objects.requireNonNull(yamlPath, "yamlPath");
        if (!Files.exists(yamlPath)) {
            throw new IOException("pagelens.yml not found at: " + yamlPath.toAbsolutePath());
        }
        try (InputStream in = Files.newInputStream(yamlPath)) {
            return load(in);
        }
    }

    /** 클래스패스 리소스 등 스트림에서 직접 로드 */
    public static CrawlConfig load(InputStream in) {
        Objects.requireNonNull(in, "in");
        Yaml yaml = new Yaml(new SafeConstructor(new LoaderOptions()));
        Object root = yaml.load(in);

        CrawlConfig cfg = CrawlConfig.defaults();

        if (!(root instanceof Map<?, ?> map)) {
            // 비어있거나 단순 스칼라면 defaults 유지
            cfg.validate();
            return cfg;
        }

        // 1) 평면 키
        setString(map, "baseUrl", cfg::setBaseUrl);
        setLong(map, "timeoutMs", cfg::setTimeoutMs);
        setLong(map, "delayMs", cfg::setDelayMs);
        setBoolean(map, "followRedirects", cfg::setFollowRedirects);

        // 2) siteMap.maxPages / query.maxPages
        Map<?, ?> siteMap = getMap(map, "siteMap");
        if (siteMap != null) setInt(siteMap, "maxPages", cfg::setSiteMapMaxPages);

        Map<?, ?> query = getMap(map, "query");
        if (query != null) setInt(query, "maxPages", cfg::setQueryMaxPages);

        // 3) http.*
        Map<?, ?> http = getMap(map, "http");
        if (http != null) {
            setString(http, "userAgent", cfg::setUserAgent);
            setString(http, "accept", cfg::setAccept);
        }

        // 기본값/필수값 확인
        cfg.validate();
        return cfg;
    }

    // ------------ helpers ------------
    private static Map<?, ?> getMap(Map<?, ?> map, String key) {
        Object v = map.get(key);
        return (v instanceof Map<?, ?> m) ? m : null;
    }

    private static void setString(Map<?, ?> map, String key, Consumer<String> setter) {
        Object v = map.get(key);
        if (v != null) setter.accept(String.valueOf(v));
    }

    private static void setBoolean(Map<?, ?> map, String key, Consumer<Boolean> setter) {
        Object v = map.get(key);
        if (v instanceof Boolean b) setter.accept(b);
        else if (v != null) setter.accept(Boolean.parseBoolean(String.valueOf(v)));
    }

    private static void setInt(Map<?, ?> map, String key, IntConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.intValue());
        else if (v != null) setter.accept(parseInt(key, String.valueOf(v)));
    }

    private static void setLong(Map<?, ?> map, String key, LongConsumer setter) {
        Object v = map.get(key);
        if (v instanceof Number n) setter.accept(n.longValue());
        else if (v != null) setter.accept(parseInt(key, String.valueOf(v)));
    }

    private static int parseInt(String key, String raw) {
        try {
            return Integer.parseInt(raw.trim());
        } catch (NumberFormatException e) {
            throw new ValidationException(key + " must be a number (was '" + raw + "')");
        }
    }
}
