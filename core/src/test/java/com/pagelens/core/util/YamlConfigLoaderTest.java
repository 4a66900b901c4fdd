package com.pagelens.core.util;

import com.pagelens.core.api.ValidationException;
import com.pagelens.core.model.CrawlConfig;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Duration;

import static org.assertj.core.api.Assertions.*;
import static org.junit.jupiter.api.Assertions.assertThrows;

class YamlConfigLoaderTest {

    @TempDir
    Path tmp;

    private Path write(String yaml) throws IOException {
        Path f = tmp.resolve("pagelens.yml");
        Files.writeString(f, yaml, StandardCharsets.UTF_8);
        return f;
    }

    @Test
    void loadsAllKeys() throws Exception {
        Path f = write(String.join("\n",
                "baseUrl: \"https://example.org/\"",
                "timeoutMs: 3000",
                "delayMs: 0",
                "followRedirects: false",
                "siteMap:",
                "  maxPages: 5",
                "query:",
                "  maxPages: \"7\"",
                "http:",
                "  userAgent: \"TestBot/1.0\"",
                "  accept: \"text/html\"",
                ""));

        CrawlConfig cfg = YamlConfigLoader.load(f);

        assertThat(cfg.getBaseUrl()).isEqualTo("https://example.org/");
        assertThat(cfg.getTimeout()).isEqualTo(Duration.ofSeconds(3));
        assertThat(cfg.getDelay()).isEqualTo(Duration.ZERO);
        assertThat(cfg.isFollowRedirects()).isFalse();
        assertThat(cfg.getSiteMapMaxPages()).isEqualTo(5);
        assertThat(cfg.getQueryMaxPages()).isEqualTo(7);
        assertThat(cfg.getUserAgent()).isEqualTo("TestBot/1.0");
        assertThat(cfg.getAccept()).isEqualTo("text/html");
    }

    @Test
    void missingKeysKeepDefaults() throws Exception {
        CrawlConfig cfg = YamlConfigLoader.load(write("delayMs: 100\n"));

        assertThat(cfg.getDelay()).isEqualTo(Duration.ofMillis(100));
        assertThat(cfg.getBaseUrl()).isEqualTo(CrawlConfig.DEFAULT_BASE_URL);
        assertThat(cfg.getQueryMaxPages()).isEqualTo(12);
    }

    @Test
    void emptyFileIsDefaults() throws Exception {
        CrawlConfig cfg = YamlConfigLoader.load(write(""));
        assertThat(cfg.getSiteMapMaxPages()).isEqualTo(10);
    }

    @Test
    void missingFileThrowsIOException() {
        assertThrows(IOException.class, () -> YamlConfigLoader.load(tmp.resolve("nope.yml")));
    }

    @Test
    void outOfRangeOrNonNumericIsValidationError() throws Exception {
        Path tooMany = write("siteMap:\n  maxPages: 99\n");
        assertThrows(ValidationException.class, () -> YamlConfigLoader.load(tooMany));

        Path notNumber = write("timeoutMs: soon\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(notNumber))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("timeoutMs");
    }

    @Test
    void unsafeTagsAreRejected() throws Exception {
        Path f = write("baseUrl: !!java.io.File \"/tmp\"\n");
        assertThatThrownBy(() -> YamlConfigLoader.load(f)).isInstanceOf(RuntimeException.class);
    }
}
