package com.pagelens.core.util;

import org.junit.jupiter.api.Test;

import java.util.logging.Level;

import static org.assertj.core.api.Assertions.*;

class StructuredLogTest {

    final StructuredLog log = StructuredLog.get(StructuredLogTest.class);

    @Test
    void builds_single_json_object() {
        String json = log.buildJson(Level.INFO, "fetch", null, "url", "https://h/", "status", 200, "ok", true);

        assertThat(json).startsWith("{\"ts\":\"").endsWith("}")
                .contains("\"lvl\":\"INFO\"")
                .contains("\"comp\":\"StructuredLogTest\"")
                .contains("\"event\":\"fetch\"")
                .contains("\"url\":\"https://h/\",\"status\":200,\"ok\":true");
    }

    @Test
    void bound_keys_come_first_and_parent_is_untouched() {
        StructuredLog bound = log.bind("crawlId", "abc12345");

        assertThat(bound.buildJson(Level.INFO, "e", null, "k", "v"))
                .contains("\"crawlId\":\"abc12345\",\"k\":\"v\"");
        assertThat(log.buildJson(Level.INFO, "e", null)).doesNotContain("crawlId");
    }

    @Test
    void escapes_and_mismatch_marker() {
        String json = log.buildJson(Level.WARNING, "e", null, "msg", "say \"hi\"\n", "dangling");

        assertThat(json).contains("\"msg\":\"say \\\"hi\\\"\\n\"").contains("\"_kv_mismatch\":true");
    }

    @Test
    void error_adds_exception_fields() {
        String json = log.buildJson(Level.SEVERE, "e", new IllegalStateException("bad"));
        assertThat(json).contains("\"error\":\"IllegalStateException\"").contains("\"message\":\"bad\"");
    }
}
