package com.pagelens.core.service.export;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.pagelens.core.model.SiteMap;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Objects;

/** 사이트맵 JSON 출력: {"base": ..., "pages": [{"url", "links": [{"href", "text"}]}]} */
public final class SiteMapExporter {

    private final ObjectMapper om = new ObjectMapper()
            .enable(SerializationFeature.INDENT_OUTPUT);

    public String toJson(SiteMap siteMap) throws IOException {
        Objects.requireNonNull(siteMap, "siteMap");
        return om.writeValueAsString(siteMap);
    }

    /** 상위 디렉터리가 없으면 만든다 */
    public Path writeTo(SiteMap siteMap, Path file) throws IOException {
        Objects.requireNonNull(siteMap, "siteMap");
        Objects.requireNonNull(file, "file");
        Path parent = file.toAbsolutePath().getParent();
        if (parent != null) Files.createDirectories(parent);
        om.writeValue(file.toFile(), siteMap);
        return file;
    }
}
