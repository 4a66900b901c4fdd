package com.pagelens.core.model;

import java.util.Objects;

/** 페이지에서 추출한 앵커 하나: 절대 URL + 앵커 텍스트(없으면 "") */
public record PageLink(String href, String text) {
    public PageLink {
        Objects.requireNonNull(href, "href");
        text = (text == null) ? "" : text;
    }
}
