package com.pagelens.core.util;

import java.net.MalformedURLException;
import java.net.URI;
import java.net.URL;

/**
 * 네트워크 위치(authority) 판정 유틸.
 * 정규화하지 않는다: 대소문자/포트/userinfo를 적힌 그대로 비교하고 scheme은 보지 않는다.
 */
public final class UrlUtils {
    private UrlUtils() {}

    /** "user@host:port" 형태 그대로. 파싱 불가 또는 authority 없음이면 "" */
    public static String networkLocation(String url) {
        if (url == null || url.isBlank()) return "";
        try {
            String a = URI.create(url.trim()).getRawAuthority();
            return a == null ? "" : a;
        } catch (IllegalArgumentException e) {
            // 공백 등으로 URI 파싱이 안 되면 URL 파서로 재시도
            try {
                String a = new URL(url.trim()).getAuthority();
                return a == null ? "" : a;
            } catch (MalformedURLException ignore) {
                return "";
            }
        }
    }

    /** 시드와 같은 네트워크 위치인지(빈 authority는 항상 false) */
    public static boolean sameNetworkLocation(String seedLocation, String url) {
        if (seedLocation == null || seedLocation.isEmpty()) return false;
        return seedLocation.equals(networkLocation(url));
    }
}
