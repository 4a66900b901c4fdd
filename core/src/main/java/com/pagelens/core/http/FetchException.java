package com.pagelens.core.http;

import java.io.IOException;

/** URL 하나에 대한 fetch 실패. 크롤 경계에서 "이 URL과 그 하위 링크를 건너뜀"으로 바뀐다. */
public class FetchException extends IOException {
    private static final long serialVersionUID = 1L;

    public enum Reason {
        /** 200이 아닌 응답 */
        HTTP_STATUS,
        /** HTML이 아닌 Content-Type (.html URL 예외 제외) */
        CONTENT_TYPE,
        /** 연결/타임아웃/잘못된 URL 등 전송 계층 오류 */
        NETWORK
    }

    private final Reason reason;
    private final int statusCode;   // 응답이 없으면 -1

    public FetchException(Reason reason, int statusCode, String message) {
        super(message);
        this.reason = reason;
        this.statusCode = statusCode;
    }

    public FetchException(Reason reason, String message, Throwable cause) {
        super(message, cause);
        this.reason = reason;
        this.statusCode = -1;
    }

    public Reason getReason() { return reason; }
    public int getStatusCode() { return statusCode; }
}
