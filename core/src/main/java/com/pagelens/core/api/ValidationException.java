package com.pagelens.core.api;

/**
 * 호출자 입력 오류(빈 시드 URL, 빈 프롬프트, 범위 밖 maxPages, 잘못된 설정).
 * 즉시 던지고 재시도하지 않는다.
 */
public class ValidationException extends IllegalArgumentException {
    private static final long serialVersionUID = 1L;

    public ValidationException(String message) {
        super(message);
    }
}
