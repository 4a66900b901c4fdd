// IAnswerEngine.java
package com.pagelens.core.api;

import com.pagelens.core.model.Page;

import java.util.List;

/** 응답 엔진 최소 계약: 수집된 페이지와 프롬프트만으로 답을 만든다(I/O 없음, 예외 없음). */
public interface IAnswerEngine {
    String answer(List<Page> pages, String prompt);
}
