package com.pagelens.core.util;

/** 공백 처리 헬퍼. NBSP 같은 유니코드 공백도 공백으로 본다. */
public final class TextUtil {
    private TextUtil() {}

    public static boolean isSpace(char c) {
        return Character.isWhitespace(c) || Character.isSpaceChar(c);
    }

    /** 앞뒤 공백 제거. null이면 "" */
    public static String trim(String s) {
        if (s == null) return "";
        int start = 0, end = s.length();
        while (start < end && isSpace(s.charAt(start))) start++;
        while (end > start && isSpace(s.charAt(end - 1))) end--;
        return s.substring(start, end);
    }

    /** 연속 공백을 한 칸으로 접고 앞뒤 공백 제거 */
    public static String collapseWhitespace(String s) {
        if (s == null) return "";
        StringBuilder sb = new StringBuilder(s.length());
        boolean pendingSpace = false;
        for (int i = 0; i < s.length(); i++) {
            char c = s.charAt(i);
            if (isSpace(c)) {
                pendingSpace = sb.length() > 0;
            } else {
                if (pendingSpace) sb.append(' ');
                sb.append(c);
                pendingSpace = false;
            }
        }
        return sb.toString();
    }
}
