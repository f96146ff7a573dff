package com.purchasingpower.signalintel.util;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Helpers for pulling JSON out of free-form model text.
 */
public final class LlmJson {

    private static final Pattern FENCED = Pattern.compile("```(?:json|JSON)?\\s*([\\s\\S]*?)```");

    private LlmJson() {
    }

    /**
     * Returns the body of the first markdown code fence, or the trimmed text when there is none.
     */
    public static String stripCodeFences(String text) {
        if (text == null) {
            return "";
        }
        Matcher matcher = FENCED.matcher(text);
        if (matcher.find()) {
            return matcher.group(1).trim();
        }
        return text.trim();
    }

    /**
     * First {@code [...]} span in the text, or {@code null}.
     */
    public static String firstJsonArray(String text) {
        return span(stripCodeFences(text), '[', ']');
    }

    private static String span(String text, char open, char close) {
        int start = text.indexOf(open);
        int end = text.lastIndexOf(close);
        if (start < 0 || end <= start) {
            return null;
        }
        return text.substring(start, end + 1);
    }
}
