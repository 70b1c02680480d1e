package com.newsrelay.core.util;

import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class TextUtils {
    public static final String TRUNCATION_MARKER = "...";

    private static final Pattern TAG_PATTERN = Pattern.compile("<[^>]*>", Pattern.DOTALL);
    // "&lt;" must be followed by a tag name, so "3 &lt; 5" is left alone
    private static final Pattern ESCAPED_TAG_PATTERN =
            Pattern.compile("&lt;/?[A-Za-z][A-Za-z0-9]*(?:\\s[^<>]*?)?/?&gt;", Pattern.DOTALL);
    private static final Pattern WHITESPACE_PATTERN = Pattern.compile("\\s+");
    private static final Pattern NUMERIC_ENTITY_PATTERN = Pattern.compile("&#(x?[0-9a-fA-F]+);");
    private static final Map<String, String> NAMED_ENTITIES = Map.of(
            "&amp;", "&",
            "&lt;", "<",
            "&gt;", ">",
            "&quot;", "\"",
            "&apos;", "'",
            "&nbsp;", " "
    );

    private TextUtils() {
    }

    public static String stripTags(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return TAG_PATTERN.matcher(text).replaceAll(" ");
    }

    public static String stripEscapedTags(String text) {
        if (text == null || text.indexOf('&') < 0) {
            return text == null ? "" : text;
        }
        return ESCAPED_TAG_PATTERN.matcher(text).replaceAll(" ");
    }

    public static String decodeEntities(String text) {
        if (text == null || text.indexOf('&') < 0) {
            return text == null ? "" : text;
        }
        Matcher matcher = NUMERIC_ENTITY_PATTERN.matcher(text);
        StringBuilder decoded = new StringBuilder();
        while (matcher.find()) {
            matcher.appendReplacement(decoded, Matcher.quoteReplacement(decodeNumeric(matcher.group(1), matcher.group())));
        }
        matcher.appendTail(decoded);
        String result = decoded.toString();
        for (Map.Entry<String, String> entity : NAMED_ENTITIES.entrySet()) {
            if (!"&amp;".equals(entity.getKey())) {
                result = result.replace(entity.getKey(), entity.getValue());
            }
        }
        // last, so "&amp;lt;" stays "&lt;"
        return result.replace("&amp;", "&");
    }

    public static String collapseWhitespace(String text) {
        if (text == null || text.isEmpty()) {
            return "";
        }
        return WHITESPACE_PATTERN.matcher(text).replaceAll(" ").trim();
    }

    public static String truncate(String text, int maxLength) {
        if (maxLength <= TRUNCATION_MARKER.length()) {
            throw new IllegalArgumentException("maxLength must exceed the truncation marker length");
        }
        if (text == null) {
            return "";
        }
        if (text.length() <= maxLength) {
            return text;
        }
        int cut = maxLength - TRUNCATION_MARKER.length();
        if (Character.isHighSurrogate(text.charAt(cut - 1))) {
            cut--;
        }
        return text.substring(0, cut).stripTrailing() + TRUNCATION_MARKER;
    }

    private static String decodeNumeric(String code, String original) {
        try {
            int codePoint = code.startsWith("x") || code.startsWith("X")
                    ? Integer.parseInt(code.substring(1), 16)
                    : Integer.parseInt(code);
            return new String(Character.toChars(codePoint));
        } catch (IllegalArgumentException ex) {
            return original;
        }
    }
}
