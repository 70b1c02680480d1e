package com.newsrelay.feeds.normalize;

import com.newsrelay.core.util.TextUtils;

public final class TextCleaner {
    public static final int DEFAULT_MAX_LENGTH = 300;

    private final int maxLength;

    public TextCleaner() {
        this(DEFAULT_MAX_LENGTH);
    }

    public TextCleaner(int maxLength) {
        if (maxLength <= TextUtils.TRUNCATION_MARKER.length()) {
            throw new IllegalArgumentException("maxLength must be greater than " + TextUtils.TRUNCATION_MARKER.length());
        }
        this.maxLength = maxLength;
    }

    public String clean(String raw) {
        return TextUtils.truncate(flatten(raw), maxLength);
    }

    public String flatten(String raw) {
        if (raw == null || raw.isBlank()) {
            return "";
        }
        // decoding last keeps escaped comparisons ("3 &lt; 5") as text
        String stripped = TextUtils.stripEscapedTags(TextUtils.stripTags(raw));
        return TextUtils.collapseWhitespace(TextUtils.decodeEntities(stripped));
    }

    public int maxLength() {
        return maxLength;
    }
}
