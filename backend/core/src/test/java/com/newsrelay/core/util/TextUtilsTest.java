package com.newsrelay.core.util;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TextUtilsTest {
    @Test
    void stripTagsRemovesMarkupIncludingMultilineTags() {
        assertEquals("Storm warning", TextUtils.collapseWhitespace(TextUtils.stripTags("<p>Storm <b\nclass=\"x\">warning</b></p>")));
        assertEquals("a b", TextUtils.stripTags("a<br/>b"));
        assertEquals("", TextUtils.stripTags(null));
    }

    @Test
    void stripEscapedTagsLeavesEscapedComparisonsAlone() {
        assertEquals("  Storm  warning", TextUtils.stripEscapedTags("&lt;p&gt; Storm &lt;b class=&quot;x&quot;&gt;warning"));
        assertEquals("a b", TextUtils.stripEscapedTags("a&lt;br/&gt;b"));
        assertEquals("3 &lt; 5 and 9 &gt; 7", TextUtils.stripEscapedTags("3 &lt; 5 and 9 &gt; 7"));
        assertEquals("", TextUtils.stripEscapedTags(null));
    }

    @Test
    void decodeEntitiesHandlesNamedAndNumericForms() {
        assertEquals("Tom & Jerry <3", TextUtils.decodeEntities("Tom &amp; Jerry &lt;3"));
        assertEquals("A'B", TextUtils.decodeEntities("A&#39;B"));
        assertEquals("A", TextUtils.decodeEntities("&#x41;"));
        assertEquals("&lt;", TextUtils.decodeEntities("&amp;lt;"));
        assertEquals("plain", TextUtils.decodeEntities("plain"));
    }

    @Test
    void collapseWhitespaceJoinsRunsAndTrims() {
        assertEquals("a b c", TextUtils.collapseWhitespace("  a \n\t b   c  "));
        assertEquals("", TextUtils.collapseWhitespace("   "));
    }

    @Test
    void truncateKeepsShortTextAndMarksCutText() {
        assertEquals("short", TextUtils.truncate("short", 10));
        String cut = TextUtils.truncate("abcdefghijklmnop", 10);
        assertEquals("abcdefg...", cut);
        assertTrue(cut.length() <= 10);
        assertEquals("exactly10!", TextUtils.truncate("exactly10!", 10));
        assertThrows(IllegalArgumentException.class, () -> TextUtils.truncate("x", 3));
    }

    @Test
    void truncateNeverSplitsASurrogatePair() {
        String text = "abcdef\uD83D\uDCF0 headline continues";

        assertEquals("abcdef...", TextUtils.truncate(text, 10));
        assertEquals("abcdef\uD83D\uDCF0...", TextUtils.truncate(text, 11));
    }
}
