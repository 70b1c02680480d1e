package com.newsrelay.feeds.support;

import com.newsrelay.core.model.NewsItem;
import com.newsrelay.core.model.SourceDescriptor;

import java.time.Instant;

public final class Feeds {
    private Feeds() {
    }

    public static SourceDescriptor source(String name, String category) {
        return new SourceDescriptor(name, "https://" + name + ".example/rss", "Egypt", category);
    }

    public static NewsItem item(String link, String source, String category, Instant publishedAt, Instant normalizedAt) {
        return new NewsItem(link, "Title " + link, "", publishedAt, source, "Egypt", category, normalizedAt);
    }

    /**
     * Minimal RSS document; each item is {title, link, pubDate}.
     */
    public static String rss(String[]... items) {
        StringBuilder xml = new StringBuilder("<rss version=\"2.0\"><channel><title>t</title>");
        for (String[] item : items) {
            xml.append("<item><title>").append(item[0]).append("</title>")
                    .append("<link>").append(item[1]).append("</link>")
                    .append("<pubDate>").append(item[2]).append("</pubDate></item>");
        }
        return xml.append("</channel></rss>").toString();
    }
}
