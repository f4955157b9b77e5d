package com.marketpulse.core.provider;

import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.jsoup.select.Elements;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Duration;
import java.util.stream.Collectors;

/**
 * Downloads a page and reduces it to its main readable text.
 */
@Component
public class PageTextExtractor {

    static final int MAX_TEXT_LENGTH = 24_000;

    private static final String USER_AGENT = "Mozilla/5.0 (compatible; MarketPulse/0.1)";

    public String fetchText(String url, Duration timeout) throws IOException {
        Document doc = Jsoup.connect(url)
                .userAgent(USER_AGENT)
                .timeout((int) Math.max(3000, timeout.toMillis()))
                .followRedirects(true)
                .get();
        return extractText(doc);
    }

    /**
     * Strips navigation and scripts, preferring article-like containers over the whole body.
     */
    static String extractText(Document doc) {
        doc.select("script,noscript,style,header,footer,nav,aside,form").remove();

        Elements bodies = doc.select("article, main, #content, .post, .entry-content, .article, .post-body, .content");
        if (bodies.isEmpty()) {
            bodies = doc.body() == null ? new Elements() : doc.body().children();
        }

        String text = bodies.stream()
                .map(Element::text)
                .collect(Collectors.joining("\n"))
                .replace('\u00A0', ' ')
                .replaceAll("[ \\t]{2,}", " ")
                .trim();

        return text.length() > MAX_TEXT_LENGTH ? text.substring(0, MAX_TEXT_LENGTH) : text;
    }
}
