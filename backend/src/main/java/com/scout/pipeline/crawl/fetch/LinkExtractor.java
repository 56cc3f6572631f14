package com.scout.pipeline.crawl.fetch;

import com.scout.pipeline.crawl.util.UrlUtils;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public final class LinkExtractor {
    private LinkExtractor() {
    }

    /**
     * Returns the distinct same-host http(s) links of the page, fragments removed, in document order.
     */
    public static List<String> sameHostLinks(String html, String baseUrl, int limit) {
        if (html == null || html.isBlank()) {
            return List.of();
        }
        Document doc = Jsoup.parse(html, baseUrl);
        Set<String> unique = new LinkedHashSet<>();
        for (Element anchor : doc.select("a[href]")) {
            if (unique.size() >= limit) {
                break;
            }
            String normalized = UrlUtils.normalizeResource(anchor.attr("abs:href"));
            if (normalized == null || normalized.equals(baseUrl)) {
                continue;
            }
            if (!UrlUtils.sameHost(normalized, baseUrl)) {
                continue;
            }
            unique.add(normalized);
        }
        return new ArrayList<>(unique);
    }
}
