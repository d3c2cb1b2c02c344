package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.crawl.model.MatchCandidate;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.net.URI;
import java.net.URISyntaxException;
import java.net.URLDecoder;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;

final class SearchResultExtractor {
    static final String BING_SELECTOR = "li.b_algo h2 a";
    static final String DUCKDUCKGO_SELECTOR = "a.result__a";

    private static final List<String> SKIPPED_URL_MARKERS = List.of(
        ".pdf", "download", "attachment", ".doc", ".docx", ".xls"
    );
    private static final List<String> SKIPPED_TITLE_MARKERS = List.of(
        "首页", "导航", "搜索", "登录", "注册"
    );

    private SearchResultExtractor() {}

    static String selectorForLayout(String layout) {
        if (layout == null) {
            return BING_SELECTOR;
        }
        return switch (layout.toLowerCase(Locale.ROOT)) {
            case "duckduckgo" -> DUCKDUCKGO_SELECTOR;
            case "bing" -> BING_SELECTOR;
            default -> layout;
        };
    }

    static List<MatchCandidate> extract(
        String html,
        String pageUrl,
        String selector,
        List<String> allowedHosts,
        int maxResults,
        String engine
    ) {
        List<MatchCandidate> candidates = new ArrayList<>();
        if (html == null || html.isBlank()) {
            return candidates;
        }
        Document document = Jsoup.parse(html, pageUrl == null ? "" : pageUrl);
        Set<String> seen = new LinkedHashSet<>();
        for (Element link : document.select(selector)) {
            if (candidates.size() >= maxResults) {
                break;
            }
            String title = link.text().trim();
            String href = unwrapRedirect(link.absUrl("href").isBlank() ? link.attr("href") : link.absUrl("href"));
            if (title.isEmpty() || href == null || !seen.add(href)) {
                continue;
            }
            if (!isAllowedHost(href, allowedHosts) || shouldSkip(href, title)) {
                continue;
            }
            candidates.add(new MatchCandidate(title, href, null, null, null, candidates.size(), Map.of("engine", engine)));
        }
        return candidates;
    }

    // DuckDuckGo wraps result links as /l/?uddg=<encoded target>.
    static String unwrapRedirect(String href) {
        if (href == null || href.isBlank()) {
            return null;
        }
        String value = href.startsWith("//") ? "https:" + href : href;
        int marker = value.indexOf("uddg=");
        if (marker >= 0) {
            String encoded = value.substring(marker + "uddg=".length());
            int end = encoded.indexOf('&');
            if (end >= 0) {
                encoded = encoded.substring(0, end);
            }
            value = URLDecoder.decode(encoded, StandardCharsets.UTF_8);
        }
        return value.startsWith("http://") || value.startsWith("https://") ? value : null;
    }

    static boolean isAllowedHost(String url, List<String> allowedHosts) {
        if (allowedHosts == null || allowedHosts.isEmpty()) {
            return true;
        }
        String host;
        try {
            host = new URI(url).getHost();
        } catch (URISyntaxException e) {
            return false;
        }
        if (host == null) {
            return false;
        }
        String lower = host.toLowerCase(Locale.ROOT);
        for (String allowed : allowedHosts) {
            String suffix = allowed.toLowerCase(Locale.ROOT);
            if (lower.equals(suffix) || lower.endsWith("." + suffix)) {
                return true;
            }
        }
        return false;
    }

    private static boolean shouldSkip(String url, String title) {
        String lowerUrl = url.toLowerCase(Locale.ROOT);
        for (String marker : SKIPPED_URL_MARKERS) {
            if (lowerUrl.contains(marker)) {
                return true;
            }
        }
        for (String marker : SKIPPED_TITLE_MARKERS) {
            if (title.contains(marker)) {
                return true;
            }
        }
        return false;
    }
}
