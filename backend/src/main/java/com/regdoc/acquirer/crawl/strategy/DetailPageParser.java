package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class DetailPageParser {
    private static final List<Pattern> DOCUMENT_NUMBER_PATTERNS = List.of(
        Pattern.compile("[\\p{IsHan}]{1,12}令第\\s*[0-9一二三四五六七八九十百零〇]+\\s*号"),
        Pattern.compile("[\\p{IsHan}]{0,12}[〔\\[【(（]\\s*\\d{4}\\s*[〕\\]】)）]\\s*\\d+\\s*号"),
        Pattern.compile("(?i)\\bNo\\.\\s*\\d+\\b")
    );
    private static final Pattern CHINESE_DATE = Pattern.compile("(\\d{4})\\s*年\\s*(\\d{1,2})\\s*月\\s*(\\d{1,2})\\s*日");
    private static final Pattern ISO_DATE = Pattern.compile("\\b(\\d{4})-(\\d{1,2})-(\\d{1,2})\\b");
    private static final List<String> STATUS_PHRASES = List.of(
        "现行有效", "尚未生效", "已失效", "已废止", "已修改", "失效", "有效",
        "not yet in force", "in force", "repealed", "superseded"
    );
    private static final List<String> CONTENT_SELECTORS = List.of(
        "div.pages_content", "div.TRS_Editor", "div.content", "div.article_content", "div.main_content"
    );
    private static final int TEXT_SCAN_CHARS = 4000;

    private DetailPageParser() {}

    public static RawRecord parse(String html, String sourceUrl) throws StrategyException {
        if (html == null || html.isBlank()) {
            throw new StrategyException(
                ReasonCodes.PARSING_FAILED,
                "empty page at " + sourceUrl
            );
        }
        Document document = Jsoup.parse(html, sourceUrl == null ? "" : sourceUrl);
        String title = title(document);
        if (title == null) {
            throw new StrategyException(
                ReasonCodes.PARSING_FAILED,
                "no title on " + sourceUrl
            );
        }
        String pageText = document.body() == null ? document.text() : document.body().text();
        String head = pageText.length() > TEXT_SCAN_CHARS ? pageText.substring(0, TEXT_SCAN_CHARS) : pageText;
        String text = content(document, pageText);

        Map<String, String> attributes = new LinkedHashMap<>();
        String pageTitle = document.title();
        if (pageTitle != null && !pageTitle.isBlank() && !pageTitle.trim().equals(title)) {
            attributes.put("pageTitle", pageTitle.trim());
        }
        return new RawRecord(
            sourceUrl,
            title,
            documentNumber(head),
            publishDate(head),
            status(head),
            text,
            attributes
        );
    }

    private static String title(Document document) {
        for (String selector : List.of("h1", ".title", "#title")) {
            Element element = document.selectFirst(selector);
            if (element != null && !element.text().isBlank()) {
                return element.text().trim();
            }
        }
        String title = document.title();
        return title == null || title.isBlank() ? null : title.trim();
    }

    private static String content(Document document, String fallback) {
        for (String selector : CONTENT_SELECTORS) {
            Element element = document.selectFirst(selector);
            if (element != null && !element.text().isBlank()) {
                return element.text().trim();
            }
        }
        return fallback;
    }

    static String documentNumber(String text) {
        for (Pattern pattern : DOCUMENT_NUMBER_PATTERNS) {
            Matcher matcher = pattern.matcher(text);
            if (matcher.find()) {
                return matcher.group().replaceAll("\\s+", "");
            }
        }
        return null;
    }

    static String publishDate(String text) {
        Matcher chinese = CHINESE_DATE.matcher(text);
        if (chinese.find()) {
            return isoDate(chinese.group(1), chinese.group(2), chinese.group(3));
        }
        Matcher iso = ISO_DATE.matcher(text);
        if (iso.find()) {
            return isoDate(iso.group(1), iso.group(2), iso.group(3));
        }
        return null;
    }

    private static String isoDate(String year, String month, String day) {
        return String.format("%s-%02d-%02d", year, Integer.parseInt(month), Integer.parseInt(day));
    }

    static String status(String text) {
        String lower = text.toLowerCase(Locale.ROOT);
        for (String phrase : STATUS_PHRASES) {
            if (lower.contains(phrase)) {
                return phrase;
            }
        }
        return null;
    }
}
