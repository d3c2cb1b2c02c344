package com.regdoc.acquirer.crawl.match;

import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

public final class NameNormalizer {
    private static final Pattern WHITESPACE = Pattern.compile("[\\s\\u3000]+");
    private static final Pattern SPACE_NEAR_CJK = Pattern.compile("(?<=[\\p{IsHan}()]) | (?=[\\p{IsHan}()])");
    private static final Pattern BOILERPLATE_PREFIX = Pattern.compile(
        "^(中华人民共和国|(the\\s+)?people's\\s+republic\\s+of\\s+china('s)?)\\s*"
    );
    private static final Pattern TRAILING_ANNOTATION = Pattern.compile(
        "\\s*\\(([^()]*(修订|修正|修改|amendment|amended|revision|revised|\\d{4}\\s*年?)[^()]*)\\)\\s*$"
    );
    private static final Pattern LATIN_WORD = Pattern.compile("[a-z0-9]+");
    private static final Pattern HAN_RUN = Pattern.compile("\\p{IsHan}+");
    private static final Set<String> STOPWORDS = Set.of(
        "the", "of", "and", "on", "for", "in", "to", "a", "an", "law", "laws", "act"
    );

    private NameNormalizer() {}

    /**
     * Canonical form used for every comparison. Applying it twice gives the same result.
     */
    public static String normalize(String name) {
        if (name == null) {
            return "";
        }
        String value = name;
        String previous;
        do {
            previous = value;
            value = step(value);
        } while (!value.equals(previous));
        return value;
    }

    private static String step(String input) {
        String value = input
            .replace('（', '(')
            .replace('）', ')')
            .replace('【', '(')
            .replace('】', ')')
            .replace('〔', '(')
            .replace('〕', ')')
            .replace('[', '(')
            .replace(']', ')')
            .replace('’', '\'')
            .replace("《", "")
            .replace("》", "")
            .replace("\"", "")
            .replace("“", "")
            .replace("”", "");
        value = value.toLowerCase(Locale.ROOT);
        value = WHITESPACE.matcher(value).replaceAll(" ").trim();
        value = SPACE_NEAR_CJK.matcher(value).replaceAll("");
        value = BOILERPLATE_PREFIX.matcher(value).replaceFirst("");
        value = TRAILING_ANNOTATION.matcher(value).replaceFirst("");
        return value.trim();
    }

    public static Set<String> keywords(String normalized) {
        Set<String> keywords = new LinkedHashSet<>();
        if (normalized == null || normalized.isBlank()) {
            return keywords;
        }
        Matcher words = LATIN_WORD.matcher(normalized);
        while (words.find()) {
            String word = words.group();
            if (word.length() >= 3 && !STOPWORDS.contains(word)) {
                keywords.add(word);
            }
        }
        Matcher han = HAN_RUN.matcher(normalized);
        while (han.find()) {
            keywords.addAll(shingles(han.group()));
        }
        return keywords;
    }

    private static List<String> shingles(String run) {
        List<String> result = new ArrayList<>();
        if (run.length() == 1) {
            return result;
        }
        for (int i = 0; i + 2 <= run.length(); i++) {
            result.add(run.substring(i, i + 2));
        }
        return result;
    }
}
