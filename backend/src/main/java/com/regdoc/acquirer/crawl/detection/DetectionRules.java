package com.regdoc.acquirer.crawl.detection;

import com.regdoc.acquirer.crawl.model.DetectionVerdict;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.regex.Pattern;

public final class DetectionRules {
    public static final Set<Integer> RATE_LIMIT_STATUSES = Set.of(429, 503);
    public static final Set<Integer> IP_BAN_STATUSES = Set.of(403, 451);
    public static final Set<Integer> BLOCK_STATUSES = Set.of(520, 521, 522, 523, 524);

    public static final List<String> CLOUDFLARE_HEADERS = List.of("cf-mitigated", "cf-chl-bypass");
    public static final List<String> WAF_HEADERS = List.of("x-waf-event", "x-security-check", "x-waf-status");

    public static final Map<DetectionVerdict, List<Pattern>> BODY_PATTERNS = buildBodyPatterns();

    private DetectionRules() {}

    private static Map<DetectionVerdict, List<Pattern>> buildBodyPatterns() {
        Map<DetectionVerdict, List<Pattern>> patterns = new LinkedHashMap<>();
        patterns.put(DetectionVerdict.CAPTCHA, compile(
            "captcha",
            "验证码",
            "人机验证",
            "prove\\s+you\\s+are\\s+human",
            "请验证您是人类",
            "robot\\s+check",
            "机器人检测"
        ));
        patterns.put(DetectionVerdict.RATE_LIMITED, compile(
            "rate\\s+limit",
            "频率限制",
            "请求过于频繁",
            "too\\s+many\\s+requests",
            "访问过于频繁",
            "slow\\s+down",
            "请稍后再试"
        ));
        patterns.put(DetectionVerdict.WAF_DETECTED, compile(
            "web\\s+application\\s+firewall",
            "\\bwaf\\b",
            "安全防护",
            "网站防火墙",
            "security\\s+service",
            "安全服务"
        ));
        patterns.put(DetectionVerdict.CLOUDFLARE_CHALLENGE, compile(
            "checking\\s+your\\s+browser",
            "正在检查您的浏览器",
            "\\bcf-ray\\b",
            "ray\\s+id:",
            "attention\\s+required!\\s*\\|\\s*cloudflare"
        ));
        patterns.put(DetectionVerdict.BLOCKED, compile(
            "access\\s+denied",
            "访问被拒绝",
            "禁止访问",
            "\\bblocked\\b",
            "封禁",
            "拦截",
            "security\\s+check",
            "安全检查"
        ));
        return Collections.unmodifiableMap(patterns);
    }

    private static List<Pattern> compile(String... expressions) {
        return Arrays.stream(expressions)
            .map(expression -> Pattern.compile(expression, Pattern.CASE_INSENSITIVE | Pattern.UNICODE_CASE))
            .toList();
    }
}
