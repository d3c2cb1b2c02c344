package com.regdoc.acquirer.crawl.model;

public enum DetectionVerdict {
    NORMAL,
    BLOCKED,
    CAPTCHA,
    RATE_LIMITED,
    WAF_DETECTED,
    IP_BANNED,
    CLOUDFLARE_CHALLENGE;

    public boolean isNormal() {
        return this == NORMAL;
    }

    public boolean isIdentityHostile() {
        return this == IP_BANNED || this == WAF_DETECTED || this == CLOUDFLARE_CHALLENGE;
    }
}
