package com.regdoc.acquirer.crawl.identity;

import java.util.EnumSet;
import java.util.Locale;
import java.util.Set;

public enum IdentityProtocol {
    HTTP("http"),
    HTTPS("http"),
    SOCKS4("socks4"),
    SOCKS5("socks5"),
    TLS_TUNNEL("https");

    // HttpClient only speaks to HTTP proxies.
    public static final Set<IdentityProtocol> HTTP_CLIENT_COMPATIBLE = EnumSet.of(HTTP, HTTPS);

    private final String browserScheme;

    IdentityProtocol(String browserScheme) {
        this.browserScheme = browserScheme;
    }

    public String browserScheme() {
        return browserScheme;
    }

    public static IdentityProtocol fromLabel(String label) {
        if (label == null || label.isBlank()) {
            return HTTP;
        }
        String normalized = label.trim().toUpperCase(Locale.ROOT).replace('-', '_');
        if (normalized.equals("TROJAN") || normalized.equals("TLS")) {
            return TLS_TUNNEL;
        }
        return IdentityProtocol.valueOf(normalized);
    }
}
