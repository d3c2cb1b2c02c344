package com.regdoc.acquirer.crawl.identity;

import java.util.Locale;

public record IdentityEndpoint(
    String host,
    int port,
    IdentityProtocol protocol
) {
    public String key() {
        return host.toLowerCase(Locale.ROOT) + ":" + port;
    }
}
