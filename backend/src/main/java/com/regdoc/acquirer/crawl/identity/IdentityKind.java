package com.regdoc.acquirer.crawl.identity;

public enum IdentityKind {
    DIRECT,
    PROXIED
}
