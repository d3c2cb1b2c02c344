package com.regdoc.acquirer.crawl.identity;

public enum IdentityTier {
    FREE,
    PAID
}
