package com.regdoc.acquirer.crawl.identity;

import java.util.List;

public interface FreeIdentityFeed {
    List<IdentityEndpoint> fetch();
}
