package com.regdoc.acquirer.crawl.model;

public enum OperationKind {
    DEFAULT,
    SEARCH,
    RETRY,
    DETAIL
}
