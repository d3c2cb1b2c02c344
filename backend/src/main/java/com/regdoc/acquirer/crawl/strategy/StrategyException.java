package com.regdoc.acquirer.crawl.strategy;

public class StrategyException extends Exception {
    private final String reasonCode;

    public StrategyException(String reasonCode, String message) {
        super(message);
        this.reasonCode = reasonCode;
    }

    public StrategyException(String reasonCode, String message, Throwable cause) {
        super(message, cause);
        this.reasonCode = reasonCode;
    }

    public String reasonCode() {
        return reasonCode;
    }
}
