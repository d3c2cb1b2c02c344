package com.regdoc.acquirer.crawl.service;

import com.regdoc.acquirer.crawl.model.AcquisitionResult;

public interface AcquisitionResultSink {
    void accept(AcquisitionResult result);
}
