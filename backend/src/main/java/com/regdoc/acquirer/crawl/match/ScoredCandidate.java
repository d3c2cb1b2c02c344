package com.regdoc.acquirer.crawl.match;

import com.regdoc.acquirer.crawl.model.MatchCandidate;

public record ScoredCandidate(
    MatchCandidate candidate,
    double score,
    ValidityStatus validity
) {
}
