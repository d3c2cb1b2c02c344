package com.regdoc.acquirer.crawl.api;

import com.regdoc.acquirer.crawl.detection.ResponseAnalyzer;
import com.regdoc.acquirer.crawl.identity.IdentityPool;
import com.regdoc.acquirer.crawl.model.AcquisitionResult;
import com.regdoc.acquirer.crawl.model.BatchAcquisitionSummary;
import com.regdoc.acquirer.crawl.model.DetectionSummary;
import com.regdoc.acquirer.crawl.model.IdentityPoolSnapshot;
import com.regdoc.acquirer.crawl.persistence.JdbcAcquisitionResultRepository;
import com.regdoc.acquirer.crawl.service.AcquisitionOrchestrator;
import org.springframework.web.bind.annotation.GetMapping;
import org.springframework.web.bind.annotation.PostMapping;
import org.springframework.web.bind.annotation.RequestBody;
import org.springframework.web.bind.annotation.RequestMapping;
import org.springframework.web.bind.annotation.RequestParam;
import org.springframework.web.bind.annotation.RestController;
import org.springframework.web.server.ResponseStatusException;

import java.util.List;
import java.util.Map;

import static org.springframework.http.HttpStatus.NOT_FOUND;

@RestController
@RequestMapping("/api")
public class AcquisitionController {
    private final AcquisitionOrchestrator orchestrator;
    private final ResponseAnalyzer responseAnalyzer;
    private final IdentityPool identityPool;
    private final JdbcAcquisitionResultRepository resultRepository;

    public AcquisitionController(
        AcquisitionOrchestrator orchestrator,
        ResponseAnalyzer responseAnalyzer,
        IdentityPool identityPool,
        JdbcAcquisitionResultRepository resultRepository
    ) {
        this.orchestrator = orchestrator;
        this.responseAnalyzer = responseAnalyzer;
        this.identityPool = identityPool;
        this.resultRepository = resultRepository;
    }

    @PostMapping("/acquire")
    public AcquisitionResult acquire(@RequestBody(required = false) AcquireRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("request body with a name is required");
        }
        return orchestrator.acquire(request.name());
    }

    @PostMapping("/acquire/batch")
    public BatchAcquisitionSummary acquireBatch(@RequestBody(required = false) BatchAcquireRequest request) {
        if (request == null || request.names() == null) {
            throw new IllegalArgumentException("request body with names is required");
        }
        return orchestrator.acquireBatch(request.names(), request.concurrencyLimit());
    }

    @GetMapping("/results/latest")
    public AcquisitionResult latestResult(@RequestParam("name") String name) {
        return resultRepository.findLatest(name)
            .orElseThrow(() -> new ResponseStatusException(NOT_FOUND, "No stored result for " + name));
    }

    @GetMapping("/diagnostics/detection")
    public DetectionSummary detection() {
        return responseAnalyzer.summary();
    }

    @GetMapping("/diagnostics/identities")
    public IdentityPoolSnapshot identities() {
        return identityPool.snapshot();
    }

    @GetMapping("/diagnostics/strategies")
    public Map<String, List<String>> strategies() {
        return Map.of("order", orchestrator.strategyOrder());
    }
}
