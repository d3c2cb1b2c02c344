package com.regdoc.acquirer.crawl.service;

import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.model.AcquisitionResult;
import com.regdoc.acquirer.crawl.model.BatchAcquisitionSummary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.boot.ApplicationArguments;
import org.springframework.boot.ApplicationRunner;
import org.springframework.boot.SpringApplication;
import org.springframework.context.ConfigurableApplicationContext;
import org.springframework.stereotype.Component;

import java.util.List;

@Component
public class AcquisitionCliRunner implements ApplicationRunner {
    private static final Logger log = LoggerFactory.getLogger(AcquisitionCliRunner.class);

    private final AcquirerProperties properties;
    private final TargetListReader targetListReader;
    private final AcquisitionOrchestrator orchestrator;
    private final ConfigurableApplicationContext applicationContext;

    public AcquisitionCliRunner(
        AcquirerProperties properties,
        TargetListReader targetListReader,
        AcquisitionOrchestrator orchestrator,
        ConfigurableApplicationContext applicationContext
    ) {
        this.properties = properties;
        this.targetListReader = targetListReader;
        this.orchestrator = orchestrator;
        this.applicationContext = applicationContext;
    }

    @Override
    public void run(ApplicationArguments args) {
        AcquirerProperties.Cli cli = properties.getCli();
        if (!cli.isRun()) {
            return;
        }

        List<String> names = targetListReader.read(cli.getNames(), cli.getTargetsCsv());
        if (names.isEmpty()) {
            log.warn("CLI run requested but no target names were configured");
        } else {
            BatchAcquisitionSummary summary = orchestrator.acquireBatch(names, cli.getConcurrencyLimit());
            log.info(
                "Batch finished: found={}, notFound={}, byStrategy={}",
                summary.foundCount(),
                summary.notFoundCount(),
                summary.foundByStrategy()
            );
            for (AcquisitionResult result : summary.results()) {
                if (result.found()) {
                    log.info(
                        "Result {}: strategy={}, number={}, url={}, {}ms",
                        result.targetName(),
                        result.strategyUsed(),
                        result.record().documentNumber(),
                        result.record().sourceUrl(),
                        result.elapsedMillis()
                    );
                } else {
                    log.info("Result {}: not found ({}), {}ms", result.targetName(), result.error(), result.elapsedMillis());
                }
            }
        }

        if (cli.isExitAfterRun()) {
            int exitCode = SpringApplication.exit(applicationContext, () -> 0);
            System.exit(exitCode);
        }
    }
}
