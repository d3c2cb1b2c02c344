package com.regdoc.acquirer.crawl.persistence;

import com.regdoc.acquirer.crawl.model.AcquisitionResult;
import com.regdoc.acquirer.crawl.model.RawRecord;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.context.SpringBootTest;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.transaction.annotation.Transactional;

import java.time.Duration;
import java.time.Instant;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

@SpringBootTest
@ActiveProfiles("test")
@Transactional
class JdbcAcquisitionResultRepositoryTest {

    @Autowired
    private JdbcAcquisitionResultRepository repository;

    @Test
    void latestResultComesBackWithItsRecord() {
        String name = "数据安全法-" + UUID.randomUUID().toString().substring(0, 6);
        RawRecord record = new RawRecord(
            "https://flk.npc.gov.cn/detail2.html?id=ff80",
            "中华人民共和国数据安全法",
            "中华人民共和国主席令第八十四号",
            "2021-06-10",
            "有效",
            "第一条 为了规范数据处理活动，保障数据安全，制定本法。",
            Map.of("registryId", "ff80", "type", "法律")
        );
        AcquisitionResult older = new AcquisitionResult(
            name, false, null, null, Duration.ofMillis(900), Instant.parse("2024-03-01T08:00:00Z"), "exhausted (last direct-url: NO_MATCH)");
        AcquisitionResult newer = new AcquisitionResult(
            name, true, record, "structured-api", Duration.ofMillis(1234), Instant.parse("2024-03-01T09:30:00.250Z"), null);

        assertEquals(1, repository.insert(older));
        assertEquals(1, repository.insert(newer));

        Optional<AcquisitionResult> latest = repository.findLatest(name);
        assertTrue(latest.isPresent());
        assertEquals(newer, latest.get());
        assertEquals(record, latest.get().record());
    }

    @Test
    void notFoundResultsAreStoredWithoutRecord() {
        String name = "反垄断法-" + UUID.randomUUID().toString().substring(0, 6);
        long foundBefore = repository.countFound(false);

        repository.accept(AcquisitionResult.notFound(name, Duration.ofSeconds(3), "target_timeout"));

        AcquisitionResult stored = repository.findLatest(name).orElseThrow();
        assertFalse(stored.found());
        assertNull(stored.record());
        assertNull(stored.strategyUsed());
        assertEquals("target_timeout", stored.error());
        assertEquals(3000L, stored.elapsedMillis());
        assertEquals(foundBefore + 1, repository.countFound(false));
    }

    @Test
    void unknownTargetHasNoResult() {
        assertTrue(repository.findLatest("never-acquired-" + UUID.randomUUID()).isEmpty());
    }
}
