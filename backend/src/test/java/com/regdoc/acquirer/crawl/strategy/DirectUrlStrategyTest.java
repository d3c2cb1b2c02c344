package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.TestProperties;
import com.regdoc.acquirer.config.AcquirerProperties;
import com.regdoc.acquirer.crawl.model.MatchCandidate;
import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import okhttp3.mockwebserver.MockResponse;
import okhttp3.mockwebserver.MockWebServer;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DirectUrlStrategyTest {
    private MockWebServer server;
    private ExecutorService executor;
    private AcquirerProperties properties;

    @BeforeEach
    void setUp() throws Exception {
        server = new MockWebServer();
        server.start();
        executor = Executors.newFixedThreadPool(2);
        properties = TestProperties.fast();
        Map<String, String> known = new LinkedHashMap<>();
        known.put("网络安全法", server.url("/csl.html").toString());
        known.put("数据安全管理办法", server.url("/dsm.html").toString());
        known.put("中华人民共和国数据安全法", server.url("/dsl.html").toString());
        known.put("中华人民共和国刑法", server.url("/criminal.html").toString());
        properties.getStrategies().getDirectUrl().setKnown(known);
    }

    @AfterEach
    void tearDown() throws Exception {
        server.shutdown();
        executor.shutdownNow();
    }

    @Test
    void exactMatchesComeBeforeKeywordOverlaps() throws Exception {
        List<MatchCandidate> candidates = strategy().search("数据安全法");

        assertThat(candidates).extracting(MatchCandidate::title)
            .containsExactly("中华人民共和国数据安全法", "网络安全法", "数据安全管理办法");
        assertThat(candidates).extracting(MatchCandidate::rank).containsExactly(0, 1, 2);
        assertThat(candidates).allMatch(candidate -> "true".equals(candidate.attributes().get("known")));
        assertThat(server.getRequestCount()).isZero();
    }

    @Test
    void emptyTableIsNotConfigured() {
        properties.getStrategies().getDirectUrl().setKnown(Map.of());

        assertThatThrownBy(() -> strategy().search("数据安全法"))
            .extracting(StrategyTestSupport::reasonOf)
            .isEqualTo(ReasonCodes.NOT_CONFIGURED);
    }

    @Test
    void fetchDetailParsesTheKnownPage() throws Exception {
        server.enqueue(new MockResponse().setBody(DetailPageParserTest.DATA_SECURITY_LAW_PAGE));
        server.enqueue(new MockResponse().setResponseCode(404).setBody("<p>gone</p>"));
        DirectUrlStrategy strategy = strategy();

        RawRecord record = strategy.fetchDetail(MatchCandidate.of("中华人民共和国数据安全法", server.url("/dsl.html").toString(), null));

        assertThat(record.title()).isEqualTo("中华人民共和国数据安全法");
        assertThat(record.documentNumber()).isEqualTo("中华人民共和国主席令第八十四号");
        assertThatThrownBy(() -> strategy.fetchDetail(MatchCandidate.of("网络安全法", server.url("/csl.html").toString(), null)))
            .extracting(StrategyTestSupport::reasonOf)
            .isEqualTo(ReasonCodes.HTTP_404);
    }

    private DirectUrlStrategy strategy() {
        return new DirectUrlStrategy(properties, StrategyTestSupport.directClient(properties, executor));
    }
}
