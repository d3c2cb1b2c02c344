package com.regdoc.acquirer.crawl.strategy;

import com.regdoc.acquirer.crawl.model.RawRecord;
import com.regdoc.acquirer.crawl.util.ReasonCodes;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class DetailPageParserTest {
    static final String DATA_SECURITY_LAW_PAGE = """
        <html>
          <head><title>中华人民共和国数据安全法_中国人大网</title></head>
          <body>
            <div class="nav">首页 &gt; 法律</div>
            <h1>中华人民共和国数据安全法</h1>
            <div class="pages_content">
              <p>（2021年6月10日第十三届全国人民代表大会常务委员会第二十九次会议通过）</p>
              <p>中华人民共和国主席令第八十四号</p>
              <p>现行有效</p>
              <p>第一条 为了规范数据处理活动，促进数据开发利用，制定本法。</p>
            </div>
          </body>
        </html>
        """;

    @Test
    void extractsTitleNumberDateStatusAndContent() throws Exception {
        RawRecord record = DetailPageParser.parse(DATA_SECURITY_LAW_PAGE, "http://flk.npc.gov.cn/detail2.html?id=1");

        assertThat(record.title()).isEqualTo("中华人民共和国数据安全法");
        assertThat(record.documentNumber()).isEqualTo("中华人民共和国主席令第八十四号");
        assertThat(record.publishDate()).isEqualTo("2021-06-10");
        assertThat(record.status()).isEqualTo("现行有效");
        assertThat(record.content()).startsWith("（2021年6月10日").contains("第一条").doesNotContain("首页");
        assertThat(record.sourceUrl()).isEqualTo("http://flk.npc.gov.cn/detail2.html?id=1");
        assertThat(record.attributes()).containsEntry("pageTitle", "中华人民共和国数据安全法_中国人大网");
    }

    @Test
    void fallsBackToDocumentTitleAndBodyText() throws Exception {
        String html = "<html><head><title>Measures No. 12</title></head>"
            + "<body><p>Issued 2020-1-5. Repealed.</p></body></html>";

        RawRecord record = DetailPageParser.parse(html, "https://www.gov.cn/x");

        assertThat(record.title()).isEqualTo("Measures No. 12");
        assertThat(record.content()).isEqualTo("Issued 2020-1-5. Repealed.");
        assertThat(record.publishDate()).isEqualTo("2020-01-05");
        assertThat(record.status()).isEqualTo("repealed");
        assertThat(record.attributes()).doesNotContainKey("pageTitle");
    }

    @Test
    void recognisesBracketedIssuanceNumbers() {
        assertThat(DetailPageParser.documentNumber("国务院办公厅 国办发〔2021〕12号 关于")).isEqualTo("国办发〔2021〕12号");
        assertThat(DetailPageParser.documentNumber("Order No. 7 of the Ministry")).isEqualTo("No.7");
        assertThat(DetailPageParser.documentNumber("没有文号")).isNull();
    }

    @Test
    void emptyOrUntitledPagesFailParsing() {
        assertThatThrownBy(() -> DetailPageParser.parse("  ", "u"))
            .isInstanceOf(StrategyException.class)
            .extracting(e -> ((StrategyException) e).reasonCode())
            .isEqualTo(ReasonCodes.PARSING_FAILED);
        assertThatThrownBy(() -> DetailPageParser.parse("<html><body><p>x</p></body></html>", "u"))
            .isInstanceOf(StrategyException.class)
            .extracting(e -> ((StrategyException) e).reasonCode())
            .isEqualTo(ReasonCodes.PARSING_FAILED);
    }
}
