package com.regdoc.acquirer.crawl.match;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;

class NameNormalizerTest {

    @Test
    void stripsCountryPrefixBracketsAndRevisionNote() {
        assertThat(NameNormalizer.normalize("《中华人民共和国消费者权益保护法》（2013年修正）"))
            .isEqualTo("消费者权益保护法");
        assertThat(NameNormalizer.normalize("The People's Republic of China  Consumer Protection Law (2013 Amendment)"))
            .isEqualTo("consumer protection law");
    }

    @Test
    void removesSpacesBetweenHanCharacters() {
        assertThat(NameNormalizer.normalize("数据 安全 法")).isEqualTo("数据安全法");
    }

    @Test
    void normalizeIsIdempotent() {
        List<String> inputs = List.of(
            "中华人民共和国中华人民共和国个人信息保护法",
            "《网络安全法》（2016年）（修订）",
            "  Regulations on the Protection of  Critical Information Infrastructure ",
            "【最高人民法院】关于审理劳动争议案件适用法律问题的解释（一）",
            "",
            "   "
        );
        for (String input : inputs) {
            String once = NameNormalizer.normalize(input);
            assertThat(NameNormalizer.normalize(once)).as(input).isEqualTo(once);
        }
    }

    @Test
    void nullBecomesEmpty() {
        assertThat(NameNormalizer.normalize(null)).isEmpty();
    }

    @Test
    void keywordsUseHanShinglesAndSkipStopwords() {
        assertThat(NameNormalizer.keywords("数据安全法")).containsExactly("数据", "据安", "安全", "全法");
        assertThat(NameNormalizer.keywords("law of the consumer protection")).containsExactly("consumer", "protection");
    }
}
