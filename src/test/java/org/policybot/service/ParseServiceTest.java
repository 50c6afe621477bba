package org.policybot.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.policybot.config.SyncProperties;

import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class ParseServiceTest {

    private ParseService parseService;

    @BeforeEach
    void setUp() {
        parseService = new ParseService(new SyncProperties());
    }

    @Test
    void shortTextBecomesSingleTrimmedChunk() {
        assertThat(parseService.chunk("  제1조 목적  ")).containsExactly("제1조 목적");
    }

    @Test
    void blankTextProducesNoChunks() {
        assertThat(parseService.chunk("   \n  ")).isEmpty();
        assertThat(parseService.chunk(null)).isEmpty();
    }

    @Test
    void textWithoutBoundariesIsHardCutWithOverlap() {
        String text = "a".repeat(1000);

        List<String> chunks = parseService.chunk(text, 800, 80);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0)).hasSize(800);
        // 第二块从 800 - 80 = 720 开始
        assertThat(chunks.get(1)).hasSize(280);
    }

    @Test
    void prefersParagraphBoundary() {
        String first = "x".repeat(500);
        String second = "y".repeat(500);
        String text = first + "\n\n" + second;

        List<String> chunks = parseService.chunk(text, 800, 80);

        assertThat(chunks.get(0)).isEqualTo(first);
        assertThat(chunks.get(chunks.size() - 1)).endsWith("y");
    }

    @Test
    void fallsBackToSentenceBoundary() {
        String sentence = "b".repeat(599) + ". ";
        String text = sentence + "c".repeat(600);

        List<String> chunks = parseService.chunk(text, 800, 80);

        assertThat(chunks.get(0)).endsWith(".");
        assertThat(chunks.get(0)).hasSize(600);
    }

    @Test
    void earlyHeadingBreakDoesNotProduceFragments() {
        String text = "# Title\n\n" + "w".repeat(1200);

        List<String> chunks = parseService.chunk(text, 800, 80);

        assertThat(chunks).hasSize(2);
        assertThat(chunks.get(0)).startsWith("# Title").hasSize(800);
        assertThat(chunks).noneMatch(c -> c.equals("itle") || c.equals("e"));
        assertThat(chunks.get(1)).endsWith("w");
    }

    @Test
    void everyChunkRespectsMaxSizeAndLoopTerminates() {
        StringBuilder sb = new StringBuilder();
        for (int i = 0; i < 200; i++) {
            sb.append("Article ").append(i).append(" applies to all employees.\n");
        }

        List<String> chunks = parseService.chunk(sb.toString(), 300, 50);

        assertThat(chunks).isNotEmpty();
        assertThat(chunks).allSatisfy(c -> assertThat(c.length()).isLessThanOrEqualTo(300));
        assertThat(chunks.get(chunks.size() - 1)).contains("Article 199");
    }

    @Test
    void rejectsOverlapNotSmallerThanSize() {
        assertThatThrownBy(() -> parseService.chunk("text", 100, 100))
                .isInstanceOf(IllegalArgumentException.class);
    }

    @Test
    void cleanTextNormalizesNewlinesAndSpaces() {
        String cleaned = parseService.cleanText("제1조\r\n\r\n\r\n\r\n목적   및\t범위  ");

        assertThat(cleaned).isEqualTo("제1조\n\n목적 및 범위");
    }

    @Test
    void extractTitleUsesFirstHeadingOrFileName() {
        assertThat(parseService.extractTitle("intro\n# 휴가 규정\n## 제1조", "leave.md")).isEqualTo("휴가 규정");
        assertThat(parseService.extractTitle("## only second level", "leave-policy.md")).isEqualTo("leave-policy");
    }
}
