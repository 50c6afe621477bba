package org.policybot.utils;

import org.junit.jupiter.api.Test;
import org.policybot.entity.Language;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.within;

class TextUtilsTest {

    @Test
    void detectsKoreanByHangulRatio() {
        assertThat(TextUtils.detectLanguage("연차 휴가는 입사일 기준으로 부여됩니다.", 1000, 0.1)).isEqualTo(Language.KO);
        assertThat(TextUtils.detectLanguage("Annual leave is granted on the hire date.", 1000, 0.1)).isEqualTo(Language.EN);
    }

    @Test
    void englishPathOverridesContent() {
        assertThat(TextUtils.detectLanguage("연차 휴가 규정", "policies/en/leave.md", 1000, 0.1)).isEqualTo(Language.EN);
        assertThat(TextUtils.detectLanguage("연차 휴가 규정", "policies/ko/leave.md", 1000, 0.1)).isEqualTo(Language.KO);
    }

    @Test
    void onlyPrefixIsSampled() {
        String text = "a".repeat(1000) + "한".repeat(1000);

        assertThat(TextUtils.detectLanguage(text, 1000, 0.1)).isEqualTo(Language.EN);
    }

    @Test
    void estimateTokensRoundsUp() {
        assertThat(TextUtils.estimateTokens(null)).isZero();
        assertThat(TextUtils.estimateTokens("")).isZero();
        assertThat(TextUtils.estimateTokens("abc")).isEqualTo(1);
        assertThat(TextUtils.estimateTokens("abcd")).isEqualTo(1);
        assertThat(TextUtils.estimateTokens("abcde")).isEqualTo(2);
    }

    @Test
    void truncateAppendsEllipsis() {
        assertThat(TextUtils.truncate("abcdef", 3)).isEqualTo("abc...");
        assertThat(TextUtils.truncate("abc", 3)).isEqualTo("abc");
    }

    @Test
    void jaccardIsCaseInsensitiveWordOverlap() {
        assertThat(TextUtils.jaccard("Leave Policy", "leave policy")).isEqualTo(1.0);
        assertThat(TextUtils.jaccard("a b", "b c")).isCloseTo(1.0 / 3, within(1e-9));
        assertThat(TextUtils.jaccard("", "")).isZero();
    }
}
