package com.querybim.classify;

import com.querybim.classify.service.MatchTextFormatter;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class MatchTextFormatterTest {

    @Test
    void testFormatsCodeTitleAndScore() {
        assertThat(MatchTextFormatter.format("C10", "Doors", 0.873)).isEqualTo("C10:Doors:0.87");
    }

    @Test
    void testScoreAlwaysHasTwoDecimals() {
        assertThat(MatchTextFormatter.formatScore(1)).isEqualTo("1.00");
        assertThat(MatchTextFormatter.formatScore(0.5)).isEqualTo("0.50");
        assertThat(MatchTextFormatter.formatScore(0.999)).isEqualTo("1.00");
    }

    @Test
    void testRoundingUsesExactBinaryValue() {
        // 1.005 is stored as 1.00499999999999989...
        assertThat(MatchTextFormatter.formatScore(1.005)).isEqualTo("1.00");
        assertThat(MatchTextFormatter.formatScore(0.125)).isEqualTo("0.13");
    }

    @Test
    void testNegativeSimilarityIsPassedThrough() {
        assertThat(MatchTextFormatter.format("Pr_20", "Pipes", -0.426)).isEqualTo("Pr_20:Pipes:-0.43");
    }

    @Test
    void testSmallNegativeScoreKeepsSign() {
        assertThat(MatchTextFormatter.formatScore(-0.004)).isEqualTo("-0.00");
        assertThat(MatchTextFormatter.formatScore(-0.005)).isEqualTo("-0.01");
        assertThat(MatchTextFormatter.formatScore(-0.0)).isEqualTo("0.00");
    }

    @Test
    void testTinyScoresUsePlainNotation() {
        assertThat(MatchTextFormatter.formatScore(1.0E-7)).isEqualTo("0.00");
    }

    @Test
    void testMissingCodeOrTitleRendersEmpty() {
        assertThat(MatchTextFormatter.format(null, null, 0.4)).isEqualTo("::0.40");
    }

    @Test
    void testTitleMayContainSeparator() {
        assertThat(MatchTextFormatter.format("Ss_25", "Walls: external", 0.71)).isEqualTo("Ss_25:Walls: external:0.71");
    }
}
