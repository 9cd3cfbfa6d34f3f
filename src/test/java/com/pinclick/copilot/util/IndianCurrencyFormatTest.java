package com.pinclick.copilot.util;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class IndianCurrencyFormatTest {

    @Test
    void formatsCroresAndLakhs() {
        assertThat(IndianCurrencyFormat.format(10_000_000L)).isEqualTo("1Cr");
        assertThat(IndianCurrencyFormat.format(13_000_000L)).isEqualTo("1.3Cr");
        assertThat(IndianCurrencyFormat.format(12_500_000L)).isEqualTo("1.3Cr");
        assertThat(IndianCurrencyFormat.format(8_800_000L)).isEqualTo("88L");
        assertThat(IndianCurrencyFormat.format(8_850_000L)).isEqualTo("88.5L");
        assertThat(IndianCurrencyFormat.format(8_000_000L)).isEqualTo("80L");
    }

    @Test
    void parsesShorthandAndPlainAmounts() {
        assertThat(IndianCurrencyFormat.parse("1.2 Cr")).contains(12_000_000L);
        assertThat(IndianCurrencyFormat.parse("2 crores")).contains(20_000_000L);
        assertThat(IndianCurrencyFormat.parse("85 lakhs")).contains(8_500_000L);
        assertThat(IndianCurrencyFormat.parse("85L")).contains(8_500_000L);
        assertThat(IndianCurrencyFormat.parse("under 1,20,00,000")).contains(12_000_000L);
        assertThat(IndianCurrencyFormat.parse("no amount here")).isEmpty();
        assertThat(IndianCurrencyFormat.parse(null)).isEmpty();
    }
}
