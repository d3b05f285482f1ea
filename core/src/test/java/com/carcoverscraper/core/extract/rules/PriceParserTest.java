package com.carcoverscraper.core.extract.rules;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;

import static org.assertj.core.api.Assertions.assertThat;

class PriceParserTest {

    @Test
    void rupeeWithThousandsSeparator() {
        assertThat(PriceParser.parse("₹ 1,499")).contains(new BigDecimal("1499"));
        assertThat(PriceParser.parse("Rs. 2,500")).contains(new BigDecimal("2500"));
        assertThat(PriceParser.parse("₹ 1,00,000")).contains(new BigDecimal("100000"));
    }

    @Test
    void plainAndDecimalAmounts() {
        assertThat(PriceParser.parse("799")).contains(new BigDecimal("799"));
        assertThat(PriceParser.parse("1499.50 only")).contains(new BigDecimal("1499.50"));
    }

    @Test
    void noNumber_isEmpty() {
        assertThat(PriceParser.parse("Price on request")).isEmpty();
        assertThat(PriceParser.parse("")).isEmpty();
        assertThat(PriceParser.parse(null)).isEmpty();
    }

    @Test
    void tooManyIntegerDigits_isEmpty() {
        assertThat(PriceParser.parse("9999999999999999")).contains(new BigDecimal("9999999999999999"));
        assertThat(PriceParser.parse("Call 99999999999999999")).isEmpty();
    }
}
