package com.carcoverscraper.core.extract.rules;

import com.carcoverscraper.core.model.Size;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;
import org.junit.jupiter.params.provider.ValueSource;
import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SizeParserTest {

    @ParameterizedTest(name = "{0} → {1}x{2}")
    @CsvSource(delimiter = '|', value = {
            "Car cover 450x190cm             | 450 | 190",
            "size: 450 x 190 cm              | 450 | 190",
            "450cm x 190cm                   | 450 | 190",
            "450 × 190                       | 450 | 190",
            "4.5m x 1.9m                     | 450 | 190",
            "4500 x 1900 mm                  | 450 | 190",
            "480X185 CM for Creta            | 480 | 185",
            "LxWxH 430x170x150cm             | 430 | 170",
            "Size 450x190cm.                 | 450 | 190",
    })
    void parsesAndNormalizesToCentimeters(String text, int w, int h) {
        assertThat(SizeParser.parse(text)).contains(new Size(w, h));
    }

    @ParameterizedTest
    @ValueSource(strings = {
            "no size here",
            "4x4 off-roader",
            "1x1",
            "99999x100",
            "",
    })
    void absentOrImplausible_isEmpty(String text) {
        assertThat(SizeParser.parse(text)).isEmpty();
    }

    @Test
    void implausibleMatch_isSkipped_inFavourOfLaterOne() {
        assertThat(SizeParser.parse("4x4 SUV cover 450x190cm")).contains(new Size(450, 190));
    }

    @Test
    void unitWordAfterNumber_isNotMistakenForMeters() {
        // "190 mirror": m 뒤에 글자가 이어지므로 단위가 아님 → cm
        assertThat(SizeParser.parse("450x190 mirror pockets")).contains(new Size(450, 190));
    }

    @Test
    void nullInput_isEmpty() {
        assertThat(SizeParser.parse(null)).isEmpty();
        assertThat(new SizeParser().apply("300x150")).contains(new Size(300, 150));
    }
}
