package tagsettings;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagDurationTest {

    @Test
    void parse_bareNumberIsSeconds() {
        var duration = TagDuration.parse("20");

        assertEquals(DurationUnit.SECONDS, duration.getUnit());
        assertEquals(new BigDecimal("20"), duration.getMagnitude());
    }

    @Test
    void parse_percentSuffix() {
        assertEquals(TagDuration.ofPercent(new BigDecimal("35")), TagDuration.parse("35%"));
        assertEquals(TagDuration.ofPercent(new BigDecimal("12.5")), TagDuration.parse(" 12.5 % "));
    }

    @Test
    void parse_acceptsSecondsSuffix() {
        var duration = TagDuration.parse("15s");

        assertEquals(TagDuration.ofSeconds(new BigDecimal("15")), duration);
        assertEquals("15", duration.format());
    }

    @Test
    void parse_blankIsAbsent() {
        assertNull(TagDuration.parse(null));
        assertNull(TagDuration.parse(""));
        assertNull(TagDuration.parse("   "));
    }

    @Test
    void parse_rejectsMalformedText() {
        for (String text : List.of("abc", "35%%", "%35", "1,5", "12 minutes", "--3")) {
            var e = assertThrows(MalformedValueException.class, () -> TagDuration.parse(text), text);
            assertEquals(text, e.getText());
        }
    }

    @Test
    void format_reproducesParsedText() {
        for (String text : List.of("15", "2.0", "35%", "-1.5", "0.25%", "100%", "0")) {
            assertEquals(text, TagDuration.parse(text).format());
        }
    }

    @Test
    void parse_reproducesFormattedValue() {
        var values = List.of(
                TagDuration.ofSeconds(new BigDecimal("7.50")),
                TagDuration.ofPercent(new BigDecimal("-3")),
                TagDuration.ofPercent(new BigDecimal("0.001")));
        for (TagDuration value : values) {
            assertEquals(value, TagDuration.parse(value.format()));
        }
    }

    @Test
    void parse_reproducesValuesWithNegativeScale() {
        var values = List.of(
                TagDuration.ofSeconds(new BigDecimal("1E+3")),
                TagDuration.ofPercent(new BigDecimal("20").stripTrailingZeros()),
                TagDuration.ofSeconds(new BigDecimal("100.0").stripTrailingZeros()));
        for (TagDuration value : values) {
            assertEquals(value, TagDuration.parse(value.format()));
        }
        assertEquals("1000", TagDuration.ofSeconds(new BigDecimal("1E+3")).format());
        assertEquals(TagDuration.ofPercent(new BigDecimal("20")),
                TagDuration.ofPercent(new BigDecimal("20").stripTrailingZeros()));
    }

    @Test
    void toSeconds_takesPercentOfReference() {
        assertEquals(30.0, TagDuration.parse("25%").toSeconds(120.0), 1e-9);
        assertEquals(20.0, TagDuration.parse("20").toSeconds(120.0), 1e-9);
        assertTrue(TagDuration.parse("25%").isPercent());
    }
}
