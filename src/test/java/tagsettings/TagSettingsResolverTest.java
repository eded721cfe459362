package tagsettings;

import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.nio.file.Files;
import java.nio.file.Paths;
import java.util.List;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagSettingsResolverTest {

    private static final String BASIC = "src/test/resources/tag_settings/basic.csv";
    private static final String NO_DEFAULT = "src/test/resources/tag_settings/no_default.csv";

    private final TagRowParser parser = new TagRowParser();
    private final TagSettingsResolver resolver = new TagSettingsResolver();

    private ParsedTags parse(String path) throws Exception {
        return parser.parse(Files.readString(Paths.get(path)));
    }

    @Test
    void resolve_inheritsThresholdsFromDefaultRow() throws Exception {
        var outdoor = resolver.resolve(parse(BASIC), "Outdoor");

        assertEquals("outdoor", outdoor.getTag());
        assertEquals("Outdoor", outdoor.getName());
        assertEquals("Location", outdoor.getCategory());
        assertTrue(outdoor.isEnabled());
        assertTrue(outdoor.isMarkersEnabled());
        assertEquals(2.0, outdoor.getMinMarkerDuration());
        assertEquals(5.0, outdoor.getMaxGap());
        assertEquals(TagDuration.ofPercent(new BigDecimal("35")), outdoor.getRequiredSceneTagDuration());
    }

    @Test
    void resolve_ownValuesWin() throws Exception {
        var indoor = resolver.resolve(parse(BASIC), "  INDOOR ");

        assertFalse(indoor.isEnabled());
        assertFalse(indoor.isMarkersEnabled());
        assertEquals(TagDuration.ofSeconds(new BigDecimal("20")), indoor.getRequiredSceneTagDuration());
        assertEquals(1.5, indoor.getMinMarkerDuration());
        assertEquals(5.0, indoor.getMaxGap());
    }

    @Test
    void resolve_readsAlternativeBooleanSpellings() throws Exception {
        var parsed = parse(BASIC);

        assertTrue(resolver.resolve(parsed, "portrait").isEnabled());
        assertFalse(resolver.resolve(parsed, "close up").isEnabled());
    }

    @Test
    void resolve_blankCategoryUsesFallback() throws Exception {
        var parsed = parse(BASIC);

        assertEquals("Other", resolver.resolve(parsed, "Portrait").getCategory());

        var custom = new TagSettingsResolver(TagSettingsConfig.builder().fallbackCategory("Misc").build());
        assertEquals("Misc", custom.resolve(parsed, "Portrait").getCategory());
        assertEquals("Camera", custom.resolve(parsed, "Close Up").getCategory());
    }

    @Test
    void resolve_unknownTagUsesDefaultRowOnly() throws Exception {
        var unknown = resolver.resolve(parse(BASIC), " Mountain ");

        assertEquals("mountain", unknown.getTag());
        assertEquals("mountain", unknown.getName());
        assertEquals("Other", unknown.getCategory());
        assertTrue(unknown.isEnabled());
        assertEquals(2.0, unknown.getMinMarkerDuration());
        assertEquals(TagDuration.ofPercent(new BigDecimal("35")), unknown.getRequiredSceneTagDuration());
    }

    @Test
    void resolve_withoutDefaultRowFlagsAreOnAndThresholdsAbsent() throws Exception {
        var parsed = parse(NO_DEFAULT);

        var outdoor = resolver.resolve(parsed, "outdoor");
        assertTrue(outdoor.isEnabled());
        assertTrue(outdoor.isMarkersEnabled());
        assertNull(outdoor.getRequiredSceneTagDuration());
        assertNull(outdoor.getMinMarkerDuration());
        assertNull(outdoor.getMaxGap());

        assertFalse(resolver.resolve(parsed, "night").isEnabled());
        assertTrue(resolver.resolve(parsed, "anything").isEnabled());
    }

    @Test
    void resolveAll_keepsFileOrder() throws Exception {
        var names = resolver.resolveAll(parse(BASIC)).stream()
                .map(EffectiveSettings::getTag)
                .collect(Collectors.toList());

        assertEquals(List.of("outdoor", "indoor", "portrait", "close up"), names);
    }

    @Test
    void normalize_trimsAndLowerCases() {
        assertEquals("close up", TagSettingsResolver.normalize("  Close Up "));
        assertEquals("", TagSettingsResolver.normalize(null));
    }
}
