package tagsettings.service;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import tagsettings.DefaultRow;
import tagsettings.MalformedValueException;
import tagsettings.TagSettingsStore;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class TagSettingsServiceTest {

    private static final String BASIC = "src/test/resources/tag_settings/basic.csv";

    private static final ModelInfo SCENES = ModelInfo.builder()
            .name("scenes").identifier("scenes-v2").version("2.0").type("image")
            .category("Location").category("Camera")
            .build();
    private static final ModelInfo PEOPLE = ModelInfo.builder()
            .name("people").identifier("people-v1").version("1.1").type("video")
            .category("Camera").category("People")
            .build();

    @TempDir
    Path tempDir;

    private Path file;
    private String original;
    private TagSettingsStore store;

    @BeforeEach
    void setUp() throws Exception {
        file = tempDir.resolve("tag_settings.csv");
        Files.copy(Paths.get(BASIC), file);
        original = Files.readString(file);
        store = new TagSettingsStore(file);
    }

    @Test
    void getAvailableTagsData_reportsTagsModelsAndDefaults() {
        var service = new TagSettingsService(store, () -> List.of(SCENES, PEOPLE));

        var data = service.getAvailableTagsData(true);

        assertNull(data.getError());
        assertEquals(List.of("Outdoor", "Indoor", "Portrait", "Close Up"),
                data.getTags().stream().map(TagSettingsView::getName).collect(Collectors.toList()));
        assertEquals(List.of(SCENES, PEOPLE), data.getModels());
        assertEquals(List.of("Location", "Camera", "People"), data.getLoadedCategories());

        var portrait = data.getTags().get(2);
        assertEquals("Portrait", portrait.getTag());
        assertEquals("Other", portrait.getCategory());
        assertEquals("10%", portrait.getRequiredSceneTagDuration());
        assertEquals(3.0, portrait.getMaxGap());
        assertEquals(2.0, portrait.getMinMarkerDuration());

        var defaults = data.getDefaults();
        assertTrue(defaults.isEnabled());
        assertEquals("35%", defaults.getRequiredSceneTagDuration());
        assertEquals(5.0, defaults.getMaxGap());
    }

    @Test
    void getAvailableTagsData_canLeaveOutDisabledTags() {
        var service = new TagSettingsService(store);

        var data = service.getAvailableTagsData(false);

        assertEquals(List.of("Outdoor", "Portrait"),
                data.getTags().stream().map(TagSettingsView::getName).collect(Collectors.toList()));
        assertTrue(data.getModels().isEmpty());
    }

    @Test
    void getAvailableTagsData_modelFailureStillListsTags() {
        var service = new TagSettingsService(store, () -> {
            throw new IllegalStateException("backend down");
        });

        var data = service.getAvailableTagsData(true);

        assertNull(data.getError());
        assertEquals(4, data.getTags().size());
        assertTrue(data.getModels().isEmpty());
        assertTrue(data.getLoadedCategories().isEmpty());
    }

    @Test
    void getAvailableTagsData_reportsMissingFile() {
        var missing = tempDir.resolve("missing.csv");
        var service = new TagSettingsService(new TagSettingsStore(missing), () -> List.of(SCENES));

        var data = service.getAvailableTagsData(true);

        assertTrue(data.getError().contains(missing.toString()));
        assertTrue(data.getTags().isEmpty());
        assertTrue(data.getModels().isEmpty());
        assertTrue(data.getDefaults().isEnabled());
        assertNull(data.getDefaults().getMaxGap());
    }

    @Test
    void listsNamesStatusesAndEnabledTags() {
        var service = new TagSettingsService(store);

        assertEquals(List.of("Outdoor", "Indoor", "Portrait", "Close Up"), service.getAvailableTagNames(true));
        assertEquals(List.of("Outdoor", "Portrait"), service.getAvailableTagNames(false));
        assertEquals(List.of("outdoor", "portrait"), service.getEnabledTagsList());
        assertEquals(Boolean.FALSE, service.getAllTagStatuses().get("indoor"));
    }

    @Test
    void updateTagEnabledStatus_disableListWins() {
        var service = new TagSettingsService(store);

        var result = service.updateTagEnabledStatus(null, List.of("Indoor", "Close Up"), List.of(" close up "));

        assertEquals(UpdateResult.OK, result.getStatus());
        assertEquals(4, result.getUpdated());
        assertTrue(store.isTagEnabled("indoor"));
        assertFalse(store.isTagEnabled("close up"));
        assertEquals(List.of("outdoor", "indoor", "portrait"), service.getEnabledTagsList());
    }

    @Test
    void updateTagEnabledStatus_explicitMapTakesPriority() {
        var service = new TagSettingsService(store);

        var result = service.updateTagEnabledStatus(Map.of("portrait", false), List.of("portrait"), null);

        assertEquals(1, result.getUpdated());
        assertFalse(store.isTagEnabled("portrait"));
    }

    @Test
    void updateTagSettingsFromPayload_writesTypedValues() throws Exception {
        var service = new TagSettingsService(store);

        var result = service.updateTagSettingsFromPayload(
                Map.of("Outdoor", Map.of("max_gap", "7", "enabled", "no")));

        assertEquals(1, result.getUpdated());
        assertTrue(Files.readString(file).contains("Outdoor,Location,FALSE,,,,7.0,\n"));
        var outdoor = store.resolve("outdoor");
        assertFalse(outdoor.isEnabled());
        assertEquals(7.0, outdoor.getMaxGap());
    }

    @Test
    void updateTagSettingsFromPayload_nullClearsField() {
        var service = new TagSettingsService(store);
        Map<String, Object> values = new HashMap<>();
        values.put("min_marker_duration", null);

        service.updateTagSettingsFromPayload(Map.of("Indoor", values));

        assertEquals(2.0, store.resolve("indoor").getMinMarkerDuration());
    }

    @Test
    void updateTagSettingsFromPayload_malformedValueWritesNothing() throws Exception {
        var service = new TagSettingsService(store);

        assertThrows(MalformedValueException.class, () -> service.updateTagSettingsFromPayload(Map.of(
                "Outdoor", Map.of("enabled", "no"),
                "Indoor", Map.of("required_scene_tag_duration", "soon"))));

        assertEquals(original, Files.readString(file));
    }

    @Test
    void getAvailableTagsData_takesTagsAndDefaultsFromOneRead() {
        var singleRead = new TagSettingsStore(file) {
            @Override
            public DefaultRow getDefaults() {
                throw new AssertionError("defaults read separately from tags");
            }

            @Override
            public boolean isLoaded() {
                throw new AssertionError("load state read separately from tags");
            }
        };
        var service = new TagSettingsService(singleRead);

        var data = service.getAvailableTagsData(true);

        assertNull(data.getError());
        assertEquals(4, data.getTags().size());
        assertEquals("35%", data.getDefaults().getRequiredSceneTagDuration());
    }
}
