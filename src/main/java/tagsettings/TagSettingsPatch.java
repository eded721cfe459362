package tagsettings;

import lombok.Builder;
import lombok.NonNull;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.util.Map;

@Value
@Builder(toBuilder = true)
public class TagSettingsPatch {

    public static final String ENABLED = "enabled";
    public static final String MARKERS_ENABLED = "markers_enabled";
    public static final String REQUIRED_SCENE_TAG_DURATION = "required_scene_tag_duration";
    public static final String MIN_MARKER_DURATION = "min_marker_duration";
    public static final String MAX_GAP = "max_gap";
    public static final String CATEGORY = "category";

    @NonNull
    @Builder.Default
    PatchField<Boolean> enabled = PatchField.absent();
    @NonNull
    @Builder.Default
    PatchField<Boolean> markersEnabled = PatchField.absent();
    @NonNull
    @Builder.Default
    PatchField<TagDuration> requiredSceneTagDuration = PatchField.absent();
    @NonNull
    @Builder.Default
    PatchField<Double> minMarkerDuration = PatchField.absent();
    @NonNull
    @Builder.Default
    PatchField<Double> maxGap = PatchField.absent();
    @NonNull
    @Builder.Default
    PatchField<String> category = PatchField.absent();

    public static TagSettingsPatch enabledOnly(Boolean enabled) {
        return TagSettingsPatch.builder().enabled(PatchField.set(enabled)).build();
    }

    /**
     * Builds a patch from a loosely typed map such as a decoded JSON body. A key that is missing leaves the field
     * alone; a key mapped to {@code null} or blank text clears it.
     *
     * @throws MalformedValueException when a value cannot be read as the field's type
     */
    public static TagSettingsPatch fromMap(Map<String, ?> values) {
        TagSettingsPatchBuilder builder = TagSettingsPatch.builder();
        if (values == null) {
            return builder.build();
        }
        if (values.containsKey(ENABLED)) {
            builder.enabled(PatchField.set(toBoolean(values.get(ENABLED))));
        }
        if (values.containsKey(MARKERS_ENABLED)) {
            builder.markersEnabled(PatchField.set(toBoolean(values.get(MARKERS_ENABLED))));
        }
        if (values.containsKey(REQUIRED_SCENE_TAG_DURATION)) {
            builder.requiredSceneTagDuration(PatchField.set(toDuration(values.get(REQUIRED_SCENE_TAG_DURATION))));
        }
        if (values.containsKey(MIN_MARKER_DURATION)) {
            builder.minMarkerDuration(PatchField.set(toNumber(values.get(MIN_MARKER_DURATION))));
        }
        if (values.containsKey(MAX_GAP)) {
            builder.maxGap(PatchField.set(toNumber(values.get(MAX_GAP))));
        }
        if (values.containsKey(CATEGORY)) {
            Object category = values.get(CATEGORY);
            builder.category(PatchField.set(category == null ? null : StringUtils.trimToNull(category.toString())));
        }
        return builder.build();
    }

    public boolean isEmpty() {
        return !enabled.isPresent()
                && !markersEnabled.isPresent()
                && !requiredSceneTagDuration.isPresent()
                && !minMarkerDuration.isPresent()
                && !maxGap.isPresent()
                && !category.isPresent();
    }

    private static Boolean toBoolean(Object value) {
        if (value == null || value instanceof Boolean) {
            return (Boolean) value;
        }
        if (value instanceof Number) {
            return ((Number) value).doubleValue() != 0;
        }
        String text = value.toString();
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Boolean parsed = BooleanTokens.parse(text);
        if (parsed == null) {
            throw new MalformedValueException("Not a boolean", text);
        }
        return parsed;
    }

    private static TagDuration toDuration(Object value) {
        if (value == null || value instanceof TagDuration) {
            return (TagDuration) value;
        }
        return TagDuration.parse(value.toString());
    }

    private static Double toNumber(Object value) {
        if (value == null) {
            return null;
        }
        if (value instanceof Number) {
            double number = ((Number) value).doubleValue();
            if (!Double.isFinite(number)) {
                throw new MalformedValueException("Not a finite number", value.toString());
            }
            return number;
        }
        return TagRowParser.parseNumber(value.toString());
    }
}
