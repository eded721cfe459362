package tagsettings;

import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

public class TagSettingsResolver {

    private static final boolean DEFAULT_ENABLED = true;
    private static final boolean DEFAULT_MARKERS_ENABLED = true;

    private final String fallbackCategory;

    public TagSettingsResolver() {
        this(TagSettingsConfig.defaults());
    }

    public TagSettingsResolver(TagSettingsConfig config) {
        this.fallbackCategory = config.getFallbackCategory();
    }

    public static String normalize(String tagName) {
        return StringUtils.trimToEmpty(tagName).toLowerCase(Locale.ROOT);
    }

    public EffectiveSettings resolve(ParsedTags parsed, String tagName) {
        String key = normalize(tagName);
        TagRow row = parsed.find(key);
        DefaultRow defaults = parsed.getDefaults();
        if (row == null) {
            return fromDefaults(key, defaults);
        }
        return EffectiveSettings.builder()
                .tag(key)
                .name(row.getTagName())
                .category(StringUtils.isBlank(row.getCategory()) ? fallbackCategory : row.getCategory())
                .enabled(flag(row.getEnabled(), defaults.getEnabled(), DEFAULT_ENABLED))
                .markersEnabled(flag(row.getMarkersEnabled(), defaults.getMarkersEnabled(), DEFAULT_MARKERS_ENABLED))
                .requiredSceneTagDuration(firstPresent(row.getRequiredSceneTagDuration(),
                        defaults.getRequiredSceneTagDuration()))
                .minMarkerDuration(firstPresent(row.getMinMarkerDuration(), defaults.getMinMarkerDuration()))
                .maxGap(firstPresent(row.getMaxGap(), defaults.getMaxGap()))
                .build();
    }

    public List<EffectiveSettings> resolveAll(ParsedTags parsed) {
        List<EffectiveSettings> result = new ArrayList<>(parsed.getRowsByName().size());
        for (String key : parsed.getRowsByName().keySet()) {
            result.add(resolve(parsed, key));
        }
        return result;
    }

    public boolean resolveEnabled(ParsedTags parsed, String tagName) {
        TagRow row = parsed.find(normalize(tagName));
        return flag(row == null ? null : row.getEnabled(), parsed.getDefaults().getEnabled(), DEFAULT_ENABLED);
    }

    private EffectiveSettings fromDefaults(String key, DefaultRow defaults) {
        return EffectiveSettings.builder()
                .tag(key)
                .name(key)
                .category(fallbackCategory)
                .enabled(flag(null, defaults.getEnabled(), DEFAULT_ENABLED))
                .markersEnabled(flag(null, defaults.getMarkersEnabled(), DEFAULT_MARKERS_ENABLED))
                .requiredSceneTagDuration(defaults.getRequiredSceneTagDuration())
                .minMarkerDuration(defaults.getMinMarkerDuration())
                .maxGap(defaults.getMaxGap())
                .build();
    }

    private static boolean flag(Boolean own, Boolean inherited, boolean fallback) {
        if (own != null) {
            return own;
        }
        return inherited != null ? inherited : fallback;
    }

    private static <T> T firstPresent(T own, T inherited) {
        return own != null ? own : inherited;
    }
}
