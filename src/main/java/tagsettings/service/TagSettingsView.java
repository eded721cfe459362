package tagsettings.service;

import lombok.Builder;
import lombok.Value;
import tagsettings.EffectiveSettings;

@Value
@Builder
public class TagSettingsView {

    String tag;
    String name;
    String category;
    boolean enabled;
    boolean markersEnabled;
    String requiredSceneTagDuration;
    Double minMarkerDuration;
    Double maxGap;

    public static TagSettingsView from(EffectiveSettings settings) {
        return TagSettingsView.builder()
                .tag(settings.getName())
                .name(settings.getName())
                .category(settings.getCategory())
                .enabled(settings.isEnabled())
                .markersEnabled(settings.isMarkersEnabled())
                .requiredSceneTagDuration(settings.getRequiredSceneTagDuration() == null
                        ? null : settings.getRequiredSceneTagDuration().format())
                .minMarkerDuration(settings.getMinMarkerDuration())
                .maxGap(settings.getMaxGap())
                .build();
    }
}
