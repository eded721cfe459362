package tagsettings.service;

import lombok.Builder;
import lombok.Value;
import tagsettings.DefaultRow;

@Value
@Builder
public class TagDefaultsView {

    boolean enabled;
    boolean markersEnabled;
    String requiredSceneTagDuration;
    Double minMarkerDuration;
    Double maxGap;

    public static TagDefaultsView from(DefaultRow row) {
        return TagDefaultsView.builder()
                .enabled(row.getEnabled() == null || row.getEnabled())
                .markersEnabled(row.getMarkersEnabled() == null || row.getMarkersEnabled())
                .requiredSceneTagDuration(row.getRequiredSceneTagDuration() == null
                        ? null : row.getRequiredSceneTagDuration().format())
                .minMarkerDuration(row.getMinMarkerDuration())
                .maxGap(row.getMaxGap())
                .build();
    }
}
