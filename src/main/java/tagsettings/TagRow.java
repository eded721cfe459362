package tagsettings;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class TagRow {

    String tagName;
    String category;
    Boolean enabled;
    Boolean markersEnabled;
    TagDuration requiredSceneTagDuration;
    Double minMarkerDuration;
    Double maxGap;

    public String getNormalizedName() {
        return TagSettingsResolver.normalize(tagName);
    }
}
