package tagsettings;

import lombok.Builder;
import lombok.Value;

@Value
@Builder(toBuilder = true)
public class EffectiveSettings {

    String tag;
    String name;
    String category;
    boolean enabled;
    boolean markersEnabled;
    TagDuration requiredSceneTagDuration;
    Double minMarkerDuration;
    Double maxGap;
}
