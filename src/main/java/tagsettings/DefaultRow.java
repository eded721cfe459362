package tagsettings;

import lombok.Builder;
import lombok.Value;

@Value
@Builder
public class DefaultRow {

    public static final DefaultRow EMPTY = DefaultRow.builder().build();

    Boolean enabled;
    Boolean markersEnabled;
    TagDuration requiredSceneTagDuration;
    Double minMarkerDuration;
    Double maxGap;
}
