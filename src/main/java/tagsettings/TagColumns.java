package tagsettings;

public final class TagColumns {

    public static final String TAG_NAME = "tag_name";
    public static final String TAG_NAME_LEGACY = "tag";
    public static final String CATEGORY = "category";
    public static final String ENABLED = "enabled";
    public static final String MARKERS_ENABLED = "markers_enabled";
    public static final String REQUIRED_SCENE_TAG_DURATION = "RequiredSceneTagDuration";
    public static final String REQUIRED_SCENE_TAG_DURATION_ALIAS = "required_scene_tag_duration";
    public static final String MIN_MARKER_DURATION = "min_marker_duration";
    public static final String MAX_GAP = "max_gap";

    public static final String DEFAULT_ROW_NAME = "__default__";

    private TagColumns() {
    }
}
