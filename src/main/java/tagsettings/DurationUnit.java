package tagsettings;

public enum DurationUnit {
    SECONDS,
    PERCENT
}
