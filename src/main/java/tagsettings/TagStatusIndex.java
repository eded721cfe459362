package tagsettings;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

public final class TagStatusIndex {

    private final Map<String, Boolean> statuses;
    private final Set<String> enabledTags;
    private final boolean defaultEnabled;

    private TagStatusIndex(Map<String, Boolean> statuses, boolean defaultEnabled) {
        this.statuses = Collections.unmodifiableMap(statuses);
        Set<String> enabled = new LinkedHashSet<>();
        statuses.forEach((name, on) -> {
            if (on) {
                enabled.add(name);
            }
        });
        this.enabledTags = Collections.unmodifiableSet(enabled);
        this.defaultEnabled = defaultEnabled;
    }

    public static TagStatusIndex build(ParsedTags parsed, TagSettingsResolver resolver) {
        Map<String, Boolean> statuses = new LinkedHashMap<>();
        for (String name : parsed.getRowsByName().keySet()) {
            statuses.put(name, resolver.resolveEnabled(parsed, name));
        }
        Boolean inherited = parsed.getDefaults().getEnabled();
        return new TagStatusIndex(statuses, inherited == null || inherited);
    }

    public static TagStatusIndex empty() {
        return new TagStatusIndex(new LinkedHashMap<>(), true);
    }

    public Map<String, Boolean> asMap() {
        return statuses;
    }

    public Set<String> getEnabledTags() {
        return enabledTags;
    }

    public boolean isEnabled(String tagName) {
        Boolean status = statuses.get(TagSettingsResolver.normalize(tagName));
        return status != null ? status : defaultEnabled;
    }

    public int size() {
        return statuses.size();
    }
}
