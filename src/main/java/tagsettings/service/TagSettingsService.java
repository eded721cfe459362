package tagsettings.service;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tagsettings.EffectiveSettings;
import tagsettings.ResolvedTags;
import tagsettings.TagSettingsPatch;
import tagsettings.TagSettingsResolver;
import tagsettings.TagSettingsStore;

import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class TagSettingsService {

    private static final Logger log = LoggerFactory.getLogger(TagSettingsService.class);

    private final TagSettingsStore store;
    private final ActiveModelSource modelSource;

    public TagSettingsService(TagSettingsStore store) {
        this(store, ActiveModelSource.NONE);
    }

    public TagSettingsService(TagSettingsStore store, ActiveModelSource modelSource) {
        this.store = store;
        this.modelSource = modelSource;
    }

    public AvailableTags getAvailableTagsData(boolean includeDisabled) {
        ResolvedTags resolved = store.resolveAllWithDefaults(includeDisabled);
        List<TagSettingsView> tags = new ArrayList<>();
        for (EffectiveSettings settings : resolved.getTags()) {
            tags.add(TagSettingsView.from(settings));
        }
        TagDefaultsView defaults = TagDefaultsView.from(resolved.getDefaults());
        if (!resolved.isLoaded()) {
            return AvailableTags.builder()
                    .tags(Collections.emptyList())
                    .models(Collections.emptyList())
                    .loadedCategories(Collections.emptyList())
                    .defaults(defaults)
                    .error("Tag settings file is not available: " + store.getSource())
                    .build();
        }

        List<ModelInfo> models = new ArrayList<>();
        Set<String> loadedCategories = new LinkedHashSet<>();
        try {
            for (ModelInfo model : modelSource.getActiveModels()) {
                models.add(model);
                if (model.getCategories() != null) {
                    loadedCategories.addAll(model.getCategories());
                }
            }
        } catch (RuntimeException e) {
            log.warn("Failed to fetch active models, showing all tags: {}", e.toString());
            models.clear();
            loadedCategories.clear();
        }

        return AvailableTags.builder()
                .tags(tags)
                .models(models)
                .loadedCategories(new ArrayList<>(loadedCategories))
                .defaults(defaults)
                .build();
    }

    public List<String> getAvailableTagNames(boolean includeDisabled) {
        List<String> names = new ArrayList<>();
        for (EffectiveSettings settings : store.resolveAll(includeDisabled)) {
            names.add(settings.getName());
        }
        return names;
    }

    public Map<String, Boolean> getAllTagStatuses() {
        return store.getAllTagStatuses();
    }

    public List<String> getEnabledTagsList() {
        return new ArrayList<>(store.getEnabledTags());
    }

    /**
     * Either applies {@code tagStatuses} as given, or, when it is {@code null}, starts from the current statuses,
     * enables {@code enabledTags} and then disables {@code disabledTags}. A tag in both lists ends up disabled.
     */
    public UpdateResult updateTagEnabledStatus(Map<String, Boolean> tagStatuses,
                                               Collection<String> enabledTags,
                                               Collection<String> disabledTags) {
        if (tagStatuses != null) {
            store.updateTagEnabledStatus(tagStatuses);
            return UpdateResult.ok(tagStatuses.size());
        }

        Map<String, Boolean> merged = new LinkedHashMap<>(store.getAllTagStatuses());
        if (enabledTags != null) {
            for (String tag : enabledTags) {
                merged.put(TagSettingsResolver.normalize(tag), Boolean.TRUE);
            }
        }
        if (disabledTags != null) {
            for (String tag : disabledTags) {
                merged.put(TagSettingsResolver.normalize(tag), Boolean.FALSE);
            }
        }
        store.updateTagEnabledStatus(merged);
        return UpdateResult.ok(merged.size());
    }

    public UpdateResult updateTagSettings(Map<String, TagSettingsPatch> tagSettings) {
        store.updateTagSettings(tagSettings);
        return UpdateResult.ok(tagSettings == null ? 0 : tagSettings.size());
    }

    public UpdateResult updateTagSettingsFromPayload(Map<String, ? extends Map<String, ?>> payload) {
        Map<String, TagSettingsPatch> patches = new LinkedHashMap<>();
        if (payload != null) {
            payload.forEach((tag, values) -> patches.put(tag, TagSettingsPatch.fromMap(values)));
        }
        return updateTagSettings(patches);
    }
}
