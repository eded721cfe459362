package tagsettings.service;

import lombok.Builder;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class AvailableTags {

    List<TagSettingsView> tags;
    List<ModelInfo> models;
    List<String> loadedCategories;
    TagDefaultsView defaults;
    String error;
}
