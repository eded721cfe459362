package tagsettings;

import lombok.Value;

import java.util.List;

@Value
public class ResolvedTags {

    List<EffectiveSettings> tags;
    DefaultRow defaults;
    boolean loaded;
}
