package tagsettings.service;

import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.util.List;

@Value
@Builder
public class ModelInfo {

    String name;
    String identifier;
    String version;
    @Singular
    List<String> categories;
    String type;
}
