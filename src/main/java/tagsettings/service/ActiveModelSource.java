package tagsettings.service;

import java.util.List;

@FunctionalInterface
public interface ActiveModelSource {

    ActiveModelSource NONE = List::of;

    List<ModelInfo> getActiveModels();
}
