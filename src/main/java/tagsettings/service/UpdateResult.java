package tagsettings.service;

import lombok.Value;

@Value
public class UpdateResult {

    public static final String OK = "ok";

    String status;
    int updated;

    public static UpdateResult ok(int updated) {
        return new UpdateResult(OK, updated);
    }
}
