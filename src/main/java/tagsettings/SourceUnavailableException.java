package tagsettings;

import lombok.Getter;

import java.nio.file.Path;

@Getter
public class SourceUnavailableException extends TagSettingsException {

    private final Path source;

    public SourceUnavailableException(Path source, String message) {
        super(message + ": " + source);
        this.source = source;
    }

    public SourceUnavailableException(Path source, String message, Throwable cause) {
        super(message + ": " + source, cause);
        this.source = source;
    }
}
