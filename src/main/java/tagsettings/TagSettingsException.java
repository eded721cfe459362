package tagsettings;

public class TagSettingsException extends RuntimeException {

    public TagSettingsException(String message) {
        super(message);
    }

    public TagSettingsException(String message, Throwable cause) {
        super(message, cause);
    }
}
