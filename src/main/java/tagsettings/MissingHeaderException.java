package tagsettings;

public class MissingHeaderException extends TagSettingsException {

    public MissingHeaderException(String message) {
        super(message);
    }
}
