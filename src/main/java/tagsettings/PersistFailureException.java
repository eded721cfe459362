package tagsettings;

public class PersistFailureException extends TagSettingsException {

    public PersistFailureException(String message, Throwable cause) {
        super(message, cause);
    }
}
