package tagsettings;

import lombok.Getter;

@Getter
public class MalformedValueException extends TagSettingsException {

    private final String text;

    public MalformedValueException(String message, String text) {
        super(message + ": '" + text + "'");
        this.text = text;
    }
}
