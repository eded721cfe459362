package tagsettings;

import org.apache.commons.lang3.StringUtils;

import java.util.Locale;
import java.util.Set;

public final class BooleanTokens {

    public static final String TRUE = "TRUE";
    public static final String FALSE = "FALSE";

    private static final Set<String> TRUE_TOKENS = Set.of("1", "true", "yes", "on");
    private static final Set<String> FALSE_TOKENS = Set.of("0", "false", "no", "off");

    private BooleanTokens() {
    }

    public static Boolean parse(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        String token = text.trim().toLowerCase(Locale.ROOT);
        if (TRUE_TOKENS.contains(token)) {
            return Boolean.TRUE;
        }
        if (FALSE_TOKENS.contains(token)) {
            return Boolean.FALSE;
        }
        return null;
    }

    public static boolean parse(String text, boolean defaultValue) {
        Boolean value = parse(text);
        return value == null ? defaultValue : value;
    }

    public static boolean isRecognized(String text) {
        return parse(text) != null;
    }

    public static String format(boolean value) {
        return value ? TRUE : FALSE;
    }
}
