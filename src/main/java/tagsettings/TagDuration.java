package tagsettings;

import lombok.NonNull;
import lombok.Value;
import org.apache.commons.lang3.StringUtils;

import java.math.BigDecimal;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

@Value
public class TagDuration {

    private static final Pattern DURATION_PATTERN =
            Pattern.compile("^([+-]?(?:\\d+(?:\\.\\d*)?|\\.\\d+))\\s*(%|[sS])?$");

    BigDecimal magnitude;
    DurationUnit unit;

    private TagDuration(@NonNull BigDecimal magnitude, @NonNull DurationUnit unit) {
        // 2E+1 and 20 format the same, so they must be the same value
        this.magnitude = magnitude.scale() < 0 ? magnitude.setScale(0) : magnitude;
        this.unit = unit;
    }

    public static TagDuration ofSeconds(BigDecimal magnitude) {
        return new TagDuration(magnitude, DurationUnit.SECONDS);
    }

    public static TagDuration ofPercent(BigDecimal magnitude) {
        return new TagDuration(magnitude, DurationUnit.PERCENT);
    }

    public static TagDuration parse(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        Matcher matcher = DURATION_PATTERN.matcher(text.trim());
        if (!matcher.matches()) {
            throw new MalformedValueException("Not a duration", text);
        }
        BigDecimal magnitude = new BigDecimal(matcher.group(1));
        boolean percent = "%".equals(matcher.group(2));
        return new TagDuration(magnitude, percent ? DurationUnit.PERCENT : DurationUnit.SECONDS);
    }

    public boolean isPercent() {
        return unit == DurationUnit.PERCENT;
    }

    public double toSeconds(double referenceSeconds) {
        if (isPercent()) {
            return magnitude.doubleValue() * referenceSeconds / 100.0;
        }
        return magnitude.doubleValue();
    }

    public String format() {
        String number = magnitude.toPlainString();
        return isPercent() ? number + "%" : number;
    }

    @Override
    public String toString() {
        return format();
    }
}
