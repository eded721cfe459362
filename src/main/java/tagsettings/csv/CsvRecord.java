package tagsettings.csv;

import lombok.Getter;
import lombok.ToString;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

@Getter
@ToString
public class CsvRecord {

    private final List<String> cells;
    private String raw;

    private CsvRecord(List<String> cells, String raw) {
        this.cells = cells;
        this.raw = raw;
    }

    static CsvRecord parsed(List<String> cells, String raw) {
        return new CsvRecord(new ArrayList<>(cells), raw);
    }

    public static CsvRecord created(List<String> cells) {
        return new CsvRecord(new ArrayList<>(cells), null);
    }

    public static CsvRecord blank(int width) {
        return created(Collections.nCopies(Math.max(width, 0), StringUtils.EMPTY));
    }

    public List<String> getCells() {
        return Collections.unmodifiableList(cells);
    }

    public int size() {
        return cells.size();
    }

    public String get(int index) {
        if (index < 0 || index >= cells.size()) {
            return StringUtils.EMPTY;
        }
        String value = cells.get(index);
        return value == null ? StringUtils.EMPTY : value;
    }

    public void set(int index, String value) {
        if (index < 0) {
            throw new IndexOutOfBoundsException("Negative column index: " + index);
        }
        while (cells.size() <= index) {
            cells.add(StringUtils.EMPTY);
        }
        cells.set(index, value == null ? StringUtils.EMPTY : value);
        raw = null;
    }

    public boolean isModified() {
        return raw == null;
    }

    public boolean isEmptyLine() {
        return raw != null && raw.isEmpty();
    }
}
