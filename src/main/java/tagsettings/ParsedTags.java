package tagsettings;

import lombok.Value;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Value
public class ParsedTags {

    public static final ParsedTags EMPTY = new ParsedTags(Collections.emptyList(), null);

    List<TagRow> rows;
    DefaultRow defaultRow;
    Map<String, TagRow> rowsByName;

    public ParsedTags(List<TagRow> rows, DefaultRow defaultRow) {
        this.rows = List.copyOf(rows);
        this.defaultRow = defaultRow;
        Map<String, TagRow> byName = new LinkedHashMap<>();
        // last line wins, first position kept
        for (TagRow row : this.rows) {
            byName.put(row.getNormalizedName(), row);
        }
        this.rowsByName = Collections.unmodifiableMap(byName);
    }

    public boolean hasDefaultRow() {
        return defaultRow != null;
    }

    public DefaultRow getDefaults() {
        return defaultRow == null ? DefaultRow.EMPTY : defaultRow;
    }

    public TagRow find(String normalizedName) {
        return rowsByName.get(normalizedName);
    }
}
