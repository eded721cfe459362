package tagsettings;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tagsettings.csv.CsvRecord;
import tagsettings.csv.CsvTable;
import tagsettings.csv.FlatCsv;
import tagsettings.csv.FlatTableService;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class TagRowParser {

    private static final Logger log = LoggerFactory.getLogger(TagRowParser.class);

    private final FlatTableService tableService;
    private final Set<String> placeholderNames;

    public TagRowParser() {
        this(new FlatCsv(), TagSettingsConfig.defaults());
    }

    public TagRowParser(FlatTableService tableService, TagSettingsConfig config) {
        this.tableService = tableService;
        this.placeholderNames = config.normalizedPlaceholderNames();
    }

    public ParsedTags parse(String data) {
        return parse(tableService.flatToTable(data));
    }

    public ParsedTags parse(CsvTable table) {
        tableService.validate(table);
        Columns columns = Columns.of(table);
        if (columns.name < 0) {
            log.warn("Tag settings header has neither '{}' nor '{}' column, no tags will be read",
                    TagColumns.TAG_NAME, TagColumns.TAG_NAME_LEGACY);
        }

        List<TagRow> rows = new ArrayList<>();
        DefaultRow defaultRow = null;
        int line = 0;
        for (CsvRecord record : table.getRecords()) {
            line++;
            if (record.isEmptyLine()) {
                continue;
            }
            String name = StringUtils.trim(record.get(columns.name));
            if (TagColumns.DEFAULT_ROW_NAME.equalsIgnoreCase(name)) {
                if (defaultRow != null) {
                    log.debug("Repeated {} line at record {}, the later one is used", TagColumns.DEFAULT_ROW_NAME, line);
                }
                defaultRow = toDefaultRow(record, columns, line);
                continue;
            }
            if (!isTaggable(name)) {
                continue;
            }
            rows.add(toTagRow(name, record, columns, line));
        }
        log.debug("Parsed {} tag lines, default line present: {}", rows.size(), defaultRow != null);
        return new ParsedTags(rows, defaultRow);
    }

    public boolean isTaggable(String name) {
        String normalized = TagSettingsResolver.normalize(name);
        return !normalized.isEmpty()
                && !TagColumns.DEFAULT_ROW_NAME.equals(normalized)
                && !placeholderNames.contains(normalized);
    }

    private TagRow toTagRow(String name, CsvRecord record, Columns columns, int line) {
        CellReader cells = new CellReader(record, name, line);
        return TagRow.builder()
                .tagName(name)
                .category(StringUtils.trimToEmpty(record.get(columns.category)))
                .enabled(cells.bool(columns.enabled, TagColumns.ENABLED))
                .markersEnabled(cells.bool(columns.markersEnabled, TagColumns.MARKERS_ENABLED))
                .requiredSceneTagDuration(cells.duration(columns.requiredSceneTagDuration))
                .minMarkerDuration(cells.number(columns.minMarkerDuration, TagColumns.MIN_MARKER_DURATION))
                .maxGap(cells.number(columns.maxGap, TagColumns.MAX_GAP))
                .build();
    }

    private DefaultRow toDefaultRow(CsvRecord record, Columns columns, int line) {
        CellReader cells = new CellReader(record, TagColumns.DEFAULT_ROW_NAME, line);
        return DefaultRow.builder()
                .enabled(cells.bool(columns.enabled, TagColumns.ENABLED))
                .markersEnabled(cells.bool(columns.markersEnabled, TagColumns.MARKERS_ENABLED))
                .requiredSceneTagDuration(cells.duration(columns.requiredSceneTagDuration))
                .minMarkerDuration(cells.number(columns.minMarkerDuration, TagColumns.MIN_MARKER_DURATION))
                .maxGap(cells.number(columns.maxGap, TagColumns.MAX_GAP))
                .build();
    }

    static Double parseNumber(String text) {
        if (StringUtils.isBlank(text)) {
            return null;
        }
        double value;
        try {
            value = Double.parseDouble(text.trim());
        } catch (NumberFormatException e) {
            throw new MalformedValueException("Not a number", text);
        }
        if (!Double.isFinite(value)) {
            throw new MalformedValueException("Not a finite number", text);
        }
        return value;
    }

    private static final class CellReader {
        private final CsvRecord record;
        private final String tag;
        private final int line;

        CellReader(CsvRecord record, String tag, int line) {
            this.record = record;
            this.tag = tag;
            this.line = line;
        }

        Boolean bool(int column, String columnName) {
            String text = record.get(column);
            Boolean value = BooleanTokens.parse(text);
            if (value == null && StringUtils.isNotBlank(text)) {
                log.warn("Ignoring {}='{}' for tag '{}' (record {}): not a boolean", columnName, text, tag, line);
            }
            return value;
        }

        TagDuration duration(int column) {
            try {
                return TagDuration.parse(record.get(column));
            } catch (MalformedValueException e) {
                log.warn("Ignoring {} for tag '{}' (record {}): {}",
                        TagColumns.REQUIRED_SCENE_TAG_DURATION, tag, line, e.getMessage());
                return null;
            }
        }

        Double number(int column, String columnName) {
            try {
                return parseNumber(record.get(column));
            } catch (MalformedValueException e) {
                log.warn("Ignoring {} for tag '{}' (record {}): {}", columnName, tag, line, e.getMessage());
                return null;
            }
        }
    }

    private static final class Columns {
        final int name;
        final int category;
        final int enabled;
        final int markersEnabled;
        final int requiredSceneTagDuration;
        final int minMarkerDuration;
        final int maxGap;

        private Columns(CsvTable table) {
            this.name = table.columnIndex(TagColumns.TAG_NAME, TagColumns.TAG_NAME_LEGACY);
            this.category = table.columnIndex(TagColumns.CATEGORY);
            this.enabled = table.columnIndex(TagColumns.ENABLED);
            this.markersEnabled = table.columnIndex(TagColumns.MARKERS_ENABLED);
            this.requiredSceneTagDuration = table.columnIndex(
                    TagColumns.REQUIRED_SCENE_TAG_DURATION, TagColumns.REQUIRED_SCENE_TAG_DURATION_ALIAS);
            this.minMarkerDuration = table.columnIndex(TagColumns.MIN_MARKER_DURATION);
            this.maxGap = table.columnIndex(TagColumns.MAX_GAP);
        }

        static Columns of(CsvTable table) {
            return new Columns(table);
        }
    }
}
