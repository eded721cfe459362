package tagsettings;

import org.apache.commons.lang3.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import tagsettings.csv.CsvRecord;
import tagsettings.csv.CsvTable;

import java.math.BigDecimal;
import java.util.HashMap;
import java.util.Map;
import java.util.Objects;
import java.util.function.Function;

final class TagTableEditor {

    private static final Logger log = LoggerFactory.getLogger(TagTableEditor.class);

    private final CsvTable table;
    private final TagRowParser parser;
    private final Map<String, CsvRecord> recordsByName = new HashMap<>();
    private final int nameColumn;

    TagTableEditor(CsvTable table, TagRowParser parser) {
        this.table = table;
        this.parser = parser;
        int column = table.columnIndex(TagColumns.TAG_NAME, TagColumns.TAG_NAME_LEGACY);
        this.nameColumn = column >= 0 ? column : table.ensureColumn(TagColumns.TAG_NAME);
        for (CsvRecord record : table.getRecords()) {
            if (record.isEmptyLine()) {
                continue;
            }
            String key = TagSettingsResolver.normalize(record.get(nameColumn));
            if (!key.isEmpty()) {
                recordsByName.put(key, record);
            }
        }
    }

    int apply(Map<String, TagSettingsPatch> patches) {
        int changed = 0;
        for (Map.Entry<String, TagSettingsPatch> entry : patches.entrySet()) {
            if (apply(entry.getKey(), entry.getValue())) {
                changed++;
            }
        }
        return changed;
    }

    private boolean apply(String tagName, TagSettingsPatch patch) {
        String key = TagSettingsResolver.normalize(tagName);
        if (!TagColumns.DEFAULT_ROW_NAME.equals(key) && !parser.isTaggable(key)) {
            log.warn("Skipping update for reserved or blank tag name '{}'", tagName);
            return false;
        }
        if (patch == null || patch.isEmpty()) {
            return false;
        }

        CsvRecord record = recordsByName.get(key);
        boolean created = record == null;
        if (created) {
            record = table.appendRecord();
            record.set(nameColumn, tagName.trim());
            recordsByName.put(key, record);
            log.debug("Adding line for new tag '{}'", tagName.trim());
        }

        boolean changed = created;
        changed |= writeFlag(record, patch.getEnabled(), TagColumns.ENABLED);
        changed |= writeFlag(record, patch.getMarkersEnabled(), TagColumns.MARKERS_ENABLED);
        changed |= writeText(record, patch.getRequiredSceneTagDuration(), TagDuration::format,
                TagColumns.REQUIRED_SCENE_TAG_DURATION, TagColumns.REQUIRED_SCENE_TAG_DURATION_ALIAS);
        changed |= writeNumber(record, patch.getMinMarkerDuration(), TagColumns.MIN_MARKER_DURATION);
        changed |= writeNumber(record, patch.getMaxGap(), TagColumns.MAX_GAP);
        changed |= writeText(record, patch.getCategory(), String::trim, TagColumns.CATEGORY);
        return changed;
    }

    private boolean writeFlag(CsvRecord record, PatchField<Boolean> field, String column) {
        if (!field.isPresent()) {
            return false;
        }
        int index = column(column);
        String current = record.get(index);
        if (field.isCleared()) {
            return setIfDifferent(record, index, StringUtils.EMPTY);
        }
        boolean wanted = field.getValue();
        if (Objects.equals(BooleanTokens.parse(current), wanted)) {
            return false;
        }
        record.set(index, BooleanTokens.format(wanted));
        return true;
    }

    private boolean writeNumber(CsvRecord record, PatchField<Double> field, String column) {
        return writeText(record, field, TagTableEditor::formatNumber, column);
    }

    private <T> boolean writeText(CsvRecord record, PatchField<T> field,
                                  Function<T, String> formatter, String... columns) {
        if (!field.isPresent()) {
            return false;
        }
        int index = column(columns);
        String text = field.isCleared() ? StringUtils.EMPTY : formatter.apply(field.getValue());
        return setIfDifferent(record, index, text);
    }

    private static boolean setIfDifferent(CsvRecord record, int index, String text) {
        if (record.get(index).trim().equals(text)) {
            return false;
        }
        record.set(index, text);
        return true;
    }

    private int column(String... names) {
        int index = table.columnIndex(names);
        return index >= 0 ? index : table.ensureColumn(names[0]);
    }

    static String formatNumber(Double value) {
        return BigDecimal.valueOf(value).toPlainString();
    }
}
