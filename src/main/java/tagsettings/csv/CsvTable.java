package tagsettings.csv;

import lombok.Getter;
import org.apache.commons.lang3.StringUtils;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

@Getter
public class CsvTable {

    private static final String BYTE_ORDER_MARK = "\uFEFF";

    private final List<CsvRecord> preamble;
    private final CsvRecord header;
    private final List<CsvRecord> records;
    private final String lineSeparator;
    private final boolean endsWithNewline;

    CsvTable(List<CsvRecord> preamble, CsvRecord header, List<CsvRecord> records,
             String lineSeparator, boolean endsWithNewline) {
        this.preamble = preamble;
        this.header = header;
        this.records = records;
        this.lineSeparator = lineSeparator;
        this.endsWithNewline = endsWithNewline;
    }

    public static CsvTable withHeader(List<String> columns) {
        return new CsvTable(new ArrayList<>(), CsvRecord.created(columns), new ArrayList<>(), "\n", true);
    }

    public boolean hasHeader() {
        return header != null;
    }

    public List<String> getColumns() {
        return header == null ? Collections.emptyList() : header.getCells();
    }

    public int columnIndex(String... names) {
        List<String> columns = getColumns();
        for (String name : names) {
            String wanted = normalizeColumn(name);
            for (int i = 0; i < columns.size(); i++) {
                if (normalizeColumn(columns.get(i)).equals(wanted)) {
                    return i;
                }
            }
        }
        return -1;
    }

    /**
     * Returns the index of the column, appending it to the header when missing. A new column goes after the widest
     * record so that unnamed trailing cells keep their place. Data records are not widened: a record shorter than
     * the header reads as blank in the missing columns.
     */
    public int ensureColumn(String name) {
        if (header == null) {
            throw new IllegalStateException("Cannot add column '" + name + "' to a table without header.");
        }
        int index = columnIndex(name);
        if (index >= 0) {
            return index;
        }
        index = header.size();
        for (CsvRecord record : records) {
            index = Math.max(index, record.size());
        }
        header.set(index, name);
        return index;
    }

    public CsvRecord appendRecord() {
        CsvRecord record = CsvRecord.blank(getColumns().size());
        records.add(record);
        return record;
    }

    public List<CsvRecord> getRecords() {
        return Collections.unmodifiableList(records);
    }

    public List<CsvRecord> getPreamble() {
        return Collections.unmodifiableList(preamble);
    }

    private static String normalizeColumn(String name) {
        String column = StringUtils.removeStart(StringUtils.defaultString(name), BYTE_ORDER_MARK);
        return column.trim().toLowerCase(Locale.ROOT);
    }
}
