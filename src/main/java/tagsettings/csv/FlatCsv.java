package tagsettings.csv;

import org.apache.commons.lang3.StringUtils;
import tagsettings.MissingHeaderException;

import java.util.ArrayList;
import java.util.List;
import java.util.StringJoiner;

public class FlatCsv implements FlatTableService {

    private static final char DELIMITER = ',';
    private static final char QUOTE = '"';
    private static final String TOKEN_RN = "\r\n";
    private static final String TOKEN_N = "\n";
    private static final String TOKEN_R = "\r";

    @Override
    public CsvTable flatToTable(String data) {
        String text = data == null ? StringUtils.EMPTY : data;
        String lineSeparator = detectLineSeparator(text);
        boolean endsWithNewline = endsWithAnyNewline(text);

        List<CsvRecord> all = new RecordReader(text).readAll();

        List<CsvRecord> preamble = new ArrayList<>();
        CsvRecord header = null;
        List<CsvRecord> records = new ArrayList<>();
        for (CsvRecord record : all) {
            if (header == null) {
                if (record.isEmptyLine()) {
                    preamble.add(record);
                } else {
                    header = record;
                }
            } else {
                records.add(record);
            }
        }
        return new CsvTable(preamble, header, records, lineSeparator, endsWithNewline);
    }

    @Override
    public String flatToString(CsvTable table) {
        if (table == null) {
            return StringUtils.EMPTY;
        }
        String ls = table.getLineSeparator() == null ? TOKEN_N : table.getLineSeparator();
        List<CsvRecord> lines = new ArrayList<>(table.getPreamble());
        if (table.getHeader() != null) {
            lines.add(table.getHeader());
        }
        lines.addAll(table.getRecords());
        if (lines.isEmpty()) {
            return StringUtils.EMPTY;
        }

        StringJoiner out = new StringJoiner(ls);
        for (CsvRecord record : lines) {
            out.add(render(record));
        }
        return table.isEndsWithNewline() ? out + ls : out.toString();
    }

    @Override
    public void validate(CsvTable table) {
        if (table == null || !table.hasHeader()) {
            throw new MissingHeaderException("CSV source has no header line.");
        }
    }

    static String render(CsvRecord record) {
        if (!record.isModified()) {
            return record.getRaw();
        }
        StringJoiner line = new StringJoiner(String.valueOf(DELIMITER));
        for (String cell : record.getCells()) {
            line.add(quoteIfNeeded(cell));
        }
        return line.toString();
    }

    static String quoteIfNeeded(String cell) {
        if (cell == null || cell.isEmpty()) {
            return StringUtils.EMPTY;
        }
        if (StringUtils.containsAny(cell, DELIMITER, QUOTE, '\r', '\n')) {
            return QUOTE + cell.replace("\"", "\"\"") + QUOTE;
        }
        return cell;
    }

    private static boolean endsWithAnyNewline(String s) {
        if (s.isEmpty()) {
            return false;
        }
        char last = s.charAt(s.length() - 1);
        return last == '\n' || last == '\r';
    }

    private static String detectLineSeparator(String s) {
        int rn = s.indexOf(TOKEN_RN);
        int n = s.indexOf('\n');
        int r = s.indexOf('\r');
        if (rn >= 0 && rn <= n) {
            return TOKEN_RN;
        }
        if (r >= 0 && (n < 0 || r < n)) {
            return TOKEN_R;
        }
        return TOKEN_N;
    }

    private static final class RecordReader {
        private final String text;
        private final List<CsvRecord> out = new ArrayList<>();
        private int pos;

        RecordReader(String text) {
            this.text = text;
        }

        List<CsvRecord> readAll() {
            while (pos < text.length()) {
                readRecord();
            }
            return out;
        }

        private void readRecord() {
            int start = pos;
            List<String> cells = new ArrayList<>();
            StringBuilder cell = new StringBuilder();
            boolean quoted = false;
            boolean atCellStart = true;

            while (pos < text.length()) {
                char c = text.charAt(pos);
                if (quoted) {
                    if (c == QUOTE) {
                        if (pos + 1 < text.length() && text.charAt(pos + 1) == QUOTE) {
                            cell.append(QUOTE);
                            pos += 2;
                            continue;
                        }
                        quoted = false;
                    } else {
                        cell.append(c);
                    }
                    pos++;
                    continue;
                }
                if (c == '\r' || c == '\n') {
                    break;
                }
                if (c == DELIMITER) {
                    cells.add(cell.toString());
                    cell.setLength(0);
                    atCellStart = true;
                    pos++;
                    continue;
                }
                if (c == QUOTE && atCellStart) {
                    quoted = true;
                } else {
                    cell.append(c);
                }
                atCellStart = false;
                pos++;
            }

            cells.add(cell.toString());
            String raw = text.substring(start, pos);
            skipLineSeparator();
            out.add(CsvRecord.parsed(cells, raw));
        }

        private void skipLineSeparator() {
            if (pos >= text.length()) {
                return;
            }
            if (text.charAt(pos) == '\r') {
                pos++;
                if (pos < text.length() && text.charAt(pos) == '\n') {
                    pos++;
                }
            } else if (text.charAt(pos) == '\n') {
                pos++;
            }
        }
    }
}
