package tagsettings.csv;

public interface FlatTableService {
    CsvTable flatToTable(String data);

    String flatToString(CsvTable table);

    void validate(CsvTable table);
}
