package my.workpackmhrs.app.importer;

import my.workpackmhrs.app.model.DataRow;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.util.CsvParsing;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;

public class ReferenceIdCsvParser {
	private final CsvTableParser tableParser;

	public ReferenceIdCsvParser(CsvTableParser tableParser) {
		this.tableParser = tableParser;
	}

	public Set<String> parse(byte[] payload, String filename, String idColumn) {
		DataTable table = tableParser.parse(payload, filename);
		CsvTableParser.requireColumns(table, List.of(idColumn));
		Set<String> ids = new LinkedHashSet<>();
		for (DataRow row : table.rows()) {
			String id = row.get(idColumn);
			if (!CsvParsing.isMissing(id)) {
				ids.add(id.trim());
			}
		}
		return ids;
	}
}
