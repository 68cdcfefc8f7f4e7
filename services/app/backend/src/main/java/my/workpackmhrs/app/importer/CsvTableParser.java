package my.workpackmhrs.app.importer;

import my.workpackmhrs.app.model.DataRow;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.util.CsvParsing;
import org.apache.commons.csv.CSVFormat;
import org.apache.commons.csv.CSVParser;
import org.apache.commons.csv.CSVRecord;

import java.io.IOException;
import java.io.StringReader;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Reads a delimited export into a {@link DataTable}. The delimiter is sniffed from the header line,
 * blank lines and rows with only empty cells are skipped. Row numbers are 1-based data rows.
 */
public class CsvTableParser {

	public DataTable parse(byte[] payload, String filename) {
		if (payload == null || payload.length == 0) {
			throw new IllegalArgumentException("File is empty");
		}
		String content = CsvParsing.decodeUtf8(payload);
		char delimiter = CsvParsing.sniffDelimiter(CsvParsing.firstLine(content));

		List<String> headers = new ArrayList<>();
		List<DataRow> rows = new ArrayList<>();
		try (CSVParser parser = CSVParser.parse(
				new StringReader(content),
				CSVFormat.DEFAULT.withDelimiter(delimiter)
						.withFirstRecordAsHeader()
						.withAllowMissingColumnNames()
						.withTrim()
		)) {
			List<String> headerNames = parser.getHeaderNames();
			for (String header : headerNames) {
				if (header != null && !header.isBlank() && !headers.contains(header)) {
					headers.add(header);
				}
			}
			int rowNumber = 0;
			for (CSVRecord record : parser) {
				Map<String, String> values = new LinkedHashMap<>();
				boolean hasValue = false;
				for (int i = 0; i < headerNames.size() && i < record.size(); i++) {
					String header = headerNames.get(i);
					if (header == null || header.isBlank() || values.containsKey(header)) {
						continue;
					}
					String value = record.get(i);
					values.put(header, value);
					if (value != null && !value.isBlank()) {
						hasValue = true;
					}
				}
				if (!hasValue) {
					continue;
				}
				rowNumber++;
				rows.add(new DataRow(rowNumber, values));
			}
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read CSV " + filename + ": " + exc.getMessage(), exc);
		}
		return new DataTable(baseName(filename), headers, rows);
	}

	static String baseName(String filename) {
		if (filename == null || filename.isBlank()) {
			return "upload";
		}
		String name = filename.replace('\\', '/');
		int slash = name.lastIndexOf('/');
		if (slash >= 0) {
			name = name.substring(slash + 1);
		}
		int dot = name.lastIndexOf('.');
		return dot > 0 ? name.substring(0, dot) : name;
	}

	static void requireColumns(DataTable table, List<String> required) {
		List<String> missing = new ArrayList<>();
		for (String column : required) {
			if (!table.hasColumn(column)) {
				missing.add(column);
			}
		}
		if (!missing.isEmpty()) {
			throw new IllegalArgumentException(table.name() + " is missing columns " + missing);
		}
	}
}
