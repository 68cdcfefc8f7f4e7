package my.workpackmhrs.app.importer;

import my.workpackmhrs.app.model.DataRow;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.service.adjustment.TypeCoefficientEntry;
import my.workpackmhrs.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class TypeCoefficientCsvParser {
	private static final Logger logger = LoggerFactory.getLogger(TypeCoefficientCsvParser.class);

	private final CsvTableParser tableParser;
	private final String primaryColumn;
	private final String checkGroupColumn;
	private final String functionGroupColumn;
	private final String coefficientColumn;
	private final String activeColumn;

	public TypeCoefficientCsvParser(CsvTableParser tableParser, String primaryColumn, String checkGroupColumn,
									String functionGroupColumn, String coefficientColumn, String activeColumn) {
		this.tableParser = tableParser;
		this.primaryColumn = primaryColumn;
		this.checkGroupColumn = checkGroupColumn;
		this.functionGroupColumn = functionGroupColumn;
		this.coefficientColumn = coefficientColumn;
		this.activeColumn = activeColumn;
	}

	public List<TypeCoefficientEntry> parse(byte[] payload, String filename) {
		DataTable table = tableParser.parse(payload, filename);
		CsvTableParser.requireColumns(table, List.of(primaryColumn, checkGroupColumn, functionGroupColumn,
				coefficientColumn));
		boolean hasActive = table.hasColumn(activeColumn);

		List<TypeCoefficientEntry> entries = new ArrayList<>();
		for (DataRow row : table.rows()) {
			Double coefficient = CsvParsing.parseNumber(row.get(coefficientColumn));
			if (coefficient == null || coefficient <= 0) {
				logger.warn("{} row {}: coefficient '{}' is not a positive number, row skipped", table.name(),
						row.rowNumber(), row.get(coefficientColumn));
				continue;
			}
			Boolean active = hasActive ? CsvParsing.parseFlag(row.get(activeColumn)) : null;
			entries.add(new TypeCoefficientEntry(row.get(primaryColumn), row.get(checkGroupColumn),
					row.get(functionGroupColumn), coefficient, active));
		}
		return entries;
	}
}
