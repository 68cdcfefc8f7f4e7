package my.workpackmhrs.app.importer;

import my.workpackmhrs.app.model.DataRow;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.service.adjustment.BonusEntry;
import my.workpackmhrs.app.service.adjustment.BonusSource;
import my.workpackmhrs.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;

public class BonusSourceCsvParser {
	private static final Logger logger = LoggerFactory.getLogger(BonusSourceCsvParser.class);

	private final CsvTableParser tableParser;
	private final String primaryColumn;
	private final String secondaryColumn;
	private final String hoursColumn;
	private final String activeColumn;

	public BonusSourceCsvParser(CsvTableParser tableParser, String primaryColumn, String secondaryColumn,
								String hoursColumn, String activeColumn) {
		this.tableParser = tableParser;
		this.primaryColumn = primaryColumn;
		this.secondaryColumn = secondaryColumn;
		this.hoursColumn = hoursColumn;
		this.activeColumn = activeColumn;
	}

	public BonusSource parse(byte[] payload, String filename) {
		DataTable table = tableParser.parse(payload, filename);
		CsvTableParser.requireColumns(table, List.of(primaryColumn, secondaryColumn, hoursColumn));
		// a present active column filters rows, blank cells included
		boolean hasActive = table.hasColumn(activeColumn);

		List<BonusEntry> entries = new ArrayList<>();
		for (DataRow row : table.rows()) {
			String primary = row.get(primaryColumn);
			String secondary = row.get(secondaryColumn);
			if (CsvParsing.isMissing(primary) || CsvParsing.isMissing(secondary)) {
				continue;
			}
			Double hours = CsvParsing.parseNumber(row.get(hoursColumn));
			if (hours == null) {
				logger.warn("{} row {}: bonus hours '{}' is not a number, row skipped", table.name(), row.rowNumber(),
						row.get(hoursColumn));
				continue;
			}
			Boolean active = hasActive ? CsvParsing.parseFlag(row.get(activeColumn)) : null;
			entries.add(new BonusEntry(primary, secondary, hours, active));
		}
		return new BonusSource(table.name(), entries);
	}
}
