package my.workpackmhrs.app.service;

import my.workpackmhrs.app.dto.RunDiagnosticDto;
import my.workpackmhrs.app.model.ColumnMapping;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.model.WorkpackContext;
import my.workpackmhrs.app.model.WorkpackLabel;
import my.workpackmhrs.app.model.WorkpackPeriod;
import my.workpackmhrs.app.rules.CheckGroupMapping;
import my.workpackmhrs.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.time.LocalDate;
import java.time.format.DateTimeFormatter;
import java.time.format.DateTimeParseException;
import java.util.List;

/**
 * Reads the work-package level facts (label, period, check group) from the first data row.
 */
public class WorkpackContextFactory {
	private static final Logger logger = LoggerFactory.getLogger(WorkpackContextFactory.class);
	private static final DateTimeFormatter DAY_FIRST = DateTimeFormatter.ofPattern("d/M/uuuu");

	private final ColumnMapping columns;
	private final CheckGroupMapping checkGroups;

	public WorkpackContextFactory(ColumnMapping columns, CheckGroupMapping checkGroups) {
		this.columns = columns == null ? ColumnMapping.defaults() : columns;
		this.checkGroups = checkGroups == null ? CheckGroupMapping.empty() : checkGroups;
	}

	public WorkpackContext build(DataTable table, Integer explicitDays, List<RunDiagnosticDto> diagnostics) {
		WorkpackLabel label = readLabel(table, diagnostics);
		WorkpackPeriod period = explicitDays != null && explicitDays > 0
				? WorkpackPeriod.ofDays(explicitDays)
				: readPeriod(table, diagnostics);
		String checkGroup = label.isEmpty() ? null : checkGroups.resolve(label.secondaryKey());
		return new WorkpackContext(table.name(), label, period, checkGroup);
	}

	private WorkpackLabel readLabel(DataTable table, List<RunDiagnosticDto> diagnostics) {
		if (!table.hasColumn(columns.label())) {
			warn(diagnostics, "Label column '" + columns.label() + "' not found; no bonus hours applied");
			return WorkpackLabel.EMPTY;
		}
		String raw = table.firstValue(columns.label());
		if (CsvParsing.isMissing(raw)) {
			warn(diagnostics, "Label column '" + columns.label() + "' is empty; no bonus hours applied");
			return WorkpackLabel.EMPTY;
		}
		WorkpackLabel label = WorkpackLabel.parse(raw);
		logger.info("Work package label '{}' -> primary='{}', secondary='{}'", label.raw(), label.primaryKey(),
				label.secondaryKey());
		return label;
	}

	private WorkpackPeriod readPeriod(DataTable table, List<RunDiagnosticDto> diagnostics) {
		if (!table.hasColumn(columns.startDate()) || !table.hasColumn(columns.endDate())) {
			warn(diagnostics, "Date columns '" + columns.startDate() + "'/'" + columns.endDate()
					+ "' not found; work package days unknown");
			return null;
		}
		LocalDate start = parseDate(table.firstValue(columns.startDate()));
		LocalDate end = parseDate(table.firstValue(columns.endDate()));
		if (start == null || end == null) {
			warn(diagnostics, "Work package dates could not be parsed; work package days unknown");
			return null;
		}
		if (end.isBefore(start)) {
			warn(diagnostics, "Work package end date " + end + " is before start date " + start);
			return null;
		}
		return WorkpackPeriod.between(start, end);
	}

	static LocalDate parseDate(String raw) {
		if (CsvParsing.isMissing(raw)) {
			return null;
		}
		String value = raw.trim();
		try {
			if (value.length() >= 10 && value.charAt(4) == '-') {
				return LocalDate.parse(value.substring(0, 10));
			}
			return LocalDate.parse(value, DAY_FIRST);
		} catch (DateTimeParseException exc) {
			return null;
		}
	}

	private void warn(List<RunDiagnosticDto> diagnostics, String message) {
		logger.warn(message);
		diagnostics.add(RunDiagnosticDto.warning(message));
	}
}
