package my.workpackmhrs.app.service;

import my.workpackmhrs.app.dto.RunDiagnosticDto;
import my.workpackmhrs.app.dto.ToolControlIssueDto;
import my.workpackmhrs.app.model.ColumnMapping;
import my.workpackmhrs.app.model.DataRow;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.model.ToolControlColumns;
import my.workpackmhrs.app.rules.IdentifierExtractor;
import my.workpackmhrs.app.rules.RowClassifier;
import my.workpackmhrs.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Set;

/**
 * Flags tools and spares with no stock at all. Runs over every row, without policy filtering
 * or deduplication.
 */
public class ToolControlChecker {
	private static final Logger logger = LoggerFactory.getLogger(ToolControlChecker.class);

	private final ToolControlColumns toolColumns;
	private final ColumnMapping columns;
	private final Set<String> ignoreList;
	private final RowClassifier classifier;
	private final IdentifierExtractor extractor;

	public ToolControlChecker(ToolControlColumns toolColumns, ColumnMapping columns, Set<String> ignoreList,
							  RowClassifier classifier, IdentifierExtractor extractor) {
		this.toolColumns = toolColumns == null ? ToolControlColumns.defaults() : toolColumns;
		this.columns = columns == null ? ColumnMapping.defaults() : columns;
		this.ignoreList = ignoreList == null ? Set.of() : Set.copyOf(ignoreList);
		this.classifier = classifier;
		this.extractor = extractor;
	}

	public List<ToolControlIssueDto> check(DataTable table, List<RunDiagnosticDto> diagnostics) {
		List<String> missing = new ArrayList<>();
		for (String column : toolColumns.all()) {
			if (!table.hasColumn(column)) {
				missing.add(column);
			}
		}
		if (!missing.isEmpty()) {
			String message = "Tool control skipped, missing columns " + missing;
			logger.warn(message);
			diagnostics.add(RunDiagnosticDto.warning(message));
			return List.of();
		}

		List<ToolControlIssueDto> issues = new ArrayList<>();
		int ignored = 0;
		for (DataRow row : table.rows()) {
			String toolName = CsvParsing.trimToEmpty(row.get(toolColumns.toolName()));
			String partNumber = CsvParsing.trimToEmpty(row.get(toolColumns.partNumber()));
			if (CsvParsing.isMissing(toolName) || CsvParsing.isMissing(partNumber)) {
				continue;
			}
			if (quantity(row.get(toolColumns.totalQty())) != 0.0d || quantity(row.get(toolColumns.altQty())) != 0.0d) {
				continue;
			}
			if (isIgnored(partNumber) || isIgnored(toolName)) {
				ignored++;
				continue;
			}
			String sequenceKey = CsvParsing.trimToEmpty(row.get(columns.sequenceKey()));
			String identifier = extractor.extract(row.get(columns.title()), classifier.extractionRule(sequenceKey));
			issues.add(new ToolControlIssueDto(row.rowNumber(), sequenceKey, identifier, partNumber, toolName,
					typeLabel(row.get(toolColumns.toolType()))));
		}
		logger.info("Tool control found {} unavailable items ({} ignored)", issues.size(), ignored);
		return issues;
	}

	private boolean isIgnored(String value) {
		return ignoreList.contains(value.toLowerCase(Locale.ROOT));
	}

	private double quantity(String raw) {
		Double parsed = CsvParsing.parseNumber(raw);
		return parsed == null ? 0.0d : parsed;
	}

	static String typeLabel(String raw) {
		String value = CsvParsing.trimToEmpty(raw);
		if (value.isEmpty()) {
			return "Unknown";
		}
		return switch (value.toUpperCase(Locale.ROOT)) {
			case "Y" -> "Tool";
			case "N" -> "Spare";
			default -> value;
		};
	}
}
