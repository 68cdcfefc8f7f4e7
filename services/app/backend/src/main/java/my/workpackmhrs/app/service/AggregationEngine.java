package my.workpackmhrs.app.service;

import my.workpackmhrs.app.dto.AggregateResultDto;
import my.workpackmhrs.app.dto.ClassificationShareDto;
import my.workpackmhrs.app.dto.CoefficientSummaryDto;
import my.workpackmhrs.app.dto.HighHoursRowDto;
import my.workpackmhrs.app.dto.ReconciliationMismatchDto;
import my.workpackmhrs.app.dto.RunDiagnosticDto;
import my.workpackmhrs.app.dto.ToolControlIssueDto;
import my.workpackmhrs.app.model.ColumnMapping;
import my.workpackmhrs.app.model.DataRow;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.model.LineItem;
import my.workpackmhrs.app.model.ProcessedLineItem;
import my.workpackmhrs.app.model.ReferenceIdentifiers;
import my.workpackmhrs.app.model.WorkpackContext;
import my.workpackmhrs.app.rules.IdentifierExtractor;
import my.workpackmhrs.app.rules.RowClassifier;
import my.workpackmhrs.app.rules.SequenceKeys;
import my.workpackmhrs.app.service.adjustment.BonusResolution;
import my.workpackmhrs.app.service.adjustment.BonusStrategy;
import my.workpackmhrs.app.service.adjustment.CoefficientStrategy;
import my.workpackmhrs.app.util.CsvParsing;
import my.workpackmhrs.app.util.ManHours;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Turns one work-package table into adjusted man-hour totals.
 * <p>
 * Rows are classified, converted from minutes, scaled by their coefficient and deduplicated on the
 * sequence key (first occurrence wins). The work-package bonus is resolved once and added once.
 */
public class AggregationEngine {
	private static final Logger logger = LoggerFactory.getLogger(AggregationEngine.class);

	private final RowClassifier classifier;
	private final IdentifierExtractor extractor;
	private final CoefficientStrategy coefficientStrategy;
	private final BonusStrategy bonusStrategy;
	private final ReconciliationEngine reconciliationEngine;
	private final ToolControlChecker toolControlChecker;
	private final WorkpackContextFactory contextFactory;
	private final AggregationSettings settings;

	public AggregationEngine(RowClassifier classifier,
							 IdentifierExtractor extractor,
							 CoefficientStrategy coefficientStrategy,
							 BonusStrategy bonusStrategy,
							 ReconciliationEngine reconciliationEngine,
							 ToolControlChecker toolControlChecker,
							 WorkpackContextFactory contextFactory,
							 AggregationSettings settings) {
		this.classifier = classifier;
		this.extractor = extractor;
		this.coefficientStrategy = coefficientStrategy;
		this.bonusStrategy = bonusStrategy;
		this.reconciliationEngine = reconciliationEngine;
		this.toolControlChecker = toolControlChecker;
		this.contextFactory = contextFactory;
		this.settings = settings == null ? AggregationSettings.defaults() : settings;
	}

	public AggregateResultDto process(DataTable table, ReferenceIdentifiers references) {
		return process(table, references, null);
	}

	public AggregateResultDto process(DataTable table, ReferenceIdentifiers references, Integer workpackDays) {
		if (table == null) {
			throw new IllegalArgumentException("Work package table is required");
		}
		ColumnMapping columns = settings.columns();
		validateColumns(table, columns);

		List<RunDiagnosticDto> diagnostics = new ArrayList<>();
		WorkpackContext context = contextFactory.build(table, workpackDays, diagnostics);

		List<ProcessedLineItem> processed = new ArrayList<>();
		int excluded = 0;
		for (DataRow row : table.rows()) {
			LineItem item = LineItem.fromRow(row, columns);
			RowClassifier.Classification classification = classifier.classify(item.sequenceKey());
			if (!classification.shouldProcess()) {
				excluded++;
				continue;
			}
			if (!item.sequenceKey().isEmpty() && !SequenceKeys.isWellFormed(item.sequenceKey())) {
				diagnostics.add(RunDiagnosticDto.info(item.rowNumber(), item.sequenceKey(),
						"Sequence key is not in <number>.<number> form"));
			}
			Double baseHours = ManHours.minutesToHours(item.rawDuration());
			if (baseHours == null) {
				diagnostics.add(RunDiagnosticDto.warning(item.rowNumber(), item.sequenceKey(),
						"Duration '" + item.rawDuration() + "' is not a number; counted as 0"));
				baseHours = 0.0d;
			}
			String identifier = extractor.extract(item.title(), classification.extractionRule());
			double coefficient = coefficientStrategy.resolve(item, identifier, context);
			processed.add(new ProcessedLineItem(item, identifier, classification.checkReference(), baseHours,
					coefficient, baseHours * coefficient));
		}

		List<ProcessedLineItem> unique = deduplicate(processed);
		int duplicates = processed.size() - unique.size();

		double totalBase = 0.0d;
		double rowAdjusted = 0.0d;
		for (ProcessedLineItem item : unique) {
			totalBase += item.baseHours();
			rowAdjusted += item.adjustedHours();
		}
		BonusResolution bonus = bonusStrategy.resolve(context);
		double totalAdjusted = rowAdjusted + bonus.total();

		boolean classificationEnabled = settings.classificationEnabled();
		List<ClassificationShareDto> distribution = List.of();
		if (classificationEnabled) {
			if (!table.hasAnyValue(columns.classificationCode())) {
				String message = "Classification column '" + columns.classificationCode()
						+ "' missing or empty; distribution disabled";
				logger.warn(message);
				diagnostics.add(RunDiagnosticDto.warning(message));
				classificationEnabled = false;
			} else {
				distribution = distribution(unique, rowAdjusted, context, diagnostics);
			}
		}

		List<HighHoursRowDto> highHours = highHoursRows(unique);
		List<ReconciliationMismatchDto> mismatches = reconciliationEngine.reconcile(unique, references);
		boolean toolControlEnabled = toolControlChecker != null;
		List<ToolControlIssueDto> toolIssues = toolControlEnabled
				? toolControlChecker.check(table, diagnostics)
				: List.of();

		logger.info("Work package '{}': {} rows, {} processed, {} excluded, {} duplicates, base {} h, adjusted {} h, bonus {} h",
				table.name(), table.rows().size(), unique.size(), excluded, duplicates, totalBase, totalAdjusted,
				bonus.total());
		if (!mismatches.isEmpty()) {
			logger.info("Work package '{}': {} identifiers missing from reference data", table.name(), mismatches.size());
		}

		return new AggregateResultDto(
				table.name(),
				context.label(),
				context.checkGroup(),
				context.period(),
				table.rows().size(),
				unique.size(),
				excluded,
				duplicates,
				totalBase,
				rowAdjusted,
				bonus.total(),
				totalAdjusted,
				bonus.breakdown(),
				coefficientSummary(unique),
				classificationEnabled,
				distribution,
				settings.highHoursThreshold(),
				highHours,
				mismatches,
				toolControlEnabled,
				toolIssues,
				diagnostics
		);
	}

	/**
	 * Keeps the first row per trimmed sequence key. Applying it twice changes nothing.
	 */
	public List<ProcessedLineItem> deduplicate(List<ProcessedLineItem> items) {
		Map<String, ProcessedLineItem> unique = new LinkedHashMap<>();
		for (ProcessedLineItem item : items) {
			unique.putIfAbsent(item.sequenceKey(), item);
		}
		return new ArrayList<>(unique.values());
	}

	private void validateColumns(DataTable table, ColumnMapping columns) {
		List<String> expected = columns.mandatory();
		List<String> missing = new ArrayList<>();
		for (String column : expected) {
			if (!table.hasColumn(column)) {
				missing.add(column);
			}
		}
		if (!missing.isEmpty()) {
			logger.error("Work package '{}' is missing required columns {}", table.name(), missing);
			throw new MissingColumnsException(expected, missing);
		}
	}

	private List<ClassificationShareDto> distribution(List<ProcessedLineItem> items, double rowAdjusted,
													  WorkpackContext context, List<RunDiagnosticDto> diagnostics) {
		Map<String, Double> byCode = new LinkedHashMap<>();
		for (ProcessedLineItem item : items) {
			String code = item.item().classificationCode();
			if (CsvParsing.isMissing(code)) {
				diagnostics.add(RunDiagnosticDto.info(item.rowNumber(), item.sequenceKey(),
						"No classification code; row left out of the distribution"));
				continue;
			}
			byCode.merge(code.trim(), item.adjustedHours(), Double::sum);
		}
		boolean perDay = context.period() != null && context.period().hasPositiveDays();
		List<ClassificationShareDto> shares = new ArrayList<>();
		for (Map.Entry<String, Double> entry : byCode.entrySet()) {
			double hours = entry.getValue();
			Double hoursPerDay = perDay ? hours / context.days() : null;
			Double percentage = rowAdjusted > 0 ? hours / rowAdjusted * 100.0d : null;
			shares.add(new ClassificationShareDto(entry.getKey(), hours, hoursPerDay, percentage));
		}
		shares.sort(Comparator.comparingDouble(ClassificationShareDto::hours).reversed());
		return shares;
	}

	private List<HighHoursRowDto> highHoursRows(List<ProcessedLineItem> items) {
		List<HighHoursRowDto> rows = new ArrayList<>();
		for (ProcessedLineItem item : items) {
			if (item.adjustedHours() > settings.highHoursThreshold()) {
				rows.add(new HighHoursRowDto(item.rowNumber(), item.sequenceKey(), item.item().title(),
						item.identifier(), item.baseHours(), item.coefficient(), item.adjustedHours()));
			}
		}
		return rows;
	}

	private List<CoefficientSummaryDto> coefficientSummary(List<ProcessedLineItem> items) {
		Map<Double, double[]> byCoefficient = new TreeMap<>();
		for (ProcessedLineItem item : items) {
			double[] totals = byCoefficient.computeIfAbsent(item.coefficient(), key -> new double[3]);
			totals[0] += 1;
			totals[1] += item.baseHours();
			totals[2] += item.adjustedHours();
		}
		List<CoefficientSummaryDto> summary = new ArrayList<>();
		byCoefficient.forEach((coefficient, totals) ->
				summary.add(new CoefficientSummaryDto(coefficient, (int) totals[0], totals[1], totals[2])));
		return summary;
	}
}
