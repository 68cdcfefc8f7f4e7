package my.workpackmhrs.app.service;

import my.workpackmhrs.app.dto.AggregateResultDto;
import my.workpackmhrs.app.dto.ClassificationShareDto;
import my.workpackmhrs.app.dto.CoefficientSummaryDto;
import my.workpackmhrs.app.dto.ReconciliationMismatchDto;
import my.workpackmhrs.app.dto.RunDiagnosticDto;
import my.workpackmhrs.app.model.ColumnMapping;
import my.workpackmhrs.app.model.DataRow;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.model.LineItem;
import my.workpackmhrs.app.model.ProcessedLineItem;
import my.workpackmhrs.app.model.ReferenceIdentifiers;
import my.workpackmhrs.app.rules.CheckGroupMapping;
import my.workpackmhrs.app.rules.CoefficientTable;
import my.workpackmhrs.app.rules.ExtractionRule;
import my.workpackmhrs.app.rules.IdentifierExtractor;
import my.workpackmhrs.app.rules.PolicyEntry;
import my.workpackmhrs.app.rules.PolicyTable;
import my.workpackmhrs.app.rules.ProcessingPolicy;
import my.workpackmhrs.app.rules.RowClassifier;
import my.workpackmhrs.app.service.adjustment.BonusResolution;
import my.workpackmhrs.app.service.adjustment.BonusStrategy;
import my.workpackmhrs.app.service.adjustment.NoBonusStrategy;
import my.workpackmhrs.app.service.adjustment.PrefixCoefficientStrategy;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.within;

class AggregationEngineTest {
	private static final List<String> HEADERS = List.of("Seq. No.", "Title", "Planned Mhrs", "Special code", "A");

	private final RowClassifier classifier = new RowClassifier(new PolicyTable(Map.of(
			"1", new PolicyEntry(ProcessingPolicy.INCLUDE, ExtractionRule.PARENTHESIS),
			"4", new PolicyEntry(ProcessingPolicy.SKIP_REFERENCE_CHECK, ExtractionRule.VERBATIM),
			"9", new PolicyEntry(ProcessingPolicy.EXCLUDE, ExtractionRule.VERBATIM)
	), PolicyEntry.DEFAULT));
	private final CoefficientTable coefficients = new CoefficientTable(Map.of("3", 2.0d), 1.0d, List.of(), 1.0d);
	private final ReferenceIdentifiers references = new ReferenceIdentifiers(
			Set.of("24-045-00", "21-010-01"), Set.of("EO-2024-002"), "EO");

	@Test
	void convertsMinutesAndAppliesPrefixCoefficient() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 8.0d).process(table(
				"3.1;21-010-01 / CABIN;120;SC1;"
		), references);

		assertThat(result.totalBaseHours()).isEqualTo(2.0d);
		assertThat(result.totalAdjustedHours()).isEqualTo(4.0d);
		assertThat(result.coefficientSummary()).containsExactly(new CoefficientSummaryDto(2.0d, 1, 2.0d, 4.0d));
	}

	@Test
	void keepsFirstRowPerSequenceKey() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 8.0d).process(table(
				"4.1;Lubricate hinge;180;SC1;",
				"4.1;Lubricate hinge again;300;SC1;"
		), references);

		assertThat(result.processedRows()).isEqualTo(1);
		assertThat(result.duplicateRows()).isEqualTo(1);
		assertThat(result.totalBaseHours()).isEqualTo(3.0d);
	}

	@Test
	void deduplicationIsIdempotent() {
		AggregationEngine engine = engine(new NoBonusStrategy(), 8.0d);
		List<ProcessedLineItem> items = List.of(
				processed(1, "2.1", 1.0d),
				processed(2, " 2.1 ", 5.0d),
				processed(3, "2.2", 2.0d),
				processed(4, "", 3.0d),
				processed(5, "", 4.0d)
		);

		List<ProcessedLineItem> once = engine.deduplicate(items);
		List<ProcessedLineItem> twice = engine.deduplicate(once);

		assertThat(once).extracting(ProcessedLineItem::rowNumber).containsExactly(1, 3, 4);
		assertThat(twice).isEqualTo(once);
	}

	@Test
	void bonusIsAddedOncePerWorkPackage() {
		BonusStrategy tenHours = context -> new BonusResolution(10.0d, List.of());
		AggregateResultDto result = engine(tenHours, 8.0d).process(table(
				"1.1;24-045-00 (00);60;SC1;B787-XYZ-A06",
				"1.2;24-045-00 (01);60;SC1;",
				"1.3;24-045-00 (02);60;SC1;"
		), references);

		assertThat(result.rowAdjustedHours()).isEqualTo(3.0d);
		assertThat(result.bonusHours()).isEqualTo(10.0d);
		assertThat(result.totalAdjustedHours()).isEqualTo(13.0d);
		assertThat(result.totalAdjustedHours()).isNotEqualTo(result.rowAdjustedHours() + 3 * result.bonusHours());
	}

	@Test
	void missingMandatoryColumnsFailBeforeProcessing() {
		DataTable table = new DataTable("wp", List.of("Seq. No.", "Title"), List.of());

		assertThatThrownBy(() -> engine(new NoBonusStrategy(), 8.0d).process(table, references))
				.isInstanceOf(MissingColumnsException.class)
				.hasMessageContaining("[Planned Mhrs]");
	}

	@Test
	void countsExcludedRowsAndReportsBadDurations() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 8.0d).process(table(
				"9.1;Housekeeping;600;SC1;",
				"2.1;21-010-01 / CABIN;two hours;SC1;",
				"2.2;21-010-01 / CABIN;;SC1;",
				"A7;21-010-01 / CABIN;60;SC1;"
		), references);

		assertThat(result.totalRows()).isEqualTo(4);
		assertThat(result.excludedRows()).isEqualTo(1);
		assertThat(result.processedRows()).isEqualTo(3);
		assertThat(result.totalBaseHours()).isEqualTo(1.0d);
		assertThat(result.diagnostics()).anyMatch(diagnostic -> diagnostic.level() == RunDiagnosticDto.Level.WARNING
				&& Integer.valueOf(2).equals(diagnostic.rowNumber())
				&& diagnostic.message().contains("two hours"));
		assertThat(result.diagnostics()).anyMatch(diagnostic -> diagnostic.level() == RunDiagnosticDto.Level.INFO
				&& "A7".equals(diagnostic.sequenceKey()));
	}

	@Test
	void buildsClassificationDistributionSortedByHours() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 8.0d).process(table(
				"1.1;24-045-00 (00);120;SC1;",
				"3.1;21-010-01 / CABIN;120;SC2;",
				"1.2;24-045-00 (01);60;;"
		), references, 2);

		assertThat(result.classificationEnabled()).isTrue();
		List<ClassificationShareDto> distribution = result.classificationDistribution();
		assertThat(distribution).extracting(ClassificationShareDto::code).containsExactly("SC2", "SC1");
		assertThat(distribution.get(0).hours()).isEqualTo(4.0d);
		assertThat(distribution.get(0).hoursPerDay()).isEqualTo(2.0d);
		assertThat(distribution.get(0).percentage()).isCloseTo(400.0d / 7.0d, within(1e-9));
		assertThat(distribution.get(1).hoursPerDay()).isEqualTo(1.0d);
		assertThat(result.diagnostics()).anyMatch(diagnostic -> "1.2".equals(diagnostic.sequenceKey())
				&& diagnostic.message().contains("classification code"));
	}

	@Test
	void distributionWithoutDaysHasNoPerDayValue() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 8.0d).process(table(
				"1.1;24-045-00 (00);120;SC1;"
		), references);

		assertThat(result.period()).isNull();
		assertThat(result.classificationDistribution().get(0).hoursPerDay()).isNull();
	}

	@Test
	void emptyClassificationColumnDisablesDistribution() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 8.0d).process(table(
				"1.1;24-045-00 (00);120;;"
		), references);

		assertThat(result.classificationEnabled()).isFalse();
		assertThat(result.classificationDistribution()).isEmpty();
		assertThat(result.diagnostics()).anyMatch(diagnostic -> diagnostic.message().contains("distribution disabled"));
	}

	@Test
	void highHoursRowsAreStrictlyAboveThreshold() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 4.0d).process(table(
				"3.1;21-010-01 / A;120;SC1;",
				"3.2;21-010-01 / B;150;SC1;",
				"1.1;24-045-00 (00);240;SC1;"
		), references);

		assertThat(result.highHoursRows()).hasSize(1);
		assertThat(result.highHoursRows().get(0).sequenceKey()).isEqualTo("3.2");
		assertThat(result.highHoursRows().get(0).adjustedHours()).isEqualTo(5.0d);
	}

	@Test
	void reconcilesOnlyRowsThatCheckReferences() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 8.0d).process(table(
				"3.1;EO-2024-001 / CABIN AIR;60;SC1;",
				"2.1;24-045-00 / DOOR;60;SC1;",
				"2.2;99-999-99 / UNKNOWN;60;SC1;",
				"4.1;Not a task;60;SC1;"
		), references);

		assertThat(result.mismatches()).containsExactly(
				new ReconciliationMismatchDto("3.1", "EO-2024-001", ReconciliationMismatchDto.Domain.SECONDARY),
				new ReconciliationMismatchDto("2.2", "99-999-99", ReconciliationMismatchDto.Domain.TASK)
		);
		assertThat(result.toolControlEnabled()).isFalse();
	}

	@Test
	void coefficientSummaryIsOrderedByCoefficient() {
		AggregateResultDto result = engine(new NoBonusStrategy(), 8.0d).process(table(
				"3.1;21-010-01 / A;60;SC1;",
				"1.1;24-045-00 (00);60;SC1;",
				"3.2;21-010-01 / B;120;SC1;"
		), references);

		assertThat(result.coefficientSummary()).containsExactly(
				new CoefficientSummaryDto(1.0d, 1, 1.0d, 1.0d),
				new CoefficientSummaryDto(2.0d, 2, 3.0d, 6.0d)
		);
	}

	private AggregationEngine engine(BonusStrategy bonusStrategy, double threshold) {
		ColumnMapping columns = ColumnMapping.defaults();
		return new AggregationEngine(
				classifier,
				new IdentifierExtractor(),
				new PrefixCoefficientStrategy(coefficients),
				bonusStrategy,
				new ReconciliationEngine(),
				null,
				new WorkpackContextFactory(columns, new CheckGroupMapping(Map.of("A", "A-CHECK"))),
				new AggregationSettings(columns, threshold, true)
		);
	}

	private DataTable table(String... lines) {
		List<DataRow> rows = new ArrayList<>();
		int rowNumber = 0;
		for (String line : lines) {
			String[] cells = line.split(";", -1);
			Map<String, String> values = new LinkedHashMap<>();
			for (int i = 0; i < HEADERS.size(); i++) {
				values.put(HEADERS.get(i), i < cells.length ? cells[i] : "");
			}
			rows.add(new DataRow(++rowNumber, values));
		}
		return new DataTable("wp", HEADERS, rows);
	}

	private ProcessedLineItem processed(int rowNumber, String sequenceKey, double hours) {
		LineItem item = new LineItem(rowNumber, sequenceKey, "title", "60", null, null);
		return new ProcessedLineItem(item, "id", true, hours, 1.0d, hours);
	}
}
