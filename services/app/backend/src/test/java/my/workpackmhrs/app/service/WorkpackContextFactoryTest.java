package my.workpackmhrs.app.service;

import my.workpackmhrs.app.dto.RunDiagnosticDto;
import my.workpackmhrs.app.model.ColumnMapping;
import my.workpackmhrs.app.model.DataRow;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.model.WorkpackContext;
import my.workpackmhrs.app.rules.CheckGroupMapping;
import org.junit.jupiter.api.Test;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class WorkpackContextFactoryTest {
	private final WorkpackContextFactory factory = new WorkpackContextFactory(ColumnMapping.defaults(),
			new CheckGroupMapping(Map.of("A", "A-CHECK")));

	@Test
	void readsLabelPeriodAndCheckGroupFromFirstRow() {
		List<RunDiagnosticDto> diagnostics = new ArrayList<>();

		WorkpackContext context = factory.build(table("B787-XYZ-A06", "2024-03-01 00:00:00", "2024-03-04"), null,
				diagnostics);

		assertThat(context.primaryKey()).isEqualTo("B787");
		assertThat(context.secondaryKey()).isEqualTo("A06");
		assertThat(context.checkGroup()).isEqualTo("A-CHECK");
		assertThat(context.period().startDate()).isEqualTo(LocalDate.of(2024, 3, 1));
		assertThat(context.days()).isEqualTo(4);
		assertThat(diagnostics).isEmpty();
	}

	@Test
	void acceptsDayFirstDates() {
		WorkpackContext context = factory.build(table("B787-A06", "28/02/2024", "01/03/2024"), null,
				new ArrayList<>());

		assertThat(context.days()).isEqualTo(3);
	}

	@Test
	void explicitDaysWin() {
		WorkpackContext context = factory.build(table("B787-A06", "2024-03-01", "2024-03-04"), 10, new ArrayList<>());

		assertThat(context.days()).isEqualTo(10);
	}

	@Test
	void badDatesGiveWarningAndNoPeriod() {
		List<RunDiagnosticDto> diagnostics = new ArrayList<>();

		WorkpackContext reversed = factory.build(table("B787-A06", "2024-03-04", "2024-03-01"), null, diagnostics);
		WorkpackContext garbage = factory.build(table("B787-A06", "soon", "later"), null, diagnostics);

		assertThat(reversed.period()).isNull();
		assertThat(garbage.period()).isNull();
		assertThat(diagnostics).hasSize(2).allMatch(diagnostic -> diagnostic.level() == RunDiagnosticDto.Level.WARNING);
	}

	@Test
	void emptyLabelGivesWarning() {
		List<RunDiagnosticDto> diagnostics = new ArrayList<>();

		WorkpackContext context = factory.build(table(" ", "2024-03-01", "2024-03-01"), null, diagnostics);

		assertThat(context.label().isEmpty()).isTrue();
		assertThat(context.checkGroup()).isNull();
		assertThat(context.days()).isEqualTo(1);
		assertThat(diagnostics).singleElement()
				.satisfies(diagnostic -> assertThat(diagnostic.message()).contains("no bonus hours"));
	}

	private DataTable table(String label, String start, String end) {
		Map<String, String> values = new LinkedHashMap<>();
		values.put("A", label);
		values.put("Start_date", start);
		values.put("End_date", end);
		return new DataTable("wp", List.of("A", "Start_date", "End_date"), List.of(new DataRow(1, values)));
	}
}
