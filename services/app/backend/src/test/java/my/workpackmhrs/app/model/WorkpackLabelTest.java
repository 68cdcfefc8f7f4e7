package my.workpackmhrs.app.model;

import org.junit.jupiter.api.Test;

import java.time.LocalDate;

import static org.assertj.core.api.Assertions.assertThat;

class WorkpackLabelTest {
	@Test
	void splitsPrimaryAndSecondaryKeys() {
		WorkpackLabel label = WorkpackLabel.parse(" B787-XYZ-A06 ");

		assertThat(label.raw()).isEqualTo("B787-XYZ-A06");
		assertThat(label.primaryKey()).isEqualTo("B787");
		assertThat(label.secondaryKey()).isEqualTo("A06");
		assertThat(label.isEmpty()).isFalse();
	}

	@Test
	void labelWithoutDashUsesWholeText() {
		WorkpackLabel label = WorkpackLabel.parse("A350");

		assertThat(label.primaryKey()).isEqualTo("A350");
		assertThat(label.secondaryKey()).isEqualTo("A350");
	}

	@Test
	void blankLabelIsEmpty() {
		assertThat(WorkpackLabel.parse("  ").isEmpty()).isTrue();
		assertThat(WorkpackLabel.parse(null)).isSameAs(WorkpackLabel.EMPTY);
	}

	@Test
	void periodCountsBothEndDays() {
		WorkpackPeriod period = WorkpackPeriod.between(LocalDate.of(2024, 3, 1), LocalDate.of(2024, 3, 4));

		assertThat(period.days()).isEqualTo(4);
		assertThat(period.hasPositiveDays()).isTrue();
		assertThat(WorkpackPeriod.ofDays(0).hasPositiveDays()).isFalse();
	}
}
