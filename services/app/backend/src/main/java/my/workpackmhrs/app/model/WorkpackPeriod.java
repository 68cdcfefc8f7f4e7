package my.workpackmhrs.app.model;

import java.time.LocalDate;
import java.time.temporal.ChronoUnit;

public record WorkpackPeriod(
		LocalDate startDate,
		LocalDate endDate,
		Integer days
) {
	public static WorkpackPeriod between(LocalDate startDate, LocalDate endDate) {
		// both the start and the end day count
		int days = (int) ChronoUnit.DAYS.between(startDate, endDate) + 1;
		return new WorkpackPeriod(startDate, endDate, days);
	}

	public static WorkpackPeriod ofDays(int days) {
		return new WorkpackPeriod(null, null, days);
	}

	public boolean hasPositiveDays() {
		return days != null && days > 0;
	}
}
