package my.workpackmhrs.app.model;

import java.util.Arrays;
import java.util.List;

public record ColumnMapping(
		String sequenceKey,
		String title,
		String duration,
		String classificationCode,
		String label,
		String startDate,
		String endDate,
		String functionGroup
) {
	public static ColumnMapping defaults() {
		return new ColumnMapping("Seq. No.", "Title", "Planned Mhrs", "Special code", "A",
				"Start_date", "End_date", "Special type");
	}

	public List<String> mandatory() {
		return Arrays.asList(sequenceKey, title, duration);
	}
}
