package my.workpackmhrs.app.dto;

public record HighHoursRowDto(
		int rowNumber,
		String sequenceKey,
		String title,
		String identifier,
		double baseHours,
		double coefficient,
		double adjustedHours
) {
}
