package my.workpackmhrs.app.dto;

public record CoefficientSummaryDto(
		double coefficient,
		int rowCount,
		double baseHours,
		double adjustedHours
) {
}
