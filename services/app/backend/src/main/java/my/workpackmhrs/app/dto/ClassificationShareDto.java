package my.workpackmhrs.app.dto;

public record ClassificationShareDto(
		String code,
		double hours,
		Double hoursPerDay,
		Double percentage
) {
}
