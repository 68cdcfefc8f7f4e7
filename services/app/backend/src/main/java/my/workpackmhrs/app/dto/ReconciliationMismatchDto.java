package my.workpackmhrs.app.dto;

public record ReconciliationMismatchDto(
		String sequenceKey,
		String identifier,
		Domain domain
) {
	public enum Domain {
		TASK,
		SECONDARY
	}
}
