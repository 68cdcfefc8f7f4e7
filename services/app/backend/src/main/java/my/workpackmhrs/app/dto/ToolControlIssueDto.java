package my.workpackmhrs.app.dto;

public record ToolControlIssueDto(
		int rowNumber,
		String sequenceKey,
		String identifier,
		String partNumber,
		String toolName,
		String type
) {
}
