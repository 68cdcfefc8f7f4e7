package my.workpackmhrs.app.dto;

public record RunDiagnosticDto(
		Level level,
		Integer rowNumber,
		String sequenceKey,
		String message
) {
	public static RunDiagnosticDto warning(String message) {
		return new RunDiagnosticDto(Level.WARNING, null, null, message);
	}

	public static RunDiagnosticDto warning(int rowNumber, String sequenceKey, String message) {
		return new RunDiagnosticDto(Level.WARNING, rowNumber, sequenceKey, message);
	}

	public static RunDiagnosticDto info(int rowNumber, String sequenceKey, String message) {
		return new RunDiagnosticDto(Level.INFO, rowNumber, sequenceKey, message);
	}

	public enum Level {
		INFO,
		WARNING
	}
}
