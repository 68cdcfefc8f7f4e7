package my.workpackmhrs.app.service;

import java.util.List;

public class MissingColumnsException extends IllegalArgumentException {
	private final List<String> expectedColumns;
	private final List<String> missingColumns;

	public MissingColumnsException(List<String> expectedColumns, List<String> missingColumns) {
		super("Missing required columns " + missingColumns + " (expected " + expectedColumns + ")");
		this.expectedColumns = List.copyOf(expectedColumns);
		this.missingColumns = List.copyOf(missingColumns);
	}

	public List<String> getExpectedColumns() {
		return expectedColumns;
	}

	public List<String> getMissingColumns() {
		return missingColumns;
	}
}
