package my.workpackmhrs.app.model;

/**
 * Work-package label such as {@code B787-XYZ-A06}: the primary key is the text before the first
 * dash, the secondary key the text after the last dash.
 */
public record WorkpackLabel(
		String raw,
		String primaryKey,
		String secondaryKey
) {
	public static final WorkpackLabel EMPTY = new WorkpackLabel(null, null, null);

	public static WorkpackLabel parse(String value) {
		if (value == null || value.isBlank()) {
			return EMPTY;
		}
		String trimmed = value.trim();
		int firstDash = trimmed.indexOf('-');
		if (firstDash < 0) {
			return new WorkpackLabel(trimmed, trimmed, trimmed);
		}
		int lastDash = trimmed.lastIndexOf('-');
		String primary = trimmed.substring(0, firstDash).trim();
		String secondary = trimmed.substring(lastDash + 1).trim();
		return new WorkpackLabel(trimmed, primary, secondary);
	}

	public boolean isEmpty() {
		return primaryKey == null || primaryKey.isBlank() || secondaryKey == null || secondaryKey.isBlank();
	}
}
