package my.workpackmhrs.app.rules;

import java.util.Locale;

public enum ProcessingPolicy {
	INCLUDE,
	SKIP_REFERENCE_CHECK,
	EXCLUDE;

	/**
	 * Accepts the enum names in any case plus the legacy settings values
	 * ({@code true}, {@code false}, {@code ignore}). Returns null for anything else.
	 */
	public static ProcessingPolicy fromConfig(String value) {
		if (value == null) {
			return null;
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT).replace('-', '_');
		return switch (normalized) {
			case "include", "true" -> INCLUDE;
			case "skip_reference_check", "include_but_skip_reference_check", "false" -> SKIP_REFERENCE_CHECK;
			case "exclude", "ignore" -> EXCLUDE;
			default -> null;
		};
	}
}
