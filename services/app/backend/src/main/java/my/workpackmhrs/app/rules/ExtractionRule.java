package my.workpackmhrs.app.rules;

import java.util.Locale;

public enum ExtractionRule {
	PARENTHESIS,
	DELIMITER,
	VERBATIM;

	public static ExtractionRule fromConfig(String value) {
		if (value == null) {
			return null;
		}
		String normalized = value.trim().toLowerCase(Locale.ROOT);
		return switch (normalized) {
			case "parenthesis", "-" -> PARENTHESIS;
			case "delimiter", "/" -> DELIMITER;
			case "verbatim", "whole" -> VERBATIM;
			default -> null;
		};
	}
}
