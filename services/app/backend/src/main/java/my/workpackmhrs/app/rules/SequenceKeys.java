package my.workpackmhrs.app.rules;

import my.workpackmhrs.app.util.CsvParsing;

import java.util.Locale;
import java.util.regex.Pattern;

public final class SequenceKeys {
	private static final Pattern WELL_FORMED = Pattern.compile("^\\d+\\.\\d+$");

	private SequenceKeys() {
	}

	/**
	 * Major prefix of a sequence key: everything before the first dot, upper-cased.
	 * Blank and {@code nan} keys have an empty prefix.
	 */
	public static String majorPrefix(String sequenceKey) {
		if (CsvParsing.isMissing(sequenceKey)) {
			return "";
		}
		String trimmed = sequenceKey.trim();
		int dot = trimmed.indexOf('.');
		String prefix = dot < 0 ? trimmed : trimmed.substring(0, dot);
		return prefix.trim().toUpperCase(Locale.ROOT);
	}

	/**
	 * Normalises a configured key ({@code SEQ_2.X}, {@code SEQ_2.X_ID}, {@code 2.X} or {@code 2})
	 * to the bare major prefix.
	 */
	public static String normalizePrefix(String configKey) {
		if (configKey == null) {
			return "";
		}
		String key = configKey.trim().toUpperCase(Locale.ROOT);
		if (key.startsWith("SEQ_")) {
			key = key.substring(4);
		}
		if (key.endsWith("_ID")) {
			key = key.substring(0, key.length() - 3);
		}
		if (key.endsWith(".X")) {
			key = key.substring(0, key.length() - 2);
		}
		return majorPrefix(key);
	}

	public static boolean isWellFormed(String sequenceKey) {
		return sequenceKey != null && WELL_FORMED.matcher(sequenceKey.trim()).matches();
	}
}
