package my.workpackmhrs.app.util;

import java.nio.charset.StandardCharsets;
import java.util.Locale;
import java.util.Set;

public final class CsvParsing {
	private static final Set<String> TRUE_FLAGS = Set.of("true", "1", "yes", "y", "x");
	private static final Set<String> MISSING_MARKERS = Set.of("", "nan", "none", "null");

	private CsvParsing() {
	}

	public static String stripBom(String value) {
		if (value == null || value.isEmpty()) {
			return value;
		}
		if (value.charAt(0) == '\uFEFF') {
			return value.substring(1);
		}
		return value;
	}

	/**
	 * Picks the delimiter from a header line. Semicolon wins whenever it is present.
	 */
	public static char sniffDelimiter(String sample) {
		if (sample == null || sample.isEmpty()) {
			return ',';
		}
		if (sample.indexOf(';') >= 0) {
			return ';';
		}
		if (sample.indexOf('\t') >= 0 && sample.indexOf(',') < 0) {
			return '\t';
		}
		return ',';
	}

	public static String decodeUtf8(byte[] payload) {
		String raw = new String(payload, StandardCharsets.UTF_8);
		return stripBom(raw);
	}

	public static String firstLine(String content) {
		if (content == null) {
			return "";
		}
		int newline = content.indexOf('\n');
		String line = newline < 0 ? content : content.substring(0, newline);
		return line.endsWith("\r") ? line.substring(0, line.length() - 1) : line;
	}

	public static boolean isMissing(String value) {
		return value == null || MISSING_MARKERS.contains(value.trim().toLowerCase(Locale.ROOT));
	}

	public static String trimToEmpty(String value) {
		return value == null ? "" : value.trim();
	}

	/**
	 * Parses a plain or comma-decimal number. Returns null for text that is not a finite number.
	 */
	public static Double parseNumber(String raw) {
		if (isMissing(raw)) {
			return null;
		}
		String value = raw.trim().replace(" ", "");
		if (value.contains(",") && !value.contains(".")) {
			value = value.replace(",", ".");
		}
		try {
			double parsed = Double.parseDouble(value);
			if (Double.isNaN(parsed) || Double.isInfinite(parsed)) {
				return null;
			}
			return parsed;
		} catch (NumberFormatException exc) {
			return null;
		}
	}

	public static boolean parseFlag(String raw) {
		if (raw == null) {
			return false;
		}
		return TRUE_FLAGS.contains(raw.trim().toLowerCase(Locale.ROOT));
	}
}
