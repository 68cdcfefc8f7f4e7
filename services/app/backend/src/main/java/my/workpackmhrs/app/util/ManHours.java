package my.workpackmhrs.app.util;

public final class ManHours {
	private static final double MINUTES_PER_HOUR = 60.0d;

	private ManHours() {
	}

	/**
	 * Converts a planned duration in minutes to hours. Blank cells count as zero; text that is
	 * not a number yields null so the caller can report it.
	 */
	public static Double minutesToHours(String rawMinutes) {
		if (CsvParsing.isMissing(rawMinutes)) {
			return 0.0d;
		}
		Double minutes = CsvParsing.parseNumber(rawMinutes);
		if (minutes == null) {
			return null;
		}
		return minutes / MINUTES_PER_HOUR;
	}

	/**
	 * Formats hours as {@code HH:MM}, rounding to the nearest minute. Negative values render as 00:00.
	 */
	public static String toHhmm(double hours) {
		if (hours < 0 || Double.isNaN(hours)) {
			return "00:00";
		}
		long totalMinutes = Math.round(hours * MINUTES_PER_HOUR);
		long h = totalMinutes / 60;
		long m = totalMinutes % 60;
		return String.format("%02d:%02d", h, m);
	}
}
