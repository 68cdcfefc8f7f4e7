package my.workpackmhrs.app.rules;

import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Maps a work-package secondary key such as {@code A06} to its check group ({@code A-CHECK}).
 * Exact keys win over the leading-letters fallback.
 */
public final class CheckGroupMapping {
	private static final Pattern LEADING_LETTERS = Pattern.compile("^([A-Z]+)");

	private final Map<String, String> groups;

	public CheckGroupMapping(Map<String, String> groups) {
		Map<String, String> normalized = new LinkedHashMap<>();
		if (groups != null) {
			groups.forEach((key, value) -> {
				if (key != null && value != null && !key.isBlank() && !value.isBlank()) {
					normalized.put(key.trim().toUpperCase(Locale.ROOT), value.trim());
				}
			});
		}
		this.groups = Map.copyOf(normalized);
	}

	public static CheckGroupMapping empty() {
		return new CheckGroupMapping(Map.of());
	}

	public String resolve(String secondaryKey) {
		if (secondaryKey == null || secondaryKey.isBlank()) {
			return null;
		}
		String key = secondaryKey.trim().toUpperCase(Locale.ROOT);
		String exact = groups.get(key);
		if (exact != null) {
			return exact;
		}
		Matcher matcher = LEADING_LETTERS.matcher(key);
		if (matcher.find()) {
			return groups.get(matcher.group(1));
		}
		return null;
	}
}
