package my.workpackmhrs.app.rules;

/**
 * Turns a title such as {@code "24-045-00 (00) - ITEM 1"} or {@code "EO-2024-001 / CABIN AIR"}
 * into the task identifier it starts with.
 */
public class IdentifierExtractor {
	public static final String DEFAULT_DELIMITER = "/";

	private final String delimiter;

	public IdentifierExtractor() {
		this(DEFAULT_DELIMITER);
	}

	public IdentifierExtractor(String delimiter) {
		this.delimiter = delimiter == null || delimiter.isEmpty() ? DEFAULT_DELIMITER : delimiter;
	}

	public String extract(String title, ExtractionRule rule) {
		if (title == null) {
			return "";
		}
		if (rule == null) {
			return title.trim();
		}
		return switch (rule) {
			case PARENTHESIS -> before(title, "(");
			case DELIMITER -> before(title, delimiter);
			case VERBATIM -> title.trim();
		};
	}

	private String before(String title, String separator) {
		int index = title.indexOf(separator);
		if (index < 0) {
			return title.trim();
		}
		return title.substring(0, index).trim();
	}

	public String delimiter() {
		return delimiter;
	}
}
