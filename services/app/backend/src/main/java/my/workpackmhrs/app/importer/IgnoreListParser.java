package my.workpackmhrs.app.importer;

import java.util.LinkedHashSet;
import java.util.Locale;
import java.util.Set;

/**
 * One item per line. Blank lines and lines starting with {@code #} are skipped, items are lower-cased.
 */
public class IgnoreListParser {
	public Set<String> parse(String content) {
		Set<String> items = new LinkedHashSet<>();
		if (content == null) {
			return items;
		}
		for (String line : content.split("\\R")) {
			String item = line.trim();
			if (item.isEmpty() || item.startsWith("#")) {
				continue;
			}
			items.add(item.toLowerCase(Locale.ROOT));
		}
		return items;
	}
}
