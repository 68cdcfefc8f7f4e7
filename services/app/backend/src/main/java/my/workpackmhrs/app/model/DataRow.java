package my.workpackmhrs.app.model;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

public record DataRow(
		int rowNumber,
		Map<String, String> values
) {
	public DataRow {
		// LinkedHashMap keeps column order and tolerates null cells
		values = values == null ? Map.of() : Collections.unmodifiableMap(new LinkedHashMap<>(values));
	}

	public String get(String column) {
		if (column == null) {
			return null;
		}
		return values.get(column);
	}
}
