package my.workpackmhrs.app.model;

import java.util.List;

public record DataTable(
		String name,
		List<String> headers,
		List<DataRow> rows
) {
	public DataTable {
		name = name == null ? "" : name;
		headers = headers == null ? List.of() : List.copyOf(headers);
		rows = rows == null ? List.of() : List.copyOf(rows);
	}

	public boolean hasColumn(String column) {
		return column != null && !column.isBlank() && headers.contains(column);
	}

	public String firstValue(String column) {
		if (!hasColumn(column) || rows.isEmpty()) {
			return null;
		}
		return rows.get(0).get(column);
	}

	public boolean hasAnyValue(String column) {
		if (!hasColumn(column)) {
			return false;
		}
		for (DataRow row : rows) {
			String value = row.get(column);
			if (value != null && !value.isBlank()) {
				return true;
			}
		}
		return false;
	}
}
