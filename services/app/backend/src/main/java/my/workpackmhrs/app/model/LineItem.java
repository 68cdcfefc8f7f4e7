package my.workpackmhrs.app.model;

public record LineItem(
		int rowNumber,
		String sequenceKey,
		String title,
		String rawDuration,
		String classificationCode,
		String functionGroup
) {
	public LineItem {
		sequenceKey = sequenceKey == null ? "" : sequenceKey.trim();
	}

	public static LineItem fromRow(DataRow row, ColumnMapping columns) {
		return new LineItem(
				row.rowNumber(),
				row.get(columns.sequenceKey()),
				row.get(columns.title()),
				row.get(columns.duration()),
				row.get(columns.classificationCode()),
				row.get(columns.functionGroup())
		);
	}
}
