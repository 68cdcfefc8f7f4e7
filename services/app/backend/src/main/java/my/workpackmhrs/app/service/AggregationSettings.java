package my.workpackmhrs.app.service;

import my.workpackmhrs.app.model.ColumnMapping;

public record AggregationSettings(
		ColumnMapping columns,
		double highHoursThreshold,
		boolean classificationEnabled
) {
	public static final double DEFAULT_HIGH_HOURS_THRESHOLD = 8.0d;

	public AggregationSettings {
		columns = columns == null ? ColumnMapping.defaults() : columns;
	}

	public static AggregationSettings defaults() {
		return new AggregationSettings(ColumnMapping.defaults(), DEFAULT_HIGH_HOURS_THRESHOLD, true);
	}
}
