package my.workpackmhrs.app.model;

public record ProcessedLineItem(
		LineItem item,
		String identifier,
		boolean checkReference,
		double baseHours,
		double coefficient,
		double adjustedHours
) {
	public String sequenceKey() {
		return item.sequenceKey();
	}

	public int rowNumber() {
		return item.rowNumber();
	}
}
