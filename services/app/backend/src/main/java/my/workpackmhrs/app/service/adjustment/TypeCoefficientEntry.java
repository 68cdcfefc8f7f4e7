package my.workpackmhrs.app.service.adjustment;

public record TypeCoefficientEntry(
		String primaryKey,
		String checkGroup,
		String functionGroup,
		double coefficient,
		Boolean active
) {
	public TypeCoefficientEntry {
		primaryKey = primaryKey == null ? "" : primaryKey.trim();
		checkGroup = checkGroup == null ? "" : checkGroup.trim();
		functionGroup = functionGroup == null ? "" : functionGroup.trim();
	}

	public boolean isActive() {
		return active == null || active;
	}
}
