package my.workpackmhrs.app.service.adjustment;

public record BonusEntry(
		String primaryKey,
		String secondaryKey,
		double hours,
		Boolean active
) {
	public BonusEntry {
		primaryKey = primaryKey == null ? "" : primaryKey.trim();
		secondaryKey = secondaryKey == null ? "" : secondaryKey.trim();
	}

	public boolean isActive() {
		return active == null || active;
	}

	public boolean matches(String primary, String secondary) {
		return primaryKey.equals(primary) && secondaryKey.equals(secondary);
	}
}
