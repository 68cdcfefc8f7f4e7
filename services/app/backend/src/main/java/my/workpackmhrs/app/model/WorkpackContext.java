package my.workpackmhrs.app.model;

public record WorkpackContext(
		String workpackageName,
		WorkpackLabel label,
		WorkpackPeriod period,
		String checkGroup
) {
	public WorkpackContext {
		label = label == null ? WorkpackLabel.EMPTY : label;
	}

	public String primaryKey() {
		return label.primaryKey();
	}

	public String secondaryKey() {
		return label.secondaryKey();
	}

	public Integer days() {
		return period == null ? null : period.days();
	}
}
