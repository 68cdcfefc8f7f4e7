package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.model.WorkpackContext;

public class NoBonusStrategy implements BonusStrategy {
	@Override
	public BonusResolution resolve(WorkpackContext context) {
		return BonusResolution.NONE;
	}
}
