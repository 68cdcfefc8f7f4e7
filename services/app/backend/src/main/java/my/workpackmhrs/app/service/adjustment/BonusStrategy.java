package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.model.WorkpackContext;

/**
 * Additive, work-package level bonus. Resolved once per run and added once to the total.
 */
public interface BonusStrategy {
	BonusResolution resolve(WorkpackContext context);
}
