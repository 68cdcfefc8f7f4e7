package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.model.LineItem;
import my.workpackmhrs.app.model.WorkpackContext;

/**
 * Multiplicative scale factor for one row's base hours.
 */
public interface CoefficientStrategy {
	double resolve(LineItem item, String identifier, WorkpackContext context);
}
