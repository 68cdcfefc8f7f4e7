package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.model.LineItem;
import my.workpackmhrs.app.model.WorkpackContext;

import java.util.List;

/**
 * Product of the delegate strategies' factors.
 */
public class HybridCoefficientStrategy implements CoefficientStrategy {
	private final List<CoefficientStrategy> delegates;

	public HybridCoefficientStrategy(List<CoefficientStrategy> delegates) {
		this.delegates = delegates == null ? List.of() : List.copyOf(delegates);
	}

	@Override
	public double resolve(LineItem item, String identifier, WorkpackContext context) {
		double factor = 1.0d;
		for (CoefficientStrategy delegate : delegates) {
			factor *= delegate.resolve(item, identifier, context);
		}
		return factor;
	}
}
