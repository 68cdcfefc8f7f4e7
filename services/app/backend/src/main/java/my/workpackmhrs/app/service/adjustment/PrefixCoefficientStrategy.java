package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.model.LineItem;
import my.workpackmhrs.app.model.WorkpackContext;
import my.workpackmhrs.app.rules.CoefficientTable;

public class PrefixCoefficientStrategy implements CoefficientStrategy {
	private final CoefficientTable table;

	public PrefixCoefficientStrategy(CoefficientTable table) {
		this.table = table == null ? CoefficientTable.uniform() : table;
	}

	@Override
	public double resolve(LineItem item, String identifier, WorkpackContext context) {
		return table.resolve(item.sequenceKey(), identifier);
	}
}
