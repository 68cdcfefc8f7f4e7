package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.model.LineItem;
import my.workpackmhrs.app.model.WorkpackContext;

public class TypeCoefficientStrategy implements CoefficientStrategy {
	private final TypeCoefficientTable table;

	public TypeCoefficientStrategy(TypeCoefficientTable table) {
		this.table = table == null ? TypeCoefficientTable.empty() : table;
	}

	@Override
	public double resolve(LineItem item, String identifier, WorkpackContext context) {
		if (context == null) {
			return 1.0d;
		}
		return table.lookup(context.checkGroup(), context.primaryKey(), item.functionGroup());
	}
}
