package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.model.WorkpackContext;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public class TableBonusStrategy implements BonusStrategy {
	private static final Logger logger = LoggerFactory.getLogger(TableBonusStrategy.class);

	private final BonusTable table;

	public TableBonusStrategy(BonusTable table) {
		this.table = table == null ? BonusTable.empty() : table;
	}

	@Override
	public BonusResolution resolve(WorkpackContext context) {
		if (context == null || context.label().isEmpty()) {
			return BonusResolution.NONE;
		}
		String primary = context.primaryKey();
		String secondary = context.secondaryKey();
		double total = table.lookup(primary, secondary);
		if (total == 0.0d) {
			logger.info("No bonus hours found for primary='{}', secondary='{}'", primary, secondary);
			return BonusResolution.NONE;
		}
		logger.info("Applying bonus hours +{} for primary='{}', secondary='{}'", total, primary, secondary);
		return new BonusResolution(total, table.breakdown(primary, secondary));
	}
}
