package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.rules.CoefficientTable;

import java.util.List;
import java.util.Locale;

public final class AdjustmentStrategies {
	public static final String PREFIX = "prefix";
	public static final String TYPE = "type";
	public static final String HYBRID = "hybrid";
	public static final String TABLE = "table";
	public static final String NONE = "none";

	private AdjustmentStrategies() {
	}

	public static CoefficientStrategy coefficientStrategy(String name, CoefficientTable coefficientTable,
														  TypeCoefficientTable typeCoefficientTable) {
		return switch (normalize(name, PREFIX)) {
			case PREFIX -> new PrefixCoefficientStrategy(coefficientTable);
			case TYPE -> new TypeCoefficientStrategy(typeCoefficientTable);
			case HYBRID -> new HybridCoefficientStrategy(List.of(
					new PrefixCoefficientStrategy(coefficientTable),
					new TypeCoefficientStrategy(typeCoefficientTable)));
			default -> throw new IllegalArgumentException("Unsupported coefficient strategy: " + name);
		};
	}

	public static BonusStrategy bonusStrategy(String name, BonusTable bonusTable) {
		return switch (normalize(name, TABLE)) {
			case TABLE -> new TableBonusStrategy(bonusTable);
			case NONE -> new NoBonusStrategy();
			default -> throw new IllegalArgumentException("Unsupported bonus strategy: " + name);
		};
	}

	private static String normalize(String name, String fallback) {
		if (name == null || name.isBlank()) {
			return fallback;
		}
		return name.trim().toLowerCase(Locale.ROOT);
	}
}
