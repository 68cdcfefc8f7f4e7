package my.workpackmhrs.app.service.adjustment;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Coefficients keyed by check group, then primary key, then the row's function group.
 * Inactive entries are dropped when the table is built.
 */
public final class TypeCoefficientTable {
	private static final double DEFAULT_COEFFICIENT = 1.0d;

	private final Map<String, Map<String, Map<String, Double>>> byCheckGroup;

	private TypeCoefficientTable(Map<String, Map<String, Map<String, Double>>> byCheckGroup) {
		this.byCheckGroup = byCheckGroup;
	}

	public static TypeCoefficientTable empty() {
		return new TypeCoefficientTable(Map.of());
	}

	public static TypeCoefficientTable from(List<TypeCoefficientEntry> entries) {
		Map<String, Map<String, Map<String, Double>>> lookup = new LinkedHashMap<>();
		if (entries != null) {
			for (TypeCoefficientEntry entry : entries) {
				if (!entry.isActive() || entry.primaryKey().isEmpty() || entry.checkGroup().isEmpty()
						|| entry.functionGroup().isEmpty()) {
					continue;
				}
				lookup.computeIfAbsent(entry.checkGroup(), key -> new LinkedHashMap<>())
						.computeIfAbsent(entry.primaryKey(), key -> new LinkedHashMap<>())
						.put(entry.functionGroup(), entry.coefficient());
			}
		}
		Map<String, Map<String, Map<String, Double>>> frozen = new LinkedHashMap<>();
		lookup.forEach((checkGroup, byPrimary) -> {
			Map<String, Map<String, Double>> primaryCopy = new LinkedHashMap<>();
			byPrimary.forEach((primary, byFunction) -> primaryCopy.put(primary, Map.copyOf(byFunction)));
			frozen.put(checkGroup, Map.copyOf(primaryCopy));
		});
		return new TypeCoefficientTable(Map.copyOf(frozen));
	}

	public double lookup(String checkGroup, String primaryKey, String functionGroup) {
		if (isBlank(checkGroup) || isBlank(primaryKey) || isBlank(functionGroup)) {
			return DEFAULT_COEFFICIENT;
		}
		Map<String, Map<String, Double>> byPrimary = byCheckGroup.get(checkGroup.trim());
		if (byPrimary == null) {
			return DEFAULT_COEFFICIENT;
		}
		Map<String, Double> byFunction = byPrimary.get(primaryKey.trim());
		if (byFunction == null) {
			return DEFAULT_COEFFICIENT;
		}
		return byFunction.getOrDefault(functionGroup.trim(), DEFAULT_COEFFICIENT);
	}

	public boolean isEmpty() {
		return byCheckGroup.isEmpty();
	}

	public int checkGroupCount() {
		return byCheckGroup.size();
	}

	private boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
