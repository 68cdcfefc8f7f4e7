package my.workpackmhrs.app.rules;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

public final class CoefficientTable {
	public static final double DEFAULT_COEFFICIENT = 1.0d;

	private final Map<String, Double> byPrefix;
	private final double defaultCoefficient;
	private final List<String> skipList;
	private final double skipCoefficient;

	public CoefficientTable(Map<String, Double> byPrefix, double defaultCoefficient, List<String> skipList,
							double skipCoefficient) {
		Map<String, Double> normalized = new LinkedHashMap<>();
		if (byPrefix != null) {
			byPrefix.forEach((key, value) -> {
				if (value != null) {
					normalized.put(SequenceKeys.normalizePrefix(key), value);
				}
			});
		}
		List<String> skip = new ArrayList<>();
		if (skipList != null) {
			for (String entry : skipList) {
				if (entry != null && !entry.isBlank()) {
					skip.add(entry.trim().toLowerCase(Locale.ROOT));
				}
			}
		}
		this.byPrefix = Map.copyOf(normalized);
		this.defaultCoefficient = defaultCoefficient;
		this.skipList = List.copyOf(skip);
		this.skipCoefficient = skipCoefficient;
	}

	public static CoefficientTable uniform() {
		return new CoefficientTable(Map.of(), DEFAULT_COEFFICIENT, List.of(), DEFAULT_COEFFICIENT);
	}

	public static CoefficientTable from(CoefficientsDefinition definition) {
		if (definition == null) {
			return uniform();
		}
		double defaultCoefficient = definition.getDefaultCoefficient() == null
				? DEFAULT_COEFFICIENT
				: definition.getDefaultCoefficient();
		double skipCoefficient = definition.getSkipCoefficient() == null
				? DEFAULT_COEFFICIENT
				: definition.getSkipCoefficient();
		return new CoefficientTable(definition.getEntries(), defaultCoefficient, definition.getSkipList(), skipCoefficient);
	}

	/**
	 * Skip-list matches on the identifier win over the prefix lookup.
	 */
	public double resolve(String sequenceKey, String identifier) {
		if (identifier != null && !skipList.isEmpty()) {
			String lower = identifier.toLowerCase(Locale.ROOT);
			for (String entry : skipList) {
				if (lower.contains(entry)) {
					return skipCoefficient;
				}
			}
		}
		return forPrefix(SequenceKeys.majorPrefix(sequenceKey));
	}

	public double forPrefix(String prefix) {
		if (prefix == null || prefix.isEmpty()) {
			return defaultCoefficient;
		}
		return byPrefix.getOrDefault(prefix, defaultCoefficient);
	}

	public Map<String, Double> byPrefix() {
		return byPrefix;
	}

	public double defaultCoefficient() {
		return defaultCoefficient;
	}

	public List<String> skipList() {
		return skipList;
	}

	public double skipCoefficient() {
		return skipCoefficient;
	}
}
