package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.dto.BonusContributionDto;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Bonus hours accumulated across every source as {@code secondary -> primary -> hours}.
 * Contributions for the same pair are summed, never overwritten.
 */
public final class BonusTable {
	private static final Logger logger = LoggerFactory.getLogger(BonusTable.class);

	private final Map<String, Map<String, Double>> bySecondary;
	private final List<BonusSource> sources;

	private BonusTable(Map<String, Map<String, Double>> bySecondary, List<BonusSource> sources) {
		this.bySecondary = bySecondary;
		this.sources = sources;
	}

	public static BonusTable empty() {
		return new BonusTable(Map.of(), List.of());
	}

	public static BonusTable accumulate(List<BonusSource> sources) {
		List<BonusSource> safeSources = sources == null ? List.of() : List.copyOf(sources);
		Map<String, Map<String, Double>> totals = new LinkedHashMap<>();
		for (BonusSource source : safeSources) {
			for (BonusEntry entry : source.activeEntries()) {
				if (entry.primaryKey().isEmpty() || entry.secondaryKey().isEmpty()) {
					continue;
				}
				totals.computeIfAbsent(entry.secondaryKey(), key -> new LinkedHashMap<>())
						.merge(entry.primaryKey(), entry.hours(), Double::sum);
			}
		}
		Map<String, Map<String, Double>> frozen = new LinkedHashMap<>();
		totals.forEach((secondary, byPrimary) -> frozen.put(secondary, Map.copyOf(byPrimary)));
		return new BonusTable(Map.copyOf(frozen), safeSources);
	}

	public double lookup(String primaryKey, String secondaryKey) {
		if (primaryKey == null || secondaryKey == null) {
			return 0.0d;
		}
		Map<String, Double> byPrimary = bySecondary.get(secondaryKey.trim());
		if (byPrimary == null) {
			logger.info("No bonus hours configured for secondary key '{}'", secondaryKey);
			return 0.0d;
		}
		Double hours = byPrimary.get(primaryKey.trim());
		if (hours == null) {
			logger.info("No bonus hours configured for primary key '{}' under '{}'", primaryKey, secondaryKey);
			return 0.0d;
		}
		return hours;
	}

	/**
	 * Per-source amounts for the pair, in source order. Audit view only; the total comes from
	 * {@link #lookup(String, String)}.
	 */
	public List<BonusContributionDto> breakdown(String primaryKey, String secondaryKey) {
		if (primaryKey == null || secondaryKey == null) {
			return List.of();
		}
		String primary = primaryKey.trim();
		String secondary = secondaryKey.trim();
		List<BonusContributionDto> contributions = new ArrayList<>();
		for (BonusSource source : sources) {
			double hours = 0.0d;
			boolean matched = false;
			for (BonusEntry entry : source.activeEntries()) {
				if (entry.matches(primary, secondary)) {
					hours += entry.hours();
					matched = true;
				}
			}
			if (matched && hours != 0.0d) {
				contributions.add(new BonusContributionDto(source.name(), hours));
			}
		}
		return contributions;
	}

	public Map<String, Map<String, Double>> asMap() {
		return bySecondary;
	}

	public List<String> sourceNames() {
		return sources.stream().map(BonusSource::name).toList();
	}

	public boolean isEmpty() {
		return bySecondary.isEmpty();
	}
}
