package my.workpackmhrs.app.rules;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

public final class PolicyTable {
	private final Map<String, PolicyEntry> entries;
	private final PolicyEntry defaultEntry;

	public PolicyTable(Map<String, PolicyEntry> entries, PolicyEntry defaultEntry) {
		Map<String, PolicyEntry> normalized = new LinkedHashMap<>();
		if (entries != null) {
			entries.forEach((prefix, entry) -> normalized.put(SequenceKeys.normalizePrefix(prefix), entry));
		}
		this.entries = Map.copyOf(normalized);
		this.defaultEntry = defaultEntry == null ? PolicyEntry.DEFAULT : defaultEntry;
	}

	public static PolicyTable from(EngineRulesDefinition definition) {
		PolicyEntry defaultEntry = PolicyEntry.DEFAULT;
		if (definition.getDefaultPolicy() != null) {
			defaultEntry = toEntry(definition.getDefaultPolicy(), PolicyEntry.DEFAULT);
		}
		Map<String, PolicyEntry> entries = new LinkedHashMap<>();
		List<PolicyDefinition> policies = definition.getPolicies() == null ? List.of() : definition.getPolicies();
		for (PolicyDefinition policy : policies) {
			entries.put(policy.getPrefix(), toEntry(policy, defaultEntry));
		}
		return new PolicyTable(entries, defaultEntry);
	}

	private static PolicyEntry toEntry(PolicyDefinition policy, PolicyEntry fallback) {
		ProcessingPolicy processing = fallback.processing();
		if (policy.getProcessing() != null) {
			processing = ProcessingPolicy.fromConfig(policy.getProcessing());
			if (processing == null) {
				throw new IllegalArgumentException("Unknown processing policy '" + policy.getProcessing()
						+ "' for prefix " + policy.getPrefix());
			}
		}
		ExtractionRule extraction = fallback.extraction();
		if (policy.getExtraction() != null) {
			extraction = ExtractionRule.fromConfig(policy.getExtraction());
			if (extraction == null) {
				throw new IllegalArgumentException("Unknown extraction rule '" + policy.getExtraction()
						+ "' for prefix " + policy.getPrefix());
			}
		}
		return new PolicyEntry(processing, extraction);
	}

	public PolicyEntry lookup(String sequenceKey) {
		return entryForPrefix(SequenceKeys.majorPrefix(sequenceKey));
	}

	public PolicyEntry entryForPrefix(String prefix) {
		if (prefix == null || prefix.isEmpty()) {
			return defaultEntry;
		}
		return entries.getOrDefault(prefix, defaultEntry);
	}

	public Map<String, PolicyEntry> entries() {
		return entries;
	}

	public PolicyEntry defaultEntry() {
		return defaultEntry;
	}
}
