package my.workpackmhrs.app.rules;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

public class EngineRulesValidator {
	public List<String> validate(EngineRulesDefinition definition) {
		List<String> errors = new ArrayList<>();
		if (definition == null) {
			errors.add("Engine rules are empty");
			return errors;
		}
		if (definition.getSchemaVersion() != 1) {
			errors.add("schema_version must be 1");
		}
		if (definition.getName() == null || definition.getName().isBlank()) {
			errors.add("name is required");
		}
		if (definition.getExtractionDelimiter() != null && definition.getExtractionDelimiter().isEmpty()) {
			errors.add("extraction_delimiter must not be empty");
		}
		if (definition.getDefaultPolicy() != null) {
			validatePolicyValues(definition.getDefaultPolicy(), "default_policy", errors);
		}
		validatePolicies(definition.getPolicies(), errors);
		validateCoefficients(definition.getCoefficients(), errors);
		validateCheckGroups(definition.getCheckGroups(), errors);
		return errors;
	}

	private void validatePolicies(List<PolicyDefinition> policies, List<String> errors) {
		if (policies == null) {
			return;
		}
		Set<String> seen = new HashSet<>();
		for (PolicyDefinition policy : policies) {
			if (policy == null) {
				errors.add("policies must not contain empty entries");
				continue;
			}
			String prefix = SequenceKeys.normalizePrefix(policy.getPrefix());
			if (prefix.isEmpty()) {
				errors.add("policy.prefix is required");
			} else if (!seen.add(prefix)) {
				errors.add("policy.prefix " + prefix + " is defined more than once");
			}
			validatePolicyValues(policy, "policy " + prefix, errors);
		}
	}

	private void validatePolicyValues(PolicyDefinition policy, String label, List<String> errors) {
		if (policy.getProcessing() != null && ProcessingPolicy.fromConfig(policy.getProcessing()) == null) {
			errors.add(label + ": processing must be one of include, skip_reference_check, exclude");
		}
		if (policy.getExtraction() != null && ExtractionRule.fromConfig(policy.getExtraction()) == null) {
			errors.add(label + ": extraction must be one of parenthesis, delimiter, verbatim");
		}
	}

	private void validateCoefficients(CoefficientsDefinition coefficients, List<String> errors) {
		if (coefficients == null) {
			return;
		}
		if (coefficients.getDefaultCoefficient() != null && coefficients.getDefaultCoefficient() <= 0) {
			errors.add("coefficients.default_coefficient must be positive");
		}
		if (coefficients.getSkipCoefficient() != null && coefficients.getSkipCoefficient() <= 0) {
			errors.add("coefficients.skip_coefficient must be positive");
		}
		if (coefficients.getEntries() != null) {
			Set<String> seen = new HashSet<>();
			for (Map.Entry<String, Double> entry : coefficients.getEntries().entrySet()) {
				String prefix = SequenceKeys.normalizePrefix(entry.getKey());
				if (prefix.isEmpty()) {
					errors.add("coefficients.entries keys must name a sequence prefix");
				} else if (!seen.add(prefix)) {
					errors.add("coefficients.entries prefix " + prefix + " is defined more than once");
				}
				if (entry.getValue() == null || entry.getValue() <= 0) {
					errors.add("coefficients.entries." + entry.getKey() + " must be positive");
				}
			}
		}
		if (coefficients.getSkipList() != null) {
			for (String item : coefficients.getSkipList()) {
				if (item == null || item.isBlank()) {
					errors.add("coefficients.skip_list must not contain blank entries");
					break;
				}
			}
		}
	}

	private void validateCheckGroups(Map<String, String> checkGroups, List<String> errors) {
		if (checkGroups == null) {
			return;
		}
		for (Map.Entry<String, String> entry : checkGroups.entrySet()) {
			if (entry.getKey() == null || entry.getKey().isBlank()) {
				errors.add("check_groups keys must not be blank");
			}
			if (entry.getValue() == null || entry.getValue().isBlank()) {
				errors.add("check_groups." + entry.getKey() + " must not be blank");
			}
		}
	}
}
