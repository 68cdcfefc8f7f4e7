package my.workpackmhrs.app.rules;

import java.util.List;
import java.util.Map;

public class EngineRulesDefinition {
	private int schemaVersion;
	private String name;
	private String extractionDelimiter;
	private PolicyDefinition defaultPolicy;
	private List<PolicyDefinition> policies;
	private CoefficientsDefinition coefficients;
	private Map<String, String> checkGroups;

	public int getSchemaVersion() {
		return schemaVersion;
	}

	public void setSchemaVersion(int schemaVersion) {
		this.schemaVersion = schemaVersion;
	}

	public String getName() {
		return name;
	}

	public void setName(String name) {
		this.name = name;
	}

	public String getExtractionDelimiter() {
		return extractionDelimiter;
	}

	public void setExtractionDelimiter(String extractionDelimiter) {
		this.extractionDelimiter = extractionDelimiter;
	}

	public PolicyDefinition getDefaultPolicy() {
		return defaultPolicy;
	}

	public void setDefaultPolicy(PolicyDefinition defaultPolicy) {
		this.defaultPolicy = defaultPolicy;
	}

	public List<PolicyDefinition> getPolicies() {
		return policies;
	}

	public void setPolicies(List<PolicyDefinition> policies) {
		this.policies = policies;
	}

	public CoefficientsDefinition getCoefficients() {
		return coefficients;
	}

	public void setCoefficients(CoefficientsDefinition coefficients) {
		this.coefficients = coefficients;
	}

	public Map<String, String> getCheckGroups() {
		return checkGroups;
	}

	public void setCheckGroups(Map<String, String> checkGroups) {
		this.checkGroups = checkGroups;
	}
}
