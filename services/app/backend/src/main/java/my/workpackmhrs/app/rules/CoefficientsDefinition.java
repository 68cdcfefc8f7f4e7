package my.workpackmhrs.app.rules;

import java.util.List;
import java.util.Map;

public class CoefficientsDefinition {
	private Double defaultCoefficient;
	private Map<String, Double> entries;
	private List<String> skipList;
	private Double skipCoefficient;

	public Double getDefaultCoefficient() {
		return defaultCoefficient;
	}

	public void setDefaultCoefficient(Double defaultCoefficient) {
		this.defaultCoefficient = defaultCoefficient;
	}

	public Map<String, Double> getEntries() {
		return entries;
	}

	public void setEntries(Map<String, Double> entries) {
		this.entries = entries;
	}

	public List<String> getSkipList() {
		return skipList;
	}

	public void setSkipList(List<String> skipList) {
		this.skipList = skipList;
	}

	public Double getSkipCoefficient() {
		return skipCoefficient;
	}

	public void setSkipCoefficient(Double skipCoefficient) {
		this.skipCoefficient = skipCoefficient;
	}
}
