package my.workpackmhrs.app.rules;

public class PolicyDefinition {
	private String prefix;
	private String processing;
	private String extraction;

	public PolicyDefinition() {
	}

	public PolicyDefinition(String prefix, String processing, String extraction) {
		this.prefix = prefix;
		this.processing = processing;
		this.extraction = extraction;
	}

	public String getPrefix() {
		return prefix;
	}

	public void setPrefix(String prefix) {
		this.prefix = prefix;
	}

	public String getProcessing() {
		return processing;
	}

	public void setProcessing(String processing) {
		this.processing = processing;
	}

	public String getExtraction() {
		return extraction;
	}

	public void setExtraction(String extraction) {
		this.extraction = extraction;
	}
}
