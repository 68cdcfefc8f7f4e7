package my.workpackmhrs.app.rules;

public record PolicyEntry(ProcessingPolicy processing, ExtractionRule extraction) {
	public static final PolicyEntry DEFAULT = new PolicyEntry(ProcessingPolicy.INCLUDE, ExtractionRule.DELIMITER);

	public PolicyEntry {
		processing = processing == null ? ProcessingPolicy.INCLUDE : processing;
		extraction = extraction == null ? ExtractionRule.DELIMITER : extraction;
	}
}
