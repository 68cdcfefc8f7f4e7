package my.workpackmhrs.app.rules;

public class RowClassifier {
	private final PolicyTable policyTable;

	public RowClassifier(PolicyTable policyTable) {
		this.policyTable = policyTable;
	}

	public Classification classify(String sequenceKey) {
		PolicyEntry entry = policyTable.lookup(sequenceKey);
		return switch (entry.processing()) {
			case INCLUDE -> new Classification(true, true, entry.extraction());
			case SKIP_REFERENCE_CHECK -> new Classification(true, false, entry.extraction());
			case EXCLUDE -> new Classification(false, false, entry.extraction());
		};
	}

	public ExtractionRule extractionRule(String sequenceKey) {
		return policyTable.lookup(sequenceKey).extraction();
	}

	public record Classification(boolean shouldProcess, boolean checkReference, ExtractionRule extractionRule) {
	}
}
