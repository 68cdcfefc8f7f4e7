package my.workpackmhrs.app.service;

import my.workpackmhrs.app.dto.ReconciliationMismatchDto;
import my.workpackmhrs.app.model.ProcessedLineItem;
import my.workpackmhrs.app.model.ReferenceIdentifiers;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

public class ReconciliationEngine {

	/**
	 * Identifiers carrying the secondary prefix are checked against the secondary set only,
	 * everything else against the task set only. Mismatches keep input order.
	 */
	public List<ReconciliationMismatchDto> reconcile(List<ProcessedLineItem> items, ReferenceIdentifiers references) {
		ReferenceIdentifiers refs = references == null ? ReferenceIdentifiers.empty() : references;
		List<ReconciliationMismatchDto> mismatches = new ArrayList<>();
		if (items == null) {
			return mismatches;
		}
		for (ProcessedLineItem item : items) {
			if (!item.checkReference()) {
				continue;
			}
			String identifier = item.identifier() == null ? "" : item.identifier();
			boolean secondary = refs.isSecondary(identifier);
			Set<String> domain = secondary ? refs.secondaryIds() : refs.taskIds();
			if (!domain.contains(identifier)) {
				mismatches.add(new ReconciliationMismatchDto(item.sequenceKey(), identifier,
						secondary ? ReconciliationMismatchDto.Domain.SECONDARY : ReconciliationMismatchDto.Domain.TASK));
			}
		}
		return mismatches;
	}
}
