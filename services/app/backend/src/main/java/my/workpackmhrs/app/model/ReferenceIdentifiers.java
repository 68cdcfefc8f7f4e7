package my.workpackmhrs.app.model;

import java.util.Set;

public record ReferenceIdentifiers(
		Set<String> taskIds,
		Set<String> secondaryIds,
		String secondaryPrefix
) {
	public ReferenceIdentifiers {
		taskIds = taskIds == null ? Set.of() : Set.copyOf(taskIds);
		secondaryIds = secondaryIds == null ? Set.of() : Set.copyOf(secondaryIds);
		secondaryPrefix = secondaryPrefix == null ? "" : secondaryPrefix.trim();
	}

	public static ReferenceIdentifiers empty() {
		return new ReferenceIdentifiers(Set.of(), Set.of(), "");
	}

	public boolean isSecondary(String identifier) {
		return !secondaryPrefix.isEmpty() && identifier != null && identifier.startsWith(secondaryPrefix);
	}
}
