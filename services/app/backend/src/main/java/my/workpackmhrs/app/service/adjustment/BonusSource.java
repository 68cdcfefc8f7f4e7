package my.workpackmhrs.app.service.adjustment;

import java.util.List;

public record BonusSource(String name, List<BonusEntry> entries) {
	public BonusSource {
		name = name == null ? "" : name;
		entries = entries == null ? List.of() : List.copyOf(entries);
	}

	public List<BonusEntry> activeEntries() {
		return entries.stream().filter(BonusEntry::isActive).toList();
	}
}
