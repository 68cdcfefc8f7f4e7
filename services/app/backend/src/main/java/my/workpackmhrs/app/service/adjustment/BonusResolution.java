package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.dto.BonusContributionDto;

import java.util.List;

public record BonusResolution(double total, List<BonusContributionDto> breakdown) {
	public static final BonusResolution NONE = new BonusResolution(0.0d, List.of());

	public BonusResolution {
		breakdown = breakdown == null ? List.of() : List.copyOf(breakdown);
	}
}
