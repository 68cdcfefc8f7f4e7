package my.workpackmhrs.app.dto;

public record BonusContributionDto(String source, double hours) {
}
