package my.workpackmhrs.app.dto;

import my.workpackmhrs.app.model.WorkpackLabel;
import my.workpackmhrs.app.model.WorkpackPeriod;
import my.workpackmhrs.app.util.ManHours;

import java.util.List;

public record AggregateResultDto(
		String workpackageName,
		WorkpackLabel label,
		String checkGroup,
		WorkpackPeriod period,
		int totalRows,
		int processedRows,
		int excludedRows,
		int duplicateRows,
		double totalBaseHours,
		double rowAdjustedHours,
		double bonusHours,
		double totalAdjustedHours,
		List<BonusContributionDto> bonusBreakdown,
		List<CoefficientSummaryDto> coefficientSummary,
		boolean classificationEnabled,
		List<ClassificationShareDto> classificationDistribution,
		double highHoursThreshold,
		List<HighHoursRowDto> highHoursRows,
		List<ReconciliationMismatchDto> mismatches,
		boolean toolControlEnabled,
		List<ToolControlIssueDto> toolControlIssues,
		List<RunDiagnosticDto> diagnostics
) {
	public AggregateResultDto {
		bonusBreakdown = bonusBreakdown == null ? List.of() : List.copyOf(bonusBreakdown);
		coefficientSummary = coefficientSummary == null ? List.of() : List.copyOf(coefficientSummary);
		classificationDistribution = classificationDistribution == null ? List.of() : List.copyOf(classificationDistribution);
		highHoursRows = highHoursRows == null ? List.of() : List.copyOf(highHoursRows);
		mismatches = mismatches == null ? List.of() : List.copyOf(mismatches);
		toolControlIssues = toolControlIssues == null ? List.of() : List.copyOf(toolControlIssues);
		diagnostics = diagnostics == null ? List.of() : List.copyOf(diagnostics);
	}

	public String totalBaseHhmm() {
		return ManHours.toHhmm(totalBaseHours);
	}

	public String totalAdjustedHhmm() {
		return ManHours.toHhmm(totalAdjustedHours);
	}

	public String bonusHhmm() {
		return ManHours.toHhmm(bonusHours);
	}
}
