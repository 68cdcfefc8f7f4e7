package my.workpackmhrs.app.config;

import jakarta.validation.Valid;
import jakarta.validation.constraints.NotBlank;
import jakarta.validation.constraints.NotNull;
import jakarta.validation.constraints.PositiveOrZero;
import my.workpackmhrs.app.model.ColumnMapping;
import my.workpackmhrs.app.model.ToolControlColumns;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.validation.annotation.Validated;

@Validated
@ConfigurationProperties(prefix = "app")
public record AppProperties(
		@Valid @NotNull Engine engine,
		@Valid @NotNull Columns columns,
		@Valid Reference reference,
		@Valid Bonus bonus,
		@Valid TypeCoefficient typeCoefficient,
		@Valid ToolControl toolControl
) {
	public record Engine(
			@NotBlank String rulesLocation,
			@NotBlank String coefficientStrategy,
			@NotBlank String bonusStrategy,
			@PositiveOrZero Double highHoursThreshold,
			boolean classificationEnabled
	) {
	}

	public record Columns(
			@NotBlank String sequenceKey,
			@NotBlank String title,
			@NotBlank String duration,
			String classificationCode,
			String label,
			String startDate,
			String endDate,
			String functionGroup
	) {
		public ColumnMapping toMapping() {
			return new ColumnMapping(sequenceKey, title, duration, classificationCode, label, startDate, endDate,
					functionGroup);
		}
	}

	public record Reference(
			String taskIdsLocation,
			@NotBlank String taskIdColumn,
			String secondaryIdsLocation,
			@NotBlank String secondaryIdColumn,
			String secondaryPrefix
	) {
	}

	public record Bonus(
			String sourcesPattern,
			@NotBlank String primaryColumn,
			@NotBlank String secondaryColumn,
			@NotBlank String hoursColumn,
			String activeColumn
	) {
	}

	public record TypeCoefficient(
			String location,
			@NotBlank String primaryColumn,
			@NotBlank String checkGroupColumn,
			@NotBlank String functionGroupColumn,
			@NotBlank String coefficientColumn,
			String activeColumn
	) {
	}

	public record ToolControl(
			boolean enabled,
			String ignoreListLocation,
			@NotBlank String toolName,
			@NotBlank String toolType,
			@NotBlank String partNumber,
			@NotBlank String totalQty,
			@NotBlank String altQty
	) {
		public ToolControlColumns toColumns() {
			return new ToolControlColumns(toolName, toolType, partNumber, totalQty, altQty);
		}
	}
}
