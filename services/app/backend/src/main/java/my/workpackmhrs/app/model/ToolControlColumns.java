package my.workpackmhrs.app.model;

import java.util.Arrays;
import java.util.List;

public record ToolControlColumns(
		String toolName,
		String toolType,
		String partNumber,
		String totalQty,
		String altQty
) {
	public static ToolControlColumns defaults() {
		return new ToolControlColumns("Tool Name", "Tool Type", "Part No", "total_qty", "altpart_total_qty");
	}

	public List<String> all() {
		return Arrays.asList(toolName, toolType, partNumber, totalQty, altQty);
	}
}
