package my.workpackmhrs.app.service.adjustment;

import my.workpackmhrs.app.model.LineItem;
import my.workpackmhrs.app.model.WorkpackContext;
import my.workpackmhrs.app.model.WorkpackLabel;
import my.workpackmhrs.app.rules.CoefficientTable;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

class CoefficientStrategyTest {
	private final CoefficientTable prefixTable = new CoefficientTable(Map.of("3", 2.0d), 1.0d, List.of("NDT"), 0.5d);
	private final TypeCoefficientTable typeTable = TypeCoefficientTable.from(List.of(
			new TypeCoefficientEntry("B787", "A-CHECK", "STR", 1.5d, true),
			new TypeCoefficientEntry("B787", "A-CHECK", "AVI", 3.0d, false),
			new TypeCoefficientEntry("B787", "C-CHECK", "STR", 4.0d, null)
	));
	private final WorkpackContext context = new WorkpackContext("wp", WorkpackLabel.parse("B787-XYZ-A06"), null,
			"A-CHECK");

	@Test
	void prefixStrategyUsesSequencePrefixAndSkipList() {
		PrefixCoefficientStrategy strategy = new PrefixCoefficientStrategy(prefixTable);

		assertThat(strategy.resolve(item("3.1", "STR"), "24-045-00", context)).isEqualTo(2.0d);
		assertThat(strategy.resolve(item("3.1", "STR"), "24-NDT-00", context)).isEqualTo(0.5d);
		assertThat(strategy.resolve(item("1.1", "STR"), "24-045-00", context)).isEqualTo(1.0d);
	}

	@Test
	void typeStrategyUsesCheckGroupPrimaryKeyAndFunctionGroup() {
		TypeCoefficientStrategy strategy = new TypeCoefficientStrategy(typeTable);

		assertThat(strategy.resolve(item("1.1", "STR"), "x", context)).isEqualTo(1.5d);
		assertThat(strategy.resolve(item("1.1", "AVI"), "x", context)).isEqualTo(1.0d);
		assertThat(strategy.resolve(item("1.1", null), "x", context)).isEqualTo(1.0d);
		assertThat(strategy.resolve(item("1.1", "STR"), "x",
				new WorkpackContext("wp", WorkpackLabel.parse("B787-XYZ-A06"), null, null))).isEqualTo(1.0d);
	}

	@Test
	void hybridStrategyMultipliesFactors() {
		CoefficientStrategy strategy = AdjustmentStrategies.coefficientStrategy("Hybrid", prefixTable, typeTable);

		assertThat(strategy).isInstanceOf(HybridCoefficientStrategy.class);
		assertThat(strategy.resolve(item("3.1", "STR"), "24-045-00", context)).isEqualTo(3.0d);
	}

	@Test
	void strategiesAreSelectedByName() {
		assertThat(AdjustmentStrategies.coefficientStrategy(null, prefixTable, typeTable))
				.isInstanceOf(PrefixCoefficientStrategy.class);
		assertThat(AdjustmentStrategies.coefficientStrategy("type", prefixTable, typeTable))
				.isInstanceOf(TypeCoefficientStrategy.class);
		assertThat(AdjustmentStrategies.bonusStrategy("none", BonusTable.empty())).isInstanceOf(NoBonusStrategy.class);
		assertThat(AdjustmentStrategies.bonusStrategy(" TABLE ", BonusTable.empty())).isInstanceOf(TableBonusStrategy.class);
		assertThatThrownBy(() -> AdjustmentStrategies.coefficientStrategy("random", prefixTable, typeTable))
				.isInstanceOf(IllegalArgumentException.class)
				.hasMessageContaining("random");
		assertThatThrownBy(() -> AdjustmentStrategies.bonusStrategy("double", BonusTable.empty()))
				.isInstanceOf(IllegalArgumentException.class);
	}

	private LineItem item(String sequenceKey, String functionGroup) {
		return new LineItem(1, sequenceKey, "title", "60", null, functionGroup);
	}
}
