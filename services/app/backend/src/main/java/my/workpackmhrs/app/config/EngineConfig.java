package my.workpackmhrs.app.config;

import my.workpackmhrs.app.importer.CsvTableParser;
import my.workpackmhrs.app.model.ColumnMapping;
import my.workpackmhrs.app.model.ReferenceIdentifiers;
import my.workpackmhrs.app.rules.CheckGroupMapping;
import my.workpackmhrs.app.rules.CoefficientTable;
import my.workpackmhrs.app.rules.EngineRulesDefinition;
import my.workpackmhrs.app.rules.IdentifierExtractor;
import my.workpackmhrs.app.rules.PolicyTable;
import my.workpackmhrs.app.rules.RowClassifier;
import my.workpackmhrs.app.service.AggregationEngine;
import my.workpackmhrs.app.service.AggregationSettings;
import my.workpackmhrs.app.service.ReconciliationEngine;
import my.workpackmhrs.app.service.ToolControlChecker;
import my.workpackmhrs.app.service.WorkpackContextFactory;
import my.workpackmhrs.app.service.adjustment.AdjustmentStrategies;
import my.workpackmhrs.app.service.adjustment.BonusStrategy;
import my.workpackmhrs.app.service.adjustment.BonusTable;
import my.workpackmhrs.app.service.adjustment.CoefficientStrategy;
import my.workpackmhrs.app.service.adjustment.TypeCoefficientTable;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

@Configuration
public class EngineConfig {
	private static final Logger logger = LoggerFactory.getLogger(EngineConfig.class);

	@Bean
	public EngineRulesDefinition engineRules(AppProperties properties, ReferenceDataLoader loader) {
		return loader.loadRules(properties.engine().rulesLocation());
	}

	@Bean
	public RowClassifier rowClassifier(EngineRulesDefinition rules) {
		PolicyTable policyTable = PolicyTable.from(rules);
		logger.info("Policy table ready ({} prefixes, default {})", policyTable.entries().size(),
				policyTable.defaultEntry());
		return new RowClassifier(policyTable);
	}

	@Bean
	public IdentifierExtractor identifierExtractor(EngineRulesDefinition rules) {
		return new IdentifierExtractor(rules.getExtractionDelimiter());
	}

	@Bean
	public CoefficientStrategy coefficientStrategy(AppProperties properties, EngineRulesDefinition rules,
												   ReferenceDataLoader loader) {
		String name = properties.engine().coefficientStrategy();
		CoefficientTable coefficientTable = CoefficientTable.from(rules.getCoefficients());
		TypeCoefficientTable typeTable = AdjustmentStrategies.TYPE.equalsIgnoreCase(name)
				|| AdjustmentStrategies.HYBRID.equalsIgnoreCase(name)
				? TypeCoefficientTable.from(loader.loadTypeCoefficients(properties.typeCoefficient()))
				: TypeCoefficientTable.empty();
		CoefficientStrategy strategy = AdjustmentStrategies.coefficientStrategy(name, coefficientTable, typeTable);
		logger.info("Coefficient strategy '{}' ({} prefix coefficients, {} check groups)", name,
				coefficientTable.byPrefix().size(), typeTable.checkGroupCount());
		return strategy;
	}

	@Bean
	public BonusStrategy bonusStrategy(AppProperties properties, ReferenceDataLoader loader) {
		String name = properties.engine().bonusStrategy();
		BonusTable bonusTable = AdjustmentStrategies.TABLE.equalsIgnoreCase(name)
				? BonusTable.accumulate(loader.loadBonusSources(properties.bonus()))
				: BonusTable.empty();
		logger.info("Bonus strategy '{}' ({} sources)", name, bonusTable.sourceNames().size());
		return AdjustmentStrategies.bonusStrategy(name, bonusTable);
	}

	@Bean
	public ReferenceIdentifiers referenceIdentifiers(AppProperties properties, ReferenceDataLoader loader) {
		return loader.loadReferences(properties.reference());
	}

	@Bean
	public CsvTableParser csvTableParser() {
		return new CsvTableParser();
	}

	@Bean
	public AggregationEngine aggregationEngine(AppProperties properties,
											   EngineRulesDefinition rules,
											   RowClassifier rowClassifier,
											   IdentifierExtractor identifierExtractor,
											   CoefficientStrategy coefficientStrategy,
											   BonusStrategy bonusStrategy,
											   ReferenceDataLoader loader) {
		ColumnMapping columns = properties.columns().toMapping();
		Double threshold = properties.engine().highHoursThreshold();
		AggregationSettings settings = new AggregationSettings(columns,
				threshold == null ? AggregationSettings.DEFAULT_HIGH_HOURS_THRESHOLD : threshold,
				properties.engine().classificationEnabled());

		ToolControlChecker toolControlChecker = null;
		AppProperties.ToolControl toolControl = properties.toolControl();
		if (toolControl != null && toolControl.enabled()) {
			toolControlChecker = new ToolControlChecker(toolControl.toColumns(), columns,
					loader.loadIgnoreList(toolControl.ignoreListLocation()), rowClassifier, identifierExtractor);
		} else {
			logger.info("Tool control disabled");
		}

		return new AggregationEngine(
				rowClassifier,
				identifierExtractor,
				coefficientStrategy,
				bonusStrategy,
				new ReconciliationEngine(),
				toolControlChecker,
				new WorkpackContextFactory(columns, new CheckGroupMapping(rules.getCheckGroups())),
				settings
		);
	}
}
