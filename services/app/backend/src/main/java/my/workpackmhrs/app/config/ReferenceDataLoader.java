package my.workpackmhrs.app.config;

import my.workpackmhrs.app.importer.BonusSourceCsvParser;
import my.workpackmhrs.app.importer.CsvTableParser;
import my.workpackmhrs.app.importer.IgnoreListParser;
import my.workpackmhrs.app.importer.ReferenceIdCsvParser;
import my.workpackmhrs.app.importer.TypeCoefficientCsvParser;
import my.workpackmhrs.app.model.ReferenceIdentifiers;
import my.workpackmhrs.app.rules.EngineRulesDefinition;
import my.workpackmhrs.app.rules.EngineRulesParser;
import my.workpackmhrs.app.rules.EngineRulesValidator;
import my.workpackmhrs.app.service.adjustment.BonusSource;
import my.workpackmhrs.app.service.adjustment.TypeCoefficientEntry;
import my.workpackmhrs.app.util.CsvParsing;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.core.io.support.PathMatchingResourcePatternResolver;
import org.springframework.core.io.support.ResourcePatternResolver;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.List;
import java.util.Set;

/**
 * Loads the rules file and the reference data files the engine is built from. Optional files that
 * are missing or unreadable are logged and treated as empty.
 */
@Component
public class ReferenceDataLoader {
	private static final Logger logger = LoggerFactory.getLogger(ReferenceDataLoader.class);

	private final ResourceLoader resourceLoader;
	private final ResourcePatternResolver patternResolver;
	private final CsvTableParser tableParser = new CsvTableParser();
	private final EngineRulesParser rulesParser = new EngineRulesParser();
	private final EngineRulesValidator rulesValidator = new EngineRulesValidator();

	public ReferenceDataLoader(ResourceLoader resourceLoader) {
		this.resourceLoader = resourceLoader;
		this.patternResolver = new PathMatchingResourcePatternResolver(resourceLoader);
	}

	public EngineRulesDefinition loadRules(String location) {
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			throw new IllegalArgumentException("Engine rules resource not found: " + location);
		}
		String content;
		try {
			content = new String(read(resource), StandardCharsets.UTF_8);
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read engine rules " + location + ": " + exc.getMessage(), exc);
		}
		EngineRulesDefinition definition = rulesParser.parse(CsvParsing.stripBom(content));
		List<String> errors = rulesValidator.validate(definition);
		if (!errors.isEmpty()) {
			throw new IllegalArgumentException("Engine rules invalid: " + String.join("; ", errors));
		}
		logger.info("Loaded engine rules '{}' from {}", definition.getName(), location);
		return definition;
	}

	public ReferenceIdentifiers loadReferences(AppProperties.Reference reference) {
		if (reference == null) {
			logger.warn("No reference data configured; every identifier will be reported as unmatched");
			return ReferenceIdentifiers.empty();
		}
		ReferenceIdCsvParser parser = new ReferenceIdCsvParser(tableParser);
		Set<String> taskIds = loadIds(parser, reference.taskIdsLocation(), reference.taskIdColumn());
		Set<String> secondaryIds = loadIds(parser, reference.secondaryIdsLocation(), reference.secondaryIdColumn());
		logger.info("Loaded {} task identifiers and {} secondary identifiers (prefix '{}')", taskIds.size(),
				secondaryIds.size(), reference.secondaryPrefix());
		return new ReferenceIdentifiers(taskIds, secondaryIds, reference.secondaryPrefix());
	}

	public List<BonusSource> loadBonusSources(AppProperties.Bonus bonus) {
		if (bonus == null || isBlank(bonus.sourcesPattern())) {
			logger.info("No bonus sources configured; no bonus hours will be applied");
			return List.of();
		}
		Resource[] resources;
		try {
			resources = patternResolver.getResources(bonus.sourcesPattern());
		} catch (IOException exc) {
			logger.warn("Failed to resolve bonus sources {}: {}", bonus.sourcesPattern(), exc.getMessage());
			return List.of();
		}
		BonusSourceCsvParser parser = new BonusSourceCsvParser(tableParser, bonus.primaryColumn(),
				bonus.secondaryColumn(), bonus.hoursColumn(), bonus.activeColumn());
		List<Resource> ordered = new ArrayList<>(Arrays.asList(resources));
		ordered.sort(Comparator.comparing(resource -> resource.getFilename() == null ? "" : resource.getFilename()));

		List<BonusSource> sources = new ArrayList<>();
		for (Resource resource : ordered) {
			if (!resource.exists()) {
				continue;
			}
			try {
				BonusSource source = parser.parse(read(resource), resource.getFilename());
				logger.info("Loaded bonus source '{}' with {} entries", source.name(), source.entries().size());
				sources.add(source);
			} catch (IOException | IllegalArgumentException exc) {
				logger.error("Failed to load bonus source {}: {}", resource.getFilename(), exc.getMessage());
			}
		}
		if (sources.isEmpty()) {
			logger.warn("No bonus sources found at {}; no bonus hours will be applied", bonus.sourcesPattern());
		}
		return sources;
	}

	public List<TypeCoefficientEntry> loadTypeCoefficients(AppProperties.TypeCoefficient typeCoefficient) {
		if (typeCoefficient == null || isBlank(typeCoefficient.location())) {
			return List.of();
		}
		Resource resource = resourceLoader.getResource(typeCoefficient.location());
		if (!resource.exists()) {
			logger.warn("Type coefficient resource not found: {}", typeCoefficient.location());
			return List.of();
		}
		TypeCoefficientCsvParser parser = new TypeCoefficientCsvParser(tableParser, typeCoefficient.primaryColumn(),
				typeCoefficient.checkGroupColumn(), typeCoefficient.functionGroupColumn(),
				typeCoefficient.coefficientColumn(), typeCoefficient.activeColumn());
		try {
			List<TypeCoefficientEntry> entries = parser.parse(read(resource), resource.getFilename());
			logger.info("Loaded {} type coefficient entries from {}", entries.size(), typeCoefficient.location());
			return entries;
		} catch (IOException | IllegalArgumentException exc) {
			logger.error("Failed to load type coefficients {}: {}", typeCoefficient.location(), exc.getMessage());
			return List.of();
		}
	}

	public Set<String> loadIgnoreList(String location) {
		if (isBlank(location)) {
			return Set.of();
		}
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			logger.warn("Tool control ignore list not found: {}", location);
			return Set.of();
		}
		try {
			String content = CsvParsing.decodeUtf8(read(resource));
			Set<String> items = new IgnoreListParser().parse(content);
			logger.info("Loaded {} tool control ignore entries", items.size());
			return items;
		} catch (IOException exc) {
			logger.error("Failed to read ignore list {}: {}", location, exc.getMessage());
			return Set.of();
		}
	}

	private Set<String> loadIds(ReferenceIdCsvParser parser, String location, String column) {
		if (isBlank(location)) {
			return Set.of();
		}
		Resource resource = resourceLoader.getResource(location);
		if (!resource.exists()) {
			logger.warn("Reference resource not found: {}", location);
			return Set.of();
		}
		try {
			return parser.parse(read(resource), resource.getFilename(), column);
		} catch (IOException | IllegalArgumentException exc) {
			logger.error("Failed to load reference identifiers {}: {}", location, exc.getMessage());
			return Set.of();
		}
	}

	private byte[] read(Resource resource) throws IOException {
		try (InputStream inputStream = resource.getInputStream()) {
			return inputStream.readAllBytes();
		}
	}

	private boolean isBlank(String value) {
		return value == null || value.isBlank();
	}
}
