package my.workpackmhrs.app.service;

import my.workpackmhrs.app.dto.AggregateResultDto;
import my.workpackmhrs.app.importer.CsvTableParser;
import my.workpackmhrs.app.model.DataTable;
import my.workpackmhrs.app.model.ReferenceIdentifiers;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;

@Service
public class WorkpackageService {
	private static final Logger logger = LoggerFactory.getLogger(WorkpackageService.class);

	private final CsvTableParser tableParser;
	private final AggregationEngine aggregationEngine;
	private final ReferenceIdentifiers referenceIdentifiers;

	public WorkpackageService(CsvTableParser tableParser,
							  AggregationEngine aggregationEngine,
							  ReferenceIdentifiers referenceIdentifiers) {
		this.tableParser = tableParser;
		this.aggregationEngine = aggregationEngine;
		this.referenceIdentifiers = referenceIdentifiers;
	}

	public AggregateResultDto analyze(byte[] payload, String filename) {
		return analyze(payload, filename, null);
	}

	public AggregateResultDto analyze(byte[] payload, String filename, Integer workpackDays) {
		String name = filename == null ? "upload" : filename;
		validateSuffix(name);
		if (payload == null || payload.length == 0) {
			throw new IllegalArgumentException("File is empty");
		}
		DataTable table = tableParser.parse(payload, name);
		if (table.rows().isEmpty()) {
			logger.warn("Work package '{}' has no data rows", table.name());
		}
		return aggregationEngine.process(table, referenceIdentifiers, workpackDays);
	}

	public AggregateResultDto analyze(Path file) {
		return analyze(readFile(file), file.getFileName().toString());
	}

	private void validateSuffix(String filename) {
		if (!filename.toLowerCase(Locale.ROOT).endsWith(".csv")) {
			throw new IllegalArgumentException("Expected .csv file for work package " + filename);
		}
	}

	private byte[] readFile(Path file) {
		try {
			return Files.readAllBytes(file);
		} catch (IOException exc) {
			throw new IllegalArgumentException("Failed to read work package: " + exc.getMessage(), exc);
		}
	}
}
