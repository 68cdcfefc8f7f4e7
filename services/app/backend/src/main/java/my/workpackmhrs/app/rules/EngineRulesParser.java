package my.workpackmhrs.app.rules;

import tools.jackson.core.JacksonException;
import tools.jackson.databind.DeserializationFeature;
import tools.jackson.databind.ObjectMapper;
import tools.jackson.databind.PropertyNamingStrategies;
import tools.jackson.databind.json.JsonMapper;
import tools.jackson.dataformat.yaml.YAMLMapper;

public class EngineRulesParser {
	private final ObjectMapper jsonMapper;
	private final ObjectMapper yamlMapper;

	public EngineRulesParser() {
		this.jsonMapper = JsonMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();

		this.yamlMapper = YAMLMapper.builder()
				.propertyNamingStrategy(PropertyNamingStrategies.SNAKE_CASE)
				.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
				.build();
	}

	public EngineRulesDefinition parse(String content) {
		if (content == null || content.isBlank()) {
			throw new IllegalArgumentException("Engine rules content is empty");
		}
		try {
			return jsonMapper.readValue(content, EngineRulesDefinition.class);
		} catch (JacksonException jsonEx) {
			try {
				return yamlMapper.readValue(content, EngineRulesDefinition.class);
			} catch (JacksonException yamlEx) {
				throw new IllegalArgumentException("Invalid engine rules: " + yamlEx.getOriginalMessage(), yamlEx);
			}
		}
	}
}
