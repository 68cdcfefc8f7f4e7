package my.workpackmhrs.app.rules;

import org.junit.jupiter.api.Test;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class CheckGroupMappingTest {
	private final CheckGroupMapping mapping = new CheckGroupMapping(Map.of(
			"A", "A-CHECK",
			"C01", "HEAVY-C"
	));

	@Test
	void exactKeyWins() {
		assertThat(mapping.resolve("C01")).isEqualTo("HEAVY-C");
	}

	@Test
	void fallsBackToLeadingLetters() {
		assertThat(mapping.resolve("A06")).isEqualTo("A-CHECK");
		assertThat(mapping.resolve("a12")).isEqualTo("A-CHECK");
	}

	@Test
	void unknownKeysHaveNoGroup() {
		assertThat(mapping.resolve("W03")).isNull();
		assertThat(mapping.resolve("")).isNull();
		assertThat(CheckGroupMapping.empty().resolve("A06")).isNull();
	}
}
