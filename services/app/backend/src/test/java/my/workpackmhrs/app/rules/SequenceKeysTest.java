package my.workpackmhrs.app.rules;

import org.junit.jupiter.api.Test;

import static org.assertj.core.api.Assertions.assertThat;

class SequenceKeysTest {
	@Test
	void majorPrefixIsTextBeforeFirstDot() {
		assertThat(SequenceKeys.majorPrefix("2.10")).isEqualTo("2");
		assertThat(SequenceKeys.majorPrefix(" 12.3.4 ")).isEqualTo("12");
		assertThat(SequenceKeys.majorPrefix("7")).isEqualTo("7");
		assertThat(SequenceKeys.majorPrefix("eo.1")).isEqualTo("EO");
	}

	@Test
	void missingKeysHaveNoPrefix() {
		assertThat(SequenceKeys.majorPrefix(null)).isEmpty();
		assertThat(SequenceKeys.majorPrefix("")).isEmpty();
		assertThat(SequenceKeys.majorPrefix("nan")).isEmpty();
	}

	@Test
	void normalizesConfiguredKeys() {
		assertThat(SequenceKeys.normalizePrefix("SEQ_2.X")).isEqualTo("2");
		assertThat(SequenceKeys.normalizePrefix("SEQ_2.X_ID")).isEqualTo("2");
		assertThat(SequenceKeys.normalizePrefix("2.X")).isEqualTo("2");
		assertThat(SequenceKeys.normalizePrefix(" 2 ")).isEqualTo("2");
		assertThat(SequenceKeys.normalizePrefix(null)).isEmpty();
	}

	@Test
	void wellFormedKeysAreNumberDotNumber() {
		assertThat(SequenceKeys.isWellFormed("10.2")).isTrue();
		assertThat(SequenceKeys.isWellFormed("10")).isFalse();
		assertThat(SequenceKeys.isWellFormed("A.1")).isFalse();
		assertThat(SequenceKeys.isWellFormed("1.2.3")).isFalse();
	}
}
