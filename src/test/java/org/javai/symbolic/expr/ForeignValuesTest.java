package org.javai.symbolic.expr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.List;
import org.apache.logging.log4j.Level;
import org.javai.symbolic.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

class ForeignValuesTest {

	record Money(BigDecimal amount) {
	}

	@AfterEach
	void restoreDefaults() {
		ForeignValues.reset();
	}

	@Test
	void configuredNumericTypesAreConstants() {
		assertThat(ForeignValues.categorize(1)).isEqualTo(ForeignCategory.CONSTANT);
		assertThat(ForeignValues.categorize(2.5)).isEqualTo(ForeignCategory.CONSTANT);
		assertThat(ForeignValues.categorize(BigInteger.TEN)).isEqualTo(ForeignCategory.CONSTANT);
		assertThat(ForeignValues.categorize(new BigDecimal("1.5"))).isEqualTo(ForeignCategory.CONSTANT);
		assertThat(ForeignValues.categorize(true)).isEqualTo(ForeignCategory.CONSTANT);
	}

	@Test
	void listsAndArraysHaveTheirOwnCategories() {
		assertThat(ForeignValues.categorize(List.of(1, 2))).isEqualTo(ForeignCategory.SEQUENCE);
		assertThat(ForeignValues.categorize(new int[] { 1 })).isEqualTo(ForeignCategory.ARRAY);
		assertThat(ForeignValues.categorize(new Object[] { 1 })).isEqualTo(ForeignCategory.ARRAY);
	}

	@Test
	void everythingElseIsUnrecognized() {
		assertThat(ForeignValues.categorize("text")).isEqualTo(ForeignCategory.UNRECOGNIZED);
		assertThat(ForeignValues.categorize(null)).isEqualTo(ForeignCategory.UNRECOGNIZED);
		assertThat(ForeignValues.categorize(new Money(BigDecimal.ONE))).isEqualTo(ForeignCategory.UNRECOGNIZED);
		assertThat(ForeignValues.isValidOperand(new Object())).isFalse();
	}

	@Test
	void registeredTypeBecomesAValidOperand() {
		Money price = new Money(BigDecimal.TEN);
		assertThatThrownBy(() -> new Variable("x").times(price)).isInstanceOf(MalformedExpressionException.class);

		ForeignValues.register(Money.class);

		assertThat(ForeignValues.isConstant(price)).isTrue();
		assertThat(new Variable("x").times(price).children()).containsExactly(new Variable("x"), price);
	}

	@Test
	void unregisterIsIdempotent() {
		ForeignValues.register(String.class);
		ForeignValues.unregister(String.class);
		ForeignValues.unregister(String.class);

		assertThat(ForeignValues.isRegistered(String.class)).isFalse();
		assertThat(ForeignValues.categorize("text")).isEqualTo(ForeignCategory.UNRECOGNIZED);
	}

	@Test
	void expressionClassesCannotBeConstants() {
		assertThatThrownBy(() -> ForeignValues.register(Variable.class)).isInstanceOf(IllegalArgumentException.class);
	}

	@Test
	void resetRestoresTheConfiguredClasses() {
		ForeignValues.unregister(Integer.class);
		assertThat(ForeignValues.isConstant(1)).isFalse();

		ForeignValues.reset();

		assertThat(ForeignValues.isConstant(1)).isTrue();
		assertThat(ForeignValues.registeredConstantClasses()).contains(Integer.class, Double.class, BigDecimal.class);
	}

	@Test
	void unloadableConfiguredClassIsLoggedAndSkipped() {
		try (LogCaptorAppender appender = LogCaptorAppender.create(ForeignValues.class, Level.WARN)) {
			ForeignValues.registerByName(List.of("com.example.Missing", "java.lang.String"));

			assertThat(appender.messagesAt(Level.WARN))
					.anyMatch(msg -> msg.contains("com.example.Missing") && msg.contains("cannot be loaded"));
		}
		assertThat(ForeignValues.isRegistered(String.class)).isTrue();
	}
}
