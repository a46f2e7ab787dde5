package org.javai.symbolic.mapper.analysis;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.NaN;
import org.javai.symbolic.expr.Sum;
import org.javai.symbolic.expr.Variable;
import org.junit.jupiter.api.Test;

class FlopCounterTest {

	private final Variable x = new Variable("x");
	private final Variable y = new Variable("y");
	private final Variable z = new Variable("z");

	@Test
	void leavesCostNothing() {
		assertThat(FlopCounter.count(x)).isZero();
		assertThat(FlopCounter.count(3)).isZero();
		assertThat(FlopCounter.count(new NaN())).isZero();
	}

	@Test
	void naryOperatorsCountOneLessThanTheirOperands() {
		assertThat(FlopCounter.count(new Sum(List.of(x, y, z)))).isEqualTo(2);
		assertThat(FlopCounter.count(x.times(y).plus(z))).isEqualTo(2);
	}

	@Test
	void binaryOperatorsCountOne() {
		assertThat(FlopCounter.count(x.dividedBy(y).pow(2))).isEqualTo(2);
		assertThat(FlopCounter.count(x.floorDiv(y).mod(z))).isEqualTo(2);
	}

	@Test
	void operationsInsideCallArgumentsAreCounted() {
		assertThat(FlopCounter.count(new Variable("f").call(x.plus(1), y))).isEqualTo(1);
	}

	@Test
	void sharedSubexpressionsCountOnceWhenAskedTo() {
		CommonSubexpression shared = new CommonSubexpression(x.plus(y).times(z));
		Sum tree = shared.plus(shared);

		assertThat(new FlopCounter().apply(tree)).isEqualTo(5);
		assertThat(FlopCounter.sharedOnce().apply(tree)).isEqualTo(3);
	}

	@Test
	void sharedCountResetsBetweenCalls() {
		FlopCounter counter = FlopCounter.sharedOnce();
		CommonSubexpression shared = new CommonSubexpression(x.plus(y));

		assertThat(counter.apply(shared.times(shared))).isEqualTo(2);
		assertThat(counter.apply(shared.times(shared))).isEqualTo(2);
	}
}
