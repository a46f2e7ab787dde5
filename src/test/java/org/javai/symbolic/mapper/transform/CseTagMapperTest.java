package org.javai.symbolic.mapper.transform;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import java.util.Map;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.function.Function;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.CseScope;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.expr.Product;
import org.javai.symbolic.expr.Sum;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.CseCachingMapper;
import org.javai.symbolic.mapper.evaluator.EvaluationMapper;
import org.junit.jupiter.api.Test;

class CseTagMapperTest {

	private final Variable x = new Variable("x");
	private final Variable y = new Variable("y");
	private final Variable f = new Variable("f");

	@Test
	void walkCountsEqualSubexpressionsTogether() {
		CseWalkMapper walker = new CseWalkMapper();
		walker.apply(x.plus(y).times(x.plus(y)));

		assertThat(walker.occurrences(new Variable("x").plus(new Variable("y")))).isEqualTo(2);
		assertThat(walker.occurrences(x)).isEqualTo(2);
		assertThat(walker.occurrences(x.times(y))).isZero();
	}

	@Test
	void repeatedSubexpressionsShareOneMarker() {
		Object tagged = CseTagMapper.tagCommonSubexpressions(x.plus(y).times(x.plus(y)));

		assertThat(tagged).isInstanceOf(Product.class);
		List<Object> operands = ((Product) tagged).children();
		assertThat(operands.get(0)).isInstanceOf(CommonSubexpression.class).isSameAs(operands.get(1));
		CommonSubexpression marker = (CommonSubexpression) operands.get(0);
		assertThat(marker.child()).isEqualTo(x.plus(y));
		assertThat(marker.prefix()).isNull();
		assertThat(marker.scope()).isEqualTo(CseScope.EVALUATION);
	}

	@Test
	void variablesAndSingleOccurrencesAreNotTagged() {
		Expression tree = x.times(x).plus(y);

		Object tagged = CseTagMapper.tagCommonSubexpressions(tree);

		assertThat(tagged).isSameAs(tree);
	}

	@Test
	void nestedRepetitionsAreTaggedAtEveryLevel() {
		Sum inner = x.plus(1);
		Expression tree = new Sum(List.of(inner.times(2), inner.times(2), inner));

		Sum tagged = (Sum) CseTagMapper.tagCommonSubexpressions(tree);

		CommonSubexpression outerMarker = (CommonSubexpression) tagged.children().get(0);
		CommonSubexpression innerMarker = (CommonSubexpression) tagged.children().get(2);
		assertThat(tagged.children().get(1)).isSameAs(outerMarker);
		assertThat(((Product) outerMarker.child()).children().get(0)).isSameAs(innerMarker);
		assertThat(innerMarker.child()).isEqualTo(inner);
	}

	@Test
	void taggedTreeIsEvaluatedOnceUnderCaching() {
		AtomicInteger calls = new AtomicInteger();
		Function<List<Object>, Object> square = arguments -> {
			calls.incrementAndGet();
			long value = ((Number) arguments.get(0)).longValue();
			return value * value;
		};
		Map<String, Object> context = Map.of("f", square, "x", 3L);
		Expression tree = f.call(x).plus(f.call(x).times(2));

		Object tagged = CseTagMapper.tagCommonSubexpressions(tree);
		Object cached = CseCachingMapper.wrap(new EvaluationMapper(context)).apply(tagged);

		assertThat(cached).isEqualTo(27L);
		assertThat(calls).hasValue(1);

		calls.set(0);
		assertThat(EvaluationMapper.evaluate(tree, context)).isEqualTo(27L);
		assertThat(calls).hasValue(2);
	}
}
