package org.javai.symbolic.mapper.transform;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.List;
import java.util.Map;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.expr.Product;
import org.javai.symbolic.expr.Sum;
import org.javai.symbolic.expr.Variable;
import org.junit.jupiter.api.Test;

class SubstitutionMapperTest {

	private final Variable x = new Variable("x");
	private final Variable y = new Variable("y");
	private final Variable a = new Variable("a");

	@Test
	void replacesVariablesByName() {
		Object result = SubstitutionMapper.substitute(x.plus(y.times(x)), Map.of("x", 2, "y", a.plus(1)));

		assertThat(result).isEqualTo(new Sum(List.of(2, new Product(List.of(a.plus(1), 2)))));
		assertThat(result.toString()).isEqualTo("2 + (a + 1)*2");
	}

	@Test
	void replacementsAreNotSubstitutedAgain() {
		Object result = SubstitutionMapper.substitute(x.plus(y), Map.of("x", y, "y", x));

		assertThat(result).isEqualTo(y.plus(x));
	}

	@Test
	void subscriptsAndLookupsCanBeReplacedWhole() {
		Expression element = a.index(0);
		Expression field = a.attr("re");

		Object result = SubstitutionMapper.substitute(element.plus(field).plus(a), Map.of(element, x, field, y));

		assertThat(result).isEqualTo(x.plus(y).plus(a));
	}

	@Test
	void unmatchedSubscriptsAreSearchedInside() {
		Object result = SubstitutionMapper.substitute(a.index(x), Map.of("x", 3, "a", y));

		assertThat(result).isEqualTo(y.index(3));
	}

	@Test
	void untouchedTreesAreReturnedAsIs() {
		Expression tree = x.plus(y).pow(2);

		assertThat(SubstitutionMapper.substitute(tree, Map.of("z", 1))).isSameAs(tree);
	}

	@Test
	void functionReturningNullKeepsTheNode() {
		SubstitutionMapper mapper = new SubstitutionMapper(
				expression -> expression.equals(x) ? 10 : null);

		assertThat(mapper.apply(x.times(y))).isEqualTo(new Product(List.of(10, y)));
	}

	@Test
	void rejectsKeysThatAreNeitherNamesNorExpressions() {
		assertThatThrownBy(() -> SubstitutionMapper.substitute(x, Map.of(1, 2)))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
