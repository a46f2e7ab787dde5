package org.javai.symbolic.expr;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import org.junit.jupiter.api.Test;

class ExpressionTest {

	private final Variable x = new Variable("x");
	private final Variable y = new Variable("y");

	@Test
	void separatelyBuiltTreesAreEqualWithEqualHashes() {
		Expression a = new Variable("x").plus(1).pow(5);
		Expression b = new Variable("x").plus(1).pow(5);

		assertThat(a).isNotSameAs(b);
		assertThat(a).isEqualTo(b);
		assertThat(a.hashCode()).isEqualTo(b.hashCode());
	}

	@Test
	void treesDifferingInKindAreNotEqual() {
		assertThat(x.plus(y)).isNotEqualTo(x.times(y));
		assertThat(new Quotient(x, y)).isNotEqualTo(new FloorDiv(x, y));
		assertThat(new LeftShift(x, 1)).isNotEqualTo(new RightShift(x, 1));
	}

	@Test
	void treesDifferingInAnyChildAreNotEqual() {
		assertThat(x.plus(1)).isNotEqualTo(x.plus(2));
		assertThat(x.plus(1)).isNotEqualTo(y.plus(1));
		assertThat(new Comparison(x, "<", y)).isNotEqualTo(new Comparison(x, "<=", y));
		assertThat(new CommonSubexpression(x, "a")).isNotEqualTo(new CommonSubexpression(x, "b"));
		assertThat(new Sum(List.of(x, y))).isNotEqualTo(new Sum(List.of(y, x)));
	}

	@Test
	void constantsOfDifferentTypesAreDistinctChildren() {
		assertThat(x.plus(1)).isNotEqualTo(x.plus(1L));
	}

	@Test
	void arrayOperandsCompareByContent() {
		Subscript a = new Subscript(x, new Object[] { 1, 2 });
		Subscript b = new Subscript(x, new Object[] { 1, 2 });

		assertThat(a).isEqualTo(b);
		assertThat(a.hashCode()).isEqualTo(b.hashCode());
	}

	@Test
	void equalTreesAreInterchangeableAsMapKeys() {
		Map<Expression, String> names = Map.of(x.plus(y), "s");

		assertThat(names.get(new Variable("x").plus(new Variable("y")))).isEqualTo("s");
	}

	@Test
	void buildersDoNotSimplify() {
		Sum sum = x.plus(0);
		Product product = x.times(1);

		assertThat(sum.children()).containsExactly(x, 0);
		assertThat(product.children()).containsExactly(x, 1);
		assertThat(x.minus(y)).isEqualTo(new Sum(List.of(x, new Product(List.of(-1, y)))));
	}

	@Test
	void childrenCannotBeModified() {
		Sum sum = new Sum(List.of(x, y));

		assertThatThrownBy(() -> sum.children().add(1)).isInstanceOf(UnsupportedOperationException.class);
	}

	@Test
	void mutatingTheConstructorInputsDoesNotChangeTheNode() {
		List<Object> terms = new ArrayList<>(List.of(x, y));
		Object[] index = { 1, 2 };
		Sum sum = new Sum(terms);
		Subscript subscript = new Subscript(x, index);

		terms.add(3);
		index[0] = 99;

		assertThat(sum.children()).containsExactly(x, y);
		assertThat((Object[]) subscript.index()).containsExactly(1, 2);
	}

	@Test
	void nullOperandIsMalformed() {
		assertThatThrownBy(() -> x.plus(null))
				.isInstanceOf(MalformedExpressionException.class)
				.hasMessageContaining("Sum")
				.hasMessageContaining("must not be null");
	}

	@Test
	void unregisteredOperandTypeIsMalformed() {
		assertThatThrownBy(() -> new Power(x, "two"))
				.isInstanceOf(MalformedExpressionException.class)
				.hasMessageContaining("java.lang.String");
	}

	@Test
	void emptyMultiChildOperatorIsMalformed() {
		assertThatThrownBy(() -> new Product(List.of()))
				.isInstanceOf(MalformedExpressionException.class)
				.hasMessageContaining("at least 1");
	}

	@Test
	void comparisonRequiresAKnownOperator() {
		assertThat(new Comparison(x, "lt", y).operator()).isEqualTo("<");
		assertThat(new Comparison(x, ">=", y).operator()).isEqualTo(">=");
		assertThatThrownBy(() -> new Comparison(x, "<>", y))
				.isInstanceOf(MalformedExpressionException.class)
				.hasMessageContaining("<>");
	}

	@Test
	void callFunctionMustBeAnExpression() {
		assertThatThrownBy(() -> new Call(5, List.of(x)))
				.isInstanceOf(MalformedExpressionException.class)
				.hasMessageContaining("function");
	}

	@Test
	void variableNameMustNotBeBlank() {
		assertThatThrownBy(() -> new Variable(" ")).isInstanceOf(MalformedExpressionException.class);
	}

	@Test
	void substitutionNeedsOneValuePerVariable() {
		assertThatThrownBy(() -> new Substitution(x, List.of("x", "y"), List.of(1)))
				.isInstanceOf(MalformedExpressionException.class)
				.hasMessageContaining("2 variables but 1 values");
	}

	@Test
	void derivativeNeedsAVariable() {
		assertThatThrownBy(() -> new Derivative(x, List.of())).isInstanceOf(MalformedExpressionException.class);
	}

	@Test
	void sliceTakesOneToThreeComponents() {
		Slice stopOnly = new Slice(List.of(5));
		Slice full = new Slice(Arrays.asList(null, 10, 2));

		assertThat(stopOnly.start()).isNull();
		assertThat(stopOnly.stop()).isEqualTo(5);
		assertThat(full.start()).isNull();
		assertThat(full.stop()).isEqualTo(10);
		assertThat(full.step()).isEqualTo(2);
		assertThatThrownBy(() -> new Slice(List.of())).isInstanceOf(MalformedExpressionException.class);
		assertThatThrownBy(() -> new Slice(List.of(1, 2, 3, 4))).isInstanceOf(MalformedExpressionException.class);
	}

	@Test
	void commonSubexpressionDefaultsToEvaluationScope() {
		CommonSubexpression cse = new CommonSubexpression(x.plus(1));

		assertThat(cse.scope()).isEqualTo(CseScope.EVALUATION);
		assertThat(cse.prefix()).isNull();
	}

	@Test
	void keywordParametersKeepTheirOrder() {
		CallWithKwargs call = new CallWithKwargs(new Variable("f"), List.of(x), Map.of("k", 1));

		assertThat(call.kwParameters()).containsEntry("k", 1);
		assertThat(call.dispatchKey()).isEqualTo("call_with_kwargs");
	}

	@Test
	void eachKindCarriesItsDispatchKey() {
		assertThat(x.dispatchKey()).isEqualTo("variable");
		assertThat(x.plus(1).dispatchKey()).isEqualTo("sum");
		assertThat(new FloorDiv(x, 2).dispatchKey()).isEqualTo("floor_div");
		assertThat(new If(x, 1, 2).dispatchKey()).isEqualTo("if");
		assertThat(new CommonSubexpression(x).dispatchKey()).isEqualTo("common_subexpression");
	}

	@Test
	void toStringRendersTheTree() {
		assertThat(x.plus(1).pow(5)).hasToString("(x + 1)**5");
	}

	@Test
	void veryDeepTreesCanBeHashedAndCompared() {
		Expression left = deepChain(200_000, 1);
		Expression right = deepChain(200_000, 1);
		Expression other = deepChain(200_000, 2);

		assertThat(left.hashCode()).isEqualTo(right.hashCode());
		assertThat(left).isEqualTo(right);
		assertThat(left).isNotEqualTo(other);
		assertThat(new HashSet<>(List.of(left, right, other))).hasSize(2);
		assertThat(left.toString()).startsWith("Sum[nested deeper than");
	}

	private Expression deepChain(int depth, Object innermost) {
		Expression e = x.plus(innermost);
		for (int i = 1; i < depth; i++) {
			e = new Sum(Arrays.asList(e, 1));
		}
		return e;
	}
}
