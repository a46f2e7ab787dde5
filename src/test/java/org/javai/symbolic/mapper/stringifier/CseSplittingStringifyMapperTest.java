package org.javai.symbolic.mapper.stringifier;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.List;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.Sum;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.stringifier.CseSplittingStringifyMapper.CseAssignment;
import org.junit.jupiter.api.Test;

class CseSplittingStringifyMapperTest {

	private final Variable x = new Variable("x");
	private final Variable y = new Variable("y");

	@Test
	void unnamedMarkersAreNumbered() {
		CseSplittingStringifyMapper renderer = new CseSplittingStringifyMapper();
		CommonSubexpression first = new CommonSubexpression(x.plus(1));
		CommonSubexpression second = new CommonSubexpression(y.times(2));

		String text = renderer.apply(first.times(second));

		assertThat(text).isEqualTo("CSE0*CSE1");
		assertThat(renderer.assignments()).containsExactly(
				new CseAssignment("CSE0", "x + 1"),
				new CseAssignment("CSE1", "y*2"));
	}

	@Test
	void markersAroundTheSameChildShareOneAssignment() {
		CseSplittingStringifyMapper renderer = new CseSplittingStringifyMapper();
		Sum shared = x.plus(1);
		CommonSubexpression one = new CommonSubexpression(shared);
		CommonSubexpression other = new CommonSubexpression(shared);

		assertThat(renderer.apply(one.times(other).plus(one))).isEqualTo("CSE0*CSE0 + CSE0");
		assertThat(renderer.assignments()).hasSize(1);
	}

	@Test
	void markersAroundTheSameListShareOneName() {
		CseSplittingStringifyMapper renderer = new CseSplittingStringifyMapper();
		List<Object> payload = List.of(x, 1);

		String text = renderer.apply(new Sum(List.of(new CommonSubexpression(payload), new CommonSubexpression(payload))));

		assertThat(text).isEqualTo("CSE0 + CSE0");
		assertThat(renderer.assignments()).containsExactly(new CseAssignment("CSE0", "[x, 1]"));
	}

	@Test
	void equalButDistinctChildrenGetSeparateNames() {
		CseSplittingStringifyMapper renderer = new CseSplittingStringifyMapper();

		String text = renderer.apply(new CommonSubexpression(x.plus(1)).times(new CommonSubexpression(x.plus(1))));

		assertThat(text).isEqualTo("CSE0*CSE1");
	}

	@Test
	void prefixesNameTheAssignmentAndAreDisambiguated() {
		CseSplittingStringifyMapper renderer = new CseSplittingStringifyMapper();

		String text = renderer.apply(new Sum(List.of(
				new CommonSubexpression(x.times(2), "twice"),
				new CommonSubexpression(y.times(2), "twice"),
				new CommonSubexpression(x.times(y)))));

		assertThat(text).isEqualTo("twice + twice_2 + CSE0");
		assertThat(renderer.assignments()).extracting(CseAssignment::name).containsExactly("twice", "twice_2", "CSE0");
	}

	@Test
	void numberedNamesSkipNamesAlreadyTakenByPrefixes() {
		CseSplittingStringifyMapper renderer = new CseSplittingStringifyMapper();

		String text = renderer.apply(new CommonSubexpression(x, "CSE0").plus(new CommonSubexpression(y.plus(1))));

		assertThat(text).isEqualTo("CSE0 + CSE1");
	}

	@Test
	void nestedMarkersAreAssignedBeforeTheirUsers() {
		CseSplittingStringifyMapper renderer = new CseSplittingStringifyMapper();
		CommonSubexpression inner = new CommonSubexpression(x.plus(1), "inner");
		CommonSubexpression outer = new CommonSubexpression(inner.pow(2), "outer");

		String text = renderer.renderWithAssignments(outer.times(inner));

		assertThat(text).isEqualTo("inner = x + 1\nouter = inner**2\nouter*inner");
	}

	@Test
	void namesAccumulateUntilReset() {
		CseSplittingStringifyMapper renderer = new CseSplittingStringifyMapper(PrecedenceTable.defaults(), "tmp");
		Sum shared = x.plus(1);

		assertThat(renderer.apply(new CommonSubexpression(shared))).isEqualTo("tmp0");
		assertThat(renderer.apply(new CommonSubexpression(y))).isEqualTo("tmp1");
		assertThat(renderer.apply(new CommonSubexpression(shared))).isEqualTo("tmp0");

		renderer.reset();

		assertThat(renderer.assignments()).isEmpty();
		assertThat(renderer.apply(new CommonSubexpression(y))).isEqualTo("tmp0");
	}
}
