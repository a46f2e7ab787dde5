package org.javai.symbolic.mapper;

import static org.assertj.core.api.Assertions.assertThat;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.expr.Power;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.stringifier.StringifyMapper;
import org.junit.jupiter.api.Test;

class WalkMapperTest {

	private final Variable x = new Variable("x");
	private final Variable y = new Variable("y");

	static final class Recorder extends WalkMapper<Void> {

		final List<String> events = new ArrayList<>();

		@Override
		protected boolean visit(Object value, Void arg) {
			events.add("visit " + StringifyMapper.render(value));
			return !(value instanceof Power);
		}

		@Override
		protected void postVisit(Object value, Void arg) {
			events.add("post " + StringifyMapper.render(value));
		}
	}

	static final class VariableNames extends Collector<Void, String> {
		@Override
		protected Set<String> mapVariable(Variable variable, Void arg) {
			return Set.of(variable.name());
		}
	}

	@Test
	void visitsInPreOrderAndPostVisitsAfterOperands() {
		Recorder recorder = new Recorder();

		recorder.apply(x.plus(1));

		assertThat(recorder.events).containsExactly(
				"visit x + 1", "visit x", "post x", "visit 1", "post 1", "post x + 1");
	}

	@Test
	void returningFalseSkipsTheSubtree() {
		Recorder recorder = new Recorder();

		recorder.apply(y.times(x.pow(2)));

		assertThat(recorder.events).containsExactly("visit y*x**2", "visit y", "post y", "visit x**2", "post y*x**2");
	}

	@Test
	void sharedNodesAreVisitedPerOccurrence() {
		Expression shared = x.plus(1);
		Recorder recorder = new Recorder();

		recorder.apply(shared.times(shared));

		assertThat(recorder.events).filteredOn(e -> e.equals("visit x + 1")).hasSize(2);
	}

	@Test
	void sequencesAreWalked() {
		Recorder recorder = new Recorder();

		recorder.apply(List.of(x, 2));

		assertThat(recorder.events).containsExactly(
				"visit [x, 2]", "visit x", "post x", "visit 2", "post 2", "post [x, 2]");
	}

	@Test
	void collectorUnitesTheItemsOfAllOperands() {
		Expression tree = new CommonSubexpression(x.plus(y)).times(x.call(y, List.of(new Variable("z"))));

		assertThat(new VariableNames().apply(tree)).containsExactlyInAnyOrder("x", "y", "z");
	}
}
