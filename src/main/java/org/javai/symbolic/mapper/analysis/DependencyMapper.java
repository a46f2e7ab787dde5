package org.javai.symbolic.mapper.analysis;

import java.util.HashSet;
import java.util.List;
import java.util.Set;
import org.javai.symbolic.expr.Call;
import org.javai.symbolic.expr.CallWithKwargs;
import org.javai.symbolic.expr.CommonSubexpression;
import org.javai.symbolic.expr.Expression;
import org.javai.symbolic.expr.Lookup;
import org.javai.symbolic.expr.Subscript;
import org.javai.symbolic.expr.Variable;
import org.javai.symbolic.mapper.Collector;

/**
 * Collects the expressions a tree depends on: its variables and, depending on the
 * options, the subscripts, attribute lookups, calls and common subexpressions it
 * contains. Results compare by value, so repeated occurrences are reported once.
 *
 * <pre>
 * Set&lt;Expression&gt; deps = DependencyMapper.builder().compositeLeaves(false).build().apply(tree);
 * </pre>
 */
public class DependencyMapper extends Collector<Void, Expression> {

	/**
	 * How calls contribute to the dependencies.
	 */
	public enum CallDependencies {
		/** The call itself is a dependency. */
		INCLUDE,
		/** The call is traversed: its function and its arguments contribute. */
		EXCLUDE,
		/** Only the arguments contribute. */
		DESCEND_ARGS
	}

	private final boolean includeSubscripts;
	private final boolean includeLookups;
	private final CallDependencies callDependencies;
	private final boolean includeCses;

	public DependencyMapper() {
		this(builder());
	}

	private DependencyMapper(Builder builder) {
		this.includeSubscripts = builder.includeSubscripts;
		this.includeLookups = builder.includeLookups;
		this.callDependencies = builder.callDependencies;
		this.includeCses = builder.includeCses;
		register(Subscript.class, this::mapSubscript);
		register(Lookup.class, this::mapLookup);
		register(Call.class, this::mapCall);
		register(CallWithKwargs.class, this::mapCallWithKwargs);
		register(CommonSubexpression.class, this::mapCommonSubexpression);
	}

	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Dependencies of {@code expression} with the default options.
	 */
	public static Set<Expression> dependencies(Object expression) {
		return new DependencyMapper().apply(expression);
	}

	@Override
	protected Set<Expression> mapVariable(Variable variable, Void arg) {
		return singleton(variable);
	}

	protected Set<Expression> mapSubscript(Subscript subscript, Void arg) {
		return includeSubscripts ? singleton(subscript) : combineOperands(subscript, arg);
	}

	protected Set<Expression> mapLookup(Lookup lookup, Void arg) {
		return includeLookups ? singleton(lookup) : combineOperands(lookup, arg);
	}

	protected Set<Expression> mapCall(Call call, Void arg) {
		return switch (callDependencies) {
			case INCLUDE -> singleton(call);
			case EXCLUDE -> combineOperands(call, arg);
			case DESCEND_ARGS -> combineAll(call.parameters(), arg);
		};
	}

	protected Set<Expression> mapCallWithKwargs(CallWithKwargs call, Void arg) {
		return switch (callDependencies) {
			case INCLUDE -> singleton(call);
			case EXCLUDE -> combineOperands(call, arg);
			case DESCEND_ARGS -> combine(List.of(
					combineAll(call.parameters(), arg),
					combineAll(List.copyOf(call.kwParameters().values()), arg)));
		};
	}

	protected Set<Expression> mapCommonSubexpression(CommonSubexpression cse, Void arg) {
		return includeCses ? singleton(cse) : combineOperands(cse, arg);
	}

	private static Set<Expression> singleton(Expression expression) {
		Set<Expression> result = new HashSet<>();
		result.add(expression);
		return result;
	}

	public static final class Builder {

		private boolean includeSubscripts = true;
		private boolean includeLookups = true;
		private CallDependencies callDependencies = CallDependencies.INCLUDE;
		private boolean includeCses;

		private Builder() {
		}

		public Builder includeSubscripts(boolean includeSubscripts) {
			this.includeSubscripts = includeSubscripts;
			return this;
		}

		public Builder includeLookups(boolean includeLookups) {
			this.includeLookups = includeLookups;
			return this;
		}

		public Builder callDependencies(CallDependencies callDependencies) {
			if (callDependencies == null) {
				throw new IllegalArgumentException("callDependencies must not be null");
			}
			this.callDependencies = callDependencies;
			return this;
		}

		public Builder includeCses(boolean includeCses) {
			this.includeCses = includeCses;
			return this;
		}

		/**
		 * Treats subscripts, lookups and calls as opaque leaves ({@code true}) or
		 * traverses into them ({@code false}).
		 */
		public Builder compositeLeaves(boolean compositeLeaves) {
			this.includeSubscripts = compositeLeaves;
			this.includeLookups = compositeLeaves;
			this.callDependencies = compositeLeaves ? CallDependencies.INCLUDE : CallDependencies.EXCLUDE;
			return this;
		}

		public DependencyMapper build() {
			return new DependencyMapper(this);
		}
	}
}
