package org.javai.symbolic.expr;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A function call with positional and keyword parameters, {@code f(a, b, k=v)}.
 * Keyword parameters keep their insertion order.
 */
@ExpressionKind("call_with_kwargs")
public final class CallWithKwargs extends Expression {

	private final Expression function;
	private final List<Object> parameters;
	private final Map<String, Object> kwParameters;

	public CallWithKwargs(Object function, List<?> parameters, Map<String, ?> kwParameters) {
		this.function = requireExpression(function, "CallWithKwargs", "function");
		this.parameters = requireOperands(parameters, "CallWithKwargs", "parameters", 0);
		if (kwParameters == null) {
			throw new MalformedExpressionException("CallWithKwargs: keyword parameters must not be null");
		}
		Map<String, Object> copy = new LinkedHashMap<>();
		for (Map.Entry<String, ?> entry : kwParameters.entrySet()) {
			String name = requireName(entry.getKey(), "CallWithKwargs", "keyword name");
			copy.put(name, requireOperand(entry.getValue(), "CallWithKwargs", "keyword parameter '" + name + "'"));
		}
		this.kwParameters = Collections.unmodifiableMap(copy);
	}

	public Expression function() {
		return function;
	}

	public List<Object> parameters() {
		return parameters;
	}

	public Map<String, Object> kwParameters() {
		return kwParameters;
	}

	@Override
	public List<Object> children() {
		return childList(function, parameters, kwParameters);
	}
}
