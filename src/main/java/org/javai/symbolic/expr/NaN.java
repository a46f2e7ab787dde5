package org.javai.symbolic.expr;

import java.util.List;

/**
 * A not-a-number leaf, optionally tagged with the name of the numeric type it stands for.
 */
@ExpressionKind("nan")
public final class NaN extends Expression {

	private final String dataType;

	public NaN() {
		this(null);
	}

	public NaN(String dataType) {
		this.dataType = dataType;
	}

	/**
	 * @return the numeric type name, or {@code null} if unspecified
	 */
	public String dataType() {
		return dataType;
	}

	@Override
	public List<Object> children() {
		return childList(dataType);
	}
}
