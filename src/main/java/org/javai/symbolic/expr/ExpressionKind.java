package org.javai.symbolic.expr;

import java.lang.annotation.Documented;
import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Declares the dispatch key of an {@link Expression} subclass.
 * <p>
 * Mappers route a node to the handler registered under this key. A subclass that
 * does not carry the annotation itself dispatches under its nearest annotated
 * ancestor's key. Keys must be unique across all annotated classes.
 *
 * <pre>
 * {@code
 * @ExpressionKind("dot_product")
 * public final class DotProduct extends Expression {
 *     ...
 * }
 * }
 * </pre>
 */
@Documented
@Retention(RetentionPolicy.RUNTIME)
@Target(ElementType.TYPE)
public @interface ExpressionKind {

	/**
	 * The dispatch key, e.g. {@code "sum"}.
	 */
	String value();
}
