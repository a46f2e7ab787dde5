package org.javai.symbolic.expr;

import java.util.LinkedHashSet;
import java.util.List;
import java.util.Set;
import java.util.concurrent.CopyOnWriteArraySet;
import org.javai.symbolic.config.SymbolicConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Process-wide registry deciding which non-expression values may appear in a tree.
 * <p>
 * Instances of registered classes (and their subclasses) are foreign <em>constants</em>.
 * Lists and arrays are always accepted as sequences and arrays. Anything else is
 * rejected at construction time and routed to the unrecognized-value path by mappers.
 * The initial set of constant classes comes from {@link SymbolicConfig#constantClasses()}.
 * <p>
 * Registration takes effect for subsequent construction and dispatch decisions only;
 * results already computed or cached are unaffected.
 */
public final class ForeignValues {

	private static final Logger logger = LoggerFactory.getLogger(ForeignValues.class);

	private static final Set<Class<?>> constantClasses = new CopyOnWriteArraySet<>();

	static {
		registerByName(SymbolicConfig.get().constantClasses());
	}

	private ForeignValues() {
	}

	/**
	 * Treats instances of {@code type} as foreign constants from now on.
	 */
	public static void register(Class<?> type) {
		if (type == null) {
			throw new IllegalArgumentException("type must not be null");
		}
		if (Expression.class.isAssignableFrom(type)) {
			throw new IllegalArgumentException("Expression classes cannot be registered as constants: " + type.getName());
		}
		if (constantClasses.add(type)) {
			logger.debug("Registered foreign constant class {}", type.getName());
		}
	}

	/**
	 * Stops treating instances of {@code type} as foreign constants. Unregistering a class
	 * that is not registered does nothing.
	 */
	public static void unregister(Class<?> type) {
		if (type == null) {
			throw new IllegalArgumentException("type must not be null");
		}
		if (constantClasses.remove(type)) {
			logger.debug("Unregistered foreign constant class {}", type.getName());
		}
	}

	public static boolean isRegistered(Class<?> type) {
		return constantClasses.contains(type);
	}

	public static Set<Class<?>> registeredConstantClasses() {
		return Set.copyOf(constantClasses);
	}

	/**
	 * Returns {@code true} if {@code value} is an instance of a registered constant class.
	 */
	public static boolean isConstant(Object value) {
		if (value == null) {
			return false;
		}
		for (Class<?> type : constantClasses) {
			if (type.isInstance(value)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Returns {@code true} if {@code value} may be used as an operand of an expression.
	 */
	public static boolean isValidOperand(Object value) {
		return value instanceof Expression || categorize(value) != ForeignCategory.UNRECOGNIZED;
	}

	public static ForeignCategory categorize(Object value) {
		if (value == null) {
			return ForeignCategory.UNRECOGNIZED;
		}
		if (isConstant(value)) {
			return ForeignCategory.CONSTANT;
		}
		if (value instanceof List) {
			return ForeignCategory.SEQUENCE;
		}
		if (value.getClass().isArray()) {
			return ForeignCategory.ARRAY;
		}
		return ForeignCategory.UNRECOGNIZED;
	}

	/**
	 * Drops all registrations and re-registers the configured constant classes.
	 */
	public static void reset() {
		constantClasses.clear();
		registerByName(SymbolicConfig.get().constantClasses());
	}

	/**
	 * Registers constant classes by fully qualified name. Names that cannot be loaded are
	 * logged and skipped.
	 */
	public static void registerByName(List<String> classNames) {
		Set<Class<?>> resolved = new LinkedHashSet<>();
		for (String name : classNames) {
			try {
				resolved.add(Class.forName(name, false, ForeignValues.class.getClassLoader()));
			} catch (ClassNotFoundException e) {
				logger.warn("Configured foreign constant class {} cannot be loaded and is ignored", name);
			}
		}
		constantClasses.addAll(resolved);
		logger.debug("Registered foreign constant classes {}", resolved);
	}
}
