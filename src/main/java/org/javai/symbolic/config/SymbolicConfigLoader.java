package org.javai.symbolic.config;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Properties;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.yaml.snakeyaml.Yaml;

/**
 * Loads {@link SymbolicConfig} from YAML.
 * <p>
 * Sources, later ones overriding earlier ones:
 * <ol>
 * <li>{@value #DEFAULTS_RESOURCE} bundled with the library (required)</li>
 * <li>{@value #OVERRIDE_RESOURCE} on the classpath (optional)</li>
 * <li>system properties {@value #MAX_DEPTH_PROPERTY} and {@value #CSE_PREFIX_PROPERTY}</li>
 * </ol>
 *
 * <pre>
 * mapper:
 *   max-depth: 1000
 * stringify:
 *   cse-prefix: CSE
 * foreign:
 *   constant-classes:
 *     - java.lang.Integer
 * </pre>
 */
public class SymbolicConfigLoader {

	private static final Logger logger = LoggerFactory.getLogger(SymbolicConfigLoader.class);

	public static final String DEFAULTS_RESOURCE = "META-INF/symbolic/symbolic-defaults.yml";
	public static final String OVERRIDE_RESOURCE = "symbolic.yml";
	public static final String MAX_DEPTH_PROPERTY = "symbolic.mapper.max-depth";
	public static final String CSE_PREFIX_PROPERTY = "symbolic.stringify.cse-prefix";

	private final ClassLoader classLoader;
	private final Yaml yaml = new Yaml();

	public SymbolicConfigLoader() {
		this(SymbolicConfigLoader.class.getClassLoader());
	}

	public SymbolicConfigLoader(ClassLoader classLoader) {
		if (classLoader == null) {
			throw new IllegalArgumentException("classLoader must not be null");
		}
		this.classLoader = classLoader;
	}

	/**
	 * Loads the configuration from all sources, reading the JVM system properties.
	 */
	public SymbolicConfig load() {
		return load(System.getProperties());
	}

	/**
	 * Loads the configuration from all sources using the given properties in place of
	 * the system properties.
	 */
	public SymbolicConfig load(Properties properties) {
		Settings settings = defaults();
		try (InputStream override = classLoader.getResourceAsStream(OVERRIDE_RESOURCE)) {
			if (override != null) {
				settings.apply(read(override, OVERRIDE_RESOURCE), OVERRIDE_RESOURCE);
				logger.info("Applied symbolic configuration overrides from classpath resource {}", OVERRIDE_RESOURCE);
			}
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read " + OVERRIDE_RESOURCE, e);
		}
		settings.applyProperties(properties);
		return settings.toConfig();
	}

	/**
	 * Parses a configuration document on top of the bundled defaults. System properties
	 * are not consulted.
	 */
	public SymbolicConfig parse(InputStream inputStream) {
		Settings settings = defaults();
		settings.apply(read(inputStream, "input stream"), "input stream");
		return settings.toConfig();
	}

	/**
	 * Parses a configuration document given as a string on top of the bundled defaults.
	 */
	public SymbolicConfig parseString(String yamlContent) {
		Settings settings = defaults();
		Map<String, Object> data;
		try {
			data = yaml.load(yamlContent);
		} catch (Exception e) {
			throw new ConfigurationException("Failed to parse symbolic configuration from string", e);
		}
		settings.apply(data, "string");
		return settings.toConfig();
	}

	private Settings defaults() {
		try (InputStream stream = classLoader.getResourceAsStream(DEFAULTS_RESOURCE)) {
			if (stream == null) {
				throw new ConfigurationException("Missing bundled configuration resource " + DEFAULTS_RESOURCE);
			}
			Settings settings = new Settings();
			settings.apply(read(stream, DEFAULTS_RESOURCE), DEFAULTS_RESOURCE);
			return settings;
		} catch (IOException e) {
			throw new ConfigurationException("Failed to read " + DEFAULTS_RESOURCE, e);
		}
	}

	private Map<String, Object> read(InputStream stream, String source) {
		try {
			return yaml.load(stream);
		} catch (Exception e) {
			throw new ConfigurationException("Failed to parse symbolic configuration from " + source, e);
		}
	}

	private static final class Settings {

		private int maxDepth = 1000;
		private String csePrefix = "CSE";
		private List<String> constantClasses = List.of();

		@SuppressWarnings("unchecked")
		void apply(Map<String, Object> data, String source) {
			if (data == null) {
				return;
			}
			Map<String, Object> mapper = section(data, "mapper", source);
			if (mapper.containsKey("max-depth")) {
				maxDepth = toInt(mapper.get("max-depth"), "mapper.max-depth", source);
			}
			Map<String, Object> stringify = section(data, "stringify", source);
			if (stringify.containsKey("cse-prefix")) {
				csePrefix = String.valueOf(stringify.get("cse-prefix"));
			}
			Map<String, Object> foreign = section(data, "foreign", source);
			if (foreign.containsKey("constant-classes")) {
				Object classes = foreign.get("constant-classes");
				if (!(classes instanceof List)) {
					throw new ConfigurationException(
							"foreign.constant-classes in " + source + " must be a list but was " + classes);
				}
				List<String> names = new ArrayList<>();
				for (Object name : (List<Object>) classes) {
					names.add(String.valueOf(name).trim());
				}
				constantClasses = names;
			}
		}

		void applyProperties(Properties properties) {
			if (properties == null) {
				return;
			}
			String depth = properties.getProperty(MAX_DEPTH_PROPERTY);
			if (depth != null) {
				maxDepth = toInt(depth.trim(), MAX_DEPTH_PROPERTY, "system properties");
			}
			String prefix = properties.getProperty(CSE_PREFIX_PROPERTY);
			if (prefix != null) {
				csePrefix = prefix.trim();
			}
		}

		SymbolicConfig toConfig() {
			return new SymbolicConfig(maxDepth, csePrefix, constantClasses);
		}

		@SuppressWarnings("unchecked")
		private static Map<String, Object> section(Map<String, Object> data, String name, String source) {
			Object value = data.get(name);
			if (value == null) {
				return Map.of();
			}
			if (!(value instanceof Map)) {
				throw new ConfigurationException("Section '" + name + "' in " + source + " must be a mapping");
			}
			return (Map<String, Object>) value;
		}

		private static int toInt(Object value, String key, String source) {
			if (value instanceof Number number) {
				return number.intValue();
			}
			try {
				return Integer.parseInt(String.valueOf(value));
			} catch (NumberFormatException e) {
				throw new ConfigurationException(key + " in " + source + " must be an integer but was " + value, e);
			}
		}
	}
}
