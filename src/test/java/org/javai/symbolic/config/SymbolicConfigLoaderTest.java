package org.javai.symbolic.config;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.net.URL;
import java.net.URLClassLoader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Properties;
import org.apache.logging.log4j.Level;
import org.javai.symbolic.testsupport.LogCaptorAppender;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

class SymbolicConfigLoaderTest {

	private final SymbolicConfigLoader loader = new SymbolicConfigLoader();

	@Test
	void bundledDefaults() {
		SymbolicConfig config = loader.load(new Properties());

		assertThat(config.maxDepth()).isEqualTo(1000);
		assertThat(config.csePrefix()).isEqualTo("CSE");
		assertThat(config.constantClasses()).contains("java.lang.Integer", "java.math.BigDecimal", "java.lang.Boolean");
	}

	@Test
	void systemPropertiesOverrideDefaults() {
		Properties properties = new Properties();
		properties.setProperty(SymbolicConfigLoader.MAX_DEPTH_PROPERTY, " 50 ");
		properties.setProperty(SymbolicConfigLoader.CSE_PREFIX_PROPERTY, "tmp");

		SymbolicConfig config = loader.load(properties);

		assertThat(config.maxDepth()).isEqualTo(50);
		assertThat(config.csePrefix()).isEqualTo("tmp");
	}

	@Test
	void documentOverridesOnlyTheKeysItNames() {
		SymbolicConfig config = loader.parseString("""
				mapper:
				  max-depth: 20
				""");

		assertThat(config.maxDepth()).isEqualTo(20);
		assertThat(config.csePrefix()).isEqualTo("CSE");
		assertThat(config.constantClasses()).contains("java.lang.Long");
	}

	@Test
	void constantClassesCanBeReplaced() {
		SymbolicConfig config = loader.parse(new ByteArrayInputStream("""
				foreign:
				  constant-classes:
				    - java.lang.Integer
				    - java.lang.String
				""".getBytes(StandardCharsets.UTF_8)));

		assertThat(config.constantClasses()).containsExactly("java.lang.Integer", "java.lang.String");
	}

	@Test
	void classpathOverrideIsAppliedAndLogged(@TempDir Path dir) throws IOException {
		Files.writeString(dir.resolve(SymbolicConfigLoader.OVERRIDE_RESOURCE), """
				stringify:
				  cse-prefix: shared
				""");
		try (URLClassLoader classLoader = new URLClassLoader(new URL[] { dir.toUri().toURL() },
				getClass().getClassLoader());
				LogCaptorAppender appender = LogCaptorAppender.create(SymbolicConfigLoader.class, Level.INFO)) {
			SymbolicConfig config = new SymbolicConfigLoader(classLoader).load(new Properties());

			assertThat(config.csePrefix()).isEqualTo("shared");
			assertThat(appender.messagesAt(Level.INFO)).anyMatch(msg -> msg.contains("symbolic.yml"));
		}
	}

	@Test
	void nonIntegerDepthIsRejected() {
		assertThatThrownBy(() -> loader.parseString("mapper:\n  max-depth: deep\n"))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("mapper.max-depth");
	}

	@Test
	void depthBelowOneIsRejected() {
		assertThatThrownBy(() -> loader.parseString("mapper:\n  max-depth: 0\n"))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining(">= 1");
	}

	@Test
	void sectionMustBeAMapping() {
		assertThatThrownBy(() -> loader.parseString("stringify: CSE\n"))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("'stringify'");
	}

	@Test
	void constantClassesMustBeAList() {
		assertThatThrownBy(() -> loader.parseString("foreign:\n  constant-classes: java.lang.Integer\n"))
				.isInstanceOf(ConfigurationException.class)
				.hasMessageContaining("must be a list");
	}

	@Test
	void malformedYamlIsAConfigurationError() {
		assertThatThrownBy(() -> loader.parseString("mapper: [unclosed"))
				.isInstanceOf(ConfigurationException.class)
				.hasCauseInstanceOf(Exception.class);
	}

	@Test
	void blankPrefixIsRejected() {
		assertThatThrownBy(() -> SymbolicConfig.get().withCsePrefix(" ")).isInstanceOf(ConfigurationException.class);
	}
}
