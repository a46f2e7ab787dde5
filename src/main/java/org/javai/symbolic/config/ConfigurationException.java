package org.javai.symbolic.config;

import org.javai.symbolic.SymbolicException;

/**
 * Thrown when the library configuration cannot be read or holds invalid values.
 */
public class ConfigurationException extends SymbolicException {

	public ConfigurationException(String message) {
		super(message);
	}

	public ConfigurationException(String message, Throwable cause) {
		super(message, cause);
	}
}
