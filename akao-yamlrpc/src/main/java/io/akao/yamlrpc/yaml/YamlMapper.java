/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.yaml;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;

/**
 * Reads and writes YAML documents for the message codec and the manifest loader. The
 * implementation is picked up through {@link YamlMapperSupplier}; the module registers
 * one backed by Jackson.
 */
public interface YamlMapper {

	/**
	 * @param content a YAML document
	 * @param type the type to bind the document to
	 * @return the bound value, {@code null} for an empty document
	 * @throws IOException if the document is not well formed or does not fit the type
	 */
	<T> T readValue(String content, Class<T> type) throws IOException;

	/**
	 * Same as {@link #readValue(String, Class)} for a UTF-8 encoded document.
	 */
	<T> T readValue(byte[] content, Class<T> type) throws IOException;

	String writeValueAsString(Object value) throws IOException;

	/**
	 * @param value the value to write
	 * @return the YAML document encoded as UTF-8
	 * @throws IOException if the value cannot be written
	 */
	byte[] writeValueAsBytes(Object value) throws IOException;

	/**
	 * Returns the mapper of the first registered {@link YamlMapperSupplier} that can be
	 * instantiated.
	 * @return a new mapper
	 * @throws IllegalStateException if no supplier is registered or none of them could
	 * create a mapper; the individual failures are attached as suppressed exceptions
	 */
	static YamlMapper createDefault() {
		List<Throwable> failures = new ArrayList<>();
		for (ServiceLoader.Provider<YamlMapperSupplier> provider : ServiceLoader.load(YamlMapperSupplier.class)
			.stream()
			.toList()) {
			try {
				YamlMapper mapper = provider.get().get();
				if (mapper != null) {
					return mapper;
				}
			}
			catch (ServiceConfigurationError | RuntimeException e) {
				failures.add(e);
			}
		}
		IllegalStateException exception = new IllegalStateException(failures.isEmpty()
				? "No " + YamlMapperSupplier.class.getName() + " is registered"
				: "None of the registered YAML mappers could be created");
		failures.forEach(exception::addSuppressed);
		throw exception;
	}

}
