/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.yaml.jackson;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.fasterxml.jackson.dataformat.yaml.YAMLGenerator;
import com.fasterxml.jackson.dataformat.yaml.YAMLMapper;
import io.akao.yamlrpc.yaml.YamlMapper;
import io.akao.yamlrpc.yaml.YamlMapperSupplier;

/**
 * A supplier of {@link YamlMapper} instances that uses Jackson's YAML data format for
 * serialization and deserialization.
 */
public class JacksonYamlMapperSupplier implements YamlMapperSupplier {

	/**
	 * Returns a new instance of {@link YamlMapper} backed by a Jackson YAML mapper.
	 * <p>
	 * The mapper omits the {@code ---} document start marker and ignores unknown
	 * properties when binding records. Strings keep Jackson's default quoting so that
	 * values such as {@code "1.0"} or {@code "true"} survive a round trip as strings.
	 * @return a new {@link YamlMapper} instance
	 */
	@Override
	public YamlMapper get() {
		return new JacksonYamlMapper(createYamlObjectMapper());
	}

	static ObjectMapper createYamlObjectMapper() {
		YAMLFactory factory = YAMLFactory.builder()
			.disable(YAMLGenerator.Feature.WRITE_DOC_START_MARKER)
			.build();
		return YAMLMapper.builder(factory).disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES).build();
	}

}
