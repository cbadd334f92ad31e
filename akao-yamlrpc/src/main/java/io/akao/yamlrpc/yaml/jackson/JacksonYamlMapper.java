/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.yaml.jackson;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

import com.fasterxml.jackson.databind.ObjectMapper;
import io.akao.yamlrpc.util.Assert;
import io.akao.yamlrpc.yaml.YamlMapper;

/**
 * {@link YamlMapper} backed by a Jackson {@link ObjectMapper} created over a
 * {@link com.fasterxml.jackson.dataformat.yaml.YAMLFactory}.
 */
public final class JacksonYamlMapper implements YamlMapper {

	private final ObjectMapper objectMapper;

	/**
	 * @param objectMapper a mapper created over a YAML factory
	 */
	public JacksonYamlMapper(ObjectMapper objectMapper) {
		Assert.notNull(objectMapper, "objectMapper must not be null");
		this.objectMapper = objectMapper;
	}

	@Override
	public <T> T readValue(String content, Class<T> type) throws IOException {
		return objectMapper.readValue(content, type);
	}

	@Override
	public <T> T readValue(byte[] content, Class<T> type) throws IOException {
		return objectMapper.readValue(content, type);
	}

	@Override
	public String writeValueAsString(Object value) throws IOException {
		return objectMapper.writeValueAsString(value);
	}

	@Override
	public byte[] writeValueAsBytes(Object value) throws IOException {
		return objectMapper.writeValueAsString(value).getBytes(StandardCharsets.UTF_8);
	}

}
