/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.yaml;

import java.util.function.Supplier;

/**
 * Strategy interface for providing a {@link YamlMapper} implementation through
 * {@link java.util.ServiceLoader}.
 */
public interface YamlMapperSupplier extends Supplier<YamlMapper> {

}
