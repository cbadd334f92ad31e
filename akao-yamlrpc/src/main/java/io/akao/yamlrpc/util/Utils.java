/*
 * Copyright 2026-2026 the original author or authors.
 */

package io.akao.yamlrpc.util;

import reactor.util.annotation.Nullable;

/**
 * Miscellaneous utility methods.
 */
public final class Utils {

	private Utils() {
	}

	/**
	 * @param str the string to check, may be {@code null}
	 * @return whether the string has at least one non-whitespace character
	 */
	public static boolean hasText(@Nullable String str) {
		return (str != null && !str.isBlank());
	}

	/**
	 * Returns the given string, or the empty string when it is {@code null}.
	 * @param str the string to normalize
	 * @return never {@code null}
	 */
	public static String nullToEmpty(@Nullable String str) {
		return (str != null) ? str : "";
	}

}
