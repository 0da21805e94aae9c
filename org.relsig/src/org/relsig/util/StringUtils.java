/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.util;

import java.text.MessageFormat;
import java.util.Locale;

import org.relsig.internal.RelSigText;

/**
 * Miscellaneous string comparison and conversion utility methods.
 */
public final class StringUtils {

	private StringUtils() {
		// Utility class
	}

	/**
	 * Test if two strings are equal, ignoring case.
	 * <p>
	 * Only ASCII letters are folded, so the result does not depend on the
	 * default locale.
	 *
	 * @param a
	 *            first string to compare, may be {@code null}
	 * @param b
	 *            second string to compare, may be {@code null}
	 * @return {@code true} if a equals b ignoring ASCII case
	 */
	public static boolean equalsIgnoreCase(String a, String b) {
		if (a == b) {
			return true;
		}
		if (a == null || b == null || a.length() != b.length()) {
			return false;
		}
		for (int i = 0; i < a.length(); i++) {
			if (toLowerCase(a.charAt(i)) != toLowerCase(b.charAt(i))) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Convert the input to lowercase using ASCII rules only.
	 *
	 * @param in
	 *            the string to convert
	 * @return the lowercase string
	 */
	public static String toLowerCase(String in) {
		return in.toLowerCase(Locale.ROOT);
	}

	private static char toLowerCase(char c) {
		return c >= 'A' && c <= 'Z' ? (char) (c + ('a' - 'A')) : c;
	}

	/**
	 * Parse a string as a boolean.
	 * <p>
	 * Accepts {@code yes}, {@code true}, {@code 1} and {@code on} as true and
	 * {@code no}, {@code false}, {@code 0} and {@code off} as false, ignoring
	 * case.
	 *
	 * @param stringValue
	 *            the string to parse
	 * @return the boolean interpretation of {@code stringValue}
	 * @throws IllegalArgumentException
	 *             if {@code stringValue} is not recognized as a boolean
	 */
	public static boolean toBoolean(String stringValue) {
		if (stringValue == null) {
			throw new NullPointerException(
					RelSigText.get().expectedBooleanStringValue);
		}
		Boolean bool = toBooleanOrNull(stringValue);
		if (bool == null) {
			throw new IllegalArgumentException(MessageFormat
					.format(RelSigText.get().notABoolean, stringValue));
		}
		return bool.booleanValue();
	}

	/**
	 * Parse a string as a boolean, returning {@code null} if unrecognized.
	 *
	 * @param stringValue
	 *            the string to parse, may be {@code null}
	 * @return the boolean, or {@code null} if not a boolean
	 */
	public static Boolean toBooleanOrNull(String stringValue) {
		if (stringValue == null) {
			return null;
		}
		switch (toLowerCase(stringValue)) {
		case "yes": //$NON-NLS-1$
		case "true": //$NON-NLS-1$
		case "1": //$NON-NLS-1$
		case "on": //$NON-NLS-1$
			return Boolean.TRUE;
		case "no": //$NON-NLS-1$
		case "false": //$NON-NLS-1$
		case "0": //$NON-NLS-1$
		case "off": //$NON-NLS-1$
			return Boolean.FALSE;
		default:
			return null;
		}
	}

	/**
	 * Test if a string is empty or null.
	 *
	 * @param stringValue
	 *            the string to check
	 * @return {@code true} if the string is {@code null} or empty
	 */
	public static boolean isEmptyOrNull(String stringValue) {
		return stringValue == null || stringValue.isEmpty();
	}
}
