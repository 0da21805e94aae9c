/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.lib;

import java.text.MessageFormat;

import org.relsig.annotations.NonNull;
import org.relsig.internal.RelSigText;
import org.relsig.util.StringUtils;

/**
 * Registry identity of a package: a scope and a name, written
 * {@code scope.name}.
 * <p>
 * A scope has 1 to 39 characters, letters, digits and single hyphens, neither
 * starting nor ending with a hyphen. A name has 1 to 100 characters, letters,
 * digits, hyphens and underscores, starting with a letter or digit. Both
 * compare case-insensitively; the original spelling is kept for display.
 */
public final class PackageIdentity {

	private static final int MAX_SCOPE_LENGTH = 39;

	private static final int MAX_NAME_LENGTH = 100;

	private final String scope;

	private final String name;

	private PackageIdentity(String scope, String name) {
		this.scope = scope;
		this.name = name;
	}

	/**
	 * Creates a {@link PackageIdentity} from its parts.
	 *
	 * @param scope
	 *            of the package
	 * @param name
	 *            of the package
	 * @return the identity
	 * @throws IllegalArgumentException
	 *             if scope or name are malformed
	 */
	public static PackageIdentity of(String scope, String name) {
		if (!isValidScope(scope) || !isValidName(name)) {
			throw new IllegalArgumentException(MessageFormat.format(
					RelSigText.get().invalidPackageIdentity,
					scope + '.' + name));
		}
		return new PackageIdentity(scope, name);
	}

	/**
	 * Parses a {@code scope.name} string.
	 *
	 * @param identity
	 *            to parse
	 * @return the identity
	 * @throws IllegalArgumentException
	 *             if {@code identity} is malformed
	 */
	public static PackageIdentity parse(String identity) {
		int dot = identity == null ? -1 : identity.indexOf('.');
		if (dot < 0) {
			throw new IllegalArgumentException(MessageFormat.format(
					RelSigText.get().invalidPackageIdentity, identity));
		}
		return of(identity.substring(0, dot), identity.substring(dot + 1));
	}

	private static boolean isValidScope(String scope) {
		if (StringUtils.isEmptyOrNull(scope)
				|| scope.length() > MAX_SCOPE_LENGTH) {
			return false;
		}
		char prev = '-';
		for (int i = 0; i < scope.length(); i++) {
			char c = scope.charAt(i);
			if (c == '-') {
				if (prev == '-') {
					// Leading or doubled hyphen
					return false;
				}
			} else if (!isAsciiLetterOrDigit(c)) {
				return false;
			}
			prev = c;
		}
		return prev != '-';
	}

	private static boolean isValidName(String name) {
		if (StringUtils.isEmptyOrNull(name) || name.length() > MAX_NAME_LENGTH
				|| !isAsciiLetterOrDigit(name.charAt(0))) {
			return false;
		}
		for (int i = 1; i < name.length(); i++) {
			char c = name.charAt(i);
			if (!isAsciiLetterOrDigit(c) && c != '-' && c != '_') {
				return false;
			}
		}
		return true;
	}

	private static boolean isAsciiLetterOrDigit(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z')
				|| (c >= '0' && c <= '9');
	}

	/**
	 * Retrieves the scope.
	 *
	 * @return the scope
	 */
	@NonNull
	public String getScope() {
		return scope;
	}

	/**
	 * Retrieves the name.
	 *
	 * @return the name
	 */
	@NonNull
	public String getName() {
		return name;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof PackageIdentity)) {
			return false;
		}
		PackageIdentity other = (PackageIdentity) obj;
		return StringUtils.equalsIgnoreCase(scope, other.scope)
				&& StringUtils.equalsIgnoreCase(name, other.name);
	}

	@Override
	public int hashCode() {
		return StringUtils.toLowerCase(toString()).hashCode();
	}

	@Override
	public String toString() {
		return scope + '.' + name;
	}
}
