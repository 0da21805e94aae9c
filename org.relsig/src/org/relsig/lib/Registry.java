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

import java.net.URI;
import java.util.Locale;
import java.util.Objects;

import org.relsig.annotations.NonNull;

/**
 * A package registry, identified by its base URL.
 */
public final class Registry {

	private final URI url;

	private final boolean supportsAvailability;

	/**
	 * Creates a new {@link Registry}.
	 *
	 * @param url
	 *            base URL of the registry
	 * @param supportsAvailability
	 *            whether the registry offers an availability endpoint
	 */
	public Registry(@NonNull URI url, boolean supportsAvailability) {
		this.url = Objects.requireNonNull(url);
		this.supportsAvailability = supportsAvailability;
	}

	/**
	 * Creates a new {@link Registry} without availability endpoint.
	 *
	 * @param url
	 *            base URL of the registry
	 */
	public Registry(@NonNull URI url) {
		this(url, false);
	}

	/**
	 * Retrieves the registry's base URL.
	 *
	 * @return the URL
	 */
	@NonNull
	public URI getUrl() {
		return url;
	}

	/**
	 * Tells whether the registry offers an availability endpoint.
	 *
	 * @return {@code true} if it does
	 */
	public boolean supportsAvailability() {
		return supportsAvailability;
	}

	/**
	 * Retrieves the key used to find registry specific configuration: the
	 * lower-cased host of the URL, or the whole URL if it has no host.
	 *
	 * @return the configuration key
	 */
	@NonNull
	public String getConfigKey() {
		String host = url.getHost();
		return host != null ? host.toLowerCase(Locale.ROOT)
				: url.toString();
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Registry)) {
			return false;
		}
		Registry other = (Registry) obj;
		return url.equals(other.url)
				&& supportsAvailability == other.supportsAvailability;
	}

	@Override
	public int hashCode() {
		return url.hashCode();
	}

	@Override
	public String toString() {
		return url.toString();
	}
}
