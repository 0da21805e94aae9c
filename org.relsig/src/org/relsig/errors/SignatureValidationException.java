/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.errors;

import org.relsig.annotations.Nullable;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;

/**
 * Superclass of all exceptions thrown or reported while validating the
 * signature of a package release.
 * <p>
 * Carries the registry, package and version being validated, where known.
 */
public abstract class SignatureValidationException extends Exception {
	private static final long serialVersionUID = 1L;

	private final transient Registry registry;

	private final transient PackageIdentity packageIdentity;

	private final transient Version version;

	/**
	 * Creates a new exception.
	 *
	 * @param message
	 *            describing the failure
	 * @param registry
	 *            the package comes from, may be {@code null}
	 * @param packageIdentity
	 *            being validated, may be {@code null}
	 * @param version
	 *            being validated, may be {@code null}
	 * @param cause
	 *            underlying failure, may be {@code null}
	 */
	protected SignatureValidationException(String message, Registry registry,
			PackageIdentity packageIdentity, Version version,
			Throwable cause) {
		super(message, cause);
		this.registry = registry;
		this.packageIdentity = packageIdentity;
		this.version = version;
	}

	/**
	 * Creates a new exception without package context.
	 *
	 * @param message
	 *            describing the failure
	 * @param cause
	 *            underlying failure, may be {@code null}
	 */
	protected SignatureValidationException(String message, Throwable cause) {
		this(message, null, null, null, cause);
	}

	/**
	 * Get the registry
	 *
	 * @return the registry, or {@code null} if unknown
	 */
	@Nullable
	public Registry getRegistry() {
		return registry;
	}

	/**
	 * Get the package
	 *
	 * @return the package identity, or {@code null} if unknown
	 */
	@Nullable
	public PackageIdentity getPackageIdentity() {
		return packageIdentity;
	}

	/**
	 * Get the version
	 *
	 * @return the version, or {@code null} if unknown
	 */
	@Nullable
	public Version getVersion() {
		return version;
	}
}
