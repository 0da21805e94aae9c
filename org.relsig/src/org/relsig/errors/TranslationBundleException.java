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

import java.util.Locale;

/**
 * Common base class for all translation bundle related exceptions.
 */
public abstract class TranslationBundleException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final Class<?> bundleClass;

	private final Locale locale;

	/**
	 * Creates a new exception for a bundle class and locale.
	 *
	 * @param message
	 *            describing the failure
	 * @param bundleClass
	 *            the bundle class
	 * @param locale
	 *            the requested locale
	 * @param cause
	 *            the underlying failure
	 */
	protected TranslationBundleException(String message, Class<?> bundleClass,
			Locale locale, Exception cause) {
		super(message, cause);
		this.bundleClass = bundleClass;
		this.locale = locale;
	}

	/**
	 * Get the bundle class
	 *
	 * @return bundle class for which the exception occurred
	 */
	public final Class<?> getBundleClass() {
		return bundleClass;
	}

	/**
	 * Get the locale
	 *
	 * @return locale for which the exception occurred
	 */
	public final Locale getLocale() {
		return locale;
	}
}
