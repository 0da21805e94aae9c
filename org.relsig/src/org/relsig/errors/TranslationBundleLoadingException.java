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
 * Thrown when the resource bundle behind a translation bundle class cannot be
 * found or the bundle class cannot be instantiated.
 */
public class TranslationBundleLoadingException extends TranslationBundleException {
	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new instance.
	 *
	 * @param bundleClass
	 *            the bundle class that failed to load
	 * @param locale
	 *            the requested locale
	 * @param cause
	 *            the failure reported by the resource bundle lookup
	 */
	public TranslationBundleLoadingException(Class<?> bundleClass,
			Locale locale, Exception cause) {
		super("Loading of translation bundle failed for [" //$NON-NLS-1$
				+ bundleClass.getName() + ", " + locale + "]", //$NON-NLS-1$ //$NON-NLS-2$
				bundleClass, locale, cause);
	}
}
