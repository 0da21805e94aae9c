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
 * Thrown when a translation bundle declares a text field that its resource
 * bundle does not define.
 */
public class TranslationStringMissingException extends TranslationBundleException {
	private static final long serialVersionUID = 1L;

	private final String key;

	/**
	 * Creates a new instance.
	 *
	 * @param bundleClass
	 *            the bundle class
	 * @param locale
	 *            the requested locale
	 * @param key
	 *            the missing key
	 * @param cause
	 *            the lookup failure
	 */
	public TranslationStringMissingException(Class<?> bundleClass,
			Locale locale, String key, Exception cause) {
		super("Translation missing for [" + bundleClass.getName() + ", " //$NON-NLS-1$ //$NON-NLS-2$
				+ locale + ", " + key + "]", bundleClass, locale, cause); //$NON-NLS-1$ //$NON-NLS-2$
		this.key = key;
	}

	/**
	 * Get the key of the missing translation string
	 *
	 * @return the key
	 */
	public String getKey() {
		return key;
	}
}
