/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.nls;

import java.lang.reflect.Field;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

import org.relsig.errors.TranslationBundleLoadingException;
import org.relsig.errors.TranslationStringMissingException;

/**
 * Base class for translation bundles.
 * <p>
 * A concrete bundle declares one public {@code String} field per message and
 * ships a properties file named after the class in the same package. On
 * loading, every public {@code String} field receives the text stored under
 * the field's name:
 *
 * <pre>
 * public class RelSigText extends TranslationBundle {
 * 	public static RelSigText get() {
 * 		return NLS.getBundleFor(RelSigText.class);
 * 	}
 *
 * 	public String signerNotTrusted;
 * }
 * </pre>
 *
 * Subclasses need a public no-argument constructor. Lookup follows
 * {@link ResourceBundle#getBundle(String, Locale, ClassLoader)}; use
 * {@link #effectiveLocale()} to find out whether a fallback was used.
 */
public abstract class TranslationBundle {

	private Locale effectiveLocale;

	private ResourceBundle resourceBundle;

	/**
	 * Get the locale of the resource bundle the texts were taken from.
	 *
	 * @return the effective locale
	 */
	public Locale effectiveLocale() {
		return effectiveLocale;
	}

	/**
	 * Get the underlying resource bundle.
	 *
	 * @return the resource bundle backing this translation bundle
	 */
	public ResourceBundle resourceBundle() {
		return resourceBundle;
	}

	void load(Locale locale) throws TranslationBundleLoadingException {
		Class<?> bundleClass = getClass();
		try {
			resourceBundle = ResourceBundle.getBundle(bundleClass.getName(),
					locale, bundleClass.getClassLoader());
		} catch (MissingResourceException e) {
			throw new TranslationBundleLoadingException(bundleClass, locale, e);
		}
		effectiveLocale = resourceBundle.getLocale();

		for (Field field : bundleClass.getFields()) {
			if (!field.getType().equals(String.class)) {
				continue;
			}
			try {
				field.set(this, resourceBundle.getString(field.getName()));
			} catch (MissingResourceException e) {
				throw new TranslationStringMissingException(bundleClass,
						locale, field.getName(), e);
			} catch (IllegalAccessException e) {
				throw new Error(e);
			}
		}
	}
}
