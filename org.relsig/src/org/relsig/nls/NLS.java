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

import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.relsig.errors.TranslationBundleLoadingException;
import org.relsig.errors.TranslationStringMissingException;

/**
 * Per-thread locale selection for {@link TranslationBundle}s.
 * <p>
 * The locale is inherited by child threads. Threads that never called
 * {@link #setLocale(Locale)} use the JVM default locale.
 *
 * <pre>
 * NLS.setLocale(Locale.GERMAN);
 * RelSigText t = NLS.getBundleFor(RelSigText.class);
 * </pre>
 */
public class NLS {

	private static final InheritableThreadLocal<NLS> local = new InheritableThreadLocal<>();

	// Bundles are immutable once loaded, so all threads share them.
	private static final Map<Locale, Map<Class<?>, TranslationBundle>> cache = new ConcurrentHashMap<>();

	/**
	 * Sets the locale for the calling thread and the threads it creates
	 * afterwards.
	 *
	 * @param locale
	 *            the preferred locale
	 */
	public static void setLocale(Locale locale) {
		local.set(new NLS(locale));
	}

	/**
	 * Uses the JVM default locale for the calling thread.
	 */
	public static void useJVMDefaultLocale() {
		setLocale(Locale.getDefault());
	}

	/**
	 * Returns the translation bundle of the given type for the locale of the
	 * calling thread, loading it on first use.
	 *
	 * @param type
	 *            required bundle type
	 * @return an instance of the required bundle type
	 * @throws TranslationBundleLoadingException
	 *             if no resource bundle exists for {@code type}
	 * @throws TranslationStringMissingException
	 *             if the resource bundle lacks a text for a public field
	 */
	public static <T extends TranslationBundle> T getBundleFor(Class<T> type) {
		NLS nls = local.get();
		if (nls == null) {
			nls = new NLS(Locale.getDefault());
			local.set(nls);
		}
		return nls.lookup(type);
	}

	/**
	 * Drops all loaded bundles. Intended for tests switching locales.
	 */
	public static void clearCache() {
		cache.clear();
	}

	private final Locale locale;

	private NLS(Locale locale) {
		this.locale = locale;
	}

	@SuppressWarnings("unchecked")
	private <T extends TranslationBundle> T lookup(Class<T> type) {
		Map<Class<?>, TranslationBundle> bundles = cache
				.computeIfAbsent(locale, l -> new ConcurrentHashMap<>());
		TranslationBundle bundle = bundles.get(type);
		if (bundle == null) {
			bundle = newBundle(type);
			bundle.load(locale);
			// A concurrent loader may have won; keep its instance.
			TranslationBundle old = bundles.putIfAbsent(type, bundle);
			if (old != null) {
				bundle = old;
			}
		}
		return (T) bundle;
	}

	private <T extends TranslationBundle> T newBundle(Class<T> type) {
		try {
			return type.getDeclaredConstructor().newInstance();
		} catch (ReflectiveOperationException e) {
			throw new TranslationBundleLoadingException(type, locale, e);
		}
	}
}
