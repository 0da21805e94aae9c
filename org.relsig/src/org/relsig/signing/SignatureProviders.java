/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.signing;

import java.text.MessageFormat;
import java.util.EnumMap;
import java.util.Map;
import java.util.ServiceConfigurationError;
import java.util.ServiceLoader;
import java.util.concurrent.ConcurrentHashMap;

import org.relsig.annotations.NonNull;
import org.relsig.annotations.Nullable;
import org.relsig.internal.RelSigText;
import org.relsig.lib.SignatureFormat;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Manages the available signature providers.
 */
public final class SignatureProviders {

	private static final Logger LOG = LoggerFactory
			.getLogger(SignatureProviders.class);

	private static final Map<SignatureFormat, SignatureProviderFactory> FACTORIES = loadSignatureProviders();

	private static final Map<SignatureFormat, SignatureProvider> PROVIDERS = new ConcurrentHashMap<>();

	private static Map<SignatureFormat, SignatureProviderFactory> loadSignatureProviders() {
		Map<SignatureFormat, SignatureProviderFactory> result = new EnumMap<>(
				SignatureFormat.class);
		try {
			for (SignatureProviderFactory factory : ServiceLoader
					.load(SignatureProviderFactory.class)) {
				SignatureFormat format = factory.getType();
				SignatureProviderFactory existing = result.get(format);
				if (existing != null) {
					LOG.warn("{}", //$NON-NLS-1$
							MessageFormat.format(
									RelSigText.get().signatureServiceConflict,
									"SignatureProviderFactory", format, //$NON-NLS-1$
									existing.getClass().getCanonicalName(),
									factory.getClass().getCanonicalName()));
				} else {
					result.put(format, factory);
				}
			}
		} catch (ServiceConfigurationError e) {
			LOG.error(e.getMessage(), e);
		}
		return result;
	}

	private SignatureProviders() {
		// No instantiation
	}

	/**
	 * Retrieves a {@link SignatureProvider} that can verify signatures of the
	 * given type {@code format}.
	 *
	 * @param format
	 *            {@link SignatureFormat} the provider must support
	 * @return a {@link SignatureProvider}, or {@code null} if none is
	 *         available
	 */
	@Nullable
	public static SignatureProvider get(@NonNull SignatureFormat format) {
		return PROVIDERS.computeIfAbsent(format, f -> {
			SignatureProviderFactory factory = FACTORIES.get(format);
			if (factory == null) {
				return null;
			}
			return factory.create();
		});
	}

	/**
	 * Sets a specific signature provider to use for a specific signature
	 * type.
	 *
	 * @param format
	 *            signature type to set the {@code provider} for
	 * @param provider
	 *            the {@link SignatureProvider} to use for signatures of type
	 *            {@code format}; if {@code null}, a default implementation, if
	 *            available, may be used.
	 */
	public static void set(@NonNull SignatureFormat format,
			SignatureProvider provider) {
		if (provider == null) {
			PROVIDERS.remove(format);
		} else {
			PROVIDERS.put(format, provider);
		}
	}
}
