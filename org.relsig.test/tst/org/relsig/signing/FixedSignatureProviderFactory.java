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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

import org.relsig.lib.SignatureFormat;
import org.relsig.lib.VerifierConfiguration;

/**
 * Registered through {@code META-INF/services}; its providers reject every
 * signature.
 */
public class FixedSignatureProviderFactory
		implements SignatureProviderFactory {

	static final String REASON = "rejected by the registered provider";

	@Override
	public SignatureFormat getType() {
		return SignatureFormat.CMS_1_0_0;
	}

	@Override
	public SignatureProvider create() {
		return new FixedSignatureProvider();
	}

	static class FixedSignatureProvider implements SignatureProvider {
		@Override
		public CompletableFuture<SignatureStatus> status(byte[] signature,
				byte[] content, SignatureFormat format,
				VerifierConfiguration configuration, Duration timeout) {
			return CompletableFuture
					.completedFuture(SignatureStatus.invalid(REASON));
		}

		@Override
		public String getName() {
			return "fixed";
		}
	}
}
