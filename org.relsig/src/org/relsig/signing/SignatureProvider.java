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

import org.relsig.annotations.NonNull;
import org.relsig.annotations.Nullable;
import org.relsig.lib.SignatureFormat;
import org.relsig.lib.VerifierConfiguration;

/**
 * Verifies detached signatures of one {@link SignatureFormat}.
 * <p>
 * Implementations do the cryptography and certificate chain validation and
 * report a classified {@link SignatureStatus}. They must be thread-safe.
 */
public interface SignatureProvider {

	/**
	 * Verifies a signature over some content.
	 *
	 * @param signature
	 *            raw signature bytes
	 * @param content
	 *            the signed content
	 * @param format
	 *            of the signature
	 * @param configuration
	 *            trust roots and certificate checks to apply
	 * @param timeout
	 *            hint for how long verification may take, including any
	 *            network access for revocation checks; {@code null} for no
	 *            limit
	 * @return a future completing with the outcome, or exceptionally if the
	 *         verification itself failed
	 */
	@NonNull
	CompletableFuture<SignatureStatus> status(@NonNull byte[] signature,
			@NonNull byte[] content, @NonNull SignatureFormat format,
			@NonNull VerifierConfiguration configuration,
			@Nullable Duration timeout);

	/**
	 * Retrieves the name of this provider.
	 *
	 * @return a name, used in log output
	 */
	@NonNull
	String getName();
}
