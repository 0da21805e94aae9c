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

import java.util.concurrent.CompletableFuture;

import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;

/**
 * Decides interactively whether to continue with a release whose signature is
 * missing or whose signer is not trusted.
 * <p>
 * Consulted when the configured action is
 * {@link org.relsig.lib.TrustAction#PROMPT}. Each returned future is completed
 * once; {@code true} means continue.
 */
public interface SignatureValidationDelegate {

	/**
	 * Asks whether to continue with an unsigned release.
	 *
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package
	 * @param version
	 *            the release
	 * @return a future completing with {@code true} to continue
	 */
	CompletableFuture<Boolean> onUnsigned(Registry registry,
			PackageIdentity packageIdentity, Version version);

	/**
	 * Asks whether to continue with a release signed by an untrusted signer.
	 *
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package
	 * @param version
	 *            the release
	 * @return a future completing with {@code true} to continue
	 */
	CompletableFuture<Boolean> onUntrusted(Registry registry,
			PackageIdentity packageIdentity, Version version);
}
