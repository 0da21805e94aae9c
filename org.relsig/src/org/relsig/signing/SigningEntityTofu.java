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

import org.relsig.annotations.Nullable;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.Version;

/**
 * Ledger of signing entities previously seen per package (trust on first
 * use).
 * <p>
 * Implementations synchronize themselves; {@link #validate} may be called
 * concurrently for different releases.
 */
public interface SigningEntityTofu {

	/**
	 * Records the signing entity of a release and checks it against what was
	 * seen before for the package.
	 *
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package
	 * @param version
	 *            the release
	 * @param signingEntity
	 *            the signer decided for this release, or {@code null} if there
	 *            is none
	 * @return a future completing when the ledger is updated
	 */
	CompletableFuture<?> validate(Registry registry,
			PackageIdentity packageIdentity, Version version,
			@Nullable SigningEntity signingEntity);
}
