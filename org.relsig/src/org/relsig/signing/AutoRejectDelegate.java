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
 * A {@link SignatureValidationDelegate} that never continues.
 */
public class AutoRejectDelegate implements SignatureValidationDelegate {

	/** Shared instance. */
	public static final AutoRejectDelegate INSTANCE = new AutoRejectDelegate();

	@Override
	public CompletableFuture<Boolean> onUnsigned(Registry registry,
			PackageIdentity packageIdentity, Version version) {
		return CompletableFuture.completedFuture(Boolean.FALSE);
	}

	@Override
	public CompletableFuture<Boolean> onUntrusted(Registry registry,
			PackageIdentity packageIdentity, Version version) {
		return CompletableFuture.completedFuture(Boolean.FALSE);
	}
}
