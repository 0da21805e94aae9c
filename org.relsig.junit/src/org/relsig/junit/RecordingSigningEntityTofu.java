/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.junit;

import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;

import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.Version;
import org.relsig.signing.SigningEntityTofu;

/**
 * A {@link SigningEntityTofu} remembering every signing entity it was given.
 */
public class RecordingSigningEntityTofu implements SigningEntityTofu {
	private final List<Optional<SigningEntity>> recorded = new ArrayList<>();

	private volatile Throwable failure;

	/**
	 * Acknowledge every call with a failure.
	 *
	 * @param t
	 *            failure to report
	 */
	public void setFailure(Throwable t) {
		failure = t;
	}

	/**
	 * @return the signing entities recorded so far, empty where none was given
	 */
	public synchronized List<Optional<SigningEntity>> getRecorded() {
		return new ArrayList<>(recorded);
	}

	@Override
	public CompletableFuture<?> validate(Registry registry,
			PackageIdentity packageIdentity, Version version,
			SigningEntity signingEntity) {
		synchronized (this) {
			recorded.add(Optional.ofNullable(signingEntity));
		}
		if (failure != null) {
			return CompletableFuture.failedFuture(failure);
		}
		return CompletableFuture.completedFuture(null);
	}
}
