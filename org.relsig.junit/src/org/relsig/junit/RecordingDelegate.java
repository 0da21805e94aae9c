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

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;
import org.relsig.signing.SignatureValidationDelegate;

/**
 * A {@link SignatureValidationDelegate} giving a fixed answer and counting
 * questions.
 */
public class RecordingDelegate implements SignatureValidationDelegate {
	private final AtomicInteger unsigned = new AtomicInteger();

	private final AtomicInteger untrusted = new AtomicInteger();

	private final Boolean answer;

	private final Throwable failure;

	/**
	 * Creates a delegate answering every question the same way.
	 *
	 * @param answer
	 *            the answer
	 */
	public RecordingDelegate(boolean answer) {
		this.answer = Boolean.valueOf(answer);
		this.failure = null;
	}

	/**
	 * Creates a delegate failing every question.
	 *
	 * @param failure
	 *            to report
	 */
	public RecordingDelegate(Throwable failure) {
		this.answer = null;
		this.failure = failure;
	}

	/**
	 * @return how often {@link #onUnsigned} was called
	 */
	public int getUnsignedCount() {
		return unsigned.get();
	}

	/**
	 * @return how often {@link #onUntrusted} was called
	 */
	public int getUntrustedCount() {
		return untrusted.get();
	}

	@Override
	public CompletableFuture<Boolean> onUnsigned(Registry registry,
			PackageIdentity packageIdentity, Version version) {
		unsigned.incrementAndGet();
		return reply();
	}

	@Override
	public CompletableFuture<Boolean> onUntrusted(Registry registry,
			PackageIdentity packageIdentity, Version version) {
		untrusted.incrementAndGet();
		return reply();
	}

	private CompletableFuture<Boolean> reply() {
		if (failure != null) {
			return CompletableFuture.failedFuture(failure);
		}
		return CompletableFuture.completedFuture(answer);
	}
}
