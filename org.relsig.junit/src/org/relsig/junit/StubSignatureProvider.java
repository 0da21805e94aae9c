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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import org.relsig.lib.SignatureFormat;
import org.relsig.lib.VerifierConfiguration;
import org.relsig.signing.SignatureProvider;
import org.relsig.signing.SignatureStatus;

/**
 * A {@link SignatureProvider} reporting a fixed outcome and remembering what
 * it was asked.
 */
public class StubSignatureProvider implements SignatureProvider {
	private final AtomicInteger calls = new AtomicInteger();

	private volatile SignatureStatus status;

	private volatile Throwable failure;

	private volatile byte[] lastSignature;

	private volatile byte[] lastContent;

	private volatile VerifierConfiguration lastConfiguration;

	private volatile Duration lastTimeout;

	/**
	 * Report the given outcome.
	 *
	 * @param s
	 *            outcome of every verification
	 */
	public void setStatus(SignatureStatus s) {
		status = s;
		failure = null;
	}

	/**
	 * Fail every verification.
	 *
	 * @param t
	 *            failure to report
	 */
	public void setFailure(Throwable t) {
		failure = t;
	}

	/**
	 * @return number of verifications requested
	 */
	public int getCallCount() {
		return calls.get();
	}

	/**
	 * @return signature bytes of the last verification
	 */
	public byte[] getLastSignature() {
		return lastSignature;
	}

	/**
	 * @return content bytes of the last verification
	 */
	public byte[] getLastContent() {
		return lastContent;
	}

	/**
	 * @return verifier configuration of the last verification
	 */
	public VerifierConfiguration getLastConfiguration() {
		return lastConfiguration;
	}

	/**
	 * @return timeout of the last verification
	 */
	public Duration getLastTimeout() {
		return lastTimeout;
	}

	@Override
	public CompletableFuture<SignatureStatus> status(byte[] signature,
			byte[] content, SignatureFormat format,
			VerifierConfiguration configuration, Duration timeout) {
		calls.incrementAndGet();
		lastSignature = signature;
		lastContent = content;
		lastConfiguration = configuration;
		lastTimeout = timeout;
		if (failure != null) {
			return CompletableFuture.failedFuture(failure);
		}
		return CompletableFuture.completedFuture(status);
	}

	@Override
	public String getName() {
		return "stub"; //$NON-NLS-1$
	}
}
