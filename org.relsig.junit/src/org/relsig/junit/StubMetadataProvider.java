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

import org.relsig.lib.PackageIdentity;
import org.relsig.lib.PackageVersionMetadata;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;
import org.relsig.signing.VersionMetadataProvider;

/**
 * A {@link VersionMetadataProvider} answering with fixed metadata or a fixed
 * failure.
 */
public class StubMetadataProvider implements VersionMetadataProvider {
	private final AtomicInteger calls = new AtomicInteger();

	private volatile PackageVersionMetadata metadata;

	private volatile Throwable failure;

	private volatile Duration lastTimeout;

	private volatile Thread lastThread;

	/**
	 * Answer with the given metadata.
	 *
	 * @param m
	 *            metadata to return
	 */
	public void setMetadata(PackageVersionMetadata m) {
		metadata = m;
		failure = null;
	}

	/**
	 * Fail every request.
	 *
	 * @param t
	 *            failure to report
	 */
	public void setFailure(Throwable t) {
		failure = t;
	}

	/**
	 * @return number of requests made
	 */
	public int getCallCount() {
		return calls.get();
	}

	/**
	 * @return timeout passed with the last request
	 */
	public Duration getLastTimeout() {
		return lastTimeout;
	}

	/**
	 * @return thread the last request was made on
	 */
	public Thread getLastThread() {
		return lastThread;
	}

	@Override
	public CompletableFuture<PackageVersionMetadata> getMetadata(
			Registry registry, PackageIdentity packageIdentity,
			Version version, Duration timeout) {
		calls.incrementAndGet();
		lastTimeout = timeout;
		lastThread = Thread.currentThread();
		if (failure != null) {
			return CompletableFuture.failedFuture(failure);
		}
		return CompletableFuture.completedFuture(metadata);
	}
}
