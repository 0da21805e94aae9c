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

import org.relsig.annotations.Nullable;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.PackageVersionMetadata;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;

/**
 * Retrieves release metadata from a package registry.
 */
public interface VersionMetadataProvider {

	/**
	 * Fetches the metadata of one release.
	 *
	 * @param registry
	 *            to ask
	 * @param packageIdentity
	 *            the package
	 * @param version
	 *            the release
	 * @param timeout
	 *            hint for how long the request may take; {@code null} for the
	 *            provider's default
	 * @return a future completing with the metadata, or exceptionally if it
	 *         could not be retrieved
	 */
	CompletableFuture<PackageVersionMetadata> getMetadata(Registry registry,
			PackageIdentity packageIdentity, Version version,
			@Nullable Duration timeout);
}
