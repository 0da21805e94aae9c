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

import java.util.Base64;
import java.util.Collections;

import org.relsig.lib.PackageVersionMetadata;
import org.relsig.lib.PackageVersionMetadata.Resource;
import org.relsig.lib.PackageVersionMetadata.Signing;

/**
 * Builds release metadata for tests.
 */
public final class TestMetadata {
	private TestMetadata() {
		// Static helpers only
	}

	/**
	 * Metadata with a source archive signed with the given base64 signature
	 * and format token.
	 *
	 * @param signatureBase64Encoded
	 *            signature, may be {@code null}
	 * @param format
	 *            format token, may be {@code null}
	 * @return the metadata
	 */
	public static PackageVersionMetadata signed(String signatureBase64Encoded,
			String format) {
		return sourceArchive(new Signing(signatureBase64Encoded, format));
	}

	/**
	 * Metadata with a source archive signed with the given raw signature in
	 * the {@code cms-1.0.0} format.
	 *
	 * @param signature
	 *            raw signature bytes
	 * @return the metadata
	 */
	public static PackageVersionMetadata signed(byte[] signature) {
		return signed(Base64.getEncoder().encodeToString(signature),
				"cms-1.0.0"); //$NON-NLS-1$
	}

	/**
	 * Metadata with an unsigned source archive.
	 *
	 * @return the metadata
	 */
	public static PackageVersionMetadata unsigned() {
		return sourceArchive(null);
	}

	/**
	 * Metadata listing no source archive.
	 *
	 * @return the metadata
	 */
	public static PackageVersionMetadata withoutSourceArchive() {
		return new PackageVersionMetadata(Collections.singletonList(
				new Resource("readme", "text/plain", null, null))); //$NON-NLS-1$ //$NON-NLS-2$
	}

	private static PackageVersionMetadata sourceArchive(Signing signing) {
		return new PackageVersionMetadata(Collections.singletonList(
				new Resource(PackageVersionMetadata.SOURCE_ARCHIVE_NAME,
						PackageVersionMetadata.SOURCE_ARCHIVE_TYPE,
						"0123456789abcdef", signing))); //$NON-NLS-1$
	}
}
