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

import java.util.Base64;

import org.relsig.errors.InvalidSignatureEncodingException;
import org.relsig.errors.MissingSignatureFormatException;
import org.relsig.errors.MissingSourceArchiveException;
import org.relsig.errors.SourceArchiveNotSignedException;
import org.relsig.errors.UnknownSignatureFormatException;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.PackageVersionMetadata;
import org.relsig.lib.PackageVersionMetadata.Resource;
import org.relsig.lib.PackageVersionMetadata.Signing;
import org.relsig.lib.Registry;
import org.relsig.lib.SignatureFormat;
import org.relsig.lib.Version;

/**
 * Extracts the source archive signature from release metadata.
 */
public class SignatureDecoder {

	/**
	 * Decodes the signature of the source archive of a release.
	 * <p>
	 * Checks are made in this order: the source archive exists, it carries a
	 * signature, the signature is valid base64, a format is given, and the
	 * format is known.
	 *
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package
	 * @param version
	 *            the release
	 * @param metadata
	 *            of the release
	 * @return the decoded signature
	 * @throws MissingSourceArchiveException
	 *             if there is no source archive
	 * @throws SourceArchiveNotSignedException
	 *             if the source archive has no signature
	 * @throws InvalidSignatureEncodingException
	 *             if the signature is not base64
	 * @throws MissingSignatureFormatException
	 *             if no signature format is given
	 * @throws UnknownSignatureFormatException
	 *             if the signature format is not supported
	 */
	public DecodedSignature decode(Registry registry,
			PackageIdentity packageIdentity, Version version,
			PackageVersionMetadata metadata)
			throws MissingSourceArchiveException,
			SourceArchiveNotSignedException,
			InvalidSignatureEncodingException,
			MissingSignatureFormatException,
			UnknownSignatureFormatException {
		Resource archive = metadata.getSourceArchive();
		if (archive == null) {
			throw new MissingSourceArchiveException(registry, packageIdentity,
					version);
		}
		Signing signing = archive.getSigning();
		if (signing == null || signing.getSignatureBase64Encoded() == null) {
			throw new SourceArchiveNotSignedException(registry,
					packageIdentity, version);
		}
		byte[] signature;
		try {
			signature = Base64.getDecoder()
					.decode(signing.getSignatureBase64Encoded());
		} catch (IllegalArgumentException e) {
			throw new InvalidSignatureEncodingException(registry,
					packageIdentity, version, e);
		}
		String token = signing.getSignatureFormat();
		if (token == null) {
			throw new MissingSignatureFormatException(registry,
					packageIdentity, version);
		}
		SignatureFormat format = SignatureFormat.fromToken(token);
		if (format == null) {
			throw new UnknownSignatureFormatException(token, registry,
					packageIdentity, version);
		}
		return new DecodedSignature(signature, format);
	}
}
