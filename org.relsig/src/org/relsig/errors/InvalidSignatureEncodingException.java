/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.errors;

import java.text.MessageFormat;

import org.relsig.internal.RelSigText;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;

/**
 * Thrown when the signature of a source archive is not valid base64.
 */
public class InvalidSignatureEncodingException
		extends SignatureValidationException {
	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new instance.
	 *
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            being validated
	 * @param version
	 *            being validated
	 * @param cause
	 *            the decoding failure
	 */
	public InvalidSignatureEncodingException(Registry registry,
			PackageIdentity packageIdentity, Version version,
			Throwable cause) {
		super(MessageFormat.format(RelSigText.get().invalidSignatureEncoding,
				registry, packageIdentity, version), registry,
				packageIdentity, version, cause);
	}
}
