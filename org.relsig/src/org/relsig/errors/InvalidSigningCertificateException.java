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
 * Thrown when the certificate the signature was made with is invalid, for
 * example expired or revoked.
 */
public class InvalidSigningCertificateException
		extends SignatureValidationException {
	private static final long serialVersionUID = 1L;

	private final String reason;

	/**
	 * Creates a new instance.
	 *
	 * @param reason
	 *            reported by the signature provider
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            being validated
	 * @param version
	 *            being validated
	 */
	public InvalidSigningCertificateException(String reason,
			Registry registry, PackageIdentity packageIdentity,
			Version version) {
		super(MessageFormat.format(RelSigText.get().invalidSigningCertificate,
				reason), registry, packageIdentity, version, null);
		this.reason = reason;
	}

	/**
	 * Get the reason
	 *
	 * @return why the certificate is invalid
	 */
	public String getReason() {
		return reason;
	}
}
