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
 * Thrown when the signature provider itself failed while verifying a
 * signature.
 */
public class SignatureVerificationFailedException
		extends SignatureValidationException {
	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new instance.
	 *
	 * @param cause
	 *            the provider failure
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            being validated
	 * @param version
	 *            being validated
	 */
	public SignatureVerificationFailedException(Throwable cause,
			Registry registry, PackageIdentity packageIdentity,
			Version version) {
		super(MessageFormat.format(RelSigText.get().failedToValidateSignature,
				cause.getMessage() != null ? cause.getMessage()
						: cause.getClass().getName()),
				registry, packageIdentity, version, cause);
	}

	/**
	 * Creates a new instance without an underlying exception.
	 *
	 * @param reason
	 *            why verification could not be done
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            being validated
	 * @param version
	 *            being validated
	 */
	public SignatureVerificationFailedException(String reason,
			Registry registry, PackageIdentity packageIdentity,
			Version version) {
		super(MessageFormat.format(RelSigText.get().failedToValidateSignature,
				reason), registry, packageIdentity, version, null);
	}
}
