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
 * Thrown when the signature format token of a source archive is not
 * recognized.
 */
public class UnknownSignatureFormatException
		extends SignatureValidationException {
	private static final long serialVersionUID = 1L;

	private final String format;

	/**
	 * Creates a new instance.
	 *
	 * @param format
	 *            the unrecognized token
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            being validated
	 * @param version
	 *            being validated
	 */
	public UnknownSignatureFormatException(String format, Registry registry,
			PackageIdentity packageIdentity, Version version) {
		super(MessageFormat.format(RelSigText.get().unknownSignatureFormat,
				format), registry, packageIdentity, version, null);
		this.format = format;
	}

	/**
	 * Get the format token
	 *
	 * @return the token that was not recognized
	 */
	public String getFormat() {
		return format;
	}
}
