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
 * Thrown when the source archive of a release carries no signature, and the
 * configured policy does not accept unsigned packages.
 */
public class SourceArchiveNotSignedException extends SignatureValidationException {
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
	 */
	public SourceArchiveNotSignedException(Registry registry,
			PackageIdentity packageIdentity, Version version) {
		this(registry, packageIdentity, version, null);
	}

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
	 *            why the unsigned release was refused, may be {@code null}
	 */
	public SourceArchiveNotSignedException(Registry registry,
			PackageIdentity packageIdentity, Version version,
			Throwable cause) {
		super(MessageFormat.format(RelSigText.get().sourceArchiveNotSigned,
				registry, packageIdentity, version), registry,
				packageIdentity, version, cause);
	}
}
