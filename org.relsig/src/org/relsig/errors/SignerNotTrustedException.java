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

import org.relsig.annotations.Nullable;
import org.relsig.internal.RelSigText;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.Version;

/**
 * Thrown when a signature is cryptographically valid but its signer does not
 * chain to a trusted root, and the configured policy rejects it.
 */
public class SignerNotTrustedException extends SignatureValidationException {
	private static final long serialVersionUID = 1L;

	private final transient SigningEntity signingEntity;

	/**
	 * Creates a new instance.
	 *
	 * @param signingEntity
	 *            the untrusted signer, may be {@code null}
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            being validated
	 * @param version
	 *            being validated
	 */
	public SignerNotTrustedException(SigningEntity signingEntity,
			Registry registry, PackageIdentity packageIdentity,
			Version version) {
		this(signingEntity, registry, packageIdentity, version, null);
	}

	/**
	 * Creates a new instance.
	 *
	 * @param signingEntity
	 *            the untrusted signer, may be {@code null}
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            being validated
	 * @param version
	 *            being validated
	 * @param cause
	 *            why the signer was refused, may be {@code null}
	 */
	public SignerNotTrustedException(SigningEntity signingEntity,
			Registry registry, PackageIdentity packageIdentity,
			Version version, Throwable cause) {
		super(MessageFormat.format(RelSigText.get().signerNotTrusted,
				signingEntity), registry, packageIdentity, version, cause);
		this.signingEntity = signingEntity;
	}

	/**
	 * Get the signer
	 *
	 * @return the untrusted signing entity
	 */
	@Nullable
	public SigningEntity getSigningEntity() {
		return signingEntity;
	}
}
