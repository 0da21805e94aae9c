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

import java.util.Objects;

import org.relsig.annotations.Nullable;
import org.relsig.errors.SignatureValidationException;
import org.relsig.lib.SigningEntity;

/**
 * Outcome of applying trust policy to a release: either accepted, with the
 * signing entity to record if any, or rejected with the reason.
 */
public final class TrustDecision {
	private final SigningEntity signingEntity;

	private final SignatureValidationException rejection;

	private TrustDecision(SigningEntity signingEntity,
			SignatureValidationException rejection) {
		this.signingEntity = signingEntity;
		this.rejection = rejection;
	}

	/**
	 * Accept the release.
	 *
	 * @param signingEntity
	 *            to record for the release, or {@code null} if none
	 * @return the decision
	 */
	public static TrustDecision accepted(
			@Nullable SigningEntity signingEntity) {
		return new TrustDecision(signingEntity, null);
	}

	/**
	 * Reject the release.
	 *
	 * @param reason
	 *            the failure to report
	 * @return the decision
	 */
	public static TrustDecision rejected(
			SignatureValidationException reason) {
		return new TrustDecision(null, Objects.requireNonNull(reason));
	}

	/**
	 * Whether the release was accepted
	 *
	 * @return {@code true} if the release was accepted
	 */
	public boolean isAccepted() {
		return rejection == null;
	}

	/**
	 * Get the signing entity
	 *
	 * @return the signing entity to record, {@code null} if there is none or
	 *         the release was rejected
	 */
	@Nullable
	public SigningEntity getSigningEntity() {
		return signingEntity;
	}

	/**
	 * Get the rejection
	 *
	 * @return the reason for rejection, {@code null} if accepted
	 */
	@Nullable
	public SignatureValidationException getRejection() {
		return rejection;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		if (isAccepted()) {
			return "TrustDecision[accepted, " + signingEntity + "]";
		}
		return "TrustDecision[rejected, " + rejection.getMessage() + "]";
	}
}
