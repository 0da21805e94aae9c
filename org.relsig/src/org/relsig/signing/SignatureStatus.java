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

import org.relsig.annotations.NonNull;
import org.relsig.lib.SigningEntity;

/**
 * Classified outcome of verifying a signature.
 * <p>
 * There are exactly four kinds of outcome; use a {@link Visitor} to handle
 * them.
 */
public abstract class SignatureStatus {

	/**
	 * Handles each kind of {@link SignatureStatus}.
	 *
	 * @param <R>
	 *            result type
	 */
	public interface Visitor<R> {
		/**
		 * The signature is valid and its signer chains to a trusted root.
		 *
		 * @param status
		 *            the outcome
		 * @return result
		 */
		R valid(Valid status);

		/**
		 * The signature is malformed or does not match the content.
		 *
		 * @param status
		 *            the outcome
		 * @return result
		 */
		R invalid(Invalid status);

		/**
		 * The signing certificate is invalid, e.g. expired or revoked.
		 *
		 * @param status
		 *            the outcome
		 * @return result
		 */
		R certificateInvalid(CertificateInvalid status);

		/**
		 * The signature is valid but the signer is not trusted.
		 *
		 * @param status
		 *            the outcome
		 * @return result
		 */
		R certificateNotTrusted(CertificateNotTrusted status);
	}

	private SignatureStatus() {
		// Only the nested kinds
	}

	/**
	 * Apply a visitor to this outcome.
	 *
	 * @param <R>
	 *            result type
	 * @param visitor
	 *            to apply
	 * @return the visitor's result
	 */
	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * Creates a {@link Valid} outcome.
	 *
	 * @param entity
	 *            the signer
	 * @return the outcome
	 */
	public static SignatureStatus valid(@NonNull SigningEntity entity) {
		return new Valid(entity);
	}

	/**
	 * Creates an {@link Invalid} outcome.
	 *
	 * @param reason
	 *            why the signature is invalid
	 * @return the outcome
	 */
	public static SignatureStatus invalid(@NonNull String reason) {
		return new Invalid(reason);
	}

	/**
	 * Creates a {@link CertificateInvalid} outcome.
	 *
	 * @param reason
	 *            why the certificate is invalid
	 * @return the outcome
	 */
	public static SignatureStatus certificateInvalid(@NonNull String reason) {
		return new CertificateInvalid(reason);
	}

	/**
	 * Creates a {@link CertificateNotTrusted} outcome.
	 *
	 * @param entity
	 *            the untrusted signer
	 * @return the outcome
	 */
	public static SignatureStatus certificateNotTrusted(
			@NonNull SigningEntity entity) {
		return new CertificateNotTrusted(entity);
	}

	/** Valid signature by a trusted signer. */
	public static final class Valid extends SignatureStatus {
		private final SigningEntity entity;

		Valid(SigningEntity entity) {
			this.entity = Objects.requireNonNull(entity);
		}

		/**
		 * Get the signer
		 *
		 * @return the signer
		 */
		public SigningEntity getSigningEntity() {
			return entity;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.valid(this);
		}

		@SuppressWarnings("nls")
		@Override
		public String toString() {
			return "Valid[" + entity + "]";
		}
	}

	/** Signature that is malformed or does not match. */
	public static final class Invalid extends SignatureStatus {
		private final String reason;

		Invalid(String reason) {
			this.reason = Objects.requireNonNull(reason);
		}

		/**
		 * Get the reason
		 *
		 * @return why the signature is invalid
		 */
		public String getReason() {
			return reason;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.invalid(this);
		}

		@SuppressWarnings("nls")
		@Override
		public String toString() {
			return "Invalid[" + reason + "]";
		}
	}

	/** Signature made with an invalid certificate. */
	public static final class CertificateInvalid extends SignatureStatus {
		private final String reason;

		CertificateInvalid(String reason) {
			this.reason = Objects.requireNonNull(reason);
		}

		/**
		 * Get the reason
		 *
		 * @return why the certificate is invalid
		 */
		public String getReason() {
			return reason;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.certificateInvalid(this);
		}

		@SuppressWarnings("nls")
		@Override
		public String toString() {
			return "CertificateInvalid[" + reason + "]";
		}
	}

	/** Valid signature whose signer does not chain to a trusted root. */
	public static final class CertificateNotTrusted extends SignatureStatus {
		private final SigningEntity entity;

		CertificateNotTrusted(SigningEntity entity) {
			this.entity = Objects.requireNonNull(entity);
		}

		/**
		 * Get the signer
		 *
		 * @return the untrusted signer
		 */
		public SigningEntity getSigningEntity() {
			return entity;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.certificateNotTrusted(this);
		}

		@SuppressWarnings("nls")
		@Override
		public String toString() {
			return "CertificateNotTrusted[" + entity + "]";
		}
	}
}
