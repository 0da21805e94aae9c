/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.lib;

import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.relsig.annotations.NonNull;
import org.relsig.annotations.Nullable;

/**
 * What a {@link org.relsig.signing.SignatureProvider} should accept as a
 * trustworthy signing certificate.
 * <p>
 * Defaults: no extra trusted roots, default trust store included, expiration
 * checked at the current time, strict revocation checking. Instances are
 * immutable and built per validation.
 */
public final class VerifierConfiguration {

	private final List<byte[]> trustedRoots;

	private final boolean includeDefaultTrustStore;

	private final CertificateExpiration certificateExpiration;

	private final Instant validationTime;

	private final CertificateRevocation certificateRevocation;

	private VerifierConfiguration(Builder builder) {
		List<byte[]> roots = new ArrayList<>(builder.trustedRoots.size());
		for (byte[] root : builder.trustedRoots) {
			roots.add(root.clone());
		}
		trustedRoots = Collections.unmodifiableList(roots);
		includeDefaultTrustStore = builder.includeDefaultTrustStore;
		certificateExpiration = builder.certificateExpiration;
		validationTime = builder.validationTime;
		certificateRevocation = builder.certificateRevocation;
	}

	/**
	 * Creates a {@link Builder} initialized with the defaults.
	 *
	 * @return a new builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Retrieves the additional trusted root certificates, DER or PEM encoded,
	 * in the order they were added.
	 *
	 * @return an unmodifiable list; the arrays are copies owned by this
	 *         instance and must not be modified
	 */
	@NonNull
	public List<byte[]> getTrustedRoots() {
		return trustedRoots;
	}

	/**
	 * Tells whether the platform's default trust store is used in addition to
	 * {@link #getTrustedRoots()}.
	 *
	 * @return whether to include the default trust store
	 */
	public boolean isIncludeDefaultTrustStore() {
		return includeDefaultTrustStore;
	}

	/**
	 * Get the certificate expiration check.
	 *
	 * @return the expiration check
	 */
	@NonNull
	public CertificateExpiration getCertificateExpiration() {
		return certificateExpiration;
	}

	/**
	 * Get the point in time certificates must be valid at when the expiration
	 * check is enabled.
	 *
	 * @return the validation time, or {@code null} for "now"
	 */
	@Nullable
	public Instant getValidationTime() {
		return validationTime;
	}

	/**
	 * Get the certificate revocation check.
	 *
	 * @return the revocation check
	 */
	@NonNull
	public CertificateRevocation getCertificateRevocation() {
		return certificateRevocation;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return "VerifierConfiguration[trustedRoots=" + trustedRoots.size()
				+ ", includeDefaultTrustStore=" + includeDefaultTrustStore
				+ ", certificateExpiration=" + certificateExpiration
				+ (validationTime != null ? "@" + validationTime : "")
				+ ", certificateRevocation=" + certificateRevocation + ']';
	}

	/**
	 * Builds {@link VerifierConfiguration}s.
	 */
	public static final class Builder {

		private final List<byte[]> trustedRoots = new ArrayList<>();

		private boolean includeDefaultTrustStore = true;

		private CertificateExpiration certificateExpiration = CertificateExpiration.ENABLED;

		private Instant validationTime;

		private CertificateRevocation certificateRevocation = CertificateRevocation.STRICT;

		private Builder() {
			// Use VerifierConfiguration.builder()
		}

		/**
		 * Appends a trusted root certificate.
		 *
		 * @param certificate
		 *            the encoded certificate
		 * @return {@code this}
		 */
		public Builder addTrustedRoot(@NonNull byte[] certificate) {
			trustedRoots.add(certificate);
			return this;
		}

		/**
		 * Replaces the trusted root certificates.
		 *
		 * @param certificates
		 *            the encoded certificates, in order
		 * @return {@code this}
		 */
		public Builder setTrustedRoots(@NonNull List<byte[]> certificates) {
			trustedRoots.clear();
			trustedRoots.addAll(certificates);
			return this;
		}

		/**
		 * @param include
		 *            whether to use the default trust store
		 * @return {@code this}
		 */
		public Builder setIncludeDefaultTrustStore(boolean include) {
			includeDefaultTrustStore = include;
			return this;
		}

		/**
		 * Enables the expiration check.
		 *
		 * @param time
		 *            the certificates must be valid at, or {@code null} for
		 *            the time of verification
		 * @return {@code this}
		 */
		public Builder enableCertificateExpiration(@Nullable Instant time) {
			certificateExpiration = CertificateExpiration.ENABLED;
			validationTime = time;
			return this;
		}

		/**
		 * Disables the expiration check.
		 *
		 * @return {@code this}
		 */
		public Builder disableCertificateExpiration() {
			certificateExpiration = CertificateExpiration.DISABLED;
			validationTime = null;
			return this;
		}

		/**
		 * @param revocation
		 *            the revocation check to perform
		 * @return {@code this}
		 */
		public Builder setCertificateRevocation(
				@NonNull CertificateRevocation revocation) {
			certificateRevocation = revocation;
			return this;
		}

		/**
		 * Creates the {@link VerifierConfiguration}.
		 *
		 * @return a new immutable instance
		 */
		public VerifierConfiguration build() {
			return new VerifierConfiguration(this);
		}
	}
}
