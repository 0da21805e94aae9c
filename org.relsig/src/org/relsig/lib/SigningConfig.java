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

import org.relsig.annotations.Nullable;

/**
 * Signing related security settings of a registry.
 * <p>
 * Every setting is optional; {@code null} means "not configured". Whether an
 * unset value is an error or falls back to a default is up to the consumer:
 * missing trust actions make validation fail, while missing certificate
 * checks leave the verifier's defaults in place. Instances are immutable.
 */
public class SigningConfig {

	private final TrustAction onUnsigned;

	private final TrustAction onUntrustedCertificate;

	private final String trustedRootCertificatesPath;

	private final Boolean includeDefaultTrustedRootCertificates;

	private final CertificateExpiration certificateExpiration;

	private final CertificateRevocation certificateRevocation;

	private SigningConfig(Builder builder) {
		onUnsigned = builder.onUnsigned;
		onUntrustedCertificate = builder.onUntrustedCertificate;
		trustedRootCertificatesPath = builder.trustedRootCertificatesPath;
		includeDefaultTrustedRootCertificates = builder.includeDefaultTrustedRootCertificates;
		certificateExpiration = builder.certificateExpiration;
		certificateRevocation = builder.certificateRevocation;
	}

	/**
	 * Creates a new, empty {@link Builder}.
	 *
	 * @return the builder
	 */
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Get the action for unsigned packages
	 *
	 * @return the value of {@code onUnsigned}, or {@code null}
	 */
	@Nullable
	public TrustAction getOnUnsigned() {
		return onUnsigned;
	}

	/**
	 * Get the action for packages signed with an untrusted certificate
	 *
	 * @return the value of {@code onUntrustedCertificate}, or {@code null}
	 */
	@Nullable
	public TrustAction getOnUntrustedCertificate() {
		return onUntrustedCertificate;
	}

	/**
	 * Get the directory holding additional trusted root certificates
	 *
	 * @return the value of {@code trustedRootCertificatesPath}, or
	 *         {@code null}
	 */
	@Nullable
	public String getTrustedRootCertificatesPath() {
		return trustedRootCertificatesPath;
	}

	/**
	 * Tells whether the default trust store shall be used in addition to the
	 * configured trusted roots.
	 *
	 * @return the value of {@code includeDefaultTrustedRootCertificates}, or
	 *         {@code null}
	 */
	@Nullable
	public Boolean getIncludeDefaultTrustedRootCertificates() {
		return includeDefaultTrustedRootCertificates;
	}

	/**
	 * Get the certificate expiration check setting
	 *
	 * @return the value of {@code certificateExpiration}, or {@code null}
	 */
	@Nullable
	public CertificateExpiration getCertificateExpiration() {
		return certificateExpiration;
	}

	/**
	 * Get the certificate revocation check setting
	 *
	 * @return the value of {@code certificateRevocation}, or {@code null}
	 */
	@Nullable
	public CertificateRevocation getCertificateRevocation() {
		return certificateRevocation;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return "SigningConfig[onUnsigned=" + onUnsigned
				+ ", onUntrustedCertificate=" + onUntrustedCertificate
				+ ", trustedRootCertificatesPath="
				+ trustedRootCertificatesPath
				+ ", includeDefaultTrustedRootCertificates="
				+ includeDefaultTrustedRootCertificates
				+ ", certificateExpiration=" + certificateExpiration
				+ ", certificateRevocation=" + certificateRevocation + ']';
	}

	/**
	 * Builds {@link SigningConfig}s.
	 */
	public static class Builder {

		private TrustAction onUnsigned;

		private TrustAction onUntrustedCertificate;

		private String trustedRootCertificatesPath;

		private Boolean includeDefaultTrustedRootCertificates;

		private CertificateExpiration certificateExpiration;

		private CertificateRevocation certificateRevocation;

		Builder() {
			// Use SigningConfig.builder()
		}

		/**
		 * @param action
		 *            for unsigned packages, may be {@code null}
		 * @return {@code this}
		 */
		public Builder setOnUnsigned(TrustAction action) {
			onUnsigned = action;
			return this;
		}

		/**
		 * @param action
		 *            for untrusted signing certificates, may be {@code null}
		 * @return {@code this}
		 */
		public Builder setOnUntrustedCertificate(TrustAction action) {
			onUntrustedCertificate = action;
			return this;
		}

		/**
		 * @param path
		 *            absolute path of a directory of trusted root
		 *            certificates, may be {@code null}
		 * @return {@code this}
		 */
		public Builder setTrustedRootCertificatesPath(String path) {
			trustedRootCertificatesPath = path;
			return this;
		}

		/**
		 * @param include
		 *            whether to use the default trust store, may be
		 *            {@code null}
		 * @return {@code this}
		 */
		public Builder setIncludeDefaultTrustedRootCertificates(
				Boolean include) {
			includeDefaultTrustedRootCertificates = include;
			return this;
		}

		/**
		 * @param expiration
		 *            check setting, may be {@code null}
		 * @return {@code this}
		 */
		public Builder setCertificateExpiration(
				CertificateExpiration expiration) {
			certificateExpiration = expiration;
			return this;
		}

		/**
		 * @param revocation
		 *            check setting, may be {@code null}
		 * @return {@code this}
		 */
		public Builder setCertificateRevocation(
				CertificateRevocation revocation) {
			certificateRevocation = revocation;
			return this;
		}

		/**
		 * Creates the {@link SigningConfig}.
		 *
		 * @return a new immutable {@link SigningConfig}
		 */
		public SigningConfig build() {
			return new SigningConfig(this);
		}
	}
}
