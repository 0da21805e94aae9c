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

/**
 * Constants for use with the configuration classes: section names and
 * configuration keys.
 */
@SuppressWarnings("nls")
public final class ConfigConstants {

	/** The "signing" section, holding the defaults for all registries */
	public static final String CONFIG_SIGNING_SECTION = "signing";

	/** The "registry" section; the subsection is the registry host */
	public static final String CONFIG_REGISTRY_SECTION = "registry";

	/** The "scope" section; the subsection is a package scope */
	public static final String CONFIG_SCOPE_SECTION = "scope";

	/** The "package" section; the subsection is a package identity */
	public static final String CONFIG_PACKAGE_SECTION = "package";

	/** The "onUnsigned" key */
	public static final String CONFIG_KEY_ON_UNSIGNED = "onUnsigned";

	/** The "onUntrustedCertificate" key */
	public static final String CONFIG_KEY_ON_UNTRUSTED_CERTIFICATE = "onUntrustedCertificate";

	/** The "trustedRootCertificatesPath" key */
	public static final String CONFIG_KEY_TRUSTED_ROOT_CERTIFICATES_PATH = "trustedRootCertificatesPath";

	/** The "includeDefaultTrustedRootCertificates" key */
	public static final String CONFIG_KEY_INCLUDE_DEFAULT_TRUSTED_ROOT_CERTIFICATES = "includeDefaultTrustedRootCertificates";

	/** The "certificateExpiration" key */
	public static final String CONFIG_KEY_CERTIFICATE_EXPIRATION = "certificateExpiration";

	/** The "certificateRevocation" key */
	public static final String CONFIG_KEY_CERTIFICATE_REVOCATION = "certificateRevocation";

	/**
	 * Prefix used when naming a missing or bad signing option in error
	 * messages.
	 */
	public static final String SECURITY_SIGNING_PREFIX = "security.signing.";

	private ConfigConstants() {
		// Constants only
	}
}
