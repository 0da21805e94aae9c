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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;

import java.net.URI;

import org.junit.Test;
import org.relsig.errors.ConfigInvalidException;

public class SecurityConfigTest {

	private static final Registry REGISTRY = new Registry(
			URI.create("https://packages.example.com/api"));

	private static final Registry OTHER_REGISTRY = new Registry(
			URI.create("https://other.example.org"));

	private static SecurityConfig parse(String content)
			throws ConfigInvalidException {
		Config c = new Config();
		c.fromText(content);
		return new SecurityConfig(c);
	}

	@Test
	public void testEmptyConfigHasNothingSet() throws Exception {
		SigningConfig s = parse("").getSigning(REGISTRY,
				PackageIdentity.parse("mona.LinkedList"));
		assertNull(s.getOnUnsigned());
		assertNull(s.getOnUntrustedCertificate());
		assertNull(s.getTrustedRootCertificatesPath());
		assertNull(s.getIncludeDefaultTrustedRootCertificates());
		assertNull(s.getCertificateExpiration());
		assertNull(s.getCertificateRevocation());
	}

	@Test
	public void testDefaults() throws Exception {
		SigningConfig s = parse("" //
				+ "[signing]\n" //
				+ "\tonUnsigned = prompt\n" //
				+ "\tonUntrustedCertificate = warn\n" //
				+ "\ttrustedRootCertificatesPath = /etc/relsig/roots\n" //
				+ "\tincludeDefaultTrustedRootCertificates = false\n" //
				+ "\tcertificateExpiration = disabled\n" //
				+ "\tcertificateRevocation = allowSoftFail\n" //
		).getDefaultSigning();
		assertEquals(TrustAction.PROMPT, s.getOnUnsigned());
		assertEquals(TrustAction.WARN, s.getOnUntrustedCertificate());
		assertEquals("/etc/relsig/roots", s.getTrustedRootCertificatesPath());
		assertEquals(Boolean.FALSE,
				s.getIncludeDefaultTrustedRootCertificates());
		assertEquals(CertificateExpiration.DISABLED,
				s.getCertificateExpiration());
		assertEquals(CertificateRevocation.ALLOW_SOFT_FAIL,
				s.getCertificateRevocation());
	}

	@Test
	public void testOverridesFieldByField() throws Exception {
		SecurityConfig config = parse("" //
				+ "[signing]\n" //
				+ "\tonUnsigned = prompt\n" //
				+ "\tonUntrustedCertificate = warn\n" //
				+ "\tcertificateRevocation = strict\n" //
				+ "[registry \"packages.example.com\"]\n" //
				+ "\tonUnsigned = error\n" //
				+ "\tcertificateRevocation = disabled\n" //
				+ "[scope \"mona\"]\n" //
				+ "\tonUntrustedCertificate = error\n" //
				+ "[package \"mona.LinkedList\"]\n" //
				+ "\tonUnsigned = silentAllow\n" //
		);

		SigningConfig s = config.getSigning(REGISTRY,
				PackageIdentity.parse("mona.LinkedList"));
		assertEquals(TrustAction.SILENT_ALLOW, s.getOnUnsigned());
		assertEquals(TrustAction.ERROR, s.getOnUntrustedCertificate());
		assertEquals(CertificateRevocation.DISABLED,
				s.getCertificateRevocation());

		s = config.getSigning(REGISTRY, PackageIdentity.parse("mona.Other"));
		assertEquals(TrustAction.ERROR, s.getOnUnsigned());
		assertEquals(TrustAction.ERROR, s.getOnUntrustedCertificate());

		s = config.getSigning(REGISTRY, PackageIdentity.parse("lisa.Other"));
		assertEquals(TrustAction.ERROR, s.getOnUnsigned());
		assertEquals(TrustAction.WARN, s.getOnUntrustedCertificate());

		s = config.getSigning(OTHER_REGISTRY,
				PackageIdentity.parse("lisa.Other"));
		assertEquals(TrustAction.PROMPT, s.getOnUnsigned());
		assertEquals(TrustAction.WARN, s.getOnUntrustedCertificate());
		assertEquals(CertificateRevocation.STRICT,
				s.getCertificateRevocation());

		s = config.getSigning(REGISTRY, null);
		assertEquals(TrustAction.ERROR, s.getOnUnsigned());
		assertEquals(TrustAction.WARN, s.getOnUntrustedCertificate());
	}

	@Test
	public void testPackageAndScopeMatchIgnoringCase() throws Exception {
		SecurityConfig config = parse("" //
				+ "[scope \"Mona\"]\n" //
				+ "\tonUntrustedCertificate = error\n" //
				+ "[package \"mona.linkedlist\"]\n" //
				+ "\tonUnsigned = warn\n" //
		);
		SigningConfig s = config.getSigning(REGISTRY,
				PackageIdentity.parse("MONA.LinkedList"));
		assertEquals(TrustAction.WARN, s.getOnUnsigned());
		assertEquals(TrustAction.ERROR, s.getOnUntrustedCertificate());
	}

	@Test
	public void testRegistryMatchesHostIgnoringCase() throws Exception {
		SecurityConfig config = parse("" //
				+ "[registry \"Packages.Example.com\"]\n" //
				+ "\tonUnsigned = warn\n" //
		);
		assertEquals(TrustAction.WARN,
				config.getSigning(REGISTRY, null).getOnUnsigned());
	}

	@Test
	public void testBooleanWithoutValueIsTrue() throws Exception {
		SigningConfig s = parse("" //
				+ "[signing]\n" //
				+ "\tincludeDefaultTrustedRootCertificates\n" //
		).getDefaultSigning();
		assertEquals(Boolean.TRUE, s.getIncludeDefaultTrustedRootCertificates());
	}

	@Test
	public void testInvalidValues() throws Exception {
		assertThrows(IllegalArgumentException.class, () -> parse("" //
				+ "[signing]\n" //
				+ "\tonUnsigned = maybe\n" //
		).getDefaultSigning());
		assertThrows(IllegalArgumentException.class, () -> parse("" //
				+ "[signing]\n" //
				+ "\tonUnsigned\n" //
		).getDefaultSigning());
		assertThrows(IllegalArgumentException.class, () -> parse("" //
				+ "[signing]\n" //
				+ "\tincludeDefaultTrustedRootCertificates = sometimes\n" //
		).getDefaultSigning());
	}
}
