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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;

import java.net.URI;
import java.util.Arrays;

import org.junit.Test;
import org.relsig.errors.InvalidSignatureEncodingException;
import org.relsig.errors.MissingSignatureFormatException;
import org.relsig.errors.MissingSourceArchiveException;
import org.relsig.errors.SourceArchiveNotSignedException;
import org.relsig.errors.UnknownSignatureFormatException;
import org.relsig.junit.TestMetadata;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.PackageVersionMetadata;
import org.relsig.lib.PackageVersionMetadata.Resource;
import org.relsig.lib.PackageVersionMetadata.Signing;
import org.relsig.lib.Registry;
import org.relsig.lib.SignatureFormat;
import org.relsig.lib.Version;

public class SignatureDecoderTest {

	private static final Registry REGISTRY = new Registry(
			URI.create("https://packages.example.com"));

	private static final PackageIdentity PACKAGE = PackageIdentity
			.parse("mona.LinkedList");

	private static final Version VERSION = Version.parse("1.1.1");

	private final SignatureDecoder decoder = new SignatureDecoder();

	private DecodedSignature decode(PackageVersionMetadata metadata)
			throws Exception {
		return decoder.decode(REGISTRY, PACKAGE, VERSION, metadata);
	}

	@Test
	public void testDecode() throws Exception {
		byte[] raw = "signature".getBytes(UTF_8);
		DecodedSignature s = decode(TestMetadata.signed(raw));
		assertArrayEquals(raw, s.getSignature());
		assertSame(SignatureFormat.CMS_1_0_0, s.getFormat());
	}

	@Test
	public void testMissingSourceArchive() {
		MissingSourceArchiveException e = assertThrows(
				MissingSourceArchiveException.class,
				() -> decode(TestMetadata.withoutSourceArchive()));
		assertEquals(REGISTRY, e.getRegistry());
		assertEquals(PACKAGE, e.getPackageIdentity());
		assertEquals(VERSION, e.getVersion());
	}

	@Test
	public void testSourceArchiveOfWrongType() {
		PackageVersionMetadata metadata = new PackageVersionMetadata(
				Arrays.asList(new Resource(
						PackageVersionMetadata.SOURCE_ARCHIVE_NAME,
						"application/x-tar", null,
						new Signing("c2ln", "cms-1.0.0"))));
		assertThrows(MissingSourceArchiveException.class,
				() -> decode(metadata));
	}

	@Test
	public void testNotSigned() {
		SourceArchiveNotSignedException e = assertThrows(
				SourceArchiveNotSignedException.class,
				() -> decode(TestMetadata.unsigned()));
		assertEquals(
				"mona.LinkedList version 1.1.1 from https://packages.example.com is not signed",
				e.getMessage());
		assertThrows(SourceArchiveNotSignedException.class,
				() -> decode(TestMetadata.signed(null, "cms-1.0.0")));
	}

	@Test
	public void testInvalidEncoding() {
		InvalidSignatureEncodingException e = assertThrows(
				InvalidSignatureEncodingException.class,
				() -> decode(TestMetadata.signed("not*base64!", "cms-1.0.0")));
		assertEquals(IllegalArgumentException.class,
				e.getCause().getClass());
	}

	@Test
	public void testWhitespaceIsNotValidEncoding() {
		assertThrows(InvalidSignatureEncodingException.class,
				() -> decode(TestMetadata.signed(" c2ln", "cms-1.0.0")));
		assertThrows(InvalidSignatureEncodingException.class,
				() -> decode(TestMetadata.signed("c2ln\n", "cms-1.0.0")));
		assertThrows(InvalidSignatureEncodingException.class,
				() -> decode(TestMetadata.signed("c2\nln", "cms-1.0.0")));
	}

	@Test
	public void testMissingFormat() {
		assertThrows(MissingSignatureFormatException.class,
				() -> decode(TestMetadata.signed("c2ln", null)));
	}

	@Test
	public void testUnknownFormat() {
		UnknownSignatureFormatException e = assertThrows(
				UnknownSignatureFormatException.class,
				() -> decode(TestMetadata.signed("c2ln", "xyz")));
		assertEquals("xyz", e.getFormat());
		assertEquals("unknown signature format: xyz", e.getMessage());
	}

	@Test
	public void testEncodingCheckedBeforeFormat() {
		assertThrows(InvalidSignatureEncodingException.class,
				() -> decode(TestMetadata.signed("%%%", null)));
	}

	@Test
	public void testFormatToken() {
		assertSame(SignatureFormat.CMS_1_0_0,
				SignatureFormat.fromToken("cms-1.0.0"));
		assertNull(SignatureFormat.fromToken("CMS-1.0.0"));
		assertNull(SignatureFormat.fromToken(null));
	}
}
