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
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertSame;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import java.io.File;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.List;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.mockito.Mock;
import org.mockito.junit.MockitoJUnit;
import org.mockito.junit.MockitoRule;
import org.relsig.errors.BadConfigurationException;
import org.relsig.lib.CertificateExpiration;
import org.relsig.lib.CertificateRevocation;
import org.relsig.lib.SigningConfig;
import org.relsig.lib.VerifierConfiguration;
import org.relsig.util.FileSystemReader;

public class VerifierConfigurationBuilderTest {

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Rule
	public MockitoRule mockito = MockitoJUnit.rule();

	@Mock
	private FileSystemReader fs;

	private final VerifierConfigurationBuilder builder = new VerifierConfigurationBuilder(
			FileSystemReader.DETECTED);

	private static SigningConfig withRoots(String path) {
		return SigningConfig.builder().setTrustedRootCertificatesPath(path)
				.build();
	}

	@Test
	public void testDefaults() throws Exception {
		VerifierConfiguration c = builder
				.build(SigningConfig.builder().build());
		assertTrue(c.getTrustedRoots().isEmpty());
		assertTrue(c.isIncludeDefaultTrustStore());
		assertSame(CertificateExpiration.ENABLED,
				c.getCertificateExpiration());
		assertNull(c.getValidationTime());
		assertSame(CertificateRevocation.STRICT,
				c.getCertificateRevocation());
	}

	@Test
	public void testCopiesSetValues() throws Exception {
		VerifierConfiguration c = builder.build(SigningConfig.builder()
				.setIncludeDefaultTrustedRootCertificates(Boolean.FALSE)
				.setCertificateExpiration(CertificateExpiration.DISABLED)
				.setCertificateRevocation(
						CertificateRevocation.ALLOW_SOFT_FAIL)
				.build());
		assertFalse(c.isIncludeDefaultTrustStore());
		assertSame(CertificateExpiration.DISABLED,
				c.getCertificateExpiration());
		assertSame(CertificateRevocation.ALLOW_SOFT_FAIL,
				c.getCertificateRevocation());
	}

	@Test
	public void testReadsRootsInOrder() throws Exception {
		File dir = tmp.newFolder("roots");
		write(dir, "c.cer", "third");
		write(dir, "a.cer", "first");
		write(dir, "b.cer", "second");

		VerifierConfiguration c = builder
				.build(withRoots(dir.getAbsolutePath()));
		List<byte[]> roots = c.getTrustedRoots();
		assertEquals(3, roots.size());
		assertArrayEquals("first".getBytes(UTF_8), roots.get(0));
		assertArrayEquals("second".getBytes(UTF_8), roots.get(1));
		assertArrayEquals("third".getBytes(UTF_8), roots.get(2));
	}

	@Test
	public void testEmptyRootsDirectory() throws Exception {
		File dir = tmp.newFolder("roots");
		assertTrue(builder.build(withRoots(dir.getAbsolutePath()))
				.getTrustedRoots().isEmpty());
	}

	@Test
	public void testUnreadableEntryFailsBuild() throws Exception {
		File dir = tmp.newFolder("roots");
		write(dir, "a.cer", "first");
		assertTrue(new File(dir, "b.d").mkdir());

		BadConfigurationException e = assertThrows(
				BadConfigurationException.class,
				() -> builder.build(withRoots(dir.getAbsolutePath())));
		assertTrue(e.getMessage(),
				e.getMessage().startsWith("failed to load trust roots"));
		assertTrue(e.getCause() instanceof IOException);
	}

	@Test
	public void testListingFailureFailsBuild() throws Exception {
		Path dir = Paths.get(tmp.getRoot().getAbsolutePath(), "roots");
		when(fs.isDirectory(dir)).thenReturn(Boolean.TRUE);
		when(fs.list(dir)).thenThrow(new IOException("denied"));

		BadConfigurationException e = assertThrows(
				BadConfigurationException.class,
				() -> new VerifierConfigurationBuilder(fs)
						.build(withRoots(dir.toString())));
		assertEquals("failed to load trust roots: denied", e.getMessage());
		verify(fs, never()).readFully(any());
	}

	@Test
	public void testReadFailureAfterListing() throws Exception {
		Path dir = Paths.get(tmp.getRoot().getAbsolutePath(), "roots");
		when(fs.isDirectory(dir)).thenReturn(Boolean.TRUE);
		when(fs.list(dir)).thenReturn(Arrays.asList("a", "b"));
		when(fs.readFully(dir.resolve("a"))).thenReturn(new byte[] { 1 });
		when(fs.readFully(dir.resolve("b")))
				.thenThrow(new IOException("gone"));

		assertThrows(BadConfigurationException.class,
				() -> new VerifierConfigurationBuilder(fs)
						.build(withRoots(dir.toString())));
	}

	@Test
	public void testNotADirectory() throws Exception {
		File file = tmp.newFile("root.cer");
		BadConfigurationException e = assertThrows(
				BadConfigurationException.class,
				() -> builder.build(withRoots(file.getAbsolutePath())));
		assertEquals(file.getAbsolutePath() + " is not a directory",
				e.getMessage());
	}

	@Test
	public void testMissingDirectory() {
		String missing = new File(tmp.getRoot(), "missing").getAbsolutePath();
		BadConfigurationException e = assertThrows(
				BadConfigurationException.class,
				() -> builder.build(withRoots(missing)));
		assertEquals(missing + " is not a directory", e.getMessage());
	}

	@Test
	public void testRelativePathIsInvalid() {
		BadConfigurationException e = assertThrows(
				BadConfigurationException.class,
				() -> builder.build(withRoots("relative/roots")));
		assertEquals("relative/roots is invalid: not an absolute path",
				e.getMessage());
		e = assertThrows(BadConfigurationException.class,
				() -> builder.build(withRoots("")));
		assertTrue(e.getMessage().endsWith("is invalid: not an absolute path"));
	}

	@Test
	public void testInvalidPath() {
		BadConfigurationException e = assertThrows(
				BadConfigurationException.class,
				() -> builder.build(withRoots("/roots\u0000")));
		assertTrue(e.getMessage(), e.getMessage().contains(" is invalid: "));
	}

	@Test
	public void testNoCachingAcrossCalls() throws Exception {
		File dir = tmp.newFolder("roots");
		write(dir, "a.cer", "first");
		SigningConfig config = withRoots(dir.getAbsolutePath());
		assertEquals(1, builder.build(config).getTrustedRoots().size());
		write(dir, "b.cer", "second");
		assertEquals(2, builder.build(config).getTrustedRoots().size());
	}

	private static void write(File dir, String name, String content)
			throws IOException {
		Files.write(new File(dir, name).toPath(), content.getBytes(UTF_8));
	}
}
