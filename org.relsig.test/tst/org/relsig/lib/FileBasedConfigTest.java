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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.nio.file.Files;
import java.nio.file.Path;

import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.relsig.errors.ConfigInvalidException;
import org.relsig.util.FileSystemReader;

public class FileBasedConfigTest {

	private static final String CONTENT = "[signing]\n\tonUnsigned = warn\n";

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	@Test
	public void testLoad() throws Exception {
		Path file = tmp.newFile("config").toPath();
		Files.write(file, CONTENT.getBytes(UTF_8));

		FileBasedConfig config = new FileBasedConfig(file,
				FileSystemReader.DETECTED);
		config.load();
		assertEquals(file, config.getFile());
		assertEquals("warn", config.getString("signing", null, "onUnsigned"));
	}

	@Test
	public void testLoadWithByteOrderMark() throws Exception {
		Path file = tmp.newFile("config").toPath();
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		out.write(0xEF);
		out.write(0xBB);
		out.write(0xBF);
		out.write(CONTENT.getBytes(UTF_8));
		Files.write(file, out.toByteArray());

		FileBasedConfig config = new FileBasedConfig(file,
				FileSystemReader.DETECTED);
		config.load();
		assertEquals("warn", config.getString("signing", null, "onUnsigned"));
	}

	@Test
	public void testMissingFileIsEmpty() throws Exception {
		Path file = new File(tmp.getRoot(), "missing").toPath();
		FileBasedConfig config = new FileBasedConfig(file,
				FileSystemReader.DETECTED);
		config.load();
		assertTrue(config.isEmpty());
	}

	@Test
	public void testReloadAfterDelete() throws Exception {
		Path file = tmp.newFile("config").toPath();
		Files.write(file, CONTENT.getBytes(UTF_8));
		FileBasedConfig config = new FileBasedConfig(file,
				FileSystemReader.DETECTED);
		config.load();
		Files.delete(file);
		config.load();
		assertTrue(config.isEmpty());
	}

	@Test
	public void testInvalidFile() throws Exception {
		Path file = tmp.newFile("config").toPath();
		Files.write(file, "[signing\n".getBytes(UTF_8));
		FileBasedConfig config = new FileBasedConfig(file,
				FileSystemReader.DETECTED);
		ConfigInvalidException e = assertThrows(ConfigInvalidException.class,
				config::load);
		assertEquals("Cannot read file " + file, e.getMessage());
	}
}
