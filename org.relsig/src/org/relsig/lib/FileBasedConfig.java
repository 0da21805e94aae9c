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

import java.io.IOException;
import java.nio.file.Path;
import java.text.MessageFormat;

import org.relsig.errors.ConfigInvalidException;
import org.relsig.internal.RelSigText;
import org.relsig.util.FileSystemReader;

/**
 * The configuration file that is stored in the file system.
 */
public class FileBasedConfig extends Config {

	private final Path configFile;

	private final FileSystemReader fs;

	/**
	 * Create a configuration with no default fallback.
	 *
	 * @param cfgLocation
	 *            the location of the configuration file on the file system
	 * @param fs
	 *            the file system abstraction to read the file with
	 */
	public FileBasedConfig(Path cfgLocation, FileSystemReader fs) {
		this.configFile = cfgLocation;
		this.fs = fs;
	}

	/**
	 * Get location of the configuration file on disk
	 *
	 * @return location of the configuration file on disk
	 */
	public final Path getFile() {
		return configFile;
	}

	/**
	 * Load the configuration as a Git text style configuration file.
	 * <p>
	 * If the file does not exist, this configuration is cleared, and thus
	 * behaves the same as though the file exists, but is empty.
	 *
	 * @throws IOException
	 *             the file could not be read (but does exist).
	 * @throws ConfigInvalidException
	 *             the file is not a properly formatted configuration file.
	 */
	public void load() throws IOException, ConfigInvalidException {
		if (!fs.isFile(configFile)) {
			clear();
			return;
		}
		byte[] in = fs.readFully(configFile);
		int start = 0;
		if (in.length >= 3 && in[0] == (byte) 0xEF && in[1] == (byte) 0xBB
				&& in[2] == (byte) 0xBF) {
			// Skip the UTF-8 byte order mark
			start = 3;
		}
		try {
			fromText(new String(in, start, in.length - start, UTF_8));
		} catch (ConfigInvalidException e) {
			throw new ConfigInvalidException(MessageFormat
					.format(RelSigText.get().cannotReadFile, configFile), e);
		}
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + getFile() + "]";
	}
}
