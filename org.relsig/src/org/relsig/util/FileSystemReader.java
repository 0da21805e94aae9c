/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.util;

import java.io.IOException;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Read-only access to the file system.
 * <p>
 * Everything that reads configuration or trust roots from disk goes through
 * this interface so that callers and tests can substitute their own view of
 * the file system.
 */
public interface FileSystemReader {

	/**
	 * The default implementation, backed by {@link java.nio.file.Files}.
	 */
	FileSystemReader DETECTED = new Nio();

	/**
	 * Tells whether the given path denotes an existing directory.
	 *
	 * @param path
	 *            to check
	 * @return {@code true} if {@code path} is a directory
	 */
	boolean isDirectory(Path path);

	/**
	 * Tells whether the given path denotes an existing regular file.
	 *
	 * @param path
	 *            to check
	 * @return {@code true} if {@code path} is a regular file
	 */
	boolean isFile(Path path);

	/**
	 * Lists the names of the entries of a directory.
	 *
	 * @param directory
	 *            to list
	 * @return the entry names, in the order defined by the implementation
	 * @throws IOException
	 *             if the directory cannot be listed
	 */
	List<String> list(Path directory) throws IOException;

	/**
	 * Reads a file completely.
	 *
	 * @param file
	 *            to read
	 * @return the file's contents
	 * @throws IOException
	 *             if the file cannot be read
	 */
	byte[] readFully(Path file) throws IOException;

	/**
	 * {@link FileSystemReader} on top of {@code java.nio.file}. Directory
	 * entries are listed sorted by name.
	 */
	class Nio implements FileSystemReader {

		/**
		 * Use {@link FileSystemReader#DETECTED} unless a separate instance
		 * is needed.
		 */
		protected Nio() {
			// Nothing
		}

		@Override
		public boolean isDirectory(Path path) {
			return Files.isDirectory(path);
		}

		@Override
		public boolean isFile(Path path) {
			return Files.isRegularFile(path);
		}

		@Override
		public List<String> list(Path directory) throws IOException {
			List<String> names = new ArrayList<>();
			try (DirectoryStream<Path> entries = Files
					.newDirectoryStream(directory)) {
				for (Path entry : entries) {
					names.add(entry.getFileName().toString());
				}
			}
			Collections.sort(names);
			return names;
		}

		@Override
		public byte[] readFully(Path file) throws IOException {
			return Files.readAllBytes(file);
		}
	}
}
