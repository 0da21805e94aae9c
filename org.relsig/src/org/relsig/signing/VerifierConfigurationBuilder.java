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

import java.io.IOException;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;

import org.relsig.errors.BadConfigurationException;
import org.relsig.internal.RelSigText;
import org.relsig.lib.CertificateExpiration;
import org.relsig.lib.SigningConfig;
import org.relsig.lib.VerifierConfiguration;
import org.relsig.util.FileSystemReader;

/**
 * Derives a {@link VerifierConfiguration} from a {@link SigningConfig}.
 * <p>
 * Trusted roots are read from the configured directory on every call.
 */
public class VerifierConfigurationBuilder {
	private final FileSystemReader fs;

	/**
	 * Creates a builder reading trusted roots through the given file system.
	 *
	 * @param fs
	 *            to read trusted roots with
	 */
	public VerifierConfigurationBuilder(FileSystemReader fs) {
		this.fs = fs;
	}

	/**
	 * Builds the verifier configuration for a signing configuration.
	 *
	 * @param config
	 *            the effective signing configuration
	 * @return a new verifier configuration
	 * @throws BadConfigurationException
	 *             if the trusted root directory is not an absolute path, is
	 *             not a directory, or any of its entries cannot be read
	 */
	public VerifierConfiguration build(SigningConfig config)
			throws BadConfigurationException {
		VerifierConfiguration.Builder builder = VerifierConfiguration
				.builder();
		String rootsPath = config.getTrustedRootCertificatesPath();
		if (rootsPath != null) {
			builder.setTrustedRoots(readTrustedRoots(rootsPath));
		}
		Boolean includeDefault = config
				.getIncludeDefaultTrustedRootCertificates();
		if (includeDefault != null) {
			builder.setIncludeDefaultTrustStore(includeDefault.booleanValue());
		}
		CertificateExpiration expiration = config.getCertificateExpiration();
		if (expiration != null) {
			switch (expiration) {
			case ENABLED:
				builder.enableCertificateExpiration(null);
				break;
			case DISABLED:
				builder.disableCertificateExpiration();
				break;
			default:
				break;
			}
		}
		if (config.getCertificateRevocation() != null) {
			builder.setCertificateRevocation(
					config.getCertificateRevocation());
		}
		return builder.build();
	}

	private List<byte[]> readTrustedRoots(String rootsPath)
			throws BadConfigurationException {
		Path dir;
		try {
			dir = Paths.get(rootsPath);
		} catch (InvalidPathException e) {
			throw new BadConfigurationException(MessageFormat.format(
					RelSigText.get().badConfigurationPath, rootsPath,
					e.getMessage()), e);
		}
		if (rootsPath.isEmpty() || !dir.isAbsolute()) {
			throw new BadConfigurationException(MessageFormat.format(
					RelSigText.get().badConfigurationPath, rootsPath,
					RelSigText.get().notAnAbsolutePath));
		}
		if (!fs.isDirectory(dir)) {
			throw new BadConfigurationException(MessageFormat.format(
					RelSigText.get().badConfigurationNotADirectory,
					rootsPath));
		}
		try {
			List<byte[]> roots = new ArrayList<>();
			for (String name : fs.list(dir)) {
				roots.add(fs.readFully(dir.resolve(name)));
			}
			return roots;
		} catch (IOException e) {
			throw new BadConfigurationException(MessageFormat.format(
					RelSigText.get().badConfigurationTrustRoots,
					e.getMessage()), e);
		}
	}
}
