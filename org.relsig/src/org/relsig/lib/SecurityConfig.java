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

import static org.relsig.lib.ConfigConstants.CONFIG_KEY_CERTIFICATE_EXPIRATION;
import static org.relsig.lib.ConfigConstants.CONFIG_KEY_CERTIFICATE_REVOCATION;
import static org.relsig.lib.ConfigConstants.CONFIG_KEY_INCLUDE_DEFAULT_TRUSTED_ROOT_CERTIFICATES;
import static org.relsig.lib.ConfigConstants.CONFIG_KEY_ON_UNSIGNED;
import static org.relsig.lib.ConfigConstants.CONFIG_KEY_ON_UNTRUSTED_CERTIFICATE;
import static org.relsig.lib.ConfigConstants.CONFIG_KEY_TRUSTED_ROOT_CERTIFICATES_PATH;
import static org.relsig.lib.ConfigConstants.CONFIG_PACKAGE_SECTION;
import static org.relsig.lib.ConfigConstants.CONFIG_REGISTRY_SECTION;
import static org.relsig.lib.ConfigConstants.CONFIG_SCOPE_SECTION;
import static org.relsig.lib.ConfigConstants.CONFIG_SIGNING_SECTION;

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.List;

import org.relsig.annotations.NonNull;
import org.relsig.annotations.Nullable;
import org.relsig.internal.RelSigText;
import org.relsig.util.StringUtils;

/**
 * Typed access to the signing configuration of registries.
 * <p>
 * Settings may be given at four levels; for each key, the most specific level
 * that sets it wins:
 *
 * <pre>
 * [package "mona.LinkedList"]   # one package
 * [scope "mona"]                # all packages of a scope
 * [registry "packages.example.com"]  # one registry, by host
 * [signing]                     # everything else
 * </pre>
 *
 * Scope and package subsections are matched ignoring case, like package
 * identities themselves.
 */
public class SecurityConfig {

	private final Config config;

	/**
	 * Create a new security config that reads the configuration from config.
	 *
	 * @param config
	 *            the config to read from
	 */
	public SecurityConfig(@NonNull Config config) {
		this.config = config;
	}

	/**
	 * Resolves the settings that apply to everything not overridden, i.e.
	 * the {@code [signing]} section only.
	 *
	 * @return the default {@link SigningConfig}
	 * @throws IllegalArgumentException
	 *             if a value is invalid
	 */
	public SigningConfig getDefaultSigning() {
		return resolve(List.of(new Level(CONFIG_SIGNING_SECTION, null)));
	}

	/**
	 * Resolves the settings for a package from a registry.
	 *
	 * @param registry
	 *            the package comes from
	 * @param identity
	 *            of the package; if {@code null}, only registry and default
	 *            settings apply
	 * @return the effective {@link SigningConfig}
	 * @throws IllegalArgumentException
	 *             if a value is invalid
	 */
	public SigningConfig getSigning(@NonNull Registry registry,
			@Nullable PackageIdentity identity) {
		List<Level> levels = new ArrayList<>(4);
		if (identity != null) {
			addLevel(levels, CONFIG_PACKAGE_SECTION, identity.toString());
			addLevel(levels, CONFIG_SCOPE_SECTION, identity.getScope());
		}
		addLevel(levels, CONFIG_REGISTRY_SECTION, registry.getConfigKey());
		levels.add(new Level(CONFIG_SIGNING_SECTION, null));
		return resolve(levels);
	}

	private void addLevel(List<Level> levels, String section, String key) {
		for (String subsection : config.getSubsections(section)) {
			if (StringUtils.equalsIgnoreCase(subsection, key)) {
				levels.add(new Level(section, subsection));
				return;
			}
		}
	}

	private SigningConfig resolve(List<Level> levels) {
		SigningConfig.Builder builder = SigningConfig.builder();
		Level level = find(levels, CONFIG_KEY_ON_UNSIGNED);
		if (level != null) {
			builder.setOnUnsigned(config.getEnum(TrustAction.values(),
					level.section, level.subsection, CONFIG_KEY_ON_UNSIGNED,
					null));
		}
		level = find(levels, CONFIG_KEY_ON_UNTRUSTED_CERTIFICATE);
		if (level != null) {
			builder.setOnUntrustedCertificate(config.getEnum(
					TrustAction.values(), level.section, level.subsection,
					CONFIG_KEY_ON_UNTRUSTED_CERTIFICATE, null));
		}
		level = find(levels, CONFIG_KEY_TRUSTED_ROOT_CERTIFICATES_PATH);
		if (level != null) {
			builder.setTrustedRootCertificatesPath(config.getString(
					level.section, level.subsection,
					CONFIG_KEY_TRUSTED_ROOT_CERTIFICATES_PATH));
		}
		level = find(levels,
				CONFIG_KEY_INCLUDE_DEFAULT_TRUSTED_ROOT_CERTIFICATES);
		if (level != null) {
			builder.setIncludeDefaultTrustedRootCertificates(
					Boolean.valueOf(config.getBoolean(level.section,
							level.subsection,
							CONFIG_KEY_INCLUDE_DEFAULT_TRUSTED_ROOT_CERTIFICATES,
							true)));
		}
		level = find(levels, CONFIG_KEY_CERTIFICATE_EXPIRATION);
		if (level != null) {
			builder.setCertificateExpiration(config.getEnum(
					CertificateExpiration.values(), level.section,
					level.subsection, CONFIG_KEY_CERTIFICATE_EXPIRATION, null));
		}
		level = find(levels, CONFIG_KEY_CERTIFICATE_REVOCATION);
		if (level != null) {
			builder.setCertificateRevocation(config.getEnum(
					CertificateRevocation.values(), level.section,
					level.subsection, CONFIG_KEY_CERTIFICATE_REVOCATION, null));
		}
		return builder.build();
	}

	private Level find(List<Level> levels, String key) {
		for (Level level : levels) {
			String value = config.getString(level.section, level.subsection,
					key);
			if (value == null) {
				continue;
			}
			if (Config.isMissing(value) && !key.equals(
					CONFIG_KEY_INCLUDE_DEFAULT_TRUSTED_ROOT_CERTIFICATES)) {
				// "key" without "=" only makes sense for booleans
				throw new IllegalArgumentException(MessageFormat.format(
						RelSigText.get().enumValueNotSupported2,
						level.section, key, value));
			}
			return level;
		}
		return null;
	}

	private static class Level {
		final String section;

		final String subsection;

		Level(String section, String subsection) {
			this.section = section;
			this.subsection = subsection;
		}
	}
}
