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

import java.text.MessageFormat;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.relsig.internal.RelSigText;

/**
 * A semantic version {@code major.minor.patch[-prerelease][+build]}.
 * <p>
 * Ordering follows semantic versioning precedence; build metadata does not
 * take part in comparisons but does in {@link #equals(Object)}.
 */
public final class Version implements Comparable<Version> {

	private final int major;

	private final int minor;

	private final int patch;

	private final List<String> prereleaseIdentifiers;

	private final List<String> buildMetadataIdentifiers;

	/**
	 * Creates a release version without pre-release or build identifiers.
	 *
	 * @param major
	 *            version
	 * @param minor
	 *            version
	 * @param patch
	 *            version
	 */
	public Version(int major, int minor, int patch) {
		this(major, minor, patch, Collections.emptyList(),
				Collections.emptyList());
	}

	private Version(int major, int minor, int patch, List<String> prerelease,
			List<String> build) {
		if (major < 0 || minor < 0 || patch < 0) {
			throw new IllegalArgumentException(MessageFormat.format(
					RelSigText.get().invalidVersion,
					major + "." + minor + "." + patch)); //$NON-NLS-1$ //$NON-NLS-2$
		}
		this.major = major;
		this.minor = minor;
		this.patch = patch;
		this.prereleaseIdentifiers = prerelease;
		this.buildMetadataIdentifiers = build;
	}

	/**
	 * Parses a semantic version.
	 *
	 * @param version
	 *            to parse, for instance {@code 1.2.3-beta.1+exp.sha.5114f85}
	 * @return the parsed {@link Version}
	 * @throws IllegalArgumentException
	 *             if {@code version} is not a valid semantic version
	 */
	public static Version parse(String version) {
		if (version == null) {
			throw new IllegalArgumentException(MessageFormat
					.format(RelSigText.get().invalidVersion, version));
		}
		String core = version;
		List<String> build = Collections.emptyList();
		List<String> prerelease = Collections.emptyList();
		int plus = core.indexOf('+');
		if (plus >= 0) {
			build = identifiers(version, core.substring(plus + 1), false);
			core = core.substring(0, plus);
		}
		int dash = core.indexOf('-');
		if (dash >= 0) {
			prerelease = identifiers(version, core.substring(dash + 1), true);
			core = core.substring(0, dash);
		}
		String[] parts = core.split("\\.", -1); //$NON-NLS-1$
		if (parts.length != 3) {
			throw new IllegalArgumentException(MessageFormat
					.format(RelSigText.get().invalidVersion, version));
		}
		return new Version(number(version, parts[0]), number(version, parts[1]),
				number(version, parts[2]), prerelease, build);
	}

	private static int number(String version, String part) {
		if (part.isEmpty() || (part.length() > 1 && part.charAt(0) == '0')
				|| !isNumeric(part)) {
			throw new IllegalArgumentException(MessageFormat
					.format(RelSigText.get().invalidVersion, version));
		}
		try {
			return Integer.parseInt(part);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(MessageFormat
					.format(RelSigText.get().invalidVersion, version), e);
		}
	}

	private static List<String> identifiers(String version, String text,
			boolean prerelease) {
		List<String> result = new ArrayList<>();
		for (String id : text.split("\\.", -1)) { //$NON-NLS-1$
			boolean valid = !id.isEmpty();
			for (int i = 0; valid && i < id.length(); i++) {
				char c = id.charAt(i);
				valid = (c >= '0' && c <= '9') || (c >= 'a' && c <= 'z')
						|| (c >= 'A' && c <= 'Z') || c == '-';
			}
			if (valid && prerelease && id.length() > 1 && isNumeric(id)
					&& id.charAt(0) == '0') {
				valid = false;
			}
			if (!valid) {
				throw new IllegalArgumentException(MessageFormat
						.format(RelSigText.get().invalidVersion, version));
			}
			result.add(id);
		}
		return Collections.unmodifiableList(result);
	}

	private static boolean isNumeric(String s) {
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c < '0' || c > '9') {
				return false;
			}
		}
		return !s.isEmpty();
	}

	/**
	 * Get the major version
	 *
	 * @return the major version
	 */
	public int getMajor() {
		return major;
	}

	/**
	 * Get the minor version
	 *
	 * @return the minor version
	 */
	public int getMinor() {
		return minor;
	}

	/**
	 * Get the patch version
	 *
	 * @return the patch version
	 */
	public int getPatch() {
		return patch;
	}

	/**
	 * Get the pre-release identifiers
	 *
	 * @return the pre-release identifiers, empty for a release version
	 */
	public List<String> getPrereleaseIdentifiers() {
		return prereleaseIdentifiers;
	}

	/**
	 * Get the build metadata identifiers
	 *
	 * @return the build metadata identifiers, possibly empty
	 */
	public List<String> getBuildMetadataIdentifiers() {
		return buildMetadataIdentifiers;
	}

	@Override
	public int compareTo(Version other) {
		int cmp = Integer.compare(major, other.major);
		if (cmp == 0) {
			cmp = Integer.compare(minor, other.minor);
		}
		if (cmp == 0) {
			cmp = Integer.compare(patch, other.patch);
		}
		if (cmp != 0) {
			return cmp;
		}
		// A release sorts after all of its pre-releases.
		if (prereleaseIdentifiers.isEmpty()
				|| other.prereleaseIdentifiers.isEmpty()) {
			return Boolean.compare(prereleaseIdentifiers.isEmpty(),
					other.prereleaseIdentifiers.isEmpty());
		}
		int n = Math.min(prereleaseIdentifiers.size(),
				other.prereleaseIdentifiers.size());
		for (int i = 0; i < n; i++) {
			cmp = compareIdentifier(prereleaseIdentifiers.get(i),
					other.prereleaseIdentifiers.get(i));
			if (cmp != 0) {
				return cmp;
			}
		}
		return Integer.compare(prereleaseIdentifiers.size(),
				other.prereleaseIdentifiers.size());
	}

	private static int compareIdentifier(String a, String b) {
		boolean aNumeric = isNumeric(a);
		boolean bNumeric = isNumeric(b);
		if (aNumeric && bNumeric) {
			int cmp = Integer.compare(a.length(), b.length());
			return cmp != 0 ? cmp : a.compareTo(b);
		}
		if (aNumeric != bNumeric) {
			// Numeric identifiers have lower precedence.
			return aNumeric ? -1 : 1;
		}
		return a.compareTo(b);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Version)) {
			return false;
		}
		Version other = (Version) obj;
		return major == other.major && minor == other.minor
				&& patch == other.patch
				&& prereleaseIdentifiers.equals(other.prereleaseIdentifiers)
				&& buildMetadataIdentifiers
						.equals(other.buildMetadataIdentifiers);
	}

	@Override
	public int hashCode() {
		return ((major * 31 + minor) * 31 + patch) * 31
				+ prereleaseIdentifiers.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder b = new StringBuilder();
		b.append(major).append('.').append(minor).append('.').append(patch);
		if (!prereleaseIdentifiers.isEmpty()) {
			b.append('-').append(String.join(".", prereleaseIdentifiers)); //$NON-NLS-1$
		}
		if (!buildMetadataIdentifiers.isEmpty()) {
			b.append('+').append(String.join(".", buildMetadataIdentifiers)); //$NON-NLS-1$
		}
		return b.toString();
	}
}
