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

import org.relsig.util.StringUtils;

/**
 * A line in a configuration file.
 */
class ConfigLine {
	/** The section name, {@code null} for lines before any section. */
	String section;

	/** Subsection name, {@code null} if the section has none. */
	String subsection;

	/** The key name, {@code null} for section headers and comments. */
	String name;

	/** The value. */
	String value;

	boolean match(String aSection, String aSubsection, String aKey) {
		return match(aSection, aSubsection)
				&& StringUtils.equalsIgnoreCase(name, aKey);
	}

	boolean match(String aSection, String aSubsection) {
		if (section == null || !StringUtils.equalsIgnoreCase(section, aSection)) {
			return false;
		}
		// Subsection names are case sensitive.
		return subsection == null ? aSubsection == null
				: subsection.equals(aSubsection);
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		if (section == null) {
			return "<empty>";
		}
		StringBuilder b = new StringBuilder(section);
		if (subsection != null) {
			b.append(".").append(subsection);
		}
		if (name != null) {
			b.append(".").append(name);
		}
		if (value != null) {
			b.append("=").append(value);
		}
		return b.toString();
	}
}
