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
import static org.junit.Assert.assertNotEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.util.Arrays;
import java.util.List;

import org.junit.Test;

public class VersionTest {

	@Test
	public void testParse() {
		Version v = Version.parse("1.2.3-beta.1+exp.sha.5114f85");
		assertEquals(1, v.getMajor());
		assertEquals(2, v.getMinor());
		assertEquals(3, v.getPatch());
		assertEquals(Arrays.asList("beta", "1"), v.getPrereleaseIdentifiers());
		assertEquals(Arrays.asList("exp", "sha", "5114f85"),
				v.getBuildMetadataIdentifiers());
		assertEquals("1.2.3-beta.1+exp.sha.5114f85", v.toString());
		assertEquals(new Version(1, 1, 1), Version.parse("1.1.1"));
	}

	@Test
	public void testInvalid() {
		String[] invalid = { null, "", "1", "1.2", "1.2.3.4", "01.2.3",
				"1.2.x", "1.2.3-", "1.2.3-01", "1.2.3+", "1.2.3-a..b",
				"1.2.3-a_b" };
		for (String s : invalid) {
			assertThrows(s, IllegalArgumentException.class,
					() -> Version.parse(s));
		}
	}

	@Test
	public void testPrecedence() {
		List<String> ordered = Arrays.asList("1.0.0-alpha", "1.0.0-alpha.1",
				"1.0.0-alpha.beta", "1.0.0-beta", "1.0.0-beta.2",
				"1.0.0-beta.11", "1.0.0-rc.1", "1.0.0", "1.0.1", "1.1.0",
				"2.0.0");
		for (int i = 0; i + 1 < ordered.size(); i++) {
			Version lower = Version.parse(ordered.get(i));
			Version higher = Version.parse(ordered.get(i + 1));
			assertTrue(lower + " < " + higher, lower.compareTo(higher) < 0);
			assertTrue(higher + " > " + lower, higher.compareTo(lower) > 0);
		}
	}

	@Test
	public void testBuildMetadataIgnoredForPrecedence() {
		Version a = Version.parse("1.0.0+build.1");
		Version b = Version.parse("1.0.0+build.2");
		assertEquals(0, a.compareTo(b));
		assertNotEquals(a, b);
	}
}
