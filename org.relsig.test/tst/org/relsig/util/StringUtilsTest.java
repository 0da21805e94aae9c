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

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.junit.Test;

public class StringUtilsTest {

	@Test
	public void testEqualsIgnoreCase() {
		assertTrue(StringUtils.equalsIgnoreCase("Yes", "yES"));
		assertTrue(StringUtils.equalsIgnoreCase(null, null));
		assertFalse(StringUtils.equalsIgnoreCase("yes", null));
		assertFalse(StringUtils.equalsIgnoreCase("yes", "y"));
	}

	@Test
	public void testToLowerCase() {
		assertEquals("packages.example.com",
				StringUtils.toLowerCase("Packages.Example.COM"));
	}

	@Test
	public void testToBooleanOrNull() {
		assertEquals(Boolean.TRUE, StringUtils.toBooleanOrNull("yes"));
		assertEquals(Boolean.TRUE, StringUtils.toBooleanOrNull("On"));
		assertEquals(Boolean.TRUE, StringUtils.toBooleanOrNull("1"));
		assertEquals(Boolean.FALSE, StringUtils.toBooleanOrNull("false"));
		assertEquals(Boolean.FALSE, StringUtils.toBooleanOrNull("off"));
		assertNull(StringUtils.toBooleanOrNull("maybe"));
		assertNull(StringUtils.toBooleanOrNull(null));
	}

	@Test
	public void testToBoolean() {
		assertTrue(StringUtils.toBoolean("true"));
		assertThrows(IllegalArgumentException.class,
				() -> StringUtils.toBoolean("maybe"));
	}

	@Test
	public void testIsEmptyOrNull() {
		assertTrue(StringUtils.isEmptyOrNull(null));
		assertTrue(StringUtils.isEmptyOrNull(""));
		assertFalse(StringUtils.isEmptyOrNull(" "));
	}
}
