/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.errors;

/**
 * Thrown when the signing configuration is present but unusable.
 */
public class BadConfigurationException extends SignatureValidationException {
	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new instance.
	 *
	 * @param details
	 *            describing what is wrong
	 */
	public BadConfigurationException(String details) {
		super(details, null);
	}

	/**
	 * Creates a new instance.
	 *
	 * @param details
	 *            describing what is wrong
	 * @param cause
	 *            underlying failure
	 */
	public BadConfigurationException(String details, Throwable cause) {
		super(details, cause);
	}
}
