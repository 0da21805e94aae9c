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

import java.text.MessageFormat;

import org.relsig.internal.RelSigText;

/**
 * Thrown when a policy decision needs a configuration value that is not set.
 */
public class MissingConfigurationException
		extends SignatureValidationException {
	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new instance.
	 *
	 * @param details
	 *            names the missing value
	 */
	public MissingConfigurationException(String details) {
		super(MessageFormat.format(RelSigText.get().missingConfiguration,
				details), null);
	}
}
