/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.events;

/**
 * Receives {@link org.relsig.events.SignatureWarningEvent}s.
 */
public interface SignatureWarningListener extends ValidationListener {
	/**
	 * Invoked when a package release was accepted with a warning.
	 *
	 * @param event
	 *            information about the warning.
	 */
	void onSignatureWarning(SignatureWarningEvent event);
}
