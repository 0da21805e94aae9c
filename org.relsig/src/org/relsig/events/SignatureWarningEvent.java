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

import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;

/**
 * Describes a package release that was accepted although it is unsigned or
 * its signer is not trusted.
 */
public class SignatureWarningEvent
		extends ValidationEvent<SignatureWarningListener> {
	private final String message;

	/**
	 * Create a new warning event.
	 *
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package being validated
	 * @param version
	 *            the version being validated
	 * @param message
	 *            human readable warning
	 */
	public SignatureWarningEvent(Registry registry,
			PackageIdentity packageIdentity, Version version,
			String message) {
		super(registry, packageIdentity, version);
		this.message = message;
	}

	/**
	 * Get the warning message
	 *
	 * @return human readable warning
	 */
	public String getMessage() {
		return message;
	}

	@Override
	public Class<SignatureWarningListener> getListenerType() {
		return SignatureWarningListener.class;
	}

	@Override
	public void dispatch(SignatureWarningListener listener) {
		listener.onSignatureWarning(this);
	}
}
