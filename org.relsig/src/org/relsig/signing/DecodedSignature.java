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

import org.relsig.lib.SignatureFormat;

/**
 * Raw signature bytes of a source archive together with their format.
 */
public final class DecodedSignature {
	private final byte[] signature;

	private final SignatureFormat format;

	DecodedSignature(byte[] signature, SignatureFormat format) {
		this.signature = signature;
		this.format = format;
	}

	/**
	 * Get the signature
	 *
	 * @return the raw signature bytes
	 */
	public byte[] getSignature() {
		return signature.clone();
	}

	/**
	 * Get the format
	 *
	 * @return the signature format
	 */
	public SignatureFormat getFormat() {
		return format;
	}
}
