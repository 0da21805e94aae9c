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

import org.relsig.annotations.Nullable;

/**
 * Signature encodings understood by registries.
 */
public enum SignatureFormat {

	/** CMS (PKCS #7) detached signature, version 1.0.0 */
	CMS_1_0_0("cms-1.0.0"); //$NON-NLS-1$

	private final String token;

	private SignatureFormat(String token) {
		this.token = token;
	}

	/**
	 * Retrieves the token registries use for this format.
	 *
	 * @return the token, for instance {@code cms-1.0.0}
	 */
	public String getToken() {
		return token;
	}

	/**
	 * Looks up a format by its token. Tokens are matched exactly.
	 *
	 * @param token
	 *            as found in release metadata
	 * @return the format, or {@code null} if the token is unknown
	 */
	@Nullable
	public static SignatureFormat fromToken(String token) {
		for (SignatureFormat format : values()) {
			if (format.token.equals(token)) {
				return format;
			}
		}
		return null;
	}

	@Override
	public String toString() {
		return token;
	}
}
