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
 * What to do when a package is unsigned or its signer is not trusted.
 */
public enum TrustAction implements Config.ConfigEnum {

	/** Ask the {@link org.relsig.signing.SignatureValidationDelegate}. */
	PROMPT("prompt"), //$NON-NLS-1$

	/** Reject the package. */
	ERROR("error"), //$NON-NLS-1$

	/** Accept the package and emit a warning. */
	WARN("warn"), //$NON-NLS-1$

	/** Accept the package without further notice. */
	SILENT_ALLOW("silentAllow"); //$NON-NLS-1$

	private final String configValue;

	private TrustAction(String configValue) {
		this.configValue = configValue;
	}

	@Override
	public boolean matchConfigValue(String s) {
		return StringUtils.equalsIgnoreCase(configValue, s);
	}

	@Override
	public String toConfigValue() {
		return configValue;
	}

	@Override
	public String toString() {
		return configValue;
	}
}
