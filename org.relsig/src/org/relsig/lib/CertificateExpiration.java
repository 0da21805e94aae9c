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
 * Config values for {@code certificateExpiration}.
 */
public enum CertificateExpiration implements Config.ConfigEnum {

	/** Check that certificates were valid at signing time. */
	ENABLED("enabled"), //$NON-NLS-1$

	/** Skip the expiration check. */
	DISABLED("disabled"); //$NON-NLS-1$

	private final String configValue;

	private CertificateExpiration(String configValue) {
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
