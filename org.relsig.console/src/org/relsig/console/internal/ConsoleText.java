/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.console.internal;

import org.relsig.nls.NLS;
import org.relsig.nls.TranslationBundle;

/**
 * Translation bundle for the RelSig console
 */
public class ConsoleText extends TranslationBundle {

	/**
	 * Get an instance of this translation bundle
	 *
	 * @return an instance of this translation bundle
	 */
	public static ConsoleText get() {
		return NLS.getBundleFor(ConsoleText.class);
	}

	// @formatter:off
	/***/ public String answerNo;
	/***/ public String answerYes;
	/***/ public String answerYesShort;
	/***/ public String noSystemConsoleAvailable;
	/***/ public String promptUnsigned;
	/***/ public String promptUntrusted;
}
