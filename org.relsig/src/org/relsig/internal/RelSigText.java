/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.internal;

import org.relsig.nls.NLS;
import org.relsig.nls.TranslationBundle;

/**
 * Translation bundle for RelSig
 */
public class RelSigText extends TranslationBundle {

	/**
	 * Get an instance of this translation bundle
	 *
	 * @return an instance of this translation bundle
	 */
	public static RelSigText get() {
		return NLS.getBundleFor(RelSigText.class);
	}

	// @formatter:off
	/***/ public String badConfigurationNotADirectory;
	/***/ public String badConfigurationPath;
	/***/ public String badConfigurationPromptWithoutDelegate;
	/***/ public String badConfigurationTrustRoots;
	/***/ public String badEntryDelimiter;
	/***/ public String badEntryName;
	/***/ public String badEscape;
	/***/ public String badGroupHeader;
	/***/ public String badSectionEntry;
	/***/ public String cannotReadFile;
	/***/ public String commandWasCalledInTheWrongState;
	/***/ public String delegateFailed;
	/***/ public String endOfFileInEscape;
	/***/ public String enumValueNotSupported2;
	/***/ public String enumValueNotSupported3;
	/***/ public String expectedBooleanStringValue;
	/***/ public String failedRetrievingSignature;
	/***/ public String failedToValidateSignature;
	/***/ public String invalidBooleanValue;
	/***/ public String invalidLineInConfigFile;
	/***/ public String invalidPackageIdentity;
	/***/ public String invalidSignature;
	/***/ public String invalidSignatureEncoding;
	/***/ public String invalidSigningCertificate;
	/***/ public String invalidVersion;
	/***/ public String missingCommandArgument;
	/***/ public String missingConfiguration;
	/***/ public String missingSignatureFormat;
	/***/ public String missingSourceArchive;
	/***/ public String newlineInQuotesNotAllowed;
	/***/ public String noSignatureProvider;
	/***/ public String noSignatureStatus;
	/***/ public String notABoolean;
	/***/ public String notAnAbsolutePath;
	/***/ public String packageSignedWithValidEntity;
	/***/ public String packageSignerUntrusted;
	/***/ public String packageUnsigned;
	/***/ public String signatureServiceConflict;
	/***/ public String signerNotTrusted;
	/***/ public String sourceArchiveNotSigned;
	/***/ public String tofuCheckFailed;
	/***/ public String unexpectedEndOfConfigFile;
	/***/ public String unknownSignatureFormat;
	/***/ public String warningListenerFailed;
}
