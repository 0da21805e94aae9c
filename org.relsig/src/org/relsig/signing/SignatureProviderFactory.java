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

import org.relsig.annotations.NonNull;
import org.relsig.lib.SignatureFormat;

/**
 * A factory for {@link SignatureProvider}s.
 * <p>
 * Implementations are discovered through {@link java.util.ServiceLoader}.
 */
public interface SignatureProviderFactory {

	/**
	 * Tells what kind of {@link SignatureProvider} this factory creates.
	 *
	 * @return the {@link SignatureFormat} the provider verifies
	 */
	@NonNull
	SignatureFormat getType();

	/**
	 * Creates a new instance of a {@link SignatureProvider} that can verify
	 * signatures of type {@link #getType()}.
	 *
	 * @return a new {@link SignatureProvider}
	 */
	@NonNull
	SignatureProvider create();
}
