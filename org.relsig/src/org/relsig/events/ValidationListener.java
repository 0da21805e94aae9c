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

import java.util.EventListener;

/**
 * A listener can register for event delivery.
 */
public interface ValidationListener extends EventListener {
	// Empty marker interface; see extensions for actual methods.
}
