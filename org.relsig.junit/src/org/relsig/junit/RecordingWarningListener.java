/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.junit;

import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.relsig.events.SignatureWarningEvent;
import org.relsig.events.SignatureWarningListener;

/**
 * Collects {@link SignatureWarningEvent}s.
 */
public class RecordingWarningListener implements SignatureWarningListener {
	private final List<SignatureWarningEvent> events = new CopyOnWriteArrayList<>();

	/**
	 * @return the events received so far
	 */
	public List<SignatureWarningEvent> getEvents() {
		return events;
	}

	@Override
	public void onSignatureWarning(SignatureWarningEvent event) {
		events.add(event);
	}
}
