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

/**
 * Tracks a previously registered {@link org.relsig.events.ValidationListener}.
 */
public class ListenerHandle {
	private final ListenerList parent;

	final Class<? extends ValidationListener> type;

	final ValidationListener listener;

	ListenerHandle(ListenerList parent,
			Class<? extends ValidationListener> type,
			ValidationListener listener) {
		this.parent = parent;
		this.type = type;
		this.listener = listener;
	}

	/**
	 * Remove the listener and stop receiving events.
	 */
	public void remove() {
		parent.remove(this);
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return type.getSimpleName() + "[" + listener + "]";
	}
}
