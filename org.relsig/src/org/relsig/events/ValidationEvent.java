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

import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;

/**
 * Describes something that happened while validating a package release.
 *
 * @param <T>
 *            type of listener this event dispatches to.
 */
public abstract class ValidationEvent<T extends ValidationListener> {
	private final Registry registry;

	private final PackageIdentity packageIdentity;

	private final Version version;

	/**
	 * Create an event for a package release.
	 *
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package being validated
	 * @param version
	 *            the version being validated
	 */
	protected ValidationEvent(Registry registry,
			PackageIdentity packageIdentity, Version version) {
		this.registry = registry;
		this.packageIdentity = packageIdentity;
		this.version = version;
	}

	/**
	 * Get the registry
	 *
	 * @return the registry the package comes from
	 */
	public Registry getRegistry() {
		return registry;
	}

	/**
	 * Get the package
	 *
	 * @return the package being validated
	 */
	public PackageIdentity getPackageIdentity() {
		return packageIdentity;
	}

	/**
	 * Get the version
	 *
	 * @return the version being validated
	 */
	public Version getVersion() {
		return version;
	}

	/**
	 * Get type of listener this event dispatches to
	 *
	 * @return type of listener this event dispatches to
	 */
	public abstract Class<T> getListenerType();

	/**
	 * Dispatch this event to the given listener.
	 *
	 * @param listener
	 *            listener that wants this event.
	 */
	public abstract void dispatch(T listener);

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return getClass().getSimpleName() + "[" + packageIdentity + " "
				+ version + " from " + registry + "]";
	}
}
