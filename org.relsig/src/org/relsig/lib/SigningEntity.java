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

import java.util.Objects;

import org.relsig.annotations.Nullable;

/**
 * The entity that signed a package release, as described by the subject of
 * the signing certificate.
 * <p>
 * Instances are created by {@link org.relsig.signing.SignatureProvider}s only
 * and compare by value, so that a signing entity seen earlier for a package
 * can be matched against a newly observed one.
 */
public final class SigningEntity {

	/**
	 * Well-known kinds of signing entities whose certificates follow a
	 * recognized issuance policy.
	 */
	public enum Type {
		/** Apple Developer Program certificate */
		ADP
	}

	private final Type type;

	private final String name;

	private final String organizationalUnit;

	private final String organization;

	private SigningEntity(Type type, String name, String organizationalUnit,
			String organization) {
		this.type = type;
		this.name = name;
		this.organizationalUnit = organizationalUnit;
		this.organization = organization;
	}

	/**
	 * Creates a signing entity of a recognized type.
	 *
	 * @param type
	 *            of the entity
	 * @param name
	 *            common name from the certificate subject
	 * @param organizationalUnit
	 *            organizational unit from the certificate subject
	 * @param organization
	 *            organization from the certificate subject
	 * @return the signing entity
	 */
	public static SigningEntity recognized(Type type, String name,
			String organizationalUnit, String organization) {
		return new SigningEntity(Objects.requireNonNull(type), name,
				organizationalUnit, organization);
	}

	/**
	 * Creates a signing entity of no recognized type.
	 *
	 * @param name
	 *            common name from the certificate subject, may be null
	 * @param organizationalUnit
	 *            organizational unit, may be null
	 * @param organization
	 *            organization, may be null
	 * @return the signing entity
	 */
	public static SigningEntity unrecognized(String name,
			String organizationalUnit, String organization) {
		return new SigningEntity(null, name, organizationalUnit, organization);
	}

	/**
	 * Tells whether this entity is of a recognized {@link Type}.
	 *
	 * @return {@code true} if {@link #getType()} is not {@code null}
	 */
	public boolean isRecognized() {
		return type != null;
	}

	/**
	 * Get the type
	 *
	 * @return the type, or {@code null} if unrecognized
	 */
	@Nullable
	public Type getType() {
		return type;
	}

	/**
	 * Get the name
	 *
	 * @return the common name, or {@code null}
	 */
	@Nullable
	public String getName() {
		return name;
	}

	/**
	 * Get the organizational unit
	 *
	 * @return the organizational unit, or {@code null}
	 */
	@Nullable
	public String getOrganizationalUnit() {
		return organizationalUnit;
	}

	/**
	 * Get the organization
	 *
	 * @return the organization, or {@code null}
	 */
	@Nullable
	public String getOrganization() {
		return organization;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof SigningEntity)) {
			return false;
		}
		SigningEntity other = (SigningEntity) obj;
		return type == other.type && Objects.equals(name, other.name)
				&& Objects.equals(organizationalUnit, other.organizationalUnit)
				&& Objects.equals(organization, other.organization);
	}

	@Override
	public int hashCode() {
		return Objects.hash(type, name, organizationalUnit, organization);
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		StringBuilder b = new StringBuilder();
		if (type != null) {
			b.append('[').append(type).append("] ");
		}
		b.append(name != null ? name : "<unknown>");
		if (organizationalUnit != null || organization != null) {
			b.append(" (");
			if (organizationalUnit != null) {
				b.append(organizationalUnit);
				if (organization != null) {
					b.append(", ");
				}
			}
			if (organization != null) {
				b.append(organization);
			}
			b.append(')');
		}
		return b.toString();
	}
}
