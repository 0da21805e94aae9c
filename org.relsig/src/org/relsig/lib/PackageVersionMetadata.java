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

import java.time.Instant;
import java.util.Collections;
import java.util.List;

import org.relsig.annotations.NonNull;
import org.relsig.annotations.Nullable;

/**
 * Metadata a registry publishes for one version of a package.
 */
public class PackageVersionMetadata {

	/** Name of the source archive resource */
	public static final String SOURCE_ARCHIVE_NAME = "source-archive"; //$NON-NLS-1$

	/** Media type of the source archive resource */
	public static final String SOURCE_ARCHIVE_TYPE = "application/zip"; //$NON-NLS-1$

	private final List<Resource> resources;

	private final String author;

	private final String description;

	private final Instant publishedAt;

	/**
	 * Creates metadata with resources only.
	 *
	 * @param resources
	 *            of the release
	 */
	public PackageVersionMetadata(@NonNull List<Resource> resources) {
		this(resources, null, null, null);
	}

	/**
	 * Creates new metadata.
	 *
	 * @param resources
	 *            of the release
	 * @param author
	 *            of the release, may be {@code null}
	 * @param description
	 *            of the release, may be {@code null}
	 * @param publishedAt
	 *            time of publication, may be {@code null}
	 */
	public PackageVersionMetadata(@NonNull List<Resource> resources,
			String author, String description, Instant publishedAt) {
		this.resources = Collections.unmodifiableList(resources);
		this.author = author;
		this.description = description;
		this.publishedAt = publishedAt;
	}

	/**
	 * Get the resources
	 *
	 * @return the resources of the release
	 */
	@NonNull
	public List<Resource> getResources() {
		return resources;
	}

	/**
	 * Finds the source archive among the resources.
	 *
	 * @return the first resource named {@value #SOURCE_ARCHIVE_NAME} of type
	 *         {@value #SOURCE_ARCHIVE_TYPE}, or {@code null}
	 */
	@Nullable
	public Resource getSourceArchive() {
		for (Resource resource : resources) {
			if (SOURCE_ARCHIVE_NAME.equals(resource.getName())
					&& SOURCE_ARCHIVE_TYPE.equals(resource.getType())) {
				return resource;
			}
		}
		return null;
	}

	/**
	 * Get the author
	 *
	 * @return the author, or {@code null}
	 */
	@Nullable
	public String getAuthor() {
		return author;
	}

	/**
	 * Get the description
	 *
	 * @return the description, or {@code null}
	 */
	@Nullable
	public String getDescription() {
		return description;
	}

	/**
	 * Get the publication time
	 *
	 * @return when the release was published, or {@code null}
	 */
	@Nullable
	public Instant getPublishedAt() {
		return publishedAt;
	}

	/**
	 * A downloadable resource of a release.
	 */
	public static class Resource {
		private final String name;

		private final String type;

		private final String checksum;

		private final Signing signing;

		/**
		 * Creates a new resource description.
		 *
		 * @param name
		 *            of the resource
		 * @param type
		 *            media type
		 * @param checksum
		 *            hex SHA-256 of the content, may be {@code null}
		 * @param signing
		 *            signature information, {@code null} if unsigned
		 */
		public Resource(String name, String type, String checksum,
				Signing signing) {
			this.name = name;
			this.type = type;
			this.checksum = checksum;
			this.signing = signing;
		}

		/**
		 * @return the name
		 */
		public String getName() {
			return name;
		}

		/**
		 * @return the media type
		 */
		public String getType() {
			return type;
		}

		/**
		 * @return the checksum, or {@code null}
		 */
		@Nullable
		public String getChecksum() {
			return checksum;
		}

		/**
		 * @return the signing information, or {@code null} if unsigned
		 */
		@Nullable
		public Signing getSigning() {
			return signing;
		}
	}

	/**
	 * Signature information attached to a resource.
	 */
	public static class Signing {
		private final String signatureBase64Encoded;

		private final String signatureFormat;

		/**
		 * Creates new signature information.
		 *
		 * @param signatureBase64Encoded
		 *            the signature, may be {@code null}
		 * @param signatureFormat
		 *            the format token, may be {@code null}
		 */
		public Signing(String signatureBase64Encoded, String signatureFormat) {
			this.signatureBase64Encoded = signatureBase64Encoded;
			this.signatureFormat = signatureFormat;
		}

		/**
		 * @return the base64 encoded signature, or {@code null}
		 */
		@Nullable
		public String getSignatureBase64Encoded() {
			return signatureBase64Encoded;
		}

		/**
		 * @return the signature format token, or {@code null}
		 */
		@Nullable
		public String getSignatureFormat() {
			return signatureFormat;
		}
	}
}
