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

import java.text.MessageFormat;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;

import org.relsig.annotations.NonNull;
import org.relsig.annotations.Nullable;
import org.relsig.errors.BadConfigurationException;
import org.relsig.errors.FailedRetrievingSignatureException;
import org.relsig.errors.InvalidSignatureException;
import org.relsig.errors.InvalidSigningCertificateException;
import org.relsig.errors.SignatureValidationException;
import org.relsig.errors.SignatureVerificationFailedException;
import org.relsig.errors.SourceArchiveNotSignedException;
import org.relsig.events.ListenerList;
import org.relsig.internal.RelSigText;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.PackageVersionMetadata;
import org.relsig.lib.Registry;
import org.relsig.lib.SigningConfig;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.Version;
import org.relsig.lib.VerifierConfiguration;
import org.relsig.util.FileSystemReader;
import org.relsig.util.WorkQueue;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Validates the signature of a downloaded package release.
 * <p>
 * A validation fetches the release metadata, decodes the source archive
 * signature, verifies it against the downloaded content and applies the
 * configured trust policy. Whenever a trust decision is reached the signing
 * entity (or none) is reported to the {@link SigningEntityTofu} ledger before
 * the result is delivered. Retrieval, decoding, configuration and
 * verification failures are reported without consulting the ledger.
 * <p>
 * Each call runs independently on the {@link WorkQueue} executor. Instances
 * are thread-safe.
 */
public class SignatureValidation {
	private static final Logger LOG = LoggerFactory
			.getLogger(SignatureValidation.class);

	private final VersionMetadataProvider metadataProvider;

	private final SigningEntityTofu signingEntityTofu;

	private final SignatureDecoder decoder = new SignatureDecoder();

	private final VerifierConfigurationBuilder verifierConfigurationBuilder;

	private final TrustPolicy trustPolicy;

	private final ListenerList listeners;

	private volatile SignatureProvider signatureProvider;

	/**
	 * Creates a validation using the detected file system and a fresh
	 * listener list.
	 *
	 * @param metadataProvider
	 *            to fetch release metadata with
	 * @param signingEntityTofu
	 *            ledger of previously seen signing entities
	 * @param delegate
	 *            to ask when the configured action is to prompt, may be
	 *            {@code null}
	 */
	public SignatureValidation(@NonNull VersionMetadataProvider metadataProvider,
			@NonNull SigningEntityTofu signingEntityTofu,
			@Nullable SignatureValidationDelegate delegate) {
		this(metadataProvider, signingEntityTofu, delegate,
				FileSystemReader.DETECTED, new ListenerList());
	}

	/**
	 * Creates a validation.
	 *
	 * @param metadataProvider
	 *            to fetch release metadata with
	 * @param signingEntityTofu
	 *            ledger of previously seen signing entities
	 * @param delegate
	 *            to ask when the configured action is to prompt, may be
	 *            {@code null}
	 * @param fs
	 *            to read trusted root certificates with
	 * @param listeners
	 *            to send warnings to
	 */
	public SignatureValidation(@NonNull VersionMetadataProvider metadataProvider,
			@NonNull SigningEntityTofu signingEntityTofu,
			@Nullable SignatureValidationDelegate delegate,
			@NonNull FileSystemReader fs, @NonNull ListenerList listeners) {
		this.metadataProvider = metadataProvider;
		this.signingEntityTofu = signingEntityTofu;
		this.verifierConfigurationBuilder = new VerifierConfigurationBuilder(
				fs);
		this.listeners = listeners;
		this.trustPolicy = new TrustPolicy(listeners, delegate);
	}

	/**
	 * Get the listener list
	 *
	 * @return listeners receiving warnings of this validation
	 */
	public ListenerList getListenerList() {
		return listeners;
	}

	/**
	 * Sets the signature provider to use for every format.
	 *
	 * @param provider
	 *            to use; if {@code null} the provider registered in
	 *            {@link SignatureProviders} for the signature's format is used
	 */
	public void setSignatureProvider(@Nullable SignatureProvider provider) {
		this.signatureProvider = provider;
	}

	/**
	 * Validates the signature of a release.
	 *
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package
	 * @param version
	 *            the release
	 * @param content
	 *            the downloaded source archive
	 * @param config
	 *            effective signing configuration for the package
	 * @param timeout
	 *            hint passed on to metadata retrieval and signature
	 *            verification, may be {@code null}
	 * @param callbackExecutor
	 *            on which the returned future is completed
	 * @return a future completing with the signing entity to trust, empty if
	 *         the release was accepted without one, or exceptionally with a
	 *         {@link SignatureValidationException}
	 */
	public CompletableFuture<Optional<SigningEntity>> validate(
			@NonNull Registry registry,
			@NonNull PackageIdentity packageIdentity,
			@NonNull Version version, @NonNull byte[] content,
			@NonNull SigningConfig config, @Nullable Duration timeout,
			@NonNull Executor callbackExecutor) {
		CompletableFuture<Optional<SigningEntity>> result = new CompletableFuture<>();
		CompletableFuture
				.supplyAsync(() -> retrieve(registry, packageIdentity,
						version, timeout), WorkQueue.getExecutor())
				.thenCompose(retrieved -> retrieved)
				.thenCompose(metadata -> decide(registry, packageIdentity,
						version, metadata, content, config, timeout))
				.thenCompose(decision -> reconcile(registry, packageIdentity,
						version, decision))
				.whenCompleteAsync((decision, failure) -> {
					if (failure != null) {
						result.completeExceptionally(
								TrustPolicy.unwrap(failure));
					} else if (decision.isAccepted()) {
						result.complete(Optional
								.ofNullable(decision.getSigningEntity()));
					} else {
						result.completeExceptionally(decision.getRejection());
					}
				}, callbackExecutor);
		return result;
	}

	private CompletableFuture<PackageVersionMetadata> retrieve(
			Registry registry, PackageIdentity packageIdentity,
			Version version, Duration timeout) {
		CompletableFuture<PackageVersionMetadata> metadata;
		try {
			metadata = metadataProvider.getMetadata(registry,
					packageIdentity, version, timeout);
		} catch (RuntimeException e) {
			metadata = CompletableFuture.failedFuture(e);
		}
		CompletableFuture<PackageVersionMetadata> retrieved = new CompletableFuture<>();
		metadata.whenComplete((m, failure) -> {
			if (failure != null || m == null) {
				retrieved.completeExceptionally(
						new FailedRetrievingSignatureException(registry,
								packageIdentity, version,
								failure != null ? TrustPolicy.unwrap(failure)
										: null));
			} else {
				retrieved.complete(m);
			}
		});
		return retrieved;
	}

	private CompletableFuture<TrustDecision> decide(Registry registry,
			PackageIdentity packageIdentity, Version version,
			PackageVersionMetadata metadata, byte[] content,
			SigningConfig config, Duration timeout) {
		DecodedSignature signature;
		VerifierConfiguration verifierConfig;
		try {
			signature = decoder.decode(registry, packageIdentity, version,
					metadata);
		} catch (SourceArchiveNotSignedException e) {
			LOG.info(MessageFormat.format(RelSigText.get().packageUnsigned,
					registry, packageIdentity, version));
			return trustPolicy.onUnsigned(config, registry, packageIdentity,
					version);
		} catch (SignatureValidationException e) {
			return CompletableFuture.failedFuture(e);
		}
		try {
			verifierConfig = verifierConfigurationBuilder.build(config);
		} catch (BadConfigurationException e) {
			return CompletableFuture.failedFuture(e);
		}
		SignatureProvider provider = signatureProvider != null
				? signatureProvider
				: SignatureProviders.get(signature.getFormat());
		if (provider == null) {
			return CompletableFuture.failedFuture(
					new SignatureVerificationFailedException(
							MessageFormat.format(
									RelSigText.get().noSignatureProvider,
									signature.getFormat()),
							registry, packageIdentity, version));
		}
		CompletableFuture<SignatureStatus> status;
		try {
			status = provider.status(signature.getSignature(), content,
					signature.getFormat(), verifierConfig, timeout);
		} catch (RuntimeException e) {
			status = CompletableFuture.failedFuture(e);
		}
		return status.handle((s, failure) -> {
			if (failure != null) {
				return CompletableFuture.<TrustDecision> failedFuture(
						new SignatureVerificationFailedException(
								TrustPolicy.unwrap(failure), registry,
								packageIdentity, version));
			}
			if (s == null) {
				return CompletableFuture.<TrustDecision> failedFuture(
						new SignatureVerificationFailedException(
								MessageFormat.format(
										RelSigText.get().noSignatureStatus,
										provider.getName()),
								registry, packageIdentity, version));
			}
			return s.accept(new StatusHandler(registry, packageIdentity,
					version, config));
		}).thenCompose(decision -> decision);
	}

	private CompletableFuture<TrustDecision> reconcile(Registry registry,
			PackageIdentity packageIdentity, Version version,
			TrustDecision decision) {
		CompletableFuture<?> ack;
		try {
			ack = signingEntityTofu.validate(registry, packageIdentity,
					version, decision.getSigningEntity());
		} catch (RuntimeException e) {
			ack = CompletableFuture.failedFuture(e);
		}
		if (ack == null) {
			return CompletableFuture.completedFuture(decision);
		}
		return ack.handle((ignored, failure) -> {
			if (failure != null) {
				LOG.warn(MessageFormat.format(RelSigText.get().tofuCheckFailed,
						registry, packageIdentity, version),
						TrustPolicy.unwrap(failure));
			}
			return decision;
		});
	}

	private class StatusHandler
			implements SignatureStatus.Visitor<CompletableFuture<TrustDecision>> {
		private final Registry registry;

		private final PackageIdentity packageIdentity;

		private final Version version;

		private final SigningConfig config;

		StatusHandler(Registry registry, PackageIdentity packageIdentity,
				Version version, SigningConfig config) {
			this.registry = registry;
			this.packageIdentity = packageIdentity;
			this.version = version;
			this.config = config;
		}

		@Override
		public CompletableFuture<TrustDecision> valid(
				SignatureStatus.Valid status) {
			LOG.info(MessageFormat.format(
					RelSigText.get().packageSignedWithValidEntity, registry,
					packageIdentity, version, status.getSigningEntity()));
			return CompletableFuture.completedFuture(
					TrustDecision.accepted(status.getSigningEntity()));
		}

		@Override
		public CompletableFuture<TrustDecision> invalid(
				SignatureStatus.Invalid status) {
			return CompletableFuture.failedFuture(
					new InvalidSignatureException(status.getReason(),
							registry, packageIdentity, version));
		}

		@Override
		public CompletableFuture<TrustDecision> certificateInvalid(
				SignatureStatus.CertificateInvalid status) {
			return CompletableFuture.failedFuture(
					new InvalidSigningCertificateException(status.getReason(),
							registry, packageIdentity, version));
		}

		@Override
		public CompletableFuture<TrustDecision> certificateNotTrusted(
				SignatureStatus.CertificateNotTrusted status) {
			LOG.info(MessageFormat.format(
					RelSigText.get().packageSignerUntrusted, registry,
					packageIdentity, version, status.getSigningEntity()));
			return trustPolicy.onUntrusted(config, status.getSigningEntity(),
					registry, packageIdentity, version);
		}
	}
}
