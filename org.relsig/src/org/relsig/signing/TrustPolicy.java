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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;
import java.util.concurrent.ExecutionException;
import java.util.function.Supplier;

import org.relsig.annotations.Nullable;
import org.relsig.errors.BadConfigurationException;
import org.relsig.errors.MissingConfigurationException;
import org.relsig.errors.SignerNotTrustedException;
import org.relsig.errors.SourceArchiveNotSignedException;
import org.relsig.events.ListenerList;
import org.relsig.events.SignatureWarningEvent;
import org.relsig.internal.RelSigText;
import org.relsig.lib.ConfigConstants;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.SigningConfig;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.TrustAction;
import org.relsig.lib.Version;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Applies the configured {@link TrustAction}s to unsigned releases and to
 * releases signed by an untrusted signer.
 * <p>
 * Accepted releases never carry a signing entity: an untrusted signer is not
 * recorded. Configuration problems complete the returned future
 * exceptionally; refusals complete it with a rejected {@link TrustDecision}.
 */
public class TrustPolicy {
	private static final Logger LOG = LoggerFactory
			.getLogger(TrustPolicy.class);

	private final ListenerList listeners;

	private final SignatureValidationDelegate delegate;

	/**
	 * Creates a trust policy.
	 *
	 * @param listeners
	 *            to send warnings to
	 * @param delegate
	 *            to ask when the action is {@link TrustAction#PROMPT}, may be
	 *            {@code null}
	 */
	public TrustPolicy(ListenerList listeners,
			@Nullable SignatureValidationDelegate delegate) {
		this.listeners = listeners;
		this.delegate = delegate;
	}

	/**
	 * Decides about a release without signature.
	 *
	 * @param config
	 *            effective signing configuration
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package
	 * @param version
	 *            the release
	 * @return a future completing with the decision, or exceptionally with
	 *         {@link MissingConfigurationException} or
	 *         {@link BadConfigurationException}
	 */
	public CompletableFuture<TrustDecision> onUnsigned(SigningConfig config,
			Registry registry, PackageIdentity packageIdentity,
			Version version) {
		TrustAction action = config.getOnUnsigned();
		if (action == null) {
			return CompletableFuture.failedFuture(
					new MissingConfigurationException(
							ConfigConstants.SECURITY_SIGNING_PREFIX
									+ ConfigConstants.CONFIG_KEY_ON_UNSIGNED));
		}
		switch (action) {
		case PROMPT:
			if (delegate == null) {
				return promptWithoutDelegate(
						ConfigConstants.CONFIG_KEY_ON_UNSIGNED);
			}
			return ask(() -> delegate.onUnsigned(registry, packageIdentity,
					version), registry, packageIdentity, version)
							.thenApply(answer -> answer.accepted
									? TrustDecision.accepted(null)
									: TrustDecision.rejected(
											new SourceArchiveNotSignedException(
													registry, packageIdentity,
													version, answer.failure)));
		case ERROR:
			return CompletableFuture.completedFuture(TrustDecision.rejected(
					new SourceArchiveNotSignedException(registry,
							packageIdentity, version)));
		case WARN:
			warn(registry, packageIdentity, version,
					new SourceArchiveNotSignedException(registry,
							packageIdentity, version).getMessage());
			return CompletableFuture
					.completedFuture(TrustDecision.accepted(null));
		case SILENT_ALLOW:
		default:
			return CompletableFuture
					.completedFuture(TrustDecision.accepted(null));
		}
	}

	/**
	 * Decides about a release with a valid signature by an untrusted signer.
	 *
	 * @param config
	 *            effective signing configuration
	 * @param signingEntity
	 *            the untrusted signer
	 * @param registry
	 *            the package comes from
	 * @param packageIdentity
	 *            the package
	 * @param version
	 *            the release
	 * @return a future completing with the decision, or exceptionally with
	 *         {@link MissingConfigurationException} or
	 *         {@link BadConfigurationException}
	 */
	public CompletableFuture<TrustDecision> onUntrusted(SigningConfig config,
			SigningEntity signingEntity, Registry registry,
			PackageIdentity packageIdentity, Version version) {
		TrustAction action = config.getOnUntrustedCertificate();
		if (action == null) {
			return CompletableFuture
					.failedFuture(new MissingConfigurationException(
							ConfigConstants.SECURITY_SIGNING_PREFIX
									+ ConfigConstants.CONFIG_KEY_ON_UNTRUSTED_CERTIFICATE));
		}
		switch (action) {
		case PROMPT:
			if (delegate == null) {
				return promptWithoutDelegate(
						ConfigConstants.CONFIG_KEY_ON_UNTRUSTED_CERTIFICATE);
			}
			return ask(() -> delegate.onUntrusted(registry, packageIdentity,
					version), registry, packageIdentity, version)
							.thenApply(answer -> answer.accepted
									? TrustDecision.accepted(null)
									: TrustDecision.rejected(
											new SignerNotTrustedException(
													signingEntity, registry,
													packageIdentity, version,
													answer.failure)));
		case ERROR:
			return CompletableFuture.completedFuture(TrustDecision.rejected(
					new SignerNotTrustedException(signingEntity, registry,
							packageIdentity, version)));
		case WARN:
			warn(registry, packageIdentity, version,
					new SignerNotTrustedException(signingEntity, registry,
							packageIdentity, version).getMessage());
			return CompletableFuture
					.completedFuture(TrustDecision.accepted(null));
		case SILENT_ALLOW:
		default:
			return CompletableFuture
					.completedFuture(TrustDecision.accepted(null));
		}
	}

	private static CompletableFuture<TrustDecision> promptWithoutDelegate(
			String key) {
		return CompletableFuture.failedFuture(new BadConfigurationException(
				MessageFormat.format(
						RelSigText.get().badConfigurationPromptWithoutDelegate,
						ConfigConstants.SECURITY_SIGNING_PREFIX + key)));
	}

	private void warn(Registry registry, PackageIdentity packageIdentity,
			Version version, String message) {
		LOG.warn(message);
		try {
			listeners.dispatch(new SignatureWarningEvent(registry,
					packageIdentity, version, message));
		} catch (RuntimeException e) {
			LOG.warn(MessageFormat.format(
					RelSigText.get().warningListenerFailed, registry,
					packageIdentity, version), e);
		}
	}

	private static CompletableFuture<Answer> ask(
			Supplier<CompletableFuture<Boolean>> question, Registry registry,
			PackageIdentity packageIdentity, Version version) {
		CompletableFuture<Boolean> reply;
		try {
			reply = question.get();
		} catch (RuntimeException e) {
			reply = CompletableFuture.failedFuture(e);
		}
		if (reply == null) {
			return CompletableFuture.completedFuture(new Answer(false, null));
		}
		return reply.handle((accepted, failure) -> {
			if (failure != null) {
				Throwable cause = unwrap(failure);
				LOG.warn(MessageFormat.format(RelSigText.get().delegateFailed,
						registry, packageIdentity, version), cause);
				return new Answer(false, cause);
			}
			return new Answer(Boolean.TRUE.equals(accepted), null);
		});
	}

	static Throwable unwrap(Throwable t) {
		Throwable e = t;
		while ((e instanceof CompletionException
				|| e instanceof ExecutionException) && e.getCause() != null) {
			e = e.getCause();
		}
		return e;
	}

	private static class Answer {
		final boolean accepted;

		final Throwable failure;

		Answer(boolean accepted, Throwable failure) {
			this.accepted = accepted;
			this.failure = failure;
		}
	}
}
