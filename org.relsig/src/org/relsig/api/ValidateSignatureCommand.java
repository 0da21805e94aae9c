/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.api;

import java.text.MessageFormat;
import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.Callable;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicBoolean;

import org.relsig.annotations.NonNull;
import org.relsig.errors.BadConfigurationException;
import org.relsig.errors.SignatureValidationException;
import org.relsig.errors.SignatureVerificationFailedException;
import org.relsig.internal.RelSigText;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.SecurityConfig;
import org.relsig.lib.SigningConfig;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.Version;
import org.relsig.signing.SignatureValidation;

/**
 * Validates the signature of one downloaded package release.
 * <p>
 * Collects the arguments, then runs a {@link SignatureValidation} either
 * blocking ({@link #call()}) or asynchronously ({@link #start()}). Each
 * command object can be run only once.
 *
 * <pre>
 * Optional&lt;SigningEntity&gt; signer = new ValidateSignatureCommand(validation)
 * 		.setRegistry(registry).setPackage(PackageIdentity.parse("mona.LinkedList"))
 * 		.setVersion(Version.parse("1.1.1")).setContent(archive)
 * 		.setSecurityConfig(securityConfig).call();
 * </pre>
 */
public class ValidateSignatureCommand
		implements Callable<Optional<SigningEntity>> {
	private final SignatureValidation validation;

	private final AtomicBoolean callable = new AtomicBoolean(true);

	private Registry registry;

	private PackageIdentity packageIdentity;

	private Version version;

	private byte[] content;

	private SigningConfig signingConfig;

	private SecurityConfig securityConfig;

	private Duration timeout;

	private Executor callbackExecutor = Runnable::run;

	/**
	 * Creates a new command.
	 *
	 * @param validation
	 *            to run
	 */
	public ValidateSignatureCommand(@NonNull SignatureValidation validation) {
		this.validation = validation;
	}

	/**
	 * Sets the registry the package comes from.
	 *
	 * @param registry
	 *            the registry
	 * @return {@code this}
	 */
	public ValidateSignatureCommand setRegistry(@NonNull Registry registry) {
		checkCallable();
		this.registry = registry;
		return this;
	}

	/**
	 * Sets the package to validate.
	 *
	 * @param packageIdentity
	 *            the package
	 * @return {@code this}
	 */
	public ValidateSignatureCommand setPackage(
			@NonNull PackageIdentity packageIdentity) {
		checkCallable();
		this.packageIdentity = packageIdentity;
		return this;
	}

	/**
	 * Sets the release to validate.
	 *
	 * @param version
	 *            the version
	 * @return {@code this}
	 */
	public ValidateSignatureCommand setVersion(@NonNull Version version) {
		checkCallable();
		this.version = version;
		return this;
	}

	/**
	 * Sets the downloaded source archive the signature is for.
	 *
	 * @param content
	 *            archive bytes
	 * @return {@code this}
	 */
	public ValidateSignatureCommand setContent(@NonNull byte[] content) {
		checkCallable();
		this.content = content;
		return this;
	}

	/**
	 * Sets the signing configuration to apply as is. Takes precedence over a
	 * {@link #setSecurityConfig(SecurityConfig) security configuration}.
	 *
	 * @param config
	 *            signing configuration
	 * @return {@code this}
	 */
	public ValidateSignatureCommand setSigningConfig(SigningConfig config) {
		checkCallable();
		this.signingConfig = config;
		return this;
	}

	/**
	 * Sets the security configuration to resolve the signing configuration
	 * for the registry and package from.
	 *
	 * @param config
	 *            security configuration
	 * @return {@code this}
	 */
	public ValidateSignatureCommand setSecurityConfig(SecurityConfig config) {
		checkCallable();
		this.securityConfig = config;
		return this;
	}

	/**
	 * Sets a timeout hint for retrieval and verification.
	 *
	 * @param timeout
	 *            the hint, {@code null} for none
	 * @return {@code this}
	 */
	public ValidateSignatureCommand setTimeout(Duration timeout) {
		checkCallable();
		this.timeout = timeout;
		return this;
	}

	/**
	 * Sets the executor the result of {@link #start()} is completed on. By
	 * default it is completed on the thread that finished the validation.
	 *
	 * @param executor
	 *            for completion
	 * @return {@code this}
	 */
	public ValidateSignatureCommand setCallbackExecutor(
			@NonNull Executor executor) {
		checkCallable();
		this.callbackExecutor = executor;
		return this;
	}

	/**
	 * Starts the validation.
	 *
	 * @return a future completing with the signing entity to trust, empty if
	 *         the release was accepted without one, or exceptionally with a
	 *         {@link SignatureValidationException}
	 * @throws BadConfigurationException
	 *             if the security configuration has invalid values
	 */
	public CompletableFuture<Optional<SigningEntity>> start()
			throws BadConfigurationException {
		checkCallable();
		require(registry, "registry"); //$NON-NLS-1$
		require(packageIdentity, "package"); //$NON-NLS-1$
		require(version, "version"); //$NON-NLS-1$
		require(content, "content"); //$NON-NLS-1$
		SigningConfig config = signingConfig;
		if (config == null) {
			require(securityConfig, "signing configuration"); //$NON-NLS-1$
			try {
				config = securityConfig.getSigning(registry, packageIdentity);
			} catch (IllegalArgumentException e) {
				throw new BadConfigurationException(e.getMessage(), e);
			}
		}
		setCallable(false);
		return validation.validate(registry, packageIdentity, version,
				content, config, timeout, callbackExecutor);
	}

	/**
	 * Runs the validation and waits for its result.
	 *
	 * @return the signing entity to trust, empty if the release was accepted
	 *         without one
	 * @throws SignatureValidationException
	 *             if validation failed or the release was rejected
	 * @throws InterruptedException
	 *             if interrupted while waiting
	 */
	@Override
	public Optional<SigningEntity> call()
			throws SignatureValidationException, InterruptedException {
		CompletableFuture<Optional<SigningEntity>> result = start();
		try {
			return result.get();
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof SignatureValidationException) {
				throw (SignatureValidationException) cause;
			}
			throw new SignatureVerificationFailedException(cause, registry,
					packageIdentity, version);
		}
	}

	private void require(Object value, String name) {
		if (value == null) {
			throw new IllegalArgumentException(MessageFormat.format(
					RelSigText.get().missingCommandArgument, name,
					getClass().getName()));
		}
	}

	/**
	 * Set's the state which tells whether this command can be called.
	 *
	 * @param callable
	 *            if {@code true} the command can be called
	 */
	protected void setCallable(boolean callable) {
		this.callable.set(callable);
	}

	/**
	 * Checks that the command can be called.
	 *
	 * @throws java.lang.IllegalStateException
	 *             if the command was already run
	 */
	protected void checkCallable() {
		if (!callable.get()) {
			throw new IllegalStateException(MessageFormat.format(
					RelSigText.get().commandWasCalledInTheWrongState,
					getClass().getName()));
		}
	}
}
