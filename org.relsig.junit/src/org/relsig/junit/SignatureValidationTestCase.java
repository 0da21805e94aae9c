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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.fail;

import java.io.File;
import java.io.IOException;
import java.net.URI;
import java.nio.file.Files;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

import org.junit.Before;
import org.junit.Rule;
import org.junit.rules.TemporaryFolder;
import org.relsig.events.ListenerList;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.Version;
import org.relsig.signing.SignatureValidation;
import org.relsig.signing.SignatureValidationDelegate;
import org.relsig.util.FileSystemReader;

/**
 * Base class for tests validating a package release against stub
 * collaborators.
 * <p>
 * Every test gets fresh stubs: a metadata provider, a signature provider, a
 * signing entity ledger and a listener recording warnings.
 */
public abstract class SignatureValidationTestCase {
	/** Registry releases come from. */
	protected static final Registry REGISTRY = new Registry(
			URI.create("https://packages.example.com")); //$NON-NLS-1$

	/** Package being validated. */
	protected static final PackageIdentity PACKAGE = PackageIdentity
			.parse("mona.LinkedList"); //$NON-NLS-1$

	/** Release being validated. */
	protected static final Version VERSION = Version.parse("1.1.1"); //$NON-NLS-1$

	/** Downloaded source archive. */
	protected static final byte[] CONTENT = "source archive" //$NON-NLS-1$
			.getBytes(UTF_8);

	/** Raw signature in stub metadata. */
	protected static final byte[] SIGNATURE = "signature".getBytes(UTF_8); //$NON-NLS-1$

	/** A signer. */
	protected static final SigningEntity SIGNER = SigningEntity.recognized(
			SigningEntity.Type.ADP, "J. Appleseed", "RelSig Test Unit", //$NON-NLS-1$ //$NON-NLS-2$
			"RelSig Test"); //$NON-NLS-1$

	/** Temporary directory, removed after each test. */
	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	/** Metadata provider of the validation. */
	protected StubMetadataProvider metadataProvider;

	/** Signature provider of the validation. */
	protected StubSignatureProvider signatureProvider;

	/** Ledger of the validation. */
	protected RecordingSigningEntityTofu tofu;

	/** Receives warnings of the validation. */
	protected RecordingWarningListener warnings;

	/** Listeners of the validation. */
	protected ListenerList listeners;

	/**
	 * Creates fresh stubs.
	 */
	@Before
	public void setUpStubs() {
		metadataProvider = new StubMetadataProvider();
		metadataProvider.setMetadata(TestMetadata.signed(SIGNATURE));
		signatureProvider = new StubSignatureProvider();
		tofu = new RecordingSigningEntityTofu();
		warnings = new RecordingWarningListener();
		listeners = new ListenerList();
		listeners.addSignatureWarningListener(warnings);
	}

	/**
	 * Creates a validation wired to the stubs.
	 *
	 * @param delegate
	 *            to ask, may be {@code null}
	 * @return the validation
	 */
	protected SignatureValidation newValidation(
			SignatureValidationDelegate delegate) {
		SignatureValidation validation = new SignatureValidation(
				metadataProvider, tofu, delegate, FileSystemReader.DETECTED,
				listeners);
		validation.setSignatureProvider(signatureProvider);
		return validation;
	}

	/**
	 * Creates a directory of trusted root files under the temporary folder.
	 *
	 * @param contents
	 *            content of each file, named {@code root-0.cer},
	 *            {@code root-1.cer} and so on
	 * @return the directory
	 * @throws IOException
	 *             if the files cannot be written
	 */
	protected File writeTrustedRoots(String... contents) throws IOException {
		File dir = tmp.newFolder("roots"); //$NON-NLS-1$
		for (int i = 0; i < contents.length; i++) {
			Files.write(new File(dir, "root-" + i + ".cer").toPath(), //$NON-NLS-1$ //$NON-NLS-2$
					contents[i].getBytes(UTF_8));
		}
		return dir;
	}

	/**
	 * Waits for a future to complete successfully.
	 *
	 * @param future
	 *            to wait for
	 * @return its value
	 * @throws Exception
	 *             the failure the future completed with
	 */
	protected static <T> T await(CompletableFuture<T> future)
			throws Exception {
		try {
			return future.get(10, TimeUnit.SECONDS);
		} catch (ExecutionException e) {
			Throwable cause = e.getCause();
			if (cause instanceof Exception) {
				throw (Exception) cause;
			}
			throw e;
		}
	}

	/**
	 * Waits for a future to fail.
	 *
	 * @param type
	 *            expected type of the failure
	 * @param future
	 *            to wait for
	 * @return the failure
	 * @throws InterruptedException
	 *             if interrupted while waiting
	 * @throws TimeoutException
	 *             if the future does not complete in time
	 */
	protected static <E extends Throwable> E awaitFailure(Class<E> type,
			CompletableFuture<?> future)
			throws InterruptedException, TimeoutException {
		try {
			Object value = future.get(10, TimeUnit.SECONDS);
			fail("Expected " + type.getName() + " but got " + value); //$NON-NLS-1$ //$NON-NLS-2$
			return null;
		} catch (ExecutionException e) {
			assertThat(e.getCause(), instanceOf(type));
			return type.cast(e.getCause());
		}
	}
}
