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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.sameInstance;
import static org.hamcrest.Matchers.startsWith;
import static org.junit.Assert.assertArrayEquals;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNotSame;
import static org.junit.Assert.assertTrue;

import java.io.File;
import java.io.IOException;
import java.time.Duration;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import org.relsig.errors.BadConfigurationException;
import org.relsig.errors.FailedRetrievingSignatureException;
import org.relsig.errors.InvalidSignatureException;
import org.relsig.errors.InvalidSigningCertificateException;
import org.relsig.errors.MissingConfigurationException;
import org.relsig.errors.MissingSourceArchiveException;
import org.relsig.errors.SignatureVerificationFailedException;
import org.relsig.errors.SignerNotTrustedException;
import org.relsig.errors.SourceArchiveNotSignedException;
import org.relsig.errors.UnknownSignatureFormatException;
import org.relsig.junit.RecordingDelegate;
import org.relsig.junit.SignatureValidationTestCase;
import org.relsig.junit.TestMetadata;
import org.relsig.lib.SigningConfig;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.TrustAction;

public class SignatureValidationTest extends SignatureValidationTestCase {

	private static final Executor DIRECT = Runnable::run;

	private static final Optional<SigningEntity> NONE = Optional.empty();

	private static SigningConfig config(TrustAction onUnsigned,
			TrustAction onUntrusted) {
		return SigningConfig.builder().setOnUnsigned(onUnsigned)
				.setOnUntrustedCertificate(onUntrusted).build();
	}

	private CompletableFuture<Optional<SigningEntity>> validate(
			SignatureValidation validation, SigningConfig config) {
		return validation.validate(REGISTRY, PACKAGE, VERSION, CONTENT,
				config, null, DIRECT);
	}

	private CompletableFuture<Optional<SigningEntity>> validate(
			SigningConfig config) {
		return validate(newValidation(null), config);
	}

	@Test
	public void testValidSignature() throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		Optional<SigningEntity> result = await(validate(
				config(TrustAction.ERROR, TrustAction.ERROR)));
		assertEquals(Optional.of(SIGNER), result);
		assertEquals(Collections.singletonList(Optional.of(SIGNER)),
				tofu.getRecorded());
		assertArrayEquals(SIGNATURE, signatureProvider.getLastSignature());
		assertArrayEquals(CONTENT, signatureProvider.getLastContent());
		assertTrue(warnings.getEvents().isEmpty());
	}

	@Test
	public void testValidSignatureNeedsNoPolicy() throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		assertEquals(Optional.of(SIGNER),
				await(validate(SigningConfig.builder().build())));
		assertEquals(1, tofu.getRecorded().size());
	}

	@Test
	public void testUnsignedWarn() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		assertEquals(NONE, await(validate(config(TrustAction.WARN, null))));
		assertEquals(1, warnings.getEvents().size());
		assertEquals(Collections.singletonList(NONE), tofu.getRecorded());
		assertEquals(0, signatureProvider.getCallCount());
	}

	@Test
	public void testFailingWarningListenerDoesNotStopValidation()
			throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		listeners.addSignatureWarningListener(event -> {
			throw new IllegalStateException("listener broke");
		});
		assertEquals(NONE, await(validate(config(TrustAction.WARN, null))));
		assertEquals(1, warnings.getEvents().size());
		assertEquals(Collections.singletonList(NONE), tofu.getRecorded());
	}

	@Test
	public void testUnsignedSilentAllow() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		assertEquals(NONE,
				await(validate(config(TrustAction.SILENT_ALLOW, null))));
		assertTrue(warnings.getEvents().isEmpty());
		assertEquals(Collections.singletonList(NONE), tofu.getRecorded());
	}

	@Test
	public void testUnsignedError() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		awaitFailure(SourceArchiveNotSignedException.class,
				validate(config(TrustAction.ERROR, null)));
		assertEquals(Collections.singletonList(NONE), tofu.getRecorded());
	}

	@Test
	public void testUnsignedPrompt() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		RecordingDelegate yes = new RecordingDelegate(true);
		assertEquals(NONE, await(validate(newValidation(yes),
				config(TrustAction.PROMPT, null))));
		assertEquals(1, yes.getUnsignedCount());
		assertEquals(0, yes.getUntrustedCount());

		RecordingDelegate no = new RecordingDelegate(false);
		awaitFailure(SourceArchiveNotSignedException.class, validate(
				newValidation(no), config(TrustAction.PROMPT, null)));
		assertEquals(1, no.getUnsignedCount());
		assertEquals(2, tofu.getRecorded().size());
	}

	@Test
	public void testUnsignedPromptWithoutDelegate() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		awaitFailure(BadConfigurationException.class,
				validate(config(TrustAction.PROMPT, null)));
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testUnsignedWithoutPolicy() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		awaitFailure(MissingConfigurationException.class,
				validate(config(null, TrustAction.ERROR)));
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testUntrustedError() throws Exception {
		signatureProvider
				.setStatus(SignatureStatus.certificateNotTrusted(SIGNER));
		SignerNotTrustedException e = awaitFailure(
				SignerNotTrustedException.class,
				validate(config(null, TrustAction.ERROR)));
		assertEquals(SIGNER, e.getSigningEntity());
		assertEquals(Collections.singletonList(NONE), tofu.getRecorded());
	}

	@Test
	public void testUntrustedWarn() throws Exception {
		signatureProvider
				.setStatus(SignatureStatus.certificateNotTrusted(SIGNER));
		assertEquals(NONE, await(validate(config(null, TrustAction.WARN))));
		assertEquals(1, warnings.getEvents().size());
		assertEquals(Collections.singletonList(NONE), tofu.getRecorded());
	}

	@Test
	public void testUntrustedPromptAccepted() throws Exception {
		signatureProvider
				.setStatus(SignatureStatus.certificateNotTrusted(SIGNER));
		RecordingDelegate yes = new RecordingDelegate(true);
		assertEquals(NONE, await(validate(newValidation(yes),
				config(null, TrustAction.PROMPT))));
		assertEquals(1, yes.getUntrustedCount());
		assertEquals(Collections.singletonList(NONE), tofu.getRecorded());
	}

	@Test
	public void testUntrustedPromptWithFailingDelegate() throws Exception {
		signatureProvider
				.setStatus(SignatureStatus.certificateNotTrusted(SIGNER));
		IOException failure = new IOException("closed");
		SignerNotTrustedException e = awaitFailure(
				SignerNotTrustedException.class,
				validate(newValidation(new RecordingDelegate(failure)),
						config(null, TrustAction.PROMPT)));
		assertThat(e.getCause(), sameInstance(failure));
	}

	@Test
	public void testUntrustedWithoutPolicy() throws Exception {
		signatureProvider
				.setStatus(SignatureStatus.certificateNotTrusted(SIGNER));
		awaitFailure(MissingConfigurationException.class,
				validate(config(TrustAction.ERROR, null)));
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testMissingSourceArchive() throws Exception {
		metadataProvider.setMetadata(TestMetadata.withoutSourceArchive());
		awaitFailure(MissingSourceArchiveException.class,
				validate(config(TrustAction.SILENT_ALLOW,
						TrustAction.SILENT_ALLOW)));
		assertTrue(tofu.getRecorded().isEmpty());
		assertEquals(0, signatureProvider.getCallCount());
	}

	@Test
	public void testUnknownFormat() throws Exception {
		metadataProvider.setMetadata(TestMetadata.signed("c2ln", "xyz"));
		UnknownSignatureFormatException e = awaitFailure(
				UnknownSignatureFormatException.class,
				validate(config(TrustAction.SILENT_ALLOW,
						TrustAction.SILENT_ALLOW)));
		assertEquals("xyz", e.getFormat());
		assertEquals(0, signatureProvider.getCallCount());
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testRetrievalFailure() throws Exception {
		IOException failure = new IOException("registry unavailable");
		metadataProvider.setFailure(failure);
		FailedRetrievingSignatureException e = awaitFailure(
				FailedRetrievingSignatureException.class,
				validate(config(TrustAction.SILENT_ALLOW,
						TrustAction.SILENT_ALLOW)));
		assertThat(e.getCause(), sameInstance(failure));
		assertEquals(REGISTRY, e.getRegistry());
		assertEquals(PACKAGE, e.getPackageIdentity());
		assertEquals(VERSION, e.getVersion());
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testInvalidSignature() throws Exception {
		signatureProvider.setStatus(SignatureStatus.invalid("mismatch"));
		InvalidSignatureException e = awaitFailure(
				InvalidSignatureException.class,
				validate(config(TrustAction.SILENT_ALLOW,
						TrustAction.SILENT_ALLOW)));
		assertEquals("mismatch", e.getReason());
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testInvalidCertificate() throws Exception {
		signatureProvider
				.setStatus(SignatureStatus.certificateInvalid("expired"));
		InvalidSigningCertificateException e = awaitFailure(
				InvalidSigningCertificateException.class,
				validate(config(TrustAction.SILENT_ALLOW,
						TrustAction.SILENT_ALLOW)));
		assertEquals("expired", e.getReason());
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testProviderFailure() throws Exception {
		IllegalStateException failure = new IllegalStateException("crashed");
		signatureProvider.setFailure(failure);
		SignatureVerificationFailedException e = awaitFailure(
				SignatureVerificationFailedException.class,
				validate(config(TrustAction.SILENT_ALLOW,
						TrustAction.SILENT_ALLOW)));
		assertThat(e.getCause(), sameInstance(failure));
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testProviderWithoutStatus() throws Exception {
		signatureProvider.setStatus(null);
		SignatureVerificationFailedException e = awaitFailure(
				SignatureVerificationFailedException.class,
				validate(config(TrustAction.SILENT_ALLOW,
						TrustAction.SILENT_ALLOW)));
		assertThat(e.getMessage(), containsString("stub returned no status"));
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testBadTrustRootConfiguration() throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		SigningConfig config = SigningConfig.builder()
				.setTrustedRootCertificatesPath("relative/roots").build();
		awaitFailure(BadConfigurationException.class, validate(config));
		assertEquals(0, signatureProvider.getCallCount());
		assertTrue(tofu.getRecorded().isEmpty());
	}

	@Test
	public void testTrustRootsPassedToProvider() throws Exception {
		File roots = writeTrustedRoots("one", "two");
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		await(validate(SigningConfig.builder()
				.setTrustedRootCertificatesPath(roots.getAbsolutePath())
				.setIncludeDefaultTrustedRootCertificates(Boolean.FALSE)
				.build()));
		List<byte[]> trusted = signatureProvider.getLastConfiguration()
				.getTrustedRoots();
		assertEquals(2, trusted.size());
		assertFalse(signatureProvider.getLastConfiguration()
				.isIncludeDefaultTrustStore());
	}

	@Test
	public void testLedgerFailureDoesNotChangeResult() throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		tofu.setFailure(new IllegalStateException("signer changed"));
		assertEquals(Optional.of(SIGNER), await(validate(config(null, null))));
		assertEquals(1, tofu.getRecorded().size());
	}

	@Test
	public void testTimeoutIsForwarded() throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		Duration timeout = Duration.ofSeconds(7);
		await(newValidation(null).validate(REGISTRY, PACKAGE, VERSION,
				CONTENT, config(null, null), timeout, DIRECT));
		assertEquals(timeout, metadataProvider.getLastTimeout());
		assertEquals(timeout, signatureProvider.getLastTimeout());
	}

	@Test
	public void testRunsOnWorkQueueAndCompletesOnCallbackExecutor()
			throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		AtomicInteger callbacks = new AtomicInteger();
		Executor executor = r -> {
			callbacks.incrementAndGet();
			r.run();
		};
		await(newValidation(null).validate(REGISTRY, PACKAGE, VERSION,
				CONTENT, config(null, null), null, executor));
		assertEquals(1, callbacks.get());
		assertNotSame(Thread.currentThread(),
				metadataProvider.getLastThread());
		assertThat(metadataProvider.getLastThread().getName(),
				startsWith("RelSig-WorkQueue-"));
	}

	@Test
	public void testRegisteredProviderIsUsedByDefault() throws Exception {
		SignatureValidation validation = new SignatureValidation(
				metadataProvider, tofu, null);
		InvalidSignatureException e = awaitFailure(
				InvalidSignatureException.class,
				validate(validation, config(null, null)));
		assertEquals(FixedSignatureProviderFactory.REASON, e.getReason());
	}
}
