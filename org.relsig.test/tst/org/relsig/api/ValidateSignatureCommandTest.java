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

import static org.hamcrest.MatcherAssert.assertThat;
import static org.hamcrest.Matchers.containsString;
import static org.hamcrest.Matchers.instanceOf;
import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.time.Duration;
import java.util.Optional;
import java.util.concurrent.atomic.AtomicInteger;

import org.junit.Test;
import org.relsig.errors.BadConfigurationException;
import org.relsig.errors.SignatureVerificationFailedException;
import org.relsig.errors.SourceArchiveNotSignedException;
import org.relsig.junit.SignatureValidationTestCase;
import org.relsig.junit.TestMetadata;
import org.relsig.lib.Config;
import org.relsig.lib.SecurityConfig;
import org.relsig.lib.SigningConfig;
import org.relsig.lib.SigningEntity;
import org.relsig.lib.TrustAction;
import org.relsig.signing.SignatureStatus;

public class ValidateSignatureCommandTest extends SignatureValidationTestCase {

	private ValidateSignatureCommand command() {
		return new ValidateSignatureCommand(newValidation(null))
				.setRegistry(REGISTRY).setPackage(PACKAGE).setVersion(VERSION)
				.setContent(CONTENT);
	}

	private static SecurityConfig security(String text) throws Exception {
		Config c = new Config();
		c.fromText(text);
		return new SecurityConfig(c);
	}

	@Test
	public void testCallReturnsSigningEntity() throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		Optional<SigningEntity> entity = command()
				.setSigningConfig(SigningConfig.builder().build()).call();
		assertEquals(Optional.of(SIGNER), entity);
		assertEquals(1, tofu.getRecorded().size());
	}

	@Test
	public void testStartCompletesOnCallbackExecutor() throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		AtomicInteger callbacks = new AtomicInteger();
		Optional<SigningEntity> entity = await(command()
				.setSigningConfig(SigningConfig.builder().build())
				.setTimeout(Duration.ofSeconds(3)).setCallbackExecutor(r -> {
					callbacks.incrementAndGet();
					r.run();
				}).start());
		assertEquals(Optional.of(SIGNER), entity);
		assertEquals(1, callbacks.get());
		assertEquals(Duration.ofSeconds(3), metadataProvider.getLastTimeout());
	}

	@Test
	public void testCallThrowsValidationFailure() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		ValidateSignatureCommand cmd = command()
				.setSigningConfig(SigningConfig.builder()
						.setOnUnsigned(TrustAction.ERROR).build());
		SourceArchiveNotSignedException e = assertThrows(
				SourceArchiveNotSignedException.class, cmd::call);
		assertEquals(VERSION, e.getVersion());
	}

	@Test
	public void testProviderFailureIsReported() throws Exception {
		signatureProvider.setFailure(new IllegalStateException("crashed"));
		ValidateSignatureCommand cmd = command()
				.setSigningConfig(SigningConfig.builder().build());
		SignatureVerificationFailedException e = assertThrows(
				SignatureVerificationFailedException.class, cmd::call);
		assertThat(e.getCause(), instanceOf(IllegalStateException.class));
	}

	@Test
	public void testMissingArgument() {
		ValidateSignatureCommand cmd = new ValidateSignatureCommand(
				newValidation(null)).setRegistry(REGISTRY).setPackage(PACKAGE)
						.setContent(CONTENT)
						.setSigningConfig(SigningConfig.builder().build());
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class, cmd::start);
		assertThat(e.getMessage(), containsString("missing version"));
	}

	@Test
	public void testMissingSigningConfiguration() {
		assertThrows(IllegalArgumentException.class, command()::start);
	}

	@Test
	public void testCanOnlyBeCalledOnce() throws Exception {
		signatureProvider.setStatus(SignatureStatus.valid(SIGNER));
		ValidateSignatureCommand cmd = command()
				.setSigningConfig(SigningConfig.builder().build());
		cmd.call();
		assertThrows(IllegalStateException.class, cmd::call);
	}

	@Test
	public void testResolvesSecurityConfig() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		ValidateSignatureCommand cmd = command().setSecurityConfig(security(""
				+ "[signing]\n"
				+ "\tonUnsigned = error\n"
				+ "[package \"mona.LinkedList\"]\n"
				+ "\tonUnsigned = silentAllow\n"));
		assertEquals(Optional.empty(), cmd.call());
		assertTrue(warnings.getEvents().isEmpty());
	}

	@Test
	public void testSigningConfigWinsOverSecurityConfig() throws Exception {
		metadataProvider.setMetadata(TestMetadata.unsigned());
		ValidateSignatureCommand cmd = command()
				.setSecurityConfig(security("[signing]\n\tonUnsigned = error\n"))
				.setSigningConfig(SigningConfig.builder()
						.setOnUnsigned(TrustAction.WARN).build());
		assertEquals(Optional.empty(), cmd.call());
		assertEquals(1, warnings.getEvents().size());
	}

	@Test
	public void testBadSecurityConfigValue() throws Exception {
		ValidateSignatureCommand cmd = command()
				.setSecurityConfig(security("[signing]\n\tonUnsigned = maybe\n"));
		assertThrows(BadConfigurationException.class, cmd::start);
		assertEquals(0, metadataProvider.getCallCount());
	}
}
