/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.console;

import java.io.BufferedReader;
import java.io.Console;
import java.io.IOException;
import java.io.PrintWriter;
import java.io.UncheckedIOException;
import java.text.MessageFormat;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;

import org.relsig.console.internal.ConsoleText;
import org.relsig.lib.PackageIdentity;
import org.relsig.lib.Registry;
import org.relsig.lib.Version;
import org.relsig.signing.SignatureValidationDelegate;
import org.relsig.util.StringUtils;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Asks the user on the text console whether to continue with an unsigned or
 * untrusted release.
 * <p>
 * Questions are asked one at a time on the given executor, never on the
 * thread requesting the decision. Unless an executor is given, each delegate
 * asks on its own daemon thread, apart from the validation
 * {@link org.relsig.util.WorkQueue}. Only "yes" or "y" continue; end of input
 * means no.
 */
public class ConsolePromptDelegate implements SignatureValidationDelegate {
	private static final Logger LOG = LoggerFactory
			.getLogger(ConsolePromptDelegate.class);

	/**
	 * Creates a delegate asking on the system console.
	 *
	 * @return a new delegate
	 * @throws IllegalStateException
	 *             if there is no system console
	 */
	public static ConsolePromptDelegate create() {
		Console cons = System.console();
		if (cons == null) {
			throw new IllegalStateException(
					ConsoleText.get().noSystemConsoleAvailable);
		}
		return new ConsolePromptDelegate(new BufferedReader(cons.reader()),
				cons.writer());
	}

	private static final AtomicInteger promptThreads = new AtomicInteger();

	private static ExecutorService newPromptExecutor() {
		return Executors.newSingleThreadExecutor(taskBody -> {
			Thread thr = new Thread(taskBody, "RelSig-ConsolePrompt-" //$NON-NLS-1$
					+ promptThreads.incrementAndGet());
			thr.setDaemon(true);
			return thr;
		});
	}

	private final Object lock = new Object();

	private final BufferedReader in;

	private final PrintWriter out;

	private final Executor executor;

	/**
	 * Creates a delegate asking on its own prompt thread.
	 *
	 * @param in
	 *            to read answers from
	 * @param out
	 *            to write questions to
	 */
	public ConsolePromptDelegate(BufferedReader in, PrintWriter out) {
		this(in, out, newPromptExecutor());
	}

	/**
	 * Creates a delegate.
	 *
	 * @param in
	 *            to read answers from
	 * @param out
	 *            to write questions to
	 * @param executor
	 *            to ask on
	 */
	public ConsolePromptDelegate(BufferedReader in, PrintWriter out,
			Executor executor) {
		this.in = in;
		this.out = out;
		this.executor = executor;
	}

	@Override
	public CompletableFuture<Boolean> onUnsigned(Registry registry,
			PackageIdentity packageIdentity, Version version) {
		String question = MessageFormat.format(
				ConsoleText.get().promptUnsigned, registry, packageIdentity,
				version);
		return CompletableFuture.supplyAsync(() -> ask(question), executor);
	}

	@Override
	public CompletableFuture<Boolean> onUntrusted(Registry registry,
			PackageIdentity packageIdentity, Version version) {
		String question = MessageFormat.format(
				ConsoleText.get().promptUntrusted, registry, packageIdentity,
				version);
		return CompletableFuture.supplyAsync(() -> ask(question), executor);
	}

	private Boolean ask(String question) {
		ConsoleText text = ConsoleText.get();
		synchronized (lock) {
			out.printf("%s [%s/%s]? ", question, text.answerYes, //$NON-NLS-1$
					text.answerNo);
			out.flush();
			String r;
			try {
				r = in.readLine();
			} catch (IOException e) {
				throw new UncheckedIOException(e);
			}
			if (r == null) {
				LOG.debug("End of input while asking: {}", question); //$NON-NLS-1$
				out.println();
				out.flush();
				return Boolean.FALSE;
			}
			r = r.trim();
			return Boolean.valueOf(StringUtils.equalsIgnoreCase(text.answerYes, r)
					|| StringUtils.equalsIgnoreCase(text.answerYesShort, r));
		}
	}
}
