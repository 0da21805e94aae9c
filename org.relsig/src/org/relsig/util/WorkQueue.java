/*
 * Copyright (C) 2024, The RelSig Authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */
package org.relsig.util;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.ThreadPoolExecutor;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Shared thread pool for asynchronous signature validation work.
 * <p>
 * Threads are daemons, so an idle pool never keeps the JVM alive.
 */
public class WorkQueue {
	private static final ThreadPoolExecutor executor;

	static {
		int threads = Math.max(2, Runtime.getRuntime().availableProcessors());
		executor = new ThreadPoolExecutor(threads, threads, 30,
				TimeUnit.SECONDS, new LinkedBlockingQueue<>(),
				new ThreadFactory() {
					private final AtomicInteger count = new AtomicInteger();

					@Override
					public Thread newThread(Runnable taskBody) {
						Thread thr = new Thread(taskBody,
								"RelSig-WorkQueue-" + count.incrementAndGet()); //$NON-NLS-1$
						thr.setContextClassLoader(null);
						thr.setDaemon(true);
						return thr;
					}
				});
		executor.allowCoreThreadTimeOut(true);
	}

	private WorkQueue() {
		// Static accessor only
	}

	/**
	 * Get the WorkQueue's executor
	 *
	 * @return the WorkQueue's executor
	 */
	public static ExecutorService getExecutor() {
		return executor;
	}
}
