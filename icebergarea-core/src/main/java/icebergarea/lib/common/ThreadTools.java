/*-
 * #%L
 * This file is part of IcebergArea.
 * %%
 * Copyright (C) 2024 IcebergArea developers
 * %%
 * IcebergArea is free software: you can redistribute it and/or modify
 * it under the terms of the GNU General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 * 
 * IcebergArea is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Public License for more details.
 * 
 * You should have received a copy of the GNU General Public License 
 * along with IcebergArea.  If not, see <https://www.gnu.org/licenses/>.
 * #L%
 */

package icebergarea.lib.common;

import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * Create thread factories and pools that support adding a prefix to the thread name and setting daemon status.
 * <p>
 * Named threads make it much easier to see which channel is being processed when debugging or profiling.
 */
public class ThreadTools {
	
	private ThreadTools() {
		throw new AssertionError();
	}
	
	/**
	 * Create a named thread factory with a specified priority.
	 * 
	 * @param prefix prefix for the thread names; a counter is appended
	 * @param daemon true if threads should be daemon threads
	 * @param priority requested thread priority (clipped to the valid range)
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon, int priority) {
		return new SimpleThreadFactory(prefix, daemon, priority);
	}
	
	/**
	 * Create a named thread factory with {@code Thread.NORM_PRIORITY}.
	 * 
	 * @param prefix
	 * @param daemon
	 * @return
	 */
	public static ThreadFactory createThreadFactory(String prefix, boolean daemon) {
		return createThreadFactory(prefix, daemon, Thread.NORM_PRIORITY);
	}
	
	/**
	 * Create a fixed-size pool using named daemon threads.
	 * The caller is responsible for shutting down the pool.
	 * 
	 * @param prefix
	 * @param nThreads
	 * @return
	 */
	public static ExecutorService createFixedThreadPool(String prefix, int nThreads) {
		return Executors.newFixedThreadPool(Math.max(1, nThreads), createThreadFactory(prefix, true));
	}
	
	
	static class SimpleThreadFactory implements ThreadFactory {
		
		private final ThreadGroup group;
		private final AtomicInteger threadNumber = new AtomicInteger(1);
		private final String prefix;
		private final boolean daemon;
		private final int priority;
	
		SimpleThreadFactory(final String prefix, final boolean daemon, final int priority) {
			this.group = Thread.currentThread().getThreadGroup();
			this.prefix = prefix;
			this.daemon = daemon;
			this.priority = Math.max(Thread.MIN_PRIORITY, Math.min(Thread.MAX_PRIORITY, priority));
		}
	
		@Override
		public Thread newThread(Runnable r) {
			String name = prefix + threadNumber.getAndIncrement();
			Thread t = new Thread(group, r, name, 0);
			t.setDaemon(daemon);
			if (t.getPriority() != priority)
				t.setPriority(priority);
			return t;
		}
		
	}
	
}
