package org.shirdrn.dm.medoids.common;

import java.util.concurrent.ThreadFactory;
import java.util.concurrent.atomic.AtomicInteger;

public class NamedThreadFactory implements ThreadFactory {

	private final String poolName;
	private final AtomicInteger threadNumber = new AtomicInteger(0);

	public NamedThreadFactory(String poolName) {
		super();
		this.poolName = poolName;
	}

	@Override
	public Thread newThread(Runnable r) {
		Thread t = new Thread(r, "POOL-" + poolName + "-" + threadNumber.incrementAndGet());
		t.setDaemon(true);
		return t;
	}

}
