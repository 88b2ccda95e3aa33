package org.stakenet.utils;

/**
 * Unit of work run on one of the network's executors.
 * <p>
 * Implementations name themselves so the running thread can be renamed while performing,
 * which makes thread dumps of a busy node readable.
 */
public interface Task {

	String getName();

	void perform() throws InterruptedException;

	/** Wraps task as a Runnable that renames the current thread and restores interrupt status. */
	static Runnable asRunnable(Task task) {
		return () -> {
			Thread thread = Thread.currentThread();
			String previousName = thread.getName();
			thread.setName(task.getName());

			try {
				task.perform();
			} catch (InterruptedException e) {
				thread.interrupt();
			} finally {
				thread.setName(previousName);
			}
		};
	}

}
