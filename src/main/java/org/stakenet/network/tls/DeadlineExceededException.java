package org.stakenet.network.tls;

import java.io.IOException;

/**
 * Operation did not complete before its deadline.
 * <p>
 * Distinct from other I/O failures so callers can tell a slow remote from a broken one.
 */
@SuppressWarnings("serial")
public class DeadlineExceededException extends IOException {

	public DeadlineExceededException(String message) {
		super(message);
	}

	public DeadlineExceededException(String message, Throwable cause) {
		super(message, cause);
	}

}
