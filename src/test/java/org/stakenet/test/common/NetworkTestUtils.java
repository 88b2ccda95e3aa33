package org.stakenet.test.common;

import org.stakenet.network.Network;
import org.stakenet.network.Peer;
import org.stakenet.network.PeerAddress;
import org.stakenet.network.tls.CertificateUtils;
import org.stakenet.network.tls.NodeCredentials;
import org.stakenet.settings.NetworkSettings;

import java.security.GeneralSecurityException;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.CompletableFuture;
import java.util.function.BooleanSupplier;
import java.util.stream.Collectors;

public class NetworkTestUtils {

	public static final long WAIT_TIMEOUT = 10_000L; // ms

	/** Loopback settings, suitable for several networks in one JVM, with overrides applied. */
	public static NetworkSettings settings(Object... overrides) {
		Map<String, Object> values = new LinkedHashMap<>();
		values.put("bindAddress", "127.0.0.1");
		values.put("listenPort", 0);
		values.put("inboundConnectionCooldown", 0);
		values.put("connectToGossipedPeers", false);
		values.put("handshakeTimeout", 5000);
		values.put("dialRetryAttempts", 0);
		values.put("closeTimeout", 5000);

		if (overrides.length % 2 != 0)
			throw new IllegalArgumentException("Overrides must be name/value pairs");

		for (int i = 0; i < overrides.length; i += 2)
			values.put((String) overrides[i], overrides[i + 1]);

		String json = values.entrySet().stream()
				.map(entry -> "\"" + entry.getKey() + "\": " + toJson(entry.getValue()))
				.collect(Collectors.joining(", ", "{ ", " }"));

		return NetworkSettings.fromJson(json);
	}

	private static String toJson(Object value) {
		if (value instanceof String)
			return "\"" + value + "\"";

		return String.valueOf(value);
	}

	public static NodeCredentials credentials() {
		try {
			return CertificateUtils.generate();
		} catch (GeneralSecurityException e) {
			throw new AssertionError("Couldn't generate node credentials", e);
		}
	}

	public static Network startNetwork(NetworkSettings settings, RecordingHandler handler) throws Exception {
		Network network = new Network(settings, credentials(), handler);
		network.start();
		return network;
	}

	public static PeerAddress addressOf(Network network) {
		return PeerAddress.fromString("127.0.0.1:" + network.getListenPort(), 0);
	}

	public static CompletableFuture<Peer> connect(Network from, Network to) {
		return from.connect(addressOf(to));
	}

	/** Polls until condition holds, failing after {@link #WAIT_TIMEOUT}. */
	public static void waitFor(String description, BooleanSupplier condition) throws InterruptedException {
		long deadline = System.currentTimeMillis() + WAIT_TIMEOUT;

		while (!condition.getAsBoolean()) {
			if (System.currentTimeMillis() > deadline)
				throw new AssertionError("Timed out waiting for: " + description);

			Thread.sleep(20L);
		}
	}

}
