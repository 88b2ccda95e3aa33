package org.stakenet.test.network.tls;

import org.junit.Test;
import org.stakenet.network.PeerId;
import org.stakenet.network.tls.CertificateUtils;
import org.stakenet.network.tls.DeadlineExceededException;
import org.stakenet.network.tls.HandshakeException;
import org.stakenet.network.tls.NodeCredentials;
import org.stakenet.network.tls.TlsClientUpgrader;
import org.stakenet.network.tls.TlsServerUpgrader;
import org.stakenet.network.tls.TlsUpgrader;
import org.stakenet.network.tls.UpgradedConnection;
import org.stakenet.test.common.NetworkTestUtils;

import java.io.IOException;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import static org.junit.Assert.*;

public class TlsUpgraderTests {

	private static final int TIMEOUT = 5000; // ms

	@Test
	public void testPeerIdsFromCertificates() throws Exception {
		NodeCredentials serverCredentials = NetworkTestUtils.credentials();
		NodeCredentials clientCredentials = NetworkTestUtils.credentials();

		TlsServerUpgrader serverUpgrader = new TlsServerUpgrader(TlsUpgrader.createSslContext(serverCredentials));
		TlsClientUpgrader clientUpgrader = new TlsClientUpgrader(TlsUpgrader.createSslContext(clientCredentials));

		try (ServerSocket serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress())) {
			CompletableFuture<UpgradedConnection> serverSide = CompletableFuture.supplyAsync(() -> {
				try {
					Socket socket = serverSocket.accept();
					return serverUpgrader.upgrade(socket, TIMEOUT);
				} catch (IOException e) {
					throw new IllegalStateException(e);
				}
			});

			Socket socket = new Socket(InetAddress.getLoopbackAddress(), serverSocket.getLocalPort());
			UpgradedConnection clientSide = clientUpgrader.upgrade(socket, TIMEOUT);
			UpgradedConnection upgradedServerSide = serverSide.get(TIMEOUT, TimeUnit.MILLISECONDS);

			try {
				// Each side identifies the other by its certificate's public key
				assertEquals(serverCredentials.getPeerId(), clientSide.getPeerId());
				assertEquals(clientCredentials.getPeerId(), upgradedServerSide.getPeerId());

				// Application data flows over the upgraded sockets
				OutputStream out = clientSide.getSocket().getOutputStream();
				out.write("hello".getBytes(StandardCharsets.UTF_8));
				out.flush();

				byte[] received = upgradedServerSide.getSocket().getInputStream().readNBytes(5);
				assertEquals("hello", new String(received, StandardCharsets.UTF_8));
			} finally {
				clientSide.getSocket().close();
				upgradedServerSide.getSocket().close();
			}
		}
	}

	@Test
	public void testHandshakeDeadline() throws Exception {
		TlsClientUpgrader clientUpgrader = new TlsClientUpgrader(TlsUpgrader.createSslContext(NetworkTestUtils.credentials()));

		try (ServerSocket serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
				Socket socket = new Socket(InetAddress.getLoopbackAddress(), serverSocket.getLocalPort());
				// Accepted but never answers
				Socket silent = serverSocket.accept()) {
			try {
				clientUpgrader.upgrade(socket, 300);
				fail("Expected DeadlineExceededException");
			} catch (DeadlineExceededException e) {
				// expected
			}
		}
	}

	@Test
	public void testNonTlsPeerRejected() throws Exception {
		TlsClientUpgrader clientUpgrader = new TlsClientUpgrader(TlsUpgrader.createSslContext(NetworkTestUtils.credentials()));

		try (ServerSocket serverSocket = new ServerSocket(0, 1, InetAddress.getLoopbackAddress());
				Socket socket = new Socket(InetAddress.getLoopbackAddress(), serverSocket.getLocalPort())) {
			CompletableFuture<Void> garbage = CompletableFuture.runAsync(() -> {
				try (Socket accepted = serverSocket.accept()) {
					accepted.getOutputStream().write("this is not a TLS record at all\r\n\r\n".getBytes(StandardCharsets.US_ASCII));
					accepted.getOutputStream().flush();
					// Give client time to read before closing
					Thread.sleep(500L);
				} catch (IOException e) {
					throw new IllegalStateException(e);
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			});

			try {
				clientUpgrader.upgrade(socket, TIMEOUT);
				fail("Expected HandshakeException");
			} catch (HandshakeException e) {
				// expected
			}

			garbage.get(TIMEOUT, TimeUnit.MILLISECONDS);
		}
	}

	@Test
	public void testCredentialsSaveAndLoad() throws Exception {
		Path directory = Files.createTempDirectory("stakenet-tls");
		Path certPath = directory.resolve("node.crt");
		Path keyPath = directory.resolve("node.key");

		try {
			NodeCredentials created = CertificateUtils.loadOrCreate(certPath, keyPath);
			assertTrue(Files.exists(certPath));
			assertTrue(Files.exists(keyPath));

			NodeCredentials loaded = CertificateUtils.loadOrCreate(certPath, keyPath);
			assertEquals(created.getPeerId(), loaded.getPeerId());
			assertEquals(created.getCertificate(), loaded.getCertificate());
		} finally {
			Files.deleteIfExists(certPath);
			Files.deleteIfExists(keyPath);
			Files.deleteIfExists(directory);
		}
	}

	@Test
	public void testPeerIdFormat() throws Exception {
		PeerId peerId = NetworkTestUtils.credentials().getPeerId();

		assertEquals(PeerId.LENGTH, peerId.getBytes().length);
		assertEquals(2 * PeerId.LENGTH, peerId.toString().length());
		assertEquals(peerId, PeerId.fromHex(peerId.toString()));
	}

	@Test(expected = IllegalArgumentException.class)
	public void testMismatchedCredentials() throws Exception {
		NodeCredentials one = NetworkTestUtils.credentials();
		NodeCredentials two = NetworkTestUtils.credentials();

		new NodeCredentials(one.getKeyPair(), two.getCertificate());
	}

}
