package org.stakenet.network.tls;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.PeerId;

import java.io.IOException;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketAddress;
import java.net.SocketTimeoutException;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.X509Certificate;
import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLPeerUnverifiedException;
import javax.net.ssl.SSLSocket;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManager;

/**
 * Shared TLS upgrade logic. Subclasses only decide which side of the handshake they play.
 */
public abstract class TlsUpgrader implements Upgrader {

	private static final Logger LOGGER = LogManager.getLogger(TlsUpgrader.class);

	private static final String[] PROTOCOLS = new String[] { "TLSv1.3", "TLSv1.2" };
	private static final String KEY_ALIAS = "node";
	// Only protects the in-memory keystore
	private static final char[] KEYSTORE_PASSWORD = "stakenet".toCharArray();

	private final SSLSocketFactory socketFactory;

	protected TlsUpgrader(SSLContext sslContext) {
		this.socketFactory = sslContext.getSocketFactory();
	}

	/** Builds a TLS context presenting our node certificate and accepting any valid peer certificate. */
	public static SSLContext createSslContext(NodeCredentials credentials) throws GeneralSecurityException {
		try {
			KeyStore keyStore = KeyStore.getInstance("PKCS12");
			keyStore.load(null, null);
			keyStore.setKeyEntry(KEY_ALIAS, credentials.getKeyPair().getPrivate(), KEYSTORE_PASSWORD,
					new Certificate[] { credentials.getCertificate() });

			KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
			kmf.init(keyStore, KEYSTORE_PASSWORD);

			SSLContext sslContext = SSLContext.getInstance("TLS");
			sslContext.init(kmf.getKeyManagers(), new TrustManager[] { new PeerTrustManager() }, new SecureRandom());
			return sslContext;
		} catch (IOException e) {
			throw new GeneralSecurityException("Unable to initialize in-memory keystore", e);
		}
	}

	/** Configures socket for our side of the handshake. */
	protected abstract void configure(SSLSocket sslSocket);

	@Override
	public UpgradedConnection upgrade(Socket socket, int timeout) throws IOException {
		SocketAddress remoteAddress = socket.getRemoteSocketAddress();
		String host = null;
		int port = socket.getPort();
		if (remoteAddress instanceof InetSocketAddress)
			host = ((InetSocketAddress) remoteAddress).getHostString();

		SSLSocket sslSocket = (SSLSocket) this.socketFactory.createSocket(socket, host, port, true);
		sslSocket.setEnabledProtocols(PROTOCOLS);
		configure(sslSocket);

		long deadline = System.currentTimeMillis() + timeout;
		int previousTimeout = socket.getSoTimeout();

		try {
			sslSocket.setSoTimeout(timeout);
			sslSocket.startHandshake();
			sslSocket.setSoTimeout(previousTimeout);
		} catch (IOException e) {
			if (isTimeout(e) || System.currentTimeMillis() >= deadline)
				throw new DeadlineExceededException(String.format("TLS handshake with %s not completed within %dms", remoteAddress, timeout), e);

			throw new HandshakeException(String.format("TLS handshake with %s failed: %s", remoteAddress, e.getMessage()), e);
		}

		if (System.currentTimeMillis() > deadline)
			throw new DeadlineExceededException(String.format("TLS handshake with %s not completed within %dms", remoteAddress, timeout));

		X509Certificate certificate = peerCertificate(sslSocket);
		PeerId peerId = PeerId.fromPublicKey(certificate.getPublicKey());

		LOGGER.trace("TLS {} handshake with {} completed: peer {}, {}", sslSocket.getUseClientMode() ? "client" : "server",
				remoteAddress, peerId, sslSocket.getSession().getProtocol());

		return new UpgradedConnection(sslSocket, peerId, certificate);
	}

	private static X509Certificate peerCertificate(SSLSocket sslSocket) throws HandshakeException {
		Certificate[] chain;
		try {
			chain = sslSocket.getSession().getPeerCertificates();
		} catch (SSLPeerUnverifiedException e) {
			throw new HandshakeException("Peer presented no certificate", e);
		}

		if (chain == null || chain.length == 0 || !(chain[0] instanceof X509Certificate))
			throw new HandshakeException("Peer presented no usable certificate");

		return (X509Certificate) chain[0];
	}

	private static boolean isTimeout(Throwable t) {
		for (Throwable cause = t; cause != null; cause = cause.getCause())
			if (cause instanceof SocketTimeoutException)
				return true;

		return false;
	}

}
