package org.stakenet.network.tls;

import java.security.cert.X509Certificate;
import javax.net.ssl.SSLSocket;

import org.stakenet.network.PeerId;

/** Result of a successful TLS upgrade: secured socket plus the remote's identity. */
public final class UpgradedConnection {

	private final SSLSocket socket;
	private final PeerId peerId;
	private final X509Certificate certificate;

	public UpgradedConnection(SSLSocket socket, PeerId peerId, X509Certificate certificate) {
		this.socket = socket;
		this.peerId = peerId;
		this.certificate = certificate;
	}

	public SSLSocket getSocket() {
		return this.socket;
	}

	public PeerId getPeerId() {
		return this.peerId;
	}

	public X509Certificate getCertificate() {
		return this.certificate;
	}

}
