package org.stakenet.network.tls;

import java.security.KeyPair;
import java.security.cert.X509Certificate;
import java.util.Arrays;
import java.util.Objects;

import org.stakenet.network.PeerId;

/** This node's TLS key pair and matching self-signed certificate. */
public final class NodeCredentials {

	private final KeyPair keyPair;
	private final X509Certificate certificate;
	private final PeerId peerId;

	public NodeCredentials(KeyPair keyPair, X509Certificate certificate) {
		this.keyPair = Objects.requireNonNull(keyPair);
		this.certificate = Objects.requireNonNull(certificate);

		if (!Arrays.equals(certificate.getPublicKey().getEncoded(), keyPair.getPublic().getEncoded()))
			throw new IllegalArgumentException("Certificate does not match key pair");

		this.peerId = PeerId.fromPublicKey(certificate.getPublicKey());
	}

	public KeyPair getKeyPair() {
		return this.keyPair;
	}

	public X509Certificate getCertificate() {
		return this.certificate;
	}

	/** Identity other nodes will derive for us from our certificate. */
	public PeerId getPeerId() {
		return this.peerId;
	}

}
