package org.stakenet.network.tls;

import java.net.Socket;
import java.security.cert.CertificateException;
import java.security.cert.X509Certificate;
import javax.net.ssl.SSLEngine;
import javax.net.ssl.X509ExtendedTrustManager;

/**
 * Trusts any well-formed, currently valid certificate chain.
 * <p>
 * Nodes use self-signed certificates, so identity comes from the public key (see {@link org.stakenet.network.PeerId})
 * and any policy on which identities to accept is applied after the handshake.
 */
class PeerTrustManager extends X509ExtendedTrustManager {

	private static final X509Certificate[] NO_ISSUERS = new X509Certificate[0];

	@Override
	public void checkClientTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
		checkChain(chain);
	}

	@Override
	public void checkServerTrusted(X509Certificate[] chain, String authType, Socket socket) throws CertificateException {
		checkChain(chain);
	}

	@Override
	public void checkClientTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
		checkChain(chain);
	}

	@Override
	public void checkServerTrusted(X509Certificate[] chain, String authType, SSLEngine engine) throws CertificateException {
		checkChain(chain);
	}

	@Override
	public void checkClientTrusted(X509Certificate[] chain, String authType) throws CertificateException {
		checkChain(chain);
	}

	@Override
	public void checkServerTrusted(X509Certificate[] chain, String authType) throws CertificateException {
		checkChain(chain);
	}

	@Override
	public X509Certificate[] getAcceptedIssuers() {
		return NO_ISSUERS;
	}

	private static void checkChain(X509Certificate[] chain) throws CertificateException {
		if (chain == null || chain.length == 0)
			throw new CertificateException("Peer presented no certificate");

		// Throws if expired or not yet valid
		chain[0].checkValidity();
	}

}
