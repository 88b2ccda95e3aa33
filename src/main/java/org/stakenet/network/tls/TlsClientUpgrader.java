package org.stakenet.network.tls;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;

/** Client side of the TLS upgrade, used for dialled connections. */
public class TlsClientUpgrader extends TlsUpgrader {

	public TlsClientUpgrader(SSLContext sslContext) {
		super(sslContext);
	}

	@Override
	protected void configure(SSLSocket sslSocket) {
		sslSocket.setUseClientMode(true);
	}

}
