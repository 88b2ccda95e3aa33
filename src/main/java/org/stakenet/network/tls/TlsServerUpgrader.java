package org.stakenet.network.tls;

import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocket;

/** Server side of the TLS upgrade, used for accepted connections. Requires a client certificate. */
public class TlsServerUpgrader extends TlsUpgrader {

	public TlsServerUpgrader(SSLContext sslContext) {
		super(sslContext);
	}

	@Override
	protected void configure(SSLSocket sslSocket) {
		sslSocket.setUseClientMode(false);
		sslSocket.setNeedClientAuth(true);
	}

}
