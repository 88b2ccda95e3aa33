package org.stakenet.network;

import com.google.common.net.HostAndPort;
import com.google.common.net.InetAddresses;

import java.net.Inet6Address;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.UnknownHostException;
import java.util.Locale;

/**
 * Convenience class for encapsulating/parsing/rendering/converting peer addresses
 * including late-stage resolving before actual use by a socket.
 */
public final class PeerAddress {

	private final String host;
	private final int port;

	private PeerAddress(String host, int port) {
		this.host = host;
		this.port = port;
	}

	/** Constructs new PeerAddress using remote address from passed connected socket, or null if not connected. */
	public static PeerAddress fromSocket(Socket socket) {
		if (!(socket.getRemoteSocketAddress() instanceof InetSocketAddress))
			return null;

		return fromSocketAddress((InetSocketAddress) socket.getRemoteSocketAddress());
	}

	public static PeerAddress fromSocketAddress(InetSocketAddress socketAddress) {
		InetAddress address = socketAddress.getAddress();
		if (address == null)
			return new PeerAddress(socketAddress.getHostString(), socketAddress.getPort());

		String host = InetAddresses.toAddrString(address);

		// Make sure we encapsulate IPv6 addresses in brackets
		if (address instanceof Inet6Address)
			host = "[" + host + "]";

		return new PeerAddress(host, socketAddress.getPort());
	}

	/**
	 * Constructs new PeerAddress using hostname or literal IP address and optional port.<br>
	 * Literal IPv6 addresses must be enclosed within square brackets.
	 * <p>
	 * Examples:
	 * <ul>
	 * <li>peer.example.com
	 * <li>peer.example.com:9651
	 * <li>192.0.2.1
	 * <li>192.0.2.1:9651
	 * <li>[2001:db8::1]
	 * <li>[2001:db8::1]:9651
	 * </ul>
	 * <p>
	 * Not allowed:
	 * <ul>
	 * <li>2001:db8::1
	 * <li>2001:db8::1:9651
	 * </ul>
	 */
	public static PeerAddress fromString(String addressString, int defaultPort) throws IllegalArgumentException {
		if (addressString == null || addressString.trim().isEmpty())
			throw new IllegalArgumentException("Peer address cannot be null or empty");

		String trimmed = addressString.trim();
		boolean isBracketed = trimmed.startsWith("[");

		// Attempt to parse string into host and port
		HostAndPort hostAndPort = HostAndPort.fromString(trimmed).withDefaultPort(defaultPort).requireBracketsForIPv6();

		String host = hostAndPort.getHost();
		if (host.isEmpty())
			throw new IllegalArgumentException("Empty host part");

		// Validate IP literals by attempting to convert to InetAddress, without DNS lookups
		if (host.contains(":") || host.matches("[0-9.]+"))
			InetAddresses.forString(host);

		int port = hostAndPort.getPort();
		if (port <= 0)
			throw new IllegalArgumentException("Invalid port in peer address: " + trimmed);

		// Make sure we encapsulate IPv6 addresses in brackets
		if (isBracketed)
			host = "[" + host + "]";

		return new PeerAddress(host, port);
	}

	// Getters

	/** Returns hostname or literal IP address, bracketed if IPv6 */
	public String getHost() {
		return this.host;
	}

	public int getPort() {
		return this.port;
	}

	/** Returns address with same host but different port. */
	public PeerAddress withPort(int port) {
		return new PeerAddress(this.host, port);
	}

	/** Returns true if host is a wildcard or loopback literal, or <tt>localhost</tt>, so unusable by other nodes. */
	public boolean isUnroutable() {
		String unbracketedHost = this.host;
		if (unbracketedHost.startsWith("[") && unbracketedHost.endsWith("]"))
			unbracketedHost = unbracketedHost.substring(1, unbracketedHost.length() - 1);

		if (unbracketedHost.equalsIgnoreCase("localhost"))
			return true;

		if (!InetAddresses.isInetAddress(unbracketedHost))
			return false;

		InetAddress address = InetAddresses.forString(unbracketedHost);
		return address.isAnyLocalAddress() || address.isLoopbackAddress();
	}

	// Conversions

	/** Returns InetSocketAddress for use with Socket.connect(), or throws UnknownHostException if address could not be resolved by DNS lookup. */
	public InetSocketAddress toSocketAddress() throws UnknownHostException {
		String unbracketedHost = this.host;
		if (unbracketedHost.startsWith("[") && unbracketedHost.endsWith("]"))
			unbracketedHost = unbracketedHost.substring(1, unbracketedHost.length() - 1);

		// Attempt to construct new InetSocketAddress with DNS lookups.
		// There's no control here over whether IPv6 or IPv4 will be used.
		InetSocketAddress socketAddress = new InetSocketAddress(unbracketedHost, this.port);

		if (socketAddress.isUnresolved())
			throw new UnknownHostException(this.host);

		return socketAddress;
	}

	@Override
	public String toString() {
		return this.host + ":" + this.port;
	}

	// Utilities

	/** Equal if other PeerAddress has same port and same case-insensitive host part, without DNS lookups */
	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof PeerAddress))
			return false;

		PeerAddress otherAddress = (PeerAddress) other;

		// Ports must match
		if (this.port != otherAddress.port)
			return false;

		// Compare host parts but without DNS lookups
		return this.host.equalsIgnoreCase(otherAddress.host);
	}

	@Override
	public int hashCode() {
		return 31 * this.host.toLowerCase(Locale.ROOT).hashCode() + this.port;
	}

}
