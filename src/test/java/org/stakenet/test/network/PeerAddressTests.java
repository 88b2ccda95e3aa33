package org.stakenet.test.network;

import org.junit.Test;
import org.stakenet.network.PeerAddress;

import static org.junit.Assert.*;

public class PeerAddressTests {

	@Test
	public void testUnroutable() {
		assertTrue(PeerAddress.fromString("0.0.0.0:9651", 0).isUnroutable());
		assertTrue(PeerAddress.fromString("127.0.0.1:9651", 0).isUnroutable());
		assertTrue(PeerAddress.fromString("[::]:9651", 0).isUnroutable());
		assertTrue(PeerAddress.fromString("[::1]:9651", 0).isUnroutable());
		assertTrue(PeerAddress.fromString("localhost:9651", 0).isUnroutable());

		assertFalse(PeerAddress.fromString("192.0.2.1:9651", 0).isUnroutable());
		assertFalse(PeerAddress.fromString("[2001:db8::1]:9651", 0).isUnroutable());
		assertFalse(PeerAddress.fromString("peer.example.com:9651", 0).isUnroutable());
	}

	@Test
	public void testWithPort() {
		PeerAddress address = PeerAddress.fromString("[2001:db8::1]:40123", 0).withPort(9651);

		assertEquals("[2001:db8::1]", address.getHost());
		assertEquals(9651, address.getPort());
		assertEquals(PeerAddress.fromString("[2001:db8::1]:9651", 0), address);
	}

}
