package org.stakenet.network;

import java.util.HashMap;
import java.util.Map;

import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;

/** Point-in-time snapshot of network counters and gauges. */
@XmlAccessorType(XmlAccessType.FIELD)
public class NetworkStats {

	public int connectedPeers = 0;
	public int pendingPeers = 0;
	public int knownPeers = 0;
	public int benchedPeers = 0;
	public long handshakeFailures = 0;
	public long closedPeers = 0;
	public long droppedSends = 0;
	public long dialFailures = 0;
	public long inboundBytesInFlight = 0;
	public long outboundBytesInFlight = 0;
	/** Closed peers, keyed by CloseReason name */
	public Map<String, Long> closeReasons = new HashMap<>();
	/** Keyed by hex PeerId */
	public Map<String, Integer> sendQueueDepths = new HashMap<>();
	/** Keyed by hex PeerId */
	public Map<String, Double> uptimes = new HashMap<>();

	public NetworkStats() {
	}

}
