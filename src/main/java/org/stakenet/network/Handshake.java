package org.stakenet.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.message.Field;
import org.stakenet.network.message.Message;
import org.stakenet.network.message.Op;
import org.stakenet.version.Version;
import org.stakenet.version.VersionCompatibility;
import org.stakenet.version.VersionException;
import org.stakenet.version.VersionParser;

/**
 * Post-TLS handshake, as a chain of states.
 * <p>
 * Both sides send VERSION as soon as TLS completes, then wait for the other's VERSION.
 * A valid VERSION completes the handshake; anything invalid closes the peer with the matching {@link CloseReason}.
 * <p>
 * {@link #onMessage(Peer, Message)} returns the next state, or null if the peer has been closed.
 */
public enum Handshake {
	STARTED(null) {
		@Override
		public Handshake onMessage(Peer peer, Message message) {
			return VERSION;
		}

		@Override
		public void action(Peer peer) {
			/* Never called */
		}
	},
	VERSION(Op.VERSION) {
		@Override
		public Handshake onMessage(Peer peer, Message message) {
			return processVersionMessage(peer, message);
		}

		@Override
		public void action(Peer peer) {
			peer.sendVersion();
		}
	},
	COMPLETED(null) {
		@Override
		public Handshake onMessage(Peer peer, Message message) {
			// Should never be called
			return null;
		}

		@Override
		public void action(Peer peer) {
			/* Nothing to do */
		}
	};

	private static final Logger LOGGER = LogManager.getLogger(Handshake.class);

	public final Op expectedOp;

	Handshake(Op expectedOp) {
		this.expectedOp = expectedOp;
	}

	public abstract Handshake onMessage(Peer peer, Message message);

	public abstract void action(Peer peer);

	private static Handshake processVersionMessage(Peer peer, Message message) {
		Network network = peer.getNetwork();

		int peersNetworkId = message.getInt(Field.NETWORK_ID);
		if (peersNetworkId != network.getSettings().getNetworkId()) {
			peer.close(CloseReason.INCOMPATIBLE_NETWORK, String.format("network ID %d, ours %d", peersNetworkId, network.getSettings().getNetworkId()));
			return null;
		}

		long now = System.currentTimeMillis();
		long peersTime = message.getLong(Field.MY_TIME);
		long timestampDelta = Math.abs(peersTime - now);
		if (timestampDelta > network.getSettings().getMaxClockDifference()) {
			peer.close(CloseReason.CLOCK_SKEW, String.format("timestamp %d too divergent (± %d > %d) from ours %d",
					peersTime, timestampDelta, network.getSettings().getMaxClockDifference(), now));
			return null;
		}

		String versionString = message.getString(Field.VERSION_STR);
		Version peersVersion;
		try {
			peersVersion = VersionParser.parse(versionString);
		} catch (VersionException e) {
			peer.close(CloseReason.INCOMPATIBLE_VERSION, e.getMessage());
			return null;
		}

		VersionCompatibility.Result compatibility = network.getCompatibility().check(peersVersion, now);
		if (!compatibility.isAcceptable()) {
			peer.close(CloseReason.INCOMPATIBLE_VERSION, String.format("version %s, minimum %s", peersVersion, network.getCompatibility().getMinCompatible()));
			return null;
		}

		if (compatibility == VersionCompatibility.Result.DEPRECATED)
			LOGGER.info("[{}] Peer {} is running deprecated version {}", peer.getPeerConnectionId(), peer, peersVersion);

		peer.setPeersVersion(peersVersion);
		peer.setPeersTimestamp(peersTime);
		peer.setAdvertisedAddress(message.getString(Field.IP));

		return COMPLETED;
	}

}
