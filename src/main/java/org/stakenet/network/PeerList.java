package org.stakenet.network;

import java.util.Collection;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Function;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * An immutable, thread-safe snapshot of connected Peers.
 * <p>
 * Provides map-based lookups by {@link PeerId}, plus the usual collection methods
 * so it can be iterated like a {@code List<Peer>}.
 */
public class PeerList implements Iterable<Peer> {

	private final List<Peer> peerList;
	private final Map<PeerId, Peer> peerMap;

	/** Creates an empty PeerList. */
	public PeerList() {
		this.peerList = Collections.emptyList();
		this.peerMap = Collections.emptyMap();
	}

	/**
	 * Creates a new immutable PeerList by taking a snapshot of passed peers.
	 * All peers must have completed TLS upgrade.
	 */
	public PeerList(Collection<Peer> sourcePeers) {
		this.peerList = List.copyOf(sourcePeers);
		this.peerMap = this.peerList.stream()
				.collect(Collectors.toUnmodifiableMap(Peer::getPeerId, Function.identity(), (existing, replacement) -> existing));
	}

	/** Returns peer with passed ID, or null if not present. */
	public Peer get(PeerId peerId) {
		if (peerId == null)
			return null;

		return this.peerMap.get(peerId);
	}

	public boolean contains(PeerId peerId) {
		return peerId != null && this.peerMap.containsKey(peerId);
	}

	public List<Peer> asList() {
		return this.peerList;
	}

	public Stream<Peer> stream() {
		return this.peerList.stream();
	}

	@Override
	public Iterator<Peer> iterator() {
		return this.peerList.iterator();
	}

	public int size() {
		return this.peerList.size();
	}

	public boolean isEmpty() {
		return this.peerList.isEmpty();
	}

}
