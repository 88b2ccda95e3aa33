package org.stakenet.network;

import com.google.common.net.InetAddresses;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.benchlist.Benchlist;
import org.stakenet.benchlist.BenchlistListener;
import org.stakenet.network.message.Field;
import org.stakenet.network.message.Message;
import org.stakenet.network.message.MessageBuilder;
import org.stakenet.network.task.BenchlistSweepTask;
import org.stakenet.network.task.ChannelAcceptTask;
import org.stakenet.network.task.GossipTask;
import org.stakenet.network.task.PeerConnectTask;
import org.stakenet.network.task.PingTask;
import org.stakenet.network.throttling.ByteMessageThrottler;
import org.stakenet.network.throttling.InboundConnectionThrottler;
import org.stakenet.network.throttling.MessageThrottler;
import org.stakenet.network.tls.CertificateUtils;
import org.stakenet.network.tls.NodeCredentials;
import org.stakenet.network.tls.TlsClientUpgrader;
import org.stakenet.network.tls.TlsServerUpgrader;
import org.stakenet.network.tls.TlsUpgrader;
import org.stakenet.network.tls.Upgrader;
import org.stakenet.settings.NetworkSettings;
import org.stakenet.uptime.UptimeTracker;
import org.stakenet.utils.DaemonThreadFactory;
import org.stakenet.utils.Task;
import org.stakenet.version.Compatibility;
import org.stakenet.version.Version;
import org.stakenet.version.VersionException;
import org.stakenet.version.VersionParser;

import java.io.IOException;
import java.net.InetAddress;
import java.net.InetSocketAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.security.GeneralSecurityException;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.RejectedExecutionException;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.stream.Collectors;

import javax.net.ssl.SSLContext;

/**
 * Owns the listener, every peer connection and the periodic network tasks.
 * <p>
 * Pending peers (upgrading or handshaking) and connected peers are tracked under {@link #peersLock}.
 * Readers are served an immutable {@link PeerList} snapshot, rebuilt whenever the connected set changes.
 * No I/O is performed while holding the lock.
 */
public class Network implements AutoCloseable, BenchlistListener {

	private static final Logger LOGGER = LogManager.getLogger(Network.class);

	private final NetworkSettings settings;
	private final NodeCredentials credentials;
	private final PeerId ourPeerId;
	private final MessageHandler handler;
	private final Compatibility compatibility;

	private final Benchlist benchlist;
	private final UptimeTracker uptimeTracker;
	private final Dialer dialer;
	private final Upgrader serverUpgrader;
	private final Upgrader clientUpgrader;
	private final MessageThrottler inboundThrottler;
	private final MessageThrottler outboundThrottler;
	private final InboundConnectionThrottler inboundConnectionThrottler;

	// Peers

	private final Object peersLock = new Object();
	/** Peers still upgrading or handshaking */
	private final List<Peer> pendingPeers = new ArrayList<>();
	private final Map<PeerId, Peer> connectedPeers = new HashMap<>();
	/** Always rebuilt from connectedPeers, under peersLock */
	private volatile PeerList immutableConnectedPeers = new PeerList();

	/** Addresses learned from configuration, connections and gossip, oldest first */
	private final Set<PeerAddress> knownPeers = new LinkedHashSet<>();
	/** Outbound connections in progress, with dialled address */
	private final Map<CompletableFuture<Peer>, PeerAddress> dialling = new HashMap<>();

	// Stats

	private final AtomicLong handshakeFailures = new AtomicLong();
	private final AtomicLong closedPeers = new AtomicLong();
	private final AtomicLong droppedSends = new AtomicLong();
	private final AtomicLong dialFailures = new AtomicLong();
	private final Map<CloseReason, Long> closeReasons = new EnumMap<>(CloseReason.class);

	// Lifecycle

	private final ExecutorService peerExecutor;
	private final ScheduledExecutorService scheduler;
	private final AtomicBoolean started = new AtomicBoolean(false);
	private final AtomicBoolean closing = new AtomicBoolean(false);
	private volatile ServerSocket serverSocket;
	private Thread acceptThread;

	// Constructors

	/** Constructs network using node credentials from <tt>certificatePath</tt> and <tt>privateKeyPath</tt>, creating them if missing. */
	public Network(NetworkSettings settings, MessageHandler handler) throws IOException, GeneralSecurityException {
		this(settings, CertificateUtils.loadOrCreate(settings), handler);
	}

	/** Constructs network with default dialer, TLS upgraders, benchlist and throttlers built from <tt>settings</tt>. */
	public Network(NetworkSettings settings, NodeCredentials credentials, MessageHandler handler) throws GeneralSecurityException {
		this(settings, credentials, handler, TlsUpgrader.createSslContext(credentials));
	}

	private Network(NetworkSettings settings, NodeCredentials credentials, MessageHandler handler, SSLContext sslContext) {
		this(settings, credentials, handler,
				new Benchlist(settings.getBenchlistThreshold(), settings.getBenchlistWindow(), settings.getBenchlistDuration()),
				new TcpDialer(),
				new TlsServerUpgrader(sslContext),
				new TlsClientUpgrader(sslContext),
				new ByteMessageThrottler("inbound", settings.getInboundThrottlerBytes(), settings.getInboundThrottlerNodeMaxBytes()),
				new ByteMessageThrottler("outbound", settings.getOutboundThrottlerBytes(), settings.getOutboundThrottlerNodeMaxBytes()));
	}

	public Network(NetworkSettings settings, NodeCredentials credentials, MessageHandler handler,
			Benchlist benchlist, Dialer dialer, Upgrader serverUpgrader, Upgrader clientUpgrader,
			MessageThrottler inboundThrottler, MessageThrottler outboundThrottler) {
		this.settings = settings;
		this.credentials = credentials;
		this.ourPeerId = credentials.getPeerId();
		this.handler = handler;
		this.compatibility = buildCompatibility(settings);

		this.benchlist = benchlist;
		this.benchlist.addListener(this);
		this.uptimeTracker = new UptimeTracker(settings.getUptimeHalflife(), settings.getUptimeMaxSkippedIntervals());
		this.dialer = dialer;
		this.serverUpgrader = serverUpgrader;
		this.clientUpgrader = clientUpgrader;
		this.inboundThrottler = inboundThrottler;
		this.outboundThrottler = outboundThrottler;
		this.inboundConnectionThrottler = new InboundConnectionThrottler(settings.getInboundConnectionCooldown(), settings.getInboundConnectionMaxRecent());

		this.peerExecutor = Executors.newCachedThreadPool(new DaemonThreadFactory("Network-Peer"));
		this.scheduler = Executors.newSingleThreadScheduledExecutor(new DaemonThreadFactory("Network-Scheduler"));
	}

	private static Compatibility buildCompatibility(NetworkSettings settings) {
		try {
			Version current = VersionParser.parse(settings.getAppVersion());
			Version minCompatible = VersionParser.parse(settings.getMinCompatibleVersion());
			String prevMinCompatibleVersion = settings.getPrevMinCompatibleVersion();
			Version prevMinCompatible = prevMinCompatibleVersion != null ? VersionParser.parse(prevMinCompatibleVersion) : minCompatible;

			return new Compatibility(current, minCompatible, settings.getMinCompatibleTime(), prevMinCompatible);
		} catch (VersionException e) {
			throw new IllegalStateException("Invalid version in network settings", e);
		}
	}

	// Getters

	public NetworkSettings getSettings() {
		return this.settings;
	}

	public PeerId getOurPeerId() {
		return this.ourPeerId;
	}

	public NodeCredentials getCredentials() {
		return this.credentials;
	}

	public MessageHandler getHandler() {
		return this.handler;
	}

	public Compatibility getCompatibility() {
		return this.compatibility;
	}

	public Benchlist getBenchlist() {
		return this.benchlist;
	}

	public UptimeTracker getUptimeTracker() {
		return this.uptimeTracker;
	}

	public Dialer getDialer() {
		return this.dialer;
	}

	public Upgrader getServerUpgrader() {
		return this.serverUpgrader;
	}

	public Upgrader getClientUpgrader() {
		return this.clientUpgrader;
	}

	public MessageThrottler getInboundThrottler() {
		return this.inboundThrottler;
	}

	public MessageThrottler getOutboundThrottler() {
		return this.outboundThrottler;
	}

	public InboundConnectionThrottler getInboundConnectionThrottler() {
		return this.inboundConnectionThrottler;
	}

	public boolean isClosing() {
		return this.closing.get();
	}

	/** Actual bound port, which differs from settings when listening on port 0. Returns -1 if not listening. */
	public int getListenPort() {
		ServerSocket currentServerSocket = this.serverSocket;
		if (currentServerSocket == null)
			return -1;

		return currentServerSocket.getLocalPort();
	}

	/**
	 * Address sent to peers in our VERSION message over <tt>socket</tt>.
	 * <p>
	 * Uses <tt>publicAddress</tt> if configured. Otherwise a wildcard bind address is replaced by the connection's local address.
	 */
	public String getOurAdvertisedAddress(Socket socket) {
		String publicAddress = this.settings.getPublicAddress();
		if (publicAddress != null && !publicAddress.isEmpty())
			return publicAddress;

		int port = getListenPort();
		if (port < 0)
			port = this.settings.getListenPort();

		String host = this.settings.getBindAddress();
		if (isWildcardAddress(host) && socket != null) {
			InetAddress localAddress = socket.getLocalAddress();
			if (localAddress != null && !localAddress.isAnyLocalAddress())
				host = InetAddresses.toAddrString(localAddress);
		}

		if (host.contains(":"))
			host = "[" + host + "]";

		return host + ":" + port;
	}

	private static boolean isWildcardAddress(String host) {
		return InetAddresses.isInetAddress(host) && InetAddresses.forString(host).isAnyLocalAddress();
	}

	// Start-up

	/**
	 * Binds listener then starts accepting connections, the periodic tasks and connections to initial peers.
	 *
	 * @throws IOException if listener cannot be bound
	 */
	public void start() throws IOException {
		if (isClosing())
			throw new IllegalStateException("Network already closed");

		if (!this.started.compareAndSet(false, true))
			throw new IllegalStateException("Network already started");

		InetSocketAddress bindAddress = new InetSocketAddress(this.settings.getBindAddress(), this.settings.getListenPort());
		ServerSocket newServerSocket = new ServerSocket();
		try {
			newServerSocket.setReuseAddress(true);
			newServerSocket.bind(bindAddress);
		} catch (IOException e) {
			LOGGER.error("Can't bind listen socket to address {}", bindAddress);
			newServerSocket.close();
			throw e;
		}

		this.serverSocket = newServerSocket;
		LOGGER.info("Listening on {}:{} as peer {}", this.settings.getBindAddress(), getListenPort(), this.ourPeerId);

		this.acceptThread = new DaemonThreadFactory("Network-Accept").newThread(Task.asRunnable(new ChannelAcceptTask(this, newServerSocket)));
		this.acceptThread.start();

		scheduleTask(new GossipTask(this), this.settings.getGossipPeerListFreq());
		scheduleTask(new BenchlistSweepTask(this), this.settings.getBenchlistSweepInterval());
		scheduleTask(new PingTask(this), this.settings.getPingFrequency());

		for (String initialPeer : this.settings.getInitialPeers()) {
			PeerAddress address;
			try {
				address = PeerAddress.fromString(initialPeer, this.settings.getListenPort());
			} catch (IllegalArgumentException e) {
				LOGGER.warn("Ignoring invalid initial peer '{}'", initialPeer);
				continue;
			}

			addKnownPeer(address);
			connect(address);
		}
	}

	private void scheduleTask(Task task, long interval) {
		Runnable runnable = Task.asRunnable(task);

		this.scheduler.scheduleWithFixedDelay(() -> {
			try {
				runnable.run();
			} catch (RuntimeException e) {
				LOGGER.error(String.format("%s failed", task.getName()), e);
			}
		}, interval, interval, TimeUnit.MILLISECONDS);
	}

	// Inbound connections

	/** Called by accept loop for each accepted socket. */
	public void onInboundConnection(Socket socket) {
		PeerAddress address = PeerAddress.fromSocket(socket);

		String refusal = null;
		if (isClosing())
			refusal = "network closing";
		else if (!this.inboundConnectionThrottler.allow(socket.getInetAddress()))
			refusal = "connection attempted too soon";
		else
			synchronized (this.peersLock) {
				if (this.connectedPeers.size() + this.pendingPeers.size() >= this.settings.getMaxPeers())
					refusal = "too many peers";
			}

		if (refusal != null) {
			LOGGER.debug("Refusing inbound connection from {}: {}", address, refusal);
			closeQuietly(socket);
			return;
		}

		try {
			socket.setTcpNoDelay(true);
		} catch (IOException e) {
			LOGGER.debug("Couldn't configure inbound socket from {}: {}", address, e.getMessage());
		}

		Peer peer = new Peer(this, socket);
		if (!addPendingPeer(peer))
			return;

		LOGGER.debug("[{}] Accepted connection from {}", peer.getPeerConnectionId(), address);

		try {
			this.peerExecutor.execute(peer::upgrade);
		} catch (RejectedExecutionException e) {
			peer.close(CloseReason.NETWORK_SHUTDOWN, "network closing");
		}
	}

	private static void closeQuietly(Socket socket) {
		try {
			socket.close();
		} catch (IOException e) {
			LOGGER.debug("IOException while closing refused socket: {}", e.getMessage());
		}
	}

	// Outbound connections

	/**
	 * Connects to peer at <tt>address</tt>.
	 * <p>
	 * Returned future completes with the peer once CONNECTED, or fails with {@link PeerClosedException}
	 * (carrying the {@link CloseReason}) or the dial's {@link IOException}.
	 */
	public CompletableFuture<Peer> connect(PeerAddress address) {
		CompletableFuture<Peer> future = new CompletableFuture<>();

		if (isClosing()) {
			future.completeExceptionally(new PeerClosedException(CloseReason.NETWORK_SHUTDOWN, "network closing"));
			return future;
		}

		synchronized (this.peersLock) {
			this.dialling.put(future, address);
		}

		future.whenComplete((peer, e) -> {
			synchronized (this.peersLock) {
				this.dialling.remove(future);
			}
		});

		try {
			this.peerExecutor.execute(Task.asRunnable(new PeerConnectTask(this, address, future)));
		} catch (RejectedExecutionException e) {
			future.completeExceptionally(new PeerClosedException(CloseReason.NETWORK_SHUTDOWN, "network closing"));
		}

		return future;
	}

	/** Called by connect task when every dial attempt failed. */
	public void onDialFailed(PeerAddress address) {
		this.dialFailures.incrementAndGet();
	}

	/**
	 * Registers a new peer as pending and arms its handshake deadline.
	 *
	 * @return false if refused, in which case peer has been closed
	 */
	public boolean addPendingPeer(Peer peer) {
		boolean refused;
		synchronized (this.peersLock) {
			refused = isClosing();
			if (!refused)
				this.pendingPeers.add(peer);
		}

		if (refused) {
			peer.close(CloseReason.NETWORK_SHUTDOWN, "network closing");
			return false;
		}

		try {
			this.scheduler.schedule(() -> {
				if (!peer.isConnected() && !peer.isClosing())
					peer.close(CloseReason.HANDSHAKE_TIMEOUT, String.format("no handshake within %dms", this.settings.getHandshakeTimeout()));
			}, this.settings.getHandshakeTimeout(), TimeUnit.MILLISECONDS);
		} catch (RejectedExecutionException e) {
			peer.close(CloseReason.NETWORK_SHUTDOWN, "network closing");
			return false;
		}

		return true;
	}

	// Peer lifecycle callbacks

	/**
	 * Admission checks once peer's identity is known.
	 *
	 * @return reason to refuse peer, or null to proceed with handshake
	 */
	/* package */ CloseReason onPeerUpgraded(Peer peer) {
		PeerId peerId = peer.getPeerId();

		if (isClosing())
			return CloseReason.NETWORK_SHUTDOWN;

		if (peerId.equals(this.ourPeerId))
			return CloseReason.SELF_CONNECTION;

		if (this.benchlist.isBenched(peerId))
			return CloseReason.BENCHED;

		Peer supersededPeer = null;
		synchronized (this.peersLock) {
			if (this.connectedPeers.containsKey(peerId))
				return CloseReason.DUPLICATE;

			if (this.connectedPeers.size() >= this.settings.getMaxPeers())
				return CloseReason.MAX_PEERS;

			for (Peer otherPeer : this.pendingPeers) {
				if (otherPeer == peer || !peerId.equals(otherPeer.getPeerId()) || otherPeer.isClosing())
					continue;

				if (!prefersConnection(peer, otherPeer))
					return CloseReason.DUPLICATE;

				supersededPeer = otherPeer;
				break;
			}
		}

		if (supersededPeer != null) {
			LOGGER.debug("[{}] Dropping duplicate connection {} to {} in favour of {}",
					supersededPeer.getPeerConnectionId(), supersededPeer, peerId, peer);
			supersededPeer.close(CloseReason.DUPLICATE, "superseded by simultaneous connection");
		}

		return null;
	}

	/**
	 * Tie-break for simultaneous connections between the same two nodes:
	 * keep the connection dialled by the node with the smaller PeerId, so both ends keep the same one.
	 * Between connections in the same direction, the existing one wins.
	 */
	private boolean prefersConnection(Peer newPeer, Peer existingPeer) {
		if (newPeer.isOutbound() == existingPeer.isOutbound())
			return false;

		boolean weDialFirst = this.ourPeerId.compareTo(newPeer.getPeerId()) < 0;
		return newPeer.isOutbound() == weDialFirst;
	}

	/** Runs peer's read or write loop on the peer executor. */
	/* package */ void startPeerLoop(Peer peer, Task task) {
		try {
			this.peerExecutor.execute(Task.asRunnable(task));
		} catch (RejectedExecutionException e) {
			peer.close(CloseReason.NETWORK_SHUTDOWN, "network closing");
			peer.onLoopExited();
		}
	}

	/**
	 * Moves handshaken peer from pending to connected.
	 *
	 * @return reason to refuse peer, or null if registered
	 */
	/* package */ CloseReason registerConnectedPeer(Peer peer) {
		synchronized (this.peersLock) {
			if (isClosing())
				return CloseReason.NETWORK_SHUTDOWN;

			Peer existingPeer = this.connectedPeers.get(peer.getPeerId());
			if (existingPeer != null && existingPeer != peer)
				return CloseReason.DUPLICATE;

			if (this.connectedPeers.size() >= this.settings.getMaxPeers())
				return CloseReason.MAX_PEERS;

			this.pendingPeers.remove(peer);
			this.connectedPeers.put(peer.getPeerId(), peer);
			this.immutableConnectedPeers = new PeerList(this.connectedPeers.values());
		}

		return null;
	}

	/* package */ void onPeerConnected(Peer peer) {
		LOGGER.info("[{}] Connected to peer {} ({}), version {}", peer.getPeerConnectionId(), peer, peer.getPeerId(), peer.getPeersVersion());

		this.uptimeTracker.start(peer.getPeerId(), System.currentTimeMillis());

		PeerAddress listenAddress = peer.isOutbound() ? peer.getAddress() : peer.getAdvertisedAddress();
		if (listenAddress != null)
			addKnownPeer(listenAddress);

		try {
			this.handler.connected(peer.getPeerId());
		} catch (RuntimeException e) {
			LOGGER.warn(String.format("[%s] Message handler failed on connection of peer %s", peer.getPeerConnectionId(), peer), e);
		}

		peer.send(buildPeerListMessage(), false);
	}

	/** Called exactly once per peer, when it reaches CLOSED. */
	/* package */ void onPeerClosed(Peer peer, CloseReason reason) {
		boolean wasConnected;
		synchronized (this.peersLock) {
			this.pendingPeers.remove(peer);

			PeerId peerId = peer.getPeerId();
			wasConnected = peerId != null && this.connectedPeers.remove(peerId, peer);
			if (wasConnected)
				this.immutableConnectedPeers = new PeerList(this.connectedPeers.values());

			this.closeReasons.merge(reason, 1L, Long::sum);
		}

		this.closedPeers.incrementAndGet();
		if (reason.isHandshakeFailure)
			this.handshakeFailures.incrementAndGet();

		if (reason == CloseReason.SELF_CONNECTION && peer.isOutbound())
			forgetKnownPeer(peer.getAddress());

		if (peer.getConnectionEstablished() > 0L) {
			LOGGER.info("[{}] Disconnected from peer {} ({}): {}", peer.getPeerConnectionId(), peer, peer.getPeerId(), reason);

			this.uptimeTracker.stop(peer.getPeerId(), System.currentTimeMillis());

			try {
				this.handler.disconnected(peer.getPeerId());
			} catch (RuntimeException e) {
				LOGGER.warn(String.format("[%s] Message handler failed on disconnection of peer %s", peer.getPeerConnectionId(), peer), e);
			}
		}
	}

	/* package */ void onSendDropped(Peer peer) {
		this.droppedSends.incrementAndGet();
	}

	/** Peer sent something undecodable. Counts against its benchlist standing. */
	public void peerMisbehaved(Peer peer) {
		PeerId peerId = peer.getPeerId();
		if (peerId == null)
			return;

		LOGGER.debug("[{}] Peer {} ({}) misbehaved", peer.getPeerConnectionId(), peer, peerId);
		this.benchlist.registerFailure(peerId);
	}

	// Known peers and gossip

	/** Adds address to known peers, evicting the oldest if full. Returns true if address was new. */
	public boolean addKnownPeer(PeerAddress address) {
		synchronized (this.knownPeers) {
			if (!this.knownPeers.add(address))
				return false;

			Iterator<PeerAddress> iterator = this.knownPeers.iterator();
			while (this.knownPeers.size() > this.settings.getMaxKnownPeers()) {
				iterator.next();
				iterator.remove();
			}

			return this.knownPeers.contains(address);
		}
	}

	private void forgetKnownPeer(PeerAddress address) {
		synchronized (this.knownPeers) {
			if (this.knownPeers.remove(address))
				LOGGER.debug("Forgetting known peer {}: it's us", address);
		}
	}

	public List<PeerAddress> getKnownPeers() {
		synchronized (this.knownPeers) {
			return new ArrayList<>(this.knownPeers);
		}
	}

	/** Builds PEER_LIST carrying a random sample of up to <tt>peerListSize</tt> known addresses. */
	/* package */ Message buildPeerListMessage() {
		List<PeerAddress> sample = getKnownPeers();
		Collections.shuffle(sample);

		List<String> peers = sample.stream()
				.limit(this.settings.getPeerListSize())
				.map(PeerAddress::toString)
				.collect(Collectors.toList());

		return MessageBuilder.peerList(peers);
	}

	/** Merges addresses from peer's PEER_LIST into known peers, optionally dialling new ones. */
	/* package */ void mergePeers(Peer peer, Message message) {
		List<String> peers = message.getList(Field.PEERS);
		String ourAddress = getOurAdvertisedAddress(peer.getSocket());
		int added = 0;

		for (String peerString : peers) {
			PeerAddress address;
			try {
				address = PeerAddress.fromString(peerString, this.settings.getListenPort());
			} catch (IllegalArgumentException e) {
				LOGGER.trace("[{}] Ignoring invalid address '{}' from peer {}", peer.getPeerConnectionId(), peerString, peer);
				continue;
			}

			if (address.toString().equalsIgnoreCase(ourAddress))
				continue;

			if (!addKnownPeer(address))
				continue;

			++added;

			if (this.settings.isConnectToGossipedPeers() && shouldDial(address))
				connect(address).whenComplete((connectedPeer, e) -> {
					if (e != null)
						LOGGER.debug("Couldn't connect to gossiped peer {}: {}", address, e.getMessage());
				});
		}

		if (added > 0)
			LOGGER.debug("[{}] Merged {} new addresses from peer {}", peer.getPeerConnectionId(), added, peer);
	}

	private boolean shouldDial(PeerAddress address) {
		if (isClosing())
			return false;

		synchronized (this.peersLock) {
			if (this.dialling.containsValue(address))
				return false;

			if (this.connectedPeers.size() + this.pendingPeers.size() >= this.settings.getMaxPeers())
				return false;

			for (Peer peer : this.connectedPeers.values())
				if (address.equals(peer.getAddress()) || address.equals(peer.getAdvertisedAddress()))
					return false;
		}

		return true;
	}

	/** Sends a PEER_LIST sample to up to <tt>gossipPeerListTo</tt> random connected peers. */
	public void gossipPeerList() {
		List<Peer> peers = new ArrayList<>(this.immutableConnectedPeers.asList());
		if (peers.isEmpty())
			return;

		Message peerListMessage = buildPeerListMessage();
		if (peerListMessage.<String>getList(Field.PEERS).isEmpty())
			return;

		Collections.shuffle(peers);
		int count = Math.min(this.settings.getGossipPeerListTo(), peers.size());
		for (Peer peer : peers.subList(0, count))
			peer.send(peerListMessage, false);

		LOGGER.trace("Gossiped peer list to {} peers", count);
	}

	// Sending

	/**
	 * Queues message to each connected, non-benched peer in <tt>peerIds</tt>.
	 *
	 * @return PeerIds that actually accepted the message
	 */
	public Set<PeerId> send(Message message, Collection<PeerId> peerIds, boolean canBlock) {
		PeerList peers = this.immutableConnectedPeers;
		Set<PeerId> sentTo = new HashSet<>();

		for (PeerId peerId : peerIds) {
			Peer peer = peers.get(peerId);
			if (peer == null)
				continue;

			if (this.benchlist.isBenched(peerId)) {
				LOGGER.trace("[{}] Not sending {} to benched peer {}", peer.getPeerConnectionId(), message, peer);
				continue;
			}

			if (peer.send(message, canBlock))
				sentTo.add(peerId);
		}

		return sentTo;
	}

	/** Queues message to every connected, non-benched peer, without blocking. */
	public Set<PeerId> broadcast(Message message) {
		PeerList peers = this.immutableConnectedPeers;
		List<PeerId> peerIds = peers.stream().map(Peer::getPeerId).collect(Collectors.toList());

		return send(message, peerIds, false);
	}

	// Benchlist

	public boolean registerQueryFailure(PeerId peerId) {
		return this.benchlist.registerFailure(peerId);
	}

	public void registerResponse(PeerId peerId) {
		this.benchlist.registerResponse(peerId);
	}

	public boolean isBenched(PeerId peerId) {
		return this.benchlist.isBenched(peerId);
	}

	@Override
	public void benched(PeerId peerId, long benchedUntil) {
		LOGGER.info("Peer {} benched until {}", peerId, benchedUntil);
	}

	@Override
	public void unbenched(PeerId peerId) {
		LOGGER.info("Peer {} no longer benched", peerId);
	}

	// Queries

	public PeerList getConnectedPeers() {
		return this.immutableConnectedPeers;
	}

	/** Returns connected peer with passed ID, or null. */
	public Peer getPeer(PeerId peerId) {
		return this.immutableConnectedPeers.get(peerId);
	}

	public List<Peer> getPendingPeers() {
		synchronized (this.peersLock) {
			return new ArrayList<>(this.pendingPeers);
		}
	}

	public double getUptime(PeerId peerId) {
		return this.uptimeTracker.getUptime(peerId, System.currentTimeMillis());
	}

	public NetworkStats getStats() {
		long now = System.currentTimeMillis();
		NetworkStats stats = new NetworkStats();

		PeerList peers;
		synchronized (this.peersLock) {
			peers = this.immutableConnectedPeers;
			stats.pendingPeers = this.pendingPeers.size();

			for (Map.Entry<CloseReason, Long> entry : this.closeReasons.entrySet())
				stats.closeReasons.put(entry.getKey().name(), entry.getValue());
		}

		stats.connectedPeers = peers.size();
		for (Peer peer : peers)
			stats.sendQueueDepths.put(peer.getPeerId().toString(), peer.getSendQueueSize());

		synchronized (this.knownPeers) {
			stats.knownPeers = this.knownPeers.size();
		}

		stats.benchedPeers = this.benchlist.getBenched(now).size();
		stats.handshakeFailures = this.handshakeFailures.get();
		stats.closedPeers = this.closedPeers.get();
		stats.droppedSends = this.droppedSends.get();
		stats.dialFailures = this.dialFailures.get();
		stats.inboundBytesInFlight = this.inboundThrottler.getUsedBytes();
		stats.outboundBytesInFlight = this.outboundThrottler.getUsedBytes();

		for (Map.Entry<PeerId, Double> entry : this.uptimeTracker.getUptimes(now).entrySet())
			stats.uptimes.put(entry.getKey().toString(), entry.getValue());

		return stats;
	}

	// Shutdown

	/**
	 * Stops accepting, closes every pending and connected peer and waits, up to <tt>closeTimeout</tt>,
	 * for them to reach CLOSED. Then releases executors. Idempotent.
	 */
	@Override
	public void close() {
		if (!this.closing.compareAndSet(false, true))
			return;

		LOGGER.info("Shutting down network");

		ServerSocket currentServerSocket = this.serverSocket;
		if (currentServerSocket != null)
			try {
				currentServerSocket.close();
			} catch (IOException e) {
				LOGGER.warn("IOException while closing listen socket: {}", e.getMessage());
			}

		this.scheduler.shutdownNow();

		List<Peer> peers;
		synchronized (this.peersLock) {
			peers = new ArrayList<>(this.pendingPeers);
			peers.addAll(this.connectedPeers.values());
		}

		for (Peer peer : peers)
			peer.close(CloseReason.NETWORK_SHUTDOWN, "network closing");

		try {
			if (!awaitPeersClosed(peers, this.settings.getCloseTimeout())) {
				LOGGER.warn("Peers didn't close within {}ms, forcing sockets closed", this.settings.getCloseTimeout());

				for (Peer peer : peers)
					peer.closeSocket();

				awaitPeersClosed(peers, this.settings.getCloseTimeout());
			}

			this.peerExecutor.shutdownNow();
			if (!this.peerExecutor.awaitTermination(this.settings.getCloseTimeout(), TimeUnit.MILLISECONDS))
				LOGGER.warn("Peer threads didn't terminate within {}ms", this.settings.getCloseTimeout());

			if (this.acceptThread != null)
				this.acceptThread.join(this.settings.getCloseTimeout());
		} catch (InterruptedException e) {
			LOGGER.warn("Interrupted while shutting down network");
			Thread.currentThread().interrupt();
		}

		// Connect tasks that never ran
		List<CompletableFuture<Peer>> unfinishedConnects;
		synchronized (this.peersLock) {
			unfinishedConnects = new ArrayList<>(this.dialling.keySet());
		}

		for (CompletableFuture<Peer> future : unfinishedConnects)
			future.completeExceptionally(new PeerClosedException(CloseReason.NETWORK_SHUTDOWN, "network closing"));

		LOGGER.info("Network shut down");
	}

	private static boolean awaitPeersClosed(List<Peer> peers, long timeout) throws InterruptedException {
		long deadline = System.currentTimeMillis() + timeout;

		for (Peer peer : peers) {
			long remaining = deadline - System.currentTimeMillis();
			if (!peer.awaitClosed(Math.max(remaining, 0L)))
				return false;
		}

		return true;
	}

}
