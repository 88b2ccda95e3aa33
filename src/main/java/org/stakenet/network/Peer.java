package org.stakenet.network;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.stakenet.network.message.Message;
import org.stakenet.network.message.MessageBuilder;
import org.stakenet.network.message.MessageCodec;
import org.stakenet.network.task.PeerReadTask;
import org.stakenet.network.task.PeerWriteTask;
import org.stakenet.network.throttling.MessageThrottler;
import org.stakenet.network.tls.DeadlineExceededException;
import org.stakenet.network.tls.UpgradedConnection;
import org.stakenet.network.tls.Upgrader;
import org.stakenet.settings.NetworkSettings;
import org.stakenet.version.Version;

import java.io.BufferedInputStream;
import java.io.BufferedOutputStream;
import java.io.DataInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.net.Socket;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.UUID;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.locks.Condition;
import java.util.concurrent.locks.ReentrantLock;

// For managing one peer
public class Peer {

	private static final Logger LOGGER = LogManager.getLogger(Peer.class);

	/** How long blocking throttler waits sleep before re-checking whether peer is closing. (ms) */
	private static final long THROTTLE_POLL_INTERVAL = 100L; // ms

	private final Network network;
	private final boolean isOutbound;
	private final UUID peerConnectionId = UUID.randomUUID();
	private final long connectionStarted = System.currentTimeMillis();

	/** Dialled address for outbound peers, remote socket address for inbound peers. */
	private final PeerAddress address;
	/** Completed once peer reaches CONNECTED, or fails with {@link PeerClosedException}. */
	private final CompletableFuture<Peer> connectFuture;

	// Lifecycle

	private final Object stateLock = new Object();
	private volatile PeerState state = PeerState.CONNECTING;
	private int loopsRunning = 0;
	private CloseReason closeReason;
	private String closeDetail;
	private Throwable closeCause;
	private final CountDownLatch closedLatch = new CountDownLatch(1);

	// Connection

	private final Socket rawSocket;
	private volatile Socket socket;
	private DataInputStream inputStream;
	private OutputStream outputStream;

	// Send queue

	/** Queued message plus the throttler reservation made for it, if any. */
	private static final class QueuedMessage {
		final Message message;
		final PeerId throttleKey;
		final int bytes;

		QueuedMessage(Message message, PeerId throttleKey, int bytes) {
			this.message = message;
			this.throttleKey = throttleKey;
			this.bytes = bytes;
		}
	}

	private final int sendQueueCapacity;
	private final Deque<QueuedMessage> sendQueue = new ArrayDeque<>();
	/** Message taken by writer loop but not yet written. Writer thread only. */
	private QueuedMessage inFlight;
	private final ReentrantLock sendLock = new ReentrantLock();
	private final Condition notFull = this.sendLock.newCondition();
	private final Condition notEmpty = this.sendLock.newCondition();

	// Peer info, set during upgrade and handshake

	private volatile PeerId peerId;
	private volatile Handshake handshakeStatus = Handshake.STARTED;
	private volatile Version peersVersion;
	private volatile long peersTimestamp;
	private volatile PeerAddress advertisedAddress;
	private volatile long connectionEstablished = 0L;

	private volatile long lastMessageReceived = 0L;
	private volatile long lastPingSent = 0L;
	private volatile Long lastPing = null;

	// Constructors

	/** Constructs peer for an accepted, inbound connection. */
	public Peer(Network network, Socket socket) {
		this(network, socket, false, PeerAddress.fromSocket(socket), new CompletableFuture<>());
	}

	/** Constructs peer for a dialled, outbound connection. */
	public Peer(Network network, Socket socket, PeerAddress address, CompletableFuture<Peer> connectFuture) {
		this(network, socket, true, address, connectFuture);
	}

	private Peer(Network network, Socket socket, boolean isOutbound, PeerAddress address, CompletableFuture<Peer> connectFuture) {
		this.network = network;
		this.rawSocket = socket;
		this.socket = socket;
		this.isOutbound = isOutbound;
		this.address = address;
		this.connectFuture = connectFuture;
		this.sendQueueCapacity = network.getSettings().getSendQueueSize();
	}

	// Getters / setters

	public Network getNetwork() {
		return this.network;
	}

	public UUID getPeerConnectionId() {
		return this.peerConnectionId;
	}

	public boolean isOutbound() {
		return this.isOutbound;
	}

	public PeerAddress getAddress() {
		return this.address;
	}

	/** Current socket, TLS once upgraded. */
	/* package */ Socket getSocket() {
		return this.socket;
	}

	/** Returns remote's identity, or null if TLS upgrade hasn't completed. */
	public PeerId getPeerId() {
		return this.peerId;
	}

	public PeerState getState() {
		return this.state;
	}

	public boolean isClosing() {
		return this.state.isClosing();
	}

	public boolean isConnected() {
		return this.state == PeerState.CONNECTED;
	}

	public CloseReason getCloseReason() {
		synchronized (this.stateLock) {
			return this.closeReason;
		}
	}

	public Handshake getHandshakeStatus() {
		return this.handshakeStatus;
	}

	public CompletableFuture<Peer> getConnectFuture() {
		return this.connectFuture;
	}

	public Version getPeersVersion() {
		return this.peersVersion;
	}

	/* package */ void setPeersVersion(Version peersVersion) {
		this.peersVersion = peersVersion;
	}

	public long getPeersTimestamp() {
		return this.peersTimestamp;
	}

	/* package */ void setPeersTimestamp(long peersTimestamp) {
		this.peersTimestamp = peersTimestamp;
	}

	/** Listening address the peer advertised in its VERSION, or null if absent or unparseable. */
	public PeerAddress getAdvertisedAddress() {
		return this.advertisedAddress;
	}

	/**
	 * Records listening address from peer's VERSION.
	 * <p>
	 * A missing, wildcard or loopback host is replaced by the host we see the peer connecting from.
	 */
	/* package */ void setAdvertisedAddress(String advertisedAddress) {
		if (advertisedAddress == null || advertisedAddress.isEmpty())
			return;

		// Port only, e.g. ":9651"
		if (advertisedAddress.startsWith(":"))
			advertisedAddress = "0.0.0.0" + advertisedAddress;

		PeerAddress parsedAddress;
		try {
			parsedAddress = PeerAddress.fromString(advertisedAddress, this.network.getSettings().getListenPort());
		} catch (IllegalArgumentException e) {
			LOGGER.debug("[{}] Peer {} advertised unusable address '{}'", this.peerConnectionId, this, advertisedAddress);
			return;
		}

		if (parsedAddress.isUnroutable()) {
			if (this.address == null)
				return;

			parsedAddress = this.address.withPort(parsedAddress.getPort());
		}

		this.advertisedAddress = parsedAddress;
	}

	public long getConnectionEstablished() {
		return this.connectionEstablished;
	}

	public long getConnectionAge() {
		if (this.connectionEstablished > 0L)
			return System.currentTimeMillis() - this.connectionEstablished;

		return System.currentTimeMillis() - this.connectionStarted;
	}

	public long getLastMessageReceived() {
		return this.lastMessageReceived;
	}

	public Long getLastPing() {
		return this.lastPing;
	}

	/** Socket input, available once HANDSHAKING. */
	public DataInputStream getInputStream() {
		return this.inputStream;
	}

	/** Socket output, available once HANDSHAKING. */
	public OutputStream getOutputStream() {
		return this.outputStream;
	}

	@Override
	public String toString() {
		String where = this.address != null ? this.address.toString() : "unconnected";
		return (this.isOutbound ? "out:" : "in:") + where;
	}

	// Upgrade and handshake

	/**
	 * Upgrades connection to TLS, applies network admission checks, then starts read/write loops and handshake.
	 * <p>
	 * Runs on the calling thread until the loops are started. Failures close the peer.
	 */
	public void upgrade() {
		if (this.state != PeerState.CONNECTING)
			return;

		Upgrader upgrader = this.isOutbound ? this.network.getClientUpgrader() : this.network.getServerUpgrader();

		UpgradedConnection connection;
		try {
			connection = upgrader.upgrade(this.rawSocket, this.network.getSettings().getHandshakeTimeout());
		} catch (DeadlineExceededException e) {
			close(CloseReason.HANDSHAKE_TIMEOUT, e.getMessage(), e);
			return;
		} catch (IOException e) {
			close(CloseReason.TLS_ERROR, e.getMessage(), e);
			return;
		}

		DataInputStream in;
		OutputStream out;
		try {
			connection.getSocket().setSoTimeout(this.network.getSettings().getPingTimeout());
			in = new DataInputStream(new BufferedInputStream(connection.getSocket().getInputStream()));
			out = new BufferedOutputStream(connection.getSocket().getOutputStream());
		} catch (IOException e) {
			close(CloseReason.IO_ERROR, e.getMessage(), e);
			return;
		}

		synchronized (this.stateLock) {
			if (this.state != PeerState.CONNECTING)
				// Closed while upgrading: socket already closed
				return;

			this.socket = connection.getSocket();
			this.peerId = connection.getPeerId();
		}

		LOGGER.debug("[{}] TLS established with peer {}, id {}", this.peerConnectionId, this, this.peerId);

		CloseReason refusal = this.network.onPeerUpgraded(this);
		if (refusal != null) {
			close(refusal, null);
			return;
		}

		synchronized (this.stateLock) {
			if (this.state != PeerState.CONNECTING)
				return;

			this.inputStream = in;
			this.outputStream = out;
			this.state = PeerState.HANDSHAKING;
			this.loopsRunning = 2;
		}

		// Queue our VERSION ahead of anything the reader might trigger
		this.handshakeStatus = Handshake.STARTED.onMessage(this, null);
		this.handshakeStatus.action(this);

		this.network.startPeerLoop(this, new PeerReadTask(this));
		this.network.startPeerLoop(this, new PeerWriteTask(this));
	}

	/* package */ void sendVersion() {
		NetworkSettings settings = this.network.getSettings();
		Message versionMessage = MessageBuilder.version(settings.getNetworkId(), System.currentTimeMillis(),
				this.network.getOurAdvertisedAddress(this.socket), settings.getAppVersion());

		if (!send(versionMessage, false))
			LOGGER.debug("[{}] Couldn't queue VERSION for peer {}", this.peerConnectionId, this);
	}

	// Inbound message processing, called from reader loop

	/**
	 * Processes one inbound message: throttles, then handles network messages itself
	 * and passes everything else to the handler once connected.
	 */
	public void onMessage(Message message) throws InterruptedException {
		this.lastMessageReceived = System.currentTimeMillis();

		MessageThrottler throttler = this.network.getInboundThrottler();
		int bytes = MessageCodec.frameSize(message);

		while (!throttler.acquire(this.peerId, bytes, THROTTLE_POLL_INTERVAL))
			if (isClosing())
				return;

		try {
			if (message.getOp().isNetworkOp())
				onNetworkMessage(message);
			else
				onHandlerMessage(message);
		} finally {
			throttler.release(this.peerId, bytes);
		}
	}

	private void onNetworkMessage(Message message) {
		LOGGER.trace("[{}] Received {} from peer {}", this.peerConnectionId, message, this);

		switch (message.getOp()) {
			case GET_VERSION:
				sendVersion();
				break;

			case VERSION:
				onVersion(message);
				break;

			case GET_PEER_LIST:
				if (isConnected())
					send(this.network.buildPeerListMessage(), false);
				break;

			case PEER_LIST:
				if (isConnected())
					this.network.mergePeers(this, message);
				break;

			case PING:
				send(MessageBuilder.pong(), false);
				break;

			case PONG:
				if (this.lastPingSent > 0L)
					this.lastPing = System.currentTimeMillis() - this.lastPingSent;
				break;

			default:
				break;
		}
	}

	private void onVersion(Message message) {
		Handshake handshake = this.handshakeStatus;
		if (handshake.expectedOp != message.getOp()) {
			LOGGER.trace("[{}] Ignoring VERSION from peer {} in handshake state {}", this.peerConnectionId, this, handshake);
			return;
		}

		Handshake newHandshakeStatus = handshake.onMessage(this, message);
		if (newHandshakeStatus == null)
			// Peer already closed with reason
			return;

		this.handshakeStatus = newHandshakeStatus;
		if (newHandshakeStatus == Handshake.COMPLETED)
			onHandshakeCompleted();
	}

	private void onHandshakeCompleted() {
		CloseReason refusal = this.network.registerConnectedPeer(this);
		if (refusal != null) {
			close(refusal, null);
			return;
		}

		synchronized (this.stateLock) {
			if (this.state != PeerState.HANDSHAKING)
				// Closed meanwhile: network deregisters us on close
				return;

			this.state = PeerState.CONNECTED;
			this.connectionEstablished = System.currentTimeMillis();
		}

		LOGGER.debug("[{}] Handshake completed with peer {}, version {}", this.peerConnectionId, this, this.peersVersion);

		this.network.onPeerConnected(this);
		this.connectFuture.complete(this);
	}

	private void onHandlerMessage(Message message) {
		if (!isConnected()) {
			LOGGER.trace("[{}] Dropping {} from peer {} before handshake completed", this.peerConnectionId, message, this);
			return;
		}

		try {
			this.network.getHandler().handleMessage(this.peerId, message);
		} catch (RuntimeException e) {
			LOGGER.warn(String.format("[%s] Message handler failed on %s from peer %s", this.peerConnectionId, message, this), e);
		}
	}

	// Sending

	/**
	 * Queues message to be sent to peer, preserving order.
	 * <p>
	 * If the send queue is full and <tt>canBlock</tt> is true, waits for space or until peer closes.
	 * Otherwise a full queue, or a refusal by the outbound throttler, drops the message.
	 *
	 * @return true if message was queued
	 */
	public boolean send(Message message, boolean canBlock) {
		if (isClosing())
			return false;

		int bytes = MessageCodec.frameSize(message);
		MessageThrottler throttler = this.network.getOutboundThrottler();
		// No identity to throttle against until TLS upgrade completes
		PeerId throttleKey = this.peerId;

		try {
			if (throttleKey != null && !acquireOutbound(throttler, throttleKey, bytes, canBlock)) {
				LOGGER.trace("[{}] Outbound throttler dropped {} to peer {}", this.peerConnectionId, message, this);
				this.network.onSendDropped(this);
				return false;
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}

		boolean queued = false;
		this.sendLock.lock();
		try {
			while (!isClosing() && this.sendQueue.size() >= this.sendQueueCapacity && canBlock)
				this.notFull.await();

			if (!isClosing() && this.sendQueue.size() < this.sendQueueCapacity) {
				this.sendQueue.addLast(new QueuedMessage(message, throttleKey, bytes));
				this.notEmpty.signal();
				queued = true;
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		} finally {
			this.sendLock.unlock();
		}

		if (!queued) {
			if (throttleKey != null)
				throttler.release(throttleKey, bytes);

			if (!isClosing()) {
				LOGGER.trace("[{}] Send queue full, dropping {} to peer {}", this.peerConnectionId, message, this);
				this.network.onSendDropped(this);
			}
		}

		return queued;
	}

	private boolean acquireOutbound(MessageThrottler throttler, PeerId throttleKey, int bytes, boolean canBlock) throws InterruptedException {
		if (!canBlock)
			return throttler.acquire(throttleKey, bytes, 0L);

		while (!throttler.acquire(throttleKey, bytes, THROTTLE_POLL_INTERVAL))
			if (isClosing())
				return false;

		return true;
	}

	/**
	 * Returns next message to write, blocking while queue is empty.
	 * <p>
	 * Returns null once peer is closing, unless queued messages are to be flushed first.
	 * Writer loop only. Caller must call {@link #onMessageWritten()} for each returned message, even if writing failed.
	 */
	public Message takeNextMessage() throws InterruptedException {
		this.sendLock.lock();
		try {
			while (true) {
				if (isClosing() && !this.network.getSettings().isFlushOnClose())
					return null;

				QueuedMessage queuedMessage = this.sendQueue.pollFirst();
				if (queuedMessage != null) {
					this.notFull.signal();
					this.inFlight = queuedMessage;
					return queuedMessage.message;
				}

				if (isClosing())
					return null;

				this.notEmpty.await();
			}
		} finally {
			this.sendLock.unlock();
		}
	}

	/** Whether more messages are queued, used to decide when to flush socket output. */
	public boolean hasQueuedMessages() {
		this.sendLock.lock();
		try {
			return !this.sendQueue.isEmpty();
		} finally {
			this.sendLock.unlock();
		}
	}

	/** Releases reservation for message last returned by {@link #takeNextMessage()}. */
	public void onMessageWritten() {
		QueuedMessage queuedMessage = this.inFlight;
		this.inFlight = null;

		if (queuedMessage != null)
			releaseReservation(queuedMessage);
	}

	private void releaseReservation(QueuedMessage queuedMessage) {
		if (queuedMessage.throttleKey != null)
			this.network.getOutboundThrottler().release(queuedMessage.throttleKey, queuedMessage.bytes);
	}

	public int getSendQueueSize() {
		this.sendLock.lock();
		try {
			return this.sendQueue.size();
		} finally {
			this.sendLock.unlock();
		}
	}

	public int getSendQueueCapacity() {
		return this.sendQueueCapacity;
	}

	// Closing

	public void close() {
		close(CloseReason.LOCAL, null);
	}

	public void close(CloseReason reason, String detail) {
		close(reason, detail, null);
	}

	/**
	 * Moves peer to CLOSING, exactly once. Further calls are no-ops.
	 * <p>
	 * Wakes blocked senders and both loops. Peer becomes CLOSED once both loops have exited.
	 */
	public void close(CloseReason reason, String detail, Throwable cause) {
		PeerState previousState;
		boolean finishNow;

		synchronized (this.stateLock) {
			if (!this.state.canTransitionTo(PeerState.CLOSING))
				return;

			previousState = this.state;
			this.state = PeerState.CLOSING;
			this.closeReason = reason;
			this.closeDetail = detail;
			this.closeCause = cause;
			finishNow = this.loopsRunning == 0;
		}

		if (reason == CloseReason.LOCAL || reason == CloseReason.NETWORK_SHUTDOWN)
			LOGGER.debug("[{}] Closing peer {}", this.peerConnectionId, this);
		else
			LOGGER.debug("[{}] Closing peer {} ({}): {}", this.peerConnectionId, this, reason, detail);

		this.sendLock.lock();
		try {
			this.notFull.signalAll();
			this.notEmpty.signalAll();
		} finally {
			this.sendLock.unlock();
		}

		// When flushing, the writer loop closes the socket after draining the queue
		if (finishNow || previousState != PeerState.CONNECTED || !this.network.getSettings().isFlushOnClose())
			closeSocket();

		if (finishNow)
			finish();
	}

	/** Closes the socket, forcing any blocked read or write to fail. */
	public void closeSocket() {
		Socket currentSocket = this.socket;

		try {
			currentSocket.close();
		} catch (IOException e) {
			LOGGER.debug("[{}] IOException while closing socket to peer {}: {}", this.peerConnectionId, this, e.getMessage());
		}

		if (currentSocket != this.rawSocket && !this.rawSocket.isClosed()) {
			try {
				this.rawSocket.close();
			} catch (IOException e) {
				LOGGER.debug("[{}] IOException while closing raw socket to peer {}: {}", this.peerConnectionId, this, e.getMessage());
			}
		}
	}

	/** Called by each read/write loop as it exits. */
	public void onLoopExited() {
		boolean finishNow;

		synchronized (this.stateLock) {
			finishNow = --this.loopsRunning == 0 && this.state == PeerState.CLOSING;
		}

		if (finishNow)
			finish();
	}

	/** Runs exactly once, when CLOSING and no loops remain. */
	private void finish() {
		closeSocket();

		int discarded = 0;
		this.sendLock.lock();
		try {
			QueuedMessage queuedMessage;
			while ((queuedMessage = this.sendQueue.pollFirst()) != null) {
				releaseReservation(queuedMessage);
				++discarded;
			}
		} finally {
			this.sendLock.unlock();
		}

		if (discarded > 0)
			LOGGER.trace("[{}] Discarded {} queued messages to peer {}", this.peerConnectionId, discarded, this);

		CloseReason reason;
		String detail;
		Throwable cause;
		synchronized (this.stateLock) {
			this.state = PeerState.CLOSED;
			reason = this.closeReason;
			detail = this.closeDetail;
			cause = this.closeCause;
		}

		this.network.onPeerClosed(this, reason);
		this.connectFuture.completeExceptionally(new PeerClosedException(reason, detail, cause));
		this.closedLatch.countDown();
	}

	/** Waits until peer is CLOSED. */
	public boolean awaitClosed(long timeout) throws InterruptedException {
		return this.closedLatch.await(timeout, TimeUnit.MILLISECONDS);
	}

	// Keepalive

	/** Sends PING if connected. */
	public void ping() {
		if (!isConnected())
			return;

		long now = System.currentTimeMillis();
		if (send(MessageBuilder.ping(), false))
			this.lastPingSent = now;
	}

}
