package org.stakenet.settings;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.eclipse.persistence.jaxb.JAXBContextFactory;
import org.eclipse.persistence.jaxb.UnmarshallerProperties;
import org.stakenet.network.message.Field;
import org.stakenet.version.VersionException;
import org.stakenet.version.VersionParser;

import javax.xml.bind.JAXBContext;
import javax.xml.bind.JAXBException;
import javax.xml.bind.UnmarshalException;
import javax.xml.bind.Unmarshaller;
import javax.xml.bind.annotation.XmlAccessType;
import javax.xml.bind.annotation.XmlAccessorType;
import javax.xml.transform.stream.StreamSource;
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Network configuration, loaded from JSON.
 * <p>
 * All durations are in milliseconds. Any option missing from the JSON keeps its default.
 */
@XmlAccessorType(XmlAccessType.FIELD)
public class NetworkSettings {

	private static final Logger LOGGER = LogManager.getLogger(NetworkSettings.class);

	// Identity and versioning

	/** Nodes on different network IDs refuse to connect. */
	private int networkId = 1;
	private String appVersion = "stakenet/1.0.0";
	private String minCompatibleVersion = "stakenet/1.0.0";
	/** Tolerated until {@link #minCompatibleTime}; defaults to {@link #minCompatibleVersion} */
	private String prevMinCompatibleVersion = null;
	private long minCompatibleTime = 0L;

	// Listening

	private String bindAddress = "0.0.0.0";
	/** 0 means any free port. */
	private int listenPort = 9651;
	/** Address advertised to peers in VERSION, as "host:port". Defaults to bind address and actual port. */
	private String publicAddress = null;

	private String certificatePath = "staking/node.crt";
	private String privateKeyPath = "staking/node.key";

	// Peers and gossip

	private List<String> initialPeers = new ArrayList<>();
	private int maxPeers = 128;
	private int maxKnownPeers = 1000;
	/** Addresses per PEER_LIST message */
	private int peerListSize = 50;
	/** Connected peers that each PEER_LIST gossip round is sent to */
	private int gossipPeerListTo = 8;
	private long gossipPeerListFreq = 60 * 1000L;
	private boolean connectToGossipedPeers = true;

	// Messaging

	private int sendQueueSize = 1024;
	private int maxMessageSize = 2 * 1024 * 1024;
	/** Send whatever is still queued when closing a peer, instead of discarding it */
	private boolean flushOnClose = false;

	// Timeouts and retries

	private int handshakeTimeout = 15 * 1000;
	private int dialTimeout = 5 * 1000;
	private int dialRetryAttempts = 3;
	private long dialRetryBackoff = 500L;
	private long dialRetryMaxBackoff = 5 * 1000L;
	private long maxClockDifference = 60 * 1000L;
	private long pingFrequency = 22 * 1000L + 500L;
	private int pingTimeout = 30 * 1000;
	private long closeTimeout = 10 * 1000L;

	// Throttling

	private long inboundConnectionCooldown = 10 * 1000L;
	private int inboundConnectionMaxRecent = 256;
	private long inboundThrottlerBytes = 32L * 1024 * 1024;
	private long inboundThrottlerNodeMaxBytes = 4L * 1024 * 1024;
	private long outboundThrottlerBytes = 32L * 1024 * 1024;
	private long outboundThrottlerNodeMaxBytes = 4L * 1024 * 1024;

	// Benchlist

	/** Failures within window that bench a peer. 0 disables benching. */
	private int benchlistThreshold = 10;
	private long benchlistWindow = 5 * 60 * 1000L;
	private long benchlistDuration = 15 * 60 * 1000L;
	private long benchlistSweepInterval = 60 * 1000L;

	// Uptime

	private long uptimeHalflife = 5 * 60 * 1000L;
	private int uptimeMaxSkippedIntervals = 32;

	// Constructors

	public NetworkSettings() {
	}

	public static NetworkSettings fileInstance(Path path) {
		try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
			NetworkSettings settings = fromJson(reader);
			LOGGER.info("Using settings file: {}", path);
			return settings;
		} catch (IOException e) {
			String message = String.format("Settings file '%s' unreadable", path);
			LOGGER.error(message, e);
			throw new IllegalStateException(message, e);
		}
	}

	public static NetworkSettings fromJson(String json) {
		return fromJson(new StringReader(json));
	}

	public static NetworkSettings fromJson(Reader reader) {
		Unmarshaller unmarshaller;

		try {
			// Create JAXB context aware of Settings
			JAXBContext jc = JAXBContextFactory.createContext(new Class[] { NetworkSettings.class }, null);

			// Create unmarshaller
			unmarshaller = jc.createUnmarshaller();

			// Set the unmarshaller media type to JSON
			unmarshaller.setProperty(UnmarshallerProperties.MEDIA_TYPE, "application/json");

			// Tell unmarshaller that there's no JSON root element in the JSON input
			unmarshaller.setProperty(UnmarshallerProperties.JSON_INCLUDE_ROOT, false);
		} catch (JAXBException e) {
			String message = "Failed to setup unmarshaller to read settings";
			LOGGER.error(message, e);
			throw new IllegalStateException(message, e);
		}

		NetworkSettings settings;
		try {
			StreamSource json = new StreamSource(reader);
			settings = unmarshaller.unmarshal(json, NetworkSettings.class).getValue();
		} catch (UnmarshalException e) {
			String message = "Failed to parse settings";
			LOGGER.error(message, e);
			throw new IllegalStateException(message, e);
		} catch (JAXBException e) {
			String message = "Unexpected JAXB issue while processing settings";
			LOGGER.error(message, e);
			throw new IllegalStateException(message, e);
		}

		settings.validate();
		return settings;
	}

	/**
	 * Checks option values are usable.
	 *
	 * @throws IllegalStateException describing the first invalid option
	 */
	public void validate() {
		try {
			VersionParser.parse(this.appVersion);
			VersionParser.parse(this.minCompatibleVersion);
			VersionParser.parse(getPrevMinCompatibleVersion());
		} catch (VersionException e) {
			throw new IllegalStateException("Invalid version setting: " + e.getMessage(), e);
		}

		requireInRange("listenPort", this.listenPort, 0, 65535);
		requirePositive("sendQueueSize", this.sendQueueSize);
		requirePositive("maxPeers", this.maxPeers);
		requirePositive("maxMessageSize", this.maxMessageSize);
		requirePositive("maxKnownPeers", this.maxKnownPeers);
		requireInRange("peerListSize", this.peerListSize, 0, Field.MAX_PEERS);
		requireInRange("gossipPeerListTo", this.gossipPeerListTo, 0, Integer.MAX_VALUE);
		requirePositive("gossipPeerListFreq", this.gossipPeerListFreq);
		requirePositive("handshakeTimeout", this.handshakeTimeout);
		requirePositive("dialTimeout", this.dialTimeout);
		requireInRange("dialRetryAttempts", this.dialRetryAttempts, 0, 32);
		requireInRange("dialRetryBackoff", this.dialRetryBackoff, 0, Long.MAX_VALUE);
		requireInRange("dialRetryMaxBackoff", this.dialRetryMaxBackoff, this.dialRetryBackoff, Long.MAX_VALUE);
		requireInRange("maxClockDifference", this.maxClockDifference, 0, Long.MAX_VALUE);
		requirePositive("pingFrequency", this.pingFrequency);
		requireInRange("pingTimeout", this.pingTimeout, this.pingFrequency + 1, Integer.MAX_VALUE);
		requireInRange("closeTimeout", this.closeTimeout, 0, Long.MAX_VALUE);
		requireInRange("inboundConnectionCooldown", this.inboundConnectionCooldown, 0, Long.MAX_VALUE);
		requireInRange("inboundConnectionMaxRecent", this.inboundConnectionMaxRecent, 0, Integer.MAX_VALUE);
		requirePositive("inboundThrottlerBytes", this.inboundThrottlerBytes);
		requirePositive("inboundThrottlerNodeMaxBytes", this.inboundThrottlerNodeMaxBytes);
		requirePositive("outboundThrottlerBytes", this.outboundThrottlerBytes);
		requirePositive("outboundThrottlerNodeMaxBytes", this.outboundThrottlerNodeMaxBytes);
		requireInRange("benchlistThreshold", this.benchlistThreshold, 0, Integer.MAX_VALUE);
		requireInRange("benchlistWindow", this.benchlistWindow, 0, Long.MAX_VALUE);
		requireInRange("benchlistDuration", this.benchlistDuration, 0, Long.MAX_VALUE);
		requirePositive("benchlistSweepInterval", this.benchlistSweepInterval);
		requirePositive("uptimeHalflife", this.uptimeHalflife);
		requireInRange("uptimeMaxSkippedIntervals", this.uptimeMaxSkippedIntervals, 1, 62);
	}

	private static void requirePositive(String name, long value) {
		if (value <= 0)
			throw new IllegalStateException(String.format("Setting '%s' must be positive, got %d", name, value));
	}

	private static void requireInRange(String name, long value, long min, long max) {
		if (value < min || value > max)
			throw new IllegalStateException(String.format("Setting '%s' must be within %d..%d, got %d", name, min, max, value));
	}

	// Getters

	public int getNetworkId() {
		return this.networkId;
	}

	public String getAppVersion() {
		return this.appVersion;
	}

	public String getMinCompatibleVersion() {
		return this.minCompatibleVersion;
	}

	public String getPrevMinCompatibleVersion() {
		return this.prevMinCompatibleVersion != null ? this.prevMinCompatibleVersion : this.minCompatibleVersion;
	}

	public long getMinCompatibleTime() {
		return this.minCompatibleTime;
	}

	public String getBindAddress() {
		return this.bindAddress;
	}

	public int getListenPort() {
		return this.listenPort;
	}

	public String getPublicAddress() {
		return this.publicAddress;
	}

	public String getCertificatePath() {
		return this.certificatePath;
	}

	public String getPrivateKeyPath() {
		return this.privateKeyPath;
	}

	public List<String> getInitialPeers() {
		return this.initialPeers == null ? Collections.emptyList() : Collections.unmodifiableList(this.initialPeers);
	}

	public int getMaxPeers() {
		return this.maxPeers;
	}

	public int getMaxKnownPeers() {
		return this.maxKnownPeers;
	}

	public int getPeerListSize() {
		return this.peerListSize;
	}

	public int getGossipPeerListTo() {
		return this.gossipPeerListTo;
	}

	public long getGossipPeerListFreq() {
		return this.gossipPeerListFreq;
	}

	public boolean isConnectToGossipedPeers() {
		return this.connectToGossipedPeers;
	}

	public int getSendQueueSize() {
		return this.sendQueueSize;
	}

	public int getMaxMessageSize() {
		return this.maxMessageSize;
	}

	public boolean isFlushOnClose() {
		return this.flushOnClose;
	}

	public int getHandshakeTimeout() {
		return this.handshakeTimeout;
	}

	public int getDialTimeout() {
		return this.dialTimeout;
	}

	public int getDialRetryAttempts() {
		return this.dialRetryAttempts;
	}

	public long getDialRetryBackoff() {
		return this.dialRetryBackoff;
	}

	public long getDialRetryMaxBackoff() {
		return this.dialRetryMaxBackoff;
	}

	public long getMaxClockDifference() {
		return this.maxClockDifference;
	}

	public long getPingFrequency() {
		return this.pingFrequency;
	}

	public int getPingTimeout() {
		return this.pingTimeout;
	}

	public long getCloseTimeout() {
		return this.closeTimeout;
	}

	public long getInboundConnectionCooldown() {
		return this.inboundConnectionCooldown;
	}

	public int getInboundConnectionMaxRecent() {
		return this.inboundConnectionMaxRecent;
	}

	public long getInboundThrottlerBytes() {
		return this.inboundThrottlerBytes;
	}

	public long getInboundThrottlerNodeMaxBytes() {
		return this.inboundThrottlerNodeMaxBytes;
	}

	public long getOutboundThrottlerBytes() {
		return this.outboundThrottlerBytes;
	}

	public long getOutboundThrottlerNodeMaxBytes() {
		return this.outboundThrottlerNodeMaxBytes;
	}

	public int getBenchlistThreshold() {
		return this.benchlistThreshold;
	}

	public long getBenchlistWindow() {
		return this.benchlistWindow;
	}

	public long getBenchlistDuration() {
		return this.benchlistDuration;
	}

	public long getBenchlistSweepInterval() {
		return this.benchlistSweepInterval;
	}

	public long getUptimeHalflife() {
		return this.uptimeHalflife;
	}

	public int getUptimeMaxSkippedIntervals() {
		return this.uptimeMaxSkippedIntervals;
	}

}
