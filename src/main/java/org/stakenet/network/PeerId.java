package org.stakenet.network;

import com.google.common.io.BaseEncoding;
import org.bouncycastle.crypto.digests.RIPEMD160Digest;
import org.bouncycastle.crypto.digests.SHA256Digest;

import java.security.PublicKey;
import java.util.Arrays;

/**
 * Stable identity of a remote node, derived from its certificate's public key.
 * <p>
 * PeerId = RIPEMD-160(SHA-256(DER-encoded public key)). Never derived from transport address.
 */
public final class PeerId implements Comparable<PeerId> {

	public static final int LENGTH = 20;

	private final byte[] bytes;
	private final int hashCode;

	private PeerId(byte[] bytes) {
		this.bytes = bytes;
		this.hashCode = Arrays.hashCode(bytes);
	}

	public static PeerId fromBytes(byte[] bytes) {
		if (bytes == null || bytes.length != LENGTH)
			throw new IllegalArgumentException("PeerId must be " + LENGTH + " bytes");

		return new PeerId(bytes.clone());
	}

	public static PeerId fromPublicKey(PublicKey publicKey) {
		return new PeerId(hash160(publicKey.getEncoded()));
	}

	public static PeerId fromHex(String hex) {
		return fromBytes(BaseEncoding.base16().lowerCase().decode(hex.toLowerCase()));
	}

	private static byte[] hash160(byte[] input) {
		SHA256Digest sha256 = new SHA256Digest();
		sha256.update(input, 0, input.length);
		byte[] sha256Hash = new byte[sha256.getDigestSize()];
		sha256.doFinal(sha256Hash, 0);

		RIPEMD160Digest ripeMd160 = new RIPEMD160Digest();
		ripeMd160.update(sha256Hash, 0, sha256Hash.length);
		byte[] hash = new byte[ripeMd160.getDigestSize()];
		ripeMd160.doFinal(hash, 0);

		return hash;
	}

	public byte[] getBytes() {
		return this.bytes.clone();
	}

	@Override
	public int compareTo(PeerId other) {
		return Arrays.compareUnsigned(this.bytes, other.bytes);
	}

	@Override
	public boolean equals(Object other) {
		if (this == other)
			return true;

		if (!(other instanceof PeerId))
			return false;

		return Arrays.equals(this.bytes, ((PeerId) other).bytes);
	}

	@Override
	public int hashCode() {
		return this.hashCode;
	}

	@Override
	public String toString() {
		return BaseEncoding.base16().lowerCase().encode(this.bytes);
	}

}
