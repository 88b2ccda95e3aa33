package org.stakenet.network.tls;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.BasicConstraints;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.KeyUsage;
import org.bouncycastle.cert.CertIOException;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.operator.OperatorCreationException;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;
import org.bouncycastle.util.io.pem.PemObject;
import org.bouncycastle.util.io.pem.PemReader;
import org.bouncycastle.util.io.pem.PemWriter;
import org.stakenet.settings.NetworkSettings;

import java.io.ByteArrayInputStream;
import java.io.File;
import java.io.IOException;
import java.io.Reader;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.security.GeneralSecurityException;
import java.security.KeyFactory;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Security;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.security.spec.PKCS8EncodedKeySpec;
import java.util.Date;
import java.util.concurrent.TimeUnit;

/**
 * Generation and PEM persistence of node certificates.
 * <p>
 * Node certificates are self-signed: peers trust each other by {@link org.stakenet.network.PeerId},
 * not by certificate authority.
 */
public class CertificateUtils {

	private static final Logger LOGGER = LogManager.getLogger(CertificateUtils.class);

	private static final int KEY_SIZE = 2048; // bits
	private static final long VALIDITY = TimeUnit.DAYS.toMillis(10L * 365); // ms
	private static final String SIGNATURE_ALGORITHM = "SHA256WithRSAEncryption";
	private static final String SUBJECT = "CN=stakenet-node";

	static {
		if (Security.getProvider(BouncyCastleProvider.PROVIDER_NAME) == null)
			Security.addProvider(new BouncyCastleProvider());
	}

	private CertificateUtils() {
	}

	/** Generates a fresh RSA key pair and self-signed certificate. */
	public static NodeCredentials generate() throws GeneralSecurityException {
		KeyPairGenerator kpGen = KeyPairGenerator.getInstance("RSA");
		kpGen.initialize(KEY_SIZE, new SecureRandom());
		KeyPair keyPair = kpGen.generateKeyPair();

		X500Name subject = new X500Name(SUBJECT);
		long now = System.currentTimeMillis();
		BigInteger serial = BigInteger.valueOf(now);
		// Backdated slightly to tolerate clock differences between nodes
		Date notBefore = new Date(now - TimeUnit.DAYS.toMillis(1));
		Date notAfter = new Date(now + VALIDITY);

		JcaX509v3CertificateBuilder certBuilder = new JcaX509v3CertificateBuilder(subject, serial, notBefore, notAfter, subject, keyPair.getPublic());

		try {
			certBuilder.addExtension(Extension.basicConstraints, true, new BasicConstraints(false));
			certBuilder.addExtension(Extension.keyUsage, true, new KeyUsage(KeyUsage.digitalSignature | KeyUsage.keyEncipherment));

			JcaContentSignerBuilder signerBuilder = new JcaContentSignerBuilder(SIGNATURE_ALGORITHM).setProvider(BouncyCastleProvider.PROVIDER_NAME);
			X509Certificate certificate = new JcaX509CertificateConverter().getCertificate(certBuilder.build(signerBuilder.build(keyPair.getPrivate())));

			return new NodeCredentials(keyPair, certificate);
		} catch (CertIOException | OperatorCreationException e) {
			throw new GeneralSecurityException("Unable to build node certificate", e);
		}
	}

	/** Loads or creates credentials at <tt>certificatePath</tt> and <tt>privateKeyPath</tt> from settings. */
	public static NodeCredentials loadOrCreate(NetworkSettings settings) throws IOException, GeneralSecurityException {
		return loadOrCreate(Paths.get(settings.getCertificatePath()), Paths.get(settings.getPrivateKeyPath()));
	}

	/**
	 * Loads credentials from PEM files, generating and saving new ones if either file is missing.
	 */
	public static NodeCredentials loadOrCreate(Path certPath, Path keyPath) throws IOException, GeneralSecurityException {
		if (Files.exists(certPath) && Files.exists(keyPath))
			return load(certPath, keyPath);

		LOGGER.info("Generating new node certificate at {}", certPath);
		NodeCredentials credentials = generate();
		save(credentials, certPath, keyPath);
		return credentials;
	}

	public static NodeCredentials load(Path certPath, Path keyPath) throws IOException, GeneralSecurityException {
		X509Certificate certificate;
		try (Reader reader = Files.newBufferedReader(certPath, StandardCharsets.US_ASCII)) {
			certificate = readCertificate(reader);
		}

		PrivateKey privateKey;
		try (Reader reader = Files.newBufferedReader(keyPath, StandardCharsets.US_ASCII)) {
			privateKey = readPrivateKey(reader);
		}

		return new NodeCredentials(new KeyPair(certificate.getPublicKey(), privateKey), certificate);
	}

	public static void save(NodeCredentials credentials, Path certPath, Path keyPath) throws IOException, GeneralSecurityException {
		Path certDir = certPath.toAbsolutePath().getParent();
		if (certDir != null)
			Files.createDirectories(certDir);

		Path keyDir = keyPath.toAbsolutePath().getParent();
		if (keyDir != null)
			Files.createDirectories(keyDir);

		try (Writer writer = Files.newBufferedWriter(certPath, StandardCharsets.US_ASCII)) {
			writePem(writer, "CERTIFICATE", credentials.getCertificate().getEncoded());
		}

		try (Writer writer = Files.newBufferedWriter(keyPath, StandardCharsets.US_ASCII)) {
			writePem(writer, "PRIVATE KEY", credentials.getKeyPair().getPrivate().getEncoded());
		}

		setOwnerOnly(keyPath);
	}

	static X509Certificate readCertificate(Reader reader) throws IOException, GeneralSecurityException {
		byte[] der = readPem(reader, "CERTIFICATE");
		CertificateFactory cf = CertificateFactory.getInstance("X.509");
		return (X509Certificate) cf.generateCertificate(new ByteArrayInputStream(der));
	}

	static PrivateKey readPrivateKey(Reader reader) throws IOException, GeneralSecurityException {
		byte[] der = readPem(reader, "PRIVATE KEY");
		KeyFactory kf = KeyFactory.getInstance("RSA");
		return kf.generatePrivate(new PKCS8EncodedKeySpec(der));
	}

	private static void writePem(Writer writer, String type, byte[] der) throws IOException {
		try (PemWriter pw = new PemWriter(writer)) {
			pw.writeObject(new PemObject(type, der));
		}
	}

	private static byte[] readPem(Reader reader, String expectedType) throws IOException {
		try (PemReader pemReader = new PemReader(reader)) {
			PemObject pemObject = pemReader.readPemObject();
			if (pemObject == null)
				throw new IOException("No PEM data found");

			if (!expectedType.equals(pemObject.getType()))
				throw new IOException(String.format("Expected PEM %s but found %s", expectedType, pemObject.getType()));

			return pemObject.getContent();
		}
	}

	private static void setOwnerOnly(Path path) {
		File file = path.toFile();
		file.setReadable(false, false);
		file.setWritable(false, false);
		file.setExecutable(false, false);
		file.setReadable(true, true);
		file.setWritable(true, true);
	}

}
