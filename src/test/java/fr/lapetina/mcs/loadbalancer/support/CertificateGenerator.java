package fr.lapetina.mcs.loadbalancer.support;

import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x509.SubjectPublicKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.X509v3CertificateBuilder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.jce.provider.BouncyCastleProvider;
import org.bouncycastle.openssl.jcajce.JcaPEMWriter;
import org.bouncycastle.openssl.jcajce.JcaPKCS8Generator;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import javax.net.ssl.SSLContext;
import javax.net.ssl.TrustManagerFactory;
import java.io.IOException;
import java.io.Writer;
import java.math.BigInteger;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.KeyStore;
import java.security.SecureRandom;
import java.security.cert.X509Certificate;
import java.security.spec.ECGenParameterSpec;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;

/**
 * Generates self-signed certificates and PEM files for TLS tests.
 */
public final class CertificateGenerator {

    public enum KeyFormat {
        /** RSA key as {@code RSA PRIVATE KEY}. */
        PKCS1,
        /** RSA key as {@code PRIVATE KEY}. */
        PKCS8,
        /** EC key as {@code EC PRIVATE KEY}. */
        SEC1
    }

    public record Material(KeyPair keyPair, X509Certificate certificate, Path certPem, Path keyPem) {
    }

    private CertificateGenerator() {
    }

    public static Material generate(Path directory, KeyFormat format) {
        try {
            KeyPair pair = format == KeyFormat.SEC1 ? generateEcKeyPair() : generateRsaKeyPair();
            X509Certificate certificate = selfSigned(pair);
            Path certPem = directory.resolve("server.cert");
            Path keyPem = directory.resolve("server.key");
            writePem(certPem, certificate);
            if (format == KeyFormat.PKCS8) {
                writePem(keyPem, new JcaPKCS8Generator(pair.getPrivate(), null));
            } else {
                writePem(keyPem, pair.getPrivate());
            }
            return new Material(pair, certificate, certPem, keyPem);
        } catch (Exception e) {
            throw new IllegalStateException("Failed to generate test certificate", e);
        }
    }

    public static KeyPair generateRsaKeyPair() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("RSA");
        generator.initialize(2048, new SecureRandom());
        return generator.generateKeyPair();
    }

    /**
     * EC key pair from the BouncyCastle provider, whose encoding keeps the curve
     * parameters inside the SEC1 structure.
     */
    public static KeyPair generateEcKeyPair() throws Exception {
        KeyPairGenerator generator = KeyPairGenerator.getInstance("EC", new BouncyCastleProvider());
        generator.initialize(new ECGenParameterSpec("secp256r1"), new SecureRandom());
        return generator.generateKeyPair();
    }

    public static X509Certificate selfSigned(KeyPair pair) throws Exception {
        Instant now = Instant.now();
        X509v3CertificateBuilder builder = new X509v3CertificateBuilder(
                new X500Name("CN=localhost"),
                BigInteger.valueOf(now.toEpochMilli()),
                Date.from(now.minus(Duration.ofMinutes(1))),
                Date.from(now.plus(Duration.ofDays(1))),
                new X500Name("CN=localhost"),
                SubjectPublicKeyInfo.getInstance(pair.getPublic().getEncoded()));
        String algorithm = "EC".equals(pair.getPrivate().getAlgorithm()) ? "SHA256withECDSA" : "SHA256withRSA";
        X509CertificateHolder holder = builder.build(new JcaContentSignerBuilder(algorithm).build(pair.getPrivate()));
        return new JcaX509CertificateConverter().getCertificate(holder);
    }

    public static void writePem(Path path, Object object) throws IOException {
        try (Writer writer = Files.newBufferedWriter(path, StandardCharsets.US_ASCII);
             JcaPEMWriter pemWriter = new JcaPEMWriter(writer)) {
            pemWriter.writeObject(object);
        }
    }

    /**
     * Client context trusting only the given certificate.
     */
    public static SSLContext clientContext(X509Certificate trusted) throws Exception {
        KeyStore trustStore = KeyStore.getInstance("PKCS12");
        trustStore.load(null, null);
        trustStore.setCertificateEntry("server", trusted);
        TrustManagerFactory trustManagerFactory = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
        trustManagerFactory.init(trustStore);
        SSLContext context = SSLContext.getInstance("TLS");
        context.init(null, trustManagerFactory.getTrustManagers(), new SecureRandom());
        return context;
    }
}
