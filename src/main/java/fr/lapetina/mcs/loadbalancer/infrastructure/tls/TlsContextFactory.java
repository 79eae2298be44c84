package fr.lapetina.mcs.loadbalancer.infrastructure.tls;

import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.openssl.PEMEncryptedKeyPair;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;
import org.bouncycastle.pkcs.PKCS8EncryptedPrivateKeyInfo;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import java.io.IOException;
import java.io.InputStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.Signature;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.Collection;
import java.util.UUID;

/**
 * Builds the server {@link SSLContext} from a PEM certificate chain and a PEM private key.
 *
 * Supported key encodings: PKCS#8 ({@code PRIVATE KEY}), PKCS#1 RSA
 * ({@code RSA PRIVATE KEY}) and SEC1 EC ({@code EC PRIVATE KEY}). Encrypted keys are
 * rejected. The key must match the public key of the first certificate.
 */
public final class TlsContextFactory {

    private static final Logger log = LoggerFactory.getLogger(TlsContextFactory.class);

    private static final String KEY_ALIAS = "server";

    private TlsContextFactory() {
    }

    /**
     * Loads the material and initialises a server SSL context.
     *
     * @throws TlsConfigurationException if anything is missing, unreadable or inconsistent
     */
    public static SSLContext createServerContext(Path certPath, Path keyPath) {
        X509Certificate[] chain = loadCertificateChain(certPath);
        PrivateKey key = loadPrivateKey(keyPath);
        verifyKeyMatchesCertificate(key, chain[0], certPath, keyPath);

        try {
            // In-memory store, the password never leaves this method
            char[] password = UUID.randomUUID().toString().toCharArray();
            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry(KEY_ALIAS, key, password, chain);

            KeyManagerFactory keyManagerFactory = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            keyManagerFactory.init(keyStore, password);

            SSLContext context = SSLContext.getInstance("TLS");
            context.init(keyManagerFactory.getKeyManagers(), null, new SecureRandom());

            log.info("TLS context created: subject={}, notAfter={}, chainLength={}, keyAlgorithm={}",
                    chain[0].getSubjectX500Principal().getName(), chain[0].getNotAfter(), chain.length,
                    key.getAlgorithm());
            return context;
        } catch (GeneralSecurityException | IOException e) {
            throw new TlsConfigurationException("Failed to initialise TLS context: " + e.getMessage(), e);
        }
    }

    /**
     * Reads every certificate of a PEM file, leaf first.
     */
    public static X509Certificate[] loadCertificateChain(Path certPath) {
        if (!Files.isReadable(certPath)) {
            throw new TlsConfigurationException("TLS certificate not found or not readable: " + certPath);
        }
        try (InputStream in = Files.newInputStream(certPath)) {
            Collection<? extends Certificate> certificates =
                    CertificateFactory.getInstance("X.509").generateCertificates(in);
            if (certificates.isEmpty()) {
                throw new TlsConfigurationException("No certificate found in " + certPath);
            }
            return certificates.stream()
                    .map(X509Certificate.class::cast)
                    .toArray(X509Certificate[]::new);
        } catch (GeneralSecurityException | IOException e) {
            throw new TlsConfigurationException("Failed to read TLS certificate " + certPath + ": " + e.getMessage(), e);
        }
    }

    /**
     * Reads the first private key of a PEM file.
     */
    public static PrivateKey loadPrivateKey(Path keyPath) {
        if (!Files.isReadable(keyPath)) {
            throw new TlsConfigurationException("TLS private key not found or not readable: " + keyPath);
        }
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        try (Reader reader = Files.newBufferedReader(keyPath, StandardCharsets.US_ASCII);
             PEMParser parser = new PEMParser(reader)) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof PEMKeyPair keyPair) {
                    // PKCS#1 RSA or SEC1 EC
                    return converter.getKeyPair(keyPair).getPrivate();
                }
                if (object instanceof PrivateKeyInfo keyInfo) {
                    // PKCS#8
                    return converter.getPrivateKey(keyInfo);
                }
                if (object instanceof PEMEncryptedKeyPair || object instanceof PKCS8EncryptedPrivateKeyInfo) {
                    throw new TlsConfigurationException("Encrypted TLS private keys are not supported: " + keyPath);
                }
                // EC PARAMETERS and other blocks precede the key
                log.debug("Skipping PEM object in {}: {}", keyPath, object.getClass().getSimpleName());
            }
        } catch (TlsConfigurationException e) {
            throw e;
        } catch (IOException | RuntimeException e) {
            // Corrupt PEM content surfaces as unchecked BouncyCastle exceptions
            throw new TlsConfigurationException("Failed to read TLS private key " + keyPath + ": " + e.getMessage(), e);
        }
        throw new TlsConfigurationException("No private key found in " + keyPath);
    }

    private static void verifyKeyMatchesCertificate(PrivateKey key, X509Certificate certificate,
                                                    Path certPath, Path keyPath) {
        String algorithm = signatureAlgorithm(key);
        if (algorithm == null) {
            log.warn("Cannot verify key/certificate match for key algorithm {}", key.getAlgorithm());
            return;
        }
        try {
            byte[] challenge = new byte[32];
            new SecureRandom().nextBytes(challenge);

            Signature signer = Signature.getInstance(algorithm);
            signer.initSign(key);
            signer.update(challenge);
            byte[] signature = signer.sign();

            Signature verifier = Signature.getInstance(algorithm);
            verifier.initVerify(certificate.getPublicKey());
            verifier.update(challenge);
            if (!verifier.verify(signature)) {
                throw new TlsConfigurationException("TLS private key " + keyPath
                        + " does not match certificate " + certPath);
            }
        } catch (GeneralSecurityException e) {
            throw new TlsConfigurationException("TLS private key " + keyPath
                    + " does not match certificate " + certPath + ": " + e.getMessage(), e);
        }
    }

    private static String signatureAlgorithm(PrivateKey key) {
        return switch (key.getAlgorithm()) {
            case "RSA" -> "SHA256withRSA";
            case "EC", "ECDSA" -> "SHA256withECDSA";
            case "Ed25519", "EdDSA" -> "Ed25519";
            default -> null;
        };
    }
}
