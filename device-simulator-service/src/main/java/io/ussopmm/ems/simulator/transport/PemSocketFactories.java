package io.ussopmm.ems.simulator.transport;

import io.ussopmm.ems.simulator.credential.Credential;
import org.bouncycastle.asn1.pkcs.PrivateKeyInfo;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.openssl.PEMKeyPair;
import org.bouncycastle.openssl.PEMParser;
import org.bouncycastle.openssl.jcajce.JcaPEMKeyConverter;

import javax.net.ssl.KeyManagerFactory;
import javax.net.ssl.SSLContext;
import javax.net.ssl.SSLSocketFactory;
import javax.net.ssl.TrustManagerFactory;
import java.io.CharArrayReader;
import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.security.GeneralSecurityException;
import java.security.KeyStore;
import java.security.PrivateKey;
import java.security.SecureRandom;
import java.security.cert.Certificate;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Builds mutual-TLS socket factories from PEM key material.
 */
final class PemSocketFactories {

    private static final String KEY_ALIAS = "device";

    private PemSocketFactories() {
    }

    static SSLSocketFactory create(Credential credential, String rootCaPath) throws GeneralSecurityException, IOException {
        char[] certificatePem = credential.certificatePem();
        char[] privateKeyPem = credential.privateKeyPem();
        char[] storePassword = randomPassword();
        try {
            List<X509Certificate> chain = readCertificates(certificatePem);
            if (chain.isEmpty()) {
                throw new GeneralSecurityException("certificate PEM contains no certificate");
            }
            PrivateKey privateKey = readPrivateKey(privateKeyPem);

            KeyStore keyStore = KeyStore.getInstance("PKCS12");
            keyStore.load(null, null);
            keyStore.setKeyEntry(KEY_ALIAS, privateKey, storePassword, chain.toArray(new Certificate[0]));
            KeyManagerFactory kmf = KeyManagerFactory.getInstance(KeyManagerFactory.getDefaultAlgorithm());
            kmf.init(keyStore, storePassword);

            TrustManagerFactory tmf = TrustManagerFactory.getInstance(TrustManagerFactory.getDefaultAlgorithm());
            tmf.init(rootCaPath == null || rootCaPath.isBlank() ? null : trustStore(Path.of(rootCaPath)));

            SSLContext context = SSLContext.getInstance("TLSv1.2");
            context.init(kmf.getKeyManagers(), tmf.getTrustManagers(), new SecureRandom());
            return context.getSocketFactory();
        } finally {
            Arrays.fill(certificatePem, '\0');
            Arrays.fill(privateKeyPem, '\0');
            Arrays.fill(storePassword, '\0');
        }
    }

    static List<X509Certificate> readCertificates(char[] pem) throws IOException, GeneralSecurityException {
        JcaX509CertificateConverter converter = new JcaX509CertificateConverter();
        List<X509Certificate> certificates = new ArrayList<>();
        try (PEMParser parser = new PEMParser(new CharArrayReader(pem))) {
            Object object;
            while ((object = parser.readObject()) != null) {
                if (object instanceof X509CertificateHolder holder) {
                    certificates.add(converter.getCertificate(holder));
                }
            }
        }
        return certificates;
    }

    static PrivateKey readPrivateKey(char[] pem) throws IOException, GeneralSecurityException {
        JcaPEMKeyConverter converter = new JcaPEMKeyConverter();
        try (PEMParser parser = new PEMParser(new CharArrayReader(pem))) {
            Object object = parser.readObject();
            // PKCS#1 ("RSA PRIVATE KEY") or PKCS#8 ("PRIVATE KEY")
            if (object instanceof PEMKeyPair keyPair) {
                return converter.getKeyPair(keyPair).getPrivate();
            }
            if (object instanceof PrivateKeyInfo keyInfo) {
                return converter.getPrivateKey(keyInfo);
            }
            throw new GeneralSecurityException("unsupported private key PEM: "
                    + (object == null ? "empty" : object.getClass().getSimpleName()));
        }
    }

    private static KeyStore trustStore(Path rootCaPath) throws IOException, GeneralSecurityException {
        KeyStore trustStore = KeyStore.getInstance("PKCS12");
        trustStore.load(null, null);
        CertificateFactory factory = CertificateFactory.getInstance("X.509");
        try (InputStream in = Files.newInputStream(rootCaPath)) {
            int i = 0;
            for (Certificate certificate : factory.generateCertificates(in)) {
                trustStore.setCertificateEntry("root-ca-" + i++, certificate);
            }
        }
        return trustStore;
    }

    private static char[] randomPassword() {
        SecureRandom random = new SecureRandom();
        char[] password = new char[24];
        for (int i = 0; i < password.length; i++) {
            password[i] = (char) ('a' + random.nextInt(26));
        }
        return password;
    }
}
