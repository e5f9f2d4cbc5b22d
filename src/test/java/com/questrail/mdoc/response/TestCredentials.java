package com.questrail.mdoc.response;

import com.questrail.mdoc.connectionmethod.BleConnectionMethod;
import com.questrail.mdoc.crypto.CoseAlgorithm;
import com.questrail.mdoc.crypto.Digests;
import com.questrail.mdoc.crypto.EcCurve;
import com.questrail.mdoc.crypto.EcKeys;
import com.questrail.mdoc.crypto.cose.CoseKey;
import com.questrail.mdoc.crypto.cose.CoseSigner;
import com.questrail.mdoc.engagement.CborEngagementCodec;
import com.questrail.mdoc.engagement.DeviceEngagement;
import com.questrail.mdoc.presentment.MdocCredential;
import com.questrail.mdoc.request.DocRequest;
import com.questrail.mdoc.securearea.CreateKeySettings;
import com.questrail.mdoc.securearea.KeyInfo;
import com.questrail.mdoc.securearea.KeyPurpose;
import com.questrail.mdoc.securearea.SecureArea;
import com.questrail.mdoc.securearea.SoftwareSecureArea;
import com.questrail.mdoc.session.Handover;
import com.questrail.mdoc.session.SessionTranscript;
import com.upokecenter.cbor.CBORObject;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.cert.X509CertificateHolder;
import org.bouncycastle.cert.jcajce.JcaX509CertificateConverter;
import org.bouncycastle.cert.jcajce.JcaX509v3CertificateBuilder;
import org.bouncycastle.operator.ContentSigner;
import org.bouncycastle.operator.jcajce.JcaContentSignerBuilder;

import java.math.BigInteger;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.cert.X509Certificate;
import java.security.interfaces.ECPublicKey;
import java.time.Duration;
import java.time.Instant;
import java.util.Date;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Issuer, reader and device key material for tests, plus a ready-made mDL.
 *
 * <p>Every instance generates fresh keys; creating one costs a few EC key
 * generations and two self-signed certificates.</p>
 */
public final class TestCredentials
{
    public static final String DOC_TYPE = "org.iso.18013.5.1.mDL";
    public static final String NAMESPACE = "org.iso.18013.5.1";
    public static final String DEVICE_KEY_ALIAS = "mdl-device-key";

    private final KeyPair issuerKey;
    private final X509Certificate issuerCertificate;
    private final KeyPair readerKey;
    private final X509Certificate readerCertificate;
    private final SecureArea secureArea = new SoftwareSecureArea();
    private final KeyInfo deviceKey;
    private final IssuerNamespaces issuerNamespaces;
    private final byte[] encodedIssuerAuth;

    public TestCredentials() {
        issuerKey = EcKeys.generateKeyPair(EcCurve.P256);
        issuerCertificate = selfSigned(issuerKey, "CN=Test mDL Issuer");
        readerKey = EcKeys.generateKeyPair(EcCurve.P256);
        readerCertificate = selfSigned(readerKey, "CN=Test mDL Reader");
        deviceKey = secureArea.createKey(DEVICE_KEY_ALIAS, CreateKeySettings.builder()
                .withCurve(EcCurve.P256)
                .withPurposes(Set.of(KeyPurpose.SIGN, KeyPurpose.AGREE_KEY))
                .build());

        issuerNamespaces = IssuerNamespaces.builder()
                .addDataElement(NAMESPACE, "family_name", CBORObject.FromObject("Mustermann"))
                .addDataElement(NAMESPACE, "given_name", CBORObject.FromObject("Erika"))
                .addDataElement(NAMESPACE, "age_over_21", CBORObject.True)
                .addDataElement(NAMESPACE, "document_number", CBORObject.FromObject("D1234567"))
                .build();

        Instant now = Instant.now();
        byte[] mso = new MobileSecurityObjectGenerator(Digests.SHA_256, DOC_TYPE, deviceKey.publicKey())
                .addIssuerNamespaces(issuerNamespaces)
                .setValidityInfo(new ValidityInfo(now, now.minus(Duration.ofHours(1)), now.plus(Duration.ofDays(365)), null))
                .generate();
        encodedIssuerAuth = MobileSecurityObjectGenerator.signIssuerAuth(
                mso, jcaSigner(issuerKey.getPrivate()), List.of(issuerCertificate));
    }

    public MdocCredential mdl() {
        return new MdocCredential(DOC_TYPE, issuerNamespaces, encodedIssuerAuth, secureArea, DEVICE_KEY_ALIAS);
    }

    public IssuerNamespaces issuerNamespaces() {
        return issuerNamespaces;
    }

    public byte[] encodedIssuerAuth() {
        return encodedIssuerAuth.clone();
    }

    public SecureArea secureArea() {
        return secureArea;
    }

    public ECPublicKey devicePublicKey() {
        return deviceKey.publicKey();
    }

    public X509Certificate issuerCertificate() {
        return issuerCertificate;
    }

    public CoseSigner readerSigner() {
        return jcaSigner(readerKey.getPrivate());
    }

    public List<X509Certificate> readerCertChain() {
        return List.of(readerCertificate);
    }

    /** Family name, given name and age_over_21. */
    public static DocRequest mdlRequest() {
        Map<String, Boolean> elements = new LinkedHashMap<>();
        elements.put("family_name", false);
        elements.put("given_name", false);
        elements.put("age_over_21", false);
        return DocRequest.of(DOC_TYPE, Map.of(NAMESPACE, elements));
    }

    /** A QR-engagement transcript between fresh ephemeral keys. */
    public static byte[] sessionTranscript(ECPublicKey eReaderKey) {
        ECPublicKey eDeviceKey = (ECPublicKey) EcKeys.generateKeyPair(EcCurve.P256).getPublic();
        byte[] engagement = new CborEngagementCodec().encode(DeviceEngagement.of(eDeviceKey,
                List.of(BleConnectionMethod.peripheralServer(UUID.randomUUID()))));
        return SessionTranscript.compute(engagement, CoseKey.encode(eReaderKey), Handover.qr());
    }

    // -------------------------------------------------------------------------

    public static CoseSigner jcaSigner(PrivateKey privateKey) {
        return new CoseSigner() {
            @Override
            public CoseAlgorithm algorithm() {
                return CoseAlgorithm.ES256;
            }

            @Override
            public byte[] sign(byte[] toBeSigned) {
                try {
                    Signature signature = Signature.getInstance(CoseAlgorithm.ES256.jcaName());
                    signature.initSign(privateKey);
                    signature.update(toBeSigned);
                    return signature.sign();
                } catch (GeneralSecurityException e) {
                    throw new IllegalStateException(e);
                }
            }
        };
    }

    private static X509Certificate selfSigned(KeyPair keyPair, String dn) {
        try {
            X500Name name = new X500Name(dn);
            Instant now = Instant.now();
            JcaX509v3CertificateBuilder builder = new JcaX509v3CertificateBuilder(
                    name,
                    BigInteger.valueOf(now.toEpochMilli()),
                    Date.from(now.minus(Duration.ofDays(1))),
                    Date.from(now.plus(Duration.ofDays(365))),
                    name,
                    keyPair.getPublic());
            ContentSigner signer = new JcaContentSignerBuilder("SHA256withECDSA").build(keyPair.getPrivate());
            X509CertificateHolder holder = builder.build(signer);
            return new JcaX509CertificateConverter().getCertificate(holder);
        } catch (Exception e) {
            throw new IllegalStateException("Unable to create test certificate for " + dn, e);
        }
    }
}
