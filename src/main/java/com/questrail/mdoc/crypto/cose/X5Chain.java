package com.questrail.mdoc.crypto.cose;

import com.questrail.mdoc.cbor.MdocCbor;
import com.upokecenter.cbor.CBORObject;
import com.upokecenter.cbor.CBORType;

import java.io.ByteArrayInputStream;
import java.security.cert.CertificateEncodingException;
import java.security.cert.CertificateException;
import java.security.cert.CertificateFactory;
import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.List;

/**
 * The {@code x5chain} header parameter: a single DER certificate as a byte string,
 * or an array of them, leaf first.
 */
public final class X5Chain
{
    private X5Chain() {}

    public static CBORObject toCbor(List<X509Certificate> chain) {
        try {
            if (chain.size() == 1) {
                return CBORObject.FromObject(chain.get(0).getEncoded());
            }
            CBORObject array = CBORObject.NewArray();
            for (X509Certificate certificate : chain) {
                array.Add(certificate.getEncoded());
            }
            return array;
        } catch (CertificateEncodingException e) {
            throw new CoseException("Unable to encode certificate chain", e);
        }
    }

    public static List<X509Certificate> fromCbor(CBORObject item) {
        List<X509Certificate> chain = new ArrayList<>();
        if (item == null) {
            return chain;
        }
        try {
            CertificateFactory factory = CertificateFactory.getInstance("X.509");
            if (item.getType() == CBORType.ByteString) {
                chain.add(parse(factory, item.GetByteString()));
            } else {
                CBORObject array = MdocCbor.requireArray(item, "x5chain");
                for (int i = 0; i < array.size(); i++) {
                    chain.add(parse(factory, MdocCbor.requireBytes(array.get(i), "x5chain entry")));
                }
            }
        } catch (CertificateException e) {
            throw new CoseException("Malformed x5chain certificate", e);
        }
        return chain;
    }

    private static X509Certificate parse(CertificateFactory factory, byte[] der) throws CertificateException {
        return (X509Certificate) factory.generateCertificate(new ByteArrayInputStream(der));
    }
}
