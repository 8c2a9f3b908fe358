package net.certauth.core.claims;

import java.security.cert.X509Certificate;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import net.certauth.log.AuthLogger;
import net.certauth.log.AuthLoggerFactory;
import org.bouncycastle.asn1.ASN1Encodable;
import org.bouncycastle.asn1.ASN1ObjectIdentifier;
import org.bouncycastle.asn1.ASN1OctetString;
import org.bouncycastle.asn1.ASN1Primitive;
import org.bouncycastle.asn1.ASN1String;
import org.bouncycastle.asn1.ASN1TaggedObject;
import org.bouncycastle.asn1.x500.AttributeTypeAndValue;
import org.bouncycastle.asn1.x500.RDN;
import org.bouncycastle.asn1.x500.X500Name;
import org.bouncycastle.asn1.x500.style.BCStyle;
import org.bouncycastle.asn1.x509.Extension;
import org.bouncycastle.asn1.x509.GeneralName;
import org.bouncycastle.asn1.x509.GeneralNames;
import org.bouncycastle.asn1.x509.OtherName;

/**
 * Reads the name forms of a certificate from its subject and subject alternative name extension.
 * Every method returns null when the certificate has no such name.
 */
public class CertificateNameExtractor {
  private static final AuthLogger logger =
      AuthLoggerFactory.getLogger(CertificateNameExtractor.class);

  /** Microsoft user principal name, carried as a SAN otherName. */
  static final ASN1ObjectIdentifier UPN_OID = new ASN1ObjectIdentifier("1.3.6.1.4.1.311.20.2.3");

  /** First SAN dNSName, else the subject common name. */
  public String getDnsName(X509Certificate cert) {
    String dns = firstSubjectAlternativeName(cert, GeneralName.dNSName);
    return dns != null ? dns : subjectAttribute(cert, BCStyle.CN);
  }

  /**
   * Subject common name, else organizational unit, else organization, else e-mail attribute,
   * else the first SAN e-mail, DNS name or URI.
   */
  public String getSimpleName(X509Certificate cert) {
    ASN1ObjectIdentifier[] attributes = {
      BCStyle.CN, BCStyle.OU, BCStyle.O, BCStyle.EmailAddress
    };
    for (ASN1ObjectIdentifier attribute : attributes) {
      String value = subjectAttribute(cert, attribute);
      if (value != null) {
        return value;
      }
    }
    int[] sanTags = {
      GeneralName.rfc822Name, GeneralName.dNSName, GeneralName.uniformResourceIdentifier
    };
    for (int tag : sanTags) {
      String value = firstSubjectAlternativeName(cert, tag);
      if (value != null) {
        return value;
      }
    }
    return null;
  }

  /** First SAN rfc822Name, else the subject e-mail attribute. */
  public String getEmailName(X509Certificate cert) {
    String email = firstSubjectAlternativeName(cert, GeneralName.rfc822Name);
    return email != null ? email : subjectAttribute(cert, BCStyle.EmailAddress);
  }

  public String getUpnName(X509Certificate cert) {
    for (GeneralName name : subjectAlternativeNames(cert)) {
      if (name.getTagNo() != GeneralName.otherName) {
        continue;
      }
      try {
        OtherName otherName = OtherName.getInstance(name.getName());
        if (UPN_OID.equals(otherName.getTypeID())) {
          return stringValue(otherName.getValue());
        }
      } catch (IllegalArgumentException e) {
        logger.debug(
            "Skipping malformed otherName in certificate {}: {}",
            cert.getSubjectX500Principal(),
            e.getMessage());
      }
    }
    return null;
  }

  public String getUriName(X509Certificate cert) {
    return firstSubjectAlternativeName(cert, GeneralName.uniformResourceIdentifier);
  }

  private static String firstSubjectAlternativeName(X509Certificate cert, int tagNo) {
    for (GeneralName name : subjectAlternativeNames(cert)) {
      if (name.getTagNo() == tagNo) {
        String value = stringValue(name.getName());
        if (value != null && !value.trim().isEmpty()) {
          return value;
        }
      }
    }
    return null;
  }

  static List<GeneralName> subjectAlternativeNames(X509Certificate cert) {
    byte[] extensionBytes = cert.getExtensionValue(Extension.subjectAlternativeName.getId());
    if (extensionBytes == null) {
      return Collections.emptyList();
    }
    try {
      ASN1OctetString octetString = (ASN1OctetString) ASN1Primitive.fromByteArray(extensionBytes);
      GeneralNames generalNames =
          GeneralNames.getInstance(ASN1Primitive.fromByteArray(octetString.getOctets()));
      List<GeneralName> names = new ArrayList<>();
      Collections.addAll(names, generalNames.getNames());
      return names;
    } catch (Exception e) {
      logger.debug(
          "Failed to parse subject alternative names of certificate {}: {}",
          cert.getSubjectX500Principal(),
          e.getMessage());
      return Collections.emptyList();
    }
  }

  private static String subjectAttribute(X509Certificate cert, ASN1ObjectIdentifier attribute) {
    X500Name subject = X500Name.getInstance(cert.getSubjectX500Principal().getEncoded());
    for (RDN rdn : subject.getRDNs(attribute)) {
      // a multi-valued RDN holds its values in DER order, not in the order asked for
      for (AttributeTypeAndValue typeAndValue : rdn.getTypesAndValues()) {
        if (!attribute.equals(typeAndValue.getType())) {
          continue;
        }
        String value = stringValue(typeAndValue.getValue());
        if (value != null && !value.trim().isEmpty()) {
          return value;
        }
      }
    }
    return null;
  }

  private static String stringValue(ASN1Encodable value) {
    if (value instanceof ASN1TaggedObject) {
      // otherName values are explicitly tagged
      value = ((ASN1TaggedObject) value).getBaseObject();
    }
    if (value instanceof ASN1String) {
      return ((ASN1String) value).getString();
    }
    return value == null ? null : value.toString();
  }
}
