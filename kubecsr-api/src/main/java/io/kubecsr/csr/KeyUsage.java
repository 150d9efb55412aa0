/*
 * Copyright Kubecsr Authors.
 *
 * Licensed under the Apache Software License version 2.0, available at http://www.apache.org/licenses/LICENSE-2.0
 */

package io.kubecsr.csr;

import java.util.Arrays;
import java.util.Collection;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The key usages a Kubernetes certificate signing request may ask for, keyed by the string the API carries.
 */
public enum KeyUsage {
    SIGNING("signing"),
    DIGITAL_SIGNATURE("digital signature"),
    CONTENT_COMMITMENT("content commitment"),
    KEY_ENCIPHERMENT("key encipherment"),
    KEY_AGREEMENT("key agreement"),
    DATA_ENCIPHERMENT("data encipherment"),
    CERT_SIGN("cert sign"),
    CRL_SIGN("crl sign"),
    ENCIPHER_ONLY("encipher only"),
    DECIPHER_ONLY("decipher only"),
    ANY("any"),
    SERVER_AUTH("server auth"),
    CLIENT_AUTH("client auth"),
    CODE_SIGNING("code signing"),
    EMAIL_PROTECTION("email protection"),
    SMIME("s/mime"),
    IPSEC_END_SYSTEM("ipsec end system"),
    IPSEC_TUNNEL("ipsec tunnel"),
    IPSEC_USER("ipsec user"),
    TIMESTAMPING("timestamping"),
    OCSP_SIGNING("ocsp signing"),
    MICROSOFT_SGC("microsoft sgc"),
    NETSCAPE_SGC("netscape sgc");

    private static final Map<String, KeyUsage> BY_WIRE_VALUE = Arrays.stream(values())
            .collect(Collectors.toUnmodifiableMap(KeyUsage::wireValue, Function.identity()));

    private final String wireValue;

    KeyUsage(String wireValue) {
        this.wireValue = wireValue;
    }

    public String wireValue() {
        return wireValue;
    }

    public static Optional<KeyUsage> fromWireValue(String value) {
        return Optional.ofNullable(BY_WIRE_VALUE.get(value));
    }

    public static Set<String> wireValues(Collection<KeyUsage> usages) {
        return usages.stream().map(KeyUsage::wireValue).collect(Collectors.toUnmodifiableSet());
    }
}
