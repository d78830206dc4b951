package com.idp.sa.token.jwt;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonSubTypes;
import com.fasterxml.jackson.annotation.JsonTypeInfo;

/**
 * Private key description parsed from a JSON Web Key, tagged by its {@code kty} member.
 */
@JsonTypeInfo(use = JsonTypeInfo.Id.NAME, include = JsonTypeInfo.As.PROPERTY, property = "kty")
@JsonSubTypes(@JsonSubTypes.Type(value = KeyDescription.Rsa.class, name = KeyDescription.RSA))
public sealed interface KeyDescription permits KeyDescription.Rsa {

    String RSA = "RSA";

    String keyType();

    /**
     * RSA private key members, each base64url encoded. {@code dp}, {@code dq} and {@code qi}
     * are recomputed from {@code d}, {@code p} and {@code q} and therefore not read.
     */
    @JsonIgnoreProperties(ignoreUnknown = true)
    record Rsa(
        @JsonProperty("n") String modulus,
        @JsonProperty("e") String publicExponent,
        @JsonProperty("d") String privateExponent,
        @JsonProperty("p") String primeP,
        @JsonProperty("q") String primeQ,
        @JsonProperty("kid") String keyId
    ) implements KeyDescription {

        @Override
        public String keyType() {
            return RSA;
        }

        @Override
        public String toString() {
            return "Rsa[kid=" + keyId + "]";
        }
    }
}
