package com.idp.sa.token.jwt;

import java.util.Objects;

/**
 * Where the service account's private key comes from. Exactly one source is configured per request.
 */
public sealed interface KeySource {

    /**
     * A JSON Web Key holding an RSA private key.
     */
    record Jwk(String json) implements KeySource {
        public Jwk {
            Objects.requireNonNull(json, "json");
        }

        @Override
        public String toString() {
            return "Jwk[length=" + json.length() + "]";
        }
    }

    /**
     * A PKCS#8 PEM encoded RSA private key.
     */
    record Pem(String pem) implements KeySource {
        public Pem {
            Objects.requireNonNull(pem, "pem");
        }

        @Override
        public String toString() {
            return "Pem[length=" + pem.length() + "]";
        }
    }
}
