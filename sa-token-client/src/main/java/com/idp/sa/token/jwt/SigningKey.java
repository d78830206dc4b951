package com.idp.sa.token.jwt;

import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.util.Objects;

/**
 * RSA signing capability for one token request. The private half never leaves this package.
 */
public final class SigningKey {
    /** Smallest modulus RS256 signing accepts. */
    public static final int MIN_MODULUS_BITS = 2048;

    private final RSAPrivateCrtKey privateKey;
    private final RSAPublicKey publicKey;

    SigningKey(RSAPrivateCrtKey privateKey, RSAPublicKey publicKey) {
        this.privateKey = Objects.requireNonNull(privateKey, "privateKey");
        this.publicKey = Objects.requireNonNull(publicKey, "publicKey");
    }

    public RSAPublicKey publicKey() {
        return publicKey;
    }

    public int bitLength() {
        return publicKey.getModulus().bitLength();
    }

    RSAPrivateCrtKey privateKey() {
        return privateKey;
    }

    @Override
    public String toString() {
        return "SigningKey[RSA, " + bitLength() + " bits]";
    }
}
