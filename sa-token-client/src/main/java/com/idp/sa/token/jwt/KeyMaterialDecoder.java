package com.idp.sa.token.jwt;

import com.fasterxml.jackson.core.JsonLocation;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.exc.InvalidTypeIdException;
import com.idp.sa.token.KeyMaterialException;

import java.math.BigInteger;
import java.security.KeyFactory;
import java.security.NoSuchAlgorithmException;
import java.security.interfaces.RSAPrivateCrtKey;
import java.security.interfaces.RSAPublicKey;
import java.security.spec.InvalidKeySpecException;
import java.security.spec.RSAPrivateCrtKeySpec;
import java.security.spec.RSAPublicKeySpec;
import java.util.Base64;
import java.util.Objects;

import lombok.extern.slf4j.Slf4j;

/**
 * Rebuilds an RSA signing key from a JSON Web Key or a PEM key.
 *
 * <p>The public exponent is always 65537; the JWK {@code e} member is not read.
 * CRT parameters are derived from {@code d}, {@code p} and {@code q} when the key is built.
 */
@Slf4j
public final class KeyMaterialDecoder {
    static final BigInteger PUBLIC_EXPONENT = BigInteger.valueOf(65537);
    private static final String STANDARD_EXPONENT = "AQAB";

    private final ObjectMapper mapper;

    public KeyMaterialDecoder() {
        this(new ObjectMapper());
    }

    public KeyMaterialDecoder(ObjectMapper mapper) {
        this.mapper = Objects.requireNonNull(mapper, "mapper");
    }

    public SigningKey decode(KeySource source) {
        if (source instanceof KeySource.Jwk jwk) {
            return decode(parse(jwk.json()));
        }
        if (source instanceof KeySource.Pem pem) {
            return PemKeyLoader.loadSigningKey(pem.pem());
        }
        throw new KeyMaterialException("keySource", "unsupported key source " + source);
    }

    public KeyDescription parse(String jwkJson) {
        KeyDescription description;
        try {
            description = mapper.readValue(jwkJson, KeyDescription.class);
        } catch (InvalidTypeIdException e) {
            throw new KeyMaterialException("kty", "missing or unsupported key type, expected " + KeyDescription.RSA);
        } catch (JsonProcessingException e) {
            // Jackson messages quote the offending input, report the position only
            throw new KeyMaterialException("jwk_json", "not a valid JSON Web Key" + position(e.getLocation()));
        }
        if (description == null) {
            throw new KeyMaterialException("jwk_json", "empty JSON Web Key");
        }
        return description;
    }

    public SigningKey decode(KeyDescription description) {
        Objects.requireNonNull(description, "description");
        if (description instanceof KeyDescription.Rsa rsa) {
            return decodeRsa(rsa);
        }
        throw new KeyMaterialException("kty", "unsupported key type " + description.keyType());
    }

    private SigningKey decodeRsa(KeyDescription.Rsa rsa) {
        BigInteger n = unsigned("n", rsa.modulus());
        BigInteger d = unsigned("d", rsa.privateExponent());
        BigInteger p = unsigned("p", rsa.primeP());
        BigInteger q = unsigned("q", rsa.primeQ());

        if (rsa.publicExponent() != null && !STANDARD_EXPONENT.equals(rsa.publicExponent())) {
            log.warn("Ignoring JWK public exponent for key {}, using 65537", rsa.keyId());
        }
        if (!n.equals(p.multiply(q))) {
            throw new KeyMaterialException("n", "modulus does not match the prime factors");
        }
        if (n.bitLength() < SigningKey.MIN_MODULUS_BITS) {
            throw new KeyMaterialException("n", "RSA key of " + n.bitLength() + " bits is below the "
                + SigningKey.MIN_MODULUS_BITS + "-bit minimum for RS256");
        }

        BigInteger qInverse;
        try {
            qInverse = q.modInverse(p);
        } catch (ArithmeticException e) {
            throw new KeyMaterialException("q", "prime factors are not coprime");
        }
        RSAPrivateCrtKeySpec spec = new RSAPrivateCrtKeySpec(
            n,
            PUBLIC_EXPONENT,
            d,
            p,
            q,
            d.mod(p.subtract(BigInteger.ONE)),
            d.mod(q.subtract(BigInteger.ONE)),
            qInverse);

        try {
            KeyFactory factory = KeyFactory.getInstance("RSA");
            RSAPrivateCrtKey privateKey = (RSAPrivateCrtKey) factory.generatePrivate(spec);
            RSAPublicKey publicKey = (RSAPublicKey) factory.generatePublic(new RSAPublicKeySpec(n, PUBLIC_EXPONENT));
            log.debug("Decoded {}-bit RSA key {}", n.bitLength(), rsa.keyId());
            return new SigningKey(privateKey, publicKey);
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("RSA not available", e);
        } catch (InvalidKeySpecException e) {
            throw new KeyMaterialException("jwk_json", "RSA key parameters rejected");
        }
    }

    private static BigInteger unsigned(String field, String value) {
        if (value == null || value.isBlank()) {
            throw new KeyMaterialException(field, "missing");
        }
        if (value.indexOf('=') >= 0) {
            throw new KeyMaterialException(field, "base64url value must not be padded");
        }
        byte[] raw;
        try {
            raw = Base64.getUrlDecoder().decode(value);
        } catch (IllegalArgumentException e) {
            throw new KeyMaterialException(field, "not valid base64url (length " + value.length() + ")");
        }
        BigInteger decoded = new BigInteger(1, raw);
        if (decoded.signum() == 0) {
            throw new KeyMaterialException(field, "decodes to zero");
        }
        return decoded;
    }

    private static String position(JsonLocation location) {
        if (location == null) {
            return "";
        }
        return " at line " + location.getLineNr() + ", column " + location.getColumnNr();
    }
}
