package com.vface.api.support;

import com.vface.api.key.PemKeys;
import com.vface.api.registry.RevocationMessage;

import java.nio.charset.StandardCharsets;
import java.security.GeneralSecurityException;
import java.security.KeyPair;
import java.security.KeyPairGenerator;
import java.security.PrivateKey;
import java.security.Signature;
import java.security.spec.ECGenParameterSpec;
import java.util.HexFormat;
import java.util.Random;

/**
 * Vectors, owner keypairs and signed revocation messages for tests.
 */
public final class TestVectors {

    public static final int DIMENSION = 128;

    private TestVectors() {
    }

    public static double[] randomUnitVector(Random random) {
        double[] v = new double[DIMENSION];
        double norm = 0;
        for (int i = 0; i < DIMENSION; i++) {
            v[i] = random.nextGaussian();
            norm += v[i] * v[i];
        }
        norm = Math.sqrt(norm);
        for (int i = 0; i < DIMENSION; i++) {
            v[i] /= norm;
        }
        return v;
    }

    /**
     * Adds gaussian noise of the given scale to every component.
     */
    public static double[] perturb(double[] vector, Random random, double scale) {
        double[] copy = vector.clone();
        for (int i = 0; i < copy.length; i++) {
            copy[i] += random.nextGaussian() * scale;
        }
        return copy;
    }

    public static KeyPair ownerKeyPair() {
        try {
            KeyPairGenerator generator = KeyPairGenerator.getInstance("EC");
            generator.initialize(new ECGenParameterSpec("secp256r1"));
            return generator.generateKeyPair();
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }

    public static String ownerKeyPem(KeyPair keyPair) {
        return PemKeys.toPem(keyPair.getPublic());
    }

    public static String sign(PrivateKey privateKey, RevocationMessage message) {
        try {
            Signature signature = Signature.getInstance("SHA256withECDSA");
            signature.initSign(privateKey);
            signature.update(message.canonicalJson().getBytes(StandardCharsets.UTF_8));
            return HexFormat.of().formatHex(signature.sign());
        } catch (GeneralSecurityException e) {
            throw new IllegalStateException(e);
        }
    }
}
