package com.vface.core.fingerprint;

import com.vface.core.error.ErrorKind;
import com.vface.core.error.ValidationException;
import net.jqwik.api.*;

import java.util.Arrays;

import static org.assertj.core.api.Assertions.*;

/**
 * Property-based tests for fingerprint derivation.
 * Tests determinism, quantization and dimension checks without Spring context.
 */
class FingerprintDeriverPropertyTest {

    private final FingerprintDeriver deriver = new FingerprintDeriver();

    @Property(tries = 100)
    void fingerprintIsDeterministic(@ForAll("embeddings") double[] vector) {
        String first = deriver.derive(vector);
        String second = deriver.derive(vector.clone());

        assertThat(first).isEqualTo(second);
        assertThat(first).hasSize(64).matches("[a-f0-9]{64}");
    }

    /**
     * Scaling by a power of two is exact in floating point, so both vectors normalize
     * to identical components and must quantize to the same bytes.
     */
    @Property(tries = 100)
    void scaledVectorsShareFingerprint(@ForAll("embeddings") double[] vector) {
        double[] scaled = Arrays.stream(vector).map(v -> v * 4.0).toArray();

        assertThat(deriver.derive(scaled)).isEqualTo(deriver.derive(vector));
    }

    @Property(tries = 100)
    void perturbationBeyondPrecisionChangesFingerprint(
            @ForAll("embeddings") double[] vector,
            @ForAll("componentIndexes") int index) {
        double[] perturbed = vector.clone();
        perturbed[index] += 0.5;

        assertThat(deriver.derive(perturbed)).isNotEqualTo(deriver.derive(vector));
    }

    @Example
    void perturbationBelowPrecisionIsAbsorbed() {
        double[] base = new double[128];
        base[0] = 1.0;
        double[] nudged = base.clone();
        nudged[1] = 1e-7;

        assertThat(deriver.derive(nudged)).isEqualTo(deriver.derive(base));

        nudged[1] = 0.01;
        assertThat(deriver.derive(nudged)).isNotEqualTo(deriver.derive(base));
    }

    @Example
    void canonicalFormIsCompactAndTrimmed() {
        FingerprintDeriver small = new FingerprintDeriver(3, 4);

        assertThat(small.canonicalize(new double[]{3.0, 4.0, 0.0})).isEqualTo("[0.6,0.8,0]");
        assertThat(small.canonicalize(new double[]{1.0, -1.0, -0.0})).isEqualTo("[0.7071,-0.7071,0]");
        assertThat(small.canonicalize(new double[]{5.0, 0.0, -0.00000001})).isEqualTo("[1,0,0]");
    }

    @Example
    void knownVectorsHaveKnownFingerprints() {
        FingerprintDeriver small = new FingerprintDeriver(3, 4);

        assertThat(small.derive(new double[]{3.0, 4.0, 0.0}))
                .isEqualTo("918d4366aa4cac0f83b89b4e7f406f1c69f21b1ad2d515ec1d53f55e0afe6e4b");
        assertThat(small.derive(new double[]{2.0, 0.0, 0.0}))
                .isEqualTo("7ff52993d5d3cb149089942de7fc7a6511db2671cf2125976c081ad6fff89772");
    }

    @Property(tries = 50)
    void wrongDimensionIsRejected(@ForAll("wrongLengths") int length) {
        double[] vector = new double[length];
        Arrays.fill(vector, 0.5);

        assertThatThrownBy(() -> deriver.derive(vector))
                .isInstanceOf(FingerprintDeriver.DimensionMismatchException.class)
                .hasMessageContaining("128 dimensions");
    }

    @Example
    void zeroAndNonFiniteVectorsAreValidationErrors() {
        assertThatThrownBy(() -> deriver.derive(new double[128]))
                .isInstanceOf(ValidationException.class)
                .hasMessageContaining("zero vector");

        double[] nan = new double[128];
        nan[3] = Double.NaN;
        assertThatThrownBy(() -> deriver.derive(nan))
                .isInstanceOfSatisfying(ValidationException.class,
                        e -> assertThat(e.getKind()).isEqualTo(ErrorKind.VALIDATION));
    }

    @Provide
    Arbitrary<double[]> embeddings() {
        return Arbitraries.doubles().between(-1.0, 1.0)
                .array(double[].class).ofSize(128)
                .filter(v -> Arrays.stream(v).filter(x -> Math.abs(x) > 0.1).count() >= 2);
    }

    @Provide
    Arbitrary<Integer> componentIndexes() {
        return Arbitraries.integers().between(0, 127);
    }

    @Provide
    Arbitrary<Integer> wrongLengths() {
        return Arbitraries.integers().between(1, 512).filter(n -> n != 128);
    }
}
