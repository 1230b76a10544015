package com.phillippitts.tsaugment.service.transform;

import org.apache.commons.math3.complex.Complex;
import org.apache.commons.math3.transform.DftNormalization;
import org.apache.commons.math3.transform.FastFourierTransformer;
import org.apache.commons.math3.transform.TransformType;
import org.apache.commons.math3.util.ArithmeticUtils;

import java.util.Arrays;

/**
 * Discrete Fourier transform of arbitrary length.
 *
 * <p>Power-of-two lengths go straight to commons-math3's radix-2 transformer. Other lengths
 * are re-expressed as a circular convolution (Bluestein's chirp-z algorithm) whose length is a
 * power of two, which the same transformer then evaluates.
 *
 * <p>Stateless and thread-safe.
 */
final class FourierKernel {

    private static final FastFourierTransformer TRANSFORMER = new FastFourierTransformer(DftNormalization.STANDARD);

    private FourierKernel() {}

    /**
     * Unnormalised forward DFT: {@code X[k] = sum x[n] exp(-2 pi i n k / N)}.
     */
    static Complex[] forward(Complex[] input) {
        int n = input.length;
        if (n == 0) {
            return new Complex[0];
        }
        if (ArithmeticUtils.isPowerOfTwo(n)) {
            return TRANSFORMER.transform(input, TransformType.FORWARD);
        }
        return bluestein(input);
    }

    /**
     * Inverse DFT including the {@code 1/N} factor, so {@code inverse(forward(x)) == x}.
     */
    static Complex[] inverse(Complex[] input) {
        int n = input.length;
        if (n == 0) {
            return new Complex[0];
        }
        Complex[] conjugated = new Complex[n];
        for (int i = 0; i < n; i++) {
            conjugated[i] = input[i].conjugate();
        }
        Complex[] transformed = forward(conjugated);
        Complex[] out = new Complex[n];
        for (int i = 0; i < n; i++) {
            out[i] = transformed[i].conjugate().divide(n);
        }
        return out;
    }

    /**
     * Forward transform of a real row, laid out as {@code [re0, im0, re1, im1, ...]}.
     */
    static double[] forwardInterleaved(double[] row) {
        Complex[] buffer = new Complex[row.length];
        for (int i = 0; i < row.length; i++) {
            buffer[i] = new Complex(row[i], 0.0);
        }
        Complex[] spectrum = forward(buffer);
        double[] out = new double[2 * spectrum.length];
        for (int i = 0; i < spectrum.length; i++) {
            out[2 * i] = spectrum[i].getReal();
            out[2 * i + 1] = spectrum[i].getImaginary();
        }
        return out;
    }

    /**
     * Inverse of {@link #forwardInterleaved(double[])}; keeps the real part of the result.
     * The caller guarantees an even row length.
     */
    static double[] inverseInterleaved(double[] interleaved) {
        int n = interleaved.length / 2;
        Complex[] buffer = new Complex[n];
        for (int i = 0; i < n; i++) {
            buffer[i] = new Complex(interleaved[2 * i], interleaved[2 * i + 1]);
        }
        Complex[] signal = inverse(buffer);
        double[] out = new double[n];
        for (int i = 0; i < n; i++) {
            out[i] = signal[i].getReal();
        }
        return out;
    }

    private static Complex[] bluestein(Complex[] x) {
        int n = x.length;
        int m = 1;
        while (m < 2 * n - 1) {
            m <<= 1;
        }

        // chirp w[k] = exp(-i pi k^2 / n); k^2 is reduced mod 2n to keep the angle small
        Complex[] chirp = new Complex[n];
        long period = 2L * n;
        for (int k = 0; k < n; k++) {
            long k2 = ((long) k * k) % period;
            double angle = Math.PI * k2 / n;
            chirp[k] = new Complex(Math.cos(angle), -Math.sin(angle));
        }

        Complex[] a = zeros(m);
        Complex[] b = zeros(m);
        for (int k = 0; k < n; k++) {
            a[k] = x[k].multiply(chirp[k]);
        }
        b[0] = chirp[0].conjugate();
        for (int k = 1; k < n; k++) {
            Complex c = chirp[k].conjugate();
            b[k] = c;
            b[m - k] = c;
        }

        Complex[] fa = TRANSFORMER.transform(a, TransformType.FORWARD);
        Complex[] fb = TRANSFORMER.transform(b, TransformType.FORWARD);
        Complex[] product = new Complex[m];
        for (int i = 0; i < m; i++) {
            product[i] = fa[i].multiply(fb[i]);
        }
        Complex[] convolution = TRANSFORMER.transform(product, TransformType.INVERSE);

        Complex[] out = new Complex[n];
        for (int k = 0; k < n; k++) {
            out[k] = convolution[k].multiply(chirp[k]);
        }
        return out;
    }

    private static Complex[] zeros(int length) {
        Complex[] out = new Complex[length];
        Arrays.fill(out, Complex.ZERO);
        return out;
    }
}
