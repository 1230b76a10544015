package com.phillippitts.tsaugment.service.transform;

import org.apache.commons.math3.complex.Complex;

/**
 * DCT-II and its scaled inverse (DCT-III) for arbitrary lengths, evaluated through a
 * {@code 2N}-point {@link FourierKernel} transform of the mirrored sequence.
 *
 * <p>Conventions:
 * <ul>
 *   <li>forward: {@code X[k] = sum x[n] cos(pi k (n + 1/2) / N)} (no normalisation)</li>
 *   <li>inverse: {@code x[n] = (2/N) (X[0]/2 + sum_{k>=1} X[k] cos(pi k (n + 1/2) / N))}</li>
 * </ul>
 */
final class CosineKernel {

    private CosineKernel() {}

    static double[] forward(double[] x) {
        int n = x.length;
        if (n == 0) {
            return new double[0];
        }
        Complex[] mirrored = new Complex[2 * n];
        for (int i = 0; i < n; i++) {
            Complex value = new Complex(x[i], 0.0);
            mirrored[i] = value;
            mirrored[2 * n - 1 - i] = value;
        }
        Complex[] spectrum = FourierKernel.forward(mirrored);

        double[] out = new double[n];
        for (int k = 0; k < n; k++) {
            double theta = Math.PI * k / (2.0 * n);
            // Re(exp(-i theta) * Y[k]) / 2
            out[k] = 0.5 * (Math.cos(theta) * spectrum[k].getReal() + Math.sin(theta) * spectrum[k].getImaginary());
        }
        return out;
    }

    static double[] inverse(double[] coefficients) {
        int n = coefficients.length;
        if (n == 0) {
            return new double[0];
        }
        Complex[] z = new Complex[2 * n];
        for (int k = 0; k < 2 * n; k++) {
            if (k >= n) {
                z[k] = Complex.ZERO;
                continue;
            }
            double weight = k == 0 ? 0.5 : 1.0;
            double theta = Math.PI * k / (2.0 * n);
            // conjugate of weight * X[k] * exp(i theta)
            z[k] = new Complex(weight * coefficients[k] * Math.cos(theta), -weight * coefficients[k] * Math.sin(theta));
        }
        Complex[] summed = FourierKernel.forward(z);

        double[] out = new double[n];
        double norm = 2.0 / n;
        for (int i = 0; i < n; i++) {
            out[i] = summed[i].getReal() * norm;
        }
        return out;
    }
}
