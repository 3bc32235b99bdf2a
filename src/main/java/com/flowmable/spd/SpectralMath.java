package com.flowmable.spd;

import java.util.Arrays;

/**
 * Small dense linear-algebra helpers over row-major {@code double[][]} matrices.
 */
public final class SpectralMath {

    private SpectralMath() {}

    public static double[][] copy(double[][] m) {
        double[][] out = new double[m.length][];
        for (int i = 0; i < m.length; i++) {
            out[i] = m[i].clone();
        }
        return out;
    }

    public static double[] column(double[][] m, int col) {
        double[] out = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            out[i] = m[i][col];
        }
        return out;
    }

    /** {@code a · b} for an (r × k) and a (k × c) matrix. */
    public static double[][] multiply(double[][] a, double[][] b) {
        int rows = a.length;
        int inner = b.length;
        int cols = inner == 0 ? 0 : b[0].length;
        double[][] out = new double[rows][cols];
        for (int i = 0; i < rows; i++) {
            if (a[i].length != inner) {
                throw new IllegalArgumentException("Dimension mismatch: " + a[i].length + " vs " + inner);
            }
            for (int k = 0; k < inner; k++) {
                double aik = a[i][k];
                if (aik == 0) continue;
                double[] bk = b[k];
                for (int j = 0; j < cols; j++) {
                    out[i][j] += aik * bk[j];
                }
            }
        }
        return out;
    }

    /** {@code m · x}. */
    public static double[] apply(double[][] m, double[] x) {
        double[] out = new double[m.length];
        for (int i = 0; i < m.length; i++) {
            if (m[i].length != x.length) {
                throw new IllegalArgumentException("Dimension mismatch: " + m[i].length + " vs " + x.length);
            }
            double s = 0;
            for (int j = 0; j < x.length; j++) {
                s += m[i][j] * x[j];
            }
            out[i] = s;
        }
        return out;
    }

    public static double[] subtract(double[] a, double[] b) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] - b[i];
        }
        return out;
    }

    public static double[] divide(double[] a, double[] b) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = a[i] / b[i];
        }
        return out;
    }

    public static double[] negate(double[] a) {
        double[] out = new double[a.length];
        for (int i = 0; i < a.length; i++) {
            out[i] = -a[i];
        }
        return out;
    }

    public static double[] filled(int n, double value) {
        double[] out = new double[n];
        Arrays.fill(out, value);
        return out;
    }
}
