package org.levelforge.core.generation.strategies;

import java.util.Random;

/**
 * Seeded 2D gradient noise (improved Perlin). The permutation table is shuffled from the
 * given random source, so two instances built from equally seeded sources agree.
 */
public class PerlinNoise {

    private static final int[][] GRADIENTS = {
            {1, 1}, {-1, 1}, {1, -1}, {-1, -1},
            {1, 0}, {-1, 0}, {0, 1}, {0, -1}
    };

    private final int[] perm = new int[512];

    public PerlinNoise(Random rng) {
        int[] p = new int[256];
        for (int i = 0; i < 256; i++) p[i] = i;
        for (int i = 255; i > 0; i--) {
            int j = rng.nextInt(i + 1);
            int tmp = p[i];
            p[i] = p[j];
            p[j] = tmp;
        }
        for (int i = 0; i < 512; i++) perm[i] = p[i & 255];
    }

    /** Single octave, roughly in [-1, 1]; zero on integer lattice points. */
    public double noise(double x, double y) {
        int xi = (int) Math.floor(x);
        int yi = (int) Math.floor(y);
        double xf = x - xi;
        double yf = y - yi;
        int X = xi & 255;
        int Y = yi & 255;

        double n00 = grad(perm[perm[X] + Y], xf, yf);
        double n10 = grad(perm[perm[X + 1] + Y], xf - 1, yf);
        double n01 = grad(perm[perm[X] + Y + 1], xf, yf - 1);
        double n11 = grad(perm[perm[X + 1] + Y + 1], xf - 1, yf - 1);

        double u = fade(xf);
        double v = fade(yf);
        return lerp(lerp(n00, n10, u), lerp(n01, n11, u), v);
    }

    /**
     * Fractal sum of {@code octaves} layers, divided by the total amplitude so the result
     * stays in the single-octave range.
     */
    public double fractal(double x, double y, int octaves, double persistence, double lacunarity) {
        double total = 0.0;
        double amplitude = 1.0;
        double frequency = 1.0;
        double maxAmplitude = 0.0;
        for (int i = 0; i < octaves; i++) {
            total += amplitude * noise(x * frequency, y * frequency);
            maxAmplitude += amplitude;
            amplitude *= persistence;
            frequency *= lacunarity;
        }
        return maxAmplitude > 0.0 ? total / maxAmplitude : 0.0;
    }

    private static double grad(int hash, double x, double y) {
        int[] g = GRADIENTS[hash & 7];
        return g[0] * x + g[1] * y;
    }

    private static double fade(double t) {
        return t * t * t * (t * (t * 6 - 15) + 10);
    }

    private static double lerp(double a, double b, double t) {
        return a + t * (b - a);
    }
}
