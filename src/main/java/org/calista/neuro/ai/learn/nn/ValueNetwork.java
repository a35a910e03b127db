package org.calista.neuro.ai.learn.nn;

import java.util.Arrays;
import java.util.Objects;
import java.util.Random;

/**
 * ValueNetwork: полносвязная сеть (Linear, ReLU, ..., Linear), оптимизатор Adam.
 *
 * <ul>
 *   <li>He-инициализация весов, нулевые bias</li>
 *   <li>{@link #trainStep}: один шаг MSE только по выбранным действиям</li>
 *   <li>{@link #copyFrom}: жёсткая синхронизация весов (для target-сети)</li>
 * </ul>
 *
 * Not thread-safe; owned by one learner.
 */
public final class ValueNetwork {

    private static final double BETA1 = 0.9;
    private static final double BETA2 = 0.999;
    private static final double ADAM_EPS = 1e-8;

    private final int[] sizes;
    private final double learningRate;

    // w[l] is row-major [out][in]
    private final double[][] w;
    private final double[][] b;

    // Adam moments
    private final double[][] mw, vw, mb, vb;
    private long step;

    public ValueNetwork(int[] sizes, double learningRate, Random rnd) {
        Objects.requireNonNull(sizes, "sizes");
        Objects.requireNonNull(rnd, "rnd");
        if (sizes.length < 2) throw new IllegalArgumentException("need at least input and output layer");
        for (int s : sizes) if (s < 1) throw new IllegalArgumentException("layer size must be >= 1");
        if (!(learningRate > 0.0)) throw new IllegalArgumentException("learningRate must be > 0");

        this.sizes = sizes.clone();
        this.learningRate = learningRate;

        int layers = sizes.length - 1;
        this.w = new double[layers][];
        this.b = new double[layers][];
        this.mw = new double[layers][];
        this.vw = new double[layers][];
        this.mb = new double[layers][];
        this.vb = new double[layers][];

        for (int l = 0; l < layers; l++) {
            int in = sizes[l], out = sizes[l + 1];
            w[l] = new double[in * out];
            b[l] = new double[out];
            mw[l] = new double[in * out];
            vw[l] = new double[in * out];
            mb[l] = new double[out];
            vb[l] = new double[out];
        }
        reinitialize(rnd);
    }

    /** Fresh He-normal weights, zero biases, optimizer state reset. */
    public void reinitialize(Random rnd) {
        Objects.requireNonNull(rnd, "rnd");
        for (int l = 0; l < w.length; l++) {
            double std = Math.sqrt(2.0 / sizes[l]);
            for (int i = 0; i < w[l].length; i++) w[l][i] = rnd.nextGaussian() * std;
            Arrays.fill(b[l], 0.0);
        }
        resetOptimizer();
    }

    // ----- shape -----

    public int inputSize() {
        return sizes[0];
    }

    public int outputSize() {
        return sizes[sizes.length - 1];
    }

    public int[] layerSizes() {
        return sizes.clone();
    }

    public double learningRate() {
        return learningRate;
    }

    public boolean sameShape(ValueNetwork other) {
        return other != null && Arrays.equals(sizes, other.sizes);
    }

    // ----- inference -----

    public double[] predict(double[] input) {
        double[][] acts = forward(input);
        return acts[acts.length - 1].clone();
    }

    /** Index of the largest output; ties resolve to the lowest index. */
    public int argmax(double[] input) {
        double[] q = predict(input);
        int best = 0;
        for (int i = 1; i < q.length; i++) if (q[i] > q[best]) best = i;
        return best;
    }

    public double maxOutput(double[] input) {
        double[] q = predict(input);
        double m = q[0];
        for (int i = 1; i < q.length; i++) m = Math.max(m, q[i]);
        return m;
    }

    private double[][] forward(double[] input) {
        Objects.requireNonNull(input, "input");
        if (input.length != sizes[0]) {
            throw new IllegalArgumentException("input width " + input.length + " != " + sizes[0]);
        }
        int layers = w.length;
        double[][] acts = new double[layers + 1][];
        acts[0] = input;
        for (int l = 0; l < layers; l++) {
            int in = sizes[l], out = sizes[l + 1];
            double[] x = acts[l];
            double[] z = new double[out];
            double[] wl = w[l];
            for (int o = 0; o < out; o++) {
                double s = b[l][o];
                int row = o * in;
                for (int i = 0; i < in; i++) s += wl[row + i] * x[i];
                // ReLU on hidden layers only
                z[o] = (l < layers - 1) ? Math.max(0.0, s) : s;
            }
            acts[l + 1] = z;
        }
        return acts;
    }

    // ----- training -----

    /**
     * One Adam step on {@code mean((Q(s_k)[a_k] - y_k)^2)}.
     *
     * @return batch loss before the step
     */
    public double trainStep(double[][] inputs, int[] actions, double[] targets) {
        Objects.requireNonNull(inputs, "inputs");
        Objects.requireNonNull(actions, "actions");
        Objects.requireNonNull(targets, "targets");
        int n = inputs.length;
        if (n == 0) return 0.0;
        if (actions.length != n || targets.length != n) {
            throw new IllegalArgumentException("batch arrays differ in length");
        }

        int layers = w.length;
        double[][] gw = new double[layers][];
        double[][] gb = new double[layers][];
        for (int l = 0; l < layers; l++) {
            gw[l] = new double[w[l].length];
            gb[l] = new double[b[l].length];
        }

        double loss = 0.0;
        for (int k = 0; k < n; k++) {
            int a = actions[k];
            if (a < 0 || a >= outputSize()) throw new IllegalArgumentException("action index out of range: " + a);

            double[][] acts = forward(inputs[k]);
            double err = acts[layers][a] - targets[k];
            loss += err * err;

            double[] delta = new double[outputSize()];
            delta[a] = 2.0 * err / n;

            for (int l = layers - 1; l >= 0; l--) {
                int in = sizes[l], out = sizes[l + 1];
                double[] x = acts[l];
                double[] wl = w[l];
                double[] gwl = gw[l];
                for (int o = 0; o < out; o++) {
                    double d = delta[o];
                    if (d == 0.0) continue;
                    gb[l][o] += d;
                    int row = o * in;
                    for (int i = 0; i < in; i++) gwl[row + i] += d * x[i];
                }
                if (l > 0) {
                    double[] prev = new double[in];
                    for (int i = 0; i < in; i++) {
                        if (x[i] <= 0.0) continue; // ReLU'
                        double s = 0.0;
                        for (int o = 0; o < out; o++) s += wl[o * in + i] * delta[o];
                        prev[i] = s;
                    }
                    delta = prev;
                }
            }
        }

        adam(gw, gb);
        return loss / n;
    }

    private void adam(double[][] gw, double[][] gb) {
        step++;
        double c1 = 1.0 - Math.pow(BETA1, step);
        double c2 = 1.0 - Math.pow(BETA2, step);
        for (int l = 0; l < w.length; l++) {
            adamUpdate(w[l], gw[l], mw[l], vw[l], c1, c2);
            adamUpdate(b[l], gb[l], mb[l], vb[l], c1, c2);
        }
    }

    private void adamUpdate(double[] p, double[] g, double[] m, double[] v, double c1, double c2) {
        for (int i = 0; i < p.length; i++) {
            m[i] = BETA1 * m[i] + (1.0 - BETA1) * g[i];
            v[i] = BETA2 * v[i] + (1.0 - BETA2) * g[i] * g[i];
            double mh = m[i] / c1;
            double vh = v[i] / c2;
            p[i] -= learningRate * mh / (Math.sqrt(vh) + ADAM_EPS);
        }
    }

    private void resetOptimizer() {
        for (int l = 0; l < w.length; l++) {
            Arrays.fill(mw[l], 0.0);
            Arrays.fill(vw[l], 0.0);
            Arrays.fill(mb[l], 0.0);
            Arrays.fill(vb[l], 0.0);
        }
        step = 0;
    }

    // ----- weights -----

    /** Verbatim weight copy; the optimizer state of this network is left alone. */
    public void copyFrom(ValueNetwork src) {
        Objects.requireNonNull(src, "src");
        if (!sameShape(src)) throw new IllegalArgumentException("shape mismatch");
        for (int l = 0; l < w.length; l++) {
            System.arraycopy(src.w[l], 0, w[l], 0, w[l].length);
            System.arraycopy(src.b[l], 0, b[l], 0, b[l].length);
        }
    }

    public boolean sameWeights(ValueNetwork other) {
        if (!sameShape(other)) return false;
        for (int l = 0; l < w.length; l++) {
            if (!Arrays.equals(w[l], other.w[l]) || !Arrays.equals(b[l], other.b[l])) return false;
        }
        return true;
    }

    public int layerCount() {
        return w.length;
    }

    public double[] weights(int layer) {
        return w[layer].clone();
    }

    public double[] biases(int layer) {
        return b[layer].clone();
    }

    /** Replaces one layer's parameters; optimizer moments restart from zero. */
    public void setLayer(int layer, double[] weights, double[] biases) {
        Objects.requireNonNull(weights, "weights");
        Objects.requireNonNull(biases, "biases");
        if (weights.length != w[layer].length || biases.length != b[layer].length) {
            throw new IllegalArgumentException("layer " + layer + " size mismatch");
        }
        System.arraycopy(weights, 0, w[layer], 0, weights.length);
        System.arraycopy(biases, 0, b[layer], 0, biases.length);
        resetOptimizer();
    }
}
