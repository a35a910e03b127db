package org.calista.neuro.ai.learn.impl;

import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;
import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.learn.ReplayBuffer;
import org.calista.neuro.ai.learn.Transition;
import org.calista.neuro.ai.learn.ValueLearner;
import org.calista.neuro.ai.learn.nn.ModelCodec;
import org.calista.neuro.ai.learn.nn.ValueNetwork;
import org.calista.neuro.ai.state.StateVector;
import org.calista.neuro.io.FileIO;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Objects;
import java.util.Random;

/**
 * DqnLearner: Deep Q-Learning:
 * <ul>
 *   <li>policy-сеть + target-сеть одинаковой формы</li>
 *   <li>replay buffer (FIFO), выборка без повторов</li>
 *   <li>epsilon-greedy, мультипликативный decay до пола</li>
 *   <li>жёсткая синхронизация target каждые N вызовов update</li>
 * </ul>
 *
 * Epsilon decays on every {@link #update} call, and the sync counter advances on
 * every call too, whether or not a gradient step ran.
 */
public final class DqnLearner implements ValueLearner {
    private static final Logger log = LogManager.getLogger(DqnLearner.class);

    private static final Action[] ACTIONS = Action.values();

    private final int stateSize;
    private final double gamma;
    private final double epsilonMin;
    private final double epsilonDecay;
    private final int batchSize;
    private final int targetSyncEvery;

    private final ValueNetwork policy;
    private final ValueNetwork target;
    private final ReplayBuffer buffer;
    private final Random rnd;
    private final FileIO io; // nullable

    private double epsilon;
    private long updateCalls;
    private long trainSteps;
    private double lastLoss = Double.NaN;

    private DqnLearner(Builder b) {
        if (b.stateSize < 1) throw new IllegalArgumentException("stateSize must be >= 1");
        if (!(b.gamma >= 0.0 && b.gamma <= 1.0)) throw new IllegalArgumentException("gamma must be in [0,1]");
        if (!(b.epsilonMin >= 0.0 && b.epsilonMin <= 1.0)) throw new IllegalArgumentException("epsilonMin must be in [0,1]");
        if (!(b.epsilon >= 0.0 && b.epsilon <= 1.0)) throw new IllegalArgumentException("epsilon must be in [0,1]");
        if (!(b.epsilonDecay > 0.0 && b.epsilonDecay <= 1.0)) throw new IllegalArgumentException("epsilonDecay must be in (0,1]");
        if (b.batchSize < 1) throw new IllegalArgumentException("batchSize must be >= 1");
        if (b.capacity < b.batchSize) {
            throw new IllegalArgumentException("capacity (" + b.capacity + ") must be >= batchSize (" + b.batchSize + ")");
        }
        if (b.targetSyncEvery < 1) throw new IllegalArgumentException("targetSyncEvery must be >= 1");
        Objects.requireNonNull(b.hidden, "hidden");

        this.stateSize = b.stateSize;
        this.gamma = b.gamma;
        this.epsilonMin = b.epsilonMin;
        this.epsilonDecay = b.epsilonDecay;
        this.epsilon = Math.max(b.epsilonMin, b.epsilon);
        this.batchSize = b.batchSize;
        this.targetSyncEvery = b.targetSyncEvery;
        this.rnd = (b.random != null) ? b.random : new Random();
        this.io = b.io;

        int[] sizes = new int[b.hidden.length + 2];
        sizes[0] = stateSize;
        System.arraycopy(b.hidden, 0, sizes, 1, b.hidden.length);
        sizes[sizes.length - 1] = ACTIONS.length;

        this.policy = new ValueNetwork(sizes, b.learningRate, rnd);
        this.target = new ValueNetwork(sizes, b.learningRate, rnd);
        this.target.copyFrom(policy);
        this.buffer = new ReplayBuffer(b.capacity);

        log.debug("DqnLearner init: sizes={}, gamma={}, eps={} (min={}, decay={}), batch={}, sync={}",
                Arrays.toString(sizes), gamma, epsilon, epsilonMin, epsilonDecay, batchSize, targetSyncEvery);
    }

    // ---------------------------------------------------------------------
    // ValueLearner
    // ---------------------------------------------------------------------

    @Override
    public Action selectAction(StateVector state) {
        double[] x = input(state);
        if (rnd.nextDouble() < epsilon) {
            return ACTIONS[rnd.nextInt(ACTIONS.length)];
        }
        return ACTIONS[policy.argmax(x)];
    }

    @Override
    public double[] qValues(StateVector state) {
        return policy.predict(input(state));
    }

    @Override
    public void update(StateVector prev, Action action, double reward, StateVector next) {
        Objects.requireNonNull(action, "action");
        input(prev);
        input(next);

        buffer.push(new Transition(prev, action.ordinal(), reward, next, false));
        epsilon = Math.max(epsilonMin, epsilon * epsilonDecay);
        updateCalls++;

        if (buffer.size() >= batchSize) {
            train(buffer.sample(batchSize, rnd));
        }

        if (updateCalls % targetSyncEvery == 0) {
            target.copyFrom(policy);
            log.debug("target network synced at update {}", updateCalls);
        }
    }

    private void train(List<Transition> batch) {
        int n = batch.size();
        double[][] xs = new double[n][];
        int[] as = new int[n];
        double[] ys = new double[n];
        for (int k = 0; k < n; k++) {
            Transition t = batch.get(k);
            xs[k] = t.prev().values();
            as[k] = t.actionIndex();
            // no terminal states in this world: always bootstrap
            double future = t.terminal() ? 0.0 : target.maxOutput(t.next().values());
            ys[k] = t.reward() + gamma * future;
        }
        lastLoss = policy.trainStep(xs, as, ys);
        trainSteps++;
        if (log.isTraceEnabled()) log.trace("train step {} loss={}", trainSteps, lastLoss);
    }

    @Override
    public double epsilon() {
        return epsilon;
    }

    // ---------------------------------------------------------------------
    // Persistence
    // ---------------------------------------------------------------------

    @Override
    public void save(Path path) throws IOException {
        Objects.requireNonNull(path, "path");
        byte[] bytes = ModelCodec.encode(policy);
        Path file = locate(path);
        fileIO(file).writeBytes(file, bytes);
        log.info("DQN model saved to {} ({} bytes)", path, bytes.length);
    }

    @Override
    public boolean load(Path path) {
        Objects.requireNonNull(path, "path");
        try {
            Path file = locate(path);
            // FileIO creates its base dir, so a missing model must not get that far
            if (!Files.exists(file)) throw new NoSuchFileException(file.toString());
            byte[] bytes = fileIO(file).readBytes(file);
            ModelCodec.decodeInto(bytes, policy);
            target.copyFrom(policy);
            log.info("DQN model loaded from {}", path);
            return true;
        } catch (NoSuchFileException e) {
            log.warn("No DQN model found at {}. Starting with a new model.", path);
        } catch (IOException | RuntimeException e) {
            log.warn("Error loading DQN model from {}: {}. Starting with a new model.", path, e.toString());
        }
        policy.reinitialize(rnd);
        target.copyFrom(policy);
        return false;
    }

    private Path locate(Path path) {
        return (io != null) ? io.resolveAny(path) : path.toAbsolutePath().normalize();
    }

    private FileIO fileIO(Path file) {
        if (io != null) return io;
        Path parent = file.getParent();
        return new FileIO(parent != null ? parent : file);
    }

    // ---------------------------------------------------------------------
    // Introspection
    // ---------------------------------------------------------------------

    public ValueNetwork policyNetwork() { return policy; }

    public ValueNetwork targetNetwork() { return target; }

    public ReplayBuffer replayBuffer() { return buffer; }

    public long updateCalls() { return updateCalls; }

    public long trainSteps() { return trainSteps; }

    public double lastLoss() { return lastLoss; }

    public boolean targetInSync() {
        return target.sameWeights(policy);
    }

    private double[] input(StateVector s) {
        Objects.requireNonNull(s, "state");
        if (s.width() != stateSize) {
            throw new IllegalArgumentException("state width " + s.width() + " != " + stateSize);
        }
        return s.values();
    }

    @Override
    public String toString() {
        return String.format(Locale.ROOT, "DqnLearner (Epsilon: %.3f, Buffer Size: %d)", epsilon, buffer.size());
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {
        private int stateSize = StateVector.WIDTH;
        private int[] hidden = {64, 128};
        private double learningRate = 0.001;
        private double gamma = 0.99;
        private double epsilon = 1.0;
        private double epsilonMin = 0.01;
        private double epsilonDecay = 0.995;
        private int capacity = 10_000;
        private int batchSize = 64;
        private int targetSyncEvery = 100;
        private Random random;
        private FileIO io;

        private Builder() {
        }

        public Builder stateSize(int v) { this.stateSize = v; return this; }

        public Builder hidden(int... v) { this.hidden = Objects.requireNonNull(v, "hidden").clone(); return this; }

        public Builder learningRate(double v) { this.learningRate = v; return this; }

        public Builder gamma(double v) { this.gamma = v; return this; }

        public Builder epsilon(double v) { this.epsilon = v; return this; }

        public Builder epsilonMin(double v) { this.epsilonMin = v; return this; }

        public Builder epsilonDecay(double v) { this.epsilonDecay = v; return this; }

        public Builder capacity(int v) { this.capacity = v; return this; }

        public Builder batchSize(int v) { this.batchSize = v; return this; }

        public Builder targetSyncEvery(int v) { this.targetSyncEvery = v; return this; }

        public Builder random(Random v) { this.random = v; return this; }

        /** Anchors relative model paths; absolute paths work without it. */
        public Builder fileIO(FileIO v) { this.io = v; return this; }

        public DqnLearner build() {
            return new DqnLearner(this);
        }
    }
}
