package org.calista.neuro.ai.core;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.neuro.ai.agent.Agent;
import org.calista.neuro.ai.agent.TickResult;
import org.calista.neuro.ai.env.Environment;
import org.calista.neuro.ai.env.GridPos;
import org.calista.neuro.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Random;
import java.util.function.Consumer;

/**
 * AgentKernel: instance-owned runtime container.
 *
 * Lifecycle:
 *   1) build(configFile) -> loadOrCreate config + FileIO on baseDir + agents (models loaded if enabled)
 *   2) simulate(env)     -> fixed number of ticks
 *   3) close()           -> save models if enabled
 *
 * No statics singletons: lifecycle is explicit.
 */
public final class AgentKernel implements AutoCloseable {

    private static final Logger log = LoggerFactory.getLogger(AgentKernel.class);

    private final FileIO io;
    private final ObjectMapper mapper;
    private final AgentConfig cfg;
    private final AgentFactory factory;
    private final List<Agent> agents;

    private volatile boolean closed = false;

    private AgentKernel(FileIO io, ObjectMapper mapper, AgentConfig cfg, AgentFactory factory, List<Agent> agents) {
        this.io = Objects.requireNonNull(io, "io");
        this.mapper = Objects.requireNonNull(mapper, "mapper");
        this.cfg = Objects.requireNonNull(cfg, "cfg");
        this.factory = Objects.requireNonNull(factory, "factory");
        this.agents = List.copyOf(agents);
    }

    // ---------------------------------------------------------------------
    // Builder
    // ---------------------------------------------------------------------

    public static Builder builder() {
        return new Builder();
    }

    public static final class Builder {

        private Charset charset = StandardCharsets.UTF_8;

        /**
         * Root directory where config lives.
         * Config is read BEFORE baseDir is known (baseDir is inside config).
         */
        private Path configRoot = Path.of(".");

        private ObjectMapper mapper;
        private Random random;

        public Builder charset(Charset charset) {
            this.charset = Objects.requireNonNull(charset, "charset");
            return this;
        }

        public Builder configRoot(Path configRoot) {
            this.configRoot = Objects.requireNonNull(configRoot, "configRoot");
            return this;
        }

        public Builder mapper(ObjectMapper mapper) {
            this.mapper = Objects.requireNonNull(mapper, "mapper");
            return this;
        }

        /** Overrides {@code simulation.seed}. */
        public Builder random(Random random) {
            this.random = Objects.requireNonNull(random, "random");
            return this;
        }

        /**
         * Loads/creates config, opens the data dir, composes agents and
         * loads their models when {@code learner.loadModel} is set.
         */
        public AgentKernel build(Path configFile) throws IOException {
            Objects.requireNonNull(configFile, "configFile");

            ObjectMapper om = (this.mapper != null) ? this.mapper : defaultMapper();

            // Config IO (outside baseDir)
            FileIO external = new FileIO(configRoot, charset, true);
            Path cfgPath = configFile.isAbsolute() ? configFile : configRoot.resolve(configFile);

            AgentConfig cfg = AgentConfig.loadOrCreate(external, cfgPath, om);

            // relative baseDir sits next to the config
            Path base = Path.of(cfg.baseDir);
            if (!base.isAbsolute()) base = configRoot.resolve(base);
            FileIO io = new FileIO(base, charset, true);
            io.ensureBaseDir();

            Random rnd = (this.random != null) ? this.random
                    : (cfg.simulation.seed != null ? new Random(cfg.simulation.seed) : new Random());

            AgentFactory factory = new AgentFactory(cfg, io, rnd);
            List<Agent> agents = new ArrayList<>(cfg.simulation.agents);
            for (int i = 0; i < cfg.simulation.agents; i++) {
                agents.add(factory.create("Agent-" + (i + 1), startOf(i, cfg.simulation.gridSize)));
            }

            AgentKernel k = new AgentKernel(io, om, cfg, factory, agents);
            if (cfg.learner.loadModel) k.loadModels();

            k.logCreated(cfgPath);
            return k;
        }
    }

    public static ObjectMapper defaultMapper() {
        ObjectMapper om = new ObjectMapper();
        om.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);
        return om;
    }

    // agents start along the top row, wrapping onto the next rows
    static GridPos startOf(int index, int gridSize) {
        return GridPos.of((index / gridSize) % gridSize, index % gridSize);
    }

    // ---------------------------------------------------------------------
    // Models
    // ---------------------------------------------------------------------

    /**
     * Model file of an agent, relative to baseDir. A single agent uses
     * {@code modelFile} itself; several agents get their name as a prefix.
     */
    public Path modelPath(Agent agent) {
        Objects.requireNonNull(agent, "agent");
        String file = (agents.size() == 1) ? cfg.modelFile : agent.name() + "-" + cfg.modelFile;
        return io.resolve(file);
    }

    /** @return number of agents whose model was restored from disk */
    public int loadModels() {
        int loaded = 0;
        for (Agent a : agents) {
            if (a.learner().load(modelPath(a))) loaded++;
        }
        log.info("Models loaded: {}/{}", loaded, agents.size());
        return loaded;
    }

    public void saveModels() throws IOException {
        for (Agent a : agents) {
            a.learner().save(modelPath(a));
        }
    }

    // ---------------------------------------------------------------------
    // Run
    // ---------------------------------------------------------------------

    public SimulationReport simulate(Environment env) {
        return simulate(env, cfg.simulation.ticks, null);
    }

    public SimulationReport simulate(Environment env, int ticks, Consumer<TickResult> listener) {
        if (closed) throw new IllegalStateException("kernel is closed");
        return new Simulation(env, agents, ticks, listener).run();
    }

    // ---------------------------------------------------------------------
    // Accessors
    // ---------------------------------------------------------------------

    public FileIO io() { return io; }
    public ObjectMapper mapper() { return mapper; }
    public AgentConfig config() { return cfg; }
    public AgentFactory factory() { return factory; }
    public List<Agent> agents() { return agents; }

    // ---------------------------------------------------------------------
    // Lifecycle
    // ---------------------------------------------------------------------

    @Override
    public void close() {
        if (closed) return;
        closed = true;
        if (!cfg.learner.saveOnClose) return;
        try {
            saveModels();
        } catch (IOException e) {
            log.warn("Could not save models on close: {}", e.toString());
        }
    }

    private void logCreated(Path cfgPath) {
        if (!log.isInfoEnabled()) return;
        log.info("AgentKernel created: config={}, baseDir={}, agents={}",
                cfgPath, io.baseDir(), agents.size());
    }
}
