package org.calista.neuro.ai.core;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.calista.neuro.ai.consciousness.ConsciousnessSettings;
import org.calista.neuro.ai.decision.ArbiterSettings;
import org.calista.neuro.io.FileIO;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.util.Objects;

/**
 * AgentConfig: простой POJO конфиг агента:
 * - дефолты в полях
 * - loadOrCreate() создаёт файл, если его нет
 * - validate() нормализует значения
 *
 * Every arbitration and mode threshold lives here; the arbiter and the
 * consciousness machine only see the records built by {@link #arbiterSettings()}
 * and {@link #consciousnessSettings()}.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
public final class AgentConfig {

    private static final Logger log = LoggerFactory.getLogger(AgentConfig.class);

    public String baseDir = "data";
    public String modelFile = "dqn_model.bin";

    public Physiology physiology = new Physiology();
    public Emotion emotion = new Emotion();
    public Learner learner = new Learner();
    public Arbiter arbiter = new Arbiter();
    public Consciousness consciousness = new Consciousness();
    public Memory memory = new Memory();
    public Perception perception = new Perception();
    public Goals goals = new Goals();
    public Simulation simulation = new Simulation();

    // -------------------- Sections --------------------

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Physiology {
        // per-tick growth
        public double hungerRate = 0.03;
        public double fatigueRate = 0.02;
        public double thirstRate = 0.025;

        public double initialHunger = 0.2;
        public double initialFatigue = 0.1;
        public double initialThirst = 0.2;

        /** Need growth multiplier at night. */
        public double nightScale = 1.5;

        // mood weights (inverted needs)
        public double moodHungerWeight = 0.4;
        public double moodFatigueWeight = 0.3;
        public double moodThirstWeight = 0.3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Emotion {
        public double rewardHighMood = 0.7;
        public double rewardLowMood = 0.3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Learner {
        public int[] hidden = {64, 128};
        public double learningRate = 0.001;
        public double gamma = 0.99;
        public double epsilon = 1.0;
        public double epsilonMin = 0.01;
        public double epsilonDecay = 0.995;
        public int replayCapacity = 10_000;
        public int batchSize = 64;
        public int targetSyncEvery = 100;

        public boolean loadModel = true;
        public boolean saveOnClose = true;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Arbiter {
        public double critical = 0.85;
        public double proceduralReactive = 0.7;
        public double proceduralDeliberate = 0.9;
        public double goalParentBoost = 0.1;
        public double goalSuggestFraction = 0.8;
        public double memoryNeed = 0.6;
        public int memoryRecentTicks = 3;
        public double curiosity = 0.6;
        public double calmNeedCeiling = 0.7;
        public double rainExploreChance = 0.5;
        public double rainFatigueCeiling = 0.8;
        public double crowdHunger = 0.5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Consciousness {
        public double sleepFatigue = 0.9;
        public double wakeFatigue = 0.2;
        public double focusNeed = 0.7;
        public double focusGoalPriority = 0.95;
        public double reactiveNeed = 0.8;
        public double awakeFocusBoost = 0.2;
        public double focusedBoost = 0.3;
        public int focusRecallTicks = 5;
        public double focusNeedFloor = 0.3;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Memory {
        public int episodicCapacity = 1000;
        public int semanticCapacity = 100;
        public int proceduralCapacity = 50;
        public int workingCapacity = 5;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Perception {
        public double accuracy = 0.9;
        public int viewRadius = 1;
        /** Need level that pulls attention. */
        public double attentionNeed = 0.7;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Goals {
        public boolean seedDefaults = true;
        public int generatorCooldown = 10;
        public double hungerTrigger = 0.6;
        public double curiosityTrigger = 0.7;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static final class Simulation {
        public int gridSize = 10;
        public int ticks = 100;
        public int agents = 1;
        /** null => nondeterministic. */
        public Long seed = null;
    }

    // -------------------- Load / Create --------------------

    /**
     * Загружает конфиг. Если файла нет (или он пустой), создаёт дефолтный и пишет на диск.
     */
    public static AgentConfig loadOrCreate(FileIO io, Path configFile, ObjectMapper mapper) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");

        String json;
        try {
            json = io.readString(configFile);
        } catch (NoSuchFileException e) {
            AgentConfig created = new AgentConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.info("Config file not found. Created default config at {}", configFile);
            return created;
        }

        if (json == null || json.isBlank()) {
            AgentConfig created = new AgentConfig();
            created.validate();
            writePretty(io, configFile, mapper, created);
            log.warn("Config file {} is empty. Recreated defaults.", configFile);
            return created;
        }

        AgentConfig cfg = mapper.readValue(json, AgentConfig.class);
        if (cfg == null) cfg = new AgentConfig();

        cfg.validate();
        return cfg;
    }

    /**
     * Перезаписывает конфиг на диск (pretty JSON).
     */
    public static void save(FileIO io, Path configFile, ObjectMapper mapper, AgentConfig cfg) throws IOException {
        Objects.requireNonNull(io, "io");
        Objects.requireNonNull(configFile, "configFile");
        Objects.requireNonNull(mapper, "mapper");
        Objects.requireNonNull(cfg, "cfg");

        cfg.validate();
        writePretty(io, configFile, mapper, cfg);
    }

    private static void writePretty(FileIO io, Path configFile, ObjectMapper mapper, AgentConfig cfg) throws IOException {
        String out = mapper.writerWithDefaultPrettyPrinter().writeValueAsString(cfg);
        io.writeString(configFile, out + System.lineSeparator());
    }

    // -------------------- Settings records --------------------

    public ArbiterSettings arbiterSettings() {
        return new ArbiterSettings(
                arbiter.critical,
                arbiter.proceduralReactive,
                arbiter.proceduralDeliberate,
                arbiter.goalParentBoost,
                arbiter.goalSuggestFraction,
                arbiter.memoryNeed,
                arbiter.memoryRecentTicks,
                arbiter.curiosity,
                arbiter.calmNeedCeiling,
                arbiter.rainExploreChance,
                arbiter.rainFatigueCeiling,
                arbiter.crowdHunger);
    }

    public ConsciousnessSettings consciousnessSettings() {
        return new ConsciousnessSettings(
                consciousness.sleepFatigue,
                consciousness.wakeFatigue,
                consciousness.focusNeed,
                consciousness.focusGoalPriority,
                consciousness.reactiveNeed,
                consciousness.awakeFocusBoost,
                consciousness.focusedBoost,
                consciousness.focusRecallTicks,
                consciousness.focusNeedFloor);
    }

    // -------------------- Validation / Normalization --------------------

    public void validate() {
        if (baseDir == null || baseDir.isBlank()) baseDir = "data";
        if (modelFile == null || modelFile.isBlank()) modelFile = "dqn_model.bin";

        if (physiology == null) physiology = new Physiology();
        physiology.hungerRate = nonNegative(physiology.hungerRate, 0.03);
        physiology.fatigueRate = nonNegative(physiology.fatigueRate, 0.02);
        physiology.thirstRate = nonNegative(physiology.thirstRate, 0.025);
        physiology.initialHunger = unit(physiology.initialHunger, 0.2);
        physiology.initialFatigue = unit(physiology.initialFatigue, 0.1);
        physiology.initialThirst = unit(physiology.initialThirst, 0.2);
        if (!(physiology.nightScale > 0.0) || !Double.isFinite(physiology.nightScale)) physiology.nightScale = 1.5;
        physiology.moodHungerWeight = nonNegative(physiology.moodHungerWeight, 0.4);
        physiology.moodFatigueWeight = nonNegative(physiology.moodFatigueWeight, 0.3);
        physiology.moodThirstWeight = nonNegative(physiology.moodThirstWeight, 0.3);
        if (physiology.moodHungerWeight + physiology.moodFatigueWeight + physiology.moodThirstWeight <= 0.0) {
            physiology.moodHungerWeight = 0.4;
            physiology.moodFatigueWeight = 0.3;
            physiology.moodThirstWeight = 0.3;
        }

        if (emotion == null) emotion = new Emotion();
        emotion.rewardHighMood = unit(emotion.rewardHighMood, 0.7);
        emotion.rewardLowMood = unit(emotion.rewardLowMood, 0.3);
        if (emotion.rewardLowMood >= emotion.rewardHighMood) {
            emotion.rewardHighMood = 0.7;
            emotion.rewardLowMood = 0.3;
        }

        if (learner == null) learner = new Learner();
        if (learner.hidden == null || learner.hidden.length == 0) learner.hidden = new int[]{64, 128};
        for (int i = 0; i < learner.hidden.length; i++) {
            if (learner.hidden[i] < 1) learner.hidden[i] = 1;
        }
        if (!(learner.learningRate > 0.0) || !Double.isFinite(learner.learningRate)) learner.learningRate = 0.001;
        learner.gamma = unit(learner.gamma, 0.99);
        learner.epsilon = unit(learner.epsilon, 1.0);
        learner.epsilonMin = unit(learner.epsilonMin, 0.01);
        if (learner.epsilonMin > learner.epsilon) learner.epsilonMin = learner.epsilon;
        if (!(learner.epsilonDecay > 0.0 && learner.epsilonDecay <= 1.0)) learner.epsilonDecay = 0.995;
        if (learner.batchSize < 1) learner.batchSize = 1;
        if (learner.replayCapacity < learner.batchSize) learner.replayCapacity = learner.batchSize;
        if (learner.targetSyncEvery < 1) learner.targetSyncEvery = 1;

        if (arbiter == null) arbiter = new Arbiter();
        arbiter.critical = unit(arbiter.critical, 0.85);
        arbiter.proceduralReactive = unit(arbiter.proceduralReactive, 0.7);
        arbiter.proceduralDeliberate = unit(arbiter.proceduralDeliberate, 0.9);
        arbiter.goalParentBoost = unit(arbiter.goalParentBoost, 0.1);
        arbiter.goalSuggestFraction = unit(arbiter.goalSuggestFraction, 0.8);
        arbiter.memoryNeed = unit(arbiter.memoryNeed, 0.6);
        if (arbiter.memoryRecentTicks < 0) arbiter.memoryRecentTicks = 0;
        arbiter.curiosity = unit(arbiter.curiosity, 0.6);
        arbiter.calmNeedCeiling = unit(arbiter.calmNeedCeiling, 0.7);
        arbiter.rainExploreChance = unit(arbiter.rainExploreChance, 0.5);
        arbiter.rainFatigueCeiling = unit(arbiter.rainFatigueCeiling, 0.8);
        arbiter.crowdHunger = unit(arbiter.crowdHunger, 0.5);

        if (consciousness == null) consciousness = new Consciousness();
        consciousness.sleepFatigue = unit(consciousness.sleepFatigue, 0.9);
        consciousness.wakeFatigue = unit(consciousness.wakeFatigue, 0.2);
        if (consciousness.wakeFatigue >= consciousness.sleepFatigue) {
            consciousness.sleepFatigue = 0.9;
            consciousness.wakeFatigue = 0.2;
        }
        consciousness.focusNeed = unit(consciousness.focusNeed, 0.7);
        consciousness.focusGoalPriority = unit(consciousness.focusGoalPriority, 0.95);
        consciousness.reactiveNeed = unit(consciousness.reactiveNeed, 0.8);
        consciousness.awakeFocusBoost = unit(consciousness.awakeFocusBoost, 0.2);
        consciousness.focusedBoost = unit(consciousness.focusedBoost, 0.3);
        if (consciousness.focusRecallTicks < 0) consciousness.focusRecallTicks = 0;
        consciousness.focusNeedFloor = unit(consciousness.focusNeedFloor, 0.3);

        if (memory == null) memory = new Memory();
        if (memory.episodicCapacity < 1) memory.episodicCapacity = 1;
        if (memory.semanticCapacity < 1) memory.semanticCapacity = 1;
        if (memory.proceduralCapacity < 1) memory.proceduralCapacity = 1;
        if (memory.workingCapacity < 1) memory.workingCapacity = 1;

        if (perception == null) perception = new Perception();
        perception.accuracy = unit(perception.accuracy, 0.9);
        if (perception.viewRadius < 0) perception.viewRadius = 0;
        perception.attentionNeed = unit(perception.attentionNeed, 0.7);

        if (goals == null) goals = new Goals();
        if (goals.generatorCooldown < 1) goals.generatorCooldown = 1;
        goals.hungerTrigger = unit(goals.hungerTrigger, 0.6);
        goals.curiosityTrigger = unit(goals.curiosityTrigger, 0.7);

        if (simulation == null) simulation = new Simulation();
        if (simulation.gridSize < 1) simulation.gridSize = 1;
        if (simulation.ticks < 0) simulation.ticks = 0;
        if (simulation.agents < 1) simulation.agents = 1;
    }

    private static double unit(double v, double fallback) {
        if (!Double.isFinite(v)) return fallback;
        if (v < 0.0) return 0.0;
        if (v > 1.0) return 1.0;
        return v;
    }

    private static double nonNegative(double v, double fallback) {
        if (!Double.isFinite(v)) return fallback;
        return Math.max(0.0, v);
    }
}
