package org.calista.neuro.ai.learn;

import org.calista.neuro.ai.action.Action;
import org.calista.neuro.ai.state.StateVector;

import java.io.IOException;
import java.nio.file.Path;

/**
 * ValueLearner: оценивает ценность действий для вектора состояния и учится онлайн.
 *
 * <p>Implementations are owned by one agent and are not thread-safe.</p>
 */
public interface ValueLearner {

    /** Epsilon-greedy choice over {@link Action#values()}. */
    Action selectAction(StateVector state);

    /** Current value estimate per action, in {@link Action} order. */
    double[] qValues(StateVector state);

    /**
     * Records one transition and, once enough samples exist, performs one training step.
     * Never fails because the buffer is still small.
     */
    void update(StateVector prev, Action action, double reward, StateVector next);

    double epsilon();

    /** Writes the policy weights. */
    void save(Path path) throws IOException;

    /**
     * Loads policy weights and syncs the target network.
     *
     * @return false when the file was missing or unusable; the learner then starts from fresh weights
     */
    boolean load(Path path);
}
