package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.action.Action;

import java.util.List;
import java.util.Optional;

/**
 * Learned condition → action habits with outcome feedback.
 */
public interface ProceduralMemory {

    /** @return id of the new procedure */
    String add(String name, ProcedureCondition condition, Action action, double priority);

    /** Highest effective priority among procedures whose condition holds; read-only. */
    Optional<ProcedureMatch> matching(ProcedureContext ctx);

    /** Unknown ids are ignored. */
    void recordOutcome(String procedureId, boolean success);

    List<Procedure> procedures();
}
