package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.action.Action;

import java.util.Objects;

/** Best-matching procedure at one point in time. */
public record ProcedureMatch(String procedureId, Action action, double priority, String description) {

    public ProcedureMatch {
        Objects.requireNonNull(procedureId, "procedureId");
        Objects.requireNonNull(action, "action");
    }
}
