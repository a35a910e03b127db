package org.calista.neuro.ai.memory;

import org.calista.neuro.ai.action.Action;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Bounded procedure store. When full, the procedure with the lowest base priority makes room.
 */
public final class InMemoryProceduralMemory implements ProceduralMemory {
    private static final Logger log = LoggerFactory.getLogger(InMemoryProceduralMemory.class);

    private final int capacity;
    private final LinkedHashMap<String, Procedure> procedures = new LinkedHashMap<>();
    private int nextId;

    public InMemoryProceduralMemory(int capacity) {
        if (capacity < 1) throw new IllegalArgumentException("capacity must be >= 1");
        this.capacity = capacity;
    }

    @Override
    public String add(String name, ProcedureCondition condition, Action action, double priority) {
        if (procedures.size() >= capacity) {
            procedures.values().stream()
                    .min(Comparator.comparingDouble(Procedure::basePriority))
                    .ifPresent(p -> {
                        procedures.remove(p.id());
                        log.debug("procedural memory full, evicted {}", p);
                    });
        }
        String id = "proc_" + (nextId++);
        procedures.put(id, new Procedure(id, name, condition, action, priority));
        return id;
    }

    @Override
    public Optional<ProcedureMatch> matching(ProcedureContext ctx) {
        Objects.requireNonNull(ctx, "ctx");
        Procedure best = null;
        double bestPriority = -1.0;
        for (Procedure p : procedures.values()) {
            if (!p.condition().holds(ctx)) continue;
            double pr = p.effectivePriority();
            // first added wins ties
            if (pr > bestPriority) {
                bestPriority = pr;
                best = p;
            }
        }
        if (best == null) return Optional.empty();
        return Optional.of(new ProcedureMatch(best.id(), best.action(), bestPriority, best.condition().describe()));
    }

    @Override
    public void recordOutcome(String procedureId, boolean success) {
        if (procedureId == null) return;
        Procedure p = procedures.get(procedureId);
        if (p == null) return;
        p.recordOutcome(success);
        log.trace("procedure {} outcome success={}", procedureId, success);
    }

    @Override
    public List<Procedure> procedures() {
        return List.copyOf(procedures.values());
    }
}
