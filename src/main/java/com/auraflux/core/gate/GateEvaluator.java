package com.auraflux.core.gate;

import com.auraflux.core.model.Phase;
import com.auraflux.core.model.SessionSnapshot;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Decides whether a session snapshot may move to a target phase.
 * <p>
 * Each declared edge carries a rule set. All rules of the edge are evaluated and every failing rule
 * is reported, so callers can render a complete checklist. Undeclared edges (skipping a phase,
 * moving backward without a configured rollback edge, leaving the terminal phase) are always denied.
 * <p>
 * The rule table is built once from {@link WorkflowProperties} and never changes afterwards, so
 * {@link #evaluate} is a deterministic function of its arguments.
 */
@Service
public class GateEvaluator {

    private static final Logger log = LoggerFactory.getLogger(GateEvaluator.class);

    private final Map<Phase, Map<Phase, List<GateRule>>> edges;

    @Autowired
    public GateEvaluator(WorkflowProperties properties) {
        this(properties.getMinKeywords(), properties.getMinScopeElements(),
                properties.getRequiredScopeElements(), properties.getRollbackEdges());
    }

    GateEvaluator(int minKeywords, int minScopeElements, List<String> requiredScopeElements,
                  List<String> rollbackEdges) {
        var table = new EnumMap<Phase, Map<Phase, List<GateRule>>>(Phase.class);

        declare(table, Phase.INITIATION, Phase.EXPLORATION, List.of(
                questionLocked(),
                minKeywords(minKeywords)));

        var formulationRules = new ArrayList<GateRule>();
        formulationRules.add(questionLocked());
        formulationRules.add(minScopeElements(minScopeElements));
        for (String name : requiredScopeElements) {
            formulationRules.add(requiredScopeElement(name));
        }
        declare(table, Phase.EXPLORATION, Phase.FORMULATION, formulationRules);

        declare(table, Phase.FORMULATION, Phase.COLLECTION, List.of(feasibilityAssessed()));
        declare(table, Phase.COLLECTION, Phase.PRESENTATION, List.of(reflectionRecorded()));
        declare(table, Phase.PRESENTATION, Phase.CLOSED, List.of());

        for (String edge : rollbackEdges) {
            Phase[] parsed = parseRollbackEdge(edge);
            declare(table, parsed[0], parsed[1], List.of());
            log.info("Rollback edge {} -> {} enabled", parsed[0], parsed[1]);
        }

        var frozen = new EnumMap<Phase, Map<Phase, List<GateRule>>>(Phase.class);
        table.forEach((from, targets) -> frozen.put(from, Collections.unmodifiableMap(new EnumMap<>(targets))));
        this.edges = Collections.unmodifiableMap(frozen);
    }

    /**
     * Evaluates a transition of {@code snapshot} to {@code target}.
     *
     * @return an allow decision, or a deny decision listing every unmet condition
     */
    public GateDecision evaluate(SessionSnapshot snapshot, Phase target) {
        Phase from = snapshot.phase();
        if (from.isTerminal()) {
            return GateDecision.deny(from, target, List.of("Session is closed; no further transitions are possible"));
        }
        if (from == target) {
            return GateDecision.deny(from, target, List.of("Session is already in phase " + target));
        }
        List<GateRule> rules = edges.getOrDefault(from, Map.of()).get(target);
        if (rules == null) {
            return GateDecision.deny(from, target, List.of("No transition is declared from " + from + " to " + target));
        }

        var reasons = new ArrayList<String>();
        for (GateRule rule : rules) {
            rule.check(snapshot).ifPresent(reasons::add);
        }
        return reasons.isEmpty() ? GateDecision.allow(from, target) : GateDecision.deny(from, target, reasons);
    }

    /**
     * Phases reachable in one declared step from {@code from}.
     */
    public Set<Phase> targetsFrom(Phase from) {
        return edges.getOrDefault(from, Map.of()).keySet();
    }

    // ── Rules ────────────────────────────────────────────────────────────

    private static GateRule questionLocked() {
        return s -> s.question().isLocked()
                ? Optional.empty()
                : Optional.of("Research question must be locked");
    }

    private static GateRule minKeywords(int min) {
        return s -> s.activeKeywordCount() >= min
                ? Optional.empty()
                : Optional.of("At least " + min + " keywords are required (currently " + s.activeKeywordCount() + ")");
    }

    private static GateRule minScopeElements(int min) {
        return s -> s.activeScopeElementCount() >= min
                ? Optional.empty()
                : Optional.of("At least " + min + " scope elements are required (currently "
                        + s.activeScopeElementCount() + ")");
    }

    private static GateRule requiredScopeElement(String name) {
        return s -> s.findScopeElement(name).filter(e -> e.status().isActive()).isPresent()
                ? Optional.empty()
                : Optional.of("Scope element '" + name + "' is required");
    }

    private static GateRule feasibilityAssessed() {
        return s -> s.feasibility() != null
                ? Optional.empty()
                : Optional.of("A feasibility assessment is required");
    }

    private static GateRule reflectionRecorded() {
        return s -> !s.reflectionLog().isEmpty()
                ? Optional.empty()
                : Optional.of("At least one reflection log entry is required");
    }

    // ── Helpers ──────────────────────────────────────────────────────────

    private static void declare(Map<Phase, Map<Phase, List<GateRule>>> table, Phase from, Phase to,
                                List<GateRule> rules) {
        table.computeIfAbsent(from, k -> new EnumMap<>(Phase.class)).put(to, List.copyOf(rules));
    }

    private static Phase[] parseRollbackEdge(String edge) {
        String[] parts = edge.split(":");
        if (parts.length != 2) {
            throw new IllegalArgumentException("Rollback edge must be FROM:TO, got '" + edge + "'");
        }
        Phase from = Phase.valueOf(parts[0].trim().toUpperCase());
        Phase to = Phase.valueOf(parts[1].trim().toUpperCase());
        if (from.isTerminal() || to.ordinal() >= from.ordinal()) {
            throw new IllegalArgumentException("Rollback edge must move backward from a non-terminal phase: " + edge);
        }
        return new Phase[]{from, to};
    }
}
