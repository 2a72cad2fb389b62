package com.meridian.security.policy;

import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.Map;
import java.util.Set;

/**
 * Evaluates access decisions against a shared {@link PolicyModel} plus grants that exist
 * only for the lifetime of this evaluator.
 * <p>
 * One evaluator is created per request. Grants added through
 * {@link #addRoleForSubject(String, String)} are kept in a private overlay and never
 * written into the model, so concurrent requests cannot see each other's grants.
 * Instances are not thread-safe.
 * <p>
 * Decisions are allow-only: anything not explicitly allowed by a rule is denied.
 */
public class PolicyEvaluator {

    private final PolicyModel model;
    private final Map<String, Set<String>> overlay = new HashMap<>();

    public PolicyEvaluator(PolicyModel model) {
        if (model == null) {
            throw new IllegalArgumentException("model must not be null");
        }
        this.model = model;
    }

    /**
     * Grants {@code role} to {@code subject} for this evaluator only.
     */
    public void addRoleForSubject(String subject, String role) {
        if (subject == null || subject.isBlank() || role == null || role.isBlank()) {
            throw new IllegalArgumentException("subject and role must not be blank");
        }
        overlay.computeIfAbsent(subject, k -> new LinkedHashSet<>()).add(role);
    }

    /**
     * Whether {@code subject} holds {@code role} directly or through the hierarchy.
     */
    public boolean hasRole(String subject, String role) {
        if (subject == null || role == null) {
            return false;
        }
        return implicitRoles(subject).contains(role);
    }

    /**
     * All roles reachable from {@code subject}, following overlay and model grants
     * transitively. The subject itself is not included.
     */
    public Set<String> implicitRoles(String subject) {
        Set<String> reached = new LinkedHashSet<>();
        if (subject == null) {
            return reached;
        }
        Deque<String> pending = new ArrayDeque<>();
        pending.add(subject);
        while (!pending.isEmpty()) {
            String member = pending.poll();
            for (String role : directRolesOf(member)) {
                if (!role.equals(subject) && reached.add(role)) {
                    pending.add(role);
                }
            }
        }
        return Collections.unmodifiableSet(reached);
    }

    /**
     * Whether {@code subject} may perform {@code action} on {@code object}: true if any
     * rule keyed on the subject or one of its implicit roles covers the pair.
     */
    public boolean enforce(String subject, String object, String action) {
        if (subject == null || object == null || action == null) {
            return false;
        }
        if (allows(subject, object, action)) {
            return true;
        }
        for (String role : implicitRoles(subject)) {
            if (allows(role, object, action)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Human-readable dump of the grants visible to this evaluator and the model rules,
     * for debug logging.
     */
    public String describe() {
        StringBuilder out = new StringBuilder("## Grants:\n");
        Map<String, Set<String>> merged = new java.util.TreeMap<>();
        model.grants().forEach(g -> merged.computeIfAbsent(g.member(), k -> new java.util.TreeSet<>()).add(g.role()));
        overlay.forEach((member, roles) -> merged.computeIfAbsent(member, k -> new java.util.TreeSet<>()).addAll(roles));
        merged.forEach((member, roles) -> out.append("  ").append(member).append(" -> ").append(roles).append('\n'));
        out.append("## Rules:\n");
        model.rules().forEach(r -> out.append("  ")
                .append(r.subject()).append(", ").append(r.object()).append(", ").append(r.action()).append('\n'));
        return out.toString();
    }

    private boolean allows(String subject, String object, String action) {
        for (PolicyRule rule : model.rulesFor(subject)) {
            if (rule.covers(object, action)) {
                return true;
            }
        }
        return false;
    }

    private Set<String> directRolesOf(String member) {
        Set<String> fromOverlay = overlay.get(member);
        Set<String> fromModel = model.directRolesOf(member);
        if (fromOverlay == null) {
            return fromModel;
        }
        Set<String> combined = new LinkedHashSet<>(fromOverlay);
        combined.addAll(fromModel);
        return combined;
    }
}
