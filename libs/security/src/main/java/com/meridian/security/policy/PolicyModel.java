package com.meridian.security.policy;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * The static, process-wide access policy: allow rules plus role hierarchy grants.
 * <p>
 * Immutable once built and safe to share between threads without synchronization.
 * Request-scoped grants never touch this class; they live in a {@link PolicyEvaluator}.
 */
public final class PolicyModel {

    private final List<PolicyRule> rules;
    private final List<RoleGrant> grants;
    private final Map<String, List<PolicyRule>> rulesBySubject;
    private final Map<String, Set<String>> rolesByMember;

    private PolicyModel(List<PolicyRule> rules, List<RoleGrant> grants) {
        this.rules = List.copyOf(rules);
        this.grants = List.copyOf(grants);

        Map<String, List<PolicyRule>> bySubject = new LinkedHashMap<>();
        for (PolicyRule rule : this.rules) {
            bySubject.computeIfAbsent(rule.subject(), k -> new ArrayList<>()).add(rule);
        }
        Map<String, List<PolicyRule>> frozenRules = new LinkedHashMap<>();
        bySubject.forEach((subject, list) -> frozenRules.put(subject, List.copyOf(list)));
        this.rulesBySubject = Collections.unmodifiableMap(frozenRules);

        Map<String, Set<String>> byMember = new LinkedHashMap<>();
        for (RoleGrant grant : this.grants) {
            byMember.computeIfAbsent(grant.member(), k -> new LinkedHashSet<>()).add(grant.role());
        }
        Map<String, Set<String>> frozenGrants = new LinkedHashMap<>();
        byMember.forEach((member, roles) -> frozenGrants.put(member, Collections.unmodifiableSet(roles)));
        this.rolesByMember = Collections.unmodifiableMap(frozenGrants);
    }

    /**
     * Builds a model from rules and grants. Duplicates are kept but harmless.
     */
    public static PolicyModel of(List<PolicyRule> rules, List<RoleGrant> grants) {
        return new PolicyModel(rules, grants);
    }

    /** A model that allows nothing. */
    public static PolicyModel empty() {
        return new PolicyModel(List.of(), List.of());
    }

    public List<PolicyRule> rules() {
        return rules;
    }

    public List<RoleGrant> grants() {
        return grants;
    }

    /** Rules whose subject is exactly {@code subject}. */
    public List<PolicyRule> rulesFor(String subject) {
        return rulesBySubject.getOrDefault(subject, List.of());
    }

    /** Roles directly granted to {@code member} (no transitive expansion). */
    public Set<String> directRolesOf(String member) {
        return rolesByMember.getOrDefault(member, Set.of());
    }
}
