package com.meridian.security.policy;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Reads the declarative access policy from YAML.
 * <p>
 * Document layout:
 * <pre>
 * grants:
 *   - member: "${client-id}:${role-admin}"
 *     role: administrator
 * rules:
 *   - subject: data_user
 *     object: asset
 *     actions: [create, read, update, delete]
 * </pre>
 * {@code ${name}} placeholders in any field are replaced with the configured variables;
 * an unknown placeholder is a definition error.
 */
public class PolicyModelLoader {

    private static final Logger log = LoggerFactory.getLogger(PolicyModelLoader.class);

    private static final Pattern PLACEHOLDER = Pattern.compile("\\$\\{([A-Za-z0-9_.-]+)}");

    private final ObjectMapper mapper = new ObjectMapper(new YAMLFactory())
            .enable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
    private final Map<String, String> variables;

    /**
     * @param variables placeholder values, e.g. {@code client-id -> apisix}
     */
    public PolicyModelLoader(Map<String, String> variables) {
        this.variables = Map.copyOf(variables);
    }

    /**
     * Loads a policy from a classpath resource.
     *
     * @throws PolicyDefinitionException if the resource is missing or invalid
     */
    public PolicyModel loadClasspath(String resource) {
        ClassLoader loader = Thread.currentThread().getContextClassLoader();
        if (loader == null) {
            loader = PolicyModelLoader.class.getClassLoader();
        }
        try (InputStream in = loader.getResourceAsStream(resource)) {
            if (in == null) {
                throw new PolicyDefinitionException("Policy resource not found: " + resource);
            }
            return load(in, resource);
        } catch (IOException e) {
            throw new PolicyDefinitionException("Failed to read policy resource " + resource, e);
        }
    }

    /**
     * Loads a policy from a stream. The stream is not closed.
     *
     * @param in         YAML document
     * @param sourceName used in log and error messages
     * @throws PolicyDefinitionException if the document cannot be parsed or has invalid entries
     */
    public PolicyModel load(InputStream in, String sourceName) {
        PolicyDocument document;
        try {
            document = mapper.readValue(in, PolicyDocument.class);
        } catch (IOException e) {
            throw new PolicyDefinitionException("Malformed policy " + sourceName + ": " + e.getMessage(), e);
        }
        if (document == null) {
            throw new PolicyDefinitionException("Policy " + sourceName + " is empty");
        }

        List<RoleGrant> grants = new ArrayList<>();
        for (GrantEntry entry : nullToEmpty(document.grants())) {
            grants.add(new RoleGrant(substitute(entry.member()), substitute(entry.role())));
        }

        List<PolicyRule> rules = new ArrayList<>();
        for (RuleEntry entry : nullToEmpty(document.rules())) {
            if (entry.actions() == null || entry.actions().isEmpty()) {
                throw new PolicyDefinitionException(
                        "Rule for subject '%s' on '%s' lists no actions".formatted(entry.subject(), entry.object()));
            }
            for (String action : entry.actions()) {
                rules.add(new PolicyRule(substitute(entry.subject()), substitute(entry.object()), substitute(action)));
            }
        }

        log.info("Loaded access policy from {}: {} grants, {} rules", sourceName, grants.size(), rules.size());
        return PolicyModel.of(rules, grants);
    }

    String substitute(String value) {
        if (value == null) {
            return null;
        }
        Matcher matcher = PLACEHOLDER.matcher(value);
        StringBuilder out = new StringBuilder();
        while (matcher.find()) {
            String name = matcher.group(1);
            String replacement = variables.get(name);
            if (replacement == null) {
                throw new PolicyDefinitionException("Unknown policy placeholder '${%s}'".formatted(name));
            }
            matcher.appendReplacement(out, Matcher.quoteReplacement(replacement));
        }
        matcher.appendTail(out);
        return out.toString();
    }

    private static <T> List<T> nullToEmpty(List<T> list) {
        return list == null ? List.of() : list;
    }

    record PolicyDocument(List<GrantEntry> grants, List<RuleEntry> rules) {
    }

    record GrantEntry(String member, String role) {
    }

    record RuleEntry(String subject, String object, List<String> actions) {
    }
}
