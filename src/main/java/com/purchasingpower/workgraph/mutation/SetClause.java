package com.purchasingpower.workgraph.mutation;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.regex.Pattern;

/**
 * Builds a Cypher {@code SET} clause that only touches the properties it was given.
 *
 * <p>Values are always bound as parameters; property names must be plain
 * identifiers chosen by code, never by callers.
 *
 * <pre>
 * SetClause clause = SetClause.forAlias("n")
 *     .set("title", update.getTitle())      // skipped when null
 *     .setExpression("updatedAt", "datetime()");
 * String cypher = "MATCH (n:WorkItem {id: $nodeId}) " + clause.toCypher() + " RETURN n";
 * </pre>
 */
public final class SetClause {

    private static final Pattern IDENTIFIER = Pattern.compile("[A-Za-z][A-Za-z0-9_]*");

    private final String alias;
    private final List<String> assignments = new ArrayList<>();
    private final List<String> properties = new ArrayList<>();
    private final Map<String, Object> parameters = new HashMap<>();

    private SetClause(String alias) {
        this.alias = requireIdentifier(alias);
    }

    public static SetClause forAlias(String alias) {
        return new SetClause(alias);
    }

    /**
     * Adds {@code alias.property = $param} when {@code value} is not null.
     */
    public SetClause set(String property, Object value) {
        if (value == null) {
            return this;
        }
        String param = "set_" + requireIdentifier(property);
        assignments.add(alias + "." + property + " = $" + param);
        properties.add(property);
        parameters.put(param, value);
        return this;
    }

    /**
     * Adds {@code alias.property = expression}; the expression is trusted Cypher such as {@code datetime()}.
     */
    public SetClause setExpression(String property, String expression) {
        assignments.add(alias + "." + requireIdentifier(property) + " = " + expression);
        properties.add(property);
        return this;
    }

    public boolean isEmpty() {
        return assignments.isEmpty();
    }

    /**
     * Rendered clause, or an empty string when nothing was set.
     */
    public String toCypher() {
        return assignments.isEmpty() ? "" : "SET " + String.join(", ", assignments);
    }

    public Map<String, Object> getParameters() {
        return Collections.unmodifiableMap(parameters);
    }

    public List<String> getAssignedProperties() {
        return Collections.unmodifiableList(properties);
    }

    private static String requireIdentifier(String name) {
        if (name == null || !IDENTIFIER.matcher(name).matches()) {
            throw new IllegalArgumentException("Not a valid Cypher identifier: " + name);
        }
        return name;
    }
}
