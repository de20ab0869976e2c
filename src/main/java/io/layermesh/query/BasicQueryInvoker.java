package io.layermesh.query;

import io.layermesh.error.AuthorizationException;
import io.layermesh.error.ProtocolException;
import io.layermesh.exposure.Operation;
import io.layermesh.util.Stages;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.concurrent.CompletionStage;

/**
 * A small query evaluator covering what layers send to each other.
 *
 * <p>A query is either a list of queries, evaluated one after the other against the same
 * receiver, or a map. In a map, {@code "<="} replaces the receiver and every other key has the
 * form {@code "source=>target"} (or just {@code "source"}). The sub-query attached to a key is
 * {@code true} to return the value as is, or a map: when it holds {@code "()"} the source is
 * called with that argument list, otherwise it is read, and its remaining keys are evaluated
 * against the obtained value. A key with an empty target merges a map result into the enclosing
 * result, or makes a non-map result the whole result. When {@code "<="} supplied the receiver,
 * a key with no source ({@code "=>changes"}) selects that value again.
 *
 * <p>Example: {@code {"Clock=>": {"getTime=>result": {"()": []}}}} evaluates to
 * {@code {"result": <time>}}.
 */
public final class BasicQueryInvoker implements QueryInvoker {
    public static final String ARGUMENTS_KEY = "()";
    public static final String SOURCE_VALUE_KEY = "<=";
    private static final String ARROW = "=>";

    @Override
    public CompletionStage<Object> invoke(Object receiver, Object query, Authorizer authorizer) {
        if (authorizer == null) {
            throw new IllegalArgumentException("authorizer is required");
        }
        return evaluate(receiver, query, authorizer);
    }

    private CompletionStage<Object> evaluate(Object receiver, Object query, Authorizer authorizer) {
        if (query instanceof List) {
            List<?> queries = (List<?>) query;
            List<Object> results = new ArrayList<>(queries.size());
            return Stages.forEachSequential(queries, element -> evaluate(receiver, element, authorizer)
                    .thenAccept(results::add))
                    .thenApply(ignored -> results);
        }
        if (query instanceof Map) {
            return evaluateMap(receiver, asQueryMap(query), authorizer);
        }
        throw new ProtocolException("A query must be a map or a list of maps");
    }

    private CompletionStage<Object> evaluateMap(Object receiver, Map<String, Object> query, Authorizer authorizer) {
        boolean supplied = query.containsKey(SOURCE_VALUE_KEY);
        Object current = supplied ? query.get(SOURCE_VALUE_KEY) : receiver;
        List<Map.Entry<String, Object>> entries = new ArrayList<>();
        for (Map.Entry<String, Object> entry : query.entrySet()) {
            if (!entry.getKey().equals(SOURCE_VALUE_KEY) && !entry.getKey().equals(ARGUMENTS_KEY)) {
                entries.add(entry);
            }
        }
        Map<String, Object> result = new LinkedHashMap<>();
        Object[] direct = new Object[1];
        return Stages.forEachSequential(entries, entry -> {
            String key = entry.getKey();
            int arrow = key.indexOf(ARROW);
            String source = arrow < 0 ? key : key.substring(0, arrow);
            String target = arrow < 0 ? key : key.substring(arrow + ARROW.length());
            CompletionStage<Object> evaluated;
            if (!source.isEmpty()) {
                evaluated = evaluateKey(current, source, entry.getValue(), authorizer);
            } else if (supplied) {
                evaluated = evaluateSelf(current, key, entry.getValue(), authorizer);
            } else {
                throw new ProtocolException("A query key must name a source (key: '" + key + "')");
            }
            return evaluated.thenAccept(value -> {
                if (value == null) {
                    return;
                }
                if (!target.isEmpty()) {
                    result.put(target, value);
                } else if (value instanceof Map) {
                    result.putAll(asQueryMap(value));
                } else {
                    direct[0] = value;
                }
            });
        }).thenApply(ignored -> direct[0] != null ? direct[0] : result);
    }

    private CompletionStage<Object> evaluateKey(Object receiver, String source, Object subquery, Authorizer authorizer) {
        if (Boolean.TRUE.equals(subquery)) {
            return fetch(receiver, source, null, authorizer);
        }
        if (!(subquery instanceof Map)) {
            throw new ProtocolException("Unsupported sub-query (key: '" + source + "')");
        }
        Map<String, Object> submap = asQueryMap(subquery);
        List<Object> args = null;
        if (submap.containsKey(ARGUMENTS_KEY)) {
            Object rawArgs = submap.get(ARGUMENTS_KEY);
            if (!(rawArgs instanceof List)) {
                throw new ProtocolException("Call arguments must be a list (key: '" + source + "')");
            }
            args = new ArrayList<>((List<?>) rawArgs);
        }
        return fetch(receiver, source, args, authorizer).thenCompose(value -> {
            if (!hasNestedKeys(submap) || value == null) {
                return Stages.<Object>of(value);
            }
            return evaluateMap(value, submap, authorizer);
        });
    }

    /**
     * A key without a source selects the value supplied with {@code "<="} itself, as it is after
     * the keys before it ran.
     */
    private CompletionStage<Object> evaluateSelf(Object receiver, String key, Object subquery, Authorizer authorizer) {
        if (Boolean.TRUE.equals(subquery)) {
            return Stages.of(receiver);
        }
        if (subquery instanceof Map && !asQueryMap(subquery).containsKey(ARGUMENTS_KEY)) {
            return evaluateMap(receiver, asQueryMap(subquery), authorizer);
        }
        throw new ProtocolException("A key without a source can only select the supplied value (key: '" + key + "')");
    }

    private CompletionStage<Object> fetch(Object receiver, String name, List<Object> args, Authorizer authorizer) {
        Operation operation = args == null ? Operation.GET : Operation.CALL;
        List<Object> params = args == null ? List.of() : args;
        return authorizer.authorize(receiver, name, operation, params).thenCompose(allowed -> {
            if (!Boolean.TRUE.equals(allowed)) {
                throw inaccessible(name, operation);
            }
            if (!(receiver instanceof QueryReceiver)) {
                throw inaccessible(name, operation);
            }
            QueryReceiver queryReceiver = (QueryReceiver) receiver;
            if (operation == Operation.CALL) {
                return queryReceiver.callQueryMethod(name, params);
            }
            return Stages.<Object>of(queryReceiver.getQueryProperty(name).orElseThrow(() -> inaccessible(name, operation)));
        });
    }

    private static boolean hasNestedKeys(Map<String, Object> submap) {
        for (String key : submap.keySet()) {
            if (!key.equals(ARGUMENTS_KEY)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Denied and missing properties are reported the same way.
     */
    private static AuthorizationException inaccessible(String name, Operation operation) {
        return new AuthorizationException(
                "Cannot access the property '" + name + "' (operation: '" + operation.wireName() + "')");
    }

    @SuppressWarnings("unchecked")
    private static Map<String, Object> asQueryMap(Object value) {
        return (Map<String, Object>) value;
    }
}
