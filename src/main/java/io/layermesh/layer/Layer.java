package io.layermesh.layer;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.node.ObjectNode;
import io.layermesh.error.AuthorizationException;
import io.layermesh.error.LifecycleException;
import io.layermesh.error.LookupException;
import io.layermesh.error.ProtocolException;
import io.layermesh.error.SerializationException;
import io.layermesh.exposure.ExposedProperty;
import io.layermesh.exposure.Operation;
import io.layermesh.model.ModelClass;
import io.layermesh.model.Registerable;
import io.layermesh.query.Authorizer;
import io.layermesh.query.BasicQueryInvoker;
import io.layermesh.query.QueryInvoker;
import io.layermesh.query.QueryReceiver;
import io.layermesh.serialization.PropertyFilter;
import io.layermesh.serialization.SerializationOptions;
import io.layermesh.serialization.ValueSerializer;
import io.layermesh.serialization.WireSerializable;
import io.layermesh.util.Jsons;
import io.layermesh.util.RandomIds;
import io.layermesh.util.Stages;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionStage;
import java.util.function.Function;
import java.util.function.Predicate;

/**
 * A named registry of items that routes queries to an optional parent layer.
 *
 * <p>A fork reads its base's registry until it touches an item: the first lookup of an
 * inherited name forks the item into the fork's own registry, so the base never changes.
 * Forks share the name, parent, hooks, transport, invoker and scheduler of their base. The
 * open flag is read through the chain but only the layer that was opened may close itself.
 *
 * <p>A layer is driven by one logical thread of control and is not thread-safe.
 */
public class Layer implements QueryReceiver {
    private static final Logger LOG = LoggerFactory.getLogger(Layer.class);

    public static final String INTROSPECT_METHOD = "$introspect";
    static final int GENERATED_NAME_LENGTH = 10;
    private static final List<Object> EXPOSED_INTROSPECTION_ARGUMENTS = List.of(Map.of(
            "items", Map.of("filter", IntrospectionOptions.EXPOSED_FILTER),
            "properties", Map.of("filter", IntrospectionOptions.EXPOSED_FILTER)
    ));

    private final Layer base;
    private final Map<String, Registerable> ownItems = new LinkedHashMap<>();
    private final String name;
    private final boolean nameWasGenerated;
    private final ReceivedQueryHook beforeInvokeReceivedQuery;
    private final ReceivedQueryHook afterInvokeReceivedQuery;
    private final QueryTransport transport;
    private final QueryInvoker invoker;
    private final Scheduler scheduler;
    private final ValueSerializer serializer = new ValueSerializer(typeName -> find(typeName).map(item -> (Object) item));
    private Layer parent;
    private Boolean open;
    private Boolean detached;
    private BatchState batchState;
    private Layer ghost;

    private Layer(Builder builder) {
        this.base = null;
        if (builder.name == null) {
            this.name = RandomIds.createShortId(GENERATED_NAME_LENGTH);
            this.nameWasGenerated = true;
        } else {
            if (builder.name.isBlank()) {
                throw new IllegalArgumentException("layer name cannot be empty");
            }
            this.name = builder.name;
            this.nameWasGenerated = false;
        }
        this.beforeInvokeReceivedQuery = builder.beforeInvokeReceivedQuery;
        this.afterInvokeReceivedQuery = builder.afterInvokeReceivedQuery;
        this.transport = builder.transport;
        this.invoker = builder.invoker;
        this.scheduler = builder.scheduler;
        this.parent = builder.parent;
        register(builder.items);
    }

    private Layer(Layer base) {
        this.base = base;
        this.name = base.name;
        this.nameWasGenerated = base.nameWasGenerated;
        this.beforeInvokeReceivedQuery = base.beforeInvokeReceivedQuery;
        this.afterInvokeReceivedQuery = base.afterInvokeReceivedQuery;
        this.transport = base.transport;
        this.invoker = base.invoker;
        this.scheduler = base.scheduler;
    }

    public static Builder builder() {
        return new Builder();
    }

    public String getName() {
        return name;
    }

    public boolean nameWasGenerated() {
        return nameWasGenerated;
    }

    // === Registration ===

    public Layer register(Map<String, ? extends Registerable> items) {
        if (items == null) {
            throw new IllegalArgumentException("items are required");
        }
        items.forEach(this::register);
        return this;
    }

    public Layer register(String itemName, Registerable item) {
        if (itemName == null || itemName.isBlank()) {
            throw new IllegalArgumentException("item name cannot be empty");
        }
        if (item == null) {
            throw new IllegalArgumentException("item is required: " + itemName);
        }
        if (item.findOwnLayer().isPresent()) {
            throw new ProtocolException("Item already registered (name: '" + itemName + "')");
        }
        if (findInChain(itemName) != null) {
            throw new ProtocolException("Name already registered (name: '" + itemName + "')");
        }
        if (isOpen()) {
            throw new ProtocolException("Cannot register an item in an open layer (name: '" + itemName + "')");
        }
        item.setLayer(this);
        item.setRegisteredName(itemName);
        ownItems.put(itemName, item);
        return this;
    }

    // === Opening and closing ===

    public CompletionStage<Void> open() {
        if (isOpen()) {
            throw new LifecycleException("Cannot open a layer that is already open");
        }
        return Stages.forEachSequential(getItems(), Registerable::open).thenRun(() -> {
            open = Boolean.TRUE;
            LOG.debug("Layer '{}' opened", name);
        });
    }

    public CompletionStage<Void> close() {
        if (!isOpen()) {
            throw new LifecycleException("Cannot close a layer that is not open");
        }
        if (open == null) {
            throw new LifecycleException("Cannot close a layer from a fork");
        }
        return Stages.forEachSequential(getItems(), Registerable::close).thenRun(() -> {
            open = Boolean.FALSE;
            LOG.debug("Layer '{}' closed", name);
        });
    }

    public boolean isOpen() {
        for (Layer current = this; current != null; current = current.base) {
            if (current.open != null) {
                return current.open;
            }
        }
        return false;
    }

    // === Getting items ===

    public Registerable get(String itemName) {
        return get(itemName, true);
    }

    /**
     * @return the item, or {@code null} when it is absent and {@code throwIfNotFound} is false
     */
    public Registerable get(String itemName, boolean throwIfNotFound) {
        Optional<Registerable> item = find(itemName);
        if (item.isEmpty() && throwIfNotFound) {
            throw new LookupException("Item not found in the layer (name: '" + itemName + "')");
        }
        return item.orElse(null);
    }

    public <T extends Registerable> T get(String itemName, Class<T> type) {
        Registerable item = get(itemName);
        if (!type.isInstance(item)) {
            throw new LookupException("Item is not a " + type.getSimpleName() + " (name: '" + itemName + "')");
        }
        return type.cast(item);
    }

    /**
     * Looks an item up, forking an inherited item into this layer on first access.
     */
    public Optional<Registerable> find(String itemName) {
        if (itemName == null) {
            return Optional.empty();
        }
        Registerable own = ownItems.get(itemName);
        if (own != null) {
            return Optional.of(own);
        }
        Registerable inherited = base == null ? null : base.findInChain(itemName);
        if (inherited == null) {
            return Optional.empty();
        }
        Registerable forked = inherited.fork();
        forked.setLayer(this);
        if (isDetached()) {
            forked.detach();
        }
        ownItems.put(itemName, forked);
        return Optional.of(forked);
    }

    private Registerable findInChain(String itemName) {
        for (Layer current = this; current != null; current = current.base) {
            Registerable item = current.ownItems.get(itemName);
            if (item != null) {
                return item;
            }
        }
        return null;
    }

    /**
     * Items in registration order, oldest layer in the fork chain first.
     */
    public List<Registerable> getItems() {
        return getItems(item -> true);
    }

    public List<Registerable> getItems(Predicate<? super Registerable> filter) {
        List<Registerable> items = new ArrayList<>();
        for (String itemName : itemNames()) {
            Registerable item = find(itemName).orElseThrow();
            if (filter.test(item)) {
                items.add(item);
            }
        }
        return items;
    }

    private Set<String> itemNames() {
        Set<String> names = base == null ? new LinkedHashSet<>() : base.itemNames();
        names.addAll(ownItems.keySet());
        return names;
    }

    // === Forking ===

    public Layer fork() {
        return new Layer(this);
    }

    /**
     * A memoized fork for scratch work.
     */
    public Layer getGhost() {
        if (ghost == null) {
            ghost = fork();
        }
        return ghost;
    }

    public Optional<Layer> getBase() {
        return Optional.ofNullable(base);
    }

    // === Attachment ===

    /**
     * Detaches the items this layer owns. Items forked into this layer later are detached as
     * they materialize.
     */
    public Layer detach() {
        for (Registerable item : ownItems.values()) {
            item.detach();
        }
        detached = Boolean.TRUE;
        return this;
    }

    public boolean isDetached() {
        for (Layer current = this; current != null; current = current.base) {
            if (current.detached != null) {
                return current.detached;
            }
        }
        return false;
    }

    // === Parent layer ===

    public Optional<Layer> findParent() {
        for (Layer current = this; current != null; current = current.base) {
            if (current.parent != null) {
                return Optional.of(current.parent);
            }
        }
        return Optional.empty();
    }

    public Layer getParent() {
        return findParent().orElseThrow(() -> new LookupException("Parent layer not found"));
    }

    public boolean hasParent() {
        return findParent().isPresent();
    }

    public Layer setParent(Layer newParent) {
        if (newParent == this) {
            throw new IllegalArgumentException("a layer cannot be its own parent");
        }
        parent = newParent;
        return this;
    }

    // === Batching ===

    /**
     * Runs {@code operation} with batching on: queries it sends are queued, then flushed to the
     * parent as one combined call per pass, and each caller gets its own slice of the combined
     * result. Batches nest; batching ends when the outermost one finishes.
     *
     * @return the results of the stages {@code operation} returned, in order
     */
    public CompletionStage<List<Object>> batch(Function<? super Layer, ? extends List<? extends CompletionStage<Object>>> operation) {
        if (operation == null) {
            throw new IllegalArgumentException("batched operation is required");
        }
        if (batchState == null || batchState.depth == 0) {
            batchState = new BatchState();
        }
        BatchState state = batchState;
        state.depth++;
        Throwable[] failure = new Throwable[1];
        return Stages.withFinally(() -> Stages.attempt(() -> {
            List<? extends CompletionStage<Object>> calls = operation.apply(this);
            if (calls == null) {
                throw new IllegalArgumentException("batched operation must return a list of stages");
            }
            List<CompletionStage<Object>> pending = new ArrayList<>(calls);
            return flushBatch().thenCompose(ignored -> Stages.mapAll(pending, call -> call));
        }).whenComplete((results, error) -> failure[0] = error), () -> {
            state.depth--;
            if (state.depth == 0) {
                abandonQueued(state, failure[0]);
            }
            return Stages.done();
        });
    }

    /**
     * Rejects the queries still waiting when the outermost batch ends, with the operation's
     * failure when there is one.
     */
    private static void abandonQueued(BatchState state, Throwable failure) {
        if (state.queued.isEmpty()) {
            return;
        }
        List<QueuedQuery> abandoned = state.queued;
        state.queued = new ArrayList<>();
        Throwable cause = failure != null
                ? Stages.unwrap(failure)
                : new LifecycleException("The batch ended before the query was sent");
        abandoned.forEach(queued -> queued.result().completeExceptionally(cause));
    }

    public boolean isBatched() {
        return batchState != null && batchState.depth > 0;
    }

    private CompletionStage<Void> flushBatch() {
        return scheduler.yieldPoint().thenCompose(ignored -> {
            if (batchState.queued.isEmpty()) {
                return Stages.done();
            }
            List<QueuedQuery> slice = batchState.queued;
            batchState.queued = new ArrayList<>();
            return dispatchSlice(slice).thenCompose(dispatched -> flushBatch());
        });
    }

    private CompletionStage<Void> dispatchSlice(List<QueuedQuery> slice) {
        List<Object> queries = new ArrayList<>(slice.size());
        for (QueuedQuery queued : slice) {
            queries.add(queued.query());
        }
        return Stages.attempt(() -> sendQuery(queries, true)).handle((result, error) -> {
            if (error != null) {
                Throwable cause = Stages.unwrap(error);
                slice.forEach(queued -> queued.result().completeExceptionally(cause));
            } else if (!(result instanceof List) || ((List<?>) result).size() != slice.size()) {
                ProtocolException mismatch = new ProtocolException(
                        "Expected " + slice.size() + " results from a batched query");
                slice.forEach(queued -> queued.result().completeExceptionally(mismatch));
            } else {
                List<?> results = (List<?>) result;
                for (int i = 0; i < slice.size(); i++) {
                    slice.get(i).result().complete(results.get(i));
                }
            }
            return null;
        });
    }

    // === Sending queries ===

    public CompletionStage<Object> sendQuery(Object query) {
        return sendQuery(query, false);
    }

    /**
     * Sends {@code query} to the parent layer along with the state of the items both layers
     * register, then applies the returned item state and yields the deserialized result.
     *
     * @throws LookupException when this layer has no parent
     */
    public CompletionStage<Object> sendQuery(Object query, boolean ignoreBatch) {
        if (isBatched() && !ignoreBatch) {
            CompletableFuture<Object> deferred = new CompletableFuture<>();
            batchState.queued.add(new QueuedQuery(query, deferred));
            return deferred;
        }
        Layer target = getParent();
        String source = name;
        SerializationOptions outgoing = SerializationOptions.toTarget(target.getName());
        SerializationOptions incoming = SerializationOptions.fromSource(target.getName());
        return serializer.serialize(query, outgoing)
                .thenCompose(serializedQuery -> serializeItems(target, outgoing)
                        .thenApply(items -> new QueryRequest(serializedQuery, items, source)))
                .thenCompose(request -> {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("[{} → {}] {query: {}, items: {}}", source, target.getName(),
                                Jsons.toCompactJson(request.query()), Jsons.toCompactJson(request.items()));
                    }
                    return transport.deliver(target, request);
                })
                .thenCompose(response -> {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("[{} ← {}] {result: {}, items: {}}", source, target.getName(),
                                Jsons.toCompactJson(response.result()), Jsons.toCompactJson(response.items()));
                    }
                    CompletionStage<Object> result = response.result() == null
                            ? Stages.of(null)
                            : serializer.deserialize(response.result(), incoming);
                    return result.thenCompose(value -> applyItems(response.items(), incoming, false)
                            .thenApply(applied -> value));
                });
    }

    // === Receiving queries ===

    /**
     * Runs a query sent by a child layer: applies the item state it carries, opens this layer,
     * evaluates the query under the exposure rules and answers with the result and the state of
     * the exposed items. The layer is closed again whatever happens.
     */
    public CompletionStage<QueryResponse> receiveQuery(QueryRequest request) {
        if (request == null) {
            throw new IllegalArgumentException("query request is required");
        }
        String source = request.source();
        if (LOG.isDebugEnabled()) {
            LOG.debug("[{} → {}] {query: {}, items: {}}", source, name,
                    Jsons.toCompactJson(request.query()), Jsons.toCompactJson(request.items()));
        }
        SerializationOptions incoming = SerializationOptions.fromSource(source).withFilter(filterFor(Operation.SET));
        SerializationOptions outgoing = SerializationOptions.toTarget(source).withFilter(filterFor(Operation.GET));
        return Stages.attempt(() -> applyItems(request.items(), incoming, true))
                .thenCompose(applied -> open())
                .thenCompose(opened -> Stages.withFinally(
                        () -> invokeReceivedQuery(request, incoming, outgoing),
                        this::close))
                .thenApply(response -> {
                    if (LOG.isDebugEnabled()) {
                        LOG.debug("[{} ← {}] {result: {}, items: {}}", source, name,
                                Jsons.toCompactJson(response.result()), Jsons.toCompactJson(response.items()));
                    }
                    return response;
                });
    }

    private CompletionStage<QueryResponse> invokeReceivedQuery(
            QueryRequest request,
            SerializationOptions incoming,
            SerializationOptions outgoing
    ) {
        if (request.query() == null) {
            throw new ProtocolException("A query is required");
        }
        return serializer.deserialize(request.query(), incoming)
                .thenCompose(query -> runHook(beforeInvokeReceivedQuery)
                        .thenCompose(ignored -> invoker.invoke(this, query, createAuthorizer())))
                .thenCompose(result -> result == null
                        ? Stages.<JsonNode>of(null)
                        : serializer.serialize(result, outgoing))
                .thenCompose(result -> serializeItems(null, outgoing)
                        .thenCompose(items -> runHook(afterInvokeReceivedQuery)
                                .thenApply(ignored -> new QueryResponse(result, items))));
    }

    private CompletionStage<?> runHook(ReceivedQueryHook hook) {
        if (hook == null) {
            return Stages.done();
        }
        CompletionStage<?> stage = hook.onReceivedQuery(this);
        return stage == null ? Stages.done() : stage;
    }

    private static PropertyFilter filterFor(Operation operation) {
        return (owner, property) -> owner.operationIsAllowed(property, operation);
    }

    /**
     * Receivers of a query evaluated here: a layer only lets exposed items be read (plus the
     * introspection of its exposed surface), an item only lets its exposed properties be used
     * as their settings allow. Everything else is denied.
     */
    private Authorizer createAuthorizer() {
        return (receiver, propertyName, operation, params) -> {
            if (receiver instanceof Layer) {
                Layer layer = (Layer) receiver;
                if (INTROSPECT_METHOD.equals(propertyName)
                        && operation == Operation.CALL
                        && EXPOSED_INTROSPECTION_ARGUMENTS.equals(params)) {
                    return Stages.of(Boolean.TRUE);
                }
                if (operation != Operation.GET) {
                    return Stages.of(Boolean.FALSE);
                }
                return Stages.of(layer.find(propertyName).map(Registerable::isExposed).orElse(false));
            }
            if (receiver instanceof Registerable) {
                Registerable item = (Registerable) receiver;
                Optional<ExposedProperty> property = item.getExposedProperty(propertyName);
                if (property.isEmpty()) {
                    return Stages.of(Boolean.FALSE);
                }
                return item.operationIsAllowed(property.get(), operation);
            }
            return Stages.of(Boolean.FALSE);
        };
    }

    // === Item state ===

    /**
     * Sending to {@code target}: the items it also registers. Answering (no target): the exposed
     * items.
     */
    private CompletionStage<ObjectNode> serializeItems(Layer target, SerializationOptions options) {
        ObjectNode serialized = Jsons.nodes().objectNode();
        return Stages.forEachSequential(getItems(), item -> {
            String itemName = item.getRegisteredName();
            if (target != null ? target.find(itemName).isEmpty() : !item.isExposed()) {
                return Stages.done();
            }
            if (!(item instanceof WireSerializable)) {
                throw new SerializationException("Cannot send an item that is not serializable (name: '" + itemName + "')");
            }
            return ((WireSerializable) item).serialize(serializer, options)
                    .thenAccept(node -> serialized.set(itemName, node));
        }).thenApply(ignored -> serialized.isEmpty() ? null : serialized);
    }

    private CompletionStage<Void> applyItems(ObjectNode items, SerializationOptions options, boolean receiving) {
        if (items == null) {
            return Stages.done();
        }
        List<Map.Entry<String, JsonNode>> entries = new ArrayList<>();
        Iterator<Map.Entry<String, JsonNode>> fields = items.fields();
        while (fields.hasNext()) {
            entries.add(fields.next());
        }
        return Stages.forEachSequential(entries, entry -> {
            String itemName = entry.getKey();
            Optional<Registerable> found = find(itemName);
            if (receiving && !found.map(Registerable::isExposed).orElse(false)) {
                // Missing and unexposed items are reported alike.
                throw new AuthorizationException("Cannot receive the item '" + itemName + "'");
            }
            if (found.isEmpty()) {
                return Stages.done();
            }
            Registerable item = found.get();
            if (!(item instanceof WireSerializable)) {
                throw new SerializationException("Cannot receive an item that is not serializable (name: '" + itemName + "')");
            }
            if (!entry.getValue().isObject()) {
                throw new ProtocolException("Item state must be an object (name: '" + itemName + "')");
            }
            return ((WireSerializable) item).applyState((ObjectNode) entry.getValue(), serializer, options);
        });
    }

    // === Serialization ===

    public CompletionStage<JsonNode> serialize(Object value, SerializationOptions options) {
        return serializer.serialize(value, options);
    }

    public CompletionStage<Object> deserialize(JsonNode value, SerializationOptions options) {
        return serializer.deserialize(value, options);
    }

    // === Introspection ===

    /**
     * {@code {name?, items?}}: the name is left out when it was generated, and items map each
     * listed item's registered name to its own introspection.
     */
    public Map<String, Object> introspect(IntrospectionOptions options) {
        IntrospectionOptions safe = options == null ? IntrospectionOptions.ALL : options;
        Map<String, Object> introspection = new LinkedHashMap<>();
        if (!nameWasGenerated) {
            introspection.put("name", name);
        }
        Map<String, Object> items = new LinkedHashMap<>();
        for (Registerable item : getItems(item -> !safe.exposedItemsOnly() || isVisible(item))) {
            items.put(item.getRegisteredName(), item.introspect());
        }
        if (!items.isEmpty()) {
            introspection.put("items", items);
        }
        return introspection;
    }

    private static boolean isVisible(Registerable item) {
        if (item.isExposed()) {
            return true;
        }
        return item instanceof ModelClass && ((ModelClass) item).prototype().isExposed();
    }

    // === Query receiver ===

    @Override
    public Optional<Object> getQueryProperty(String propertyName) {
        return find(propertyName).map(item -> (Object) item);
    }

    @Override
    public CompletionStage<Object> callQueryMethod(String methodName, List<Object> args) {
        if (INTROSPECT_METHOD.equals(methodName)) {
            return Stages.of(introspect(IntrospectionOptions.fromArguments(args)));
        }
        return Stages.failed(new LookupException("Method not found (name: '" + methodName + "')"));
    }

    @Override
    public String toString() {
        return "Layer(" + name + ")";
    }

    private static final class BatchState {
        private int depth;
        private List<QueuedQuery> queued = new ArrayList<>();
    }

    private record QueuedQuery(Object query, CompletableFuture<Object> result) {
    }

    public static final class Builder {
        private final Map<String, Registerable> items = new LinkedHashMap<>();
        private String name;
        private Layer parent;
        private ReceivedQueryHook beforeInvokeReceivedQuery;
        private ReceivedQueryHook afterInvokeReceivedQuery;
        private QueryTransport transport = DirectTransport.INSTANCE;
        private QueryInvoker invoker = new BasicQueryInvoker();
        private Scheduler scheduler = Scheduler.immediate();

        private Builder() {
        }

        public Builder name(String value) {
            this.name = value;
            return this;
        }

        public Builder parent(Layer value) {
            this.parent = value;
            return this;
        }

        public Builder register(String itemName, Registerable item) {
            if (items.containsKey(itemName)) {
                throw new ProtocolException("Name already registered (name: '" + itemName + "')");
            }
            items.put(itemName, item);
            return this;
        }

        public Builder register(Map<String, ? extends Registerable> values) {
            values.forEach(this::register);
            return this;
        }

        public Builder beforeInvokeReceivedQuery(ReceivedQueryHook hook) {
            this.beforeInvokeReceivedQuery = hook;
            return this;
        }

        public Builder afterInvokeReceivedQuery(ReceivedQueryHook hook) {
            this.afterInvokeReceivedQuery = hook;
            return this;
        }

        public Builder transport(QueryTransport value) {
            if (value == null) {
                throw new IllegalArgumentException("transport is required");
            }
            this.transport = value;
            return this;
        }

        public Builder invoker(QueryInvoker value) {
            if (value == null) {
                throw new IllegalArgumentException("query invoker is required");
            }
            this.invoker = value;
            return this;
        }

        public Builder scheduler(Scheduler value) {
            if (value == null) {
                throw new IllegalArgumentException("scheduler is required");
            }
            this.scheduler = value;
            return this;
        }

        public Layer build() {
            return new Layer(this);
        }
    }
}
