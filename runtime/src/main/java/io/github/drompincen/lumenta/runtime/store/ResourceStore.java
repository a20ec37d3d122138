package io.github.drompincen.lumenta.runtime.store;

import io.github.drompincen.lumenta.protocol.resource.ActiveWorkflowResource;
import io.github.drompincen.lumenta.protocol.resource.AudioTranscriptResource;
import io.github.drompincen.lumenta.protocol.resource.DetectionResource;
import io.github.drompincen.lumenta.protocol.resource.IdentityMatchResource;
import io.github.drompincen.lumenta.protocol.resource.NodeExecutionTrace;
import io.github.drompincen.lumenta.protocol.resource.ResourceKind;
import io.github.drompincen.lumenta.protocol.resource.StoredResource;
import io.github.drompincen.lumenta.protocol.resource.VideoSummaryResource;
import io.github.drompincen.lumenta.protocol.resource.WorkflowGraph;
import io.github.drompincen.lumenta.runtime.config.LumentaProperties;
import io.github.drompincen.lumenta.runtime.graph.GraphMutation;
import io.github.drompincen.lumenta.runtime.graph.GraphMutationException;
import io.github.drompincen.lumenta.runtime.graph.MutableWorkflowGraph;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Component;

import java.time.Instant;
import java.util.EnumMap;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.UUID;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.concurrent.locks.ReentrantReadWriteLock;
import java.util.function.Predicate;
import java.util.function.Supplier;
import java.util.function.UnaryOperator;

/**
 * In-memory store for every resource kind, with synchronous fan-out to subscribers.
 *
 * <p>Writers serialize on a publish lock that covers both the mutation and the notification, so
 * subscribers observe events of one kind in {@code add*} call order and never interleaved. The
 * collections themselves sit behind a read/write lock that is held only for the mutation, so
 * readers are never blocked by a slow subscriber.
 */
@Component
public class ResourceStore {

    private static final Logger log = LoggerFactory.getLogger(ResourceStore.class);

    public static final int DEFAULT_DETECTION_LIMIT = 100;
    public static final int DEFAULT_IDENTITY_MATCH_LIMIT = 100;
    public static final int DEFAULT_TRANSCRIPT_LIMIT = 100;
    public static final int DEFAULT_SUMMARY_LIMIT = 50;
    public static final int DEFAULT_TRACE_LIMIT = 500;

    private final Map<ResourceKind, BoundedCollection<StoredResource>> collections = new EnumMap<>(ResourceKind.class);
    private final Map<String, MutableWorkflowGraph> graphs = new HashMap<>();
    private final ReentrantReadWriteLock collectionLock = new ReentrantReadWriteLock();
    private final ReentrantLock publishLock = new ReentrantLock();
    private final List<Subscription> subscriptions = new CopyOnWriteArrayList<>();
    private final AtomicLong subscriptionIds = new AtomicLong();

    public ResourceStore(LumentaProperties properties) {
        LumentaProperties.Retention retention = properties.getStore().getRetention();
        for (ResourceKind kind : ResourceKind.values()) {
            collections.put(kind, new BoundedCollection<>(retention.capacity(kind)));
        }
    }

    // ---- writes ----

    public DetectionResource addDetection(DetectionResource detection) {
        return (DetectionResource) add(ResourceKind.DETECTION, detection);
    }

    public IdentityMatchResource addIdentityMatch(IdentityMatchResource match) {
        return (IdentityMatchResource) add(ResourceKind.IDENTITY_MATCH, match);
    }

    public AudioTranscriptResource addTranscript(AudioTranscriptResource transcript) {
        return (AudioTranscriptResource) add(ResourceKind.TRANSCRIPT, transcript);
    }

    public VideoSummaryResource addSummary(VideoSummaryResource summary) {
        return (VideoSummaryResource) add(ResourceKind.SUMMARY, summary);
    }

    public ActiveWorkflowResource addWorkflow(ActiveWorkflowResource workflow) {
        return (ActiveWorkflowResource) add(ResourceKind.WORKFLOW, workflow);
    }

    public NodeExecutionTrace addTrace(NodeExecutionTrace trace) {
        return (NodeExecutionTrace) add(ResourceKind.TRACE, trace);
    }

    /**
     * Stores the resource (assigning an id and timestamp where absent), replacing any resource of
     * the same kind and id, and notifies subscribers.
     *
     * @return the resource as stored
     */
    public StoredResource add(ResourceKind kind, StoredResource resource) {
        Objects.requireNonNull(resource, "resource");
        if (resource.kind() != kind) {
            throw new IllegalArgumentException("Expected a " + kind.wire() + " resource but got " + resource.kind().wire());
        }
        return publish(() -> put(resource.withDefaults(UUID.randomUUID().toString(), Instant.now())));
    }

    /**
     * Atomically replaces a workflow with {@code update(current)}.
     *
     * @return the updated workflow, or empty when no workflow has that id
     */
    public Optional<ActiveWorkflowResource> updateWorkflow(String workflowId, UnaryOperator<ActiveWorkflowResource> update) {
        publishLock.lock();
        try {
            Optional<ActiveWorkflowResource> current = getWorkflow(workflowId);
            if (current.isEmpty()) {
                return Optional.empty();
            }
            ActiveWorkflowResource updated = update.apply(current.get());
            if (!workflowId.equals(updated.id())) {
                throw new IllegalArgumentException("Workflow update must keep id " + workflowId);
            }
            put(updated);
            return Optional.of(updated);
        } finally {
            publishLock.unlock();
        }
    }

    /**
     * Applies one mutation to the workflow's graph. The mutation is all-or-nothing; on success the
     * workflow's {@code nodeCount} and {@code lastEventAt} are refreshed and a workflow event is emitted.
     *
     * @throws GraphMutationException when the workflow is unknown or the mutation is invalid
     */
    public WorkflowGraph mutateGraph(String workflowId, GraphMutation mutation) {
        publishLock.lock();
        try {
            ActiveWorkflowResource workflow = getWorkflow(workflowId)
                    .orElseThrow(() -> new GraphMutationException("Workflow not found: " + workflowId));
            MutableWorkflowGraph working = new MutableWorkflowGraph(graph(workflowId).orElseThrow());
            working.apply(mutation);

            collectionLock.writeLock().lock();
            try {
                graphs.put(workflowId, working);
            } finally {
                collectionLock.writeLock().unlock();
            }
            put(workflow.withNodeCount(working.nodeCount(), Instant.now()));
            return working.snapshot(workflowId);
        } finally {
            publishLock.unlock();
        }
    }

    // ---- reads ----

    public Optional<DetectionResource> getDetection(String id) {
        return get(ResourceKind.DETECTION, id).map(DetectionResource.class::cast);
    }

    public Optional<IdentityMatchResource> getIdentityMatch(String id) {
        return get(ResourceKind.IDENTITY_MATCH, id).map(IdentityMatchResource.class::cast);
    }

    public Optional<AudioTranscriptResource> getTranscript(String id) {
        return get(ResourceKind.TRANSCRIPT, id).map(AudioTranscriptResource.class::cast);
    }

    public Optional<VideoSummaryResource> getSummary(String id) {
        return get(ResourceKind.SUMMARY, id).map(VideoSummaryResource.class::cast);
    }

    public Optional<ActiveWorkflowResource> getWorkflow(String id) {
        return get(ResourceKind.WORKFLOW, id).map(ActiveWorkflowResource.class::cast);
    }

    public Optional<NodeExecutionTrace> getTrace(String id) {
        return get(ResourceKind.TRACE, id).map(NodeExecutionTrace.class::cast);
    }

    public Optional<StoredResource> get(ResourceKind kind, String id) {
        if (id == null) {
            return Optional.empty();
        }
        return read(() -> collections.get(kind).get(id));
    }

    public List<DetectionResource> listDetections() {
        return listDetections(DEFAULT_DETECTION_LIMIT);
    }

    public List<DetectionResource> listDetections(int limit) {
        return latest(ResourceKind.DETECTION, limit, r -> true);
    }

    public List<DetectionResource> listDetectionsByFeed(String feedId) {
        return listDetectionsByFeed(feedId, DEFAULT_DETECTION_LIMIT);
    }

    public List<DetectionResource> listDetectionsByFeed(String feedId, int limit) {
        return latest(ResourceKind.DETECTION, limit, r -> Objects.equals(feedId, ((DetectionResource) r).feedId()));
    }

    public List<IdentityMatchResource> listIdentityMatches() {
        return listIdentityMatches(DEFAULT_IDENTITY_MATCH_LIMIT);
    }

    public List<IdentityMatchResource> listIdentityMatches(int limit) {
        return latest(ResourceKind.IDENTITY_MATCH, limit, r -> true);
    }

    public List<AudioTranscriptResource> listTranscripts() {
        return listTranscripts(DEFAULT_TRANSCRIPT_LIMIT);
    }

    public List<AudioTranscriptResource> listTranscripts(int limit) {
        return latest(ResourceKind.TRANSCRIPT, limit, r -> true);
    }

    public List<VideoSummaryResource> listSummaries() {
        return listSummaries(DEFAULT_SUMMARY_LIMIT);
    }

    public List<VideoSummaryResource> listSummaries(int limit) {
        return latest(ResourceKind.SUMMARY, limit, r -> true);
    }

    @SuppressWarnings("unchecked")
    public List<ActiveWorkflowResource> listWorkflows() {
        return (List<ActiveWorkflowResource>) (List<?>) read(() -> collections.get(ResourceKind.WORKFLOW).all());
    }

    public List<NodeExecutionTrace> listTraces(String workflowId) {
        return listTraces(workflowId, DEFAULT_TRACE_LIMIT);
    }

    /** Most recent traces, optionally restricted to one workflow ({@code workflowId == null} means all). */
    public List<NodeExecutionTrace> listTraces(String workflowId, int limit) {
        return latest(ResourceKind.TRACE, limit,
                r -> workflowId == null || workflowId.equals(((NodeExecutionTrace) r).workflowId()));
    }

    /** Graph snapshot of an existing workflow; a workflow nobody has mutated yet has an empty graph. */
    public Optional<WorkflowGraph> graph(String workflowId) {
        return read(() -> {
            if (collections.get(ResourceKind.WORKFLOW).get(workflowId).isEmpty()) {
                return Optional.empty();
            }
            MutableWorkflowGraph graph = graphs.get(workflowId);
            return Optional.of(graph != null ? graph.snapshot(workflowId) : WorkflowGraph.empty(workflowId));
        });
    }

    // ---- subscriptions ----

    public Subscription subscribe(StoreListener listener) {
        Objects.requireNonNull(listener, "listener");
        Subscription subscription = new Subscription(subscriptionIds.incrementAndGet(), listener, this);
        subscriptions.add(subscription);
        log.debug("Subscriber {} registered ({} active)", subscription.id(), subscriptions.size());
        return subscription;
    }

    /**
     * Removes a subscriber. Unknown or already removed ids are ignored.
     *
     * @return true if this call removed the subscriber
     */
    public boolean unsubscribe(long subscriptionId) {
        for (Subscription subscription : subscriptions) {
            if (subscription.id() == subscriptionId && subscription.deactivate()) {
                subscriptions.remove(subscription);
                log.debug("Subscriber {} removed ({} active)", subscriptionId, subscriptions.size());
                return true;
            }
        }
        return false;
    }

    public int subscriberCount() {
        return subscriptions.size();
    }

    // ---- internals ----

    private StoredResource publish(Supplier<StoredResource> mutation) {
        publishLock.lock();
        try {
            return mutation.get();
        } finally {
            publishLock.unlock();
        }
    }

    /** Caller holds the publish lock. */
    private StoredResource put(StoredResource resource) {
        ResourceKind kind = resource.kind();
        collectionLock.writeLock().lock();
        try {
            List<StoredResource> evicted = collections.get(kind).put(resource);
            if (kind == ResourceKind.WORKFLOW) {
                evicted.forEach(w -> graphs.remove(w.id()));
            }
            if (!evicted.isEmpty()) {
                log.debug("Evicted {} {} resource(s)", evicted.size(), kind.wire());
            }
        } finally {
            collectionLock.writeLock().unlock();
        }
        notifySubscribers(new StoreEvent(kind, resource));
        return resource;
    }

    private void notifySubscribers(StoreEvent event) {
        // iterates a snapshot: subscribers added during this loop miss the in-flight event
        for (Subscription subscription : subscriptions) {
            try {
                subscription.deliver(event);
            } catch (RuntimeException e) {
                log.error("Subscriber {} failed handling {} event", subscription.id(), event.type(), e);
            }
        }
    }

    @SuppressWarnings("unchecked")
    private <T extends StoredResource> List<T> latest(ResourceKind kind, int limit,
                                                      Predicate<StoredResource> filter) {
        return (List<T>) read(() -> collections.get(kind).latest(limit, filter));
    }

    private <T> T read(Supplier<T> reader) {
        collectionLock.readLock().lock();
        try {
            return reader.get();
        } finally {
            collectionLock.readLock().unlock();
        }
    }
}
