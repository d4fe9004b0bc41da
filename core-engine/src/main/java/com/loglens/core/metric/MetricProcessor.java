package com.loglens.core.metric;

import com.loglens.core.config.ConfigurationException;
import com.loglens.core.model.LogEvent;
import com.loglens.core.model.MetricResult;
import com.loglens.core.window.SlidingWindow;
import com.loglens.core.window.TimeWindow;
import com.loglens.core.window.WindowSnapshot;
import com.loglens.core.window.WindowType;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.io.Serializable;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.Set;

/**
 * Runs every configured metric over a stream of log events.
 *
 * <p>
 * For each event and each metric, in configuration order: filter, group key,
 * value extraction, window admission, aggregation of the emitted snapshot.
 * </p>
 *
 * <h3>Grouping</h3>
 * <p>
 * A grouped metric keeps one window per group key. Sliding metrics report the
 * latest value of every group with samples still in scope; tumbling metrics report only the group
 * whose window just closed. The number of tracked groups is capped by
 * {@link MetricProcessorOptions#getMaxGroupsPerMetric()}, evicting the least
 * recently active group.
 * </p>
 *
 * <h3>Failures</h3>
 * <p>
 * A throwing filter, key or extractor only affects that metric for that
 * event: it is wrapped in an {@link EvaluationException}, counted and passed
 * to the configured {@link EvaluationErrorHandler}.
 * </p>
 *
 * <h3>State</h3>
 * <p>
 * Not thread-safe. In the Flink job one instance is held per metric in keyed
 * state, so all state uses plain mutable collections.
 * </p>
 *
 * @since 1.0.0
 */
public class MetricProcessor implements Serializable {

    private static final long serialVersionUID = 1L;
    private static final Logger LOG = LoggerFactory.getLogger(MetricProcessor.class);

    /** Group key reported when the key expression yields nothing. */
    public static final String NULL_GROUP = "null";

    private final LinkedHashMap<String, MetricState> states = new LinkedHashMap<>();
    private final LinkedHashMap<String, MetricResult> latestResults = new LinkedHashMap<>();
    private final EvaluationErrorHandler errorHandler;
    private long evaluationErrorCount;

    public MetricProcessor(List<MetricDefinition> definitions) {
        this(definitions, MetricProcessorOptions.defaults());
    }

    /**
     * @throws ConfigurationException if the list is empty, holds a
     *         {@code null} definition, or repeats a metric name
     */
    public MetricProcessor(List<MetricDefinition> definitions, MetricProcessorOptions options) {
        Objects.requireNonNull(options, "options must not be null");
        if (definitions == null || definitions.isEmpty()) {
            throw new ConfigurationException("At least one metric definition is required");
        }
        for (MetricDefinition definition : definitions) {
            if (definition == null) {
                throw new ConfigurationException("Metric definitions must not contain null");
            }
            if (states.containsKey(definition.getName())) {
                throw new ConfigurationException("Duplicate metric name: '" + definition.getName() + "'");
            }
            states.put(definition.getName(), new MetricState(definition, options.getMaxGroupsPerMetric()));
        }
        this.errorHandler = options.getErrorHandler();

        LOG.info("MetricProcessor initialised with {} metric(s): {}", states.size(), states.keySet());
    }

    // -------------------------------------------------------------------------
    // Event processing
    // -------------------------------------------------------------------------

    /**
     * Feed one event to every metric.
     *
     * @param event the event, must not be {@code null}
     * @return results of the metrics that emitted, in configuration order
     */
    public Map<String, MetricResult> addEvent(LogEvent event) {
        Objects.requireNonNull(event, "Event must not be null");

        Map<String, MetricResult> emitted = new LinkedHashMap<>();
        for (MetricState state : states.values()) {
            try {
                state.add(event).ifPresent(result -> {
                    emitted.put(result.getMetricName(), result);
                    latestResults.put(result.getMetricName(), result);
                });
            } catch (EvaluationException e) {
                evaluationErrorCount++;
                errorHandler.onError(e);
            }
        }
        return emitted;
    }

    /**
     * Finalise partial windows. Tumbling metrics emit and reset their current
     * buffer; sliding metrics report their current contents.
     *
     * @return results of the metrics holding data, in configuration order
     */
    public Map<String, MetricResult> flush() {
        Map<String, MetricResult> emitted = new LinkedHashMap<>();
        for (MetricState state : states.values()) {
            state.flush().ifPresent(result -> {
                emitted.put(result.getMetricName(), result);
                latestResults.put(result.getMetricName(), result);
            });
        }
        LOG.debug("Flushed {} metric(s)", emitted.size());
        return emitted;
    }

    /**
     * Feed a batch of events and collect every emitted result. Partial
     * windows are not flushed.
     *
     * @return every result per metric, in emission order
     */
    public Map<String, List<MetricResult>> processEvents(Iterable<LogEvent> events) {
        Objects.requireNonNull(events, "events must not be null");
        Map<String, List<MetricResult>> updates = new LinkedHashMap<>();
        for (LogEvent event : events) {
            for (Map.Entry<String, MetricResult> entry : addEvent(event).entrySet()) {
                updates.computeIfAbsent(entry.getKey(), k -> new ArrayList<>()).add(entry.getValue());
            }
        }
        return updates;
    }

    // -------------------------------------------------------------------------
    // Introspection
    // -------------------------------------------------------------------------

    public Optional<MetricResult> getMetric(String name) {
        return Optional.ofNullable(latestResults.get(name));
    }

    /**
     * @return the latest result of every metric that has emitted
     */
    public Map<String, MetricResult> getAllMetrics() {
        return Collections.unmodifiableMap(new LinkedHashMap<>(latestResults));
    }

    /**
     * @return tracked group keys, least recently active first; empty for
     *         unknown or ungrouped metrics
     */
    public Set<String> getGroupKeys(String metricName) {
        MetricState state = states.get(metricName);
        if (state == null) {
            return Collections.emptySet();
        }
        return Collections.unmodifiableSet(new LinkedHashSet<>(state.groups.keySet()));
    }

    public Set<String> getMetricNames() {
        return Collections.unmodifiableSet(new LinkedHashSet<>(states.keySet()));
    }

    public Optional<MetricDefinition> getDefinition(String metricName) {
        MetricState state = states.get(metricName);
        return state == null ? Optional.empty() : Optional.of(state.definition);
    }

    public long getEvaluationErrorCount() {
        return evaluationErrorCount;
    }

    /**
     * Reset every window and forget all results. The error count is kept.
     */
    public void clear() {
        for (MetricState state : states.values()) {
            state.clear();
        }
        latestResults.clear();
        LOG.debug("Cleared state of {} metric(s)", states.size());
    }

    // -------------------------------------------------------------------------
    // Per-metric state
    // -------------------------------------------------------------------------

    private static final class MetricState implements Serializable {

        private static final long serialVersionUID = 1L;

        private final MetricDefinition definition;
        private final TimeWindow<MetricSample> window;
        private final int maxGroups;
        /** Insertion order doubles as recency order: re-inserted on every admission. */
        private final LinkedHashMap<String, GroupState> groups = new LinkedHashMap<>();

        MetricState(MetricDefinition definition, int maxGroups) {
            this.definition = definition;
            this.maxGroups = maxGroups;
            this.window = definition.isGrouped() ? null : definition.getWindow().newWindow();
        }

        Optional<MetricResult> add(LogEvent event) {
            String name = definition.getName();

            if (!evaluateFilter(event)) {
                LOG.trace("Metric [{}] filtered out event {}", name, event);
                return Optional.empty();
            }
            String groupKey = definition.isGrouped() ? evaluateGroupKey(event) : null;
            MetricSample sample = new MetricSample(event, evaluateValue(event));

            if (groupKey == null) {
                return window.add(sample, event.getTimestamp())
                        .map(snapshot -> MetricResult.scalar(name, snapshot.getStart(), snapshot.getEnd(),
                                Aggregator.aggregate(definition.getAggregation(), snapshot.getValues()),
                                snapshot.size()));
            }

            GroupState group = touch(groupKey);
            Optional<WindowSnapshot<MetricSample>> snapshot = group.window.add(sample, event.getTimestamp());
            if (snapshot.isEmpty()) {
                return Optional.empty();
            }
            WindowSnapshot<MetricSample> emitted = snapshot.get();
            Double value = Aggregator.aggregate(definition.getAggregation(), emitted.getValues());

            Map<String, Double> grouped = new LinkedHashMap<>();
            if (definition.getWindow().getType() == WindowType.SLIDING) {
                group.latestValue = value;
                expireIdleGroups(groupKey, event.getTimestamp());
                for (Map.Entry<String, GroupState> entry : groups.entrySet()) {
                    if (entry.getValue().latestValue != null) {
                        grouped.put(entry.getKey(), entry.getValue().latestValue);
                    }
                }
            } else {
                grouped.put(groupKey, value);
            }
            return Optional.of(MetricResult.grouped(name, emitted.getStart(), emitted.getEnd(),
                    grouped, emitted.size()));
        }

        Optional<MetricResult> flush() {
            String name = definition.getName();
            if (!definition.isGrouped()) {
                return window.flush()
                        .map(snapshot -> MetricResult.scalar(name, snapshot.getStart(), snapshot.getEnd(),
                                Aggregator.aggregate(definition.getAggregation(), snapshot.getValues()),
                                snapshot.size()));
            }

            boolean sliding = definition.getWindow().getType() == WindowType.SLIDING;
            Map<String, Double> grouped = new LinkedHashMap<>();
            Instant start = null;
            Instant end = null;
            int sampleCount = 0;

            for (Map.Entry<String, GroupState> entry : groups.entrySet()) {
                Optional<WindowSnapshot<MetricSample>> flushed = entry.getValue().window.flush();
                if (flushed.isEmpty()) {
                    continue;
                }
                WindowSnapshot<MetricSample> snapshot = flushed.get();
                Double value = Aggregator.aggregate(definition.getAggregation(), snapshot.getValues());
                if (sliding) {
                    entry.getValue().latestValue = value;
                }
                if (value != null) {
                    grouped.put(entry.getKey(), value);
                }
                start = start == null || snapshot.getStart().isBefore(start) ? snapshot.getStart() : start;
                end = end == null || snapshot.getEnd().isAfter(end) ? snapshot.getEnd() : end;
                sampleCount += snapshot.size();
            }

            if (start == null) {
                return Optional.empty();
            }
            return Optional.of(MetricResult.grouped(name, start, end, grouped, sampleCount));
        }

        void clear() {
            if (window != null) {
                window.clear();
            }
            groups.clear();
        }

        /**
         * Age every sliding group other than {@code activeKey} to {@code now}.
         * Groups left without samples are forgotten; the others get their
         * aggregate recomputed over what is still in scope.
         */
        private void expireIdleGroups(String activeKey, Instant now) {
            Iterator<Map.Entry<String, GroupState>> it = groups.entrySet().iterator();
            while (it.hasNext()) {
                Map.Entry<String, GroupState> entry = it.next();
                if (entry.getKey().equals(activeKey)) {
                    continue;
                }
                GroupState idle = entry.getValue();
                SlidingWindow<MetricSample> idleWindow = (SlidingWindow<MetricSample>) idle.window;
                if (idleWindow.expire(now) == 0) {
                    continue;
                }
                if (idleWindow.size() == 0) {
                    it.remove();
                    LOG.debug("Metric [{}] group '{}' has no samples left in scope, dropping it",
                            definition.getName(), entry.getKey());
                } else {
                    idle.latestValue = Aggregator.aggregate(definition.getAggregation(), idleWindow.values());
                }
            }
        }

        /**
         * Mark {@code key} as most recently active, creating its window if new.
         */
        private GroupState touch(String key) {
            GroupState group = groups.remove(key);
            if (group == null) {
                group = new GroupState(definition.getWindow().newWindow());
                if (groups.size() >= maxGroups) {
                    Iterator<String> eldest = groups.keySet().iterator();
                    String evicted = eldest.next();
                    eldest.remove();
                    LOG.debug("Metric [{}] reached {} groups, evicted least recently active group '{}'",
                            definition.getName(), maxGroups, evicted);
                }
            }
            groups.put(key, group);
            return group;
        }

        private boolean evaluateFilter(LogEvent event) {
            try {
                return definition.getFilter().test(event);
            } catch (RuntimeException e) {
                throw new EvaluationException(definition.getName(), event, e);
            }
        }

        private String evaluateGroupKey(LogEvent event) {
            try {
                String key = definition.getGroupBy().keyOf(event);
                return key != null ? key : NULL_GROUP;
            } catch (RuntimeException e) {
                throw new EvaluationException(definition.getName(), event, e);
            }
        }

        private Double evaluateValue(LogEvent event) {
            if (definition.getValueExtractor() == null) {
                return null;
            }
            try {
                return definition.getValueExtractor().valueOf(event);
            } catch (RuntimeException e) {
                throw new EvaluationException(definition.getName(), event, e);
            }
        }
    }

    private static final class GroupState implements Serializable {

        private static final long serialVersionUID = 1L;

        private final TimeWindow<MetricSample> window;
        private Double latestValue;

        GroupState(TimeWindow<MetricSample> window) {
            this.window = window;
        }
    }
}
