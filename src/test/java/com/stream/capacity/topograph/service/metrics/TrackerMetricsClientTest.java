package com.stream.capacity.topograph.service.metrics;

import com.stream.capacity.topograph.TopologyFixtures;
import com.stream.capacity.topograph.dto.metrics.InstanceTimeSeries;
import com.stream.capacity.topograph.exception.PlanFetchException;
import com.stream.capacity.topograph.service.graph.InstanceNameParser;
import com.stream.capacity.topograph.service.plan.PlanSource;
import com.stream.capacity.topograph.service.plan.TrackerStub;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.http.HttpStatus;

import java.net.URI;
import java.time.Instant;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.assertj.core.api.Assertions.entry;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class TrackerMetricsClientTest {

    private static final Instant START = Instant.ofEpochSecond(1700000000L);
    private static final Instant END = Instant.ofEpochSecond(1700000120L);

    @Mock
    private PlanSource planSource;

    private final TrackerStub tracker =
            TrackerStub.respondingWith(HttpStatus.OK, TrackerStub.resource("metricstimeline.json"));

    private MetricsClient metricsClient(TrackerStub stub) {
        return new TrackerMetricsClient(stub.client(), planSource, new InstanceNameParser());
    }

    @Test
    void executeCountsArePerInstanceTimeSeries() {
        List<InstanceTimeSeries> series = metricsClient(tracker)
                .getExecuteCounts("WordCount", START, END, options("count", "word"));

        assertThat(series).hasSize(2);
        InstanceTimeSeries first = series.get(0);
        assertThat(first.getInstance()).isEqualTo("container_1_count_3");
        assertThat(first.getContainer()).isEqualTo(1);
        assertThat(first.getTaskId()).isEqualTo(3);
        assertThat(first.getComponent()).isEqualTo("count");
        assertThat(first.getSource()).isEqualTo("word");
        assertThat(first.getStream()).isEqualTo("default");
        assertThat(first.getMetric()).isEqualTo("__execute-count");
        assertThat(first.getValues()).containsExactly(
                entry(Instant.ofEpochSecond(1700000000L), 120.0),
                entry(Instant.ofEpochSecond(1700000060L), 135.5));

        assertThat(series.get(1).getValues()).containsOnlyKeys(Instant.ofEpochSecond(1700000060L));
        verifyNoInteractions(planSource);
    }

    @Test
    void requestCarriesTopologyComponentScopedMetricAndWindow() {
        metricsClient(tracker).getExecuteCounts("WordCount", START, END, options("count", "word"));

        URI request = tracker.lastRequest();
        assertThat(request.getPath()).isEqualTo("/topologies/metricstimeline");
        assertThat(request.getQuery())
                .contains("cluster=local")
                .contains("environ=default")
                .contains("topology=WordCount")
                .contains("component=count")
                .contains("metricname=__execute-count/word/default")
                .contains("starttime=1700000000")
                .contains("endtime=1700000120");
    }

    @Test
    void boltMetricsAreScopedBySourceWhileEmitCountsAreNot() {
        MetricsClient metricsClient = metricsClient(tracker);
        Map<String, Object> options = options("count", "word");
        options.put("stream", "errors");

        metricsClient.getServiceTimes("WordCount", START, END, options);
        assertThat(tracker.lastRequest().getQuery()).contains("metricname=__execute-latency/word/errors");

        metricsClient.getEmitCounts("WordCount", START, END, options);
        assertThat(tracker.lastRequest().getQuery()).contains("metricname=__emit-count/errors");

        // answer carries no series for these metric names
        assertThat(metricsClient.getReceiveCounts("WordCount", START, END, options)).isEmpty();
        assertThat(tracker.lastRequest().getQuery()).contains("metricname=__execute-count/word/errors");
        assertThat(tracker.requestCount()).isEqualTo(3);
    }

    @Test
    void withoutSourceEveryDeclaredInputIsRead() {
        when(planSource.getLogicalPlan("local", "default", "WordCount"))
                .thenReturn(TopologyFixtures.wordCountLogicalPlan());

        List<InstanceTimeSeries> series = metricsClient(tracker)
                .getExecuteCounts("WordCount", START, END, options("sink_writer", null));

        // sink_writer consumes count/default and count/errors
        assertThat(tracker.requestCount()).isEqualTo(2);
        assertThat(tracker.lastRequest().getQuery()).contains("metricname=__execute-count/count/errors");
        assertThat(series).isEmpty();
    }

    @Test
    void derivedInputsAreNarrowedToRequestedStream() {
        when(planSource.getLogicalPlan("local", "default", "WordCount"))
                .thenReturn(TopologyFixtures.wordCountLogicalPlan());
        Map<String, Object> options = options("count", null);
        options.put("stream", "default");

        List<InstanceTimeSeries> series = metricsClient(tracker).getExecuteCounts("WordCount", START, END, options);

        assertThat(tracker.requestCount()).isEqualTo(1);
        assertThat(tracker.lastRequest().getQuery()).contains("metricname=__execute-count/word/default");
        assertThat(series).extracting(InstanceTimeSeries::getSource).containsOnly("word");
    }

    @Test
    void spoutHasNoExecuteMetrics() {
        when(planSource.getLogicalPlan("local", "default", "WordCount"))
                .thenReturn(TopologyFixtures.wordCountLogicalPlan());

        assertThatThrownBy(() -> metricsClient(tracker)
                .getServiceTimes("WordCount", START, END, options("word", null)))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("not a bolt");
        assertThat(tracker.requestCount()).isZero();
    }

    @Test
    void rejectsWindowEndingBeforeStart() {
        assertThatThrownBy(() -> metricsClient(tracker).getEmitCounts("WordCount", END, START, options("count", null)))
                .isInstanceOf(IllegalArgumentException.class);
        assertThat(tracker.requestCount()).isZero();
    }

    @Test
    void requiresComponentOption() {
        Map<String, Object> options = options("count", "word");
        options.remove("component");

        assertThatThrownBy(() -> metricsClient(tracker).getServiceTimes("WordCount", START, END, options))
                .isInstanceOf(IllegalArgumentException.class)
                .hasMessageContaining("component");
    }

    @Test
    void trackerFailureSurfacesAsFetchFailure() {
        TrackerStub failing = TrackerStub.respondingWith(HttpStatus.OK, TrackerStub.resource("error.json"));

        assertThatThrownBy(() -> metricsClient(failing).getExecuteCounts("ghost", START, END, options("count", "word")))
                .isInstanceOf(PlanFetchException.class);
    }

    @Test
    void nullPointValueIsMalformedTimeline() {
        TrackerStub malformed = TrackerStub.respondingWith(HttpStatus.OK, "{\"status\": \"success\", \"result\": "
                + "{\"timeline\": {\"__execute-count/word/default\": {\"container_1_count_3\": {\"1700000000\": null}}}}}");

        assertThatThrownBy(() -> metricsClient(malformed).getExecuteCounts("WordCount", START, END,
                options("count", "word")))
                .isInstanceOf(PlanFetchException.class)
                .hasMessageContaining("Malformed metrics timeline")
                .hasCauseInstanceOf(NumberFormatException.class)
                .satisfies(e -> assertThat(((PlanFetchException) e).isNotFound()).isFalse());
    }

    @Test
    void nonNumericTimestampIsMalformedTimeline() {
        TrackerStub malformed = TrackerStub.respondingWith(HttpStatus.OK, "{\"status\": \"success\", \"result\": "
                + "{\"timeline\": {\"__emit-count/default\": {\"container_1_count_3\": {\"yesterday\": \"4\"}}}}}");

        assertThatThrownBy(() -> metricsClient(malformed).getEmitCounts("WordCount", START, END,
                options("count", null)))
                .isInstanceOf(PlanFetchException.class)
                .hasMessageContaining("yesterday");
    }

    private static Map<String, Object> options(String component, String source) {
        Map<String, Object> options = new HashMap<>();
        options.put("cluster", "local");
        options.put("environ", "default");
        options.put("component", component);
        if (source != null) {
            options.put("source", source);
        }
        return options;
    }
}
