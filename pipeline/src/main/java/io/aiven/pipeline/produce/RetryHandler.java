/*
 * Inkless
 * Copyright (C) 2024 - 2025 Aiven OY
 *
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Affero General Public License as published by
 * the Free Software Foundation, either version 3 of the License, or
 * (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU Affero General Public License for more details.
 *
 * You should have received a copy of the GNU Affero General Public License
 * along with this program.  If not, see <http://www.gnu.org/licenses/>.
 */
package io.aiven.pipeline.produce;

import org.apache.kafka.common.TopicPartition;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Collectors;

/**
 * Tracks the publish statistics of one batch across retry rounds and decides which
 * requests have to be sent again, according to the {@link PublishGuarantee}.
 *
 * <p>A handler is scoped to a single batch and is not thread-safe.
 */
public class RetryHandler {
    private static final Logger LOGGER = LoggerFactory.getLogger(RetryHandler.class);

    private final List<PublishRequest> initialRequests;
    private final PublishGuarantee guarantee;
    private final PublishOutcomeClassifier classifier;
    private final WatermarkReconciler reconciler;

    private List<PublishRequest> requestsToBeSent;
    private Map<TopicPartition, Stats> successStatsThisRound = new HashMap<>();
    private final Map<TopicPartition, Stats> successStatsCumulative = new HashMap<>();

    private int hiddenSuccessesLastRound;
    private int droppedLastRound;

    public RetryHandler(final List<PublishRequest> requests,
                        final PublishGuarantee guarantee,
                        final WatermarkReconciler reconciler) {
        this(requests, guarantee, new PublishOutcomeClassifier(), reconciler);
    }

    // Visible for testing
    RetryHandler(final List<PublishRequest> requests,
                 final PublishGuarantee guarantee,
                 final PublishOutcomeClassifier classifier,
                 final WatermarkReconciler reconciler) {
        this.initialRequests = List.copyOf(Objects.requireNonNull(requests, "requests cannot be null"));
        this.guarantee = Objects.requireNonNull(guarantee, "guarantee cannot be null");
        this.classifier = Objects.requireNonNull(classifier, "classifier cannot be null");
        if (guarantee == PublishGuarantee.EXACTLY_ONCE) {
            Objects.requireNonNull(reconciler, "reconciler cannot be null with exactly-once guarantee");
        }
        this.reconciler = reconciler;
        this.requestsToBeSent = initialRequests;
    }

    /**
     * Update the stats from the responses to {@link #requestsToBeSent()} and replace it
     * with the requests to send in the next round.
     *
     * @param responses responses of the current round, possibly fewer than the requests
     * @param trackedOffsets offset of each topic at the start of the round, required for exactly-once
     */
    public void updateUnpublishedRequests(final List<PublishResponse> responses, final Map<String, Long> trackedOffsets) {
        successStatsThisRound = new HashMap<>();
        hiddenSuccessesLastRound = 0;
        droppedLastRound = 0;

        List<PublishRequest> requestsToRetry = updateSuccessRequestsStats(requestsToBeSent, responses);
        if (guarantee == PublishGuarantee.EXACTLY_ONCE && !requestsToRetry.isEmpty()) {
            requestsToRetry = verifyFailedRequests(
                requestsToRetry,
                trackedOffsets == null ? Map.of() : trackedOffsets
            );
        }
        LOGGER.debug("{} of {} requests to be retried", requestsToRetry.size(), requestsToBeSent.size());
        requestsToBeSent = Collections.unmodifiableList(requestsToRetry);
    }

    /**
     * Record the stats of the requests with a success response and return the disputed ones.
     */
    private List<PublishRequest> updateSuccessRequestsStats(final List<PublishRequest> requests,
                                                            final List<PublishResponse> responses) {
        final Map<TopicPartition, PublishOutcome.Success> successes = classifier.successesByPartition(responses);

        final List<PublishRequest> disputed = new ArrayList<>();
        for (final PublishRequest request : requests) {
            final PublishOutcome.Success success = successes.get(request.topicPartition());
            if (success == null) {
                disputed.add(request);
                continue;
            }
            recordSuccess(request.topicPartition(), new Stats(success.offset(), request.messageCount()));
        }
        return disputed;
    }

    private List<PublishRequest> verifyFailedRequests(final List<PublishRequest> requests,
                                                      final Map<String, Long> trackedOffsets) {
        final List<PublishRequest> requestsToRetry = new ArrayList<>();
        for (final PublishRequest request : requests) {
            final ReconciliationResult result = reconciler.reconcile(request, trackedOffsets);
            if (result instanceof ReconciliationResult.Published published) {
                hiddenSuccessesLastRound++;
                recordSuccess(request.topicPartition(), published.stats());
            } else if (result instanceof ReconciliationResult.Retry) {
                requestsToRetry.add(request);
            } else {
                droppedLastRound++;
            }
        }
        return requestsToRetry;
    }

    private void recordSuccess(final TopicPartition topicPartition, final Stats stats) {
        successStatsThisRound.merge(topicPartition, stats, Stats::add);
        successStatsCumulative.merge(topicPartition, stats, Stats::add);
    }

    public List<PublishRequest> initialRequests() {
        return initialRequests;
    }

    public List<PublishRequest> requestsToBeSent() {
        return requestsToBeSent;
    }

    public PublishGuarantee guarantee() {
        return guarantee;
    }

    public Map<TopicPartition, Stats> successStatsThisRound() {
        return Collections.unmodifiableMap(successStatsThisRound);
    }

    public Map<TopicPartition, Stats> successStatsCumulative() {
        return Collections.unmodifiableMap(successStatsCumulative);
    }

    public long totalPublishedMessageCount() {
        return successStatsCumulative.values().stream()
            .mapToLong(Stats::messageCount)
            .sum();
    }

    /**
     * Whether some topic-partition of the initial requests has no recorded success.
     *
     * <p>This does not check every request individually. The retry loop must be bounded
     * by the caller as unresolvable requests keep this true forever.
     */
    public boolean hasUnpublishedRequest() {
        final Set<TopicPartition> requested = initialRequests.stream()
            .map(PublishRequest::topicPartition)
            .collect(Collectors.toSet());
        return !successStatsCumulative.keySet().containsAll(requested);
    }

    int hiddenSuccessesLastRound() {
        return hiddenSuccessesLastRound;
    }

    int droppedLastRound() {
        return droppedLastRound;
    }
}
