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
package io.aiven.pipeline.config;

import org.apache.kafka.common.config.AbstractConfig;
import org.apache.kafka.common.config.ConfigDef;

import java.time.Duration;
import java.util.Locale;
import java.util.Map;

import io.aiven.pipeline.produce.PublishGuarantee;
import io.aiven.pipeline.produce.UnverifiedRequestPolicy;

public class PipelineClientConfig extends AbstractConfig {
    public static final String PUBLISH_GUARANTEE_CONFIG = "producer.publish.guarantee";
    private static final String PUBLISH_GUARANTEE_DOC = "Delivery guarantee of the producer. "
        + "With exactly_once, requests without a success response are verified against the broker watermarks before being retried.";

    public static final String UNVERIFIED_REQUEST_POLICY_CONFIG = "producer.unverified.request.policy";
    private static final String UNVERIFIED_REQUEST_POLICY_DOC = "What to do with a request whose outcome cannot be verified "
        + "because the watermark query failed. drop may lose messages, retry may duplicate them.";

    public static final String MAX_PUBLISH_ROUNDS_CONFIG = "producer.max.publish.rounds";
    private static final String MAX_PUBLISH_ROUNDS_DOC = "The maximum number of publish rounds for a batch, including the first one.";

    public static final String PUBLISH_RETRY_BACKOFF_MS_CONFIG = "producer.publish.retry.backoff.ms";
    private static final String PUBLISH_RETRY_BACKOFF_MS_DOC = "The time to wait between publish rounds.";

    public static final String AUTO_OFFSET_RESET_CONFIG = "consumer.auto.offset.reset";
    private static final String AUTO_OFFSET_RESET_DOC = "Where to start consuming a partition without committed offset: "
        + "earliest or latest.";

    public static final String PARTITIONER_COOLDOWN_MS_CONFIG = "consumer.partitioner.cooldown.ms";
    private static final String PARTITIONER_COOLDOWN_MS_DOC = "The time the consumer group waits for members to settle "
        + "before partitions are assigned.";

    public static final String GET_MESSAGES_TIMEOUT_MS_CONFIG = "consumer.get.messages.timeout.ms";
    private static final String GET_MESSAGES_TIMEOUT_MS_DOC = "The default time to block waiting for messages.";

    public static ConfigDef configDef() {
        return new ConfigDef()
            .define(
                PUBLISH_GUARANTEE_CONFIG,
                ConfigDef.Type.STRING,
                PublishGuarantee.EXACTLY_ONCE.configValue,
                ConfigDef.CaseInsensitiveValidString.in(
                    PublishGuarantee.EXACTLY_ONCE.configValue,
                    PublishGuarantee.AT_LEAST_ONCE.configValue),
                ConfigDef.Importance.HIGH,
                PUBLISH_GUARANTEE_DOC
            )
            .define(
                UNVERIFIED_REQUEST_POLICY_CONFIG,
                ConfigDef.Type.STRING,
                UnverifiedRequestPolicy.DROP.configValue,
                ConfigDef.CaseInsensitiveValidString.in(
                    UnverifiedRequestPolicy.DROP.configValue,
                    UnverifiedRequestPolicy.RETRY.configValue),
                ConfigDef.Importance.MEDIUM,
                UNVERIFIED_REQUEST_POLICY_DOC
            )
            .define(
                MAX_PUBLISH_ROUNDS_CONFIG,
                ConfigDef.Type.INT,
                5,
                ConfigDef.Range.atLeast(1),
                ConfigDef.Importance.MEDIUM,
                MAX_PUBLISH_ROUNDS_DOC
            )
            .define(
                PUBLISH_RETRY_BACKOFF_MS_CONFIG,
                ConfigDef.Type.LONG,
                100L,
                ConfigDef.Range.atLeast(0),
                ConfigDef.Importance.LOW,
                PUBLISH_RETRY_BACKOFF_MS_DOC
            )
            .define(
                AUTO_OFFSET_RESET_CONFIG,
                ConfigDef.Type.STRING,
                "earliest",
                ConfigDef.CaseInsensitiveValidString.in("earliest", "latest"),
                ConfigDef.Importance.MEDIUM,
                AUTO_OFFSET_RESET_DOC
            )
            .define(
                PARTITIONER_COOLDOWN_MS_CONFIG,
                ConfigDef.Type.LONG,
                500L,
                ConfigDef.Range.atLeast(0),
                ConfigDef.Importance.LOW,
                PARTITIONER_COOLDOWN_MS_DOC
            )
            .define(
                GET_MESSAGES_TIMEOUT_MS_CONFIG,
                ConfigDef.Type.LONG,
                100L,
                ConfigDef.Range.atLeast(0),
                ConfigDef.Importance.LOW,
                GET_MESSAGES_TIMEOUT_MS_DOC
            );
    }

    public PipelineClientConfig(final Map<?, ?> originals) {
        super(configDef(), originals);
    }

    public PublishGuarantee publishGuarantee() {
        return PublishGuarantee.fromConfigValue(getString(PUBLISH_GUARANTEE_CONFIG));
    }

    public UnverifiedRequestPolicy unverifiedRequestPolicy() {
        return UnverifiedRequestPolicy.fromConfigValue(getString(UNVERIFIED_REQUEST_POLICY_CONFIG));
    }

    public int maxPublishRounds() {
        return getInt(MAX_PUBLISH_ROUNDS_CONFIG);
    }

    public Duration publishRetryBackoff() {
        return Duration.ofMillis(getLong(PUBLISH_RETRY_BACKOFF_MS_CONFIG));
    }

    public String autoOffsetReset() {
        return getString(AUTO_OFFSET_RESET_CONFIG).toLowerCase(Locale.ROOT);
    }

    public Duration partitionerCooldown() {
        return Duration.ofMillis(getLong(PARTITIONER_COOLDOWN_MS_CONFIG));
    }

    public Duration getMessagesTimeout() {
        return Duration.ofMillis(getLong(GET_MESSAGES_TIMEOUT_MS_CONFIG));
    }
}
