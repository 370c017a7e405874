// Copyright (c) 2025 Broadcom. All Rights Reserved.
// The term "Broadcom" refers to Broadcom Inc. and/or its subsidiaries.
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License.
//
// If you have any questions regarding licensing, please contact us at
// info@rabbitmq.com.
package com.rabbitmq.listener;

import com.rabbitmq.listener.metrics.MetricsCollector;
import java.time.Duration;

/** API to configure and create a {@link BlockingConsumer}. */
public interface BlockingConsumerBuilder {

  /**
   * The queues to consume from.
   *
   * @param queues queues
   * @return this builder instance
   */
  BlockingConsumerBuilder queues(String... queues);

  /**
   * The acknowledgment mode.
   *
   * <p>The default is {@link AcknowledgeMode#AUTO}.
   *
   * @param acknowledgeMode acknowledgment mode
   * @return this builder instance
   */
  BlockingConsumerBuilder acknowledgeMode(AcknowledgeMode acknowledgeMode);

  /**
   * Whether the channel of the consumer is transactional.
   *
   * <p>The default is false.
   *
   * @param transactional transactional flag
   * @return this builder instance
   */
  BlockingConsumerBuilder transactional(boolean transactional);

  /**
   * The maximum number of unacknowledged messages the broker sends to the consumer.
   *
   * <p>Ignored with {@link AcknowledgeMode#NONE}. The default is 1.
   *
   * @param prefetchCount prefetch count
   * @return this builder instance
   */
  BlockingConsumerBuilder prefetchCount(int prefetchCount);

  /**
   * Whether rejected messages are requeued by default.
   *
   * <p>A {@link AmqpException.AmqpRejectAndDontRequeueException} always prevents requeueing. The
   * default is true.
   *
   * @param defaultRequeueRejected requeue flag
   * @return this builder instance
   */
  BlockingConsumerBuilder defaultRequeueRejected(boolean defaultRequeueRejected);

  /**
   * The counter the consumer registers in while it is active.
   *
   * <p>A listener container shares one counter between its consumers to wait for them to stop.
   *
   * @param activeObjectCounter counter
   * @return this builder instance
   */
  BlockingConsumerBuilder activeObjectCounter(
      ActiveObjectCounter<BlockingConsumer> activeObjectCounter);

  /**
   * The converter to create message properties.
   *
   * @param converter converter
   * @return this builder instance
   */
  BlockingConsumerBuilder messagePropertiesConverter(MessagePropertiesConverter converter);

  /**
   * The synchronization point of an external transaction.
   *
   * <p>Required only for transactional consumers with {@link AcknowledgeMode#AUTO} that are not
   * locally transacted.
   *
   * @param transactionSynchronization transaction synchronization
   * @return this builder instance
   */
  BlockingConsumerBuilder transactionSynchronization(
      TransactionSynchronization transactionSynchronization);

  /**
   * Collector for consumption metrics.
   *
   * @param metricsCollector metrics collector
   * @return this builder instance
   */
  BlockingConsumerBuilder metricsCollector(MetricsCollector metricsCollector);

  /**
   * Period at which {@link BlockingConsumer#nextMessage()} checks for a channel shutdown while
   * waiting.
   *
   * <p>The default is 1 second.
   *
   * @param interval check interval
   * @return this builder instance
   */
  BlockingConsumerBuilder shutdownCheckInterval(Duration interval);

  /**
   * Add {@link Resource.StateListener}s to the consumer.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  BlockingConsumerBuilder listeners(Resource.StateListener... listeners);

  /**
   * Build the consumer.
   *
   * <p>The consumer does not use the connection factory until it is started.
   *
   * @return the configured consumer instance
   */
  BlockingConsumer build();
}
