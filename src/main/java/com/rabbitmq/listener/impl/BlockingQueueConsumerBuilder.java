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
package com.rabbitmq.listener.impl;

import static com.rabbitmq.listener.impl.Assert.notNull;

import com.rabbitmq.listener.AcknowledgeMode;
import com.rabbitmq.listener.ActiveObjectCounter;
import com.rabbitmq.listener.AmqpException;
import com.rabbitmq.listener.BlockingConsumer;
import com.rabbitmq.listener.BlockingConsumerBuilder;
import com.rabbitmq.listener.ConnectionFactory;
import com.rabbitmq.listener.MessagePropertiesConverter;
import com.rabbitmq.listener.Resource;
import com.rabbitmq.listener.TransactionSynchronization;
import com.rabbitmq.listener.metrics.MetricsCollector;
import com.rabbitmq.listener.metrics.NoOpMetricsCollector;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

/**
 * Default {@link BlockingConsumerBuilder}.
 *
 * <p>Example:
 *
 * <pre>{@code
 * BlockingConsumer consumer =
 *     new BlockingQueueConsumerBuilder(connectionFactory)
 *         .queues("orders")
 *         .acknowledgeMode(AcknowledgeMode.AUTO)
 *         .prefetchCount(10)
 *         .activeObjectCounter(counter)
 *         .build();
 * }</pre>
 */
public class BlockingQueueConsumerBuilder implements BlockingConsumerBuilder {

  static final TransactionSynchronization NO_TRANSACTION_SYNCHRONIZATION =
      (channel, deliveryTag) -> {
        throw new AmqpException(
            "No transaction synchronization configured to register delivery tag %s",
            Long.toUnsignedString(deliveryTag));
      };

  private final ConnectionFactory connectionFactory;
  private final List<String> queues = new ArrayList<>();
  private AcknowledgeMode acknowledgeMode = AcknowledgeMode.AUTO;
  private boolean transactional = false;
  private int prefetchCount = 1;
  private boolean defaultRequeueRejected = true;
  private ActiveObjectCounter<BlockingConsumer> activeObjectCounter = new ActiveObjectCounter<>();
  private MessagePropertiesConverter messagePropertiesConverter =
      new DefaultMessagePropertiesConverter();
  private TransactionSynchronization transactionSynchronization = NO_TRANSACTION_SYNCHRONIZATION;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private Duration shutdownCheckInterval = Duration.ofSeconds(1);
  private final List<Resource.StateListener> listeners = new ArrayList<>();

  public BlockingQueueConsumerBuilder(ConnectionFactory connectionFactory) {
    this.connectionFactory = notNull(connectionFactory, "Connection factory cannot be null");
  }

  @Override
  public BlockingConsumerBuilder queues(String... queues) {
    this.queues.clear();
    if (queues != null) {
      for (String queue : queues) {
        this.queues.add(Assert.notBlank(queue, "Queue name cannot be null or blank"));
      }
    }
    return this;
  }

  @Override
  public BlockingConsumerBuilder acknowledgeMode(AcknowledgeMode acknowledgeMode) {
    this.acknowledgeMode = notNull(acknowledgeMode, "Acknowledge mode cannot be null");
    return this;
  }

  @Override
  public BlockingConsumerBuilder transactional(boolean transactional) {
    this.transactional = transactional;
    return this;
  }

  @Override
  public BlockingConsumerBuilder prefetchCount(int prefetchCount) {
    this.prefetchCount = Assert.positive(prefetchCount, "Prefetch count must be greater than 0");
    return this;
  }

  @Override
  public BlockingConsumerBuilder defaultRequeueRejected(boolean defaultRequeueRejected) {
    this.defaultRequeueRejected = defaultRequeueRejected;
    return this;
  }

  @Override
  public BlockingConsumerBuilder activeObjectCounter(
      ActiveObjectCounter<BlockingConsumer> activeObjectCounter) {
    this.activeObjectCounter = notNull(activeObjectCounter, "Active object counter cannot be null");
    return this;
  }

  @Override
  public BlockingConsumerBuilder messagePropertiesConverter(
      MessagePropertiesConverter converter) {
    this.messagePropertiesConverter =
        notNull(converter, "Message properties converter cannot be null");
    return this;
  }

  @Override
  public BlockingConsumerBuilder transactionSynchronization(
      TransactionSynchronization transactionSynchronization) {
    this.transactionSynchronization =
        transactionSynchronization == null
            ? NO_TRANSACTION_SYNCHRONIZATION
            : transactionSynchronization;
    return this;
  }

  @Override
  public BlockingConsumerBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public BlockingConsumerBuilder shutdownCheckInterval(Duration interval) {
    notNull(interval, "Shutdown check interval cannot be null");
    if (interval.isNegative() || interval.isZero()) {
      throw new IllegalArgumentException("Shutdown check interval must be positive");
    }
    this.shutdownCheckInterval = interval;
    return this;
  }

  @Override
  public BlockingConsumerBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public BlockingConsumer build() {
    if (this.queues.isEmpty()) {
      throw new IllegalArgumentException("At least one queue must be specified");
    }
    return new BlockingQueueConsumer(this);
  }

  ConnectionFactory connectionFactory() {
    return this.connectionFactory;
  }

  List<String> queues() {
    return this.queues;
  }

  AcknowledgeMode acknowledgeMode() {
    return this.acknowledgeMode;
  }

  boolean transactional() {
    return this.transactional;
  }

  int prefetchCount() {
    return this.prefetchCount;
  }

  boolean defaultRequeueRejected() {
    return this.defaultRequeueRejected;
  }

  ActiveObjectCounter<BlockingConsumer> activeObjectCounter() {
    return this.activeObjectCounter;
  }

  MessagePropertiesConverter messagePropertiesConverter() {
    return this.messagePropertiesConverter;
  }

  TransactionSynchronization transactionSynchronization() {
    return this.transactionSynchronization;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  Duration shutdownCheckInterval() {
    return this.shutdownCheckInterval;
  }

  List<Resource.StateListener> stateListeners() {
    return this.listeners;
  }
}
