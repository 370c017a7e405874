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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.Mockito.mock;

import com.rabbitmq.listener.AcknowledgeMode;
import com.rabbitmq.listener.AmqpException;
import com.rabbitmq.listener.BlockingConsumer;
import com.rabbitmq.listener.Channel;
import com.rabbitmq.listener.ConnectionFactory;
import com.rabbitmq.listener.Resource;
import com.rabbitmq.listener.metrics.NoOpMetricsCollector;
import java.time.Duration;
import org.junit.jupiter.api.Test;

public class BlockingQueueConsumerBuilderTest {

  ConnectionFactory connectionFactory = mock(ConnectionFactory.class);
  BlockingQueueConsumerBuilder builder = new BlockingQueueConsumerBuilder(connectionFactory);

  @Test
  void defaults() {
    assertThat(builder.acknowledgeMode()).isEqualTo(AcknowledgeMode.AUTO);
    assertThat(builder.transactional()).isFalse();
    assertThat(builder.prefetchCount()).isEqualTo(1);
    assertThat(builder.defaultRequeueRejected()).isTrue();
    assertThat(builder.activeObjectCounter()).isNotNull();
    assertThat(builder.messagePropertiesConverter())
        .isInstanceOf(DefaultMessagePropertiesConverter.class);
    assertThat(builder.metricsCollector()).isSameAs(NoOpMetricsCollector.INSTANCE);
    assertThat(builder.shutdownCheckInterval()).isEqualTo(Duration.ofSeconds(1));
    assertThat(builder.stateListeners()).isEmpty();
  }

  @Test
  void buildShouldCreateConsumerInCreatedState() {
    BlockingConsumer consumer =
        builder
            .queues("q1", "q2")
            .acknowledgeMode(AcknowledgeMode.MANUAL)
            .transactional(true)
            .prefetchCount(250)
            .build();
    assertThat(consumer.state()).isEqualTo(Resource.State.CREATED);
    assertThat(consumer.queues()).containsExactly("q1", "q2");
    assertThat(consumer.acknowledgeMode()).isEqualTo(AcknowledgeMode.MANUAL);
    assertThat(consumer.isTransactional()).isTrue();
    assertThat(consumer.isCancelled()).isFalse();
    assertThat(consumer.channel()).isNull();
    assertThat(consumer.consumerTag()).isNull();
  }

  @Test
  void buildWithoutQueueShouldFail() {
    assertThatThrownBy(builder::build).isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void invalidValuesShouldBeRejected() {
    assertThatThrownBy(() -> builder.queues("q1", " "))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.prefetchCount(0))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.acknowledgeMode(null))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> builder.shutdownCheckInterval(Duration.ZERO))
        .isInstanceOf(IllegalArgumentException.class);
    assertThatThrownBy(() -> new BlockingQueueConsumerBuilder(null))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void listenersShouldAccumulateAndEmptyCallShouldClear() {
    Resource.StateListener listener = context -> {};
    builder.listeners(listener).listeners(listener);
    assertThat(builder.stateListeners()).hasSize(2);
    builder.listeners();
    assertThat(builder.stateListeners()).isEmpty();
  }

  @Test
  void missingTransactionSynchronizationShouldFailWhenUsed() {
    builder.transactionSynchronization(null);
    assertThatThrownBy(
            () -> builder.transactionSynchronization().registerDeliveryTag(mock(Channel.class), 1))
        .isInstanceOf(AmqpException.class)
        .hasMessageContaining("1");
  }
}
