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
package com.rabbitmq.listener.metrics;

import static org.assertj.core.api.Assertions.assertThat;

import io.micrometer.core.instrument.simple.SimpleMeterRegistry;
import org.junit.jupiter.api.Test;

public class MicrometerMetricsCollectorTest {

  @Test
  void simple() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MetricsCollector collector = new MicrometerMetricsCollector(registry);

    assertThat(registry.get("rabbitmq.amqp.listener.consumers").gauge().value()).isZero();
    collector.openConsumer();
    assertThat(registry.get("rabbitmq.amqp.listener.consumers").gauge().value()).isEqualTo(1);
    collector.openConsumer();
    assertThat(registry.get("rabbitmq.amqp.listener.consumers").gauge().value()).isEqualTo(2);
    collector.closeConsumer();
    assertThat(registry.get("rabbitmq.amqp.listener.consumers").gauge().value()).isEqualTo(1);

    assertThat(registry.get("rabbitmq.amqp.listener.consumed").counter().count()).isZero();
    collector.consume();
    assertThat(registry.get("rabbitmq.amqp.listener.consumed").counter().count()).isEqualTo(1.0);
    collector.consume();
    collector.consume();
    assertThat(registry.get("rabbitmq.amqp.listener.consumed").counter().count()).isEqualTo(3.0);

    assertThat(registry.get("rabbitmq.amqp.listener.consumed_accepted").counter().count())
        .isZero();
    collector.consumeDisposition(MetricsCollector.ConsumeDisposition.ACCEPTED);
    assertThat(registry.get("rabbitmq.amqp.listener.consumed_accepted").counter().count())
        .isEqualTo(1.0);

    assertThat(registry.get("rabbitmq.amqp.listener.consumed_requeued").counter().count())
        .isZero();
    collector.consumeDisposition(MetricsCollector.ConsumeDisposition.REQUEUED);
    assertThat(registry.get("rabbitmq.amqp.listener.consumed_requeued").counter().count())
        .isEqualTo(1.0);

    assertThat(registry.get("rabbitmq.amqp.listener.consumed_discarded").counter().count())
        .isZero();
    collector.consumeDisposition(MetricsCollector.ConsumeDisposition.DISCARDED);
    assertThat(registry.get("rabbitmq.amqp.listener.consumed_discarded").counter().count())
        .isEqualTo(1.0);
  }

  @Test
  void prefixAndTags() {
    SimpleMeterRegistry registry = new SimpleMeterRegistry();
    MetricsCollector collector =
        new MicrometerMetricsCollector(registry, "orders", "container", "main");

    collector.openConsumer();
    collector.consume();

    assertThat(registry.get("orders.consumers").tag("container", "main").gauge().value())
        .isEqualTo(1);
    assertThat(registry.get("orders.consumed").tag("container", "main").counter().count())
        .isEqualTo(1.0);
  }
}
