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

import static org.assertj.core.api.Assertions.fail;

import com.rabbitmq.listener.Message;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import org.assertj.core.api.AbstractObjectAssert;

final class Assertions {

  private Assertions() {}

  static SyncAssert assertThat(TestUtils.Sync sync) {
    return new SyncAssert(sync);
  }

  static MessageAssert assertThat(Message message) {
    return new MessageAssert(message);
  }

  static class SyncAssert extends AbstractObjectAssert<SyncAssert, TestUtils.Sync> {

    private SyncAssert(TestUtils.Sync sync) {
      super(sync, SyncAssert.class);
    }

    SyncAssert completes() {
      return this.completes(TestUtils.DEFAULT_CONDITION_TIMEOUT);
    }

    SyncAssert completes(Duration timeout) {
      boolean completed = actual.await(timeout);
      if (!completed) {
        fail("Sync timed out after %d ms", timeout.toMillis());
      }
      return this;
    }

    SyncAssert hasNotCompleted() {
      if (actual.hasCompleted()) {
        fail("Sync should not have completed");
      }
      return this;
    }
  }

  static class MessageAssert extends AbstractObjectAssert<MessageAssert, Message> {

    private MessageAssert(Message message) {
      super(message, MessageAssert.class);
    }

    MessageAssert hasBody(String body) {
      isNotNull();
      String actualBody = new String(actual.body(), StandardCharsets.UTF_8);
      if (!actualBody.equals(body)) {
        fail("Message body should be '%s' but is '%s'", body, actualBody);
      }
      return this;
    }

    MessageAssert hasDeliveryTag(long deliveryTag) {
      isNotNull();
      if (actual.properties().deliveryTag() != deliveryTag) {
        fail(
            "Delivery tag should be %s but is %s",
            Long.toUnsignedString(deliveryTag),
            Long.toUnsignedString(actual.properties().deliveryTag()));
      }
      return this;
    }

    MessageAssert hasConsumerQueue(String queue) {
      isNotNull();
      if (!queue.equals(actual.properties().consumerQueue())) {
        fail(
            "Consumer queue should be '%s' but is '%s'",
            queue, actual.properties().consumerQueue());
      }
      return this;
    }
  }
}
