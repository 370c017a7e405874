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

/** Delivery metadata sent by the broker along with a message. */
public final class Envelope {

  private final long deliveryTag;
  private final boolean redelivered;
  private final String exchange;
  private final String routingKey;
  private final int messageCount;

  public Envelope(long deliveryTag, boolean redelivered, String exchange, String routingKey) {
    this(deliveryTag, redelivered, exchange, routingKey, 0);
  }

  public Envelope(
      long deliveryTag,
      boolean redelivered,
      String exchange,
      String routingKey,
      int messageCount) {
    this.deliveryTag = deliveryTag;
    this.redelivered = redelivered;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.messageCount = messageCount;
  }

  /**
   * The delivery tag, an unsigned 64-bit number issued by the broker for the channel.
   *
   * <p>Use {@link Long#toUnsignedString(long)} and {@link Long#compareUnsigned(long, long)} to
   * display and compare it.
   *
   * @return delivery tag
   */
  public long deliveryTag() {
    return this.deliveryTag;
  }

  public boolean isRedelivered() {
    return this.redelivered;
  }

  public String exchange() {
    return this.exchange;
  }

  public String routingKey() {
    return this.routingKey;
  }

  /**
   * Number of messages remaining in the queue, 0 for pushed deliveries.
   *
   * @return message count
   */
  public int messageCount() {
    return this.messageCount;
  }

  @Override
  public String toString() {
    return "Envelope{"
        + "deliveryTag="
        + Long.toUnsignedString(this.deliveryTag)
        + ", redelivered="
        + this.redelivered
        + ", exchange='"
        + this.exchange
        + '\''
        + ", routingKey='"
        + this.routingKey
        + '\''
        + '}';
  }
}
