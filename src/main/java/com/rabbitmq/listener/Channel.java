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

import java.io.IOException;

/**
 * The subset of an AMQP 0-9-1 channel a {@link BlockingConsumer} uses.
 *
 * <p>Protocol operations throw an {@link IOException} when the broker refuses them, its cause is
 * then usually a {@link ShutdownSignalException} with the reply code of the broker.
 */
public interface Channel {

  /**
   * Request a specific quality of service.
   *
   * @param prefetchSize maximum amount of content (in bytes) the broker delivers, 0 for unlimited
   * @param prefetchCount maximum number of unacknowledged messages the broker delivers, 0 for
   *     unlimited
   * @param global true to apply the settings to the whole channel
   * @throws IOException if the broker refuses the request
   */
  void basicQos(int prefetchSize, int prefetchCount, boolean global) throws IOException;

  /**
   * Check a queue exists without creating it.
   *
   * @param queue the name of the queue
   * @throws IOException if the queue does not exist or cannot be accessed
   */
  void queueDeclarePassive(String queue) throws IOException;

  /**
   * Start a consumer.
   *
   * @param queue the name of the queue
   * @param autoAck true if the broker should consider messages acknowledged once delivered
   * @param callback the consumer callback
   * @return the consumer tag generated by the broker
   * @throws IOException if the broker refuses the request
   */
  String basicConsume(String queue, boolean autoAck, BasicConsumer callback) throws IOException;

  /**
   * Cancel a consumer.
   *
   * <p>The broker confirms with {@link BasicConsumer#handleCancelOk(String)}.
   *
   * @param consumerTag the consumer tag
   * @throws IOException if the broker refuses the request
   */
  void basicCancel(String consumerTag) throws IOException;

  /**
   * Acknowledge one or several messages.
   *
   * @param deliveryTag the delivery tag
   * @param multiple true to acknowledge all messages up to and including the delivery tag
   * @throws IOException if the broker refuses the request
   */
  void basicAck(long deliveryTag, boolean multiple) throws IOException;

  /**
   * Reject a message.
   *
   * @param deliveryTag the delivery tag
   * @param requeue true to requeue the message, false to discard or dead-letter it
   * @throws IOException if the broker refuses the request
   */
  void basicReject(long deliveryTag, boolean requeue) throws IOException;

  /**
   * Commit the current transaction of a transactional channel.
   *
   * @throws IOException if the broker refuses the request
   */
  void txCommit() throws IOException;

  /**
   * Roll back the current transaction of a transactional channel.
   *
   * @throws IOException if the broker refuses the request
   */
  void txRollback() throws IOException;

  boolean isOpen();

  /** Close the channel, must not throw. */
  void close();
}
