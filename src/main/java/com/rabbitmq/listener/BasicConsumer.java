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

/**
 * Callback contract of an AMQP consumer.
 *
 * <p>Methods are called on the connection thread and must not block.
 */
public interface BasicConsumer {

  /**
   * The broker registered the consumer.
   *
   * @param consumerTag the consumer tag
   */
  void handleConsumeOk(String consumerTag);

  /**
   * The broker confirmed the cancellation requested with {@link Channel#basicCancel(String)}.
   *
   * @param consumerTag the consumer tag
   */
  void handleCancelOk(String consumerTag);

  /**
   * The broker cancelled the consumer for another reason than {@link
   * Channel#basicCancel(String)}, e.g. the queue has been deleted.
   *
   * @param consumerTag the consumer tag
   */
  void handleCancel(String consumerTag);

  /**
   * The channel or the connection has been shut down.
   *
   * @param consumerTag the consumer tag
   * @param signal the shutdown cause
   */
  void handleShutdownSignal(String consumerTag, ShutdownSignalException signal);

  /**
   * The broker acknowledged a <code>basic.recover</code>.
   *
   * @param consumerTag the consumer tag
   */
  void handleRecoverOk(String consumerTag);

  /**
   * A message has been delivered.
   *
   * @param consumerTag the consumer tag
   * @param envelope the delivery metadata
   * @param properties the content header
   * @param body the message body
   */
  void handleDelivery(
      String consumerTag, Envelope envelope, BasicProperties properties, byte[] body);
}
