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

import java.time.Duration;
import java.util.List;

/**
 * Consumer that buffers the deliveries of the broker and lets worker threads pull them.
 *
 * <p>A listener container drives the consumer: it starts it, retrieves messages with {@link
 * #nextMessage()} or {@link #nextMessage(Duration)}, hands them to the application, then calls
 * {@link #commitIfNecessary(boolean)} on success or {@link
 * #rollbackOnExceptionIfNecessary(Channel, Message, Throwable)} on failure. Commit and rollback
 * must not be called concurrently on the same instance.
 *
 * <p>Instances are configured and created with a {@link BlockingConsumerBuilder}. They cannot be
 * restarted once stopped.
 *
 * @see BlockingConsumerBuilder
 */
public interface BlockingConsumer extends Resource {

  /**
   * Open the channel, check the queues and register the consumer on the broker.
   *
   * @throws AmqpException.AmqpSetupException if a queue does not exist or cannot be accessed
   * @throws AmqpException if the channel cannot be opened or the consumer cannot be registered
   */
  void start();

  /**
   * Cancel the consumer and close its channel.
   *
   * <p>The consumer is released from its {@link ActiveObjectCounter} once the broker confirms the
   * cancellation. Calling this method several times is safe.
   *
   * <p>When called while {@link #start()} is in progress, the starting thread does the teardown
   * before returning. The {@link Resource.Context#failureCause()} of the {@link
   * Resource.State#STOPPED} event is the broker shutdown signal, if one was received.
   */
  void stop();

  /**
   * Wait for the next delivery and return it.
   *
   * @return the next message
   * @throws AmqpException.AmqpShutdownException if the channel has been shut down
   */
  Message nextMessage();

  /**
   * Wait at most the given duration for the next delivery.
   *
   * @param timeout maximum time to wait
   * @return the next message, or null if none arrived in time
   * @throws AmqpException.AmqpShutdownException if the channel has been shut down
   */
  Message nextMessage(Duration timeout);

  /**
   * Acknowledge or commit the messages received since the last transaction boundary.
   *
   * @param locallyTransacted whether the channel transaction is driven by the consumer caller
   * @return true if there were messages to commit
   */
  boolean commitIfNecessary(boolean locallyTransacted);

  /**
   * Roll back the channel transaction and reject the messages received since the last
   * transaction boundary, as appropriate for the acknowledgment mode.
   *
   * <p>Messages are requeued, unless the cause is a {@link
   * AmqpException.AmqpRejectAndDontRequeueException}. If the rollback fails, the failure is
   * logged and the application exception is rethrown.
   *
   * @param channel the channel to roll back
   * @param message the message being processed, can be null
   * @param cause the application exception
   */
  void rollbackOnExceptionIfNecessary(Channel channel, Message message, Throwable cause);

  /**
   * The channel of the consumer, null before start.
   *
   * @return the channel
   */
  Channel channel();

  /**
   * The consumer tag assigned by the broker for the first queue, null before start.
   *
   * @return the consumer tag
   */
  String consumerTag();

  /**
   * The consumer tags of the queues the consumer is still registered on.
   *
   * @return consumer tags
   */
  List<String> consumerTags();

  List<String> queues();

  AcknowledgeMode acknowledgeMode();

  boolean isTransactional();

  /**
   * Whether the consumer stopped accepting deliveries, after {@link #stop()} or a cancellation by
   * the broker.
   *
   * @return true if cancelled
   */
  boolean isCancelled();

  /**
   * The shutdown cause of the channel, null while it is running.
   *
   * @return the shutdown signal
   */
  ShutdownSignalException shutdownSignal();

  /**
   * Number of messages buffered and not retrieved yet.
   *
   * @return buffered message count
   */
  int queuedMessageCount();
}
