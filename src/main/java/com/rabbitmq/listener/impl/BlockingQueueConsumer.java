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

import static com.rabbitmq.listener.Resource.State.CREATED;
import static com.rabbitmq.listener.Resource.State.STARTED;
import static com.rabbitmq.listener.Resource.State.STARTING;
import static com.rabbitmq.listener.Resource.State.STOPPED;
import static com.rabbitmq.listener.Resource.State.STOPPING;
import static com.rabbitmq.listener.metrics.MetricsCollector.ConsumeDisposition.ACCEPTED;
import static com.rabbitmq.listener.metrics.MetricsCollector.ConsumeDisposition.DISCARDED;
import static com.rabbitmq.listener.metrics.MetricsCollector.ConsumeDisposition.REQUEUED;
import static java.util.concurrent.TimeUnit.MILLISECONDS;

import com.rabbitmq.listener.AcknowledgeMode;
import com.rabbitmq.listener.ActiveObjectCounter;
import com.rabbitmq.listener.AmqpException;
import com.rabbitmq.listener.BasicConsumer;
import com.rabbitmq.listener.BasicProperties;
import com.rabbitmq.listener.BlockingConsumer;
import com.rabbitmq.listener.Channel;
import com.rabbitmq.listener.ConnectionFactory;
import com.rabbitmq.listener.Envelope;
import com.rabbitmq.listener.Message;
import com.rabbitmq.listener.MessageProperties;
import com.rabbitmq.listener.MessagePropertiesConverter;
import com.rabbitmq.listener.ShutdownSignalException;
import com.rabbitmq.listener.TransactionSynchronization;
import com.rabbitmq.listener.metrics.MetricsCollector;
import java.io.IOException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * {@link BlockingConsumer} buffering deliveries in an unbounded queue.
 *
 * <p>The broker callbacks run on the connection thread and only append to the queue, worker
 * threads pull from it. The delivery tags of the messages handed to the application are recorded
 * until the next commit or rollback.
 */
final class BlockingQueueConsumer extends ResourceBase implements BlockingConsumer {

  private static final Logger LOGGER = LoggerFactory.getLogger(BlockingQueueConsumer.class);

  static final String CHARSET = "UTF-8";

  // must be unbounded, a bounded queue could block the connection thread
  private final BlockingQueue<Delivery> queue = new LinkedBlockingQueue<>();
  private final AtomicReference<ShutdownSignalException> shutdown = new AtomicReference<>();
  private final List<String> queues;
  private final int prefetchCount;
  private final boolean transactional;
  private final boolean defaultRequeueRejected;
  private final AcknowledgeMode acknowledgeMode;
  private final ConnectionFactory connectionFactory;
  private final MessagePropertiesConverter messagePropertiesConverter;
  private final TransactionSynchronization transactionSynchronization;
  private final ActiveObjectCounter<BlockingConsumer> activeObjectCounter;
  private final MetricsCollector metricsCollector;
  private final Duration shutdownCheckInterval;
  private final AtomicBoolean cancelled = new AtomicBoolean(false);
  private final AtomicBoolean stopRequested = new AtomicBoolean(false);
  // consumer tag -> queue
  private final Map<String, String> consumerTags = new ConcurrentHashMap<>();
  // guarded by itself
  private final List<Long> deliveryTags = new ArrayList<>();
  private volatile Channel channel;
  private volatile String consumerTag;

  BlockingQueueConsumer(BlockingQueueConsumerBuilder builder) {
    super(builder.stateListeners());
    this.connectionFactory = builder.connectionFactory();
    this.queues = List.copyOf(builder.queues());
    this.acknowledgeMode = builder.acknowledgeMode();
    this.transactional = builder.transactional();
    this.prefetchCount = builder.prefetchCount();
    this.defaultRequeueRejected = builder.defaultRequeueRejected();
    this.activeObjectCounter = builder.activeObjectCounter();
    this.messagePropertiesConverter = builder.messagePropertiesConverter();
    this.transactionSynchronization = builder.transactionSynchronization();
    this.metricsCollector = builder.metricsCollector();
    this.shutdownCheckInterval = builder.shutdownCheckInterval();
  }

  @Override
  public void start() {
    if (!this.compareAndSetState(CREATED, STARTING)) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Consumer cannot be started, current state is %s", this.state().name());
    }
    LOGGER.debug("Starting consumer {}", this);
    try {
      this.channel = this.connectionFactory.createChannel(this.transactional);
    } catch (IOException | RuntimeException e) {
      AmqpException exception = ExceptionUtils.convert(e, "Error while creating channel");
      this.state(STOPPED, exception);
      throw exception;
    }
    if (this.stopRequested.get()) {
      LOGGER.debug("Stop requested while creating channel, not consuming: {}", this);
      ChannelUtils.closeChannel(this.channel);
      this.state(STOPPED);
      return;
    }
    this.clearDeliveryTags();
    this.activeObjectCounter.add(this);
    InternalConsumer callback = new InternalConsumer();
    try {
      if (!this.acknowledgeMode.isAutoAck()) {
        // QoS must be set before consuming, otherwise the broker sends unbounded batches
        this.channel.basicQos(0, this.prefetchCount, false);
      }
      for (String queue : this.queues) {
        this.channel.queueDeclarePassive(queue);
      }
    } catch (IOException | RuntimeException e) {
      this.activeObjectCounter.release(this);
      ChannelUtils.closeChannel(this.channel);
      AmqpException exception =
          new AmqpException.AmqpSetupException(
              "Cannot prepare queue for listener. "
                  + "Either the queue doesn't exist or the broker will not allow us to use it.",
              e);
      this.state(STOPPED, exception);
      throw exception;
    }

    String currentQueue = null;
    try {
      for (String queue : this.queues) {
        currentQueue = queue;
        String tag =
            this.channel.basicConsume(queue, this.acknowledgeMode.isAutoAck(), callback);
        if (tag != null) {
          this.consumerTags.put(tag, queue);
          if (this.consumerTag == null) {
            this.consumerTag = tag;
          }
        }
        LOGGER.debug("Started on queue '{}': {}", queue, this);
      }
    } catch (IOException | RuntimeException e) {
      this.cancelled.set(true);
      this.consumerTags.clear();
      ChannelUtils.closeChannel(this.channel);
      this.activeObjectCounter.release(this);
      AmqpException exception =
          ExceptionUtils.convert(e, "Error while consuming from queue '%s'", currentQueue);
      this.state(STOPPED, exception);
      throw exception;
    }
    this.metricsCollector.openConsumer();
    this.state(STARTED);
    // stop() leaves the teardown to start() if it ran before the consumer was started
    if (this.stopRequested.get() && this.compareAndSetState(STARTED, STOPPING)) {
      LOGGER.debug("Stop requested while starting: {}", this);
      this.doStop();
    }
  }

  @Override
  public void stop() {
    this.cancelled.lazySet(true);
    this.stopRequested.set(true);
    if (this.compareAndSetState(CREATED, STOPPED)) {
      return;
    }
    if (this.compareAndSetState(STARTED, STOPPING)) {
      this.doStop();
    } else {
      LOGGER.debug("Consumer is {}, stop left to start or already done: {}", this.state(), this);
    }
  }

  private void doStop() {
    Channel ch = this.channel;
    List<String> tags = new ArrayList<>(this.consumerTags.keySet());
    boolean cancelRequested =
        !tags.isEmpty() && ChannelUtils.closeMessageConsumer(ch, tags, this.transactional);
    if (!cancelRequested) {
      // no cancellation confirmation to expect from the broker
      this.activeObjectCounter.release(this);
    }
    LOGGER.debug("Closing channel: {}", ch);
    ChannelUtils.closeChannel(ch);
    this.clearDeliveryTags();
    this.metricsCollector.closeConsumer();
    this.state(STOPPED, this.shutdown.get());
  }

  @Override
  public Message nextMessage() {
    LOGGER.trace("Retrieving delivery for {}", this);
    this.checkShutdown();
    try {
      Delivery delivery = null;
      while (delivery == null) {
        delivery = this.queue.poll(this.shutdownCheckInterval.toMillis(), MILLISECONDS);
        if (delivery == null) {
          this.checkShutdown();
        }
      }
      return this.handle(delivery);
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    }
  }

  @Override
  public Message nextMessage(Duration timeout) {
    LOGGER.debug("Retrieving delivery for {}", this);
    this.checkShutdown();
    try {
      return this.handle(this.queue.poll(timeout.toMillis(), MILLISECONDS));
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException(e);
    }
  }

  @Override
  public boolean commitIfNecessary(boolean locallyTransacted) {
    List<Long> tags = this.drainDeliveryTags();
    if (tags.isEmpty()) {
      return false;
    }
    try {
      if (this.acknowledgeMode.requiresAck()) {
        if (this.transactional && !locallyTransacted) {
          // the external transaction acknowledges the messages when it commits
          for (Long tag : tags) {
            this.transactionSynchronization.registerDeliveryTag(this.channel, tag);
          }
        } else {
          long lastTag = tags.get(tags.size() - 1);
          this.channel.basicAck(lastTag, true);
          tags.forEach(tag -> this.metricsCollector.consumeDisposition(ACCEPTED));
        }
      }
      if (locallyTransacted) {
        // manual acknowledgments need the commit as well
        ChannelUtils.commitIfNecessary(this.channel);
      }
    } catch (IOException e) {
      throw ExceptionUtils.convert(e, "Error while acknowledging messages");
    }
    return true;
  }

  @Override
  public void rollbackOnExceptionIfNecessary(Channel channel, Message message, Throwable cause) {
    Channel ch = channel == null ? this.channel : channel;
    List<Long> tags = this.drainDeliveryTags();
    boolean ackRequired = this.acknowledgeMode.requiresAck();
    try {
      if (this.transactional) {
        LOGGER.debug(
            "Initiating transaction rollback on application exception: {}", String.valueOf(cause));
        ChannelUtils.rollbackIfNecessary(ch);
      }
      if (ackRequired) {
        boolean requeue =
            this.defaultRequeueRejected && !ExceptionUtils.isRejectAndDontRequeue(cause);
        LOGGER.debug("Rejecting {} message(s), requeue={}", tags.size(), requeue);
        for (Long tag : tags) {
          ch.basicReject(tag, requeue);
          this.metricsCollector.consumeDisposition(requeue ? REQUEUED : DISCARDED);
        }
        if (this.transactional) {
          // the rejections must be committed
          ChannelUtils.commitIfNecessary(ch);
        }
      }
    } catch (IOException | RuntimeException e) {
      LOGGER.error(
          "Error during rollback, rethrowing application exception {}", String.valueOf(cause), e);
      if (cause == null) {
        throw ExceptionUtils.convert(e, "Error during rollback");
      }
      cause.addSuppressed(e);
      throw ExceptionUtils.propagate(cause);
    }
  }

  @Override
  public Channel channel() {
    return this.channel;
  }

  @Override
  public String consumerTag() {
    return this.consumerTag;
  }

  @Override
  public List<String> consumerTags() {
    return List.copyOf(this.consumerTags.keySet());
  }

  @Override
  public List<String> queues() {
    return this.queues;
  }

  @Override
  public AcknowledgeMode acknowledgeMode() {
    return this.acknowledgeMode;
  }

  @Override
  public boolean isTransactional() {
    return this.transactional;
  }

  @Override
  public boolean isCancelled() {
    return this.cancelled.get();
  }

  @Override
  public ShutdownSignalException shutdownSignal() {
    return this.shutdown.get();
  }

  @Override
  public int queuedMessageCount() {
    return this.queue.size();
  }

  @Override
  public String toString() {
    return "Consumer: tag=["
        + this.consumerTag
        + "], channel="
        + this.channel
        + ", acknowledgeMode="
        + this.acknowledgeMode
        + " local queue size="
        + this.queue.size();
  }

  // internal API

  List<Long> deliveryTags() {
    synchronized (this.deliveryTags) {
      return Collections.unmodifiableList(new ArrayList<>(this.deliveryTags));
    }
  }

  private void checkShutdown() {
    ShutdownSignalException signal = this.shutdown.get();
    if (signal != null) {
      throw new AmqpException.AmqpShutdownException(signal);
    }
  }

  private Message handle(Delivery delivery) {
    if (delivery == null) {
      this.checkShutdown();
      return null;
    }
    Envelope envelope = delivery.envelope();
    MessageProperties properties =
        this.messagePropertiesConverter.toMessageProperties(
            delivery.properties(), envelope, CHARSET);
    properties.messageCount(0);
    if (delivery.consumerTag() != null) {
      properties.consumerTag(delivery.consumerTag());
      properties.consumerQueue(this.consumerTags.get(delivery.consumerTag()));
    }
    Message message = new Message(delivery.body(), properties);
    LOGGER.debug("Received message: {}", message);
    this.metricsCollector.consume();
    if (!this.acknowledgeMode.isAutoAck()) {
      synchronized (this.deliveryTags) {
        this.deliveryTags.add(envelope.deliveryTag());
      }
    }
    return message;
  }

  private List<Long> drainDeliveryTags() {
    synchronized (this.deliveryTags) {
      List<Long> tags = new ArrayList<>(this.deliveryTags);
      this.deliveryTags.clear();
      return tags;
    }
  }

  private void clearDeliveryTags() {
    synchronized (this.deliveryTags) {
      this.deliveryTags.clear();
    }
  }

  private void consumerTagGone(String tag) {
    if (tag != null) {
      this.consumerTags.remove(tag);
    }
    if (this.consumerTags.isEmpty()) {
      // signal to the container the consumer has been cancelled
      this.activeObjectCounter.release(this);
    }
  }

  /** Receives the broker callbacks on the connection thread. */
  private final class InternalConsumer implements BasicConsumer {

    @Override
    public void handleConsumeOk(String consumerTag) {
      LOGGER.debug("ConsumeOK for tag {}: {}", consumerTag, BlockingQueueConsumer.this);
    }

    @Override
    public void handleCancelOk(String consumerTag) {
      LOGGER.debug(
          "Received cancellation notice for tag {}: {}", consumerTag, BlockingQueueConsumer.this);
      consumerTagGone(consumerTag);
    }

    @Override
    public void handleCancel(String consumerTag) {
      LOGGER.warn(
          "Cancel received for consumer tag {} on queue '{}': {}",
          consumerTag,
          consumerTag == null ? null : consumerTags.get(consumerTag),
          BlockingQueueConsumer.this);
      if (consumerTags.size() <= 1) {
        cancelled.set(true);
      }
      consumerTagGone(consumerTag);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException signal) {
      if (signal.isInitiatedByApplication()) {
        LOGGER.debug("Channel of consumer tag {} closed by application", consumerTag);
      } else {
        LOGGER.debug(
            "Received shutdown signal for consumer tag={}, cause={}",
            consumerTag,
            signal.getMessage());
        shutdown.compareAndSet(null, signal);
      }
      clearDeliveryTags();
    }

    @Override
    public void handleRecoverOk(String consumerTag) {
      LOGGER.debug("RecoverOK for tag {}: {}", consumerTag, BlockingQueueConsumer.this);
    }

    @Override
    public void handleDelivery(
        String consumerTag, Envelope envelope, BasicProperties properties, byte[] body) {
      if (cancelled.get() && acknowledgeMode.isTransactionAllowed()) {
        // the broker requeues unacknowledged messages when the channel closes
        LOGGER.debug(
            "Dropping delivery {} for cancelled consumer {}",
            Long.toUnsignedString(envelope.deliveryTag()),
            BlockingQueueConsumer.this);
        return;
      }
      LOGGER.debug("Storing delivery for {}", BlockingQueueConsumer.this);
      try {
        // an unbounded queue never makes the connection thread wait
        queue.put(new Delivery(consumerTag, envelope, properties, body));
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
      }
    }
  }
}
