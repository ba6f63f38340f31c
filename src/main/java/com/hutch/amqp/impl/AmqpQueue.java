// Copyright (c) 2024 Broadcom. All Rights Reserved.
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
package com.hutch.amqp.impl;

import static com.hutch.amqp.Resource.State.CLOSED;
import static com.hutch.amqp.Resource.State.CLOSING;
import static com.hutch.amqp.Resource.State.OPEN;

import com.hutch.amqp.AmqpException;
import com.hutch.amqp.Message;
import com.hutch.amqp.Queue;
import com.hutch.amqp.Subscription;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpQueue extends ResourceBase implements Queue {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpQueue.class);

  private final AmqpExchange exchange;
  private final String name;
  private final String routingKey;
  private final AtomicReference<ConsumptionState> consumptionState =
      new AtomicReference<>(ConsumptionState.UNBOUND);
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private volatile AmqpSubscription subscription;

  AmqpQueue(AmqpQueueBuilder builder) {
    super("Queue '" + builder.name() + "'", builder.listeners());
    this.exchange = builder.exchange();
    this.routingKey = builder.routingKey();
    this.exchange.checkOpen();
    Channel channel = this.exchange.channel();
    try {
      LOGGER.debug(
          "Declaring queue '{}' (durable {}, auto-delete {})",
          builder.name(),
          builder.durable(),
          builder.autoDelete());
      AMQP.Queue.DeclareOk declareOk =
          channel.queueDeclare(
              builder.name(), builder.durable(), false, builder.autoDelete(), null);
      // the broker generates a name when none is given
      this.name = declareOk.getQueue();
      if (builder.prefetchCount() > 0 || builder.prefetchSize() > 0) {
        this.exchange.qos(builder.prefetchSize(), builder.prefetchCount());
      }
    } catch (IOException | RuntimeException e) {
      AmqpException ex = ExceptionUtils.convert(e);
      this.state(CLOSED, ex);
      throw ex;
    }
    this.state(OPEN);
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public String routingKey() {
    return this.routingKey;
  }

  @Override
  public long purge() {
    checkUsable();
    try {
      LOGGER.debug("Purging queue '{}'", this.name);
      return this.exchange.channel().queuePurge(this.name).getMessageCount();
    } catch (IOException | RuntimeException e) {
      throw ExceptionUtils.convert(e, "Error while purging queue '%s'", this.name);
    }
  }

  /**
   * Passive declaration of the queue.
   *
   * <p>The broker closes the shared channel if the queue no longer exists.
   */
  @Override
  public QueueInfo inspect() {
    checkUsable();
    try {
      AMQP.Queue.DeclareOk declareOk = this.exchange.channel().queueDeclarePassive(this.name);
      return new DefaultQueueInfo(
          declareOk.getQueue(), declareOk.getMessageCount(), declareOk.getConsumerCount());
    } catch (IOException | RuntimeException e) {
      throw ExceptionUtils.convert(e, "Error while inspecting queue '%s'", this.name);
    }
  }

  @Override
  public Subscription subscribe(BlockingQueue<Message> output) {
    Assert.notNull(output, "Output queue cannot be null");
    checkUsable();
    if (!this.consumptionState.compareAndSet(
        ConsumptionState.UNBOUND, ConsumptionState.CONSUMING)) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Queue '%s' cannot subscribe, consumption state is %s",
          this.name, this.consumptionState.get());
    }
    Channel channel = this.exchange.channel();
    AmqpSubscription sub = new AmqpSubscription(this, output);
    // counted before the consumer can terminate
    this.exchange.metricsCollector().openSubscription();
    try {
      LOGGER.debug(
          "Binding queue '{}' to exchange '{}' with routing key '{}'",
          this.name,
          this.exchange.name(),
          this.routingKey);
      channel.queueBind(this.name, this.exchange.name(), this.routingKey);
      this.subscription = sub;
      LOGGER.debug("Starting consumer on queue '{}'", this.name);
      channel.basicConsume(this.name, false, this.name, false, false, null, sub.consumer());
    } catch (IOException | RuntimeException e) {
      sub.abandon();
      this.subscription = null;
      this.consumptionState.set(ConsumptionState.UNBOUND);
      throw ExceptionUtils.convert(e, "Error while subscribing to queue '%s'", this.name);
    }
    return sub;
  }

  @Override
  public ConsumptionState consumptionState() {
    return this.consumptionState.get();
  }

  @Override
  public void close() {
    if (!this.closed.compareAndSet(false, true)) {
      return;
    }
    this.state(CLOSING);
    Channel channel = this.exchange.channel();
    boolean exchangeWasOpen = this.exchange.isOpen();
    AmqpException failure = null;
    AmqpSubscription sub = this.subscription;
    if (sub != null) {
      // no hand-off once this returns
      sub.deactivate();
      if (exchangeWasOpen && !sub.terminated()) {
        try {
          LOGGER.debug("Cancelling consumer '{}'", sub.consumerTag());
          channel.basicCancel(sub.consumerTag());
        } catch (IOException | RuntimeException e) {
          failure =
              ExceptionUtils.convert(e, "Error while cancelling consumer '%s'", sub.consumerTag());
        }
      }
    }

    CompletableFuture<ShutdownSignalException> shutdown = new CompletableFuture<>();
    channel.addShutdownListener(shutdown::complete);
    boolean exchangeClosed = false;
    try {
      this.exchange.close();
      exchangeClosed = true;
    } catch (AmqpException e) {
      if (failure == null) {
        failure = e;
      } else {
        failure.addSuppressed(e);
      }
    }

    if (exchangeClosed) {
      LOGGER.debug("Waiting for the channel of queue '{}' to close", this.name);
      ShutdownSignalException signal = shutdown.join();
      if (exchangeWasOpen && signal != null && !signal.isInitiatedByApplication()) {
        AmqpException ex =
            ExceptionUtils.convert(signal, "Channel of queue '%s' closed by broker", this.name);
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
    }

    if (sub != null) {
      sub.terminate(Subscription.TerminationReason.CANCELLED, null);
    }
    this.consumptionState.set(ConsumptionState.TERMINATED);
    this.state(CLOSED, failure);
    if (failure != null) {
      throw failure;
    }
  }

  // internal API

  AmqpExchange exchange() {
    return this.exchange;
  }

  boolean closing() {
    return this.closed.get();
  }

  void consumptionTerminated() {
    this.consumptionState.set(ConsumptionState.TERMINATED);
  }

  private void checkUsable() {
    this.checkOpen();
    this.exchange.checkOpen();
  }

  @Override
  public String toString() {
    return "AmqpQueue{"
        + "name='"
        + name
        + '\''
        + ", routingKey='"
        + routingKey
        + '\''
        + ", consumptionState="
        + consumptionState.get()
        + '}';
  }

  private static final class DefaultQueueInfo implements QueueInfo {

    private final String name;
    private final long messageCount;
    private final int consumerCount;

    private DefaultQueueInfo(String name, long messageCount, int consumerCount) {
      this.name = name;
      this.messageCount = messageCount;
      this.consumerCount = consumerCount;
    }

    @Override
    public String name() {
      return this.name;
    }

    @Override
    public long messageCount() {
      return this.messageCount;
    }

    @Override
    public int consumerCount() {
      return this.consumerCount;
    }

    @Override
    public String toString() {
      return "QueueInfo{"
          + "name='"
          + name
          + '\''
          + ", messageCount="
          + messageCount
          + ", consumerCount="
          + consumerCount
          + '}';
    }
  }
}
