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

import com.hutch.amqp.AmqpException;
import com.hutch.amqp.DisconnectHandler;
import com.hutch.amqp.Exchange;
import com.hutch.amqp.Message;
import com.hutch.amqp.Queue;
import com.hutch.amqp.Subscription;
import com.hutch.amqp.metrics.MetricsCollector;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import java.time.Duration;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.locks.Lock;
import java.util.concurrent.locks.ReentrantLock;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpSubscription implements Subscription {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpSubscription.class);

  private final AmqpQueue queue;
  private final BlockingQueue<Message> output;
  private final MetricsCollector metricsCollector;
  private final Consumer consumer = new DeliveryConsumer();
  private final CompletableFuture<Termination> termination = new CompletableFuture<>();
  private final AtomicBoolean terminated = new AtomicBoolean(false);
  // held for the whole hand-off of a delivery
  private final Lock handOffLock = new ReentrantLock();
  private volatile boolean active = true;

  AmqpSubscription(AmqpQueue queue, BlockingQueue<Message> output) {
    this.queue = queue;
    this.output = output;
    this.metricsCollector = queue.exchange().metricsCollector();
  }

  @Override
  public Queue queue() {
    return this.queue;
  }

  @Override
  public String consumerTag() {
    return this.queue.name();
  }

  @Override
  public boolean isActive() {
    return this.active;
  }

  @Override
  public CompletableFuture<Termination> termination() {
    return this.termination;
  }

  @Override
  public Message next(Duration timeout) {
    Assert.notNull(timeout, "Timeout cannot be null");
    long deadline = System.nanoTime() + timeout.toNanos();
    long interval = Utils.HAND_OFF_CHECK_INTERVAL.toNanos();
    try {
      while (true) {
        long remaining = deadline - System.nanoTime();
        Message message =
            this.output.poll(Math.max(0, Math.min(remaining, interval)), TimeUnit.NANOSECONDS);
        if (message != null) {
          return message;
        } else if (!this.active && this.output.isEmpty()) {
          throw new AmqpException.AmqpResourceClosedException(
              "Subscription to queue '" + this.queue.name() + "' is terminated");
        } else if (remaining <= 0) {
          return null;
        }
      }
    } catch (InterruptedException e) {
      Thread.currentThread().interrupt();
      throw new AmqpException("Interrupted while waiting for a message", e);
    }
  }

  Consumer consumer() {
    return this.consumer;
  }

  void deactivate() {
    this.active = false;
    // waits for a hand-off in progress to give up
    this.handOffLock.lock();
    this.handOffLock.unlock();
  }

  boolean terminated() {
    return this.terminated.get();
  }

  /** Releases a subscription whose consumer could not be registered. */
  void abandon() {
    if (this.terminated.compareAndSet(false, true)) {
      this.active = false;
      this.metricsCollector.closeSubscription();
    }
  }

  void terminate(TerminationReason reason, Throwable cause) {
    if (this.terminated.compareAndSet(false, true)) {
      this.active = false;
      LOGGER.debug(
          "Subscription to queue '{}' terminated ({})", this.queue.name(), reason, cause);
      this.queue.consumptionTerminated();
      this.metricsCollector.closeSubscription();
      this.termination.complete(new DefaultTermination(reason, cause));
      if (reason == TerminationReason.DISCONNECTED) {
        AmqpExchange exchange = this.queue.exchange();
        try {
          exchange
              .disconnectHandler()
              .handle(new DefaultDisconnectContext(exchange, this.queue, cause));
        } catch (Exception e) {
          LOGGER.warn("Error in disconnect handler of queue '{}'", this.queue.name(), e);
        }
      }
    }
  }

  private void handOff(Message message) throws InterruptedException {
    this.handOffLock.lock();
    try {
      long interval = Utils.HAND_OFF_CHECK_INTERVAL.toMillis();
      while (this.active) {
        if (this.output.offer(message, interval, TimeUnit.MILLISECONDS)) {
          this.metricsCollector.consume();
          return;
        }
      }
      LOGGER.debug(
          "Subscription to queue '{}' no longer active, dropping delivery {}",
          this.queue.name(),
          message.deliveryTag());
    } finally {
      this.handOffLock.unlock();
    }
  }

  @Override
  public String toString() {
    return "AmqpSubscription{"
        + "queue='"
        + queue.name()
        + '\''
        + ", active="
        + active
        + '}';
  }

  private final class DeliveryConsumer implements Consumer {

    @Override
    public void handleConsumeOk(String consumerTag) {
      LOGGER.debug("Consumer '{}' registered", consumerTag);
    }

    @Override
    public void handleCancelOk(String consumerTag) {
      terminate(TerminationReason.CANCELLED, null);
    }

    @Override
    public void handleCancel(String consumerTag) {
      LOGGER.debug("Consumer '{}' cancelled by the broker", consumerTag);
      terminate(TerminationReason.DISCONNECTED, null);
    }

    @Override
    public void handleShutdownSignal(String consumerTag, ShutdownSignalException sig) {
      // the shared channel can be closed by another queue or by the exchange
      if (queue.closing()) {
        terminate(TerminationReason.CANCELLED, null);
      } else {
        terminate(TerminationReason.DISCONNECTED, ExceptionUtils.convert(sig));
      }
    }

    @Override
    public void handleRecoverOk(String consumerTag) {}

    @Override
    public void handleDelivery(
        String consumerTag, Envelope envelope, AMQP.BasicProperties properties, byte[] body) {
      if (!active) {
        return;
      }
      AmqpExchange exchange = queue.exchange();
      Message message =
          new AmqpMessage(
              new DeliveryAcknowledger(
                  exchange.channel(), envelope.getDeliveryTag(), metricsCollector),
              envelope,
              properties,
              body);
      try {
        handOff(message);
      } catch (InterruptedException e) {
        Thread.currentThread().interrupt();
        LOGGER.debug("Interrupted while handing off delivery {}", envelope.getDeliveryTag());
      }
    }
  }

  private static final class DefaultTermination implements Termination {

    private final TerminationReason reason;
    private final Throwable cause;

    private DefaultTermination(TerminationReason reason, Throwable cause) {
      this.reason = reason;
      this.cause = cause;
    }

    @Override
    public TerminationReason reason() {
      return this.reason;
    }

    @Override
    public Throwable cause() {
      return this.cause;
    }

    @Override
    public String toString() {
      return "Termination{" + "reason=" + reason + ", cause=" + cause + '}';
    }
  }

  private static final class DefaultDisconnectContext implements DisconnectHandler.Context {

    private final Exchange exchange;
    private final Queue queue;
    private final Throwable cause;

    private DefaultDisconnectContext(Exchange exchange, Queue queue, Throwable cause) {
      this.exchange = exchange;
      this.queue = queue;
      this.cause = cause;
    }

    @Override
    public Exchange exchange() {
      return this.exchange;
    }

    @Override
    public Queue queue() {
      return this.queue;
    }

    @Override
    public Throwable cause() {
      return this.cause;
    }
  }
}
