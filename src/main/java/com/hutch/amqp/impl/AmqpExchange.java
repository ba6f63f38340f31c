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
import com.hutch.amqp.DisconnectHandler;
import com.hutch.amqp.Exchange;
import com.hutch.amqp.QueueBuilder;
import com.hutch.amqp.metrics.MetricsCollector;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.Channel;
import com.rabbitmq.client.Connection;
import com.rabbitmq.client.ConnectionFactory;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.net.URISyntaxException;
import java.security.GeneralSecurityException;
import java.util.Collections;
import java.util.Objects;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicReference;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class AmqpExchange extends ResourceBase implements Exchange {

  private static final Logger LOGGER = LoggerFactory.getLogger(AmqpExchange.class);

  private final String name;
  private final String connectionName;
  private final Connection connection;
  private final Channel channel;
  private final DisconnectHandler disconnectHandler;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean closed = new AtomicBoolean(false);
  private final AtomicReference<Qos> qos = new AtomicReference<>();

  AmqpExchange(AmqpExchangeBuilder builder) {
    super("Exchange '" + builder.name() + "'", builder.listeners());
    this.name = builder.name();
    this.connectionName =
        builder.connectionName() == null
            ? Utils.CONNECTION_NAME_SUPPLIER.get()
            : builder.connectionName();
    this.disconnectHandler = builder.disconnectHandler();
    this.metricsCollector = builder.metricsCollector();
    this.connection = connect(builder, this.connectionName);
    try {
      this.channel = this.connection.createChannel();
      if (this.channel == null) {
        throw new AmqpException.AmqpResourceInvalidStateException(
            "No channel available on connection '%s'", this.connectionName);
      }
      LOGGER.debug(
          "Declaring exchange '{}' (type {}, durable {}, auto-delete {})",
          this.name,
          builder.type(),
          builder.durable(),
          builder.autoDelete());
      this.channel.exchangeDeclare(
          this.name, builder.type(), builder.durable(), builder.autoDelete(), false, null);
    } catch (IOException | RuntimeException e) {
      closeQuietly(this.connection);
      AmqpException ex = ExceptionUtils.convert(e);
      this.state(CLOSED, ex);
      throw ex;
    }
    this.channel.addShutdownListener(
        signal -> {
          if (!signal.isInitiatedByApplication() && this.state() == OPEN) {
            LOGGER.debug("Channel of exchange '{}' closed by broker or network", this.name);
            this.state(CLOSED, ExceptionUtils.convert(signal));
          }
        });
    this.state(OPEN);
    this.metricsCollector.openExchange();
  }

  private static Connection connect(AmqpExchangeBuilder builder, String connectionName) {
    ConnectionFactory factory = builder.connectionFactory();
    String uri = builder.uri();
    if (factory == null) {
      factory = new ConnectionFactory();
      if (Utils.isBlank(uri)) {
        uri = Utils.DEFAULT_URI;
      }
    }
    try {
      if (!Utils.isBlank(uri)) {
        factory.setUri(uri);
      }
      // reconnection is the application's business
      factory.setAutomaticRecoveryEnabled(false);
      ExecutorService executor = builder.dispatchingExecutor();
      LOGGER.debug("Opening connection '{}'", connectionName);
      if (executor == null) {
        return factory.newConnection(connectionName);
      } else {
        return factory.newConnection(executor, connectionName);
      }
    } catch (URISyntaxException e) {
      throw new IllegalArgumentException("Invalid broker URI: " + uri, e);
    } catch (GeneralSecurityException e) {
      throw new AmqpException.AmqpSecurityException(e.getMessage(), e);
    } catch (IOException | TimeoutException | RuntimeException e) {
      throw ExceptionUtils.convert(e, "Error while connecting to broker: %s", e.getMessage());
    }
  }

  @Override
  public String name() {
    return this.name;
  }

  @Override
  public void publish(String routingKey, byte[] body, String requestId) {
    this.publish(routingKey, body, requestId, true);
  }

  @Override
  public void publishTransient(String routingKey, byte[] body, String requestId) {
    this.publish(routingKey, body, requestId, false);
  }

  private void publish(String routingKey, byte[] body, String requestId, boolean persistent) {
    checkOpen();
    Assert.notNull(routingKey, "Routing key cannot be null");
    Assert.notNull(body, "Message body cannot be null");
    Channel ch = this.channel;
    if (ch == null) {
      throw new AmqpException.AmqpResourceInvalidStateException(
          "Channel of exchange '%s' is not available", this.name);
    }
    AMQP.BasicProperties properties =
        new AMQP.BasicProperties.Builder()
            .contentType(CONTENT_TYPE)
            .headers(Collections.singletonMap(REQUEST_ID_HEADER, requestId))
            .deliveryMode(
                persistent ? Utils.PERSISTENT_DELIVERY_MODE : Utils.TRANSIENT_DELIVERY_MODE)
            .priority(0)
            .build();
    try {
      ch.basicPublish(this.name, routingKey, false, false, properties, body);
    } catch (IOException | RuntimeException e) {
      throw ExceptionUtils.convert(e);
    }
    this.metricsCollector.publish(persistent);
  }

  @Override
  public QueueBuilder queueBuilder() {
    return new AmqpQueueBuilder(this);
  }

  @Override
  public boolean isOpen() {
    return this.state() == OPEN;
  }

  @Override
  public void close() {
    this.close(null);
  }

  void close(Throwable cause) {
    if (this.closed.compareAndSet(false, true)) {
      boolean alreadyClosed = this.state() == CLOSED;
      if (!alreadyClosed) {
        this.state(CLOSING, cause);
      }
      AmqpException failure = null;
      try {
        LOGGER.debug("Closing channel of exchange '{}'", this.name);
        this.channel.close();
      } catch (AlreadyClosedException e) {
        LOGGER.debug("Channel of exchange '{}' already closed", this.name);
      } catch (IOException | TimeoutException | ShutdownSignalException e) {
        failure = ExceptionUtils.convert(e);
      }
      try {
        LOGGER.debug("Closing connection '{}'", this.connectionName);
        this.connection.close();
      } catch (AlreadyClosedException e) {
        LOGGER.debug("Connection '{}' already closed", this.connectionName);
      } catch (IOException | ShutdownSignalException e) {
        AmqpException ex = ExceptionUtils.convert(e);
        if (failure == null) {
          failure = ex;
        } else {
          failure.addSuppressed(ex);
        }
      }
      if (!alreadyClosed) {
        this.state(CLOSED, cause);
      }
      this.metricsCollector.closeExchange();
      if (failure != null) {
        throw failure;
      }
    }
  }

  // internal API

  Channel channel() {
    return this.channel;
  }

  DisconnectHandler disconnectHandler() {
    return this.disconnectHandler;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  void qos(int prefetchSize, int prefetchCount) throws IOException {
    Qos requested = new Qos(prefetchSize, prefetchCount);
    Qos previous = this.qos.getAndSet(requested);
    if (previous != null && !previous.equals(requested)) {
      LOGGER.warn(
          "Prefetch of the channel of exchange '{}' changed from {} to {}, "
              + "the new value applies to all its queues",
          this.name,
          previous,
          requested);
    }
    this.channel.basicQos(prefetchSize, prefetchCount, false);
  }

  private static void closeQuietly(Connection connection) {
    try {
      connection.close();
    } catch (Exception e) {
      LOGGER.warn("Error while closing connection after failed initialization", e);
    }
  }

  @Override
  public String toString() {
    return "AmqpExchange{" + "name='" + name + '\'' + ", connection='" + connectionName + '\'' + '}';
  }

  private static final class Qos {

    private final int prefetchSize;
    private final int prefetchCount;

    private Qos(int prefetchSize, int prefetchCount) {
      this.prefetchSize = prefetchSize;
      this.prefetchCount = prefetchCount;
    }

    @Override
    public boolean equals(Object o) {
      if (this == o) {
        return true;
      }
      if (o == null || getClass() != o.getClass()) {
        return false;
      }
      Qos qos = (Qos) o;
      return prefetchSize == qos.prefetchSize && prefetchCount == qos.prefetchCount;
    }

    @Override
    public int hashCode() {
      return Objects.hash(prefetchSize, prefetchCount);
    }

    @Override
    public String toString() {
      return "{prefetchCount=" + prefetchCount + ", prefetchSize=" + prefetchSize + '}';
    }
  }
}
