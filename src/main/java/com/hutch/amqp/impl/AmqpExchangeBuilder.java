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

import com.hutch.amqp.DisconnectHandler;
import com.hutch.amqp.Exchange;
import com.hutch.amqp.ExchangeBuilder;
import com.hutch.amqp.Resource;
import com.hutch.amqp.metrics.MetricsCollector;
import com.hutch.amqp.metrics.NoOpMetricsCollector;
import com.rabbitmq.client.ConnectionFactory;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;

/** Builder to create an {@link Exchange} instance. */
public class AmqpExchangeBuilder implements ExchangeBuilder {

  private String uri;
  private String name = Utils.DEFAULT_EXCHANGE_NAME;
  private String type = Utils.DEFAULT_EXCHANGE_TYPE;
  private boolean durable = true;
  private boolean autoDelete = false;
  private DisconnectHandler disconnectHandler = Utils.FAIL_FAST_DISCONNECT_HANDLER;
  private ConnectionFactory connectionFactory;
  private String connectionName;
  private ExecutorService dispatchingExecutor;
  private MetricsCollector metricsCollector = NoOpMetricsCollector.INSTANCE;
  private final List<Resource.StateListener> listeners = new ArrayList<>();

  public AmqpExchangeBuilder() {}

  @Override
  public AmqpExchangeBuilder uri(String uri) {
    this.uri = uri;
    return this;
  }

  @Override
  public AmqpExchangeBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public AmqpExchangeBuilder type(String type) {
    this.type = type;
    return this;
  }

  @Override
  public AmqpExchangeBuilder durable(boolean durable) {
    this.durable = durable;
    return this;
  }

  @Override
  public AmqpExchangeBuilder autoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  @Override
  public AmqpExchangeBuilder disconnectHandler(DisconnectHandler handler) {
    this.disconnectHandler = handler == null ? Utils.FAIL_FAST_DISCONNECT_HANDLER : handler;
    return this;
  }

  @Override
  public AmqpExchangeBuilder connectionFactory(ConnectionFactory connectionFactory) {
    this.connectionFactory = connectionFactory;
    return this;
  }

  @Override
  public AmqpExchangeBuilder connectionName(String connectionName) {
    this.connectionName = connectionName;
    return this;
  }

  @Override
  public AmqpExchangeBuilder dispatchingExecutor(ExecutorService executor) {
    this.dispatchingExecutor = executor;
    return this;
  }

  @Override
  public AmqpExchangeBuilder metricsCollector(MetricsCollector metricsCollector) {
    this.metricsCollector =
        metricsCollector == null ? NoOpMetricsCollector.INSTANCE : metricsCollector;
    return this;
  }

  @Override
  public AmqpExchangeBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public Exchange build() {
    Assert.notBlank(this.type, "Exchange type cannot be null or blank");
    Assert.notNull(this.name, "Exchange name cannot be null");
    return new AmqpExchange(this);
  }

  String uri() {
    return this.uri;
  }

  String name() {
    return this.name;
  }

  String type() {
    return this.type;
  }

  boolean durable() {
    return this.durable;
  }

  boolean autoDelete() {
    return this.autoDelete;
  }

  DisconnectHandler disconnectHandler() {
    return this.disconnectHandler;
  }

  ConnectionFactory connectionFactory() {
    return this.connectionFactory;
  }

  String connectionName() {
    return this.connectionName;
  }

  ExecutorService dispatchingExecutor() {
    return this.dispatchingExecutor;
  }

  MetricsCollector metricsCollector() {
    return this.metricsCollector;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }
}
