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

import com.hutch.amqp.Queue;
import com.hutch.amqp.QueueBuilder;
import com.hutch.amqp.Resource;
import java.util.ArrayList;
import java.util.List;

class AmqpQueueBuilder implements QueueBuilder {

  private final AmqpExchange exchange;
  private String name;
  private boolean durable = true;
  private boolean autoDelete = false;
  private String routingKey = "";
  private int prefetchCount = 0;
  private int prefetchSize = 0;
  private final List<Resource.StateListener> listeners = new ArrayList<>();

  AmqpQueueBuilder(AmqpExchange exchange) {
    this.exchange = exchange;
  }

  @Override
  public QueueBuilder name(String name) {
    this.name = name;
    return this;
  }

  @Override
  public QueueBuilder durable(boolean durable) {
    this.durable = durable;
    return this;
  }

  @Override
  public QueueBuilder autoDelete(boolean autoDelete) {
    this.autoDelete = autoDelete;
    return this;
  }

  @Override
  public QueueBuilder routingKey(String routingKey) {
    this.routingKey = routingKey == null ? "" : routingKey;
    return this;
  }

  @Override
  public QueueBuilder prefetchCount(int prefetchCount) {
    this.prefetchCount = Assert.notNegative(prefetchCount, "Prefetch count cannot be negative");
    return this;
  }

  @Override
  public QueueBuilder prefetchSize(int prefetchSize) {
    this.prefetchSize = Assert.notNegative(prefetchSize, "Prefetch size cannot be negative");
    return this;
  }

  @Override
  public QueueBuilder listeners(Resource.StateListener... listeners) {
    if (listeners == null || listeners.length == 0) {
      this.listeners.clear();
    } else {
      this.listeners.addAll(List.of(listeners));
    }
    return this;
  }

  @Override
  public Queue build() {
    Assert.notNull(this.name, "Queue name cannot be null");
    return new AmqpQueue(this);
  }

  AmqpExchange exchange() {
    return this.exchange;
  }

  String name() {
    return this.name;
  }

  boolean durable() {
    return this.durable;
  }

  boolean autoDelete() {
    return this.autoDelete;
  }

  String routingKey() {
    return this.routingKey;
  }

  int prefetchCount() {
    return this.prefetchCount;
  }

  int prefetchSize() {
    return this.prefetchSize;
  }

  List<Resource.StateListener> listeners() {
    return this.listeners;
  }
}
