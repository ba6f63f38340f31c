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

import com.hutch.amqp.Acknowledger;
import com.hutch.amqp.Exchange;
import com.hutch.amqp.Message;
import com.hutch.amqp.MessageBuilder;
import com.hutch.amqp.NullAcknowledger;
import java.nio.charset.StandardCharsets;
import java.util.LinkedHashMap;
import java.util.Map;

/** Builder to create a {@link Message} instance, e.g. backed by a {@link NullAcknowledger}. */
public class AmqpMessageBuilder implements MessageBuilder {

  private Acknowledger acknowledger;
  private final Map<String, Object> headers = new LinkedHashMap<>();
  private byte[] body;
  private long deliveryTag = 0;
  private String exchange;
  private String routingKey;
  private boolean redelivered = false;
  private String contentType = Exchange.CONTENT_TYPE;

  public AmqpMessageBuilder() {}

  @Override
  public AmqpMessageBuilder acknowledger(Acknowledger acknowledger) {
    this.acknowledger = acknowledger;
    return this;
  }

  @Override
  public AmqpMessageBuilder headers(Map<String, Object> headers) {
    this.headers.clear();
    if (headers != null) {
      this.headers.putAll(headers);
    }
    return this;
  }

  @Override
  public AmqpMessageBuilder header(String key, Object value) {
    Assert.notNull(key, "Header name cannot be null");
    this.headers.put(key, value);
    return this;
  }

  @Override
  public AmqpMessageBuilder requestId(String requestId) {
    return this.header(Exchange.REQUEST_ID_HEADER, requestId);
  }

  @Override
  public AmqpMessageBuilder body(byte[] body) {
    this.body = body == null ? null : body.clone();
    return this;
  }

  @Override
  public AmqpMessageBuilder body(String body) {
    this.body = body == null ? null : body.getBytes(StandardCharsets.UTF_8);
    return this;
  }

  @Override
  public AmqpMessageBuilder delivery(
      long deliveryTag, String exchange, String routingKey, boolean redelivered) {
    this.deliveryTag = deliveryTag;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.redelivered = redelivered;
    return this;
  }

  @Override
  public AmqpMessageBuilder contentType(String contentType) {
    this.contentType = contentType;
    return this;
  }

  @Override
  public Message build() {
    return new AmqpMessage(
        this.acknowledger == null ? new NullAcknowledger() : this.acknowledger,
        this.deliveryTag,
        this.exchange,
        this.routingKey,
        this.redelivered,
        this.contentType,
        this.headers,
        this.body);
  }
}
