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
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.LongString;
import java.nio.charset.StandardCharsets;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

final class AmqpMessage implements Message {

  private static final byte[] EMPTY_BODY = new byte[0];

  private final Acknowledger acknowledger;
  private final Map<String, Object> headers;
  private final byte[] body;
  private final long deliveryTag;
  private final String exchange;
  private final String routingKey;
  private final boolean redelivered;
  private final String contentType;

  AmqpMessage(
      Acknowledger acknowledger,
      Envelope envelope,
      AMQP.BasicProperties properties,
      byte[] body) {
    this(
        acknowledger,
        envelope.getDeliveryTag(),
        envelope.getExchange(),
        envelope.getRoutingKey(),
        envelope.isRedeliver(),
        properties == null ? null : properties.getContentType(),
        properties == null ? null : properties.getHeaders(),
        body);
  }

  AmqpMessage(
      Acknowledger acknowledger,
      long deliveryTag,
      String exchange,
      String routingKey,
      boolean redelivered,
      String contentType,
      Map<String, Object> headers,
      byte[] body) {
    this.acknowledger = acknowledger;
    this.deliveryTag = deliveryTag;
    this.exchange = exchange;
    this.routingKey = routingKey;
    this.redelivered = redelivered;
    this.contentType = contentType;
    this.headers = headers(headers);
    this.body = body == null ? EMPTY_BODY : body;
  }

  private static Map<String, Object> headers(Map<String, Object> source) {
    if (source == null || source.isEmpty()) {
      return Collections.emptyMap();
    }
    Map<String, Object> result = new LinkedHashMap<>(source.size());
    // the client library decodes strings as LongString
    source.forEach(
        (k, v) -> result.put(k, v instanceof LongString ? v.toString() : v));
    return Collections.unmodifiableMap(result);
  }

  @Override
  public void ack() {
    this.acknowledger.ack();
  }

  @Override
  public void nack(boolean requeue) {
    this.acknowledger.nack(requeue);
  }

  @Override
  public Map<String, Object> headers() {
    return this.headers;
  }

  @Override
  public Object header(String key) {
    return this.headers.get(key);
  }

  @Override
  public String requestId() {
    Object value = this.headers.get(Exchange.REQUEST_ID_HEADER);
    return value == null ? null : value.toString();
  }

  @Override
  public byte[] body() {
    return this.body.clone();
  }

  @Override
  public String bodyAsString() {
    return new String(this.body, StandardCharsets.UTF_8);
  }

  @Override
  public long deliveryTag() {
    return this.deliveryTag;
  }

  @Override
  public String exchange() {
    return this.exchange;
  }

  @Override
  public String routingKey() {
    return this.routingKey;
  }

  @Override
  public boolean redelivered() {
    return this.redelivered;
  }

  @Override
  public String contentType() {
    return this.contentType;
  }

  @Override
  public Acknowledger acknowledger() {
    return this.acknowledger;
  }

  @Override
  public String toString() {
    return "AmqpMessage{"
        + "deliveryTag="
        + deliveryTag
        + ", routingKey='"
        + routingKey
        + '\''
        + ", headers="
        + headers
        + ", bodySize="
        + body.length
        + '}';
  }
}
