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
package com.hutch.amqp;

import java.nio.charset.StandardCharsets;

/**
 * A broker exchange together with the connection and the channel used to reach it.
 *
 * <p>The exchange owns its connection and its channel: they are opened when the exchange is built
 * and closed together by {@link #close()}. Queues built with {@link #queueBuilder()} share the
 * channel of the exchange, so channel-level settings (prefetch) and the channel lifecycle apply to
 * all of them. Use one exchange instance per queue when isolation is required.
 *
 * <p>Instances are created with an {@link ExchangeBuilder}.
 *
 * @see ExchangeBuilder
 */
public interface Exchange extends AutoCloseable, Resource {

  /** Content type of published messages. */
  String CONTENT_TYPE = "application/json";

  /** Header carrying the request ID of published messages. */
  String REQUEST_ID_HEADER = "request_id";

  /**
   * The name of the exchange.
   *
   * @return exchange name
   */
  String name();

  /**
   * Publish a persistent message, that survives a broker restart if it is routed to durable
   * queues.
   *
   * @param routingKey routing key
   * @param body message body
   * @param requestId value of the <code>request_id</code> header
   */
  void publish(String routingKey, byte[] body, String requestId);

  /**
   * Publish a persistent message with a UTF-8 encoded body.
   *
   * @param routingKey routing key
   * @param body message body
   * @param requestId value of the <code>request_id</code> header
   * @see #publish(String, byte[], String)
   */
  default void publish(String routingKey, String body, String requestId) {
    this.publish(routingKey, body.getBytes(StandardCharsets.UTF_8), requestId);
  }

  /**
   * Publish a transient message, that can be lost on broker restart.
   *
   * @param routingKey routing key
   * @param body message body
   * @param requestId value of the <code>request_id</code> header
   */
  void publishTransient(String routingKey, byte[] body, String requestId);

  /**
   * Publish a transient message with a UTF-8 encoded body.
   *
   * @param routingKey routing key
   * @param body message body
   * @param requestId value of the <code>request_id</code> header
   * @see #publishTransient(String, byte[], String)
   */
  default void publishTransient(String routingKey, String body, String requestId) {
    this.publishTransient(routingKey, body.getBytes(StandardCharsets.UTF_8), requestId);
  }

  /**
   * Create a builder to declare a queue on this exchange's channel.
   *
   * @return queue builder
   */
  QueueBuilder queueBuilder();

  /**
   * Whether the channel and the connection are open.
   *
   * @return true if the exchange can be used
   */
  boolean isOpen();

  /**
   * Close the channel, then the connection.
   *
   * <p>Both are closed even if closing the channel fails. The first failure is thrown, the second
   * one is added as a suppressed exception.
   */
  @Override
  void close();
}
