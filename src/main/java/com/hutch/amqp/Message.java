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

import java.util.Map;

/**
 * A message delivered by a {@link Queue} subscription.
 *
 * <p>A message is its own {@link Acknowledger}: call {@link #ack()} or {@link #nack(boolean)}
 * once it is processed. Instances are immutable.
 *
 * @see Queue#subscribe(java.util.concurrent.BlockingQueue)
 */
public interface Message extends Acknowledger {

  /**
   * The message headers.
   *
   * @return an unmodifiable view of the headers, empty if the message has none
   */
  Map<String, Object> headers();

  /**
   * A header value.
   *
   * @param key header name
   * @return the value, null if the header is not set
   */
  Object header(String key);

  /**
   * The <code>request_id</code> header value set by {@link Exchange#publish(String, byte[],
   * String)}.
   *
   * @return the request ID, null if not set
   */
  String requestId();

  /**
   * A copy of the message body.
   *
   * @return the body
   */
  byte[] body();

  /**
   * The message body decoded as UTF-8.
   *
   * @return the body as a string
   */
  String bodyAsString();

  /**
   * The broker-assigned delivery tag.
   *
   * @return the delivery tag
   */
  long deliveryTag();

  /**
   * The name of the exchange the message was published to.
   *
   * @return exchange name
   */
  String exchange();

  /**
   * The routing key the message was published with.
   *
   * @return routing key
   */
  String routingKey();

  /**
   * Whether the broker delivered this message before (after a requeue or a connection loss).
   *
   * @return true if the message is redelivered
   */
  boolean redelivered();

  /**
   * The content type.
   *
   * @return content type, can be null
   */
  String contentType();

  /**
   * The acknowledger bound to this message.
   *
   * @return acknowledger
   */
  Acknowledger acknowledger();
}
