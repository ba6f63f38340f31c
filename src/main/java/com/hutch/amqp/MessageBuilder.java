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
 * Builder for {@link Message} instances outside of a subscription.
 *
 * <p>Use it with a {@link NullAcknowledger} to test message handling code without a broker:
 *
 * <pre><code class='java'>
 * NullAcknowledger acknowledger = new NullAcknowledger();
 * Message message = new AmqpMessageBuilder()
 *     .acknowledger(acknowledger)
 *     .body("{\"id\":1}")
 *     .build();
 * handler.handle(message);
 * assertThat(acknowledger.acknowledgement()).isEqualTo(Acknowledgement.ACKED);
 * </code></pre>
 *
 * @see com.hutch.amqp.impl.AmqpMessageBuilder
 */
public interface MessageBuilder {

  /**
   * The acknowledger of the message.
   *
   * <p>Default is a new {@link NullAcknowledger}.
   *
   * @param acknowledger acknowledger
   * @return this builder instance
   */
  MessageBuilder acknowledger(Acknowledger acknowledger);

  /**
   * Message headers, replacing the ones already set.
   *
   * @param headers headers
   * @return this builder instance
   */
  MessageBuilder headers(Map<String, Object> headers);

  /**
   * Set a header.
   *
   * @param key header name
   * @param value header value
   * @return this builder instance
   */
  MessageBuilder header(String key, Object value);

  /**
   * Set the <code>request_id</code> header.
   *
   * @param requestId request ID
   * @return this builder instance
   */
  MessageBuilder requestId(String requestId);

  /**
   * The message body.
   *
   * @param body body
   * @return this builder instance
   */
  MessageBuilder body(byte[] body);

  /**
   * The message body, encoded as UTF-8.
   *
   * @param body body
   * @return this builder instance
   */
  MessageBuilder body(String body);

  /**
   * Delivery metadata.
   *
   * @param deliveryTag delivery tag
   * @param exchange exchange name
   * @param routingKey routing key
   * @param redelivered redelivered flag
   * @return this builder instance
   */
  MessageBuilder delivery(
      long deliveryTag, String exchange, String routingKey, boolean redelivered);

  /**
   * The content type.
   *
   * <p>Default is {@link Exchange#CONTENT_TYPE}.
   *
   * @param contentType content type
   * @return this builder instance
   */
  MessageBuilder contentType(String contentType);

  /**
   * Create the message.
   *
   * @return the message
   */
  Message build();
}
