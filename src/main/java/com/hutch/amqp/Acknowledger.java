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

/**
 * Settles a delivered message.
 *
 * <p>Only the first call to {@link #ack()} or {@link #nack(boolean)} settles the message,
 * subsequent calls throw {@link AmqpException.AmqpAlreadyAcknowledgedException}.
 *
 * @see Message
 * @see NullAcknowledger
 */
public interface Acknowledger {

  /**
   * Acknowledge the message.
   *
   * <p>This means the message has been processed and the broker can delete it. Only this message
   * is acknowledged, not the ones delivered before it.
   *
   * @throws AmqpException.AmqpAlreadyAcknowledgedException if the message is already settled
   */
  void ack();

  /**
   * Reject the message.
   *
   * @param requeue true to put the message back in the queue, false to drop it (or dead-letter it
   *     if the queue is configured so)
   * @throws AmqpException.AmqpAlreadyAcknowledgedException if the message is already settled
   */
  void nack(boolean requeue);
}
