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

import java.time.Duration;
import java.util.concurrent.CompletableFuture;

/**
 * Handle on the consumption started by {@link Queue#subscribe(java.util.concurrent.BlockingQueue)}.
 *
 * <p>The handle tells whether the delivery stream is still active and why it ended. It also offers
 * {@link #next(Duration)} to read the output queue with an end-of-stream signal.
 */
public interface Subscription {

  /**
   * The queue the subscription consumes from.
   *
   * @return queue
   */
  Queue queue();

  /**
   * The consumer tag, equal to the queue name.
   *
   * @return consumer tag
   */
  String consumerTag();

  /**
   * Whether deliveries can still be handed off.
   *
   * @return true until the subscription terminates
   */
  boolean isActive();

  /**
   * Future completed when the subscription terminates.
   *
   * @return termination future
   */
  CompletableFuture<Termination> termination();

  /**
   * Wait for the next message of the output queue.
   *
   * @param timeout maximum time to wait
   * @return the next message, null if none arrived within the timeout
   * @throws AmqpException.AmqpResourceClosedException if the subscription is terminated and the
   *     output queue is drained
   */
  Message next(Duration timeout);

  /** Why a subscription ended. */
  enum TerminationReason {
    /** The queue was closed by the application. */
    CANCELLED,
    /** The broker-side delivery stream ended (connection or channel loss, consumer cancelled). */
    DISCONNECTED
  }

  /** Termination details. */
  interface Termination {

    /**
     * The reason.
     *
     * @return reason
     */
    TerminationReason reason();

    /**
     * The failure cause, null for a cancellation or a broker-side consumer cancel.
     *
     * @return cause
     */
    Throwable cause();
  }
}
