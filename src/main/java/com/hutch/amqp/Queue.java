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

import java.util.concurrent.BlockingQueue;

/**
 * A broker queue declared on the channel of an {@link Exchange}.
 *
 * <p>Consumption goes through 3 states: {@link ConsumptionState#UNBOUND} until {@link
 * #subscribe(BlockingQueue)} binds the queue and starts consuming, then {@link
 * ConsumptionState#CONSUMING}, then {@link ConsumptionState#TERMINATED} after {@link #close()} or
 * a disconnection. A terminated queue cannot consume again.
 *
 * <p>Instances are created with a {@link QueueBuilder}.
 *
 * @see Exchange#queueBuilder()
 */
public interface Queue extends AutoCloseable, Resource {

  /**
   * The queue name.
   *
   * @return queue name
   */
  String name();

  /**
   * The routing key used to bind the queue to the exchange.
   *
   * @return routing key
   */
  String routingKey();

  /**
   * Remove all the ready messages of the queue.
   *
   * @return number of purged messages
   */
  long purge();

  /**
   * Query the broker for the queue state.
   *
   * @return queue information
   */
  QueueInfo inspect();

  /**
   * Bind the queue to the exchange and start consuming.
   *
   * <p>Messages are not auto-acknowledged: each of them must be acked or nacked. Each delivery is
   * handed off to <code>output</code> with a blocking operation, so a slow reader slows down the
   * broker once the prefetch limit is reached.
   *
   * <p>The library never closes <code>output</code> nor adds an end marker to it. Use the
   * returned {@link Subscription} to know whether more messages can come.
   *
   * @param output the hand-off queue
   * @return the subscription handle
   * @throws AmqpException.AmqpResourceInvalidStateException if the queue is already consuming or
   *     is terminated
   */
  Subscription subscribe(BlockingQueue<Message> output);

  /**
   * The consumption state.
   *
   * @return consumption state
   */
  ConsumptionState consumptionState();

  /**
   * Cancel the consumer, close the exchange and wait for the broker to confirm the channel
   * closure.
   *
   * <p>No message is handed off after this method returns. Messages already handed off may still
   * be unacknowledged: they are requeued by the broker as the channel is closed.
   */
  @Override
  void close();

  /** Consumption state. */
  enum ConsumptionState {
    /** No subscription yet. */
    UNBOUND,
    /** Bound to the exchange and consuming. */
    CONSUMING,
    /** Consumption stopped, cannot start again. */
    TERMINATED
  }

  /** Queue information. */
  interface QueueInfo {

    /**
     * The queue name.
     *
     * @return name
     */
    String name();

    /**
     * The number of messages ready for delivery.
     *
     * @return message count
     */
    long messageCount();

    /**
     * The number of active consumers.
     *
     * @return consumer count
     */
    int consumerCount();
  }
}
