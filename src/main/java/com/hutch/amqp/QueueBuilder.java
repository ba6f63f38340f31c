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
 * Builder for {@link Queue} instances.
 *
 * <p>Defaults: durable, not auto-delete, empty routing key, no prefetch limit.
 *
 * @see Exchange#queueBuilder()
 */
public interface QueueBuilder {

  /**
   * The queue name.
   *
   * @param name queue name
   * @return this builder instance
   */
  QueueBuilder name(String name);

  /**
   * Whether the queue survives a broker restart.
   *
   * @param durable durable flag
   * @return this builder instance
   */
  QueueBuilder durable(boolean durable);

  /**
   * Whether the queue is deleted when its last consumer is cancelled.
   *
   * @param autoDelete auto-delete flag
   * @return this builder instance
   */
  QueueBuilder autoDelete(boolean autoDelete);

  /**
   * The routing key to bind the queue with.
   *
   * @param routingKey routing key
   * @return this builder instance
   */
  QueueBuilder routingKey(String routingKey);

  /**
   * Maximum number of unacknowledged deliveries.
   *
   * <p>The limit applies to the whole channel of the exchange, that is to all its queues.
   *
   * @param prefetchCount prefetch count, 0 means no limit
   * @return this builder instance
   */
  QueueBuilder prefetchCount(int prefetchCount);

  /**
   * Maximum size in bytes of unacknowledged deliveries.
   *
   * <p>The limit applies to the whole channel of the exchange, that is to all its queues.
   *
   * @param prefetchSize prefetch size, 0 means no limit
   * @return this builder instance
   */
  QueueBuilder prefetchSize(int prefetchSize);

  /**
   * Add {@link Resource.StateListener}s to the queue.
   *
   * @param listeners listeners
   * @return this builder instance
   */
  QueueBuilder listeners(Resource.StateListener... listeners);

  /**
   * Declare the queue and return it.
   *
   * @return the queue
   */
  Queue build();
}
