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
 * Callback invoked when the broker-side delivery stream of a subscription ends without {@link
 * Queue#close()} being called, e.g. after a connection loss or when the queue is deleted.
 *
 * <p>The handler is invoked at most once per subscription, from a thread of the client library.
 * Reconnection is the responsibility of the application.
 *
 * @see ExchangeBuilder#disconnectHandler(DisconnectHandler)
 * @see Subscription#termination()
 */
@FunctionalInterface
public interface DisconnectHandler {

  /**
   * Handle the disconnection.
   *
   * @param context disconnection context
   */
  void handle(Context context);

  /** Disconnection context. */
  interface Context {

    /**
     * The exchange of the subscription.
     *
     * @return exchange
     */
    Exchange exchange();

    /**
     * The queue of the subscription.
     *
     * @return queue
     */
    Queue queue();

    /**
     * The reason of the disconnection, can be null when the broker cancelled the consumer.
     *
     * @return the cause
     */
    Throwable cause();
  }
}
