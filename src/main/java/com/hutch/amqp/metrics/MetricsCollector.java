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
package com.hutch.amqp.metrics;

/** Interface to collect execution data of the client. */
public interface MetricsCollector {

  /** Called when a new {@link com.hutch.amqp.Exchange} is opened. */
  void openExchange();

  /** Called when a {@link com.hutch.amqp.Exchange} is closed. */
  void closeExchange();

  /** Called when a {@link com.hutch.amqp.Queue} starts consuming. */
  void openSubscription();

  /** Called when a {@link com.hutch.amqp.Queue} stops consuming. */
  void closeSubscription();

  /**
   * Called when a message is published.
   *
   * @param persistent whether the message is persistent
   */
  void publish(boolean persistent);

  /** Called when a message is handed off to the application. */
  void consume();

  /**
   * Called when a message is settled by the application.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** see {@link com.hutch.amqp.Acknowledger#ack()} */
    ACKED,
    /** see {@link com.hutch.amqp.Acknowledger#nack(boolean)} with requeue */
    REQUEUED,
    /** see {@link com.hutch.amqp.Acknowledger#nack(boolean)} without requeue */
    DROPPED
  }
}
