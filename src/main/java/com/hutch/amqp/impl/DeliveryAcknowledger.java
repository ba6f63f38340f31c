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
import com.hutch.amqp.AmqpException;
import com.hutch.amqp.metrics.MetricsCollector;
import com.rabbitmq.client.Channel;
import java.io.IOException;
import java.util.concurrent.atomic.AtomicBoolean;

final class DeliveryAcknowledger implements Acknowledger {

  private final Channel channel;
  private final long deliveryTag;
  private final MetricsCollector metricsCollector;
  private final AtomicBoolean settled = new AtomicBoolean(false);

  DeliveryAcknowledger(Channel channel, long deliveryTag, MetricsCollector metricsCollector) {
    this.channel = channel;
    this.deliveryTag = deliveryTag;
    this.metricsCollector = metricsCollector;
  }

  @Override
  public void ack() {
    checkNotSettled();
    try {
      this.channel.basicAck(this.deliveryTag, false);
    } catch (IOException | RuntimeException e) {
      throw ExceptionUtils.convert(e, "Error while acking message %d", this.deliveryTag);
    }
    this.metricsCollector.consumeDisposition(MetricsCollector.ConsumeDisposition.ACKED);
  }

  @Override
  public void nack(boolean requeue) {
    checkNotSettled();
    try {
      this.channel.basicNack(this.deliveryTag, false, requeue);
    } catch (IOException | RuntimeException e) {
      throw ExceptionUtils.convert(e, "Error while nacking message %d", this.deliveryTag);
    }
    this.metricsCollector.consumeDisposition(
        requeue
            ? MetricsCollector.ConsumeDisposition.REQUEUED
            : MetricsCollector.ConsumeDisposition.DROPPED);
  }

  private void checkNotSettled() {
    // the broker closes the channel on a second ack of the same tag
    if (!this.settled.compareAndSet(false, true)) {
      throw new AmqpException.AmqpAlreadyAcknowledgedException(
          "Message %d already acknowledged", this.deliveryTag);
    }
  }

  long deliveryTag() {
    return this.deliveryTag;
  }
}
