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

import io.micrometer.core.instrument.Counter;
import io.micrometer.core.instrument.MeterRegistry;
import io.micrometer.core.instrument.Tag;
import io.micrometer.core.instrument.Tags;
import java.util.Collections;
import java.util.concurrent.atomic.AtomicLong;

/**
 * {@link MetricsCollector} implementation using <a href="https://micrometer.io/">Micrometer</a>.
 */
public class MicrometerMetricsCollector implements MetricsCollector {

  private final AtomicLong exchanges;
  private final AtomicLong subscriptions;
  private final Counter publish, publishPersistent, publishTransient;
  private final Counter consume, consumeAcked, consumeRequeued, consumeDropped;

  public MicrometerMetricsCollector(MeterRegistry registry) {
    this(registry, "hutch.amqp");
  }

  public MicrometerMetricsCollector(final MeterRegistry registry, final String prefix) {
    this(registry, prefix, Collections.emptyList());
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final String... tags) {
    this(registry, prefix, Tags.of(tags));
  }

  public MicrometerMetricsCollector(
      final MeterRegistry registry, final String prefix, final Iterable<Tag> tags) {
    this.exchanges = registry.gauge(prefix + ".exchanges", tags, new AtomicLong(0));
    this.subscriptions = registry.gauge(prefix + ".subscriptions", tags, new AtomicLong(0));
    this.publish = registry.counter(prefix + ".published", tags);
    this.publishPersistent = registry.counter(prefix + ".published_persistent", tags);
    this.publishTransient = registry.counter(prefix + ".published_transient", tags);
    this.consume = registry.counter(prefix + ".consumed", tags);
    this.consumeAcked = registry.counter(prefix + ".consumed_acked", tags);
    this.consumeRequeued = registry.counter(prefix + ".consumed_requeued", tags);
    this.consumeDropped = registry.counter(prefix + ".consumed_dropped", tags);
  }

  @Override
  public void openExchange() {
    this.exchanges.incrementAndGet();
  }

  @Override
  public void closeExchange() {
    this.exchanges.decrementAndGet();
  }

  @Override
  public void openSubscription() {
    this.subscriptions.incrementAndGet();
  }

  @Override
  public void closeSubscription() {
    this.subscriptions.decrementAndGet();
  }

  @Override
  public void publish(boolean persistent) {
    this.publish.increment();
    if (persistent) {
      this.publishPersistent.increment();
    } else {
      this.publishTransient.increment();
    }
  }

  @Override
  public void consume() {
    this.consume.increment();
  }

  @Override
  public void consumeDisposition(ConsumeDisposition disposition) {
    switch (disposition) {
      case ACKED:
        this.consumeAcked.increment();
        break;
      case REQUEUED:
        this.consumeRequeued.increment();
        break;
      case DROPPED:
        this.consumeDropped.increment();
        break;
      default:
        break;
    }
  }
}
