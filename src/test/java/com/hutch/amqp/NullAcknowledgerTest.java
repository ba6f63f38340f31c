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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;

import com.hutch.amqp.impl.AmqpMessageBuilder;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.CsvSource;

public class NullAcknowledgerTest {

  @Test
  void freshInstanceShouldBeUnacknowledged() {
    NullAcknowledger acknowledger = new NullAcknowledger();
    assertThat(acknowledger.acked()).isFalse();
    assertThat(acknowledger.acknowledgement()).isEqualTo(Acknowledgement.UNACKNOWLEDGED);
  }

  @Test
  void ackShouldBeRecordedOnce() {
    NullAcknowledger acknowledger = new NullAcknowledger();
    acknowledger.ack();
    assertThat(acknowledger.acked()).isTrue();
    assertThat(acknowledger.acknowledgement()).isEqualTo(Acknowledgement.ACKED);

    assertThatThrownBy(acknowledger::ack)
        .isInstanceOf(AmqpException.AmqpAlreadyAcknowledgedException.class)
        .hasMessageContaining("already acknowledged");
    assertThatThrownBy(() -> acknowledger.nack(true))
        .isInstanceOf(AmqpException.AmqpAlreadyAcknowledgedException.class);
    assertThat(acknowledger.acknowledgement()).isEqualTo(Acknowledgement.ACKED);
  }

  @ParameterizedTest
  @CsvSource({"true,REQUEUED", "false,DROPPED"})
  void nackShouldRecordRequeueDecision(boolean requeue, Acknowledgement expected) {
    NullAcknowledger acknowledger = new NullAcknowledger();
    acknowledger.nack(requeue);
    assertThat(acknowledger.acked()).isTrue();
    assertThat(acknowledger.acknowledgement()).isEqualTo(expected);
    assertThatThrownBy(acknowledger::ack)
        .isInstanceOf(AmqpException.AmqpAlreadyAcknowledgedException.class);
    assertThat(acknowledger.acknowledgement()).isEqualTo(expected);
  }

  @Test
  void onlyOneConcurrentDecisionShouldWin() throws Exception {
    int threads = 8;
    NullAcknowledger acknowledger = new NullAcknowledger();
    AtomicInteger successes = new AtomicInteger();
    AtomicInteger failures = new AtomicInteger();
    CountDownLatch start = new CountDownLatch(1);
    ExecutorService executorService = Executors.newFixedThreadPool(threads);
    try {
      for (int i = 0; i < threads; i++) {
        boolean ack = i % 2 == 0;
        executorService.submit(
            () -> {
              start.await();
              try {
                if (ack) {
                  acknowledger.ack();
                } else {
                  acknowledger.nack(false);
                }
                successes.incrementAndGet();
              } catch (AmqpException.AmqpAlreadyAcknowledgedException e) {
                failures.incrementAndGet();
              }
              return null;
            });
      }
      start.countDown();
      executorService.shutdown();
      assertThat(executorService.awaitTermination(10, TimeUnit.SECONDS)).isTrue();
    } finally {
      executorService.shutdownNow();
    }
    assertThat(successes).hasValue(1);
    assertThat(failures).hasValue(threads - 1);
    assertThat(acknowledger.acknowledgement())
        .isIn(Acknowledgement.ACKED, Acknowledgement.DROPPED);
  }

  @Test
  void messageBackedByNullAcknowledgerShouldRecordHandlerDecision() {
    NullAcknowledger acknowledger = new NullAcknowledger();
    Message message =
        new AmqpMessageBuilder()
            .acknowledger(acknowledger)
            .requestId("req-1")
            .header("retries", 2)
            .body("{\"id\":1}")
            .delivery(5, "hutch", "orders.created", false)
            .build();

    handle(message);

    assertThat(acknowledger.acknowledgement()).isEqualTo(Acknowledgement.DROPPED);
    assertThat(message.acknowledger()).isSameAs(acknowledger);
    assertThat(message.requestId()).isEqualTo("req-1");
    assertThat(message.header("retries")).isEqualTo(2);
    assertThat(message.contentType()).isEqualTo(Exchange.CONTENT_TYPE);
    assertThat(message.deliveryTag()).isEqualTo(5);
    assertThat(message.routingKey()).isEqualTo("orders.created");
    assertThatThrownBy(message::ack)
        .isInstanceOf(AmqpException.AmqpAlreadyAcknowledgedException.class);
  }

  @Test
  void builtMessageShouldDefaultToNullAcknowledger() {
    Message message = new AmqpMessageBuilder().build();
    assertThat(message.acknowledger()).isInstanceOf(NullAcknowledger.class);
    assertThat(message.headers()).isEmpty();
    assertThat(message.body()).isEmpty();
    message.ack();
    assertThat(((NullAcknowledger) message.acknowledger()).acknowledgement())
        .isEqualTo(Acknowledgement.ACKED);
  }

  private static void handle(Message message) {
    if (message.header("retries") instanceof Integer
        && (Integer) message.header("retries") >= 2) {
      message.nack(false);
    } else {
      message.ack();
    }
  }

  @Test
  void acknowledgementLabels() {
    assertThat(Acknowledgement.UNACKNOWLEDGED).hasToString("unacknowledged");
    assertThat(Acknowledgement.ACKED).hasToString("acked");
    assertThat(Acknowledgement.REQUEUED).hasToString("requeued");
    assertThat(Acknowledgement.DROPPED).hasToString("dropped");
  }
}
