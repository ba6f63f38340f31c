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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.*;

import com.hutch.amqp.AmqpException;
import com.hutch.amqp.DisconnectHandler;
import com.hutch.amqp.Exchange;
import com.hutch.amqp.Message;
import com.hutch.amqp.Queue;
import com.hutch.amqp.Subscription;
import com.hutch.amqp.metrics.MetricsCollector;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.Consumer;
import com.rabbitmq.client.Envelope;
import com.rabbitmq.client.ShutdownSignalException;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.ArrayBlockingQueue;
import java.util.concurrent.BlockingQueue;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.LinkedBlockingQueue;
import java.util.concurrent.TimeUnit;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.mockito.InOrder;

public class AmqpQueueTest {

  private static final String Q = "orders";

  BrokerMocks broker;
  MetricsCollector metrics;
  List<DisconnectHandler.Context> disconnections;
  Exchange exchange;
  ExecutorService executorService;

  @BeforeEach
  void init() throws Exception {
    broker = new BrokerMocks();
    metrics = mock(MetricsCollector.class);
    disconnections = new CopyOnWriteArrayList<>();
    exchange =
        new AmqpExchangeBuilder()
            .connectionFactory(broker.connectionFactory)
            .metricsCollector(metrics)
            .disconnectHandler(disconnections::add)
            .build();
    executorService = Executors.newSingleThreadExecutor();
  }

  @AfterEach
  void tearDown() {
    executorService.shutdownNow();
  }

  Queue queue() {
    return exchange.queueBuilder().name(Q).routingKey("orders.*").build();
  }

  @Test
  void buildShouldDeclareQueueWithDefaults() throws Exception {
    Queue queue = queue();
    assertThat(queue.name()).isEqualTo(Q);
    assertThat(queue.routingKey()).isEqualTo("orders.*");
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.UNBOUND);
    verify(broker.channel).queueDeclare(Q, true, false, false, null);
    verify(broker.channel, never()).basicQos(anyInt(), anyInt(), anyBoolean());
  }

  @Test
  void buildShouldApplyPrefetch() throws Exception {
    exchange
        .queueBuilder()
        .name(Q)
        .durable(false)
        .autoDelete(true)
        .prefetchCount(10)
        .prefetchSize(1024)
        .build();
    verify(broker.channel).queueDeclare(Q, false, false, true, null);
    verify(broker.channel).basicQos(1024, 10, false);
  }

  @Test
  void blankNameShouldUseServerGeneratedName() throws Exception {
    AMQP.Queue.DeclareOk declareOk = BrokerMocks.declareOk("amq.gen-123", 0, 0);
    doReturn(declareOk)
        .when(broker.channel)
        .queueDeclare(eq(""), anyBoolean(), anyBoolean(), anyBoolean(), any());
    Queue queue = exchange.queueBuilder().name("").build();
    assertThat(queue.name()).isEqualTo("amq.gen-123");
  }

  @Test
  void negativePrefetchShouldBeRejected() {
    assertThatThrownBy(() -> exchange.queueBuilder().name(Q).prefetchCount(-1))
        .isInstanceOf(IllegalArgumentException.class);
  }

  @Test
  void queueCannotBeCreatedOnClosedExchange() {
    exchange.close();
    assertThatThrownBy(this::queue)
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
  }

  @Test
  void purgeShouldReturnPurgedCount() throws Exception {
    AMQP.Queue.PurgeOk purgeOk = mock(AMQP.Queue.PurgeOk.class);
    when(purgeOk.getMessageCount()).thenReturn(42);
    when(broker.channel.queuePurge(Q)).thenReturn(purgeOk);
    assertThat(queue().purge()).isEqualTo(42);
  }

  @Test
  void inspectShouldReturnQueueInformation() throws Exception {
    AMQP.Queue.DeclareOk declareOk = BrokerMocks.declareOk(Q, 5, 1);
    when(broker.channel.queueDeclarePassive(Q)).thenReturn(declareOk);
    Queue.QueueInfo info = queue().inspect();
    assertThat(info.name()).isEqualTo(Q);
    assertThat(info.messageCount()).isEqualTo(5);
    assertThat(info.consumerCount()).isEqualTo(1);
  }

  @Test
  void operationsOnClosedExchangeShouldFail() {
    Queue queue = queue();
    exchange.close();
    assertThatThrownBy(queue::purge)
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThatThrownBy(queue::inspect)
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
    assertThatThrownBy(() -> queue.subscribe(new LinkedBlockingQueue<>()))
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
  }

  @Test
  void subscribeShouldBindAndConsumeWithExplicitAcks() throws Exception {
    Queue queue = queue();
    Subscription subscription = queue.subscribe(new LinkedBlockingQueue<>());
    verify(broker.channel).queueBind(Q, "hutch", "orders.*");
    assertThat(broker.consumer(Q)).isNotNull();
    assertThat(subscription.consumerTag()).isEqualTo(Q);
    assertThat(subscription.isActive()).isTrue();
    assertThat(subscription.queue()).isSameAs(queue);
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.CONSUMING);
    verify(metrics).openSubscription();
  }

  @Test
  void subscribingTwiceShouldFail() {
    Queue queue = queue();
    queue.subscribe(new LinkedBlockingQueue<>());
    assertThatThrownBy(() -> queue.subscribe(new LinkedBlockingQueue<>()))
        .isInstanceOf(AmqpException.AmqpResourceInvalidStateException.class);
  }

  @Test
  void failedSubscriptionShouldAllowNewAttempt() throws Exception {
    Queue queue = queue();
    doThrow(new IOException("bind failed"))
        .doReturn(null)
        .when(broker.channel)
        .queueBind(anyString(), anyString(), anyString());
    assertThatThrownBy(() -> queue.subscribe(new LinkedBlockingQueue<>()))
        .isInstanceOf(AmqpException.class);
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.UNBOUND);
    queue.subscribe(new LinkedBlockingQueue<>());
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.CONSUMING);
  }

  @Test
  void deliveriesShouldBeHandedOffInOrder() throws Exception {
    Queue queue = queue();
    BlockingQueue<Message> output = new LinkedBlockingQueue<>();
    queue.subscribe(output);
    Consumer consumer = broker.consumer(Q);
    for (int i = 1; i <= 3; i++) {
      deliver(consumer, i, "message " + i);
    }
    assertThat(output).hasSize(3);
    Message message = output.poll();
    assertThat(message.bodyAsString()).isEqualTo("message 1");
    assertThat(message.deliveryTag()).isEqualTo(1);
    assertThat(message.routingKey()).isEqualTo("orders.created");
    assertThat(message.exchange()).isEqualTo("hutch");
    assertThat(message.requestId()).isEqualTo("req-1");
    assertThat(output.poll().bodyAsString()).isEqualTo("message 2");
    assertThat(output.poll().bodyAsString()).isEqualTo("message 3");
    verify(metrics, times(3)).consume();
  }

  @Test
  void messageShouldBeAcknowledgedOnce() throws Exception {
    Queue queue = queue();
    BlockingQueue<Message> output = new LinkedBlockingQueue<>();
    queue.subscribe(output);
    Consumer consumer = broker.consumer(Q);
    deliver(consumer, 1, "first");
    deliver(consumer, 2, "second");

    Message first = output.poll();
    first.ack();
    assertThatThrownBy(first::ack)
        .isInstanceOf(AmqpException.AmqpAlreadyAcknowledgedException.class);
    assertThatThrownBy(() -> first.nack(true))
        .isInstanceOf(AmqpException.AmqpAlreadyAcknowledgedException.class);
    verify(broker.channel, times(1)).basicAck(1, false);
    verify(broker.channel, never()).basicNack(eq(1L), anyBoolean(), anyBoolean());

    output.poll().nack(false);
    verify(broker.channel).basicNack(2, false, false);
  }

  @Test
  void closeShouldCancelConsumerAndCloseExchange() throws Exception {
    Queue queue = queue();
    Subscription subscription = queue.subscribe(new LinkedBlockingQueue<>());
    queue.close();
    verify(broker.channel).basicCancel(Q);
    verify(broker.channel).close();
    verify(broker.connection).close();
    assertThat(exchange.isOpen()).isFalse();
    assertThat(subscription.isActive()).isFalse();
    assertThat(subscription.termination()).isCompleted();
    assertThat(subscription.termination().get().reason())
        .isEqualTo(Subscription.TerminationReason.CANCELLED);
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.TERMINATED);
    assertThat(disconnections).isEmpty();
    verify(metrics).closeSubscription();
    assertThatThrownBy(() -> queue.subscribe(new LinkedBlockingQueue<>()))
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
  }

  @Test
  void closeWithoutSubscriptionShouldCloseExchange() throws Exception {
    Queue queue = queue();
    queue.close();
    verify(broker.channel, never()).basicCancel(anyString());
    verify(broker.channel).close();
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.TERMINATED);
  }

  @Test
  void closeShouldBeIdempotent() throws Exception {
    Queue queue = queue();
    queue.subscribe(new LinkedBlockingQueue<>());
    queue.close();
    queue.close();
    verify(broker.channel, times(1)).basicCancel(Q);
    verify(broker.channel, times(1)).close();
  }

  @Test
  void nothingShouldBeHandedOffAfterClose() throws Exception {
    Queue queue = queue();
    BlockingQueue<Message> output = new ArrayBlockingQueue<>(1);
    queue.subscribe(output);
    Consumer consumer = broker.consumer(Q);
    deliver(consumer, 1, "fills the output");
    // blocks as the output is full
    Future<?> blockedDelivery = executorService.submit(() -> deliver(consumer, 2, "blocked"));
    TestUtils.simulateActivity(200);
    assertThat(blockedDelivery).isNotDone();

    queue.close();

    blockedDelivery.get(10, TimeUnit.SECONDS);
    deliver(consumer, 3, "late");
    assertThat(output).hasSize(1);
    assertThat(output.poll().bodyAsString()).isEqualTo("fills the output");
    verify(metrics, times(1)).consume();
  }

  @Test
  void closeShouldFailWhenBrokerClosesChannel() throws Exception {
    Queue queue = queue();
    queue.subscribe(new LinkedBlockingQueue<>());
    broker.brokerClosesOnClose();
    assertThatThrownBy(queue::close).isInstanceOf(AmqpException.class);
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.TERMINATED);
    assertThat(disconnections).isEmpty();
  }

  @Test
  void closeShouldCloseExchangeWhenCancelFails() throws Exception {
    Queue queue = queue();
    queue.subscribe(new LinkedBlockingQueue<>());
    doThrow(new IOException("cancel failed")).when(broker.channel).basicCancel(Q);
    assertThatThrownBy(queue::close)
        .isInstanceOf(AmqpException.class)
        .hasMessageContaining("cancel");
    verify(broker.channel).close();
    verify(broker.connection).close();
  }

  @Test
  void closeAfterConnectionLossShouldNotFail() throws Exception {
    Queue queue = queue();
    queue.subscribe(new LinkedBlockingQueue<>());
    ShutdownSignalException signal = broker.shutdown(false, null);
    broker.consumer(Q).handleShutdownSignal(Q, signal);
    queue.close();
    verify(broker.channel, never()).basicCancel(anyString());
    assertThat(disconnections).hasSize(1);
  }

  @Test
  void connectionLossShouldInvokeDisconnectHandlerOnce() throws Exception {
    Queue queue = queue();
    BlockingQueue<Message> output = new LinkedBlockingQueue<>();
    Subscription subscription = queue.subscribe(output);
    Consumer consumer = broker.consumer(Q);
    deliver(consumer, 1, "in flight");

    ShutdownSignalException signal =
        broker.shutdown(false, BrokerMocks.reason(AMQP.NOT_FOUND));
    consumer.handleShutdownSignal(Q, signal);
    consumer.handleShutdownSignal(Q, signal);

    assertThat(disconnections).hasSize(1);
    DisconnectHandler.Context context = disconnections.get(0);
    assertThat(context.exchange()).isSameAs(exchange);
    assertThat(context.queue()).isSameAs(queue);
    assertThat(context.cause()).isInstanceOf(AmqpException.AmqpEntityNotFoundException.class);

    Subscription.Termination termination = subscription.termination().get();
    assertThat(termination.reason()).isEqualTo(Subscription.TerminationReason.DISCONNECTED);
    assertThat(termination.cause()).isSameAs(context.cause());
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.TERMINATED);
    assertThat(exchange.isOpen()).isFalse();

    // messages handed off before the disconnection are still readable
    assertThat(subscription.next(Duration.ofMillis(100)).bodyAsString()).isEqualTo("in flight");
    assertThatThrownBy(() -> subscription.next(Duration.ofMillis(100)))
        .isInstanceOf(AmqpException.AmqpResourceClosedException.class);
  }

  @Test
  void closingQueueShouldReportDisconnectionOfQueueSharingExchange() throws Exception {
    Queue orders = queue();
    Queue payments = exchange.queueBuilder().name("payments").build();
    Subscription ordersSubscription = orders.subscribe(new LinkedBlockingQueue<>());
    Subscription paymentsSubscription = payments.subscribe(new LinkedBlockingQueue<>());
    Consumer ordersConsumer = broker.consumer(Q);
    Consumer paymentsConsumer = broker.consumer("payments");

    orders.close();
    // the client notifies every consumer of the closed channel
    ShutdownSignalException signal = broker.shutdown(true, null);
    ordersConsumer.handleShutdownSignal(Q, signal);
    paymentsConsumer.handleShutdownSignal("payments", signal);

    assertThat(ordersSubscription.termination().get().reason())
        .isEqualTo(Subscription.TerminationReason.CANCELLED);
    assertThat(paymentsSubscription.termination().get().reason())
        .isEqualTo(Subscription.TerminationReason.DISCONNECTED);
    assertThat(payments.consumptionState()).isEqualTo(Queue.ConsumptionState.TERMINATED);
    assertThat(disconnections).hasSize(1);
    assertThat(disconnections.get(0).queue()).isSameAs(payments);
    assertThat(disconnections.get(0).exchange()).isSameAs(exchange);
  }

  @Test
  void subscriptionShouldBeCountedBeforeConsumerCanTerminate() throws Exception {
    doAnswer(
            invocation -> {
              Consumer consumer = invocation.getArgument(6);
              consumer.handleCancel(Q);
              return Q;
            })
        .when(broker.channel)
        .basicConsume(
            anyString(),
            anyBoolean(),
            anyString(),
            anyBoolean(),
            anyBoolean(),
            any(),
            any(Consumer.class));
    Subscription subscription = queue().subscribe(new LinkedBlockingQueue<>());
    assertThat(subscription.isActive()).isFalse();
    InOrder inOrder = inOrder(metrics);
    inOrder.verify(metrics).openSubscription();
    inOrder.verify(metrics).closeSubscription();
    verify(metrics, times(1)).closeSubscription();
  }

  @Test
  void failedConsumeShouldReleaseSubscriptionCount() throws Exception {
    doThrow(new IOException("consume failed"))
        .when(broker.channel)
        .basicConsume(
            anyString(),
            anyBoolean(),
            anyString(),
            anyBoolean(),
            anyBoolean(),
            any(),
            any(Consumer.class));
    Queue queue = queue();
    assertThatThrownBy(() -> queue.subscribe(new LinkedBlockingQueue<>()))
        .isInstanceOf(AmqpException.class);
    verify(metrics, times(1)).openSubscription();
    verify(metrics, times(1)).closeSubscription();
    assertThat(queue.consumptionState()).isEqualTo(Queue.ConsumptionState.UNBOUND);
  }

  @Test
  void brokerCancelShouldInvokeDisconnectHandler() throws Exception {
    Queue queue = queue();
    Subscription subscription = queue.subscribe(new LinkedBlockingQueue<>());
    broker.consumer(Q).handleCancel(Q);
    assertThat(disconnections).hasSize(1);
    assertThat(disconnections.get(0).cause()).isNull();
    assertThat(subscription.termination().get().reason())
        .isEqualTo(Subscription.TerminationReason.DISCONNECTED);
    assertThat(subscription.isActive()).isFalse();
  }

  @Test
  void disconnectHandlerFailureShouldNotPropagate() throws Exception {
    Exchange failingExchange =
        new AmqpExchangeBuilder()
            .connectionFactory(broker.connectionFactory)
            .disconnectHandler(
                context -> {
                  throw new IllegalStateException("handler failure");
                })
            .build();
    Queue queue = failingExchange.queueBuilder().name(Q).build();
    Subscription subscription = queue.subscribe(new LinkedBlockingQueue<>());
    broker.consumer(Q).handleCancel(Q);
    assertThat(subscription.termination()).isCompleted();
  }

  @Test
  void nextShouldReturnNullOnTimeoutWhileActive() {
    Queue queue = queue();
    Subscription subscription = queue.subscribe(new LinkedBlockingQueue<>());
    assertThat(subscription.next(Duration.ofMillis(50))).isNull();
  }

  static void deliver(Consumer consumer, long tag, String body) {
    try {
      AMQP.BasicProperties properties =
          new AMQP.BasicProperties.Builder()
              .contentType("application/json")
              .headers(Map.of("request_id", "req-" + tag))
              .build();
      consumer.handleDelivery(
          Q,
          new Envelope(tag, false, "hutch", "orders.created"),
          properties,
          body.getBytes(StandardCharsets.UTF_8));
    } catch (IOException e) {
      throw new RuntimeException(e);
    }
  }
}
