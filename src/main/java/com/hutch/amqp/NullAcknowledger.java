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

import java.util.concurrent.atomic.AtomicReference;

/**
 * {@link Acknowledger} that records the decision in memory instead of sending it to the broker.
 *
 * <p>Useful to test message handling code: wrap a payload in a message backed by this class with
 * a {@link MessageBuilder}, run the code under test, then check {@link #acknowledgement()}.
 *
 * <p>This class is thread-safe.
 */
public class NullAcknowledger implements Acknowledger {

  private final AtomicReference<Acknowledgement> acknowledgement =
      new AtomicReference<>(Acknowledgement.UNACKNOWLEDGED);

  @Override
  public void ack() {
    this.settle(Acknowledgement.ACKED);
  }

  @Override
  public void nack(boolean requeue) {
    this.settle(requeue ? Acknowledgement.REQUEUED : Acknowledgement.DROPPED);
  }

  /**
   * Whether {@link #ack()} or {@link #nack(boolean)} has been called.
   *
   * @return true if the decision is recorded
   */
  public boolean acked() {
    return this.acknowledgement.get() != Acknowledgement.UNACKNOWLEDGED;
  }

  /**
   * The recorded decision.
   *
   * @return the decision, {@link Acknowledgement#UNACKNOWLEDGED} if none yet
   */
  public Acknowledgement acknowledgement() {
    return this.acknowledgement.get();
  }

  private void settle(Acknowledgement decision) {
    if (!this.acknowledgement.compareAndSet(Acknowledgement.UNACKNOWLEDGED, decision)) {
      throw new AmqpException.AmqpAlreadyAcknowledgedException(
          "Message already acknowledged (%s)", this.acknowledgement.get());
    }
  }

  @Override
  public String toString() {
    return "NullAcknowledger{" + "acknowledgement=" + acknowledgement.get() + '}';
  }
}
