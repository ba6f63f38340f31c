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

import com.hutch.amqp.DisconnectHandler;
import java.time.Duration;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Supplier;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class Utils {

  static final String DEFAULT_URI = "amqp://localhost";
  static final String DEFAULT_EXCHANGE_NAME = "hutch";
  static final String DEFAULT_EXCHANGE_TYPE = "topic";

  static final int PERSISTENT_DELIVERY_MODE = 2;
  static final int TRANSIENT_DELIVERY_MODE = 1;

  static final int FAIL_FAST_EXIT_STATUS = 1;

  // how often a blocked hand-off checks the subscription is still active
  static final Duration HAND_OFF_CHECK_INTERVAL = Duration.ofMillis(100);

  static final Supplier<String> CONNECTION_NAME_SUPPLIER = new NameSupplier("hutch-amqp-");

  private static final Logger LOGGER = LoggerFactory.getLogger(Utils.class);

  static final DisconnectHandler FAIL_FAST_DISCONNECT_HANDLER =
      context -> {
        LOGGER.error(
            "Lost connection while consuming from queue '{}' of exchange '{}', exiting",
            context.queue().name(),
            context.exchange().name(),
            context.cause());
        Runtime.getRuntime().exit(FAIL_FAST_EXIT_STATUS);
      };

  private Utils() {}

  static boolean isBlank(String value) {
    return value == null || value.isBlank();
  }

  private static class NameSupplier implements Supplier<String> {

    private final String prefix;
    private final AtomicLong count = new AtomicLong(0);

    private NameSupplier(String prefix) {
      this.prefix = prefix;
    }

    @Override
    public String get() {
      return this.prefix + this.count.getAndIncrement();
    }
  }
}
