// Copyright (c) 2025 Broadcom. All Rights Reserved.
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
package com.rabbitmq.listener.metrics;

/** Interface to collect execution data of the consumers. */
public interface MetricsCollector {

  /** Called when a {@link com.rabbitmq.listener.BlockingConsumer} is started. */
  void openConsumer();

  /** Called when a started {@link com.rabbitmq.listener.BlockingConsumer} is stopped. */
  void closeConsumer();

  /**
   * Called when a {@link com.rabbitmq.listener.Message} is handed to the application by a {@link
   * com.rabbitmq.listener.BlockingConsumer}.
   */
  void consume();

  /**
   * Called when a {@link com.rabbitmq.listener.Message} is settled by a {@link
   * com.rabbitmq.listener.BlockingConsumer}.
   *
   * @param disposition disposition (outcome)
   */
  void consumeDisposition(ConsumeDisposition disposition);

  /** The client-to-broker dispositions. */
  enum ConsumeDisposition {
    /** The message has been acknowledged. */
    ACCEPTED,
    /** The message has been rejected without requeueing. */
    DISCARDED,
    /** The message has been rejected and requeued. */
    REQUEUED
  }
}
