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
package com.rabbitmq.listener;

/**
 * Acknowledgment discipline of a {@link BlockingConsumer}.
 *
 * @see BlockingConsumerBuilder#acknowledgeMode(AcknowledgeMode)
 */
public enum AcknowledgeMode {

  /**
   * No acknowledgment.
   *
   * <p>The broker considers a message acknowledged as soon as it is sent (<code>autoAck=true
   * </code> at consume time). The consumer does not track delivery tags.
   */
  NONE,

  /**
   * Automatic acknowledgment.
   *
   * <p>The consumer tracks delivery tags, acknowledges them when processing succeeds and rejects
   * them when processing fails.
   */
  AUTO,

  /**
   * Manual acknowledgment.
   *
   * <p>The application acknowledges messages itself. The consumer tracks delivery tags only to
   * reset its state at transaction boundaries.
   */
  MANUAL;

  /**
   * Whether the broker must consider messages acknowledged on delivery.
   *
   * @return true for {@link #NONE}
   */
  public boolean isAutoAck() {
    return this == NONE;
  }

  /**
   * Whether the application is responsible for acknowledgments.
   *
   * @return true for {@link #MANUAL}
   */
  public boolean isManual() {
    return this == MANUAL;
  }

  /**
   * Whether the consumer acknowledges and rejects messages on behalf of the application.
   *
   * @return true for {@link #AUTO}
   */
  public boolean requiresAck() {
    return !isAutoAck() && !isManual();
  }

  /**
   * Whether the mode can take part in a channel transaction.
   *
   * @return false for {@link #NONE}
   */
  public boolean isTransactionAllowed() {
    return this != NONE;
  }
}
