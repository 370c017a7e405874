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
 * Synchronization point of an externally managed transaction.
 *
 * <p>A transactional consumer that is not locally transacted registers its pending delivery tags
 * here instead of acknowledging them, the acknowledgment is sent when the external transaction
 * commits.
 */
@FunctionalInterface
public interface TransactionSynchronization {

  /**
   * Register a delivery tag to acknowledge when the external transaction commits.
   *
   * @param channel the channel the message has been delivered on
   * @param deliveryTag the delivery tag
   */
  void registerDeliveryTag(Channel channel, long deliveryTag);
}
