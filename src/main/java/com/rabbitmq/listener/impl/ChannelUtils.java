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
package com.rabbitmq.listener.impl;

import com.rabbitmq.listener.Channel;
import java.io.IOException;
import java.util.Collection;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

final class ChannelUtils {

  private static final Logger LOGGER = LoggerFactory.getLogger(ChannelUtils.class);

  private ChannelUtils() {}

  static void closeChannel(Channel channel) {
    if (channel != null) {
      try {
        channel.close();
      } catch (Exception e) {
        LOGGER.debug("Unexpected exception on closing channel: {}", e.getMessage());
      }
    }
  }

  static void commitIfNecessary(Channel channel) {
    try {
      channel.txCommit();
    } catch (IOException e) {
      throw ExceptionUtils.convert(e, "Error while committing transaction");
    }
  }

  static void rollbackIfNecessary(Channel channel) {
    try {
      channel.txRollback();
    } catch (IOException e) {
      throw ExceptionUtils.convert(e, "Error while rolling back transaction");
    }
  }

  /**
   * Cancel the consumer tags, then commit the channel if it is transactional.
   *
   * @return true if the cancellations have been sent to the broker
   */
  static boolean closeMessageConsumer(
      Channel channel, Collection<String> consumerTags, boolean transactional) {
    if (!channel.isOpen()) {
      return false;
    }
    try {
      for (String consumerTag : consumerTags) {
        channel.basicCancel(consumerTag);
      }
      if (transactional) {
        channel.txCommit();
      }
      return true;
    } catch (IOException | RuntimeException e) {
      LOGGER.warn("Error while cancelling consumer {}: {}", consumerTags, e.getMessage());
      return false;
    }
  }
}
