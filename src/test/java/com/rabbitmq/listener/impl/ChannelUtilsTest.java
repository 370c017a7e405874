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

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.doThrow;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

import com.rabbitmq.listener.AmqpException;
import com.rabbitmq.listener.Channel;
import java.io.IOException;
import java.util.List;
import org.junit.jupiter.api.Test;

public class ChannelUtilsTest {

  Channel channel = mock(Channel.class);

  @Test
  void closeMessageConsumerShouldCancelEachTag() throws IOException {
    when(channel.isOpen()).thenReturn(true);
    assertThat(ChannelUtils.closeMessageConsumer(channel, List.of("t1", "t2"), false)).isTrue();
    verify(channel).basicCancel("t1");
    verify(channel).basicCancel("t2");
    verify(channel, never()).txCommit();
  }

  @Test
  void closeMessageConsumerShouldDoNothingOnClosedChannel() throws IOException {
    when(channel.isOpen()).thenReturn(false);
    assertThat(ChannelUtils.closeMessageConsumer(channel, List.of("t1"), true)).isFalse();
    verify(channel, never()).basicCancel(anyString());
  }

  @Test
  void closeMessageConsumerShouldReportCancellationFailure() throws IOException {
    when(channel.isOpen()).thenReturn(true);
    doThrow(new IOException("closed")).when(channel).basicCancel("t1");
    assertThat(ChannelUtils.closeMessageConsumer(channel, List.of("t1"), true)).isFalse();
    verify(channel, never()).txCommit();
  }

  @Test
  void transactionFailuresShouldBeConverted() throws IOException {
    doThrow(new IOException("commit")).when(channel).txCommit();
    doThrow(new IOException("rollback")).when(channel).txRollback();
    assertThatThrownBy(() -> ChannelUtils.commitIfNecessary(channel))
        .isInstanceOf(AmqpException.AmqpIOException.class);
    assertThatThrownBy(() -> ChannelUtils.rollbackIfNecessary(channel))
        .isInstanceOf(AmqpException.AmqpIOException.class);
  }

  @Test
  void closeChannelShouldTolerateNullAndFailures() {
    ChannelUtils.closeChannel(null);
    doThrow(new IllegalStateException()).when(channel).close();
    ChannelUtils.closeChannel(channel);
    verify(channel).close();
  }
}
