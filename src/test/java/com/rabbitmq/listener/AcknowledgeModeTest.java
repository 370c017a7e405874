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

import static org.assertj.core.api.Assertions.assertThat;

import org.junit.jupiter.api.Test;

public class AcknowledgeModeTest {

  @Test
  void none() {
    assertThat(AcknowledgeMode.NONE.isAutoAck()).isTrue();
    assertThat(AcknowledgeMode.NONE.isManual()).isFalse();
    assertThat(AcknowledgeMode.NONE.requiresAck()).isFalse();
    assertThat(AcknowledgeMode.NONE.isTransactionAllowed()).isFalse();
  }

  @Test
  void auto() {
    assertThat(AcknowledgeMode.AUTO.isAutoAck()).isFalse();
    assertThat(AcknowledgeMode.AUTO.isManual()).isFalse();
    assertThat(AcknowledgeMode.AUTO.requiresAck()).isTrue();
    assertThat(AcknowledgeMode.AUTO.isTransactionAllowed()).isTrue();
  }

  @Test
  void manual() {
    assertThat(AcknowledgeMode.MANUAL.isAutoAck()).isFalse();
    assertThat(AcknowledgeMode.MANUAL.isManual()).isTrue();
    assertThat(AcknowledgeMode.MANUAL.requiresAck()).isFalse();
    assertThat(AcknowledgeMode.MANUAL.isTransactionAllowed()).isTrue();
  }
}
