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

import com.rabbitmq.listener.BasicProperties;
import com.rabbitmq.listener.Envelope;

/** A message as received from the broker, before conversion. */
final class Delivery {

  private final String consumerTag;
  private final Envelope envelope;
  private final BasicProperties properties;
  private final byte[] body;

  Delivery(String consumerTag, Envelope envelope, BasicProperties properties, byte[] body) {
    this.consumerTag = consumerTag;
    this.envelope = envelope;
    this.properties = properties;
    this.body = body;
  }

  String consumerTag() {
    return this.consumerTag;
  }

  Envelope envelope() {
    return this.envelope;
  }

  BasicProperties properties() {
    return this.properties;
  }

  byte[] body() {
    return this.body;
  }
}
