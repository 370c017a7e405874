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

import java.nio.charset.StandardCharsets;

/** A message handed to the application: raw body and {@link MessageProperties}. */
public final class Message {

  private static final int MAX_BODY_LENGTH_IN_TO_STRING = 50;

  private final byte[] body;
  private final MessageProperties properties;

  public Message(byte[] body, MessageProperties properties) {
    this.body = body == null ? new byte[0] : body;
    this.properties = properties == null ? new MessageProperties() : properties;
  }

  public byte[] body() {
    return this.body;
  }

  public MessageProperties properties() {
    return this.properties;
  }

  @Override
  public String toString() {
    return "Message(body='" + bodyAsString() + "', properties=" + this.properties + ")";
  }

  private String bodyAsString() {
    String contentType = this.properties.contentType();
    if (contentType != null && contentType.startsWith("text")) {
      String text = new String(this.body, StandardCharsets.UTF_8);
      return text.length() > MAX_BODY_LENGTH_IN_TO_STRING
          ? text.substring(0, MAX_BODY_LENGTH_IN_TO_STRING) + "..."
          : text;
    } else {
      return "[" + this.body.length + " byte(s)]";
    }
  }
}
