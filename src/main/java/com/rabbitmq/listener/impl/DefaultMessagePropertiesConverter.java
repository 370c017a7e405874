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
import com.rabbitmq.listener.MessageProperties;
import com.rabbitmq.listener.MessagePropertiesConverter;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * Copies the fields of the content header and of the envelope into {@link MessageProperties}.
 *
 * <p>Binary header values are decoded with the given charset, other header values are kept as-is.
 */
public class DefaultMessagePropertiesConverter implements MessagePropertiesConverter {

  @Override
  public MessageProperties toMessageProperties(
      BasicProperties source, Envelope envelope, String charset) {
    MessageProperties target = new MessageProperties();
    if (source != null) {
      target
          .contentType(source.contentType())
          .contentEncoding(source.contentEncoding())
          .messageId(source.messageId())
          .correlationId(source.correlationId())
          .replyTo(source.replyTo())
          .type(source.type())
          .appId(source.appId())
          .priority(source.priority())
          .deliveryMode(source.deliveryMode())
          .timestamp(source.timestamp());
      Charset headerCharset = charset == null ? StandardCharsets.UTF_8 : Charset.forName(charset);
      source
          .headers()
          .forEach(
              (key, value) -> {
                if (value instanceof byte[]) {
                  target.header(key, new String((byte[]) value, headerCharset));
                } else {
                  target.header(key, value);
                }
              });
    }
    if (envelope != null) {
      target
          .deliveryTag(envelope.deliveryTag())
          .redelivered(envelope.isRedelivered())
          .receivedExchange(envelope.exchange())
          .receivedRoutingKey(envelope.routingKey())
          .messageCount(envelope.messageCount());
    }
    return target;
  }
}
