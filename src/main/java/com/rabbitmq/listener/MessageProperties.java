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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.Map;

/** Application-level properties of a received {@link Message}. */
public class MessageProperties {

  private long deliveryTag;
  private boolean redelivered;
  private String receivedExchange;
  private String receivedRoutingKey;
  private String consumerTag;
  private String consumerQueue;
  private int messageCount;
  private String contentType;
  private String contentEncoding;
  private String messageId;
  private String correlationId;
  private String replyTo;
  private String type;
  private String appId;
  private Integer priority;
  private Integer deliveryMode;
  private Instant timestamp;
  private final Map<String, Object> headers = new LinkedHashMap<>();

  public long deliveryTag() {
    return this.deliveryTag;
  }

  public MessageProperties deliveryTag(long deliveryTag) {
    this.deliveryTag = deliveryTag;
    return this;
  }

  public boolean redelivered() {
    return this.redelivered;
  }

  public MessageProperties redelivered(boolean redelivered) {
    this.redelivered = redelivered;
    return this;
  }

  public String receivedExchange() {
    return this.receivedExchange;
  }

  public MessageProperties receivedExchange(String receivedExchange) {
    this.receivedExchange = receivedExchange;
    return this;
  }

  public String receivedRoutingKey() {
    return this.receivedRoutingKey;
  }

  public MessageProperties receivedRoutingKey(String receivedRoutingKey) {
    this.receivedRoutingKey = receivedRoutingKey;
    return this;
  }

  public String consumerTag() {
    return this.consumerTag;
  }

  public MessageProperties consumerTag(String consumerTag) {
    this.consumerTag = consumerTag;
    return this;
  }

  public String consumerQueue() {
    return this.consumerQueue;
  }

  public MessageProperties consumerQueue(String consumerQueue) {
    this.consumerQueue = consumerQueue;
    return this;
  }

  public int messageCount() {
    return this.messageCount;
  }

  public MessageProperties messageCount(int messageCount) {
    this.messageCount = messageCount;
    return this;
  }

  public String contentType() {
    return this.contentType;
  }

  public MessageProperties contentType(String contentType) {
    this.contentType = contentType;
    return this;
  }

  public String contentEncoding() {
    return this.contentEncoding;
  }

  public MessageProperties contentEncoding(String contentEncoding) {
    this.contentEncoding = contentEncoding;
    return this;
  }

  public String messageId() {
    return this.messageId;
  }

  public MessageProperties messageId(String messageId) {
    this.messageId = messageId;
    return this;
  }

  public String correlationId() {
    return this.correlationId;
  }

  public MessageProperties correlationId(String correlationId) {
    this.correlationId = correlationId;
    return this;
  }

  public String replyTo() {
    return this.replyTo;
  }

  public MessageProperties replyTo(String replyTo) {
    this.replyTo = replyTo;
    return this;
  }

  public String type() {
    return this.type;
  }

  public MessageProperties type(String type) {
    this.type = type;
    return this;
  }

  public String appId() {
    return this.appId;
  }

  public MessageProperties appId(String appId) {
    this.appId = appId;
    return this;
  }

  public Integer priority() {
    return this.priority;
  }

  public MessageProperties priority(Integer priority) {
    this.priority = priority;
    return this;
  }

  public Integer deliveryMode() {
    return this.deliveryMode;
  }

  public MessageProperties deliveryMode(Integer deliveryMode) {
    this.deliveryMode = deliveryMode;
    return this;
  }

  public Instant timestamp() {
    return this.timestamp;
  }

  public MessageProperties timestamp(Instant timestamp) {
    this.timestamp = timestamp;
    return this;
  }

  public Map<String, Object> headers() {
    return this.headers;
  }

  public MessageProperties header(String key, Object value) {
    this.headers.put(key, value);
    return this;
  }

  @Override
  public String toString() {
    return "MessageProperties{"
        + "deliveryTag="
        + Long.toUnsignedString(deliveryTag)
        + ", redelivered="
        + redelivered
        + ", receivedExchange='"
        + receivedExchange
        + '\''
        + ", receivedRoutingKey='"
        + receivedRoutingKey
        + '\''
        + ", consumerTag='"
        + consumerTag
        + '\''
        + ", consumerQueue='"
        + consumerQueue
        + '\''
        + ", contentType='"
        + contentType
        + '\''
        + ", messageId='"
        + messageId
        + '\''
        + ", headers="
        + headers
        + '}';
  }
}
