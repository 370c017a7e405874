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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Content header of a delivered message.
 *
 * <p>The consumer does not interpret it, it hands it to the {@link MessagePropertiesConverter}.
 */
public final class BasicProperties {

  public static final BasicProperties EMPTY = builder().build();

  private final String contentType;
  private final String contentEncoding;
  private final Map<String, Object> headers;
  private final Integer deliveryMode;
  private final Integer priority;
  private final String correlationId;
  private final String replyTo;
  private final String messageId;
  private final Instant timestamp;
  private final String type;
  private final String appId;

  private BasicProperties(Builder builder) {
    this.contentType = builder.contentType;
    this.contentEncoding = builder.contentEncoding;
    this.headers = Collections.unmodifiableMap(new LinkedHashMap<>(builder.headers));
    this.deliveryMode = builder.deliveryMode;
    this.priority = builder.priority;
    this.correlationId = builder.correlationId;
    this.replyTo = builder.replyTo;
    this.messageId = builder.messageId;
    this.timestamp = builder.timestamp;
    this.type = builder.type;
    this.appId = builder.appId;
  }

  public static Builder builder() {
    return new Builder();
  }

  public String contentType() {
    return this.contentType;
  }

  public String contentEncoding() {
    return this.contentEncoding;
  }

  public Map<String, Object> headers() {
    return this.headers;
  }

  public Integer deliveryMode() {
    return this.deliveryMode;
  }

  public Integer priority() {
    return this.priority;
  }

  public String correlationId() {
    return this.correlationId;
  }

  public String replyTo() {
    return this.replyTo;
  }

  public String messageId() {
    return this.messageId;
  }

  public Instant timestamp() {
    return this.timestamp;
  }

  public String type() {
    return this.type;
  }

  public String appId() {
    return this.appId;
  }

  @Override
  public String toString() {
    return "BasicProperties{"
        + "contentType='"
        + contentType
        + '\''
        + ", messageId='"
        + messageId
        + '\''
        + ", correlationId='"
        + correlationId
        + '\''
        + ", headers="
        + headers
        + '}';
  }

  public static final class Builder {

    private String contentType;
    private String contentEncoding;
    private final Map<String, Object> headers = new LinkedHashMap<>();
    private Integer deliveryMode;
    private Integer priority;
    private String correlationId;
    private String replyTo;
    private String messageId;
    private Instant timestamp;
    private String type;
    private String appId;

    private Builder() {}

    public Builder contentType(String contentType) {
      this.contentType = contentType;
      return this;
    }

    public Builder contentEncoding(String contentEncoding) {
      this.contentEncoding = contentEncoding;
      return this;
    }

    public Builder header(String key, Object value) {
      this.headers.put(key, value);
      return this;
    }

    public Builder headers(Map<String, Object> headers) {
      if (headers != null) {
        this.headers.putAll(headers);
      }
      return this;
    }

    public Builder deliveryMode(Integer deliveryMode) {
      this.deliveryMode = deliveryMode;
      return this;
    }

    public Builder priority(Integer priority) {
      this.priority = priority;
      return this;
    }

    public Builder correlationId(String correlationId) {
      this.correlationId = correlationId;
      return this;
    }

    public Builder replyTo(String replyTo) {
      this.replyTo = replyTo;
      return this;
    }

    public Builder messageId(String messageId) {
      this.messageId = messageId;
      return this;
    }

    public Builder timestamp(Instant timestamp) {
      this.timestamp = timestamp;
      return this;
    }

    public Builder type(String type) {
      this.type = type;
      return this;
    }

    public Builder appId(String appId) {
      this.appId = appId;
      return this;
    }

    public BasicProperties build() {
      return new BasicProperties(this);
    }
  }
}
