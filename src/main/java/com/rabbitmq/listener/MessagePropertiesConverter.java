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

/** Strategy to create the application-level {@link MessageProperties} of a delivery. */
@FunctionalInterface
public interface MessagePropertiesConverter {

  /**
   * Convert the protocol header of a delivery.
   *
   * @param source the content header
   * @param envelope the delivery metadata
   * @param charset the charset to decode textual values with
   * @return the message properties
   */
  MessageProperties toMessageProperties(BasicProperties source, Envelope envelope, String charset);
}
