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
 * Terminal shutdown of a connection or a channel.
 *
 * <p>Passed to {@link BasicConsumer#handleShutdownSignal(String, ShutdownSignalException)} and
 * used as the cause of the {@link java.io.IOException}s a {@link Channel} throws when the broker
 * closes it (e.g. <code>404 NOT_FOUND</code> on a passive queue declaration).
 */
public class ShutdownSignalException extends RuntimeException {

  public static final int REPLY_SUCCESS = 200;
  public static final int REPLY_ACCESS_REFUSED = 403;
  public static final int REPLY_NOT_FOUND = 404;

  private final boolean hardError;
  private final boolean initiatedByApplication;
  private final int replyCode;
  private final String replyText;

  public ShutdownSignalException(
      boolean hardError, boolean initiatedByApplication, int replyCode, String replyText) {
    this(hardError, initiatedByApplication, replyCode, replyText, null);
  }

  public ShutdownSignalException(
      boolean hardError,
      boolean initiatedByApplication,
      int replyCode,
      String replyText,
      Throwable cause) {
    super(composeMessage(hardError, initiatedByApplication, replyCode, replyText), cause);
    this.hardError = hardError;
    this.initiatedByApplication = initiatedByApplication;
    this.replyCode = replyCode;
    this.replyText = replyText;
  }

  /**
   * Whether the whole connection is shut down, not only the channel.
   *
   * @return true for a connection error
   */
  public boolean isHardError() {
    return this.hardError;
  }

  /**
   * Whether the application closed the connection or channel itself.
   *
   * @return true if initiated by the application
   */
  public boolean isInitiatedByApplication() {
    return this.initiatedByApplication;
  }

  public int replyCode() {
    return this.replyCode;
  }

  public String replyText() {
    return this.replyText;
  }

  private static String composeMessage(
      boolean hardError, boolean initiatedByApplication, int replyCode, String replyText) {
    return (hardError ? "connection" : "channel")
        + " error; initiated by "
        + (initiatedByApplication ? "application" : "broker")
        + "; reply-code="
        + replyCode
        + ", reply-text="
        + replyText;
  }
}
