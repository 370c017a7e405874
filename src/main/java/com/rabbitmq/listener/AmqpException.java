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

public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The consumer could not prepare its queues (missing queue, access refused). */
  public static class AmqpSetupException extends AmqpException {

    public AmqpSetupException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A channel operation failed. */
  public static class AmqpIOException extends AmqpException {

    public AmqpIOException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AmqpSecurityException extends AmqpIOException {

    public AmqpSecurityException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AmqpEntityDoesNotExistException extends AmqpIOException {

    public AmqpEntityDoesNotExistException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * The channel of the consumer has been shut down, the consumer cannot retrieve messages anymore.
   */
  public static class AmqpShutdownException extends AmqpException {

    private final ShutdownSignalException signal;

    public AmqpShutdownException(ShutdownSignalException signal) {
      super("Shutdown event occurred. Cause: " + signal.getMessage(), signal);
      this.signal = signal;
    }

    public ShutdownSignalException signal() {
      return this.signal;
    }
  }

  /**
   * Exception for listener implementations to indicate the message must be rejected without
   * requeueing, in order to enable features like dead-lettering.
   */
  public static class AmqpRejectAndDontRequeueException extends AmqpException {

    public AmqpRejectAndDontRequeueException(String message) {
      super(message, (Throwable) null);
    }

    public AmqpRejectAndDontRequeueException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpRejectAndDontRequeueException(Throwable cause) {
      super(cause);
    }
  }

  public static class AmqpResourceInvalidStateException extends AmqpException {

    public AmqpResourceInvalidStateException(String format, Object... args) {
      super(format, args);
    }

    public AmqpResourceInvalidStateException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AmqpResourceClosedException extends AmqpResourceInvalidStateException {

    public AmqpResourceClosedException(String message) {
      super(message, (Throwable) null);
    }

    public AmqpResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }
}
