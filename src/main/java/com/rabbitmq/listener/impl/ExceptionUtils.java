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

import com.rabbitmq.listener.AmqpException;
import com.rabbitmq.listener.ShutdownSignalException;
import java.io.IOException;

abstract class ExceptionUtils {

  private ExceptionUtils() {}

  static AmqpException convert(Exception e) {
    return convert(e, null);
  }

  static AmqpException convert(Exception e, String format, Object... args) {
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    }
    String message = format != null ? String.format(format, args) : e.getMessage();
    ShutdownSignalException signal = shutdownSignal(e);
    if (signal != null && signal.replyCode() == ShutdownSignalException.REPLY_ACCESS_REFUSED) {
      return new AmqpException.AmqpSecurityException(message, e);
    } else if (signal != null && signal.replyCode() == ShutdownSignalException.REPLY_NOT_FOUND) {
      return new AmqpException.AmqpEntityDoesNotExistException(message, e);
    } else if (e instanceof IOException || signal != null) {
      return new AmqpException.AmqpIOException(message, e);
    } else {
      return new AmqpException(message, e);
    }
  }

  /**
   * Rethrow the application exception, unchecked exceptions and errors as-is, checked exceptions
   * wrapped in an {@link AmqpException}.
   */
  static RuntimeException propagate(Throwable e) {
    if (e instanceof RuntimeException) {
      return (RuntimeException) e;
    } else if (e instanceof Error) {
      throw (Error) e;
    } else {
      return new AmqpException(e);
    }
  }

  static boolean isRejectAndDontRequeue(Throwable e) {
    Throwable current = e;
    while (current != null) {
      if (current instanceof AmqpException.AmqpRejectAndDontRequeueException) {
        return true;
      }
      current = current.getCause() == current ? null : current.getCause();
    }
    return false;
  }

  private static ShutdownSignalException shutdownSignal(Exception e) {
    if (e instanceof ShutdownSignalException) {
      return (ShutdownSignalException) e;
    } else if (e.getCause() instanceof ShutdownSignalException) {
      return (ShutdownSignalException) e.getCause();
    } else {
      return null;
    }
  }
}
