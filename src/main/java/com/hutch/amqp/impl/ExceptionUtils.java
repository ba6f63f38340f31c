// Copyright (c) 2024 Broadcom. All Rights Reserved.
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
package com.hutch.amqp.impl;

import com.hutch.amqp.AmqpException;
import com.rabbitmq.client.AMQP;
import com.rabbitmq.client.AlreadyClosedException;
import com.rabbitmq.client.AuthenticationFailureException;
import com.rabbitmq.client.MalformedFrameException;
import com.rabbitmq.client.Method;
import com.rabbitmq.client.PossibleAuthenticationFailureException;
import com.rabbitmq.client.ShutdownSignalException;
import com.rabbitmq.client.UnexpectedFrameError;
import java.io.IOException;
import java.net.ConnectException;
import java.net.SocketException;
import java.net.UnknownHostException;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeoutException;
import javax.net.ssl.SSLException;

abstract class ExceptionUtils {

  static final String NO_COMPATIBLE_SASL_MECHANISM = "No compatible authentication mechanism";
  static final String INVALID_FIELD_VALUE = "Invalid value type";

  private ExceptionUtils() {}

  static AmqpException convert(Exception e) {
    return convert(e, null);
  }

  static AmqpException convert(Exception e, String format, Object... args) {
    String message = format != null ? String.format(format, args) : null;
    return convert(e, message);
  }

  private static AmqpException convert(Throwable e, String message) {
    if (e instanceof AmqpException) {
      return (AmqpException) e;
    } else if (e instanceof ExecutionException && e.getCause() != null) {
      return convert(e.getCause(), message);
    } else if (e instanceof AuthenticationFailureException
        || e instanceof PossibleAuthenticationFailureException) {
      return new AmqpException.AmqpCredentialsException(message(message, e), e);
    } else if (e instanceof AlreadyClosedException) {
      return new AmqpException.AmqpConnectionClosedException(message(message, e), e);
    } else if (e instanceof ShutdownSignalException) {
      return convert((ShutdownSignalException) e, message(message, e), e);
    } else if (e instanceof IOException && e.getCause() instanceof ShutdownSignalException) {
      ShutdownSignalException sse = (ShutdownSignalException) e.getCause();
      return convert(sse, message(message, sse), e);
    } else if (e instanceof MalformedFrameException) {
      return new AmqpException.AmqpFrameException(AMQP.FRAME_ERROR, message(message, e), e);
    } else if (e instanceof UnexpectedFrameError) {
      return new AmqpException.AmqpUnexpectedFrameException(
          AMQP.UNEXPECTED_FRAME, message(message, e), e);
    } else if (e instanceof SSLException || e.getCause() instanceof SSLException) {
      return new AmqpException.AmqpSecurityException(message(message, e), e);
    } else if (isSaslFailure(e)) {
      return new AmqpException.AmqpSaslException(message(message, e), e);
    } else if (isNetworkError(e)) {
      return new AmqpException.AmqpConnectionException(message(message, e), e);
    } else if (e instanceof IllegalArgumentException
        && e.getMessage() != null
        && e.getMessage().startsWith(INVALID_FIELD_VALUE)) {
      return new AmqpException.AmqpFieldTypeException(message(message, e), e);
    } else {
      return new AmqpException(message(message, e), e);
    }
  }

  private static AmqpException convert(
      ShutdownSignalException sse, String message, Throwable cause) {
    int replyCode = replyCode(sse);
    switch (replyCode) {
      case AMQP.NOT_FOUND:
        return new AmqpException.AmqpEntityNotFoundException(message, cause);
      case AMQP.PRECONDITION_FAILED:
        return new AmqpException.AmqpPreconditionFailedException(message, cause);
      case AMQP.ACCESS_REFUSED:
        return new AmqpException.AmqpSecurityException(message, cause);
      case AMQP.NOT_ALLOWED:
        // also sent for e.g. a reused consumer tag
        if (isVirtualHostFailure(sse)) {
          return new AmqpException.AmqpVirtualHostException(message, cause);
        } else if (sse.isHardError()) {
          return new AmqpException.AmqpConnectionException(message, cause);
        } else {
          return new AmqpException(message, cause);
        }
      case AMQP.FRAME_ERROR:
        return new AmqpException.AmqpFrameException(replyCode, message, cause);
      case AMQP.SYNTAX_ERROR:
        return new AmqpException.AmqpSyntaxException(replyCode, message, cause);
      case AMQP.COMMAND_INVALID:
        return new AmqpException.AmqpCommandInvalidException(replyCode, message, cause);
      case AMQP.UNEXPECTED_FRAME:
        return new AmqpException.AmqpUnexpectedFrameException(replyCode, message, cause);
      default:
        if (sse.isHardError()) {
          return new AmqpException.AmqpConnectionException(message, cause);
        } else {
          return new AmqpException(message, cause);
        }
    }
  }

  /**
   * Reply code of the close method carried by the signal, -1 if there is none (e.g. network
   * failure).
   */
  static int replyCode(ShutdownSignalException sse) {
    Method reason = sse.getReason();
    if (reason instanceof AMQP.Channel.Close) {
      return ((AMQP.Channel.Close) reason).getReplyCode();
    } else if (reason instanceof AMQP.Connection.Close) {
      return ((AMQP.Connection.Close) reason).getReplyCode();
    } else {
      return -1;
    }
  }

  private static boolean isVirtualHostFailure(ShutdownSignalException sse) {
    String replyText = replyText(sse);
    return replyText != null
        && (replyText.contains("vhost") || replyText.contains("virtual host"));
  }

  private static String replyText(ShutdownSignalException sse) {
    Method reason = sse.getReason();
    if (reason instanceof AMQP.Channel.Close) {
      return ((AMQP.Channel.Close) reason).getReplyText();
    } else if (reason instanceof AMQP.Connection.Close) {
      return ((AMQP.Connection.Close) reason).getReplyText();
    } else {
      return null;
    }
  }

  private static String message(String message, Throwable e) {
    return message == null ? e.getMessage() : message;
  }

  private static boolean isSaslFailure(Throwable e) {
    return e instanceof IOException
        && e.getMessage() != null
        && e.getMessage().startsWith(NO_COMPATIBLE_SASL_MECHANISM);
  }

  private static boolean isNetworkError(Throwable e) {
    if (e instanceof ConnectException
        || e instanceof UnknownHostException
        || e instanceof SocketException
        || e instanceof TimeoutException) {
      return true;
    } else if (e.getCause() != null && e.getCause() != e) {
      return isNetworkError(e.getCause());
    } else {
      return false;
    }
  }
}
