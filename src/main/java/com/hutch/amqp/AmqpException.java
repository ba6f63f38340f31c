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
package com.hutch.amqp;

/**
 * Base class of the exceptions thrown by the library.
 *
 * <p>Checked exceptions of the underlying AMQP 0-9-1 client are converted into instances of this
 * class or one of its subclasses, so callers can tell error kinds apart without inspecting reply
 * codes.
 */
public class AmqpException extends RuntimeException {

  public AmqpException(Throwable cause) {
    super(cause);
  }

  public AmqpException(String format, Object... args) {
    super(args == null || args.length == 0 ? format : String.format(format, args));
  }

  public AmqpException(String message, Throwable cause) {
    super(message, cause);
  }

  /** The connection cannot be established or has been lost. */
  public static class AmqpConnectionException extends AmqpException {

    public AmqpConnectionException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** An operation was attempted on a closed connection or channel. */
  public static class AmqpConnectionClosedException extends AmqpConnectionException {

    public AmqpConnectionClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AmqpSecurityException extends AmqpException {

    public AmqpSecurityException(String message, Throwable cause) {
      super(message, cause);
    }

    public AmqpSecurityException(Throwable cause) {
      super(cause);
    }
  }

  /** No SASL mechanism offered by the broker is supported by the client. */
  public static class AmqpSaslException extends AmqpSecurityException {

    public AmqpSaslException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The username or password is not accepted by the broker. */
  public static class AmqpCredentialsException extends AmqpSecurityException {

    public AmqpCredentialsException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The virtual host does not exist or the user cannot access it. */
  public static class AmqpVirtualHostException extends AmqpSecurityException {

    public AmqpVirtualHostException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** The broker closed the connection or the channel because of a protocol violation. */
  public static class AmqpProtocolException extends AmqpException {

    private final int replyCode;

    public AmqpProtocolException(int replyCode, String message, Throwable cause) {
      super(message, cause);
      this.replyCode = replyCode;
    }

    /**
     * The AMQP reply code.
     *
     * @return reply code
     */
    public int replyCode() {
      return this.replyCode;
    }
  }

  public static class AmqpSyntaxException extends AmqpProtocolException {

    public AmqpSyntaxException(int replyCode, String message, Throwable cause) {
      super(replyCode, message, cause);
    }
  }

  public static class AmqpFrameException extends AmqpProtocolException {

    public AmqpFrameException(int replyCode, String message, Throwable cause) {
      super(replyCode, message, cause);
    }
  }

  public static class AmqpCommandInvalidException extends AmqpProtocolException {

    public AmqpCommandInvalidException(int replyCode, String message, Throwable cause) {
      super(replyCode, message, cause);
    }
  }

  public static class AmqpUnexpectedFrameException extends AmqpProtocolException {

    public AmqpUnexpectedFrameException(int replyCode, String message, Throwable cause) {
      super(replyCode, message, cause);
    }
  }

  /** A header or argument value cannot be encoded in an AMQP field table. */
  public static class AmqpFieldTypeException extends AmqpException {

    public AmqpFieldTypeException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  public static class AmqpEntityNotFoundException extends AmqpException {

    public AmqpEntityNotFoundException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /**
   * An entity is re-declared with properties that do not match the existing one (e.g. a durable
   * queue declared as transient).
   */
  public static class AmqpPreconditionFailedException extends AmqpException {

    public AmqpPreconditionFailedException(String message, Throwable cause) {
      super(message, cause);
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
      super(message);
    }

    public AmqpResourceClosedException(String message, Throwable cause) {
      super(message, cause);
    }
  }

  /** A message has been acked or nacked more than once. */
  public static class AmqpAlreadyAcknowledgedException extends AmqpException {

    public AmqpAlreadyAcknowledgedException(String format, Object... args) {
      super(format, args);
    }
  }
}
