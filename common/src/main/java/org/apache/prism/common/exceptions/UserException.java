/*
 * Licensed to the Apache Software Foundation (ASF) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  The ASF licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.apache.prism.common.exceptions;

import org.slf4j.Logger;

/**
 * Exception surfaced to the caller of the pruning engine. Only programming-contract violations
 * (for example refining a skipped unit of an access plan) are reported this way; statistics
 * problems are absorbed as "keep" decisions.
 * <p>Instances are created through the typed builders, e.g.
 * <pre>
 *   throw UserException.validationError()
 *       .message("Row group %d is skipped", index)
 *       .addContext("Pages", pageCount)
 *       .build(logger);
 * </pre>
 */
public class UserException extends PrismRuntimeException {
  private static final long serialVersionUID = 4129382093287651223L;

  /**
   * Category of the error. Decides the log level used when the exception is built.
   */
  public enum ErrorType {
    /** The caller violated an API contract. */
    VALIDATION,
    /** The requested operation is not supported. */
    UNSUPPORTED_OPERATION,
    /** Metadata could not be read. */
    DATA_READ,
    /** Unexpected internal failure. */
    SYSTEM
  }

  /**
   * Wraps the passed exception inside a validation error.
   *
   * @param cause exception we want the user exception to wrap. If cause is, or wraps, a user exception it will be
   *              returned by the builder instead of creating a new user exception
   * @return user exception builder
   */
  public static Builder validationError(Throwable cause) {
    return new Builder(ErrorType.VALIDATION, cause);
  }

  public static Builder validationError() {
    return validationError(null);
  }

  public static Builder unsupportedError(Throwable cause) {
    return new Builder(ErrorType.UNSUPPORTED_OPERATION, cause);
  }

  public static Builder unsupportedError() {
    return unsupportedError(null);
  }

  public static Builder dataReadError(Throwable cause) {
    return new Builder(ErrorType.DATA_READ, cause);
  }

  public static Builder dataReadError() {
    return dataReadError(null);
  }

  public static Builder systemError(Throwable cause) {
    return new Builder(ErrorType.SYSTEM, cause);
  }

  /**
   * Builder class for UserException. You can wrap an existing exception, in this case it will first check if
   * this exception is, or wraps, a UserException. If it does then the builder will use the user exception as it is
   * (it will ignore the message passed to the constructor) and will add any additional context information to the
   * exception's context
   */
  public static class Builder {

    private final Throwable cause;
    private final ErrorType errorType;
    private final UserException uex;
    private final UserExceptionContext context;

    private String message;

    private Builder(ErrorType errorType, Throwable cause) {
      this.cause = cause;

      uex = ErrorHelper.findWrappedUserException(cause);
      if (uex != null) {
        this.errorType = null;
        this.context = uex.context;
      } else {
        this.errorType = errorType;
        this.context = new UserExceptionContext();
        this.message = cause != null ? cause.getMessage() : null;
      }
    }

    /**
     * sets or replaces the error message.
     * <p>This will be ignored if this builder is wrapping a user exception
     *
     * @see String#format(String, Object...)
     *
     * @param format format string
     * @param args Arguments referenced by the format specifiers in the format string
     * @return this builder
     */
    public Builder message(String format, Object... args) {
      if (uex == null && format != null) {
        this.message = String.format(format, args);
      }
      return this;
    }

    public Builder addContext(String value) {
      context.add(value);
      return this;
    }

    public Builder addContext(String name, String value) {
      context.add(name, value);
      return this;
    }

    public Builder addContext(String name, long value) {
      context.add(name, value);
      return this;
    }

    public Builder pushContext(String value) {
      context.push(value);
      return this;
    }

    /**
     * builds a user exception or returns the wrapped one.
     *
     * @return user exception
     */
    public UserException build() {
      if (uex != null) {
        return uex;
      }

      if (errorType == ErrorType.SYSTEM) {
        message = ErrorHelper.getRootMessage(cause);
      }

      return new UserException(this);
    }

    /**
     * builds a user exception or returns the wrapped one and logs it.
     * System errors are logged as ERROR, everything else as INFO.
     *
     * @param logger the logger to write to
     * @return user exception
     */
    public UserException build(Logger logger) {
      UserException exception = build();
      if (exception != uex) {
        if (errorType == ErrorType.SYSTEM) {
          logger.error(exception.getMessage(), exception);
        } else {
          logger.info("User Error Occurred: {}", exception.getOriginalMessage(), exception);
        }
      }
      return exception;
    }
  }

  private final ErrorType errorType;

  private final UserExceptionContext context;

  private UserException(Builder builder) {
    super(builder.message, builder.cause);
    this.errorType = builder.errorType;
    this.context = builder.context;
  }

  /**
   * generates the message that will be displayed to the client without the stack trace.
   *
   * @return non verbose error message
   */
  @Override
  public String getMessage() {
    return generateMessage(true);
  }

  /**
   * @return the error message that was passed to the builder
   */
  public String getOriginalMessage() {
    return super.getMessage();
  }

  public ErrorType getErrorType() {
    return errorType;
  }

  public String getErrorId() {
    return context.getErrorId();
  }

  UserExceptionContext getContext() {
    return context;
  }

  /**
   * Generates a user error message that has the following structure:
   * ERROR TYPE ERROR: ERROR_MESSAGE
   * CONTEXT
   * [Error Id: ERROR_ID]
   */
  private String generateMessage(boolean includeErrorId) {
    return errorType + " ERROR: " + super.getMessage() + "\n\n" +
        context.generateContextMessage(includeErrorId);
  }
}
