/*
 * Licensed to SK Telecom Co., LTD. (SK Telecom) under one
 * or more contributor license agreements.  See the NOTICE file
 * distributed with this work for additional information
 * regarding copyright ownership.  SK Telecom licenses this file
 * to you under the Apache License, Version 2.0 (the
 * "License"); you may not use this file except in compliance
 * with the License.  You may obtain a copy of the License at
 *
 *   http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY
 * KIND, either express or implied.  See the License for the
 * specific language governing permissions and limitations
 * under the License.
 */

package io.factcube.query;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import io.factcube.common.utils.StringUtils;

/**
 * Base of the errors raised while evaluating a query. Never retried and never partially suppressed: the query
 * call fails as a whole.
 * <p>
 * Fields:
 * - "errorCode" is a well-defined code taken from {@link Code}
 * - "errorMessage" is the message of this exception
 * - "errorClass" is the class of this exception
 */
public class QueryException extends RuntimeException
{
  public static enum Code
  {
    UNKNOWN_COLUMN, UNKNOWN_DIMENSION_VALUE, EMPTY_AGGREGATE, UNKNOWN_AGGREGATE, UNKNOWN
  }

  private final Code errorCode;

  public QueryException(Code errorCode, String formatText, Object... arguments)
  {
    super(StringUtils.safeFormat(formatText, arguments));
    this.errorCode = errorCode;
  }

  public QueryException(Throwable cause)
  {
    super(cause == null ? null : cause.getMessage(), cause);
    this.errorCode = cause instanceof QueryException ? ((QueryException) cause).getErrorCode() : Code.UNKNOWN;
  }

  public static QueryException wrapIfNeeded(Throwable e)
  {
    return e instanceof QueryException ? (QueryException) e : new QueryException(e);
  }

  @JsonProperty
  public Code getErrorCode()
  {
    return errorCode;
  }

  @JsonProperty
  @JsonInclude(JsonInclude.Include.NON_NULL)
  public String getErrorMessage()
  {
    return getMessage();
  }

  @JsonProperty
  public String getErrorClass()
  {
    final Throwable cause = errorCode == Code.UNKNOWN ? getCause() : null;
    return cause == null ? getClass().getName() : cause.getClass().getName();
  }
}
