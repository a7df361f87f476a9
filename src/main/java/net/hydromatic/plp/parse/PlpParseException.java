/*
 * Licensed to Julian Hyde under one or more contributor license
 * agreements.  See the NOTICE file distributed with this work
 * for additional information regarding copyright ownership.
 * Julian Hyde licenses this file to you under the Apache
 * License, Version 2.0 (the "License"); you may not use this
 * file except in compliance with the License.  You may obtain a
 * copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing,
 * software distributed under the License is distributed on an
 * "AS IS" BASIS, WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND,
 * either express or implied.  See the License for the specific
 * language governing permissions and limitations under the
 * License.
 */
package net.hydromatic.plp.parse;

import static java.util.Objects.requireNonNull;

import net.hydromatic.plp.ast.Pos;
import net.hydromatic.plp.util.PlpException;

/**
 * Error while parsing a probabilistic logic program.
 *
 * <p>Wraps the {@link ParseException} or {@link TokenMgrError} thrown by the
 * generated parser; the message is the parser's message, unchanged.
 */
public class PlpParseException extends RuntimeException
    implements PlpException {
  private final Pos pos;

  PlpParseException(Throwable cause, Pos pos) {
    super(cause.getMessage(), cause);
    this.pos = requireNonNull(pos);
  }

  /** Wraps a syntax error, taking the position of the offending token. */
  static PlpParseException of(ParseException e, String file) {
    if (e.currentToken == null) {
      return new PlpParseException(e, Pos.start(file));
    }
    final Token token =
        e.currentToken.next != null ? e.currentToken.next : e.currentToken;
    return new PlpParseException(
        e,
        new Pos(
            file,
            token.beginLine,
            token.beginColumn,
            token.endLine,
            token.endColumn + 1));
  }

  /** Wraps a lexical error. The token manager does not report a token. */
  static PlpParseException of(TokenMgrError e, String file) {
    return new PlpParseException(e, Pos.start(file));
  }

  @Override
  public Pos pos() {
    return pos;
  }

  @Override
  public StringBuilder describeTo(StringBuilder buf) {
    return pos.describeTo(buf).append(" Error: ").append(getMessage());
  }
}

// End PlpParseException.java
