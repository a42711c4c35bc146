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
package net.hydromatic.jscore.compile;

import java.util.function.Consumer;
import net.hydromatic.jscore.ast.Core;
import org.mozilla.javascript.ast.AstNode;

/** Utilities for {@link Tracer}. */
public abstract class Tracers {

  /** Returns a tracer that does nothing. */
  public static Tracer empty() {
    return EmptyTracer.INSTANCE;
  }

  /** Returns a tracer that performs the given action on an expression,
   * then calls the underlying tracer. */
  public static Tracer withOnCore(Tracer tracer, int pass,
      Consumer<Core.Exp> consumer) {
    final int expectedPass = pass;
    return new DelegatingTracer(tracer) {
      @Override public void onCore(int pass, Core.Exp e) {
        if (pass == expectedPass) {
          consumer.accept(e);
        }
        super.onCore(pass, e);
      }
    };
  }

  /** Returns a tracer that performs the given action on generated
   * JavaScript, then calls the underlying tracer. */
  public static Tracer withOnProgram(Tracer tracer,
      Consumer<AstNode> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public void onProgram(AstNode node) {
        consumer.accept(node);
        super.onProgram(node);
      }
    };
  }

  public static Tracer withOnCompileException(Tracer tracer,
      Consumer<CompileException> consumer) {
    return new DelegatingTracer(tracer) {
      @Override public boolean handleCompileException(CompileException e) {
        consumer.accept(e);
        super.handleCompileException(e);
        return true;
      }
    };
  }

  /** Tracer that does nothing. */
  private static class EmptyTracer implements Tracer {
    static final Tracer INSTANCE = new EmptyTracer();

    @Override public void onCore(int pass, Core.Exp e) {
    }

    @Override public void onProgram(AstNode node) {
    }

    @Override public boolean handleCompileException(CompileException e) {
      return false;
    }
  }

  /** Tracer that delegates to an underlying tracer. */
  private static class DelegatingTracer implements Tracer {
    final Tracer tracer;

    DelegatingTracer(Tracer tracer) {
      this.tracer = tracer;
    }

    @Override public void onCore(int pass, Core.Exp e) {
      tracer.onCore(pass, e);
    }

    @Override public void onProgram(AstNode node) {
      tracer.onProgram(node);
    }

    @Override public boolean handleCompileException(CompileException e) {
      return tracer.handleCompileException(e);
    }
  }
}

// End Tracers.java
