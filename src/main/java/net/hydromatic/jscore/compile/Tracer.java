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

import net.hydromatic.jscore.ast.Core;
import org.mozilla.javascript.ast.AstNode;

/** Called on various events during compilation. */
public interface Tracer {
  /** Called with the core expression after each pass.
   *
   * <p>Pass 0 is the expression as it was given to the compiler; pass 1 is
   * the expression after optimization. */
  void onCore(int pass, Core.Exp e);

  /** Called when JavaScript has been generated. */
  void onProgram(AstNode node);

  /**
   * Called with an exception thrown during compilation. Returns whether the
   * exception was handled; if not, the compiler rethrows it.
   */
  boolean handleCompileException(CompileException e);
}

// End Tracer.java
