/*
 * Copyright 2025 The Formlang Authors
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package org.formlang.algorithms;

import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableSet;
import java.util.ArrayDeque;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.Set;
import org.formlang.expr.Expr;

/**
 * A static-only class for read-only traversals of an expression graph. Each traversal visits each
 * distinct node (by identity) once, no matter how many parents it has.
 */
public class Traversal {

  private Traversal() {}

  /** Returns the nodes reachable from {@code root}, each parent before its operands. */
  public static ImmutableList<Expr> preOrder(Expr root) {
    ImmutableList.Builder<Expr> result = ImmutableList.builder();
    Set<Expr> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    Deque<Expr> stack = new ArrayDeque<>();
    stack.push(root);
    while (!stack.isEmpty()) {
      Expr expr = stack.pop();
      if (!seen.add(expr)) {
        continue;
      }
      result.add(expr);
      ImmutableList<Expr> operands = expr.operands();
      // Push in reverse so that operands are visited left to right.
      for (int i = operands.size() - 1; i >= 0; i--) {
        stack.push(operands.get(i));
      }
    }
    return result.build();
  }

  /** Returns the nodes reachable from {@code root}, each node after all of its operands. */
  public static ImmutableList<Expr> postOrder(Expr root) {
    ImmutableList.Builder<Expr> result = ImmutableList.builder();
    Set<Expr> seen = Collections.newSetFromMap(new IdentityHashMap<>());
    // Each stack entry is a node and the index of the next operand to visit.
    Deque<Expr> nodes = new ArrayDeque<>();
    Deque<Integer> next = new ArrayDeque<>();
    seen.add(root);
    nodes.push(root);
    next.push(0);
    while (!nodes.isEmpty()) {
      Expr expr = nodes.peek();
      int i = next.pop();
      ImmutableList<Expr> operands = expr.operands();
      if (i == operands.size()) {
        nodes.pop();
        result.add(expr);
        continue;
      }
      next.push(i + 1);
      Expr operand = operands.get(i);
      if (seen.add(operand)) {
        nodes.push(operand);
        next.push(0);
      }
    }
    return result.build();
  }

  /** Returns true if any node reachable from {@code root} is exactly of class {@code type}. */
  public static boolean hasExactType(Expr root, Class<? extends Expr> type) {
    return preOrder(root).stream().anyMatch(e -> e.getClass() == type);
  }

  /** Returns the distinct nodes reachable from {@code root} that are instances of {@code type}. */
  public static <T extends Expr> ImmutableSet<T> extractType(Expr root, Class<T> type) {
    return preOrder(root).stream()
        .filter(type::isInstance)
        .map(type::cast)
        .collect(ImmutableSet.toImmutableSet());
  }
}
