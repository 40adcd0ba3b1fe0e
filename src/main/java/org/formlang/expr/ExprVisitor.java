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

package org.formlang.expr;

/**
 * An ExprVisitor has one method for each kind of Expr; {@link Expr#accept} calls the appropriate
 * one. Adding a new kind of Expr means adding a method here, and the compiler will then point at
 * every visitor that needs to handle it.
 *
 * <p>The subclasses of {@link Coefficient} (the Constant family) are visited with {@link
 * #visitCoefficient}; use {@link Terminal#isSpatiallyConstant} to distinguish them.
 */
public interface ExprVisitor<T> {
  T visitArgument(Argument argument);

  T visitCoefficient(Coefficient coefficient);

  T visitZero(Zero zero);

  T visitIdentity(Identity identity);

  T visitScalarValue(ScalarValue value);

  T visitMultiIndex(MultiIndex multiIndex);

  T visitLabel(Label label);

  T visitIndexed(Indexed indexed);

  T visitVariable(Variable variable);

  T visitSpatialDerivative(SpatialDerivative derivative);

  T visitVariableDerivative(VariableDerivative derivative);

  T visitGrad(Grad grad);

  T visitDiv(Div div);

  T visitCurl(Curl curl);

  T visitRot(Rot rot);

  T visitCoefficientDerivative(CoefficientDerivative derivative);
}
