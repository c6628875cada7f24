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
package net.hydromatic.zinc.ast;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.List;
import net.hydromatic.zinc.eval.FloatSetVal;
import net.hydromatic.zinc.eval.IntSetVal;
import net.hydromatic.zinc.eval.IntVal;
import net.hydromatic.zinc.type.PrimitiveType;
import net.hydromatic.zinc.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Builds parse tree nodes. */
public enum AstBuilder {
  /** The singleton instance of the AST builder.
   * The short name is convenient for use via 'import static',
   * but checkstyle does not approve. */
  // CHECKSTYLE: IGNORE 1
  ast;

  public Ast.IntLiteral intLiteral(Pos pos, long value) {
    return new Ast.IntLiteral(pos, IntVal.of(value));
  }

  public Ast.IntLiteral intLiteral(Pos pos, IntVal value) {
    return new Ast.IntLiteral(pos, value);
  }

  public Ast.FloatLiteral floatLiteral(Pos pos, double value) {
    return new Ast.FloatLiteral(pos, value);
  }

  public Ast.BoolLiteral boolLiteral(Pos pos, boolean value) {
    return new Ast.BoolLiteral(pos, value);
  }

  public Ast.StringLiteral stringLiteral(Pos pos, String value) {
    return new Ast.StringLiteral(pos, value);
  }

  public Ast.Absent absent(Pos pos) {
    return new Ast.Absent(pos);
  }

  /** Creates a literal whose value is a set of integers. */
  public Ast.SetLiteral setLiteral(Pos pos, IntSetVal value) {
    return new Ast.SetLiteral(pos, Type.PAR_SET_INT, value, null, null);
  }

  /** Creates a literal whose value is a set of floats. */
  public Ast.SetLiteral setLiteral(Pos pos, FloatSetVal value) {
    return new Ast.SetLiteral(pos, Type.PAR_SET_FLOAT, null, value, null);
  }

  /** Creates a set literal from a list of element expressions. */
  public Ast.SetLiteral setLiteral(Pos pos, List<? extends Ast.Exp> elements) {
    final Type elementType = lub(elements).elementType();
    return new Ast.SetLiteral(pos, elementType.setOf(), null, null,
        ImmutableList.copyOf(elements));
  }

  /** Creates a one-dimensional array literal with index set
   * {@code 1..n}. */
  public Ast.ArrayLiteral arrayLiteral(Pos pos,
      List<? extends Ast.Exp> elements) {
    return arrayLiteral(pos, lub(elements), elements,
        ImmutableIntArray.of(1, elements.size()));
  }

  /** Creates an array literal with given element type and dimensions. */
  public Ast.ArrayLiteral arrayLiteral(Pos pos, Type elementType,
      List<? extends Ast.Exp> elements, ImmutableIntArray dims) {
    return new Ast.ArrayLiteral(pos,
        Type.array(dims.length() / 2, elementType.elementType()),
        ImmutableList.copyOf(elements), dims);
  }

  /** Creates a two-dimensional array literal, such as
   * {@code [|1, 2|3, 4|]}, from its rows. */
  public Ast.ArrayLiteral arrayLiteral2d(Pos pos,
      List<? extends List<? extends Ast.Exp>> rows) {
    final ImmutableList.Builder<Ast.Exp> b = ImmutableList.builder();
    rows.forEach(b::addAll);
    final ImmutableList<Ast.Exp> elements = b.build();
    final int columns = rows.isEmpty() ? 0 : rows.get(0).size();
    return arrayLiteral(pos, lub(elements), elements,
        ImmutableIntArray.of(1, rows.size(), 1, columns));
  }

  public Ast.Id id(Pos pos, Ast.VarDecl decl) {
    return new Ast.Id(pos, decl);
  }

  /** Creates a scalar type-inst. */
  public Ast.TypeInst typeInst(Pos pos, Type type,
      Ast.@Nullable Exp domain) {
    return new Ast.TypeInst(pos, type, domain, ImmutableList.of());
  }

  /** Creates an array type-inst. Each element of {@code ranges} is the
   * declared index set of a dimension, or null if it is generic. */
  public Ast.TypeInst arrayTypeInst(Pos pos, Type elementType,
      Ast.@Nullable Exp domain, List<Ast.@Nullable Exp> ranges) {
    final ImmutableList.Builder<Ast.TypeInst> b = ImmutableList.builder();
    for (Ast.Exp range : ranges) {
      b.add(typeInst(pos, Type.PAR_INT, range));
    }
    return new Ast.TypeInst(pos, Type.array(ranges.size(), elementType),
        domain, b.build());
  }

  public Ast.VarDecl varDecl(Pos pos, Ast.TypeInst ti, String name,
      Ast.@Nullable Exp e) {
    return new Ast.VarDecl(pos, ti, name, e, false);
  }

  /** Creates a declaration that is annotated as an output parameter. */
  public Ast.VarDecl outputVarDecl(Pos pos, Ast.TypeInst ti, String name,
      Ast.@Nullable Exp e) {
    return new Ast.VarDecl(pos, ti, name, e, true);
  }

  public Ast.Call call(Pos pos, Type type, String name,
      List<? extends Ast.Exp> args) {
    return new Ast.Call(pos, type, name, ImmutableList.copyOf(args));
  }

  public Ast.Call call(Pos pos, Type type, String name, Ast.Exp... args) {
    return new Ast.Call(pos, type, name, ImmutableList.copyOf(args));
  }

  /** Creates an array access; its type is the element type of the array,
   * as a decision variable if any index is a decision variable. */
  public Ast.ArrayAccess arrayAccess(Pos pos, Ast.Exp array,
      List<? extends Ast.Exp> indices) {
    Type type = array.type.elementType();
    for (Ast.Exp index : indices) {
      if (index.type.isVar()) {
        type = type.toVar();
      }
    }
    return new Ast.ArrayAccess(pos, type, array,
        ImmutableList.copyOf(indices));
  }

  public Ast.BinOp binOp(Pos pos, Type type, Op op, Ast.Exp a0, Ast.Exp a1) {
    return new Ast.BinOp(pos, type, op, a0, a1);
  }

  public Ast.UnOp unOp(Pos pos, Type type, Op op, Ast.Exp a) {
    return new Ast.UnOp(pos, type, op, a);
  }

  public Ast.If ifThenElse(Pos pos, Type type, Ast.Exp condition,
      Ast.Exp ifTrue, Ast.Exp ifFalse) {
    return new Ast.If(pos, type, condition, ifTrue, ifFalse);
  }

  /** Returns the least type that all of a list of expressions can be
   * coerced to, as a scalar; bottom if the list is empty. */
  private static Type lub(List<? extends Ast.Exp> elements) {
    Type type = Type.PAR_BOTTOM;
    for (Ast.Exp e : elements) {
      final Type t = e.type;
      if (t.base == PrimitiveType.BOTTOM) {
        // absent, or an empty set; contributes only optionality
        type = t.opt ? type.toOpt() : type;
        continue;
      }
      if (type.base == PrimitiveType.BOTTOM
          || type.base == PrimitiveType.INT
              && t.base == PrimitiveType.FLOAT) {
        Type t2 = type.opt ? t.toOpt() : t;
        type = type.isVar() ? t2.toVar() : t2;
        continue;
      }
      if (t.isVar()) {
        type = type.toVar();
      }
      if (t.opt) {
        type = type.toOpt();
      }
    }
    return type.elementType();
  }
}

// End AstBuilder.java
