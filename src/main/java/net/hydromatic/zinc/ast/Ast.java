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

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import com.google.common.primitives.ImmutableIntArray;
import java.util.List;
import net.hydromatic.zinc.compile.FunctionDecl;
import net.hydromatic.zinc.eval.FloatSetVal;
import net.hydromatic.zinc.eval.Formatter;
import net.hydromatic.zinc.eval.IntSetVal;
import net.hydromatic.zinc.eval.IntVal;
import net.hydromatic.zinc.type.Type;
import org.checkerframework.checker.nullness.qual.Nullable;

/** Various sub-classes of AST nodes.
 *
 * <p>Nodes form a graph, not a tree: an identifier refers to its
 * declaration, and a declaration refers to its initializer, which may in
 * turn refer to other identifiers. No node owns another; a node lives as
 * long as it is reachable from a declaration or from an evaluation in
 * progress.
 *
 * <p>Nodes are immutable except for the memoized state that evaluation adds:
 * the initializer and flattened binding of a {@link VarDecl}, and the
 * resolved declaration of a {@link Call}. */
public class Ast {
  private Ast() {}

  /** Base class for an expression. Every expression has a type, assigned by
   * the type checker. */
  public abstract static class Exp extends AstNode {
    public final Type type;

    Exp(Pos pos, Op op, Type type) {
      super(pos, op);
      this.type = requireNonNull(type);
    }

    /** Returns whether this expression is a literal value. */
    public boolean isLiteral() {
      return false;
    }
  }

  /** Integer literal. */
  public static class IntLiteral extends Exp {
    public final IntVal value;

    IntLiteral(Pos pos, IntVal value) {
      super(pos, Op.INT_LITERAL, Type.PAR_INT);
      this.value = requireNonNull(value);
    }

    @Override public boolean isLiteral() {
      return true;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return value.signum() < 0 && left > 0
          ? w.append("(").append(value.toString()).append(")")
          : w.append(value.toString());
    }
  }

  /** Floating-point literal. */
  public static class FloatLiteral extends Exp {
    public final double value;

    FloatLiteral(Pos pos, double value) {
      super(pos, Op.FLOAT_LITERAL, Type.PAR_FLOAT);
      this.value = value;
    }

    @Override public boolean isLiteral() {
      return true;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      final String s = Formatter.showFloat(value);
      return value < 0 && left > 0
          ? w.append("(").append(s).append(")")
          : w.append(s);
    }
  }

  /** Boolean literal. */
  public static class BoolLiteral extends Exp {
    public final boolean value;

    BoolLiteral(Pos pos, boolean value) {
      super(pos, Op.BOOL_LITERAL, Type.PAR_BOOL);
      this.value = value;
    }

    @Override public boolean isLiteral() {
      return true;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(value ? "true" : "false");
    }
  }

  /** String literal. */
  public static class StringLiteral extends Exp {
    public final String value;

    StringLiteral(Pos pos, String value) {
      super(pos, Op.STRING_LITERAL, Type.PAR_STRING);
      this.value = requireNonNull(value);
    }

    @Override public boolean isLiteral() {
      return true;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(Formatter.quote(value));
    }
  }

  /** The absent value, {@code <>}, of an optional type. */
  public static class Absent extends Exp {
    Absent(Pos pos) {
      super(pos, Op.ABSENT, Type.PAR_BOTTOM.toOpt());
    }

    @Override public boolean isLiteral() {
      return true;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append("<>");
    }
  }

  /** Set literal.
   *
   * <p>Either a value (an integer set or a float set) that has been
   * evaluated, or a list of element expressions such as {@code {x, y + 1}}.
   * Exactly one of {@link #intSet}, {@link #floatSet} and {@link #elements}
   * is non-null. */
  public static class SetLiteral extends Exp {
    public final @Nullable IntSetVal intSet;
    public final @Nullable FloatSetVal floatSet;
    public final @Nullable ImmutableList<Exp> elements;

    SetLiteral(Pos pos, Type type, @Nullable IntSetVal intSet,
        @Nullable FloatSetVal floatSet, @Nullable ImmutableList<Exp> elements) {
      super(pos, Op.SET_LITERAL, type);
      this.intSet = intSet;
      this.floatSet = floatSet;
      this.elements = elements;
      checkArgument((intSet != null ? 1 : 0)
          + (floatSet != null ? 1 : 0)
          + (elements != null ? 1 : 0) == 1);
    }

    @Override public boolean isLiteral() {
      return elements == null;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (intSet != null) {
        return w.append(intSet.toString());
      }
      if (floatSet != null) {
        return w.append(floatSet.toString());
      }
      return w.append("{").appendAll(requireNonNull(elements), ", ")
          .append("}");
    }
  }

  /** Array literal.
   *
   * <p>Elements are stored in row-major order. Each dimension has a minimum
   * and maximum index; a dimension with {@code min > max} is empty. */
  public static class ArrayLiteral extends Exp {
    public final ImmutableList<Exp> elements;
    /** Minimum and maximum index of each dimension:
     * {@code [min0, max0, min1, max1, ...]}. */
    public final ImmutableIntArray dims;

    ArrayLiteral(Pos pos, Type type, ImmutableList<Exp> elements,
        ImmutableIntArray dims) {
      super(pos, Op.ARRAY_LITERAL, type);
      this.elements = requireNonNull(elements);
      this.dims = requireNonNull(dims);
      checkArgument(dims.length() % 2 == 0 && dims.length() > 0,
          "invalid dimensions %s", dims);
      long size = 1;
      for (int i = 0; i < dimCount(); i++) {
        size *= Math.max(0, max(i) - min(i) + 1);
      }
      checkArgument(size == elements.size(),
          "dimensions %s do not match element count %s", dims,
          elements.size());
    }

    @Override public boolean isLiteral() {
      return elements.stream().allMatch(Exp::isLiteral);
    }

    /** Returns the number of dimensions. */
    public int dimCount() {
      return dims.length() / 2;
    }

    /** Returns the minimum index of the {@code i}th dimension. */
    public int min(int i) {
      return dims.get(i * 2);
    }

    /** Returns the maximum index of the {@code i}th dimension. */
    public int max(int i) {
      return dims.get(i * 2 + 1);
    }

    /** Returns the number of elements. */
    public int size() {
      return elements.size();
    }

    /** Returns the {@code i}th element in row-major order. */
    public Exp get(int i) {
      return elements.get(i);
    }

    /** Returns whether this array has the same index sets as another. */
    public boolean sameDims(ArrayLiteral a) {
      return dims.equals(a.dims);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (dimCount() == 1 && (min(0) == 1 || elements.isEmpty())) {
        return w.append("[").appendAll(elements, ", ").append("]");
      }
      w.append("array").append(Integer.toString(dimCount())).append("d(");
      for (int i = 0; i < dimCount(); i++) {
        w.append(Integer.toString(min(i))).append("..")
            .append(Integer.toString(max(i))).append(", ");
      }
      return w.append("[").appendAll(elements, ", ").append("])");
    }
  }

  /** Reference to a declared variable or parameter. */
  public static class Id extends Exp {
    public final VarDecl decl;

    Id(Pos pos, VarDecl decl) {
      super(pos, Op.ID, decl.type);
      this.decl = requireNonNull(decl);
    }

    public String name() {
      return decl.name;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(decl.name);
    }
  }

  /** Type-inst: a type together with an optional domain and, for an array,
   * the index set of each dimension.
   *
   * <p>For example, in {@code array[1..3] of var 0..9: x}, the type-inst has
   * domain {@code 0..9} and one range whose domain is {@code 1..3}. In
   * {@code array[int] of int: y} the range has no domain, and the index set
   * is said to be generic. */
  public static class TypeInst extends AstNode {
    public final Type type;
    public final @Nullable Exp domain;
    public final ImmutableList<TypeInst> ranges;

    TypeInst(Pos pos, Type type, @Nullable Exp domain,
        ImmutableList<TypeInst> ranges) {
      super(pos, Op.TYPE_INST);
      this.type = requireNonNull(type);
      this.domain = domain;
      this.ranges = requireNonNull(ranges);
    }

    /** Returns whether any dimension's index set is not declared. */
    public boolean hasGenericRange() {
      return ranges.stream().anyMatch(r -> r.domain == null);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      if (!ranges.isEmpty()) {
        w.append("array[");
        for (int i = 0; i < ranges.size(); i++) {
          if (i > 0) {
            w.append(", ");
          }
          ranges.get(i).unparse(w, 0, 0);
        }
        w.append("] of ");
      }
      if (type.isVar()) {
        w.append("var ");
      }
      if (type.opt) {
        w.append("opt ");
      }
      if (type.set) {
        w.append("set of ");
      }
      if (domain != null) {
        return domain.unparse(w, 0, 0);
      }
      return w.append(type.base.description);
    }
  }

  /** Declaration of a variable or parameter.
   *
   * <p>The initializer may be assigned after the declaration is created,
   * which allows declarations to refer to each other. The flattened binding
   * is set when the flattening pass has computed a value for a declaration
   * that has no initializer in the model. */
  public static class VarDecl extends AstNode {
    public final Type type;
    public final String name;
    public final TypeInst ti;
    /** Whether the declaration is annotated as an output parameter. */
    public final boolean output;
    private @Nullable Exp e;
    private @Nullable VarDecl flat;

    VarDecl(Pos pos, TypeInst ti, String name, @Nullable Exp e,
        boolean output) {
      super(pos, Op.VAR_DECL);
      this.ti = requireNonNull(ti);
      this.type = ti.type;
      this.name = requireNonNull(name);
      this.e = e;
      this.output = output;
    }

    /** Returns the initializer, or null. */
    public @Nullable Exp e() {
      return e;
    }

    public void setInitializer(@Nullable Exp e) {
      this.e = e;
    }

    /** Returns the flattened binding, or null. */
    public @Nullable VarDecl flat() {
      return flat;
    }

    public void setFlat(@Nullable VarDecl flat) {
      this.flat = flat;
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      ti.unparse(w, 0, 0);
      w.append(": ").append(name);
      if (e != null) {
        w.append(" = ");
        e.unparse(w, 0, 0);
      }
      return w;
    }
  }

  /** Call to a function. */
  public static class Call extends Exp {
    public final String name;
    public final ImmutableList<Exp> args;
    /** Declaration that overload resolution chose for this call; null until
     * the call has been resolved. */
    public @Nullable FunctionDecl decl;

    Call(Pos pos, Type type, String name, ImmutableList<Exp> args) {
      super(pos, Op.CALL, type);
      this.name = requireNonNull(name);
      this.args = requireNonNull(args);
    }

    /** Returns the {@code i}th argument. */
    public Exp arg(int i) {
      return args.get(i);
    }

    /** Returns the types of the arguments. */
    public List<Type> argTypes() {
      return args.stream().map(a -> a.type)
          .collect(ImmutableList.toImmutableList());
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.append(name).append("(").appendAll(args, ", ").append(")");
    }
  }

  /** Access to an element of an array, {@code a[i, j]}. */
  public static class ArrayAccess extends Exp {
    public final Exp array;
    public final ImmutableList<Exp> indices;

    ArrayAccess(Pos pos, Type type, Exp array, ImmutableList<Exp> indices) {
      super(pos, Op.ARRAY_ACCESS, type);
      this.array = requireNonNull(array);
      this.indices = requireNonNull(indices);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      array.unparse(w, 0, Op.ARRAY_ACCESS.left);
      return w.append("[").appendAll(indices, ", ").append("]");
    }
  }

  /** Call to a binary operator, such as {@code x + y}. */
  public static class BinOp extends Exp {
    public final Exp a0;
    public final Exp a1;

    BinOp(Pos pos, Type type, Op op, Exp a0, Exp a1) {
      super(pos, op, type);
      checkArgument(op.isBinary(), "not a binary operator: %s", op);
      this.a0 = requireNonNull(a0);
      this.a1 = requireNonNull(a1);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.infix(left, a0, op, a1, right);
    }
  }

  /** Call to a unary operator, such as {@code -x} or {@code not b}. */
  public static class UnOp extends Exp {
    public final Exp a;

    UnOp(Pos pos, Type type, Op op, Exp a) {
      super(pos, op, type);
      checkArgument(op == Op.NEGATE || op == Op.POSITIVE || op == Op.NOT,
          "not a unary operator: %s", op);
      this.a = requireNonNull(a);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      return w.prefix(left, op, a, right);
    }
  }

  /** Conditional expression, {@code if c then e1 else e2 endif}. */
  public static class If extends Exp {
    public final Exp condition;
    public final Exp ifTrue;
    public final Exp ifFalse;

    If(Pos pos, Type type, Exp condition, Exp ifTrue, Exp ifFalse) {
      super(pos, Op.ITE, type);
      this.condition = requireNonNull(condition);
      this.ifTrue = requireNonNull(ifTrue);
      this.ifFalse = requireNonNull(ifFalse);
    }

    @Override AstWriter unparse(AstWriter w, int left, int right) {
      w.append("if ");
      condition.unparse(w, 0, 0);
      w.append(" then ");
      ifTrue.unparse(w, 0, 0);
      w.append(" else ");
      ifFalse.unparse(w, 0, 0);
      return w.append(" endif");
    }
  }
}

// End Ast.java
