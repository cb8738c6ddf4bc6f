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
package net.hydromatic.hol.term;

import static com.google.common.base.Preconditions.checkArgument;
import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableList;
import java.util.List;

/**
 * Higher-order logic terms.
 *
 * <p>Terms are immutable and may be shared by any number of parents. Two
 * terms are equal if they have the same structure; {@link Term#compareTo}
 * is a total order consistent with {@link Term#equals}, comparing first by
 * {@link Op} and then by contents.
 *
 * <p>Create terms using {@link HolBuilder#hol}.
 */
public class Hol {
  private Hol() {}

  /** The proposition that is always true. */
  public static final Literal TRUE = new Literal(Op.TRUE);

  /** The proposition that is always false. */
  public static final Literal FALSE = new Literal(Op.FALSE);

  /** Base class of all terms. */
  public abstract static class Term implements Comparable<Term> {
    public final Op op;

    /**
     * Number of nodes on the longest path from this term to a leaf; 1 for an
     * atom.
     */
    public final int depth;

    private final int hash;

    Term(Op op, int depth, int hash) {
      this.op = requireNonNull(op, "op");
      this.depth = depth;
      this.hash = hash;
    }

    @Override
    public final int hashCode() {
      return hash;
    }

    @Override
    public final boolean equals(Object obj) {
      return obj == this
          || obj instanceof Term
              && ((Term) obj).op == op
              && obj.hashCode() == hash
              && compareTo((Term) obj) == 0;
    }

    /** Compares this term to another; returns -1, 0 or 1. */
    @Override
    public final int compareTo(Term o) {
      if (this == o) {
        return 0;
      }
      if (op != o.op) {
        return Integer.compare(op.ordinal(), o.op.ordinal());
      }
      return compareContents(o);
    }

    /**
     * Compares with a term of the same {@link Op}; returns -1, 0 or 1.
     */
    abstract int compareContents(Term o);

    /** Accepts a shuttle, returning the transformed term. */
    public abstract Term accept(Shuttle shuttle);

    /** Accepts a visitor. */
    public abstract void accept(Visitor visitor);

    /** Writes this term to a buffer. */
    abstract void unparse(StringBuilder buf);

    /**
     * Writes an operand of an infix operator, adding parentheses if the
     * operand would otherwise be ambiguous.
     */
    static void unparseOperand(StringBuilder buf, Term term) {
      if (term.op == Op.EQUALS || term.op.isBinder()) {
        buf.append('(');
        term.unparse(buf);
        buf.append(')');
      } else {
        term.unparse(buf);
      }
    }

    @Override
    public String toString() {
      final StringBuilder buf = new StringBuilder();
      unparse(buf);
      return buf.toString();
    }
  }

  /** Compares two lists of terms by length, then element by element. */
  static int compareLists(List<Term> list0, List<Term> list1) {
    int c = Integer.compare(list0.size(), list1.size());
    for (int i = 0; c == 0 && i < list0.size(); i++) {
      c = list0.get(i).compareTo(list1.get(i));
    }
    return c;
  }

  /** Appends a number using subscript digits. */
  static StringBuilder subscript(StringBuilder buf, int i) {
    for (char c : Integer.toString(i).toCharArray()) {
      buf.append((char) ('₀' + (c - '0')));
    }
    return buf;
  }

  /**
   * Term that is a variable, constant or parameter, identified by a
   * non-negative number.
   */
  public abstract static class Symbol extends Term {
    public final int id;

    Symbol(Op op, int id) {
      super(op, 1, op.ordinal() * 100_003 + id);
      checkArgument(id >= 0, "negative id %s", id);
      this.id = id;
    }

    @Override
    int compareContents(Term o) {
      return Integer.compare(id, ((Symbol) o).id);
    }

    /** Returns the letter that precedes the id when printing. */
    abstract char prefix();

    @Override
    void unparse(StringBuilder buf) {
      subscript(buf.append(prefix()), id);
    }
  }

  /** Variable, such as {@code x₁}. */
  public static final class Variable extends Symbol {
    Variable(int id) {
      super(Op.VARIABLE, id);
    }

    @Override
    char prefix() {
      return 'x';
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Constant, such as {@code c₁}. */
  public static final class Constant extends Symbol {
    Constant(int id) {
      super(Op.CONSTANT, id);
    }

    @Override
    char prefix() {
      return 'c';
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /**
   * Parameter, such as {@code a₁}; a symbol introduced by witnessing a
   * quantifier.
   */
  public static final class Parameter extends Symbol {
    Parameter(int id) {
      super(Op.PARAMETER, id);
    }

    @Override
    char prefix() {
      return 'a';
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Integer literal. */
  public static final class IntLiteral extends Term {
    public final int value;

    IntLiteral(int value) {
      super(Op.INTEGER, 1, Op.INTEGER.ordinal() * 100_003 + value);
      this.value = value;
    }

    @Override
    int compareContents(Term o) {
      return Integer.compare(value, ((IntLiteral) o).value);
    }

    @Override
    void unparse(StringBuilder buf) {
      buf.append(value);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Boolean literal; there are only two, {@link #TRUE} and {@link #FALSE}. */
  public static final class Literal extends Term {
    private Literal(Op op) {
      super(op, 1, op.ordinal());
    }

    @Override
    int compareContents(Term o) {
      return 0;
    }

    @Override
    void unparse(StringBuilder buf) {
      buf.append(op.padded);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }
  }

  /** Negation. */
  public static final class Not extends Term {
    public final Term operand;

    Not(Term operand) {
      super(Op.NOT, operand.depth + 1, 31 * Op.NOT.ordinal() + operand.hash);
      this.operand = operand;
    }

    @Override
    int compareContents(Term o) {
      return operand.compareTo(((Not) o).operand);
    }

    @Override
    void unparse(StringBuilder buf) {
      buf.append(op.padded);
      if (operand.op == Op.EQUALS) {
        unparseOperand(buf, operand);
      } else {
        operand.unparse(buf);
      }
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Not} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Term copy(Term operand) {
      return operand == this.operand ? this : HolBuilder.hol.not(operand);
    }
  }

  /** Term with two operands, {@link IfThen} or {@link Equals}. */
  public abstract static class Binary extends Term {
    public final Term left;
    public final Term right;

    Binary(Op op, Term left, Term right) {
      super(
          op,
          Math.max(left.depth, right.depth) + 1,
          (31 * op.ordinal() + left.hash) * 31 + right.hash);
      this.left = left;
      this.right = right;
    }

    @Override
    int compareContents(Term o) {
      final Binary binary = (Binary) o;
      int c = left.compareTo(binary.left);
      if (c != 0) {
        return c;
      }
      return right.compareTo(binary.right);
    }

    /**
     * Creates a copy of this term with given contents, or {@code this} if
     * the contents are the same.
     */
    public abstract Term copy(Term left, Term right);
  }

  /** Conditional, {@code left → right}. */
  public static final class IfThen extends Binary {
    IfThen(Term left, Term right) {
      super(Op.IF_THEN, left, right);
    }

    @Override
    void unparse(StringBuilder buf) {
      buf.append('(');
      unparseOperand(buf, left);
      buf.append(op.padded);
      unparseOperand(buf, right);
      buf.append(')');
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Term copy(Term left, Term right) {
      return left == this.left && right == this.right
          ? this
          : HolBuilder.hol.ifThen(left, right);
    }
  }

  /**
   * Equality, {@code left = right}. Whether it is a biconditional or a
   * comparison of individuals depends on the inferred types of its operands.
   */
  public static final class Equals extends Binary {
    Equals(Term left, Term right) {
      super(Op.EQUALS, left, right);
    }

    @Override
    void unparse(StringBuilder buf) {
      unparseOperand(buf, left);
      buf.append(op.padded);
      if (right.op == Op.EQUALS) {
        // equality chains associate to the right
        right.unparse(buf);
      } else {
        unparseOperand(buf, right);
      }
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    @Override
    public Term copy(Term left, Term right) {
      return left == this.left && right == this.right
          ? this
          : HolBuilder.hol.equal(left, right);
    }
  }

  /** Application of a function to one argument, {@code fn(arg)}. */
  public static final class UnaryApply extends Term {
    public final Term fn;
    public final Term arg;

    UnaryApply(Term fn, Term arg) {
      super(
          Op.UNARY_APPLY,
          Math.max(fn.depth, arg.depth) + 1,
          (31 * Op.UNARY_APPLY.ordinal() + fn.hash) * 31 + arg.hash);
      this.fn = fn;
      this.arg = arg;
    }

    @Override
    int compareContents(Term o) {
      final UnaryApply apply = (UnaryApply) o;
      int c = fn.compareTo(apply.fn);
      if (c != 0) {
        return c;
      }
      return arg.compareTo(apply.arg);
    }

    @Override
    void unparse(StringBuilder buf) {
      fn.unparse(buf);
      buf.append('(');
      arg.unparse(buf);
      buf.append(')');
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code UnaryApply} with given contents, or
     * {@code this} if the contents are the same.
     */
    public Term copy(Term fn, Term arg) {
      return fn == this.fn && arg == this.arg
          ? this
          : HolBuilder.hol.apply(fn, arg);
    }
  }

  /** Application of a function to two arguments, {@code fn(arg0, arg1)}. */
  public static final class BinaryApply extends Term {
    public final Term fn;
    public final Term arg0;
    public final Term arg1;

    BinaryApply(Term fn, Term arg0, Term arg1) {
      super(
          Op.BINARY_APPLY,
          Math.max(fn.depth, Math.max(arg0.depth, arg1.depth)) + 1,
          ((31 * Op.BINARY_APPLY.ordinal() + fn.hash) * 31 + arg0.hash) * 31
              + arg1.hash);
      this.fn = fn;
      this.arg0 = arg0;
      this.arg1 = arg1;
    }

    @Override
    int compareContents(Term o) {
      final BinaryApply apply = (BinaryApply) o;
      int c = fn.compareTo(apply.fn);
      if (c != 0) {
        return c;
      }
      c = arg0.compareTo(apply.arg0);
      if (c != 0) {
        return c;
      }
      return arg1.compareTo(apply.arg1);
    }

    @Override
    void unparse(StringBuilder buf) {
      fn.unparse(buf);
      buf.append('(');
      arg0.unparse(buf);
      buf.append(", ");
      arg1.unparse(buf);
      buf.append(')');
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code BinaryApply} with given contents, or
     * {@code this} if the contents are the same.
     */
    public Term copy(Term fn, Term arg0, Term arg1) {
      return fn == this.fn && arg0 == this.arg0 && arg1 == this.arg1
          ? this
          : HolBuilder.hol.apply(fn, arg0, arg1);
    }
  }

  /**
   * Conjunction, disjunction or biconditional of one or more operands.
   *
   * <p>The order of operands does not affect the meaning, but it does affect
   * equality; canonical terms have their operands sorted.
   */
  public static final class Nary extends Term {
    public final ImmutableList<Term> args;

    Nary(Op op, ImmutableList<Term> args) {
      super(op, maxDepth(args) + 1, 31 * op.ordinal() + args.hashCode());
      checkArgument(op.isCommutative(), "not commutative: %s", op);
      checkArgument(!args.isEmpty(), "%s requires at least one operand", op);
      this.args = args;
    }

    private static int maxDepth(List<Term> args) {
      int depth = 0;
      for (Term arg : args) {
        depth = Math.max(depth, arg.depth);
      }
      return depth;
    }

    @Override
    int compareContents(Term o) {
      return compareLists(args, ((Nary) o).args);
    }

    @Override
    void unparse(StringBuilder buf) {
      buf.append('(');
      for (int i = 0; i < args.size(); i++) {
        if (i > 0) {
          buf.append(op.padded);
        }
        unparseOperand(buf, args.get(i));
      }
      buf.append(')');
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Nary} with given contents, or {@code this}
     * if the contents are the same.
     */
    public Term copy(List<Term> args) {
      if (args.size() == this.args.size()) {
        boolean same = true;
        for (int i = 0; i < args.size(); i++) {
          if (args.get(i) != this.args.get(i)) {
            same = false;
            break;
          }
        }
        if (same) {
          return this;
        }
      }
      return HolBuilder.hol.nary(op, args);
    }
  }

  /**
   * Term that binds a variable: universal or existential quantification, or
   * lambda abstraction.
   */
  public static final class Quantifier extends Term {
    public final Variable variable;
    public final Term operand;

    Quantifier(Op op, Variable variable, Term operand) {
      super(
          op,
          operand.depth + 1,
          (31 * op.ordinal() + variable.id) * 31 + operand.hash);
      checkArgument(op.isBinder(), "not a binder: %s", op);
      this.variable = variable;
      this.operand = operand;
    }

    @Override
    int compareContents(Term o) {
      final Quantifier quantifier = (Quantifier) o;
      int c = Integer.compare(variable.id, quantifier.variable.id);
      if (c != 0) {
        return c;
      }
      return operand.compareTo(quantifier.operand);
    }

    @Override
    void unparse(StringBuilder buf) {
      buf.append(op.padded);
      variable.unparse(buf);
      buf.append('.');
      operand.unparse(buf);
    }

    @Override
    public Term accept(Shuttle shuttle) {
      return shuttle.visit(this);
    }

    @Override
    public void accept(Visitor visitor) {
      visitor.visit(this);
    }

    /**
     * Creates a copy of this {@code Quantifier} with given contents, or
     * {@code this} if the contents are the same.
     */
    public Term copy(Variable variable, Term operand) {
      return variable == this.variable && operand == this.operand
          ? this
          : HolBuilder.hol.quantifier(op, variable, operand);
    }
  }
}

// End Hol.java
