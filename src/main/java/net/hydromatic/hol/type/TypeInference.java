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
package net.hydromatic.hol.type;

import static java.util.Objects.requireNonNull;

import com.google.common.collect.ImmutableMap;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;
import net.hydromatic.hol.term.Hol;
import net.hydromatic.hol.term.Hol.Term;
import net.hydromatic.hol.util.DepthLimitException;
import net.hydromatic.hol.util.Prop;

/**
 * Infers the type of every subterm of a term.
 *
 * <p>Inference is bidirectional. Each subterm is visited with the type that
 * its context expects, which is unified with the type that the subterm
 * computes. Symbols (variables, constants, parameters) have one type per id,
 * except that a bound variable has its own type while its binder is in
 * scope.
 *
 * <p>An equality is boolean (a biconditional) if both of its operands turn
 * out to be boolean. If {@link Prop#POLYMORPHIC_EQUALITY} is false, the two
 * operands must have the same type.
 */
public class TypeInference {
  private final TypeTable table = new TypeTable();
  private final TypeUnifier unifier = new TypeUnifier(table);
  private final boolean polymorphicEquality;

  private final Map<Integer, HolType> constantTypes = new HashMap<>();
  private final Map<Integer, HolType> variableTypes = new HashMap<>();
  private final Map<Integer, HolType> parameterTypes = new HashMap<>();
  private final Map<Term, HolType> termTypes = new IdentityHashMap<>();
  private final List<EqualsTypes> equalities = new ArrayList<>();

  private TypeInference(boolean polymorphicEquality) {
    this.polymorphicEquality = polymorphicEquality;
  }

  /** Computes types for a term, using default properties. */
  public static TypeAssignment computeTypes(Term term) {
    return computeTypes(term, ImmutableMap.of());
  }

  /**
   * Computes types for a term.
   *
   * @param term Term
   * @param props Properties; {@link Prop#POLYMORPHIC_EQUALITY} and
   *     {@link Prop#MAX_DEPTH} are used
   * @return Types of the term and its subterms
   * @throws TypeException if the term cannot be consistently typed
   * @throws DepthLimitException if the term is too deeply nested
   */
  public static TypeAssignment computeTypes(Term term,
      Map<Prop, Object> props) {
    requireNonNull(term, "term");
    DepthLimitException.check(term.depth, Prop.MAX_DEPTH.intValue(props));
    final TypeInference inference =
        new TypeInference(Prop.POLYMORPHIC_EQUALITY.booleanValue(props));
    inference.compute(term, SpecialType.ANY);
    return inference.assignment();
  }

  /** Flattens every recorded type and builds the result. */
  private TypeAssignment assignment() {
    final Map<Term, HolType> flatTermTypes = new IdentityHashMap<>();
    termTypes.forEach((term, type) ->
        flatTermTypes.put(term, table.flatten(type)));
    final Map<Hol.Equals, TypeAssignment.OperandTypes> flatEqualsTypes =
        new IdentityHashMap<>();
    for (EqualsTypes e : equalities) {
      final TypeAssignment.OperandTypes operandTypes =
          new TypeAssignment.OperandTypes(table.flatten(e.left),
              table.flatten(e.right));
      final TypeAssignment.OperandTypes previous =
          flatEqualsTypes.get(e.equals);
      if (previous == null
          || !previous.isBoolean() && operandTypes.isBoolean()) {
        flatEqualsTypes.put(e.equals, operandTypes);
      }
    }
    return new TypeAssignment(flatTermTypes, flatEqualsTypes,
        flatten(constantTypes), flatten(variableTypes),
        flatten(parameterTypes));
  }

  private Map<Integer, HolType> flatten(Map<Integer, HolType> map) {
    final Map<Integer, HolType> flatMap = new HashMap<>();
    map.forEach((id, type) -> flatMap.put(id, table.flatten(type)));
    return flatMap;
  }

  /** Computes the type of a term, given the type expected by its context,
   * and records it. */
  private HolType compute(Term term, HolType expected) {
    final HolType type = deduce(term, expected);
    termTypes.putIfAbsent(term, type);
    return type;
  }

  private HolType deduce(Term term, HolType expected) {
    switch (term.op) {
    case VARIABLE:
      return symbol(variableTypes, (Hol.Symbol) term, expected);
    case CONSTANT:
      return symbol(constantTypes, (Hol.Symbol) term, expected);
    case PARAMETER:
      return symbol(parameterTypes, (Hol.Symbol) term, expected);

    case INTEGER:
      return expect(PrimitiveType.INDIVIDUAL, expected, term);

    case TRUE:
    case FALSE:
      return expect(PrimitiveType.BOOLEAN, expected, term);

    case NOT:
      expect(PrimitiveType.BOOLEAN, expected, term);
      compute(((Hol.Not) term).operand, PrimitiveType.BOOLEAN);
      return PrimitiveType.BOOLEAN;

    case IF_THEN:
      expect(PrimitiveType.BOOLEAN, expected, term);
      final Hol.IfThen ifThen = (Hol.IfThen) term;
      compute(ifThen.left, PrimitiveType.BOOLEAN);
      compute(ifThen.right, PrimitiveType.BOOLEAN);
      return PrimitiveType.BOOLEAN;

    case AND:
    case OR:
    case IFF:
      expect(PrimitiveType.BOOLEAN, expected, term);
      for (Term arg : ((Hol.Nary) term).args) {
        compute(arg, PrimitiveType.BOOLEAN);
      }
      return PrimitiveType.BOOLEAN;

    case EQUALS:
      expect(PrimitiveType.BOOLEAN, expected, term);
      final Hol.Equals equals = (Hol.Equals) term;
      final TypeVar left = table.newVariable();
      compute(equals.left, left);
      final TypeVar right = polymorphicEquality ? table.newVariable() : left;
      compute(equals.right, right);
      equalities.add(new EqualsTypes(equals, left, right));
      return PrimitiveType.BOOLEAN;

    case FOR_ALL:
    case EXISTS:
      expect(PrimitiveType.BOOLEAN, expected, term);
      final Hol.Quantifier quantifier = (Hol.Quantifier) term;
      bind(quantifier, table.newVariable(), PrimitiveType.BOOLEAN);
      return PrimitiveType.BOOLEAN;

    case LAMBDA:
      final Hol.Quantifier lambda = (Hol.Quantifier) term;
      final FnType fnType = functionParts(expected, lambda);
      bind(lambda, fnType.left, fnType.right);
      return fnType;

    case UNARY_APPLY:
      final Hol.UnaryApply apply = (Hol.UnaryApply) term;
      final HolType fnType1 =
          compute(apply.fn, new FnType(table.newVariable(), expected));
      final FnType f = asFunction(fnType1, apply.fn);
      compute(apply.arg, f.left);
      return f.right;

    case BINARY_APPLY:
      final Hol.BinaryApply apply2 = (Hol.BinaryApply) term;
      final HolType fnType2 =
          compute(apply2.fn,
              new FnType(table.newVariable(),
                  new FnType(table.newVariable(), expected)));
      final FnType f0 = asFunction(fnType2, apply2.fn);
      final FnType f1 = asFunction(f0.right, apply2.fn);
      compute(apply2.arg0, f0.left);
      compute(apply2.arg1, f1.left);
      return f1.right;

    default:
      throw new AssertionError("unknown op " + term.op);
    }
  }

  /** Computes the type of a symbol; it must agree with the type of earlier
   * occurrences of the same symbol. */
  private HolType symbol(Map<Integer, HolType> map, Hol.Symbol symbol,
      HolType expected) {
    final HolType earlier =
        map.computeIfAbsent(symbol.id, id -> table.newVariable());
    // Unification may bind variables before it fails
    final HolType earlierExpanded = table.expand(earlier);
    final HolType expectedExpanded = table.expand(expected);
    final HolType type = unifier.unify(earlier, expected);
    if (type.kind() == HolType.Kind.NONE) {
      throw new TypeException("Symbol " + symbol
          + " has conflicting types; type computed from earlier instances of"
          + " symbol: " + earlierExpanded
          + "; expected type: " + expectedExpanded,
          earlierExpanded, expectedExpanded);
    }
    return type;
  }

  /** Checks that a computed type agrees with the expected type. */
  private HolType expect(HolType actual, HolType expected, Term term) {
    final HolType expectedExpanded = table.expand(expected);
    final HolType type = unifier.unify(expected, actual);
    if (type.kind() == HolType.Kind.NONE) {
      throw new TypeException("Term " + term
          + " is not well-typed; computed type: " + actual
          + "; expected type: " + expectedExpanded,
          actual, expectedExpanded);
    }
    return type;
  }

  /** Evaluates the body of a binder with the bound variable having a given
   * type, then restores any outer binding of the same variable. */
  private void bind(Hol.Quantifier quantifier, HolType variableType,
      HolType bodyType) {
    final int id = quantifier.variable.id;
    final HolType previous = variableTypes.put(id, variableType);
    termTypes.putIfAbsent(quantifier.variable, variableType);
    compute(quantifier.operand, bodyType);
    if (previous == null) {
      variableTypes.remove(id);
    } else {
      variableTypes.put(id, previous);
    }
  }

  /** Returns the argument and result types of a lambda whose context expects
   * a given type. */
  private FnType functionParts(HolType expected, Hol.Quantifier lambda) {
    HolType type = expected;
    if (type.kind() == HolType.Kind.VARIABLE) {
      final TypeVar root = table.root((TypeVar) type);
      type = table.get(root);
      if (type.kind() == HolType.Kind.ANY) {
        final FnType fnType =
            new FnType(table.newVariable(), table.newVariable());
        table.set(root, fnType);
        return fnType;
      }
    }
    switch (type.kind()) {
    case ANY:
      return new FnType(table.newVariable(), table.newVariable());
    case FUNCTION:
      return (FnType) type;
    default:
      throw new TypeException("Lambda expression " + lambda
          + " has a non-function expected type " + table.expand(expected),
          null, table.expand(expected));
    }
  }

  /** Returns the function type that a type resolves to. */
  private FnType asFunction(HolType type, Term fn) {
    HolType t = type;
    if (t.kind() == HolType.Kind.VARIABLE) {
      t = table.get(table.root((TypeVar) t));
    }
    if (t.kind() != HolType.Kind.FUNCTION) {
      throw new TypeException("Term " + fn + " is applied but has type "
          + table.expand(type), table.expand(type), null);
    }
    return (FnType) t;
  }

  /** Types of the operands of an equality, as type variables. */
  private static class EqualsTypes {
    final Hol.Equals equals;
    final HolType left;
    final HolType right;

    EqualsTypes(Hol.Equals equals, HolType left, HolType right) {
      this.equals = equals;
      this.left = left;
      this.right = right;
    }
  }
}

// End TypeInference.java
