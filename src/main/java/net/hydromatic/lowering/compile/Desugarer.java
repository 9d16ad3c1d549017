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
package net.hydromatic.lowering.compile;

import static java.util.Objects.requireNonNull;
import static net.hydromatic.lowering.ast.CoreBuilder.core;
import static net.hydromatic.lowering.util.Static.concat;

import com.google.common.collect.ImmutableList;
import java.util.List;
import net.hydromatic.lowering.ast.Ast;
import net.hydromatic.lowering.ast.Attribute;
import net.hydromatic.lowering.ast.Core;
import net.hydromatic.lowering.ast.DesugaringKind;
import net.hydromatic.lowering.ast.Pos;
import net.hydromatic.lowering.util.Pair;
import org.checkerframework.checker.nullness.qual.Nullable;

/**
 * Rewrites sugared surface expressions into core expressions that use only
 * loops, matches, blocks and calls to the standard library.
 *
 * <p>For example, {@code for x in xs { f(x) }} becomes
 *
 * <blockquote><pre>
 * {
 *   let _result = match IntoIterator::into_iter(xs) {
 *     mut iter =&gt; loop {
 *       let mut __next;
 *       match Iterator::next(&amp;mut iter) {
 *         Some(val) =&gt; __next = val,
 *         None =&gt; break
 *       }
 *       let x = __next;
 *       { f(x) }
 *     }
 *   };
 *   _result
 * }</pre></blockquote>
 *
 * <p>The variables that a rewrite introduces have generated names, so they
 * cannot capture variables of the same name in user code.
 */
class Desugarer {
  private static final List<String> INTO_ITER =
      ImmutableList.of("iter", "IntoIterator", "into_iter");
  private static final List<String> NEXT =
      ImmutableList.of("iter", "Iterator", "next");
  private static final List<String> SOME =
      ImmutableList.of("option", "Option", "Some");
  private static final List<String> NONE =
      ImmutableList.of("option", "Option", "None");
  private static final List<String> INTO_RESULT =
      ImmutableList.of("ops", "Try", "into_result");
  private static final List<String> FROM_ERROR =
      ImmutableList.of("ops", "Try", "from_error");
  private static final List<String> FROM =
      ImmutableList.of("convert", "From", "from");
  private static final List<String> OK =
      ImmutableList.of("result", "Result", "Ok");
  private static final List<String> ERR =
      ImmutableList.of("result", "Result", "Err");
  private static final List<String> MAKE_PLACE =
      ImmutableList.of("ops", "Placer", "make_place");
  private static final List<String> PLACE_POINTER =
      ImmutableList.of("ops", "Place", "pointer");
  private static final List<String> MOVE_VAL_INIT =
      ImmutableList.of("intrinsics", "move_val_init");
  private static final List<String> FINALIZE =
      ImmutableList.of("ops", "InPlace", "finalize");

  private final Lowerer lowerer;
  private final IdAllocator ids;
  private final ScopeContext scopes;
  private final TreeBuilder builder;
  private final NameGenerator nameGenerator;

  Desugarer(Lowerer lowerer, IdAllocator ids, ScopeContext scopes,
      TreeBuilder builder, NameGenerator nameGenerator) {
    this.lowerer = requireNonNull(lowerer);
    this.ids = requireNonNull(ids);
    this.scopes = requireNonNull(scopes);
    this.builder = requireNonNull(builder);
    this.nameGenerator = requireNonNull(nameGenerator);
  }

  /** Lowers a sugared expression. */
  Core.Exp desugar(Ast.Exp e) {
    switch (e.op) {
      case IF_LET:
        return desugarIfLet((Ast.IfLet) e);
      case WHILE_LET:
        return desugarWhileLet((Ast.WhileLet) e);
      case FOR_LOOP:
        return desugarForLoop((Ast.ForLoop) e);
      case TRY:
        return desugarTry((Ast.Try) e);
      case CATCH:
        final Ast.Catch aCatch = (Ast.Catch) e;
        final Core.BlockExp blockExp =
            scopes.withCatchScope(aCatch.block.id, () ->
                core.blockExp(lowerer.lowerBlock(aCatch.block, true)));
        return lowerer.toExp(e, blockExp);
      case RANGE:
        return desugarRange((Ast.Range) e);
      case IN_PLACE:
        return desugarInPlace((Ast.InPlace) e);
      case PAREN:
        return desugarParen((Ast.Paren) e);
      default:
        throw new AssertionError("not a sugared expression: " + e.op);
    }
  }

  /** Converts {@code if let PAT = SUBJECT { THEN } else { ELSE }} to
   * {@code match SUBJECT { PAT => THEN, _ => ELSE }}. */
  private Core.Exp desugarIfLet(Ast.IfLet e) {
    final Core.Exp thenExp =
        builder.blockExp(lowerer.lowerBlock(e.ifTrue, false));
    final Core.Pat pat = lowerer.lowerPat(e.pat);
    final Core.Arm thenArm = builder.arm(pat, thenExp);

    final Core.Pat wildPat = builder.wildPat(e.pos);
    final Core.Exp elseExp = e.ifFalse != null
        ? lowerer.lowerExp(e.ifFalse)
        : builder.unitExp(e.pos);
    final Core.Arm elseArm = builder.arm(wildPat, elseExp);

    final Core.Exp subject = lowerer.lowerExp(e.subject);
    return lowerer.toExp(e,
        core.match(subject, ImmutableList.of(thenArm, elseArm),
            Core.MatchSource.ifLet(e.ifFalse != null)));
  }

  /** Converts {@code while let PAT = SUBJECT { BODY }} to
   * {@code loop { match SUBJECT { PAT => BODY, _ => break } }}. */
  private Core.Exp desugarWhileLet(Ast.WhileLet e) {
    // The body, the break and the subject are all in the loop's scope, so
    // that the subject may break out of the loop
    final Core.Block[] body = {null};
    final Core.Exp[] subject = {null};
    final Core.Exp breakExp =
        scopes.withLoopScope(e.id, () -> {
          body[0] = lowerer.lowerBlock(e.body, false);
          final Core.Exp exp = breakExp(e.pos);
          subject[0] =
              scopes.withLoopCondition(() -> lowerer.lowerExp(e.subject));
          return exp;
        });

    final Core.Exp bodyExp = builder.blockExp(requireNonNull(body[0]));
    final Core.Pat pat = lowerer.lowerPat(e.pat);
    final Core.Arm patArm = builder.arm(pat, bodyExp);

    final Core.Arm breakArm = builder.arm(builder.wildPat(e.pos), breakExp);

    final Core.Exp match =
        builder.matchExp(e.pos, requireNonNull(subject[0]),
            ImmutableList.of(patArm, breakArm),
            Core.MatchSource.WHILE_LET_DESUGAR);
    return lowerer.toExp(e,
        core.loop(builder.block(match), e.label, Core.LoopSource.WHILE_LET));
  }

  /** Converts a {@code for} loop to a {@code loop} that calls
   * {@code Iterator::next} until it returns {@code None}. */
  private Core.Exp desugarForLoop(Ast.ForLoop e) {
    final Core.Exp head = lowerer.lowerExp(e.head);
    final String iter = nameGenerator.get("iter");
    final String next = nameGenerator.get("__next");
    final Core.Pat nextPat =
        builder.bindingPat(e.pos, next, Core.BindingAnnotation.MUTABLE);

    // "Some(val) => __next = val"
    final String val = nameGenerator.get("val");
    final Core.Pat valPat =
        builder.bindingPat(e.pos, val, Core.BindingAnnotation.UNANNOTATED);
    final Core.Exp valExp = builder.identExp(e.pos, val, valPat.id.nodeId);
    final Core.Exp nextExp = builder.identExp(e.pos, next, nextPat.id.nodeId);
    final Core.Exp assign = builder.exp(e.pos, core.assign(nextExp, valExp));
    final Core.Pat somePat =
        builder.stdEnumPat(e.pos, SOME, ImmutableList.of(valPat));
    final Core.Arm someArm = builder.arm(somePat, assign);

    // "None => break"
    final Core.Exp breakExp =
        scopes.withLoopScope(e.id, () -> breakExp(e.pos));
    final Core.Pat nonePat =
        builder.stdEnumPat(e.pos, NONE, ImmutableList.of());
    final Core.Arm noneArm = builder.arm(nonePat, breakExp);

    // "mut iter"
    final Core.Pat iterPat =
        builder.bindingPat(e.pos, iter, Core.BindingAnnotation.MUTABLE);

    // "match Iterator::next(&mut iter) { ... }"
    final Core.Exp iterExp = builder.identExp(e.pos, iter, iterPat.id.nodeId);
    final Core.Exp nextCall =
        builder.stdCall(e.pos, e.pos, NEXT, builder.addrOfMut(e.pos, iterExp));
    final Core.Exp match =
        builder.matchExp(e.pos, nextCall, ImmutableList.of(someArm, noneArm),
            Core.MatchSource.FOR_LOOP_DESUGAR);
    final Core.Stmt matchStmt = builder.exprStmt(match, e.pos);

    // "let mut __next;" and "let PAT = __next;"
    final Core.Exp nextValue =
        builder.identExp(e.pos, next, nextPat.id.nodeId);
    final Core.Stmt nextLet =
        builder.letStmt(e.pos, nextPat, null,
            Core.LocalSource.FOR_LOOP_DESUGAR);
    final Core.Pat pat = lowerer.lowerPat(e.pat);
    final Core.Stmt patLet =
        builder.letStmt(e.pos, pat, nextValue,
            Core.LocalSource.FOR_LOOP_DESUGAR);

    final Core.Block bodyBlock =
        scopes.withLoopScope(e.id, () -> lowerer.lowerBlock(e.body, false));
    final Core.Stmt bodyStmt =
        builder.exprStmt(builder.blockExp(bodyBlock), e.pos);

    // The loop has the id of the "for" expression, so that "break" and
    // "continue" in the body can find it
    final Core.Block loopBlock =
        builder.block(e.pos,
            ImmutableList.of(nextLet, matchStmt, patLet, bodyStmt), null);
    final Core.Exp loop =
        core.exp(ids.lower(e.id),
            core.loop(loopBlock, e.label, Core.LoopSource.FOR_LOOP), e.pos,
            ImmutableList.of());

    // "match IntoIterator::into_iter(HEAD) { mut iter => loop { ... } }"
    final Core.Arm iterArm = builder.arm(iterPat, loop);
    final Core.Exp intoIter = builder.stdCall(e.pos, e.pos, INTO_ITER, head);
    final Core.Exp outerMatch =
        builder.matchExp(e.pos, intoIter, ImmutableList.of(iterArm),
            Core.MatchSource.FOR_LOOP_DESUGAR);

    // "{ let _result = match ...; _result }"; the underscore prevents an
    // "unused variable" warning if the head diverges
    final String result = nameGenerator.get("_result");
    final Pair<Core.Stmt, Integer> let =
        builder.letStmt(e.pos, false, result, outerMatch);
    final Core.Exp resultExp = builder.identExp(e.pos, result, let.right);
    final Core.Block block =
        builder.block(e.pos, ImmutableList.of(let.left), resultExp);
    return builder.blockExp(block, e.attrs);
  }

  /** Converts {@code EXP?} to a match on {@code Try::into_result(EXP)}. An
   * error returns from the function, or breaks out of the innermost
   * {@code catch} block. */
  private Core.Exp desugarTry(Ast.Try e) {
    final Pos questionPos = e.pos.desugared(DesugaringKind.QUESTION_MARK);

    // "Try::into_result(EXP)"
    final Core.Exp sub = lowerer.lowerExp(e.exp);
    final Core.Exp discriminant =
        builder.stdCall(e.pos, questionPos, INTO_RESULT, sub);

    final Attribute attr =
        Attribute.of(e.pos, "allow", ImmutableList.of("unreachable_code"));
    final List<Attribute> attrs = ImmutableList.of(attr);

    // "Ok(val) => val"
    final String val = nameGenerator.get("val");
    final Core.Pat valPat =
        builder.bindingPat(e.pos, val, Core.BindingAnnotation.UNANNOTATED);
    final Core.Exp valExp =
        builder.identExp(e.pos, val, valPat.id.nodeId, attrs);
    final Core.Pat okPat =
        builder.stdEnumPat(e.pos, OK, ImmutableList.of(valPat));
    final Core.Arm okArm = builder.arm(okPat, valExp);

    // "Err(err) => return Try::from_error(From::from(err))"
    final String err = nameGenerator.get("err");
    final Core.Pat errPat =
        builder.bindingPat(e.pos, err, Core.BindingAnnotation.UNANNOTATED);
    final Core.Exp fromFn = builder.stdPathExp(e.pos, FROM);
    final Core.Exp errExp = builder.identExp(e.pos, err, errPat.id.nodeId);
    final Core.Exp from =
        builder.exp(e.pos, core.call(fromFn, ImmutableList.of(errExp)));
    final Core.Exp fromError =
        builder.stdCall(e.pos, questionPos, FROM_ERROR, from);
    final @Nullable Integer catchId = scopes.innermostCatch();
    final Core.Exp exit;
    if (catchId != null) {
      exit =
          builder.exp(e.pos,
              core.break_(
                  core.destination(null, Core.ScopeTarget.block(catchId)),
                  fromError),
              attrs);
    } else {
      exit = builder.exp(e.pos, core.ret(fromError), attrs);
    }
    final Core.Pat errEnumPat =
        builder.stdEnumPat(e.pos, ERR, ImmutableList.of(errPat));
    final Core.Arm errArm = builder.arm(errEnumPat, exit);

    return lowerer.toExp(e,
        core.match(discriminant, ImmutableList.of(errArm, okArm),
            Core.MatchSource.TRY_DESUGAR));
  }

  /** Converts a range such as {@code a..b} to a struct literal such as
   * {@code ops::Range { start: a, end: b }}, or {@code ..} to
   * {@code ops::RangeFull}. */
  private Core.Exp desugarRange(Ast.Range e) {
    final String structName = rangeStructName(e);
    final ImmutableList.Builder<Core.Field> fields = ImmutableList.builder();
    if (e.start != null) {
      fields.add(rangeField("start", e.start));
    }
    if (e.end != null) {
      fields.add(rangeField("end", e.end));
    }
    final boolean isUnit = e.start == null && e.end == null;
    final Pos pos = e.pos.desugared(DesugaringKind.DOT_FILL);
    final Core.Path path =
        builder.stdPath(pos, ImmutableList.of("ops", structName), isUnit);
    final Core.QPath qpath = core.resolvedQPath(null, path);
    final Core.ExpKind kind = isUnit
        ? core.pathExp(qpath)
        : core.structExp(qpath, fields.build(), null);
    return core.exp(ids.lower(e.id), kind, pos, e.attrs);
  }

  private static String rangeStructName(Ast.Range e) {
    switch (e.limits) {
      case HALF_OPEN:
        if (e.start == null) {
          return e.end == null ? "RangeFull" : "RangeTo";
        }
        return e.end == null ? "RangeFrom" : "Range";
      case CLOSED:
        if (e.end == null) {
          throw new CompileException("inclusive range with no end", false,
              e.pos);
        }
        return e.start == null ? "RangeToInclusive" : "RangeInclusive";
      default:
        throw new AssertionError(e.limits);
    }
  }

  private Core.Field rangeField(String name, Ast.Exp exp) {
    final Core.Exp value = lowerer.lowerExp(exp);
    final Pos pos = exp.pos.desugared(DesugaringKind.DOT_FILL);
    return core.field(name, pos, value, pos, false);
  }

  /** Converts {@code PLACE <- VALUE} to calls to the placement protocol:
   *
   * <blockquote><pre>
   * let placer = PLACE;
   * let mut place = Placer::make_place(placer);
   * let p_ptr = Place::pointer(&amp;mut place);
   * push_unsafe {
   *   intrinsics::move_val_init(p_ptr, pop_unsafe { VALUE });
   *   InPlace::finalize(place)
   * }</pre></blockquote>
   */
  private Core.Exp desugarInPlace(Ast.InPlace e) {
    final Core.Exp placerExp = lowerer.lowerExp(e.place);
    final Core.Exp valueExp = lowerer.lowerExp(e.value);
    final String placer = nameGenerator.get("placer");
    final String place = nameGenerator.get("place");
    final String pointer = nameGenerator.get("p_ptr");
    final Pos pathPos = e.pos.desugared(DesugaringKind.BACK_ARROW);

    final Pair<Core.Stmt, Integer> s1 =
        builder.letStmt(e.pos, false, placer, placerExp);

    final Core.Exp makePlace =
        builder.stdCall(e.pos, pathPos, MAKE_PLACE,
            builder.identExp(e.pos, placer, s1.right));
    final Pair<Core.Stmt, Integer> s2 =
        builder.letStmt(e.pos, true, place, makePlace);

    final Core.Exp placeExp = builder.identExp(e.pos, place, s2.right);
    final Core.Exp pointerCall =
        builder.stdCall(e.pos, pathPos, PLACE_POINTER,
            builder.addrOfMut(e.pos, placeExp));
    final Pair<Core.Stmt, Integer> s3 =
        builder.letStmt(e.pos, false, pointer, pointerCall);

    final Core.Exp popUnsafe =
        builder.signalBlockExp(e.pos, ImmutableList.of(), valueExp,
            Ast.BlockCheckMode.POP_UNSAFE);
    final Core.Exp pointerExp = builder.identExp(e.pos, pointer, s3.right);
    final Core.Stmt moveValInit =
        builder.semiStmt(
            builder.stdCall(e.pos, pathPos, MOVE_VAL_INIT, pointerExp,
                popUnsafe),
            e.pos);
    final Core.Exp finalize =
        builder.stdCall(e.pos, pathPos, FINALIZE,
            builder.identExp(e.pos, place, s2.right));
    final Core.Exp pushUnsafe =
        builder.signalBlockExp(e.pos, ImmutableList.of(moveValInit), finalize,
            Ast.BlockCheckMode.PUSH_UNSAFE);

    final Core.Block block =
        builder.block(e.pos, ImmutableList.of(s1.left, s2.left, s3.left),
            pushUnsafe);
    return lowerer.toExp(e, core.blockExp(block));
  }

  /** Removes parentheses. The result keeps the inner expression's id, and
   * has the attributes of both. */
  private Core.Exp desugarParen(Ast.Paren e) {
    final Core.Exp inner = lowerer.lowerExp(e.exp);
    final Pos pos = e.pos.contains(inner.pos) ? e.pos : inner.pos;
    return core.exp(inner, pos, concat(e.attrs, inner.attrs));
  }

  /** Creates an unlabeled {@code break} out of the innermost loop. */
  private Core.Exp breakExp(Pos pos) {
    final Core.Destination destination =
        lowerer.loopDestination(null, Ast.DUMMY_NODE_ID);
    return builder.exp(pos, core.break_(destination, null));
  }
}

// End Desugarer.java
