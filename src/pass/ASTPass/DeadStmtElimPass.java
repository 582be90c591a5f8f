package pass.ASTPass;

import ast.ASTNode;
import ast.expr.Expr;
import ast.stmt.BreakStmt;
import ast.stmt.CompoundStmt;
import ast.stmt.ContinueStmt;
import ast.stmt.DeclStmt;
import ast.stmt.IfStmt;
import ast.stmt.NullStmt;
import ast.stmt.ReturnStmt;
import ast.stmt.Stmt;
import pass.ASTPassType;
import pass.PassContext;
import pass.TransformVisitor;

import java.util.ArrayList;
import java.util.List;

/**
 * Removes statements that have no effect:
 * - expression statements without side effects, and empty statements
 * - statements after a break, continue or return in the same block
 * - if statements whose branches are all empty (the condition is kept when
 *   it has side effects), and empty else branches
 * - nested blocks without declarations, whose members move into the parent
 *
 * Surviving statements keep their order.
 */
public class DeadStmtElimPass extends TransformVisitor {

    public DeadStmtElimPass(PassContext context) {
        super(context);
    }

    @Override
    public ASTPassType getType() {
        return ASTPassType.DeadStmtElim;
    }

    @Override
    protected void runImpl() {
        log.info("Running pass: DeadStmtElim");
    }

    @Override
    public Boolean visit(IfStmt ifStmt) {
        boolean emptyThen = isEmpty(current(ifStmt.getThen()));
        boolean emptyElse = ifStmt.hasElse() && isEmpty(current(ifStmt.getElse()));

        if (emptyThen && (!ifStmt.hasElse() || emptyElse)) {
            Expr cond = ifStmt.getCond();
            if (cond.hasSideEffects()) {
                substitutions.put(ifStmt, cond);
            } else {
                substitutions.remove(ifStmt);
            }
            log.debug("removed empty if from {}", provenance.describe(ifStmt));
        } else if (emptyElse) {
            substitutions.put(ifStmt, ast.createIf(ifStmt.getCond(), ifStmt.getThen()));
        }
        return true;
    }

    @Override
    public Boolean visit(CompoundStmt compound) {
        List<Stmt> body = new ArrayList<>(compound.size());
        boolean changed = false;

        for (Stmt stmt : compound.getBody()) {
            ASTNode member = current(stmt);
            if (member != stmt) {
                changed = true;
            }
            if (member == null || isNoOp(member)) {
                changed |= member != null;
                continue;
            }
            if (member instanceof CompoundStmt nested && !declaresVariables(nested)) {
                body.addAll(currentBody(nested));
                changed = true;
            } else {
                body.add((Stmt) member);
            }
            if (!body.isEmpty() && isJump(body.get(body.size() - 1))) {
                // nothing after an unconditional jump can run
                changed |= stmt != compound.get(compound.size() - 1);
                break;
            }
        }

        if (changed) {
            substitutions.put(compound, ast.createCompoundStmt(body));
        }
        return true;
    }

    private static boolean isNoOp(ASTNode stmt) {
        if (stmt instanceof NullStmt) {
            return true;
        }
        return stmt instanceof Expr expr && !expr.hasSideEffects();
    }

    private static boolean isEmpty(ASTNode stmt) {
        if (stmt == null || isNoOp(stmt)) {
            return true;
        }
        if (stmt instanceof CompoundStmt block) {
            for (Stmt member : block.getBody()) {
                if (!isEmpty(member)) {
                    return false;
                }
            }
            return true;
        }
        return false;
    }

    private static boolean isJump(Stmt stmt) {
        return stmt instanceof BreakStmt || stmt instanceof ContinueStmt || stmt instanceof ReturnStmt;
    }

    private static boolean declaresVariables(CompoundStmt block) {
        for (Stmt member : block.getBody()) {
            if (member instanceof DeclStmt) {
                return true;
            }
        }
        return false;
    }
}
