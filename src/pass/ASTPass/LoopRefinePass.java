package pass.ASTPass;

import ast.expr.Expr;
import ast.expr.IntegerLiteral;
import ast.stmt.BreakStmt;
import ast.stmt.CompoundStmt;
import ast.stmt.IfStmt;
import ast.stmt.Stmt;
import ast.stmt.WhileStmt;
import pass.ASTPassType;
import pass.PassContext;
import pass.TransformVisitor;
import solver.ConditionSolver;

/**
 * Turns unbounded loops that open with an exit test into guarded loops:
 *
 * <pre>
 *   while (1U) {                while (!cond) {
 *     if (cond) { break; }  ==>   body;
 *     body;                     }
 *   }
 * </pre>
 *
 * Only a test in first position is recovered.
 */
public class LoopRefinePass extends TransformVisitor {
    private ConditionSolver solver;

    public LoopRefinePass(PassContext context) {
        super(context);
    }

    @Override
    public ASTPassType getType() {
        return ASTPassType.LoopRefine;
    }

    @Override
    protected void runImpl() {
        log.info("Running pass: LoopRefine");
        if (solver == null) {
            solver = new ConditionSolver(context.getSolverTimeoutMs());
        }
        solver.reset();
    }

    @Override
    public Boolean visit(WhileStmt loop) {
        if (!(loop.getBody() instanceof CompoundStmt body) || body.isEmpty()) {
            return true;
        }
        if (!(body.get(0) instanceof IfStmt exit) || exit.hasElse() || !isBreak(exit.getThen())) {
            return true;
        }
        if (!isAlwaysTrue(loop.getCond()) || stopped()) {
            return true;
        }

        Expr guard = ast.negateCondition(exit.getCond());
        CompoundStmt rest = ast.createCompoundStmt(body.getBody().subList(1, body.size()));
        substitutions.put(loop, ast.createWhile(guard, rest));

        log.debug("recovered loop condition {} for loop from {}", guard.toC(), provenance.describe(loop));
        return true;
    }

    private static boolean isBreak(Stmt stmt) {
        if (stmt instanceof BreakStmt) {
            return true;
        }
        return stmt instanceof CompoundStmt block && block.size() == 1 && block.get(0) instanceof BreakStmt;
    }

    private boolean isAlwaysTrue(Expr cond) {
        if (cond.hasSideEffects()) {
            return false;
        }
        if (cond instanceof IntegerLiteral literal) {
            return literal.getValue() != 0;
        }
        return solver.proveValid(solver.condition(cond));
    }

    @Override
    public void close() {
        if (solver != null) {
            solver.close();
            solver = null;
        }
    }
}
