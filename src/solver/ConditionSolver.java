package solver;

import ast.expr.Expr;
import com.microsoft.z3.BoolExpr;
import com.microsoft.z3.Context;
import com.microsoft.z3.Params;
import com.microsoft.z3.Solver;
import com.microsoft.z3.Status;
import com.microsoft.z3.Z3Exception;
import util.LoggingManager;
import util.logging.Logger;

import java.util.List;

/**
 * Boolean reasoning over tree conditions. Wraps one Z3 context that lives as
 * long as the owning pass.
 *
 * Every proof is conservative: an unknown answer, a timeout or a solver
 * failure all count as "not proved".
 */
public class ConditionSolver implements AutoCloseable {
    private static final Logger log = LoggingManager.getLogger(ConditionSolver.class);

    private final Context ctx;
    private final Z3ConvVisitor conv;
    private final Solver solver;

    private int queries = 0;
    private int undecided = 0;

    public ConditionSolver(int timeoutMs) {
        this.ctx = new Context();
        this.conv = new Z3ConvVisitor(ctx);
        this.solver = ctx.mkSolver();
        if (timeoutMs > 0) {
            Params params = ctx.mkParams();
            params.add("timeout", timeoutMs);
            solver.setParameters(params);
        }
    }

    /**
     * Forget the opaque constants of earlier walks. Call and assignment nodes
     * translated after this get fresh constants; variables keep theirs.
     */
    public void reset() {
        conv.clearOpaque();
    }

    /** Formula for the truth of {@code cond}, without simplification. */
    public BoolExpr translate(Expr cond) {
        return conv.toBool(cond);
    }

    public BoolExpr simplify(BoolExpr formula) {
        return (BoolExpr) formula.simplify();
    }

    /** Simplified formula for the truth of {@code cond}. */
    public BoolExpr condition(Expr cond) {
        return simplify(translate(cond));
    }

    public BoolExpr mkOr(List<BoolExpr> formulas) {
        if (formulas.isEmpty()) {
            return ctx.mkFalse();
        }
        return ctx.mkOr(formulas.toArray(new BoolExpr[0]));
    }

    public BoolExpr mkAnd(BoolExpr lhs, BoolExpr rhs) {
        return ctx.mkAnd(lhs, rhs);
    }

    public BoolExpr mkNot(BoolExpr formula) {
        return ctx.mkNot(formula);
    }

    /** @return true only if {@code formula} holds under every assignment */
    public boolean proveValid(BoolExpr formula) {
        return check(ctx.mkNot(formula)) == Status.UNSATISFIABLE;
    }

    /** @return true only if no assignment satisfies {@code formula} */
    public boolean proveUnsat(BoolExpr formula) {
        return check(formula) == Status.UNSATISFIABLE;
    }

    private Status check(BoolExpr formula) {
        queries++;
        solver.push();
        try {
            solver.add(formula);
            Status status = solver.check();
            if (status == Status.UNKNOWN) {
                undecided++;
                log.debug("undecided query ({}): {}", solver.getReasonUnknown(), formula);
            }
            return status;
        } catch (Z3Exception e) {
            undecided++;
            log.warn("solver failed on " + formula, e);
            return Status.UNKNOWN;
        } finally {
            solver.pop();
        }
    }

    public int getQueryCount() {
        return queries;
    }

    public int getUndecidedCount() {
        return undecided;
    }

    @Override
    public void close() {
        log.debug("closing solver after {} queries, {} undecided", queries, undecided);
        ctx.close();
    }
}
