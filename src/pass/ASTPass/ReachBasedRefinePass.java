package pass.ASTPass;

import ast.ASTNode;
import ast.decl.VarDecl;
import ast.expr.BinaryOperator;
import ast.expr.CallExpr;
import ast.expr.DeclRefExpr;
import ast.expr.Expr;
import ast.stmt.CompoundStmt;
import ast.stmt.IfStmt;
import ast.stmt.Stmt;
import com.microsoft.z3.BoolExpr;
import pass.ASTPassType;
import pass.PassContext;
import pass.TransformVisitor;
import solver.ConditionSolver;

import java.util.ArrayList;
import java.util.Collections;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;

/**
 * Reachability based refinement: chains runs of sibling if statements into a
 * single if / else if / else statement.
 *
 * <pre>
 *   if (c1) { b1 }              if (c1) { b1 }
 *   if (c2) { b2 }      ==>     else if (c2) { b2 }
 *   if (c3) { b3 }              else { b3 }
 * </pre>
 *
 * A run qualifies when every condition is unsatisfiable together with any of
 * the conditions before it, and the conditions together cover every case.
 * At most one run per block is chained per walk; the fixpoint loop picks up
 * the rest.
 */
public class ReachBasedRefinePass extends TransformVisitor {
    // two exhaustive branches are already as structured as they get
    private static final int MIN_CHAIN = 3;

    private ConditionSolver solver;

    public ReachBasedRefinePass(PassContext context) {
        super(context);
    }

    @Override
    public ASTPassType getType() {
        return ASTPassType.ReachBasedRefine;
    }

    @Override
    protected void runImpl() {
        log.info("Running pass: ReachBasedRefine");
        if (solver == null) {
            solver = new ConditionSolver(context.getSolverTimeoutMs());
        }
        solver.reset();
    }

    /** Candidate chain: the if statements and their simplified conditions. */
    private static final class Chain {
        final List<IfStmt> ifs = new ArrayList<>();
        final List<BoolExpr> conds = new ArrayList<>();

        void reset() {
            ifs.clear();
            conds.clear();
        }

        void add(IfStmt ifStmt, BoolExpr cond) {
            ifs.add(ifStmt);
            conds.add(cond);
        }

        int size() {
            return ifs.size();
        }
    }

    @Override
    public Boolean visit(CompoundStmt compound) {
        List<Stmt> body = currentBody(compound);
        Chain chain = new Chain();

        for (int i = 0; i < body.size(); i++) {
            if (stopped()) {
                return false;
            }
            if (!(body.get(i) instanceof IfStmt ifStmt) || ifStmt.hasElse()) {
                // an if with an else branch cannot be linked
                chain.reset();
                continue;
            }

            if (chain.size() > 0 && !canFollow(chain, ifStmt)) {
                // the if is still fine as the head of a new chain
                chain.reset();
            }

            BoolExpr cond = solver.condition(ifStmt.getCond());

            // can this branch only fire when none of the earlier ones did?
            boolean unreachable = solver.proveUnsat(solver.mkAnd(cond, solver.mkOr(chain.conds)));
            if (!unreachable) {
                // the overlapping if is not a head either, the next sibling starts afresh
                chain.reset();
                continue;
            }
            chain.add(ifStmt, cond);

            if (chain.size() < MIN_CHAIN) {
                continue;
            }

            // do the collected branches cover every possibility?
            if (!solver.proveValid(solver.mkOr(chain.conds))) {
                continue;
            }
            if (stopped()) {
                return false;
            }

            commit(compound, body, i, chain);
            return true;
        }
        return true;
    }

    /**
     * A linked branch is only tested once all earlier ones failed, and after
     * none of their bodies ran. That is the same as testing it in sequence
     * when the condition has no side effects and reads nothing an earlier
     * body may write.
     */
    private boolean canFollow(Chain chain, IfStmt next) {
        Expr cond = next.getCond();
        if (cond.hasSideEffects()) {
            return false;
        }
        Set<VarDecl> reads = Collections.newSetFromMap(new IdentityHashMap<>());
        collectReads(cond, reads);
        if (reads.isEmpty()) {
            return true;
        }
        for (IfStmt earlier : chain.ifs) {
            if (mayWrite(current(earlier.getThen()), reads)) {
                return false;
            }
        }
        return true;
    }

    private static void collectReads(ASTNode node, Set<VarDecl> reads) {
        if (node instanceof DeclRefExpr ref) {
            reads.add(ref.getDecl());
        }
        for (ASTNode child : node.getChildren()) {
            if (child != null) {
                collectReads(child, reads);
            }
        }
    }

    // calls are assumed to write anything
    private static boolean mayWrite(ASTNode node, Set<VarDecl> vars) {
        if (node == null) {
            return false;
        }
        if (node instanceof CallExpr) {
            return true;
        }
        if (node instanceof BinaryOperator binop && binop.isAssignment()
                && binop.getLHS() instanceof DeclRefExpr target
                && vars.contains(target.getDecl())) {
            return true;
        }
        for (ASTNode child : node.getChildren()) {
            if (mayWrite(child, vars)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Link the chain ending at {@code last} into one statement: each if gets
     * the next one as its else branch, and the body of the final if becomes
     * the closing else.
     */
    private void commit(CompoundStmt compound, List<Stmt> body, int last, Chain chain) {
        List<IfStmt> ifs = chain.ifs;
        int first = last - (ifs.size() - 1);

        Stmt linked = ifs.get(ifs.size() - 1).getThen();
        for (int k = ifs.size() - 2; k >= 0; k--) {
            IfStmt branch = ifs.get(k);
            linked = ast.createIf(branch.getCond(), branch.getThen(), linked);
        }

        List<Stmt> newBody = new ArrayList<>(body.size() - ifs.size() + 1);
        newBody.addAll(body.subList(0, first));
        newBody.add(linked);
        newBody.addAll(body.subList(last + 1, body.size()));
        substitutions.put(compound, ast.createCompoundStmt(newBody));

        if (log.isDebugEnabled()) {
            log.debug("chained {} if statements, head from {}", ifs.size(), provenance.describe(ifs.get(0)));
        }
    }

    @Override
    public void close() {
        if (solver != null) {
            solver.close();
            solver = null;
        }
    }
}
