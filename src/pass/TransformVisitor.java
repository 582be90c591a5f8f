package pass;

import ast.ASTBuilder;
import ast.ASTNode;
import ast.ASTUnit;
import ast.ASTVisitor;
import ast.Provenance;
import ast.decl.Decl;
import ast.decl.FieldDecl;
import ast.decl.FunctionDecl;
import ast.decl.RecordDecl;
import ast.decl.VarDecl;
import ast.expr.BinaryOperator;
import ast.expr.CallExpr;
import ast.expr.DeclRefExpr;
import ast.expr.IntegerLiteral;
import ast.expr.UnaryOperator;
import ast.stmt.BreakStmt;
import ast.stmt.CompoundStmt;
import ast.stmt.ContinueStmt;
import ast.stmt.DeclStmt;
import ast.stmt.IfStmt;
import ast.stmt.NullStmt;
import ast.stmt.ReturnStmt;
import ast.stmt.Stmt;
import ast.stmt.WhileStmt;
import util.LoggingManager;
import util.logging.Logger;

import java.util.ArrayList;
import java.util.List;

/**
 * Base of the tree rewriting passes.
 *
 * The walk is depth first and post order, so a node is visited after all of
 * its children. A visit may register a replacement in {@link #substitutions}
 * but must not edit the tree; the replacements are applied together when the
 * walk ends. Visits return false to cut the walk short. Node kinds a pass does
 * not override are walked through unchanged.
 */
public abstract class TransformVisitor implements Pass.ASTPass, ASTVisitor<Boolean> {
    protected final Logger log = LoggingManager.getLogger(this.getClass());

    protected final PassContext context;
    protected final ASTUnit unit;
    protected final ASTBuilder ast;
    protected final Provenance provenance;
    protected final Substitutions substitutions;

    protected TransformVisitor(PassContext context) {
        this.context = context;
        this.unit = context.getUnit();
        this.ast = context.getBuilder();
        this.provenance = context.getProvenance();
        this.substitutions = new Substitutions(ast);
    }

    @Override
    public boolean run() {
        if (stopped()) {
            return false;
        }
        substitutions.clear();
        runImpl();
        for (Decl decl : List.copyOf(unit.getDecls())) {
            if (!traverse(decl)) {
                break;
            }
        }
        int registered = substitutions.size();
        boolean changed = substitutions.apply(unit);
        if (changed) {
            log.debug("{}: applied {} substitution(s)", getType().getName(), registered);
        }
        return changed;
    }

    /** Hook invoked before each walk. */
    protected void runImpl() {
    }

    protected boolean traverse(ASTNode node) {
        for (ASTNode child : node.getChildren()) {
            if (child != null && !traverse(child)) {
                return false;
            }
        }
        return node.accept(this) && !stopped();
    }

    /**
     * The node as it will look once this run's substitutions are applied:
     * its registered replacement, null if it is being removed, or the node
     * itself.
     */
    protected ASTNode current(ASTNode node) {
        return substitutions.contains(node) ? substitutions.get(node) : node;
    }

    /**
     * Members of {@code compound} as they will be once this run's
     * substitutions are applied, removed members left out.
     */
    protected List<Stmt> currentBody(CompoundStmt compound) {
        ASTNode resolved = current(compound);
        if (!(resolved instanceof CompoundStmt block)) {
            return List.of();
        }
        List<Stmt> body = new ArrayList<>(block.size());
        for (Stmt stmt : block.getBody()) {
            ASTNode member = current(stmt);
            if (member != null) {
                body.add((Stmt) member);
            }
        }
        return body;
    }

    @Override
    public void stop() {
        context.getStopSignal().request();
    }

    @Override
    public boolean stopped() {
        return context.getStopSignal().isRequested();
    }

    /* ── default: no rewrite, keep walking ──────────── */

    @Override
    public Boolean visit(CompoundStmt stmt) {
        return true;
    }

    @Override
    public Boolean visit(IfStmt stmt) {
        return true;
    }

    @Override
    public Boolean visit(WhileStmt stmt) {
        return true;
    }

    @Override
    public Boolean visit(BreakStmt stmt) {
        return true;
    }

    @Override
    public Boolean visit(ContinueStmt stmt) {
        return true;
    }

    @Override
    public Boolean visit(ReturnStmt stmt) {
        return true;
    }

    @Override
    public Boolean visit(NullStmt stmt) {
        return true;
    }

    @Override
    public Boolean visit(DeclStmt stmt) {
        return true;
    }

    @Override
    public Boolean visit(IntegerLiteral expr) {
        return true;
    }

    @Override
    public Boolean visit(DeclRefExpr expr) {
        return true;
    }

    @Override
    public Boolean visit(BinaryOperator expr) {
        return true;
    }

    @Override
    public Boolean visit(UnaryOperator expr) {
        return true;
    }

    @Override
    public Boolean visit(CallExpr expr) {
        return true;
    }

    @Override
    public Boolean visit(VarDecl decl) {
        return true;
    }

    @Override
    public Boolean visit(FieldDecl decl) {
        return true;
    }

    @Override
    public Boolean visit(RecordDecl decl) {
        return true;
    }

    @Override
    public Boolean visit(FunctionDecl decl) {
        return true;
    }
}
