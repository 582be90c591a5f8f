package ast;

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
import ast.stmt.WhileStmt;

public interface ASTVisitor<T> {
    // statements
    T visit(CompoundStmt stmt);

    T visit(IfStmt stmt);

    T visit(WhileStmt stmt);

    T visit(BreakStmt stmt);

    T visit(ContinueStmt stmt);

    T visit(ReturnStmt stmt);

    T visit(NullStmt stmt);

    T visit(DeclStmt stmt);

    // expressions
    T visit(IntegerLiteral expr);

    T visit(DeclRefExpr expr);

    T visit(BinaryOperator expr);

    T visit(UnaryOperator expr);

    T visit(CallExpr expr);

    // declarations
    T visit(VarDecl decl);

    T visit(FieldDecl decl);

    T visit(RecordDecl decl);

    T visit(FunctionDecl decl);
}
