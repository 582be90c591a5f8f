package ast;

import ast.decl.Decl;
import ast.decl.FunctionDecl;
import ast.decl.RecordDecl;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Translation unit under structuring. Owns every node created for it: nodes
 * are appended to the arena and never freed individually.
 */
public class ASTUnit {
    private final String name;

    // top level declarations in source order
    private final List<Decl> decls = new ArrayList<>();

    // every node created through an ASTBuilder for this unit
    private final List<ASTNode> arena = new ArrayList<>();

    private final Map<String, Identifier> identifiers = new HashMap<>();

    public ASTUnit(String name) {
        this.name = name;
    }

    public String getName() {
        return name;
    }

    <N extends ASTNode> N register(N node) {
        arena.add(node);
        return node;
    }

    public int getNumNodes() {
        return arena.size();
    }

    public Identifier getIdentifier(String spelling) {
        return identifiers.computeIfAbsent(spelling, Identifier::new);
    }

    public void addDecl(Decl decl) {
        decls.add(decl);
    }

    public List<Decl> getDecls() {
        return Collections.unmodifiableList(decls);
    }

    /**
     * Relink a top level declaration. Only substitution application calls this.
     */
    public void setDecl(int index, Decl decl) {
        decls.set(index, decl);
    }

    public List<FunctionDecl> getFunctions() {
        List<FunctionDecl> functions = new ArrayList<>();
        for (Decl decl : decls) {
            if (decl instanceof FunctionDecl function) {
                functions.add(function);
            }
        }
        return functions;
    }

    public List<RecordDecl> getRecords() {
        List<RecordDecl> records = new ArrayList<>();
        for (Decl decl : decls) {
            if (decl instanceof RecordDecl record) {
                records.add(record);
            }
        }
        return records;
    }

    public FunctionDecl getFunction(String functionName) {
        for (FunctionDecl function : getFunctions()) {
            if (function.getName().equals(functionName)) {
                return function;
            }
        }
        return null;
    }

    public RecordDecl getRecord(String recordName) {
        for (RecordDecl record : getRecords()) {
            if (record.getName().equals(recordName)) {
                return record;
            }
        }
        return null;
    }

    public String toC() {
        StringBuilder sb = new StringBuilder();
        for (Decl decl : decls) {
            decl.print(sb, 0);
            sb.append("\n\n");
        }
        return sb.toString();
    }
}
