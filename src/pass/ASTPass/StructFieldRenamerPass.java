package pass.ASTPass;

import ast.decl.FieldDecl;
import ast.decl.RecordDecl;
import debuginfo.DICompositeType;
import debuginfo.DIDerivedType;
import exception.DecompileException;
import pass.ASTPassType;
import pass.PassContext;
import pass.TransformVisitor;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Gives recovered struct fields the names recorded in the debug info. Fields
 * and debug-info members correspond by position.
 *
 * When a debug name is already taken within the same struct, the field is
 * named {@code <debug name>_<synthetic name>} instead. Members without a
 * debug name keep their synthetic name.
 */
public class StructFieldRenamerPass extends TransformVisitor {

    public StructFieldRenamerPass(PassContext context) {
        super(context);
    }

    @Override
    public ASTPassType getType() {
        return ASTPassType.StructFieldRenamer;
    }

    @Override
    protected void runImpl() {
        log.info("Running pass: StructFieldRenamer");
    }

    @Override
    public Boolean visit(RecordDecl decl) {
        DICompositeType type = context.getDebugInfo().get(decl);
        if (type == null) {
            return true;
        }

        List<FieldDecl> fields = decl.getFields();
        List<DIDerivedType> members = type.getElements();
        if (fields.size() != members.size()) {
            throw DecompileException.fieldCountMismatch(decl.getName(), fields.size(), members.size());
        }

        Set<String> seen = new HashSet<>();
        List<FieldDecl> renamed = new ArrayList<>(fields.size());
        boolean changed = false;

        for (int i = 0; i < fields.size(); i++) {
            FieldDecl field = fields.get(i);
            String debugName = members.get(i).getName();
            String name = debugName == null || debugName.isEmpty() ? field.getName() : debugName;

            if (!seen.add(name)) {
                String base = name + "_" + field.getName();
                name = base;
                for (int n = 2; !seen.add(name); n++) {
                    name = base + "_" + n;
                }
                log.warn("field name {} clashes in struct {}, using {}", debugName, decl.getName(), name);
            }

            if (name.equals(field.getName())) {
                renamed.add(field);
            } else {
                renamed.add(ast.createField(name, field.getType()));
                changed = true;
            }
        }

        if (changed) {
            substitutions.put(decl, ast.createRecordDecl(decl.getIdentifier(), renamed));
        }
        return true;
    }
}
